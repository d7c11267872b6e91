package de.ialistannen.imageupdater.kubernetes;

import de.ialistannen.imageupdater.config.Annotations;
import de.ialistannen.imageupdater.model.ContainerInfo;
import de.ialistannen.imageupdater.model.WorkloadKind;
import de.ialistannen.imageupdater.model.WorkloadSnapshot;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WorkloadSnapshotsTest {

  @Test
  void testReadsIdentityAnnotationsAndContainers() {
    Deployment deployment = new DeploymentBuilder()
      .withNewMetadata()
      .withNamespace("shop")
      .withName("frontend")
      .withResourceVersion("17")
      .addToAnnotations(Annotations.ENABLED, "true")
      .endMetadata()
      .withNewSpec()
      .withNewTemplate()
      .withNewSpec()
      .addNewContainer().withName("web").withImage("nginx:1.25").withImagePullPolicy("IfNotPresent").endContainer()
      .addNewContainer().withName("sidecar").withImage("envoy:1").endContainer()
      .addNewInitContainer().withName("migrate").withImage("migrator:3").endInitContainer()
      .endSpec()
      .endTemplate()
      .endSpec()
      .build();

    WorkloadSnapshot snapshot = WorkloadSnapshots.fromObject(
      WorkloadKind.DEPLOYMENT,
      deployment.getMetadata(),
      deployment.getSpec().getTemplate()
    );

    Assertions.assertEquals("shop", snapshot.identity().namespace());
    Assertions.assertEquals("frontend", snapshot.identity().name());
    Assertions.assertEquals(Optional.of("17"), snapshot.identity().resourceVersion());
    Assertions.assertTrue(snapshot.isEnabled());
    Assertions.assertEquals(
      List.of(
        new ContainerInfo("web", "nginx:1.25", Optional.of("IfNotPresent"), false),
        new ContainerInfo("sidecar", "envoy:1", Optional.empty(), false)
      ),
      snapshot.containers()
    );
    Assertions.assertEquals(List.of(ContainerInfo.initContainer("migrate", "migrator:3")), snapshot.initContainers());
  }

  @Test
  void testMissingAnnotationsAndTemplate() {
    WorkloadSnapshot snapshot = WorkloadSnapshots.fromObject(
      WorkloadKind.DAEMONSET,
      new ObjectMetaBuilder().withNamespace("ns").withName("agent").build(),
      null
    );

    Assertions.assertFalse(snapshot.isEnabled());
    Assertions.assertEquals(Optional.empty(), snapshot.storedDigests());
    Assertions.assertEquals(List.of(), snapshot.containers());
  }

  @Test
  void testSkipsContainersWithoutImage() {
    WorkloadSnapshot snapshot = WorkloadSnapshots.fromObject(
      WorkloadKind.STATEFULSET,
      new ObjectMetaBuilder().withNamespace("ns").withName("db").build(),
      new PodTemplateSpecBuilder()
        .withNewSpec()
        .withContainers(
          new ContainerBuilder().withName("db").withImage("postgres:16").build(),
          new ContainerBuilder().withName("broken").build()
        )
        .endSpec()
        .build()
    );

    Assertions.assertEquals(List.of(ContainerInfo.container("db", "postgres:16")), snapshot.containers());
  }
}
