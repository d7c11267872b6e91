package de.ialistannen.imageupdater.kubernetes;

import de.ialistannen.imageupdater.model.ContainerInfo;
import de.ialistannen.imageupdater.model.WorkloadIdentity;
import de.ialistannen.imageupdater.model.WorkloadKind;
import de.ialistannen.imageupdater.model.WorkloadSnapshot;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts live workload objects into {@link WorkloadSnapshot}s.
 */
public final class WorkloadSnapshots {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkloadSnapshots.class);

  private WorkloadSnapshots() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Builds a snapshot from a workload's metadata and pod template. Containers without a name or image are skipped.
   *
   * @param kind the kind of the workload
   * @param metadata the workload's metadata
   * @param template the workload's pod template, may be null
   * @return the snapshot
   */
  public static WorkloadSnapshot fromObject(WorkloadKind kind, ObjectMeta metadata, PodTemplateSpec template) {
    WorkloadIdentity identity = new WorkloadIdentity(
      kind,
      metadata.getNamespace(),
      metadata.getName(),
      Optional.ofNullable(metadata.getResourceVersion())
    );
    Map<String, String> annotations = metadata.getAnnotations() == null ? Map.of() : metadata.getAnnotations();

    PodSpec podSpec = template == null ? null : template.getSpec();
    if (podSpec == null) {
      LOGGER.warn("{}: has no pod template spec", identity);
      return new WorkloadSnapshot(identity, annotations, List.of(), List.of());
    }

    return new WorkloadSnapshot(
      identity,
      annotations,
      toContainerInfos(identity, podSpec.getContainers(), false),
      toContainerInfos(identity, podSpec.getInitContainers(), true)
    );
  }

  private static List<ContainerInfo> toContainerInfos(
    WorkloadIdentity identity,
    List<Container> containers,
    boolean init
  ) {
    if (containers == null) {
      return List.of();
    }
    return containers.stream()
      .filter(container -> {
        if (container.getName() == null || container.getImage() == null) {
          LOGGER.debug("{}: skipping container without name or image", identity);
          return false;
        }
        return true;
      })
      .map(container -> new ContainerInfo(
        container.getName(),
        container.getImage(),
        Optional.ofNullable(container.getImagePullPolicy()),
        init
      ))
      .toList();
  }
}
