package de.ialistannen.imageupdater.kubernetes;

import de.ialistannen.imageupdater.model.WorkloadKind;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.util.EnumMap;
import java.util.Map;

/**
 * The explicit mapping from workload kind to the operations handling it.
 */
public final class KubernetesWorkloads {

  private KubernetesWorkloads() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * @param client the kubernetes client
   * @return operations for every supported workload kind
   */
  public static Map<WorkloadKind, WorkloadOperations> operations(KubernetesClient client) {
    Map<WorkloadKind, WorkloadOperations> operations = new EnumMap<>(WorkloadKind.class);

    operations.put(
      WorkloadKind.DEPLOYMENT,
      new FabricWorkloadOperations<>(
        WorkloadKind.DEPLOYMENT,
        client.apps().deployments(),
        (Deployment it) -> it.getSpec() == null ? null : it.getSpec().getTemplate()
      )
    );
    operations.put(
      WorkloadKind.STATEFULSET,
      new FabricWorkloadOperations<>(
        WorkloadKind.STATEFULSET,
        client.apps().statefulSets(),
        (StatefulSet it) -> it.getSpec() == null ? null : it.getSpec().getTemplate()
      )
    );
    operations.put(
      WorkloadKind.DAEMONSET,
      new FabricWorkloadOperations<>(
        WorkloadKind.DAEMONSET,
        client.apps().daemonSets(),
        (DaemonSet it) -> it.getSpec() == null ? null : it.getSpec().getTemplate()
      )
    );

    return operations;
  }
}
