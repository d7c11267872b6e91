package de.ialistannen.imageupdater.model;

import de.ialistannen.imageupdater.config.Annotations;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The state of a workload as read at the start of a single reconciliation. Snapshots are built fresh from the live
 * object every cycle and never cached.
 *
 * @param identity the workload
 * @param annotations the workload's metadata annotations
 * @param containers the pod template's containers, in declaration order
 * @param initContainers the pod template's init containers, in declaration order
 */
public record WorkloadSnapshot(
  WorkloadIdentity identity,
  Map<String, String> annotations,
  List<ContainerInfo> containers,
  List<ContainerInfo> initContainers
) {

  public WorkloadSnapshot {
    annotations = Map.copyOf(annotations);
    containers = List.copyOf(containers);
    initContainers = List.copyOf(initContainers);
  }

  public boolean isEnabled() {
    return Annotations.ENABLED_VALUE.equals(annotations.get(Annotations.ENABLED));
  }

  public Optional<String> storedDigests() {
    return Optional.ofNullable(annotations.get(Annotations.LAST_DIGEST));
  }

  public TrackingPolicy trackingPolicy() {
    return TrackingPolicy.fromAnnotations(annotations);
  }
}
