package de.ialistannen.imageupdater.updates;

import de.ialistannen.imageupdater.model.ContainerInfo;
import de.ialistannen.imageupdater.model.TrackingPolicy;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which containers of a workload are watched.
 */
public class ContainerSelector {

  /**
   * Applies a tracking policy. Include and exclude lists only ever filter regular containers, init containers are
   * either all tracked or none are.
   *
   * @param containers the regular containers, in declaration order
   * @param initContainers the init containers, in declaration order
   * @param policy the policy to apply
   * @return the tracked containers, regular containers first
   */
  public List<ContainerInfo> select(
    List<ContainerInfo> containers,
    List<ContainerInfo> initContainers,
    TrackingPolicy policy
  ) {
    List<ContainerInfo> tracked = new ArrayList<>();

    if (!policy.include().isEmpty()) {
      // Names that match no container are ignored
      containers.stream().filter(it -> policy.include().contains(it.name())).forEach(tracked::add);
    } else if (!policy.exclude().isEmpty()) {
      containers.stream().filter(it -> !policy.exclude().contains(it.name())).forEach(tracked::add);
    } else {
      tracked.addAll(containers);
    }

    if (policy.trackInit()) {
      tracked.addAll(initContainers);
    }

    return tracked;
  }
}
