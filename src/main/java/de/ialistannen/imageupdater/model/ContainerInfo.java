package de.ialistannen.imageupdater.model;

import java.util.Optional;

/**
 * A container of a workload's pod template.
 *
 * @param name the container name, unique within its list
 * @param image the raw image string as written in the pod template
 * @param imagePullPolicy the configured pull policy, if any
 * @param isInit whether this is an init container
 */
public record ContainerInfo(
  String name,
  String image,
  Optional<String> imagePullPolicy,
  boolean isInit
) {

  public static final String PULL_POLICY_ALWAYS = "Always";

  public static ContainerInfo container(String name, String image) {
    return new ContainerInfo(name, image, Optional.empty(), false);
  }

  public static ContainerInfo initContainer(String name, String image) {
    return new ContainerInfo(name, image, Optional.empty(), true);
  }

  /**
   * @return true if the pull policy is not already {@value #PULL_POLICY_ALWAYS}
   */
  public boolean needsPullPolicyUpdate() {
    return !imagePullPolicy().map(PULL_POLICY_ALWAYS::equals).orElse(false);
  }
}
