package de.ialistannen.imageupdater.config;

/**
 * Annotation keys read and written on workloads.
 */
public final class Annotations {

  private static final String PREFIX = "image-updater.eznix86.github.io/";

  public static final String ENABLED = PREFIX + "enabled";
  public static final String ENABLED_VALUE = "true";
  public static final String TRACK_CONTAINERS = PREFIX + "track-containers";
  public static final String IGNORE_CONTAINERS = PREFIX + "ignore-containers";
  public static final String TRACK_INIT_CONTAINERS = PREFIX + "track-init-containers";
  public static final String LAST_DIGEST = PREFIX + "last-digest";

  /**
   * Written to the pod template, the same annotation {@code kubectl rollout restart} uses.
   */
  public static final String RESTARTED_AT = "kubectl.kubernetes.io/restartedAt";

  private Annotations() {
    throw new UnsupportedOperationException("No instantiation");
  }
}
