package de.ialistannen.imageupdater.storage;

/**
 * The shape a stored {@code last-digest} annotation was found in.
 */
public enum DigestStateFormat {
  /**
   * No annotation, or an empty one.
   */
  ABSENT,
  /**
   * {@code name:digest,name:digest}.
   */
  CANONICAL,
  /**
   * A bare digest from before multiple containers were tracked.
   */
  LEGACY,
  /**
   * Neither of the above. Decoded as an empty map, so every container looks new.
   */
  CORRUPT
}
