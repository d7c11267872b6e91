package de.ialistannen.imageupdater.updates;

import de.ialistannen.imageupdater.model.ContainerInfo;

/**
 * The result of resolving the digest of a single tracked container.
 */
sealed interface DigestFetchResult {

  ContainerInfo container();

  /**
   * @param container the container
   * @param digest the current digest
   * @param pinned whether the digest was taken from the image reference instead of the registry
   */
  record Resolved(ContainerInfo container, String digest, boolean pinned) implements DigestFetchResult {

  }

  /**
   * @param container the container
   * @param error why the digest could not be resolved
   */
  record Failed(ContainerInfo container, RuntimeException error) implements DigestFetchResult {

  }
}
