package de.ialistannen.imageupdater.model;

import java.util.Optional;

/**
 * A parsed container image reference.
 *
 * @param registry the registry host (and port), never empty
 * @param repository the repository path inside the registry, e.g. {@code library/nginx}
 * @param tag the tag, {@code latest} if the image did not name one
 * @param pinnedDigest the digest the image is pinned to ({@code image@sha256:...}), if any
 */
public record ImageReference(
  String registry,
  String repository,
  String tag,
  Optional<String> pinnedDigest
) {

  public ImageReference(String registry, String repository, String tag) {
    this(registry, repository, tag, Optional.empty());
  }

  /**
   * @return true if the reference names a digest and therefore needs no registry lookup
   */
  public boolean isPinned() {
    return pinnedDigest().isPresent();
  }

  public String nameWithTag() {
    return registry() + "/" + repository() + ":" + tag();
  }
}
