package de.ialistannen.imageupdater.registry;

import de.ialistannen.imageupdater.model.ImageReference;
import de.ialistannen.imageupdater.storage.DigestMap;
import java.util.Optional;
import java.util.Set;

/**
 * Splits raw image strings into registry, repository and tag, filling in Docker's defaults. Docker Hub's "official
 * images" live below {@code library/}, so single-segment names on the default registry get that prefix.
 */
public class ImageReferenceParser {

  private static final Set<String> DOCKER_HUB_ALIASES = Set.of("docker.io", "index.docker.io");

  private final String defaultRegistry;

  public ImageReferenceParser(String defaultRegistry) {
    this.defaultRegistry = defaultRegistry;
  }

  /**
   * Parses an image string such as {@code nginx}, {@code org/app:stable} or {@code ghcr.io/org/app:1.2.3}.
   *
   * @param image the image as written in the pod template
   * @return the parsed reference
   * @throws ImageReferenceParseException if the image is empty or ambiguous
   */
  public ImageReference parse(String image) {
    if (image == null || image.isBlank()) {
      throw new ImageReferenceParseException(String.valueOf(image), "empty image reference");
    }
    String name = image.trim();
    Optional<String> pinnedDigest = Optional.empty();

    int digestStart = name.indexOf('@');
    if (digestStart >= 0) {
      String digest = name.substring(digestStart + 1);
      if (!DigestMap.isValidDigest(digest)) {
        throw new ImageReferenceParseException(image, "invalid digest '" + digest + "'");
      }
      pinnedDigest = Optional.of(digest);
      name = name.substring(0, digestStart);
    }

    String registry = defaultRegistry;
    String path = name;
    int firstSlash = name.indexOf('/');
    if (firstSlash > 0 && isRegistryHost(name.substring(0, firstSlash))) {
      registry = name.substring(0, firstSlash);
      path = name.substring(firstSlash + 1);
    }
    if (DOCKER_HUB_ALIASES.contains(registry)) {
      registry = defaultRegistry;
    }

    int lastSlash = path.lastIndexOf('/');
    String tag = "latest";
    int tagStart = path.lastIndexOf(':');
    if (tagStart >= 0) {
      if (tagStart < lastSlash) {
        throw new ImageReferenceParseException(image, "':' inside the repository path");
      }
      if (path.indexOf(':') != tagStart) {
        throw new ImageReferenceParseException(image, "multiple ':' in the tag");
      }
      tag = path.substring(tagStart + 1);
      path = path.substring(0, tagStart);
      if (tag.isEmpty()) {
        throw new ImageReferenceParseException(image, "empty tag");
      }
    }

    if (path.isEmpty() || path.startsWith("/") || path.endsWith("/") || path.contains("//")) {
      throw new ImageReferenceParseException(image, "empty repository segment");
    }
    if (!path.contains("/") && registry.equals(defaultRegistry)) {
      path = "library/" + path;
    }

    return new ImageReference(registry, path, tag, pinnedDigest);
  }

  private static boolean isRegistryHost(String segment) {
    return segment.contains(".") || segment.contains(":") || segment.equals("localhost");
  }
}
