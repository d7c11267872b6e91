package de.ialistannen.imageupdater.storage;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * An immutable mapping from container name to manifest digest, ordered by container name.
 *
 * @param digests the digests by container name
 */
public record DigestMap(SortedMap<String, String> digests) {

  private static final Pattern DIGEST_SHAPE = Pattern.compile("[^\\s:,]+:[^\\s,]+");

  public DigestMap {
    TreeMap<String, String> copy = new TreeMap<>();
    for (Map.Entry<String, String> entry : digests.entrySet()) {
      String name = entry.getKey();
      String digest = entry.getValue();
      if (name.isBlank() || name.contains(",") || name.contains(":")) {
        throw new IllegalArgumentException("Invalid container name '" + name + "'");
      }
      if (!isValidDigest(digest)) {
        throw new IllegalArgumentException("Invalid digest '" + digest + "' for container '" + name + "'");
      }
      copy.put(name, digest);
    }
    digests = Collections.unmodifiableSortedMap(copy);
  }

  /**
   * Checks that a digest has the {@code algorithm:encoded} shape. Anything passing this check survives being encoded and
   * decoded again.
   *
   * @param digest the digest to check
   * @return true if the digest can be stored
   */
  public static boolean isValidDigest(String digest) {
    return digest != null && DIGEST_SHAPE.matcher(digest).matches();
  }

  public static DigestMap empty() {
    return new DigestMap(new TreeMap<>());
  }

  public static DigestMap of(Map<String, String> digests) {
    return new DigestMap(new TreeMap<>(digests));
  }

  public Optional<String> get(String containerName) {
    return Optional.ofNullable(digests.get(containerName));
  }

  public boolean isEmpty() {
    return digests.isEmpty();
  }

  /**
   * @param containerName the container
   * @param digest its digest
   * @return a copy of this map with the entry added or replaced
   */
  public DigestMap with(String containerName, String digest) {
    TreeMap<String, String> copy = new TreeMap<>(digests);
    copy.put(containerName, digest);
    return new DigestMap(copy);
  }

  /**
   * @param containerNames the containers to keep
   * @return a copy of this map without entries for any other container
   */
  public DigestMap retainOnly(Set<String> containerNames) {
    TreeMap<String, String> copy = new TreeMap<>(digests);
    copy.keySet().retainAll(containerNames);
    return new DigestMap(copy);
  }
}
