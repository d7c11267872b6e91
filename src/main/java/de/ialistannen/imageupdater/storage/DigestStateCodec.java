package de.ialistannen.imageupdater.storage;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the digest state persisted in the {@code last-digest} annotation.
 * <p>
 * Values are always written in the canonical form {@code name:digest,name:digest} sorted by name. Reading tries the
 * canonical form first and falls back to the legacy single-digest form, which is attributed to the first tracked
 * container. Since writes are canonical, legacy values disappear on the next write.
 */
public class DigestStateCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(DigestStateCodec.class);

  private static final Splitter ENTRY_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Pattern LEGACY_DIGEST = Pattern.compile("(?:sha256|sha384|sha512):[A-Za-z0-9=_-]+");

  /**
   * Decodes a stored annotation value.
   *
   * @param raw the stored value, if any
   * @param legacyOwner the container a legacy bare digest belongs to
   * @return the decoded state
   */
  public DecodedDigestState decode(Optional<String> raw, String legacyOwner) {
    if (raw.isEmpty() || raw.get().isBlank()) {
      return new DecodedDigestState(DigestStateFormat.ABSENT, DigestMap.empty());
    }
    String value = raw.get().trim();

    Optional<DigestMap> canonical = decodeCanonical(value);
    if (canonical.isPresent()) {
      return new DecodedDigestState(DigestStateFormat.CANONICAL, canonical.get());
    }

    if (LEGACY_DIGEST.matcher(value).matches()) {
      LOGGER.debug("Found legacy digest '{}', attributing it to '{}'", value, legacyOwner);
      return new DecodedDigestState(DigestStateFormat.LEGACY, DigestMap.empty().with(legacyOwner, value));
    }

    LOGGER.warn("Stored digest state '{}' is neither canonical nor legacy, treating it as absent", value);
    return new DecodedDigestState(DigestStateFormat.CORRUPT, DigestMap.empty());
  }

  private Optional<DigestMap> decodeCanonical(String value) {
    List<String> entries = ENTRY_SPLITTER.splitToList(value);
    if (entries.isEmpty()) {
      return Optional.empty();
    }

    TreeMap<String, String> digests = new TreeMap<>();
    for (String entry : entries) {
      int separator = entry.indexOf(':');
      if (separator <= 0) {
        return Optional.empty();
      }
      String name = entry.substring(0, separator).trim();
      String digest = entry.substring(separator + 1).trim();
      if (name.isEmpty() || !DigestMap.isValidDigest(digest)) {
        return Optional.empty();
      }
      digests.put(name, digest);
    }

    return Optional.of(new DigestMap(digests));
  }

  /**
   * Encodes the digests in canonical form. Encoding is a fixed point: decoding the result and encoding it again yields
   * the same string, so comparing against the stored value tells whether a write is needed.
   *
   * @param digests the digests
   * @return the annotation value
   */
  public String encode(DigestMap digests) {
    return digests.digests()
      .entrySet()
      .stream()
      .map(entry -> entry.getKey() + ":" + entry.getValue())
      .collect(Collectors.joining(","));
  }
}
