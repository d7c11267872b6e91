package de.ialistannen.imageupdater.storage;

/**
 * A decoded {@code last-digest} annotation.
 *
 * @param format the format the value was stored in
 * @param digests the decoded digests, empty for {@link DigestStateFormat#ABSENT} and {@link DigestStateFormat#CORRUPT}
 */
public record DecodedDigestState(DigestStateFormat format, DigestMap digests) {

}
