package de.ialistannen.imageupdater.registry;

import de.ialistannen.imageupdater.auth.RegistryCredentialProvider;
import de.ialistannen.imageupdater.model.ImageReference;
import de.ialistannen.imageupdater.storage.DigestMap;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches manifest digests using the registry v2 API.
 */
public class RegistryDigestClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(RegistryDigestClient.class);

  static final String DIGEST_HEADER = "Docker-Content-Digest";

  /**
   * Multi-arch indices first, as that is what a node pulling the tag resolves it to. Single manifests cover registries
   * (or images) without an index, in both OCI and Docker schema2 flavour.
   */
  static final List<String> MANIFEST_MEDIA_TYPES = List.of(
    "application/vnd.oci.image.index.v1+json",
    "application/vnd.docker.distribution.manifest.list.v2+json",
    "application/vnd.oci.image.manifest.v1+json",
    "application/vnd.docker.distribution.manifest.v2+json"
  );

  private final HttpClient client;
  private final RegistryCredentialProvider credentialProvider;
  private final Duration requestTimeout;
  private final Set<String> plainHttpRegistries;

  public RegistryDigestClient(
    HttpClient client,
    RegistryCredentialProvider credentialProvider,
    Duration requestTimeout,
    Set<String> plainHttpRegistries
  ) {
    this.client = client;
    this.credentialProvider = credentialProvider;
    this.requestTimeout = requestTimeout;
    this.plainHttpRegistries = Set.copyOf(plainHttpRegistries);
  }

  /**
   * Fetches the manifest digest for a given reference. The digest is taken from the received header, the manifest body
   * is never hashed. The returned value is opaque.
   *
   * @param reference the image to get the digest for
   * @return the digest of the manifest
   * @throws RegistryException if the request timed out, failed or was answered with anything but a digest
   * @throws ImageReferenceParseException if the reference does not form a valid URL
   */
  public String getDigest(ImageReference reference) {
    LOGGER.debug("Fetching digest for '{}'", reference.nameWithTag());

    HttpRequest request = buildRequest(reference);
    HttpResponse<Void> response = send(reference, request);

    if (response.statusCode() != 200) {
      LOGGER.info(
        "Failed to fetch digest for '{}' ({})",
        reference.nameWithTag(),
        response.statusCode()
      );
      throw new RegistryException(
        RegistryFailure.forStatus(response.statusCode()),
        "Error fetching digest for '" + reference.nameWithTag() + "', got status code " + response.statusCode()
      );
    }

    // Opaque, but it has to look like "algorithm:encoded" to be stored
    Optional<String> digest = response.headers()
      .firstValue(DIGEST_HEADER)
      .map(String::trim)
      .filter(DigestMap::isValidDigest);
    if (digest.isEmpty()) {
      throw new RegistryException(
        RegistryFailure.MALFORMED_RESPONSE,
        "No valid " + DIGEST_HEADER + " header returned for '" + reference.nameWithTag() + "'"
      );
    }
    LOGGER.debug("Digest for '{}' is '{}'", reference.nameWithTag(), digest.get());

    return digest.get();
  }

  private HttpRequest buildRequest(ImageReference reference) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(manifestUri(reference))
      .header("User-Agent", "kubernetes-image-updater")
      .timeout(requestTimeout)
      .GET();
    for (String mediaType : MANIFEST_MEDIA_TYPES) {
      builder.header("Accept", mediaType);
    }
    credentialProvider.authorizationFor(reference).ifPresent(auth -> builder.header("Authorization", auth));

    return builder.build();
  }

  private HttpResponse<Void> send(ImageReference reference, HttpRequest request) {
    try {
      return client.send(request, BodyHandlers.discarding());
    } catch (HttpTimeoutException e) {
      throw new RegistryException(
        RegistryFailure.TIMEOUT,
        "Timed out after " + requestTimeout + " fetching digest for '" + reference.nameWithTag() + "'",
        e
      );
    } catch (IOException e) {
      throw new RegistryException(
        RegistryFailure.TRANSPORT,
        "Error talking to registry '" + reference.registry() + "'",
        e
      );
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RegistryException(
        RegistryFailure.TRANSPORT,
        "Interrupted fetching digest for '" + reference.nameWithTag() + "'",
        e
      );
    }
  }

  private URI manifestUri(ImageReference reference) {
    String scheme = plainHttpRegistries.contains(reference.registry()) ? "http" : "https";
    String url = "%s://%s/v2/%s/manifests/%s".formatted(
      scheme,
      reference.registry(),
      reference.repository(),
      reference.tag()
    );
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new ImageReferenceParseException(reference.nameWithTag(), "not a valid registry URL: " + e.getMessage());
    }
    // e.g. underscores in the registry, which URI then reads as a registry-based authority
    if (uri.getHost() == null) {
      throw new ImageReferenceParseException(
        reference.nameWithTag(),
        "'" + reference.registry() + "' is not a valid registry host"
      );
    }
    return uri;
  }
}
