package de.ialistannen.imageupdater.auth;

import de.ialistannen.imageupdater.model.ImageReference;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the static basic auth credentials stored in a docker {@code config.json}.
 */
public class DockerConfigCredentialProvider implements RegistryCredentialProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(DockerConfigCredentialProvider.class);

  private static final Set<String> DOCKER_HUB_HOSTS = Set.of("docker.io", "index.docker.io");

  private final List<DockerRegistryAuth> registryAuths;
  private final String defaultRegistry;

  public DockerConfigCredentialProvider(List<DockerRegistryAuth> registryAuths, String defaultRegistry) {
    this.registryAuths = List.copyOf(registryAuths);
    this.defaultRegistry = defaultRegistry;
  }

  /**
   * Reads the credentials from a docker config file.
   *
   * @param pathToConfig the path to the config
   * @param defaultRegistry the registry Docker Hub entries apply to
   * @return the provider
   * @throws IOException if the file could not be read
   */
  public static DockerConfigCredentialProvider fromFile(Path pathToConfig, String defaultRegistry) throws IOException {
    LOGGER.info("Loading auth from '{}'", pathToConfig);
    List<DockerRegistryAuth> auths = DockerRegistryAuth.loadAuthentications(pathToConfig);
    LOGGER.info("Found credentials for {} registr(y|ies)", auths.size());

    return new DockerConfigCredentialProvider(auths, defaultRegistry);
  }

  @Override
  public Optional<String> authorizationFor(ImageReference reference) {
    return registryAuths.stream()
      .filter(auth -> hostMatches(auth.url(), reference.registry()))
      .findFirst()
      .map(auth -> "Basic " + auth.encodedAuth());
  }

  private boolean hostMatches(String dockerConfigUrl, String registry) {
    String configHost = toHost(dockerConfigUrl);
    if (configHost.equalsIgnoreCase(registry)) {
      return true;
    }
    return registry.equalsIgnoreCase(defaultRegistry)
      && DOCKER_HUB_HOSTS.contains(configHost.toLowerCase(Locale.ROOT));
  }

  private static String toHost(String dockerConfigUrl) {
    if (!dockerConfigUrl.contains("://")) {
      return dockerConfigUrl;
    }
    try {
      URI uri = new URI(dockerConfigUrl);
      if (uri.getHost() == null) {
        return dockerConfigUrl;
      }
      return uri.getPort() >= 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
    } catch (URISyntaxException e) {
      LOGGER.debug("Docker config key '{}' is not a valid URL", dockerConfigUrl, e);
      return dockerConfigUrl;
    }
  }
}
