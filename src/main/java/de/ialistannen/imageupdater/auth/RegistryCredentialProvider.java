package de.ialistannen.imageupdater.auth;

import de.ialistannen.imageupdater.model.ImageReference;
import java.util.Optional;

/**
 * Supplies the {@code Authorization} header for registry requests. Obtaining the credentials is up to the
 * implementation; the registry client only attaches whatever is returned.
 */
@FunctionalInterface
public interface RegistryCredentialProvider {

  /**
   * @param reference the image about to be requested
   * @return the full {@code Authorization} header value (e.g. {@code "Basic ..."}), or empty for anonymous access
   */
  Optional<String> authorizationFor(ImageReference reference);

  static RegistryCredentialProvider anonymous() {
    return reference -> Optional.empty();
  }
}
