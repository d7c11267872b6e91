package de.ialistannen.imageupdater.registry;

/**
 * Why a digest could not be fetched.
 */
public enum RegistryFailure {
  TIMEOUT,
  UNAUTHORIZED,
  NOT_FOUND,
  SERVER_ERROR,
  MALFORMED_RESPONSE,
  TRANSPORT;

  /**
   * Classifies an unsuccessful HTTP status.
   *
   * @param statusCode the status code
   * @return the failure kind
   */
  public static RegistryFailure forStatus(int statusCode) {
    if (statusCode == 401 || statusCode == 403) {
      return UNAUTHORIZED;
    }
    if (statusCode == 404) {
      return NOT_FOUND;
    }
    if (statusCode >= 500 && statusCode < 600) {
      return SERVER_ERROR;
    }
    return MALFORMED_RESPONSE;
  }
}
