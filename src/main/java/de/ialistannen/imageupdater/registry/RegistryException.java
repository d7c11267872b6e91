package de.ialistannen.imageupdater.registry;

public class RegistryException extends RuntimeException {

  private final RegistryFailure failure;

  public RegistryException(RegistryFailure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public RegistryException(RegistryFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }

  public RegistryFailure failure() {
    return failure;
  }
}
