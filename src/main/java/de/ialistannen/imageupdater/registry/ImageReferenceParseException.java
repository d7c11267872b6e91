package de.ialistannen.imageupdater.registry;

public class ImageReferenceParseException extends RuntimeException {

  public ImageReferenceParseException(String image, String reason) {
    super("Could not parse image '" + image + "': " + reason);
  }
}
