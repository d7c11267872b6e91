package de.ialistannen.imageupdater.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;

/**
 * A single entry of the {@code "auths"} section of a docker config.
 *
 * @param url the key as written in the config, a host or a URL
 * @param encodedAuth the base64 encoded {@code user:password}
 */
public record DockerRegistryAuth(String url, String encodedAuth) {

  /**
   * Loads the docker authentications from a given config file.
   *
   * @param pathToConfig the path to the docker config
   * @return the stored authentications
   * @throws IOException if an error occurs
   */
  public static List<DockerRegistryAuth> loadAuthentications(Path pathToConfig) throws IOException {
    ObjectNode root = new ObjectMapper().readValue(Files.readString(pathToConfig), ObjectNode.class);

    JsonNode auths = root.get("auths");
    if (!(auths instanceof ObjectNode authsNode)) {
      return List.of();
    }
    return fromJson(authsNode);
  }

  /**
   * Extracts the stored registry authentications from the "auths" part of the config file. Entries without an
   * {@code auth} field (e.g. ones delegating to a credential helper) are skipped.
   *
   * @param authsNode the auths node
   * @return the found docker registry authentications
   */
  private static List<DockerRegistryAuth> fromJson(ObjectNode authsNode) {
    List<DockerRegistryAuth> auths = new ArrayList<>();

    var iterator = authsNode.fields();
    while (iterator.hasNext()) {
      Entry<String, JsonNode> entry = iterator.next();
      JsonNode auth = entry.getValue().get("auth");
      if (auth == null || auth.asText().isBlank()) {
        continue;
      }
      auths.add(new DockerRegistryAuth(entry.getKey(), auth.asText()));
    }

    return auths;
  }
}
