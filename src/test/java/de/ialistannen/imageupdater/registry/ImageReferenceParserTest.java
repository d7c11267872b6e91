package de.ialistannen.imageupdater.registry;

import de.ialistannen.imageupdater.model.ImageReference;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ImageReferenceParserTest {

  private final ImageReferenceParser parser = new ImageReferenceParser("registry-1.docker.io");

  @ParameterizedTest
  @CsvSource({
    "nginx, registry-1.docker.io, library/nginx, latest",
    "nginx:latest, registry-1.docker.io, library/nginx, latest",
    "org/app:stable, registry-1.docker.io, org/app, stable",
    "ghcr.io/org/app:1.2.3, ghcr.io, org/app, 1.2.3",
    "registry.example.com/team/app:prod, registry.example.com, team/app, prod",
    "myregistry.io/myorg/app:v1.2.3, myregistry.io, myorg/app, v1.2.3",
    "localhost:5000/myapp:dev, localhost:5000, myapp, dev",
    "localhost/myapp, localhost, myapp, latest",
    "quay.io/project/image:v1.0, quay.io, project/image, v1.0",
    "docker.io/nginx:1.25, registry-1.docker.io, library/nginx, 1.25",
    "index.docker.io/bitnami/redis:7, registry-1.docker.io, bitnami/redis, 7",
  })
  void testParse(String image, String registry, String repository, String tag) {
    ImageReference reference = parser.parse(image);

    Assertions.assertEquals(registry, reference.registry());
    Assertions.assertEquals(repository, reference.repository());
    Assertions.assertEquals(tag, reference.tag());
    Assertions.assertFalse(reference.isPinned());
  }

  @Test
  void testSingleNameAlwaysGetsDefaultRegistryAndLibraryPrefix() {
    for (String name : new String[]{"redis", "postgres:16", "busybox:1.36.1"}) {
      ImageReference reference = parser.parse(name);

      Assertions.assertEquals("registry-1.docker.io", reference.registry());
      Assertions.assertTrue(reference.repository().startsWith("library/"), reference.repository());
    }
  }

  @Test
  void testCustomDefaultRegistry() {
    ImageReference reference = new ImageReferenceParser("mirror.internal").parse("nginx:1");

    Assertions.assertEquals("mirror.internal", reference.registry());
    Assertions.assertEquals("library/nginx", reference.repository());
  }

  @Test
  void testPinnedDigestIsFlagged() {
    ImageReference reference = parser.parse("nginx@sha256:0123abcd");

    Assertions.assertTrue(reference.isPinned());
    Assertions.assertEquals(Optional.of("sha256:0123abcd"), reference.pinnedDigest());
    Assertions.assertEquals("library/nginx", reference.repository());
    Assertions.assertEquals("latest", reference.tag());
  }

  @Test
  void testPinnedDigestWithTag() {
    ImageReference reference = parser.parse("ghcr.io/org/app:1.0@sha256:feed");

    Assertions.assertEquals("ghcr.io", reference.registry());
    Assertions.assertEquals("org/app", reference.repository());
    Assertions.assertEquals("1.0", reference.tag());
    Assertions.assertEquals(Optional.of("sha256:feed"), reference.pinnedDigest());
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "",
    "   ",
    "nginx:1:2",
    "org/app:1:2",
    "nginx:",
    "org/x:y/app",
    "nginx@sha256",
    "nginx@sha256:",
    "@sha256:abc",
    "ghcr.io/",
    "ghcr.io//app",
  })
  void testInvalidImages(String image) {
    Assertions.assertThrows(ImageReferenceParseException.class, () -> parser.parse(image));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "app@sha256:abc,def",
    "app@sha256:abc def",
    "app@sha256:abc\tdef",
    "app@abcdef",
    "app@:abc",
    "app@sha256:abc:def,x",
  })
  void testPinnedDigestMustBeStorable(String image) {
    Assertions.assertThrows(ImageReferenceParseException.class, () -> parser.parse(image));
  }

  @Test
  void testNullImage() {
    Assertions.assertThrows(ImageReferenceParseException.class, () -> parser.parse(null));
  }
}
