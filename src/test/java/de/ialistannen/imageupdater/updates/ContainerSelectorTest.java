package de.ialistannen.imageupdater.updates;

import de.ialistannen.imageupdater.config.Annotations;
import de.ialistannen.imageupdater.model.ContainerInfo;
import de.ialistannen.imageupdater.model.TrackingPolicy;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ContainerSelectorTest {

  private static final List<ContainerInfo> CONTAINERS = List.of(
    ContainerInfo.container("web", "nginx:1.25"),
    ContainerInfo.container("sidecar", "envoy:1"),
    ContainerInfo.container("metrics", "exporter:2")
  );
  private static final List<ContainerInfo> INIT_CONTAINERS = List.of(
    ContainerInfo.initContainer("migrate", "migrator:3")
  );

  private final ContainerSelector selector = new ContainerSelector();

  private List<String> selectedNames(Map<String, String> annotations) {
    return selector.select(CONTAINERS, INIT_CONTAINERS, TrackingPolicy.fromAnnotations(annotations))
      .stream()
      .map(ContainerInfo::name)
      .toList();
  }

  @Test
  void testTracksAllRegularContainersByDefault() {
    Assertions.assertEquals(List.of("web", "sidecar", "metrics"), selectedNames(Map.of()));
  }

  @Test
  void testTrackListKeepsDeclarationOrder() {
    Assertions.assertEquals(
      List.of("web", "metrics"),
      selectedNames(Map.of(Annotations.TRACK_CONTAINERS, "metrics,web"))
    );
  }

  @Test
  void testWhitespaceAndEmptyEntriesAreIgnored() {
    Assertions.assertEquals(
      List.of("web", "sidecar"),
      selectedNames(Map.of(Annotations.TRACK_CONTAINERS, " web , , sidecar "))
    );
  }

  @Test
  void testIgnoreList() {
    Assertions.assertEquals(
      List.of("web", "metrics"),
      selectedNames(Map.of(Annotations.IGNORE_CONTAINERS, "sidecar"))
    );
  }

  @Test
  void testTrackListWinsOverIgnoreList() {
    Assertions.assertEquals(
      List.of("sidecar"),
      selectedNames(Map.of(
        Annotations.TRACK_CONTAINERS, "sidecar",
        Annotations.IGNORE_CONTAINERS, "sidecar,web"
      ))
    );
  }

  @Test
  void testUnknownNamesSelectNothing() {
    Assertions.assertEquals(List.of(), selectedNames(Map.of(Annotations.TRACK_CONTAINERS, "does-not-exist")));
  }

  @Test
  void testInitContainersOnlyWhenRequested() {
    Assertions.assertEquals(
      List.of("web", "sidecar", "metrics", "migrate"),
      selectedNames(Map.of(Annotations.TRACK_INIT_CONTAINERS, "true"))
    );
    Assertions.assertEquals(
      List.of("web", "sidecar", "metrics"),
      selectedNames(Map.of(Annotations.TRACK_INIT_CONTAINERS, "yes"))
    );
  }

  @Test
  void testInitContainersAreNotFilteredByTrackList() {
    Assertions.assertEquals(
      List.of("web", "migrate"),
      selectedNames(Map.of(
        Annotations.TRACK_CONTAINERS, "web",
        Annotations.TRACK_INIT_CONTAINERS, "true"
      ))
    );
  }
}
