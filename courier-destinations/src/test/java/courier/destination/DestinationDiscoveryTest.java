package courier.destination;

import courier.DestinationSettings;
import courier.ExportDestination;
import courier.registry.DefaultDestinationRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DestinationDiscoveryTest {

  @Test
  void bundledDestinationsAreDiscoveredAndOrderedByPriority() {
    DefaultDestinationRegistry registry = DefaultDestinationRegistry.builder()
        .settings(DestinationSettings.of(Map.of(
            "cdcs.url", "https://cdcs.example.org/", "cdcs.token", "t",
            "elabftw.url", "https://elab.example.org", "elabftw.api-key", "k",
            "labarchives.url", "https://la.example.org", "labarchives.api-key", "k")))
        .build();

    List<String> names = registry.enabledDestinations().stream()
        .map(ExportDestination::name)
        .collect(Collectors.toList());

    assertEquals(List.of("cdcs", "labarchives", "elabftw"), names);
  }

  @Test
  void unconfiguredDestinationsAreDisabled() {
    DefaultDestinationRegistry registry = DefaultDestinationRegistry.builder()
        .settings(DestinationSettings.empty())
        .build();

    assertEquals(3, registry.destinations().size());
    assertTrue(registry.enabledDestinations().isEmpty());
  }
}
