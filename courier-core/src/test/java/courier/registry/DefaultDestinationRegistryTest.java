package courier.registry;

import courier.DestinationSettings;
import courier.ExportDestination;
import courier.ExportResult;
import courier.StubDestination;
import courier.TestContexts;
import courier.strategy.ExportStrategy;
import courier.strategy.UnknownStrategyException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DefaultDestinationRegistryTest {

  private static DefaultDestinationRegistry manual() {
    return DefaultDestinationRegistry.builder().discovery(false).build();
  }

  private static List<String> names(List<ExportDestination> destinations) {
    return destinations.stream().map(ExportDestination::name).collect(Collectors.toList());
  }

  @Test
  void enabledDestinationsAreSortedByDescendingPriority() {
    DefaultDestinationRegistry registry = manual()
        .register(StubDestination.succeeding("low", 10))
        .register(StubDestination.succeeding("high", 900))
        .register(StubDestination.succeeding("mid", 100));

    assertEquals(List.of("high", "mid", "low"), names(registry.enabledDestinations()));
  }

  @Test
  void disabledDestinationsAreExcluded() {
    StubDestination toggled = StubDestination.succeeding("toggled", 100).enabled(false);
    DefaultDestinationRegistry registry = manual()
        .register(toggled)
        .register(StubDestination.succeeding("on", 10));

    assertEquals(List.of("on"), names(registry.enabledDestinations()));

    toggled.enabled(true);
    assertEquals(List.of("toggled", "on"), names(registry.enabledDestinations()));
  }

  @Test
  void equalPrioritiesKeepRegistrationOrder() {
    DefaultDestinationRegistry registry = manual()
        .register(StubDestination.succeeding("b", 50))
        .register(StubDestination.succeeding("a", 50))
        .register(StubDestination.succeeding("c", 50));

    assertEquals(List.of("b", "a", "c"), names(registry.enabledDestinations()));
  }

  @Test
  void duplicateNameReplacesAndMovesToLaterPosition() {
    StubDestination replacement = StubDestination.failing("dup", 50);
    DefaultDestinationRegistry registry = manual()
        .register(StubDestination.succeeding("dup", 50))
        .register(StubDestination.succeeding("other", 50))
        .register(replacement);

    List<ExportDestination> enabled = registry.enabledDestinations();
    assertEquals(List.of("other", "dup"), names(enabled));
    assertSame(replacement, enabled.get(1));
  }

  @Test
  void rejectsInvalidDestinations() {
    DefaultDestinationRegistry registry = manual();

    assertThrows(IllegalArgumentException.class, () -> registry.register(null));
    assertThrows(IllegalArgumentException.class, () -> registry.register(StubDestination.succeeding(" ", 1)));
    assertThrows(IllegalArgumentException.class, () -> registry.register(StubDestination.succeeding("neg", -1)));
    assertThrows(IllegalArgumentException.class, () -> registry.register(StubDestination.succeeding("big", 1001)));
    registry.register(StubDestination.succeeding("min", ExportDestination.MIN_PRIORITY));
    registry.register(StubDestination.succeeding("max", ExportDestination.MAX_PRIORITY));
    assertEquals(List.of("max", "min"), names(registry.enabledDestinations()));
  }

  @Test
  void discoverySkipsBrokenProvidersAndPassesSettings() {
    DefaultDestinationRegistry registry = DefaultDestinationRegistry.builder()
        .settings(DestinationSettings.of(Map.of("alpha.url", "https://alpha.example")))
        .build();

    assertEquals(List.of("alpha", "beta"), names(registry.destinations()));
    assertEquals(List.of("beta", "alpha"), names(registry.enabledDestinations()));
  }

  @Test
  void discoveryHonoursProviderSettings() {
    DefaultDestinationRegistry registry = DefaultDestinationRegistry.builder()
        .settings(DestinationSettings.empty())
        .build();

    assertEquals(List.of("beta"), names(registry.enabledDestinations()));
  }

  @Test
  void discoveryRunsOnce() {
    DefaultDestinationRegistry registry = DefaultDestinationRegistry.builder()
        .settings(DestinationSettings.empty())
        .build();

    registry.discover();
    int created = TestDestinationProviders.CREATED.get();
    registry.discover();
    registry.enabledDestinations();

    assertEquals(created, TestDestinationProviders.CREATED.get());
    assertEquals(2, registry.destinations().size());
  }

  @Test
  void explicitRegistrationReplacesDiscoveredDestination() {
    StubDestination override = StubDestination.failing("beta", 999);
    DefaultDestinationRegistry registry = DefaultDestinationRegistry.builder()
        .settings(DestinationSettings.empty())
        .build()
        .register(override);

    List<ExportDestination> enabled = registry.enabledDestinations();
    assertEquals(List.of("beta"), names(enabled));
    assertSame(override, enabled.get(0));
    assertEquals(999, enabled.get(0).priority());
  }

  @Test
  void independentRegistriesDoNotShareState() {
    DefaultDestinationRegistry first = manual().register(StubDestination.succeeding("a", 1));
    DefaultDestinationRegistry second = manual();

    assertEquals(1, first.enabledDestinations().size());
    assertTrue(second.enabledDestinations().isEmpty());
  }

  @Test
  void exportToAllRunsEnabledDestinationsInPriorityOrder() {
    StubDestination low = StubDestination.succeeding("low", 1);
    StubDestination high = StubDestination.failing("high", 10);
    DefaultDestinationRegistry registry = manual().register(low).register(high);

    List<ExportResult> results = registry.exportToAll(TestContexts.context("s1"), ExportStrategy.ALL);

    assertEquals(List.of("high", "low"),
        results.stream().map(ExportResult::destinationName).collect(Collectors.toList()));
  }

  @Test
  void exportToAllRejectsUnknownStrategyName() {
    StubDestination destination = StubDestination.succeeding("a", 1);
    DefaultDestinationRegistry registry = manual().register(destination);

    assertThrows(UnknownStrategyException.class, () -> registry.exportToAll(TestContexts.context("s1"), "nope"));
    assertEquals(0, destination.callCount());
  }

  @Test
  void throwingEnabledCheckCountsAsDisabled() {
    StubDestination broken = new StubDestination("broken", 5) {
      @Override
      public boolean enabled() {
        throw new IllegalStateException("config unreadable");
      }
    };
    DefaultDestinationRegistry registry = manual().register(broken).register(StubDestination.succeeding("ok", 1));

    assertEquals(List.of("ok"), names(registry.enabledDestinations()));
  }
}
