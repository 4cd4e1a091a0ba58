package courier.strategy;

import courier.ExportContext;
import courier.ExportDestination;
import courier.ExportResult;
import courier.StubDestination;
import courier.TestContexts;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StrategyExecutorTest {
  private final StrategyExecutor executor = new StrategyExecutor();

  private static List<String> names(List<ExportResult> results) {
    return results.stream().map(ExportResult::destinationName).collect(Collectors.toList());
  }

  /** cdcs succeeds, labarchives links cdcs and succeeds, elabftw times out. */
  private static List<ExportDestination> scenario() {
    StubDestination cdcs = new StubDestination("cdcs", 100)
        .behavior(ctx -> ExportResult.success("cdcs", "1", "http://x/1"));
    StubDestination labarchives = new StubDestination("labarchives", 90)
        .behavior(ctx -> ExportResult.succeeded("labarchives")
            .recordId("la-1")
            .metadata("cdcs_url", ctx.result("cdcs").recordUrl())
            .build());
    StubDestination elabftw = StubDestination.failing("elabftw", 80)
        .behavior(ctx -> ExportResult.failure("elabftw", "timeout"));
    return List.of(cdcs, labarchives, elabftw);
  }

  @Test
  void allRunsEveryDestinationInOrder() {
    ExportContext context = TestContexts.context("s1");

    List<ExportResult> results = executor.execute(ExportStrategy.ALL, scenario(), context);

    assertEquals(List.of("cdcs", "labarchives", "elabftw"), names(results));
    assertEquals("http://x/1", results.get(1).metadata().get("cdcs_url"));
    assertEquals("timeout", results.get(2).errorMessage());
    assertFalse(ExportStrategy.ALL.isSuccessful(results));
    assertTrue(ExportStrategy.BEST_EFFORT.isSuccessful(results));
  }

  @Test
  void firstSuccessStopsAfterFirstSuccess() {
    List<ExportDestination> destinations = scenario();
    ExportContext context = TestContexts.context("s1");

    List<ExportResult> results = executor.execute(ExportStrategy.FIRST_SUCCESS, destinations, context);

    assertEquals(List.of("cdcs"), names(results));
    assertEquals(0, ((StubDestination) destinations.get(1)).callCount());
    assertEquals(0, ((StubDestination) destinations.get(2)).callCount());
    assertEquals(List.of("cdcs"), List.copyOf(context.previousResults().keySet()));
  }

  @Test
  void firstSuccessRunsAllWhenNoneSucceed() {
    List<ExportDestination> destinations = List.of(
        StubDestination.failing("a", 3),
        StubDestination.failing("b", 2),
        StubDestination.failing("c", 1));

    List<ExportResult> results =
        executor.execute(ExportStrategy.FIRST_SUCCESS, destinations, TestContexts.context("s1"));

    assertEquals(List.of("a", "b", "c"), names(results));
  }

  @Test
  void firstSuccessIsPrefixOfAll() {
    List<ExportDestination> destinations = List.of(
        StubDestination.failing("a", 3),
        StubDestination.succeeding("b", 2),
        StubDestination.succeeding("c", 1));

    List<ExportResult> all = executor.execute(ExportStrategy.ALL, destinations, TestContexts.context("s1"));
    List<ExportResult> first =
        executor.execute(ExportStrategy.FIRST_SUCCESS, destinations, TestContexts.context("s2"));

    assertEquals(names(all).subList(0, 2), names(first));
  }

  @Test
  void bestEffortMatchesAll() {
    List<ExportResult> all = executor.execute(ExportStrategy.ALL, scenario(), TestContexts.context("s1"));
    List<ExportResult> bestEffort =
        executor.execute(ExportStrategy.BEST_EFFORT, scenario(), TestContexts.context("s1"));

    assertEquals(names(all), names(bestEffort));
    for (int i = 0; i < all.size(); i++) {
      assertEquals(all.get(i).success(), bestEffort.get(i).success());
    }
  }

  @Test
  void linkageErrorBecomesFailureAndLaterDestinationsStillRun() {
    StubDestination missingClass = new StubDestination("broken", 10).behavior(ctx -> {
      throw new NoClassDefFoundError("org/example/MissingClient");
    });
    StubDestination after = StubDestination.succeeding("after", 1);

    List<ExportResult> results =
        executor.execute(ExportStrategy.ALL, List.of(missingClass, after), TestContexts.context("s1"));

    assertEquals(List.of("broken", "after"), names(results));
    assertEquals("Unexpected error: org/example/MissingClient", results.get(0).errorMessage());
    assertTrue(results.get(1).success());
  }

  @Test
  void laterDestinationSeesEarlierResults() {
    StubDestination first = StubDestination.succeeding("first", 10);
    StubDestination second = StubDestination.failing("second", 5);
    StubDestination third = new StubDestination("third", 1).behavior(ctx -> {
      assertEquals(List.of("first", "second"), List.copyOf(ctx.previousResults().keySet()));
      return ExportResult.success("third", null, null);
    });
    ExportContext context = TestContexts.context("s1");

    List<ExportResult> results = executor.execute(ExportStrategy.ALL, List.of(first, second, third), context);

    Map<String, ExportResult> recorded = context.previousResults();
    assertEquals(3, recorded.size());
    for (ExportResult result : results) {
      assertSame(result, recorded.get(result.destinationName()));
    }
  }

  @Test
  void throwingDestinationBecomesFailure() {
    StubDestination broken = new StubDestination("broken", 10).behavior(ctx -> {
      throw new IllegalStateException("kaboom");
    });
    StubDestination next = StubDestination.succeeding("next", 5);

    List<ExportResult> results =
        executor.execute(ExportStrategy.ALL, List.of(broken, next), TestContexts.context("s1"));

    assertFalse(results.get(0).success());
    assertTrue(results.get(0).errorMessage().contains("kaboom"));
    assertEquals(1, next.callCount());
  }

  @Test
  void nullResultBecomesFailure() {
    StubDestination broken = new StubDestination("broken", 10).behavior(ctx -> null);

    List<ExportResult> results = executor.execute(ExportStrategy.ALL, List.of(broken), TestContexts.context("s1"));

    assertEquals(1, results.size());
    assertFalse(results.get(0).success());
    assertEquals("broken", results.get(0).destinationName());
  }

  @Test
  void unknownStrategyNameRunsNothing() {
    StubDestination destination = StubDestination.succeeding("a", 1);

    assertThrows(UnknownStrategyException.class, () ->
        executor.execute("sometimes", List.of(destination), TestContexts.context("s1")));
    assertEquals(0, destination.callCount());
  }

  @Test
  void emptyDestinationListYieldsNoResults() {
    assertTrue(executor.execute(ExportStrategy.ALL, List.of(), TestContexts.context("s1")).isEmpty());
  }
}
