package courier;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Configurable destination for unit tests. Records every context it is called with.
 */
public class StubDestination implements ExportDestination {
  private final String name;
  private final int priority;
  private boolean enabled = true;
  private ValidationResult validation = ValidationResult.ok();
  private Function<ExportContext, ExportResult> behavior;
  public final List<ExportContext> calls = new ArrayList<>();

  public StubDestination(String name, int priority) {
    this.name = name;
    this.priority = priority;
    this.behavior = ctx -> ExportResult.success(name, name + "-1", "https://" + name + ".example/1");
  }

  public static StubDestination succeeding(String name, int priority) {
    return new StubDestination(name, priority);
  }

  public static StubDestination failing(String name, int priority) {
    return new StubDestination(name, priority).behavior(ctx -> ExportResult.failure(name, name + " down"));
  }

  public StubDestination behavior(Function<ExportContext, ExportResult> behavior) {
    this.behavior = behavior;
    return this;
  }

  public StubDestination enabled(boolean enabled) {
    this.enabled = enabled;
    return this;
  }

  public StubDestination validation(ValidationResult validation) {
    this.validation = validation;
    return this;
  }

  public int callCount() {
    return calls.size();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int priority() {
    return priority;
  }

  @Override
  public boolean enabled() {
    return enabled;
  }

  @Override
  public ValidationResult validateConfig() {
    return validation;
  }

  @Override
  public ExportResult export(ExportContext context) {
    calls.add(context);
    return behavior.apply(context);
  }
}
