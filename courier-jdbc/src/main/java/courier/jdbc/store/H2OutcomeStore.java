package courier.jdbc.store;

import java.util.List;

/**
 * H2 outcome store. Uses the standard SQL of {@link AbstractJdbcOutcomeStore}.
 */
public final class H2OutcomeStore extends AbstractJdbcOutcomeStore {

  public H2OutcomeStore() {
    super();
  }

  public H2OutcomeStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcOutcomeStore withTableName(String tableName) {
    return new H2OutcomeStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
