package courier.jdbc.store;

import courier.jdbc.JdbcTemplate;
import courier.model.OutcomeRecord;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL outcome store.
 *
 * <p>Uses {@code DISTINCT ON} for {@link #latestBySession} instead of a correlated subquery.
 */
public final class PostgresOutcomeStore extends AbstractJdbcOutcomeStore {

  public PostgresOutcomeStore() {
    super();
  }

  public PostgresOutcomeStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcOutcomeStore withTableName(String tableName) {
    return new PostgresOutcomeStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<OutcomeRecord> latestBySession(Connection conn, String sessionIdentifier) {
    String sql = "SELECT DISTINCT ON (destination_name) " + COLUMNS
        + " FROM " + tableName()
        + " WHERE session_identifier=?"
        + " ORDER BY destination_name, id DESC";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, sessionIdentifier);
  }
}
