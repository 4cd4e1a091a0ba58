package courier.jdbc.store;

import courier.jdbc.JdbcTemplate;
import courier.jdbc.TableNames;
import courier.model.OutcomeRecord;
import courier.spi.OutcomeStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC outcome store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #latestBySession} where the database has a better query.
 * Register custom implementations via
 * {@code META-INF/services/courier.jdbc.store.AbstractJdbcOutcomeStore}.
 *
 * @see JdbcOutcomeStores
 */
public abstract class AbstractJdbcOutcomeStore implements OutcomeStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS =
      "id, session_identifier, destination_name, success, record_id, record_url, "
          + "error_message, timestamp, metadata_json";

  protected static final JdbcTemplate.RowMapper<OutcomeRecord> ROW_MAPPER = rs -> new OutcomeRecord(
      rs.getLong("id"),
      rs.getString("session_identifier"),
      rs.getString("destination_name"),
      rs.getBoolean("success"),
      rs.getString("record_id"),
      rs.getString("record_url"),
      rs.getString("error_message"),
      rs.getTimestamp("timestamp").toInstant(),
      rs.getString("metadata_json"));

  private final String tableName;

  protected AbstractJdbcOutcomeStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcOutcomeStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect writing to another table.
   */
  public abstract AbstractJdbcOutcomeStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  @Override
  public void insert(Connection conn, OutcomeRecord record) {
    Objects.requireNonNull(record, "record");
    JdbcTemplate.update(conn, insertSql(), insertParams(record));
  }

  @Override
  public void insertBatch(Connection conn, List<OutcomeRecord> records) {
    Objects.requireNonNull(records, "records");
    List<Object[]> rows = new ArrayList<>(records.size());
    for (OutcomeRecord record : records) {
      rows.add(insertParams(record));
    }
    JdbcTemplate.batchUpdate(conn, insertSql(), rows);
  }

  @Override
  public List<OutcomeRecord> findBySession(Connection conn, String sessionIdentifier) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE session_identifier=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, sessionIdentifier);
  }

  @Override
  public List<OutcomeRecord> latestBySession(Connection conn, String sessionIdentifier) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " o"
        + " WHERE o.session_identifier=? AND o.id = ("
        + "SELECT MAX(i.id) FROM " + tableName() + " i"
        + " WHERE i.session_identifier = o.session_identifier"
        + " AND i.destination_name = o.destination_name)"
        + " ORDER BY o.destination_name";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, sessionIdentifier);
  }

  @Override
  public List<OutcomeRecord> findByDestination(Connection conn, String destinationName, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE destination_name=? ORDER BY id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, destinationName, limit);
  }

  private String insertSql() {
    return "INSERT INTO " + tableName() + " ("
        + "session_identifier, destination_name, success, record_id, record_url, "
        + "error_message, timestamp, metadata_json"
        + ") VALUES (?,?,?,?,?,?,?,?)";
  }

  private static Object[] insertParams(OutcomeRecord record) {
    return new Object[]{
        record.sessionIdentifier(),
        record.destinationName(),
        record.success(),
        record.recordId(),
        record.recordUrl(),
        truncateError(record.errorMessage()),
        Timestamp.from(record.timestamp()),
        record.metadataJson()};
  }

  protected static String truncateError(String error) {
    if (error == null) {
      return null;
    }
    return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
  }
}
