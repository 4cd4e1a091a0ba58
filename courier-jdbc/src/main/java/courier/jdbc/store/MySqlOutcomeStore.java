package courier.jdbc.store;

import java.util.List;

/**
 * MySQL and MariaDB outcome store.
 */
public final class MySqlOutcomeStore extends AbstractJdbcOutcomeStore {

  public MySqlOutcomeStore() {
    super();
  }

  public MySqlOutcomeStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcOutcomeStore withTableName(String tableName) {
    return new MySqlOutcomeStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }
}
