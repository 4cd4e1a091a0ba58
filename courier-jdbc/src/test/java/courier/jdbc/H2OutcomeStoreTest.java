package courier.jdbc;

import courier.jdbc.store.AbstractJdbcOutcomeStore;
import courier.jdbc.store.H2OutcomeStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;
import java.util.UUID;

class H2OutcomeStoreTest extends AbstractOutcomeStoreIntegrationTest {
  private JdbcDataSource dataSource;
  private final H2OutcomeStore store = new H2OutcomeStore();

  @BeforeEach
  void setup() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:outcome_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    Schemas.apply(dataSource, "/schema/h2.sql");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcOutcomeStore store() {
    return store;
  }
}
