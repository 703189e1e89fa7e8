package eventjournal.jdbc;

import eventjournal.jdbc.dialect.Dialects;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlJdbcStoresIntegrationTest extends AbstractJdbcStoresIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("journal_test");

  private static SimpleDataSource dataSource;
  private static JdbcStores stores;

  @BeforeAll
  static void createSchema() {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    stores = JdbcStores.detect(dataSource);
    stores.createSchema(dataSource);
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  JdbcStores stores() {
    return stores;
  }
}
