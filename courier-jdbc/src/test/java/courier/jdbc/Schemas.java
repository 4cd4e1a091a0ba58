package courier.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;

final class Schemas {
  private Schemas() {}

  /** Runs every statement of a bundled {@code schema/*.sql} file. */
  static void apply(DataSource dataSource, String resource) throws Exception {
    String schema = load(resource);
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
  }

  static void truncate(DataSource dataSource, String table) throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM " + table);
    }
  }

  private static String load(String path) throws IOException {
    try (InputStream is = Schemas.class.getResourceAsStream(path)) {
      if (is == null) throw new IOException("Resource not found: " + path);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
