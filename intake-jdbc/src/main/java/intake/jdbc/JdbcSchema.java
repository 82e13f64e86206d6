package intake.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Installs the intake tables from the bundled DDL scripts
 * ({@code intake/schema-h2.sql}, {@code intake/schema-postgresql.sql}). The scripts
 * use {@code IF NOT EXISTS} throughout, so installing twice is harmless.
 */
public final class JdbcSchema {
  private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());

  private JdbcSchema() {}

  /**
   * @param dialect store name as reported by {@code name()} of the stores, e.g. {@code h2}
   */
  public static void install(Connection conn, String dialect) {
    String resource = "intake/schema-" + dialect.toLowerCase(Locale.ROOT) + ".sql";
    List<String> statements = statements(load(resource));
    try (Statement st = conn.createStatement()) {
      for (String sql : statements) {
        st.execute(sql);
      }
      if (!conn.getAutoCommit()) {
        conn.commit();
      }
    } catch (SQLException e) {
      throw new IntakeStoreException("Failed to install schema from " + resource, e);
    }
    logger.info("Installed intake schema from " + resource + " (" + statements.size() + " statements)");
  }

  static List<String> statements(String script) {
    StringBuilder current = new StringBuilder();
    List<String> statements = new ArrayList<>();
    for (String line : script.split("\n")) {
      String trimmed = line.strip();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(line).append('\n');
      if (trimmed.endsWith(";")) {
        String sql = current.toString().strip();
        statements.add(sql.substring(0, sql.length() - 1));
        current.setLength(0);
      }
    }
    if (!current.toString().isBlank()) {
      statements.add(current.toString().strip());
    }
    return statements;
  }

  private static String load(String resource) {
    try (InputStream in = JdbcSchema.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for dialect: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IntakeStoreException("Failed to read " + resource, e);
    }
  }
}
