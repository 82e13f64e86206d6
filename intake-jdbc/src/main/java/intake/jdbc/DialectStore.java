package intake.jdbc;

import java.util.List;

/**
 * A store implementation bound to one database family.
 */
public interface DialectStore {

  /**
   * Unique identifier for this store's database (e.g., "postgresql", "h2"). Also
   * selects the DDL script installed by {@link JdbcSchema}.
   */
  String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();
}
