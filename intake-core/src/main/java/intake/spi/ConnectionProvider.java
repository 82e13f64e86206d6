package intake.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for queue, message-store and dead-letter operations.
 *
 * <p>Every call hands out a fresh connection that the caller closes. Components never
 * share a connection across threads.
 *
 * @see intake.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
