package iocextract.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the extractor, one per run phase: the source connection for
 * reading and the cache connection for writing.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see iocextract.jdbc.DataSourceConnectionProvider
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
