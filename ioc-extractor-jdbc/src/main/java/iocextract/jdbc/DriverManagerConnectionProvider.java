package iocextract.jdbc;

import iocextract.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Unpooled {@link ConnectionProvider} opening a fresh {@link DriverManager} connection per call.
 *
 * <p>Suited to the embedded cache file: an H2 file database is closed as soon as its last
 * connection is, so no file lock survives between runs.
 */
public final class DriverManagerConnectionProvider implements ConnectionProvider {
  private final String url;
  private final String username;
  private final String password;

  public DriverManagerConnectionProvider(String url) {
    this(url, null, null);
  }

  public DriverManagerConnectionProvider(String url, String username, String password) {
    this.url = Objects.requireNonNull(url, "url");
    if (url.isBlank()) {
      throw new IllegalArgumentException("url must not be blank");
    }
    this.username = username;
    this.password = password;
  }

  public String url() {
    return url;
  }

  @Override
  public Connection getConnection() throws SQLException {
    if (username == null) {
      return DriverManager.getConnection(url);
    }
    return DriverManager.getConnection(url, username, password);
  }
}
