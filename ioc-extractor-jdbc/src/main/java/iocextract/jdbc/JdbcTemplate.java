package iocextract.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in source readers and cache stores.
 *
 * <p>Methods propagate {@link SQLException}; callers translate it into the extraction error
 * that fits their side of the run.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute a DDL statement without parameters. */
  public static void execute(Connection conn, String sql) throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(sql);
    }
  }

  /** Execute INSERT/UPDATE/MERGE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    return query(conn, sql, 0, mapper, params);
  }

  /**
   * Execute SELECT with a statement timeout, map rows.
   *
   * @param timeoutSeconds JDBC query timeout; {@code 0} means no limit
   * @throws java.sql.SQLTimeoutException if the driver cancels the statement on timeout
   */
  public static <T> List<T> query(Connection conn, String sql, int timeoutSeconds,
      RowMapper<T> mapper, Object... params) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      if (timeoutSeconds > 0) {
        ps.setQueryTimeout(timeoutSeconds);
      }
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    }
  }

  /** Returns the column as a {@link Long}, or {@code null} for SQL NULL. */
  public static Long getNullableLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
