package iocextract.jdbc.cache;

import iocextract.StorageException;
import iocextract.jdbc.JdbcTemplate;
import iocextract.jdbc.TableNames;
import iocextract.model.IocRecord;
import iocextract.spi.CacheSink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC cache store holding one row per MISP attribute id.
 *
 * <p>Date and time columns are stored as ISO-8601 text and {@code attribute_to_ids} as an
 * integer {@code 0}/{@code 1}. Subclasses supply the engine's DDL and its native upsert.
 * Register custom implementations via
 * {@code META-INF/services/iocextract.jdbc.cache.AbstractJdbcCacheStore}.
 *
 * @see JdbcCacheStores
 */
public abstract class AbstractJdbcCacheStore implements CacheSink {

  /** Columns in bind order, surrogate key excluded. */
  protected static final List<String> COLUMNS = List.of(
      "event_id", "event_uuid", "event_info", "event_date", "event_timestamp",
      "attribute_id", "attribute_type", "attribute_category", "attribute_value",
      "attribute_timestamp", "attribute_comment", "attribute_to_ids", "import_time");

  protected static final JdbcTemplate.RowMapper<IocRecord> RECORD_ROW_MAPPER = rs -> new IocRecord(
      rs.getLong("event_id"),
      rs.getString("event_uuid"),
      rs.getString("event_info"),
      parseDate(rs.getString("event_date")),
      parseInstant(rs.getString("event_timestamp")),
      rs.getLong("attribute_id"),
      rs.getString("attribute_type"),
      rs.getString("attribute_category"),
      rs.getString("attribute_value"),
      parseInstant(rs.getString("attribute_timestamp")),
      Objects.requireNonNullElse(rs.getString("attribute_comment"), ""),
      rs.getInt("attribute_to_ids") != 0,
      parseInstant(rs.getString("import_time")));

  private final String tableName;

  protected AbstractJdbcCacheStore() {
    this(TableNames.DEFAULT_CACHE_TABLE);
  }

  protected AbstractJdbcCacheStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this cache store (e.g., "h2", "mysql", "postgresql").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this cache store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same type writing to {@code tableName}.
   */
  public abstract AbstractJdbcCacheStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  /** {@code CREATE TABLE IF NOT EXISTS} statement for the cache table. */
  protected abstract String createTableSql();

  /** Upsert statement binding {@link #COLUMNS} in order. */
  protected abstract String upsertSql();

  /**
   * Lookup index statements run after the table is created. Each must be a no-op when the
   * index already exists.
   */
  protected List<String> createIndexSql() {
    return List.of(
        "CREATE INDEX IF NOT EXISTS " + indexName("attribute_type") + " ON " + tableName + " (attribute_type)",
        "CREATE INDEX IF NOT EXISTS " + indexName("attribute_value") + " ON " + tableName + " (attribute_value)",
        "CREATE INDEX IF NOT EXISTS " + indexName("event_id") + " ON " + tableName + " (event_id)");
  }

  /**
   * Statement copying the whole cache database to {@code target}, or empty when the engine
   * has no single-statement backup.
   */
  protected Optional<String> backupSql(Path target) {
    return Optional.empty();
  }

  protected String indexName(String column) {
    return "idx_" + tableName + "_" + column;
  }

  protected static String columnList() {
    return String.join(", ", COLUMNS);
  }

  protected static String placeholders() {
    return String.join(",", Collections.nCopies(COLUMNS.size(), "?"));
  }

  @Override
  public void ensureSchema(Connection conn) {
    try {
      JdbcTemplate.execute(conn, createTableSql());
      for (String sql : createIndexSql()) {
        JdbcTemplate.execute(conn, sql);
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to create cache table " + tableName, e);
    }
  }

  @Override
  public void write(Connection conn, IocRecord record) {
    Objects.requireNonNull(record, "record");
    try {
      JdbcTemplate.update(conn, upsertSql(), bindValues(record));
    } catch (SQLException e) {
      throw new StorageException("Failed to write attribute " + record.attributeId() + " to " + tableName, e);
    }
  }

  @Override
  public void backup(Connection conn, Path target) {
    Objects.requireNonNull(target, "target");
    String sql = backupSql(target).orElseThrow(() ->
        new UnsupportedOperationException("Cache store '" + name() + "' does not support backups"));
    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      JdbcTemplate.execute(conn, sql);
    } catch (IOException | SQLException e) {
      throw new StorageException("Failed to back up cache to " + target, e);
    }
  }

  /**
   * Number of cached records.
   */
  public long count(Connection conn) {
    try {
      List<Long> rows = JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName, rs -> rs.getLong(1));
      return rows.isEmpty() ? 0L : rows.get(0);
    } catch (SQLException e) {
      throw new StorageException("Failed to count rows in " + tableName, e);
    }
  }

  /**
   * Looks up the cached record for one MISP attribute.
   */
  public Optional<IocRecord> findByAttributeId(Connection conn, long attributeId) {
    try {
      List<IocRecord> rows = JdbcTemplate.query(conn,
          "SELECT " + columnList() + " FROM " + tableName + " WHERE attribute_id=?",
          RECORD_ROW_MAPPER, attributeId);
      return rows.stream().findFirst();
    } catch (SQLException e) {
      throw new StorageException("Failed to read attribute " + attributeId + " from " + tableName, e);
    }
  }

  /**
   * All cached records carrying the given indicator value, ordered by attribute id.
   */
  public List<IocRecord> findByAttributeValue(Connection conn, String attributeValue) {
    Objects.requireNonNull(attributeValue, "attributeValue");
    try {
      return JdbcTemplate.query(conn,
          "SELECT " + columnList() + " FROM " + tableName + " WHERE attribute_value=? ORDER BY attribute_id",
          RECORD_ROW_MAPPER, attributeValue);
    } catch (SQLException e) {
      throw new StorageException("Failed to look up value in " + tableName, e);
    }
  }

  static Object[] bindValues(IocRecord record) {
    return new Object[]{
        record.eventId(),
        record.eventUuid(),
        record.eventInfo(),
        record.eventDate() == null ? null : record.eventDate().toString(),
        record.eventTimestamp() == null ? null : record.eventTimestamp().toString(),
        record.attributeId(),
        record.attributeType(),
        record.attributeCategory(),
        record.attributeValue(),
        record.attributeTimestamp() == null ? null : record.attributeTimestamp().toString(),
        record.attributeComment(),
        record.attributeToIds() ? 1 : 0,
        record.importTime().toString()
    };
  }

  private static LocalDate parseDate(String text) {
    return text == null ? null : LocalDate.parse(text);
  }

  private static Instant parseInstant(String text) {
    return text == null ? null : Instant.parse(text);
  }
}
