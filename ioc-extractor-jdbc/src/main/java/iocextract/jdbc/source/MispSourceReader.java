package iocextract.jdbc.source;

import iocextract.SourceConnectionException;
import iocextract.SourceQueryException;
import iocextract.jdbc.JdbcTemplate;
import iocextract.jdbc.TableNames;
import iocextract.model.ExtractionWindow;
import iocextract.model.SourceRow;
import iocextract.spi.SourceReader;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads recently modified MISP attributes joined with their events in a single query.
 *
 * <p>Rows are filtered on the attribute {@code timestamp} (Unix seconds) against both
 * inclusive window bounds and on the attribute type allowlist, then ordered by attribute id.
 * The reader never writes to the source.
 *
 * <pre>{@code
 * MispSourceReader reader = MispSourceReader.builder()
 *     .queryTimeout(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public final class MispSourceReader implements SourceReader {
  private static final Logger logger = Logger.getLogger(MispSourceReader.class.getName());

  private static final JdbcTemplate.RowMapper<SourceRow> ROW_MAPPER = rs -> new SourceRow(
      JdbcTemplate.getNullableLong(rs, "event_id"),
      rs.getString("event_uuid"),
      rs.getString("event_info"),
      rs.getObject("event_date", LocalDate.class),
      epochSeconds(JdbcTemplate.getNullableLong(rs, "event_timestamp")),
      JdbcTemplate.getNullableLong(rs, "attribute_id"),
      rs.getString("attribute_type"),
      rs.getString("attribute_category"),
      rs.getString("attribute_value"),
      epochSeconds(JdbcTemplate.getNullableLong(rs, "attribute_timestamp")),
      rs.getString("attribute_comment"),
      rs.getObject("attribute_to_ids"));

  private final String eventsTable;
  private final String attributesTable;
  private final Duration queryTimeout;

  private MispSourceReader(Builder builder) {
    this.eventsTable = TableNames.validate(builder.eventsTable);
    this.attributesTable = TableNames.validate(builder.attributesTable);
    this.queryTimeout = builder.queryTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reader over the stock {@code events} and {@code attributes} tables with no timeout. */
  public static MispSourceReader withDefaults() {
    return builder().build();
  }

  public String eventsTable() {
    return eventsTable;
  }

  public String attributesTable() {
    return attributesTable;
  }

  public Duration queryTimeout() {
    return queryTimeout;
  }

  @Override
  public List<SourceRow> read(Connection conn, ExtractionWindow window, Set<String> attributeTypes) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(attributeTypes, "attributeTypes");
    if (attributeTypes.isEmpty()) {
      throw new SourceQueryException("Attribute type allowlist must not be empty", null);
    }
    List<Object> params = new ArrayList<>(attributeTypes.size() + 2);
    for (String type : attributeTypes) {
      if (type == null || type.isBlank()) {
        throw new SourceQueryException("Attribute type allowlist contains a blank entry", null);
      }
      params.add(type);
    }
    params.add(window.fromEpochSecond());
    params.add(window.toEpochSecond());

    long started = System.nanoTime();
    try {
      List<SourceRow> rows = JdbcTemplate.query(conn, selectSql(attributeTypes.size()),
          timeoutSeconds(), ROW_MAPPER, params.toArray());
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE, "Read {0} rows from {1} in {2} ms", new Object[]{
            rows.size(), window, Duration.ofNanos(System.nanoTime() - started).toMillis()});
      }
      return Collections.unmodifiableList(rows);
    } catch (SQLTimeoutException e) {
      throw new SourceQueryException("Source query exceeded timeout of " + queryTimeout, e);
    } catch (SQLException e) {
      if (isConnectionFailure(e)) {
        throw new SourceConnectionException("Lost connection to source database: " + e.getMessage(), e);
      }
      throw new SourceQueryException("Source query failed: " + e.getMessage(), e);
    }
  }

  String selectSql(int typeCount) {
    String placeholders = String.join(",", Collections.nCopies(typeCount, "?"));
    return "SELECT e.id AS event_id, e.uuid AS event_uuid, e.info AS event_info, "
        + "e.date AS event_date, e.timestamp AS event_timestamp, "
        + "a.id AS attribute_id, a.type AS attribute_type, a.category AS attribute_category, "
        + "a.value1 AS attribute_value, a.timestamp AS attribute_timestamp, "
        + "a.comment AS attribute_comment, a.to_ids AS attribute_to_ids "
        + "FROM " + attributesTable + " a "
        + "JOIN " + eventsTable + " e ON e.id = a.event_id "
        + "WHERE a.type IN (" + placeholders + ") "
        + "AND a.timestamp >= ? AND a.timestamp <= ? "
        + "ORDER BY a.id";
  }

  private int timeoutSeconds() {
    if (queryTimeout.isZero()) {
      return 0;
    }
    long seconds = queryTimeout.toSeconds();
    if (queryTimeout.toNanosPart() > 0) {
      seconds++;
    }
    return (int) Math.min(seconds, Integer.MAX_VALUE);
  }

  static boolean isConnectionFailure(SQLException e) {
    if (e instanceof SQLNonTransientConnectionException || e instanceof SQLTransientConnectionException) {
      return true;
    }
    String state = e.getSQLState();
    // 08: connection exception, 28: invalid authorization
    return state != null && (state.startsWith("08") || state.startsWith("28"));
  }

  private static Instant epochSeconds(Long seconds) {
    return seconds == null ? null : Instant.ofEpochSecond(seconds);
  }

  public static final class Builder {
    private String eventsTable = TableNames.DEFAULT_EVENTS_TABLE;
    private String attributesTable = TableNames.DEFAULT_ATTRIBUTES_TABLE;
    private Duration queryTimeout = Duration.ZERO;

    private Builder() {}

    public Builder eventsTable(String eventsTable) {
      this.eventsTable = Objects.requireNonNull(eventsTable, "eventsTable");
      return this;
    }

    public Builder attributesTable(String attributesTable) {
      this.attributesTable = Objects.requireNonNull(attributesTable, "attributesTable");
      return this;
    }

    /**
     * JDBC statement timeout for the source query; {@link Duration#ZERO} disables it.
     * Sub-second remainders round up to the next whole second.
     */
    public Builder queryTimeout(Duration queryTimeout) {
      Objects.requireNonNull(queryTimeout, "queryTimeout");
      if (queryTimeout.isNegative()) {
        throw new IllegalArgumentException("queryTimeout must not be negative");
      }
      this.queryTimeout = queryTimeout;
      return this;
    }

    public MispSourceReader build() {
      return new MispSourceReader(this);
    }
  }
}
