package iocextract.jdbc.cache;

import java.util.List;

/**
 * PostgreSQL cache store. Upserts with {@code ON CONFLICT (attribute_id) DO UPDATE}.
 *
 * <p>{@code attribute_value} gets a hash index since it is only ever matched for equality.
 */
public final class PostgresCacheStore extends AbstractJdbcCacheStore {

  public PostgresCacheStore() {
    super();
  }

  public PostgresCacheStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresCacheStore withTableName(String tableName) {
    return new PostgresCacheStore(tableName);
  }

  @Override
  protected String createTableSql() {
    return "CREATE TABLE IF NOT EXISTS " + tableName() + " ("
        + "id BIGSERIAL PRIMARY KEY, "
        + "event_id BIGINT NOT NULL, "
        + "event_uuid VARCHAR(64), "
        + "event_info TEXT, "
        + "event_date VARCHAR(10), "
        + "event_timestamp VARCHAR(40), "
        + "attribute_id BIGINT NOT NULL UNIQUE, "
        + "attribute_type VARCHAR(100) NOT NULL, "
        + "attribute_category VARCHAR(255), "
        + "attribute_value TEXT NOT NULL, "
        + "attribute_timestamp VARCHAR(40), "
        + "attribute_comment TEXT NOT NULL, "
        + "attribute_to_ids INTEGER NOT NULL, "
        + "import_time VARCHAR(40) NOT NULL)";
  }

  @Override
  protected List<String> createIndexSql() {
    return List.of(
        "CREATE INDEX IF NOT EXISTS " + indexName("attribute_type") + " ON " + tableName() + " (attribute_type)",
        "CREATE INDEX IF NOT EXISTS " + indexName("attribute_value") + " ON " + tableName()
            + " USING hash (attribute_value)",
        "CREATE INDEX IF NOT EXISTS " + indexName("event_id") + " ON " + tableName() + " (event_id)");
  }

  @Override
  protected String upsertSql() {
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(tableName())
        .append(" (").append(columnList()).append(") VALUES (").append(placeholders())
        .append(") ON CONFLICT (attribute_id) DO UPDATE SET ");
    String sep = "";
    for (String column : COLUMNS) {
      if (!column.equals("attribute_id")) {
        sql.append(sep).append(column).append(" = EXCLUDED.").append(column);
        sep = ", ";
      }
    }
    return sql.toString();
  }
}
