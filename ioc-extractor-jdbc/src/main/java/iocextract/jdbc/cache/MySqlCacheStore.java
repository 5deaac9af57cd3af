package iocextract.jdbc.cache;

import java.util.List;

/**
 * MySQL/TiDB cache store for deployments sharing one cache between extractors.
 *
 * <p>MySQL has no {@code CREATE INDEX IF NOT EXISTS}, so the lookup indexes are declared in
 * the table definition. {@code attribute_value} is indexed on its first 255 characters.
 */
public final class MySqlCacheStore extends AbstractJdbcCacheStore {

  public MySqlCacheStore() {
    super();
  }

  public MySqlCacheStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public MySqlCacheStore withTableName(String tableName) {
    return new MySqlCacheStore(tableName);
  }

  @Override
  protected String createTableSql() {
    return "CREATE TABLE IF NOT EXISTS " + tableName() + " ("
        + "id BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY, "
        + "event_id BIGINT NOT NULL, "
        + "event_uuid VARCHAR(64), "
        + "event_info TEXT, "
        + "event_date VARCHAR(10), "
        + "event_timestamp VARCHAR(40), "
        + "attribute_id BIGINT NOT NULL, "
        + "attribute_type VARCHAR(100) NOT NULL, "
        + "attribute_category VARCHAR(255), "
        + "attribute_value TEXT NOT NULL, "
        + "attribute_timestamp VARCHAR(40), "
        + "attribute_comment TEXT NOT NULL, "
        + "attribute_to_ids INT NOT NULL, "
        + "import_time VARCHAR(40) NOT NULL, "
        + "UNIQUE KEY uk_" + tableName() + "_attribute_id (attribute_id), "
        + "KEY " + indexName("attribute_type") + " (attribute_type), "
        + "KEY " + indexName("attribute_value") + " (attribute_value(255)), "
        + "KEY " + indexName("event_id") + " (event_id)"
        + ") DEFAULT CHARSET=utf8mb4";
  }

  @Override
  protected List<String> createIndexSql() {
    return List.of();
  }

  @Override
  protected String upsertSql() {
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(tableName())
        .append(" (").append(columnList()).append(") VALUES (").append(placeholders())
        .append(") ON DUPLICATE KEY UPDATE ");
    String sep = "";
    for (String column : COLUMNS) {
      if (!column.equals("attribute_id")) {
        sql.append(sep).append(column).append("=VALUES(").append(column).append(")");
        sep = ", ";
      }
    }
    return sql.toString();
  }
}
