package iocextract.jdbc.cache;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * H2 cache store, the default single-file cache ({@code jdbc:h2:file:./ioc_cache}).
 *
 * <p>Upserts with {@code MERGE INTO ... KEY (attribute_id)}. Backups use {@code BACKUP TO},
 * which writes a zip of the database files and needs a persistent (file) database.
 */
public final class H2CacheStore extends AbstractJdbcCacheStore {

  public H2CacheStore() {
    super();
  }

  public H2CacheStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2CacheStore withTableName(String tableName) {
    return new H2CacheStore(tableName);
  }

  @Override
  protected String createTableSql() {
    return "CREATE TABLE IF NOT EXISTS " + tableName() + " ("
        + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
        + "event_id BIGINT NOT NULL, "
        + "event_uuid VARCHAR(64), "
        + "event_info CHARACTER VARYING, "
        + "event_date VARCHAR(10), "
        + "event_timestamp VARCHAR(40), "
        + "attribute_id BIGINT NOT NULL UNIQUE, "
        + "attribute_type VARCHAR(100) NOT NULL, "
        + "attribute_category VARCHAR(255), "
        + "attribute_value CHARACTER VARYING NOT NULL, "
        + "attribute_timestamp VARCHAR(40), "
        + "attribute_comment CHARACTER VARYING NOT NULL, "
        + "attribute_to_ids INTEGER NOT NULL, "
        + "import_time VARCHAR(40) NOT NULL)";
  }

  @Override
  protected String upsertSql() {
    return "MERGE INTO " + tableName() + " (" + columnList() + ") KEY (attribute_id) VALUES ("
        + placeholders() + ")";
  }

  @Override
  protected Optional<String> backupSql(Path target) {
    return Optional.of("BACKUP TO '" + target.toAbsolutePath().toString().replace("'", "''") + "'");
  }
}
