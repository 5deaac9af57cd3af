package iocextract.jdbc;

import java.util.Objects;

/**
 * Identifier validation for table names spliced into SQL text.
 */
public final class TableNames {
  public static final String DEFAULT_CACHE_TABLE = "misp_iocs";
  public static final String DEFAULT_EVENTS_TABLE = "events";
  public static final String DEFAULT_ATTRIBUTES_TABLE = "attributes";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
