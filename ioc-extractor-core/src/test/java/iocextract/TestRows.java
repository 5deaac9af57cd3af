package iocextract;

import iocextract.model.SourceRow;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Builders for source rows and stub JDBC connections shared by core tests.
 */
public final class TestRows {

  private TestRows() {}

  public static SourceRow row(long attributeId, String type, String value, Instant modified) {
    return new SourceRow(
        10L, "5f1c7e5a-0c1b-4f3a-9d51-4a4b1a7e0001", "Phishing campaign",
        LocalDate.of(2026, 10, 18), modified,
        attributeId, type, "Network activity", value, modified,
        "seen in mail logs", 1);
  }

  public static SourceRow withoutValue(long attributeId, Instant modified) {
    return new SourceRow(
        10L, "5f1c7e5a-0c1b-4f3a-9d51-4a4b1a7e0001", "Phishing campaign",
        LocalDate.of(2026, 10, 18), modified,
        attributeId, "ip-dst", "Network activity", null, modified,
        null, 0);
  }

  public static SourceRow withComment(SourceRow row, String comment) {
    return new SourceRow(row.eventId(), row.eventUuid(), row.eventInfo(), row.eventDate(),
        row.eventTimestamp(), row.attributeId(), row.attributeType(), row.attributeCategory(),
        row.attributeValue(), row.attributeTimestamp(), comment, row.attributeToIds());
  }

  public static Connection dummyConnection() {
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }
}
