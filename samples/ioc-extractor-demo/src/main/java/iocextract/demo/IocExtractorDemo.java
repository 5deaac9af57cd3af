package iocextract.demo;

import iocextract.IocExtractor;
import iocextract.RunSummary;
import iocextract.jdbc.DataSourceConnectionProvider;
import iocextract.jdbc.DriverManagerConnectionProvider;
import iocextract.jdbc.cache.AbstractJdbcCacheStore;
import iocextract.jdbc.cache.JdbcCacheStores;
import iocextract.jdbc.source.MispSourceReader;
import iocextract.model.IocRecord;
import iocextract.snapshot.JsonSnapshotSink;

import org.h2.jdbcx.JdbcDataSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Extracts IOCs from an in-memory MISP database into a JSON snapshot and an H2 cache file.
 *
 * <p>Run with: {@code mvn install -DskipTests && mvn -pl samples/ioc-extractor-demo exec:java}
 */
public final class IocExtractorDemo {

  public static void main(String[] args) throws Exception {
    Path outputDir = Path.of(args.length > 0 ? args[0] : "target/ioc-demo");
    Files.createDirectories(outputDir);

    // ── MISP source ─────────────────────────────────────────────
    JdbcDataSource misp = new JdbcDataSource();
    misp.setURL("jdbc:h2:mem:misp;MODE=MySQL;DB_CLOSE_DELAY=-1");
    createSchema(misp);
    Instant anHourAgo = Instant.now().minus(Duration.ofHours(1));
    Instant lastWeek = Instant.now().minus(Duration.ofDays(7));
    insertEvent(misp, 1, "Emotet distribution campaign", anHourAgo);
    insertAttribute(misp, 101, 1, "ip-dst", "Network activity", "203.0.113.7", anHourAgo, "C2 server", 1);
    insertAttribute(misp, 102, 1, "md5", "Payload delivery", "d41d8cd98f00b204e9800998ecf8427e", anHourAgo, null, 1);
    insertAttribute(misp, 103, 1, "domain", "Network activity", "stale.example", lastWeek, null, 1);
    insertAttribute(misp, 104, 1, "text", "Other", "not an indicator", anHourAgo, null, 0);

    // ── Extractor ───────────────────────────────────────────────
    String cacheUrl = "jdbc:h2:file:" + outputDir.toAbsolutePath().resolve("ioc_cache");
    AbstractJdbcCacheStore cacheStore = JdbcCacheStores.detect(cacheUrl);
    DriverManagerConnectionProvider cacheConnections = new DriverManagerConnectionProvider(cacheUrl);
    Path snapshot = outputDir.resolve("misp_recent_iocs.json");

    IocExtractor extractor = IocExtractor.builder()
        .sourceConnections(new DataSourceConnectionProvider(misp))
        .sourceReader(MispSourceReader.builder().queryTimeout(Duration.ofSeconds(30)).build())
        .cacheConnections(cacheConnections)
        .cacheSink(cacheStore)
        .snapshotSink(new JsonSnapshotSink(snapshot))
        .lookback(Duration.ofHours(24))
        .attributeTypes(List.of("ip-src", "ip-dst", "domain", "hostname", "url", "md5", "sha1", "sha256"))
        .build();

    System.out.println("=== MISP IOC Extractor Demo ===\n");
    report("First run", extractor.runOnce());
    report("Second run (idempotent)", extractor.runOnce());

    // ── Snapshot & cache ────────────────────────────────────────
    System.out.println("\n=== Snapshot " + snapshot + " ===");
    System.out.println(Files.readString(snapshot));

    System.out.println("=== Cache " + cacheUrl + " ===");
    try (Connection conn = cacheConnections.getConnection()) {
      System.out.println("rows: " + cacheStore.count(conn));
      for (long attributeId : new long[]{101, 102, 103}) {
        System.out.printf("%-4d -> %s%n", attributeId,
            cacheStore.findByAttributeId(conn, attributeId).map(IocRecord::attributeValue).orElse("(not cached)"));
      }
    }

    System.out.println("\nDemo complete.");
  }

  private static void report(String label, RunSummary summary) {
    System.out.printf("%-24s state=%s rowsRead=%d normalized=%d dropped=%d cacheWrites=%d snapshot=%s%s%n",
        label + ":", summary.state(), summary.rowsRead(), summary.recordsNormalized(),
        summary.recordsDropped(), summary.cacheWrites(), summary.snapshotWritten(),
        summary.errorMessage().map(e -> " error=" + e).orElse(""));
  }

  private static void createSchema(JdbcDataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute(
          "CREATE TABLE events (" +
              "id INT PRIMARY KEY," +
              "uuid VARCHAR(40) NOT NULL," +
              "info TEXT NOT NULL," +
              "date DATE NOT NULL," +
              "timestamp INT NOT NULL" +
              ")");
      stmt.execute(
          "CREATE TABLE attributes (" +
              "id INT PRIMARY KEY," +
              "event_id INT NOT NULL," +
              "type VARCHAR(100) NOT NULL," +
              "category VARCHAR(255) NOT NULL," +
              "value1 TEXT NOT NULL," +
              "timestamp INT NOT NULL," +
              "comment TEXT," +
              "to_ids TINYINT NOT NULL" +
              ")");
    }
  }

  private static void insertEvent(JdbcDataSource dataSource, int id, String info, Instant modified)
      throws SQLException {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "INSERT INTO events (id, uuid, info, date, timestamp) VALUES (?, RANDOM_UUID(), ?, CURRENT_DATE, ?)")) {
      ps.setInt(1, id);
      ps.setString(2, info);
      ps.setLong(3, modified.getEpochSecond());
      ps.executeUpdate();
    }
  }

  private static void insertAttribute(JdbcDataSource dataSource, int id, int eventId, String type,
      String category, String value, Instant modified, String comment, int toIds) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "INSERT INTO attributes (id, event_id, type, category, value1, timestamp, comment, to_ids) "
                 + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
      ps.setInt(1, id);
      ps.setInt(2, eventId);
      ps.setString(3, type);
      ps.setString(4, category);
      ps.setString(5, value);
      ps.setLong(6, modified.getEpochSecond());
      ps.setString(7, comment);
      ps.setInt(8, toIds);
      ps.executeUpdate();
    }
  }
}
