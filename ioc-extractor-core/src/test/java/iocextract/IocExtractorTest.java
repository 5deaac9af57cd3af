package iocextract;

import iocextract.model.ExtractionWindow;
import iocextract.model.IocRecord;
import iocextract.model.SourceRow;
import iocextract.spi.CacheSink;
import iocextract.spi.ConnectionProvider;
import iocextract.spi.MetricsExporter;
import iocextract.spi.SnapshotSink;
import iocextract.spi.SourceReader;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class IocExtractorTest {

  private static final Instant NOW = Instant.parse("2026-10-19T02:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  private static final Instant ONE_HOUR_AGO = NOW.minus(Duration.ofHours(1));

  @Test
  void endToEndWritesBothSinks() {
    StubSourceReader source = new StubSourceReader(List.of(
        TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO),
        TestRows.row(102, "md5", "d41d8cd98f00b204e9800998ecf8427e", ONE_HOUR_AGO)));
    MapCacheSink cache = new MapCacheSink();
    ListSnapshotSink snapshot = new ListSnapshotSink();

    RunSummary summary = extractor(source, cache, snapshot).runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertEquals(2, summary.rowsRead());
    assertEquals(2, summary.recordsNormalized());
    assertEquals(0, summary.recordsDropped());
    assertEquals(2, summary.cacheWrites());
    assertTrue(summary.snapshotWritten());
    assertNull(summary.error());
    assertFalse(summary.isDegraded());

    assertEquals(Set.of(101L, 102L), cache.rows.keySet());
    assertEquals(2, snapshot.lastWrite.size());
    assertEquals(NOW, snapshot.lastWrite.get(0).importTime());
  }

  @Test
  void passesWindowAndAllowlistToReader() {
    StubSourceReader source = new StubSourceReader(List.of());

    IocExtractor.builder()
        .sourceConnections(TestRows::dummyConnection)
        .sourceReader(source)
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(new MapCacheSink())
        .snapshotSink(new ListSnapshotSink())
        .lookback(Duration.ofHours(6))
        .attributeTypes(List.of("ip-dst", "md5", "ip-dst"))
        .clock(CLOCK)
        .build()
        .runOnce();

    assertEquals(new ExtractionWindow(NOW.minus(Duration.ofHours(6)), NOW), source.lastWindow);
    assertEquals(Set.of("ip-dst", "md5"), source.lastTypes);
  }

  @Test
  void repeatedRunsDoNotDuplicateCacheRows() {
    StubSourceReader source = new StubSourceReader(List.of(
        TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO),
        TestRows.row(102, "md5", "d41d8cd98f00b204e9800998ecf8427e", ONE_HOUR_AGO)));
    MapCacheSink cache = new MapCacheSink();
    IocExtractor extractor = extractor(source, cache, new ListSnapshotSink());

    extractor.runOnce();
    int afterFirst = cache.rows.size();
    extractor.runOnce();

    assertEquals(afterFirst, cache.rows.size());
    assertEquals(4, cache.writeCount.get());
  }

  @Test
  void latestCommentWinsInCache() {
    SourceRow first = TestRows.withComment(TestRows.row(456, "ip-dst", "203.0.113.7", ONE_HOUR_AGO), "first");
    SourceRow second = TestRows.withComment(first, "second");
    StubSourceReader source = new StubSourceReader(List.of(first));
    MapCacheSink cache = new MapCacheSink();
    IocExtractor extractor = extractor(source, cache, new ListSnapshotSink());

    extractor.runOnce();
    source.rows = List.of(second);
    extractor.runOnce();

    assertEquals(1, cache.rows.size());
    assertEquals("second", cache.rows.get(456L).attributeComment());
  }

  @Test
  void malformedRowsAreDroppedAndCounted() {
    StubSourceReader source = new StubSourceReader(List.of(
        TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO),
        TestRows.withoutValue(102, ONE_HOUR_AGO),
        TestRows.row(103, "domain", "evil.example", ONE_HOUR_AGO)));
    MapCacheSink cache = new MapCacheSink();
    ListSnapshotSink snapshot = new ListSnapshotSink();

    RunSummary summary = extractor(source, cache, snapshot).runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertEquals(3, summary.rowsRead());
    assertEquals(2, summary.recordsNormalized());
    assertEquals(1, summary.recordsDropped());
    assertEquals(2, summary.cacheWrites());
    assertEquals(Set.of(101L, 103L), cache.rows.keySet());
    assertEquals(2, snapshot.lastWrite.size());
  }

  @Test
  void emptyResultStillWritesSnapshot() {
    ListSnapshotSink snapshot = new ListSnapshotSink();

    RunSummary summary = extractor(new StubSourceReader(List.of()), new MapCacheSink(), snapshot).runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertTrue(summary.snapshotWritten());
    assertEquals(List.of(), snapshot.lastWrite);
  }

  @Test
  void unreachableSourceFailsWithoutWrites() {
    MapCacheSink cache = new MapCacheSink();
    ListSnapshotSink snapshot = new ListSnapshotSink();
    IocExtractor extractor = IocExtractor.builder()
        .sourceConnections(() -> { throw new SQLException("Access denied for user 'misp'", "28000"); })
        .sourceReader(new StubSourceReader(List.of()))
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(cache)
        .snapshotSink(snapshot)
        .attributeTypes(List.of("ip-dst"))
        .clock(CLOCK)
        .build();

    RunSummary summary = extractor.runOnce();

    assertEquals(RunState.FAILED, summary.state());
    assertEquals(RunState.FAILED, extractor.state());
    assertTrue(summary.error().contains("connect"));
    assertEquals(0, summary.rowsRead());
    assertEquals(0, summary.cacheWrites());
    assertFalse(summary.snapshotWritten());
    assertEquals(0, cache.writeCount.get());
    assertNull(snapshot.lastWrite);
  }

  @Test
  void queryFailureFailsWithoutWrites() {
    StubSourceReader source = new StubSourceReader(List.of());
    source.failure = new SourceQueryException("Source query exceeded timeout", null);
    ListSnapshotSink snapshot = new ListSnapshotSink();

    RunSummary summary = extractor(source, new MapCacheSink(), snapshot).runOnce();

    assertTrue(summary.isFailed());
    assertEquals("Source query exceeded timeout", summary.error());
    assertNull(snapshot.lastWrite);
  }

  @Test
  void sourceConnectionIsClosedWhenQueryFails() {
    AtomicInteger closed = new AtomicInteger();
    StubSourceReader source = new StubSourceReader(List.of());
    source.failure = new SourceQueryException("bad filter", null);

    IocExtractor.builder()
        .sourceConnections(closeCounting(closed))
        .sourceReader(source)
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(new MapCacheSink())
        .snapshotSink(new ListSnapshotSink())
        .attributeTypes(List.of("ip-dst"))
        .clock(CLOCK)
        .build()
        .runOnce();

    assertEquals(1, closed.get());
  }

  @Test
  void sourceReleaseFailureKeepsRetrievedRows() {
    ListSnapshotSink snapshot = new ListSnapshotSink();
    ConnectionProvider closeFails = () -> (Connection) java.lang.reflect.Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          if ("close".equals(method.getName())) {
            throw new SQLException("Communications link failure", "08S01");
          }
          return null;
        });

    RunSummary summary = IocExtractor.builder()
        .sourceConnections(closeFails)
        .sourceReader(new StubSourceReader(List.of(
            TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO),
            TestRows.row(102, "md5", "d41d8cd98f00b204e9800998ecf8427e", ONE_HOUR_AGO))))
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(new MapCacheSink())
        .snapshotSink(snapshot)
        .attributeTypes(List.of("ip-dst", "md5"))
        .clock(CLOCK)
        .build()
        .runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertNull(summary.error());
    assertEquals(2, summary.recordsNormalized());
    assertEquals(2, summary.cacheWrites());
    assertEquals(2, snapshot.lastWrite.size());
  }

  @Test
  void cacheIsBackedUpBeforeWriting() {
    MapCacheSink cache = new MapCacheSink();
    cache.rows.put(7L, null);
    Path backup = Path.of("backups", "ioc_cache_yesterday.zip");

    RunSummary summary = IocExtractor.builder()
        .sourceConnections(TestRows::dummyConnection)
        .sourceReader(new StubSourceReader(List.of(TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO))))
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(cache)
        .snapshotSink(new ListSnapshotSink())
        .cacheBackup(backup)
        .attributeTypes(List.of("ip-dst"))
        .clock(CLOCK)
        .build()
        .runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertEquals(backup.toAbsolutePath(), cache.backupTarget);
    assertEquals(Set.of(7L), cache.rowsAtBackup);
    assertEquals(Set.of(7L, 101L), cache.rows.keySet());
  }

  @Test
  void failedBackupDoesNotDegradeTheRun() {
    MapCacheSink cache = new MapCacheSink();
    cache.backupFailure = new StorageException("backup target is read-only", null);

    RunSummary summary = backedUpExtractor(cache).runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertFalse(summary.isDegraded());
    assertEquals(1, summary.cacheWrites());
  }

  @Test
  void unsupportedBackupDoesNotDegradeTheRun() {
    CacheSink noBackup = new CacheSink() {
      @Override
      public void ensureSchema(Connection conn) {
      }

      @Override
      public void write(Connection conn, IocRecord record) {
      }
    };

    RunSummary summary = backedUpExtractor(noBackup).runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertNull(summary.error());
    assertEquals(1, summary.cacheWrites());
  }

  @Test
  void backupIsOffByDefault() {
    MapCacheSink cache = new MapCacheSink();

    IocExtractor extractor = extractor(
        new StubSourceReader(List.of(TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO))),
        cache, new ListSnapshotSink());
    extractor.runOnce();

    assertNull(extractor.cacheBackup());
    assertNull(cache.backupTarget);
  }

  @Test
  void cacheFailureDegradesButKeepsSnapshot() {
    StubSourceReader source = new StubSourceReader(List.of(
        TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO),
        TestRows.row(102, "ip-dst", "203.0.113.8", ONE_HOUR_AGO),
        TestRows.row(103, "ip-dst", "203.0.113.9", ONE_HOUR_AGO)));
    MapCacheSink cache = new MapCacheSink();
    cache.failOnAttributeId = 102L;
    ListSnapshotSink snapshot = new ListSnapshotSink();

    RunSummary summary = extractor(source, cache, snapshot).runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertTrue(summary.isDegraded());
    assertEquals(3, summary.recordsNormalized());
    assertEquals(1, summary.cacheWrites());
    assertTrue(summary.snapshotWritten());
    assertTrue(summary.error().startsWith("cache: "));
    assertEquals(Set.of(101L), cache.rows.keySet());
    assertEquals(3, snapshot.lastWrite.size());
  }

  @Test
  void unreachableCacheDegradesButKeepsSnapshot() {
    ListSnapshotSink snapshot = new ListSnapshotSink();
    RunSummary summary = IocExtractor.builder()
        .sourceConnections(TestRows::dummyConnection)
        .sourceReader(new StubSourceReader(List.of(TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO))))
        .cacheConnections(() -> { throw new SQLException("Database may be already in use"); })
        .cacheSink(new MapCacheSink())
        .snapshotSink(snapshot)
        .attributeTypes(List.of("ip-dst"))
        .clock(CLOCK)
        .build()
        .runOnce();

    assertTrue(summary.isDegraded());
    assertEquals(0, summary.cacheWrites());
    assertTrue(summary.snapshotWritten());
    assertEquals(1, snapshot.lastWrite.size());
  }

  @Test
  void snapshotFailureDegradesButKeepsCache() {
    MapCacheSink cache = new MapCacheSink();
    SnapshotSink failing = records -> { throw new StorageException("disk full", null); };

    RunSummary summary = extractor(
        new StubSourceReader(List.of(TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO))),
        cache, failing).runOnce();

    assertEquals(RunState.DONE, summary.state());
    assertTrue(summary.isDegraded());
    assertEquals(1, summary.cacheWrites());
    assertFalse(summary.snapshotWritten());
    assertEquals("snapshot: disk full", summary.error());
  }

  @Test
  void bothSinksFailingFailsTheRun() {
    MapCacheSink cache = new MapCacheSink();
    cache.failOnAttributeId = 101L;
    SnapshotSink failing = records -> { throw new StorageException("read-only file system", null); };

    RunSummary summary = extractor(
        new StubSourceReader(List.of(TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO))),
        cache, failing).runOnce();

    assertEquals(RunState.FAILED, summary.state());
    assertEquals(1, summary.rowsRead());
    assertEquals(1, summary.recordsNormalized());
    assertTrue(summary.error().contains("cache: "));
    assertTrue(summary.error().contains("snapshot: "));
  }

  @Test
  void concurrentRunIsRejected() throws Exception {
    CountDownLatch reading = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    SourceReader blocking = (conn, window, types) -> {
      reading.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return List.of();
    };
    IocExtractor extractor = extractor(blocking, new MapCacheSink(), new ListSnapshotSink());

    AtomicReference<RunSummary> first = new AtomicReference<>();
    Thread runner = new Thread(() -> first.set(extractor.runOnce()));
    runner.start();
    assertTrue(reading.await(5, TimeUnit.SECONDS));
    assertEquals(RunState.READING, extractor.state());

    assertThrows(RunInProgressException.class, extractor::runOnce);

    release.countDown();
    runner.join(5000);
    assertEquals(RunState.DONE, first.get().state());
    assertSame(first.get(), extractor.lastSummary());
    assertDoesNotThrow(extractor::runOnce);
  }

  @Test
  void exportsRunMetrics() {
    RecordingMetrics metrics = new RecordingMetrics();
    IocExtractor extractor = IocExtractor.builder()
        .sourceConnections(TestRows::dummyConnection)
        .sourceReader(new StubSourceReader(List.of(
            TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO),
            TestRows.withoutValue(102, ONE_HOUR_AGO))))
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(new MapCacheSink())
        .snapshotSink(new ListSnapshotSink())
        .attributeTypes(List.of("ip-dst"))
        .metrics(metrics)
        .clock(CLOCK)
        .build();

    extractor.runOnce();

    assertEquals(2, metrics.rowsRead);
    assertEquals(1, metrics.normalized);
    assertEquals(1, metrics.dropped);
    assertEquals(1, metrics.cacheWrites);
    assertEquals(1, metrics.completed);
    assertEquals(0, metrics.degraded);
    assertEquals(0, metrics.failed);
    assertEquals(1, metrics.lastRecords);
  }

  @Test
  void stateIsIdleBeforeFirstRun() {
    IocExtractor extractor = extractor(new StubSourceReader(List.of()), new MapCacheSink(), new ListSnapshotSink());

    assertEquals(RunState.IDLE, extractor.state());
    assertNull(extractor.lastSummary());
  }

  @Test
  void builderRejectsMissingComponents() {
    assertThrows(NullPointerException.class, () -> IocExtractor.builder()
        .sourceReader(new StubSourceReader(List.of()))
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(new MapCacheSink())
        .snapshotSink(new ListSnapshotSink())
        .attributeTypes(List.of("ip-dst"))
        .build());
    assertThrows(NullPointerException.class, () -> IocExtractor.builder()
        .sourceConnections(TestRows::dummyConnection)
        .sourceReader(new StubSourceReader(List.of()))
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(new MapCacheSink())
        .snapshotSink(new ListSnapshotSink())
        .build());
  }

  @Test
  void builderRejectsEmptyAllowlist() {
    assertThrows(IllegalArgumentException.class, () -> baseBuilder().attributeTypes(List.of()).build());
  }

  @Test
  void builderRejectsNonPositiveLookback() {
    assertThrows(IllegalArgumentException.class, () -> baseBuilder().lookback(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> baseBuilder().lookback(Duration.ofHours(-1)).build());
  }

  // ── Helpers ─────────────────────────────────────────────────────

  private static IocExtractor.Builder baseBuilder() {
    return IocExtractor.builder()
        .sourceConnections(TestRows::dummyConnection)
        .sourceReader(new StubSourceReader(List.of()))
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(new MapCacheSink())
        .snapshotSink(new ListSnapshotSink())
        .attributeTypes(List.of("ip-dst"));
  }

  private static IocExtractor extractor(SourceReader source, CacheSink cache, SnapshotSink snapshot) {
    return IocExtractor.builder()
        .sourceConnections(TestRows::dummyConnection)
        .sourceReader(source)
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(cache)
        .snapshotSink(snapshot)
        .lookback(Duration.ofHours(24))
        .attributeTypes(List.of("ip-dst", "md5", "domain"))
        .clock(CLOCK)
        .build();
  }

  private static IocExtractor backedUpExtractor(CacheSink cache) {
    return IocExtractor.builder()
        .sourceConnections(TestRows::dummyConnection)
        .sourceReader(new StubSourceReader(List.of(TestRows.row(101, "ip-dst", "203.0.113.7", ONE_HOUR_AGO))))
        .cacheConnections(TestRows::dummyConnection)
        .cacheSink(cache)
        .snapshotSink(new ListSnapshotSink())
        .cacheBackup(Path.of("ioc_cache_yesterday.zip"))
        .attributeTypes(List.of("ip-dst"))
        .clock(CLOCK)
        .build();
  }

  private static ConnectionProvider closeCounting(AtomicInteger closed) {
    return () -> (Connection) java.lang.reflect.Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          if ("close".equals(method.getName())) {
            closed.incrementAndGet();
          }
          return null;
        });
  }

  static final class StubSourceReader implements SourceReader {
    volatile List<SourceRow> rows;
    volatile RuntimeException failure;
    volatile ExtractionWindow lastWindow;
    volatile Set<String> lastTypes;

    StubSourceReader(List<SourceRow> rows) {
      this.rows = rows;
    }

    @Override
    public List<SourceRow> read(Connection conn, ExtractionWindow window, Set<String> attributeTypes) {
      lastWindow = window;
      lastTypes = attributeTypes;
      if (failure != null) {
        throw failure;
      }
      return rows;
    }
  }

  static final class MapCacheSink implements CacheSink {
    final Map<Long, IocRecord> rows = new TreeMap<>();
    final AtomicInteger writeCount = new AtomicInteger();
    Long failOnAttributeId;
    RuntimeException backupFailure;
    Path backupTarget;
    Set<Long> rowsAtBackup;

    @Override
    public void ensureSchema(Connection conn) {
    }

    @Override
    public void backup(Connection conn, Path target) {
      if (backupFailure != null) {
        throw backupFailure;
      }
      backupTarget = target;
      rowsAtBackup = Set.copyOf(rows.keySet());
    }

    @Override
    public void write(Connection conn, IocRecord record) {
      if (failOnAttributeId != null && failOnAttributeId == record.attributeId()) {
        throw new StorageException("cache file is read-only", null);
      }
      writeCount.incrementAndGet();
      rows.put(record.attributeId(), record);
    }
  }

  static final class ListSnapshotSink implements SnapshotSink {
    List<IocRecord> lastWrite;

    @Override
    public void write(List<IocRecord> records) {
      lastWrite = new ArrayList<>(records);
    }
  }

  static final class RecordingMetrics implements MetricsExporter {
    int rowsRead;
    int normalized;
    int dropped;
    int cacheWrites;
    int completed;
    int degraded;
    int failed;
    int lastRecords;

    @Override
    public void incrementRowsRead(int count) {
      rowsRead += count;
    }

    @Override
    public void incrementRecordsNormalized(int count) {
      normalized += count;
    }

    @Override
    public void incrementRecordsDropped(int count) {
      dropped += count;
    }

    @Override
    public void incrementCacheWrites(int count) {
      cacheWrites += count;
    }

    @Override
    public void incrementRunCompleted() {
      completed++;
    }

    @Override
    public void incrementRunDegraded() {
      degraded++;
    }

    @Override
    public void incrementRunFailed() {
      failed++;
    }

    @Override
    public void recordLastRunRecords(int records) {
      lastRecords = records;
    }
  }
}
