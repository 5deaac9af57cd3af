package iocextract;

import iocextract.model.ExtractionWindow;
import iocextract.model.IocRecord;
import iocextract.model.SourceRow;
import iocextract.normalize.RecordNormalizer;
import iocextract.spi.CacheSink;
import iocextract.spi.ConnectionProvider;
import iocextract.spi.MetricsExporter;
import iocextract.spi.SnapshotSink;
import iocextract.spi.SourceReader;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one extraction: reads recently modified MISP attributes, normalizes them and writes the
 * records to the cache and snapshot sinks.
 *
 * <p>A run moves through {@link RunState#READING}, {@link RunState#NORMALIZING} and
 * {@link RunState#WRITING} to {@link RunState#DONE}. A read failure ends the run in
 * {@link RunState#FAILED} before any write. A failing sink does not stop the other one; the
 * run is reported as degraded, or as failed when both sinks fail.
 *
 * <p>The source connection is held only while reading and the cache connection only while
 * writing. At most one run executes at a time; a concurrent {@link #runOnce()} call is rejected
 * with {@link RunInProgressException}.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see IocExtractor.Builder
 * @see iocextract.schedule.ExtractionScheduler
 */
public final class IocExtractor {
  private static final Logger logger = Logger.getLogger(IocExtractor.class.getName());

  private final ConnectionProvider sourceConnections;
  private final SourceReader sourceReader;
  private final ConnectionProvider cacheConnections;
  private final CacheSink cacheSink;
  private final SnapshotSink snapshotSink;
  private final Path cacheBackup;
  private final RecordNormalizer normalizer;
  private final Duration lookback;
  private final Set<String> attributeTypes;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile RunState state = RunState.IDLE;
  private volatile RunSummary lastSummary;

  private IocExtractor(Builder builder) {
    this.sourceConnections = Objects.requireNonNull(builder.sourceConnections, "sourceConnections");
    this.sourceReader = Objects.requireNonNull(builder.sourceReader, "sourceReader");
    this.cacheConnections = Objects.requireNonNull(builder.cacheConnections, "cacheConnections");
    this.cacheSink = Objects.requireNonNull(builder.cacheSink, "cacheSink");
    this.snapshotSink = Objects.requireNonNull(builder.snapshotSink, "snapshotSink");
    this.lookback = Objects.requireNonNull(builder.lookback, "lookback");
    Objects.requireNonNull(builder.attributeTypes, "attributeTypes");

    if (lookback.isNegative() || lookback.isZero()) {
      throw new IllegalArgumentException("lookback must be > 0");
    }
    if (builder.attributeTypes.isEmpty()) {
      throw new IllegalArgumentException("attributeTypes must not be empty");
    }
    for (String type : builder.attributeTypes) {
      if (type == null || type.isBlank()) {
        throw new IllegalArgumentException("attributeTypes must not contain blank entries");
      }
    }

    this.attributeTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.attributeTypes));
    this.cacheBackup = builder.cacheBackup == null ? null : builder.cacheBackup.toAbsolutePath();
    this.normalizer = builder.normalizer != null ? builder.normalizer : new RecordNormalizer();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Current state of the extractor: {@link RunState#IDLE} before the first run, the phase of an
   * ongoing run, or the terminal state of the latest run.
   */
  public RunState state() {
    return state;
  }

  /**
   * Summary of the latest finished run, or {@code null} if none finished yet.
   */
  public RunSummary lastSummary() {
    return lastSummary;
  }

  public Duration lookback() {
    return lookback;
  }

  public Set<String> attributeTypes() {
    return attributeTypes;
  }

  /**
   * Cache backup file, or {@code null} when backups are off.
   */
  public Path cacheBackup() {
    return cacheBackup;
  }

  /**
   * Executes one extraction run.
   *
   * @return the run summary; never {@code null}
   * @throws RunInProgressException if another run is still executing
   */
  public RunSummary runOnce() {
    if (!running.compareAndSet(false, true)) {
      throw new RunInProgressException("An extraction run is already in progress");
    }
    try {
      RunSummary summary = execute();
      lastSummary = summary;
      record(summary);
      return summary;
    } finally {
      running.set(false);
    }
  }

  private RunSummary execute() {
    Instant startedAt = clock.instant();
    ExtractionWindow window = ExtractionWindow.endingAt(startedAt, lookback);
    logger.log(Level.INFO, "Fetching IOCs modified between {0} and {1} for {2} attribute types",
        new Object[]{window.from(), window.to(), attributeTypes.size()});

    transition(RunState.READING);
    List<SourceRow> rows;
    try {
      rows = read(window);
    } catch (RuntimeException e) {
      transition(RunState.FAILED);
      logger.log(Level.SEVERE, "Extraction run failed while reading the source", e);
      return RunSummary.failed(startedAt, clock.instant(), describe(e));
    }
    logger.log(Level.INFO, "Retrieved {0} rows from the past {1}", new Object[]{rows.size(), lookback});

    transition(RunState.NORMALIZING);
    Instant importTime = clock.instant();
    List<IocRecord> records = new ArrayList<>(rows.size());
    int dropped = 0;
    for (SourceRow row : rows) {
      try {
        records.add(normalizer.normalize(row, importTime));
      } catch (MalformedRowException e) {
        dropped++;
        logger.log(Level.WARNING, "Skipping malformed row: {0}", e.getMessage());
      }
    }

    transition(RunState.WRITING);
    List<String> errors = new ArrayList<>(2);
    int cacheWrites = writeCache(records, errors);
    boolean snapshotWritten = writeSnapshot(records, errors);

    // both sinks failed
    RunState terminal = errors.size() == 2 ? RunState.FAILED : RunState.DONE;
    transition(terminal);

    RunSummary summary = new RunSummary(terminal, startedAt, clock.instant(), rows.size(),
        records.size(), dropped, cacheWrites, snapshotWritten,
        errors.isEmpty() ? null : String.join("; ", errors));
    logger.log(summary.error() == null ? Level.INFO : Level.WARNING,
        "Extraction run finished: state={0}, rowsRead={1}, normalized={2}, dropped={3}, "
            + "cacheWrites={4}, snapshotWritten={5}",
        new Object[]{terminal, summary.rowsRead(), summary.recordsNormalized(),
            summary.recordsDropped(), cacheWrites, snapshotWritten});
    return summary;
  }

  private List<SourceRow> read(ExtractionWindow window) {
    Connection conn;
    try {
      conn = sourceConnections.getConnection();
    } catch (SQLException | RuntimeException e) {
      throw new SourceConnectionException("Failed to connect to source database", e);
    }
    List<SourceRow> rows;
    try {
      rows = sourceReader.read(conn, window, attributeTypes);
    } catch (RuntimeException e) {
      release(conn, e);
      throw e;
    }
    release(conn, null);
    return rows;
  }

  private static void release(Connection conn, RuntimeException pending) {
    try {
      conn.close();
    } catch (SQLException e) {
      if (pending != null) {
        pending.addSuppressed(e);
      } else {
        logger.log(Level.WARNING, "Failed to release source connection", e);
      }
    }
  }

  private int writeCache(List<IocRecord> records, Collection<String> errors) {
    int written = 0;
    try (Connection conn = cacheConnections.getConnection()) {
      conn.setAutoCommit(true);
      if (cacheBackup != null) {
        backupCache(conn);
      }
      cacheSink.ensureSchema(conn);
      for (IocRecord record : records) {
        cacheSink.write(conn, record);
        written++;
      }
      logger.log(Level.INFO, "Saved {0} IOCs to cache", written);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Cache write aborted after " + written + " of "
          + records.size() + " records", e);
      errors.add("cache: " + describe(e));
    }
    return written;
  }

  private void backupCache(Connection conn) {
    try {
      cacheSink.backup(conn, cacheBackup);
      logger.log(Level.INFO, "Created backup of IOC cache at {0}", cacheBackup);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Proceeding with cache update without backup", e);
    }
  }

  private boolean writeSnapshot(List<IocRecord> records, Collection<String> errors) {
    try {
      snapshotSink.write(records);
      return true;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Snapshot write failed", e);
      errors.add("snapshot: " + describe(e));
      return false;
    }
  }

  private void record(RunSummary summary) {
    metrics.incrementRowsRead(summary.rowsRead());
    metrics.incrementRecordsNormalized(summary.recordsNormalized());
    metrics.incrementRecordsDropped(summary.recordsDropped());
    metrics.incrementCacheWrites(summary.cacheWrites());
    if (summary.isFailed()) {
      metrics.incrementRunFailed();
    } else if (summary.isDegraded()) {
      metrics.incrementRunDegraded();
    } else {
      metrics.incrementRunCompleted();
    }
    metrics.recordLastRunDurationMs(Math.max(0L, summary.duration().toMillis()));
    metrics.recordLastRunRecords(summary.recordsNormalized());
  }

  private void transition(RunState next) {
    logger.log(Level.FINE, "Extraction run {0} -> {1}", new Object[]{state, next});
    state = next;
  }

  private static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null ? t.getClass().getSimpleName() : message;
  }

  /** Builder for {@link IocExtractor}. */
  public static final class Builder {
    private ConnectionProvider sourceConnections;
    private SourceReader sourceReader;
    private ConnectionProvider cacheConnections;
    private CacheSink cacheSink;
    private SnapshotSink snapshotSink;
    private Path cacheBackup;
    private RecordNormalizer normalizer;
    private Duration lookback = Duration.ofHours(24);
    private Collection<String> attributeTypes;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the provider of connections to the MISP database.
     *
     * <p><b>Required.</b>
     *
     * @param sourceConnections the source connection provider
     * @return this builder
     */
    public Builder sourceConnections(ConnectionProvider sourceConnections) {
      this.sourceConnections = sourceConnections;
      return this;
    }

    /**
     * Sets the reader issuing the windowed query.
     *
     * <p><b>Required.</b>
     *
     * @param sourceReader the source reader
     * @return this builder
     */
    public Builder sourceReader(SourceReader sourceReader) {
      this.sourceReader = sourceReader;
      return this;
    }

    /**
     * Sets the provider of connections to the cache store. Connections are opened at the
     * start of the write phase and closed at its end.
     *
     * <p><b>Required.</b>
     *
     * @param cacheConnections the cache connection provider
     * @return this builder
     */
    public Builder cacheConnections(ConnectionProvider cacheConnections) {
      this.cacheConnections = cacheConnections;
      return this;
    }

    /**
     * Sets the cumulative cache sink.
     *
     * <p><b>Required.</b>
     *
     * @param cacheSink the cache sink
     * @return this builder
     */
    public Builder cacheSink(CacheSink cacheSink) {
      this.cacheSink = cacheSink;
      return this;
    }

    /**
     * Sets the per-run snapshot sink.
     *
     * <p><b>Required.</b>
     *
     * @param snapshotSink the snapshot sink
     * @return this builder
     */
    public Builder snapshotSink(SnapshotSink snapshotSink) {
      this.snapshotSink = snapshotSink;
      return this;
    }

    /**
     * Sets the file the cache is copied to at the start of each write phase, before any
     * record of the run is written. A failed copy is logged and does not affect the run.
     *
     * <p>Optional. No copy is made when unset.
     *
     * @param cacheBackup the backup file
     * @return this builder
     */
    public Builder cacheBackup(Path cacheBackup) {
      this.cacheBackup = cacheBackup;
      return this;
    }

    /**
     * Sets the trailing window of attribute modification times a run extracts.
     *
     * <p>Optional. Defaults to {@code 24 hours}. Must be &gt; 0.
     *
     * @param lookback the lookback window
     * @return this builder
     */
    public Builder lookback(Duration lookback) {
      this.lookback = lookback;
      return this;
    }

    /**
     * Sets the MISP attribute types to extract.
     *
     * <p><b>Required.</b> Must not be empty.
     *
     * @param attributeTypes allowlist of attribute types
     * @return this builder
     */
    public Builder attributeTypes(Collection<String> attributeTypes) {
      this.attributeTypes = attributeTypes;
      return this;
    }

    /**
     * Sets the row normalizer.
     *
     * <p>Optional. Defaults to a new {@link RecordNormalizer}.
     *
     * @param normalizer the normalizer
     * @return this builder
     */
    public Builder normalizer(RecordNormalizer normalizer) {
      this.normalizer = normalizer;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock the window end and import time are taken from.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the extractor.
     *
     * @return a new {@link IocExtractor}
     * @throws NullPointerException if a required component is missing
     * @throws IllegalArgumentException if {@code lookback <= 0} or the allowlist is empty
     */
    public IocExtractor build() {
      return new IocExtractor(this);
    }
  }
}
