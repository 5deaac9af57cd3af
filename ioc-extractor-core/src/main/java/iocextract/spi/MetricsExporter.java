package iocextract.spi;

/**
 * Observability hook for exporting extraction counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Adds the number of rows returned by the source query.
   */
  void incrementRowsRead(int count);

  /**
   * Adds the number of rows turned into IOC records.
   */
  void incrementRecordsNormalized(int count);

  /**
   * Adds the number of malformed rows dropped.
   */
  void incrementRecordsDropped(int count);

  /**
   * Adds the number of records upserted into the cache.
   */
  void incrementCacheWrites(int count);

  /**
   * Counts a run that reached DONE with both sinks written.
   */
  void incrementRunCompleted();

  /**
   * Counts a run that reached DONE with one sink failing.
   */
  void incrementRunDegraded();

  /**
   * Counts a run that ended in FAILED.
   */
  void incrementRunFailed();

  /**
   * Records the wall-clock duration of the latest run.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordLastRunDurationMs(long durationMs) {
  }

  /**
   * Records how many records the latest run produced.
   */
  default void recordLastRunRecords(int records) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementRowsRead(int count) {
    }

    @Override
    public void incrementRecordsNormalized(int count) {
    }

    @Override
    public void incrementRecordsDropped(int count) {
    }

    @Override
    public void incrementCacheWrites(int count) {
    }

    @Override
    public void incrementRunCompleted() {
    }

    @Override
    public void incrementRunDegraded() {
    }

    @Override
    public void incrementRunFailed() {
    }
  }
}
