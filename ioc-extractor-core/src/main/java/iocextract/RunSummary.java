package iocextract;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link IocExtractor#runOnce()} invocation. Every run, successful, degraded or
 * failed, yields exactly one summary.
 *
 * <p>A run is <em>degraded</em> when it reached {@link RunState#DONE} but one of the sinks
 * reported a failure; {@link #error()} then describes the failing sink. A run in
 * {@link RunState#FAILED} attempted no writes if the failure happened while reading.
 *
 * @param state             terminal state, {@link RunState#DONE} or {@link RunState#FAILED}
 * @param startedAt         wall-clock start of the run, also the end of the lookback window
 * @param finishedAt        wall-clock end of the run
 * @param rowsRead          rows returned by the source query
 * @param recordsNormalized rows converted into IOC records
 * @param recordsDropped    rows dropped as malformed
 * @param cacheWrites       records upserted into the cache sink
 * @param snapshotWritten   whether the snapshot file was replaced
 * @param error             failure description, or {@code null} for a clean run
 */
public record RunSummary(
    RunState state,
    Instant startedAt,
    Instant finishedAt,
    int rowsRead,
    int recordsNormalized,
    int recordsDropped,
    int cacheWrites,
    boolean snapshotWritten,
    String error
) {

  public RunSummary {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(finishedAt, "finishedAt");
    if (!state.isTerminal()) {
      throw new IllegalArgumentException("state must be terminal: " + state);
    }
  }

  static RunSummary failed(Instant startedAt, Instant finishedAt, String error) {
    return new RunSummary(RunState.FAILED, startedAt, finishedAt, 0, 0, 0, 0, false, error);
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(error);
  }

  public boolean isFailed() {
    return state == RunState.FAILED;
  }

  public boolean isDegraded() {
    return state == RunState.DONE && error != null;
  }

  public Duration duration() {
    return Duration.between(startedAt, finishedAt);
  }
}
