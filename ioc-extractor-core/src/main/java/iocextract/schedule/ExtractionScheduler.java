package iocextract.schedule;

import iocextract.IocExtractor;
import iocextract.RunInProgressException;
import iocextract.RunSummary;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Triggers {@link IocExtractor#runOnce()} at a fixed delay on a single daemon thread.
 *
 * <p>A failed or rejected cycle is logged and the schedule continues. Runs never overlap:
 * the executor has one thread and the extractor itself rejects concurrent triggers, so a
 * manual {@link #runOnce()} racing the schedule is skipped rather than doubled.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see ExtractionScheduler.Builder
 */
public final class ExtractionScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExtractionScheduler.class.getName());

  private final IocExtractor extractor;
  private final Duration interval;
  private final Duration initialDelay;
  private final Consumer<RunSummary> listener;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> runTask;
  private volatile boolean closed;

  private ExtractionScheduler(Builder builder) {
    this.extractor = Objects.requireNonNull(builder.extractor, "extractor");
    this.interval = Objects.requireNonNull(builder.interval, "interval");
    this.initialDelay = Objects.requireNonNull(builder.initialDelay, "initialDelay");

    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    this.listener = builder.listener != null ? builder.listener : summary -> { };
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the schedule. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ExtractionScheduler has been closed");
    }
    if (runTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "ioc-extractor-scheduler");
      thread.setDaemon(true);
      return thread;
    });
    runTask = scheduler.scheduleWithFixedDelay(this::runOnce,
        initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "IOC extraction scheduled every {0}", interval);
  }

  /**
   * Executes a single extraction cycle and hands the summary to the listener.
   *
   * <p>May be invoked directly for testing or one-off runs.
   */
  public void runOnce() {
    if (closed) {
      return;
    }
    try {
      RunSummary summary = extractor.runOnce();
      listener.accept(summary);
    } catch (RunInProgressException e) {
      logger.log(Level.INFO, "Skipping scheduled extraction: {0}", e.getMessage());
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Extraction cycle failed", t);
    }
  }

  public boolean isStarted() {
    return runTask != null;
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (runTask != null) {
      runTask.cancel(false);
      runTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link ExtractionScheduler}. */
  public static final class Builder {
    private IocExtractor extractor;
    private Duration interval = Duration.ofHours(24);
    private Duration initialDelay = Duration.ZERO;
    private Consumer<RunSummary> listener;

    private Builder() {}

    /**
     * Sets the extractor to trigger.
     *
     * <p><b>Required.</b>
     *
     * @param extractor the extractor
     * @return this builder
     */
    public Builder extractor(IocExtractor extractor) {
      this.extractor = extractor;
      return this;
    }

    /**
     * Sets the delay between the end of one run and the start of the next.
     *
     * <p>Optional. Defaults to {@code 24 hours}. Must be &gt; 0.
     *
     * @param interval delay between runs
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets the delay before the first run.
     *
     * <p>Optional. Defaults to {@code 0}. Must be &ge; 0.
     *
     * @param initialDelay delay before the first run
     * @return this builder
     */
    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    /**
     * Sets a callback receiving every run summary produced by the schedule.
     *
     * <p>Optional.
     *
     * @param listener summary callback
     * @return this builder
     */
    public Builder listener(Consumer<RunSummary> listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Builds the scheduler. Call {@link ExtractionScheduler#start()} to begin.
     *
     * @return a new {@link ExtractionScheduler} instance
     * @throws NullPointerException if {@code extractor} is null
     * @throws IllegalArgumentException if {@code interval <= 0} or {@code initialDelay < 0}
     */
    public ExtractionScheduler build() {
      return new ExtractionScheduler(this);
    }
  }
}
