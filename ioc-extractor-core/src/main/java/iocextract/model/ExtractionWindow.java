package iocextract.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval {@code [from, to]} an attribute's last modification must fall into to be
 * extracted by a run.
 *
 * <p>MISP stores timestamps as whole Unix seconds, so {@link #fromEpochSecond()} rounds up and
 * {@link #toEpochSecond()} rounds down to keep the SQL bounds inside the window.
 */
public record ExtractionWindow(Instant from, Instant to) {

  public ExtractionWindow {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (from.isAfter(to)) {
      throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
    }
  }

  /**
   * Returns the window of length {@code lookback} that ends at {@code now}.
   */
  public static ExtractionWindow endingAt(Instant now, Duration lookback) {
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(lookback, "lookback");
    if (lookback.isNegative()) {
      throw new IllegalArgumentException("lookback must be >= 0");
    }
    return new ExtractionWindow(now.minus(lookback), now);
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(from) && !instant.isAfter(to);
  }

  public long fromEpochSecond() {
    long seconds = from.getEpochSecond();
    return from.getNano() > 0 ? seconds + 1 : seconds;
  }

  public long toEpochSecond() {
    return to.getEpochSecond();
  }

  public Duration length() {
    return Duration.between(from, to);
  }
}
