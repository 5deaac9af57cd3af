package iocextract;

/**
 * Thrown by {@link IocExtractor#runOnce()} when another run on the same extractor has not
 * finished yet. The rejected trigger performs no reads and no writes.
 */
public final class RunInProgressException extends IllegalStateException {
  public RunInProgressException(String message) {
    super(message);
  }
}
