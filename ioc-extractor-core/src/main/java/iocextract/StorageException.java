package iocextract;

/**
 * A sink could not persist records (permissions, disk, corrupt store). Recoverable: the run
 * still completes with a degraded summary.
 */
public final class StorageException extends ExtractionException {
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
