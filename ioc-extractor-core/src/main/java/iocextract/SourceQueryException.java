package iocextract;

/**
 * The windowed source query could not be executed or exceeded its timeout. Fatal to the run;
 * no partial result set is trusted.
 */
public final class SourceQueryException extends ExtractionException {
  public SourceQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
