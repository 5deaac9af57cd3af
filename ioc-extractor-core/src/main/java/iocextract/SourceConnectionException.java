package iocextract;

/**
 * The MISP source database could not be reached, rejected the credentials, or dropped the
 * connection mid-query. Fatal to the run.
 */
public final class SourceConnectionException extends ExtractionException {
  public SourceConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
