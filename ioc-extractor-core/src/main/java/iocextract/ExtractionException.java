package iocextract;

/**
 * Base type for failures raised while extracting IOCs from a MISP source.
 *
 * <p>Subclasses distinguish fatal failures ({@link SourceConnectionException},
 * {@link SourceQueryException}) from recoverable ones ({@link MalformedRowException},
 * {@link StorageException}). {@link IocExtractor#runOnce()} never lets any of them escape;
 * they are converted into the {@link RunSummary}.
 */
public class ExtractionException extends RuntimeException {
  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
