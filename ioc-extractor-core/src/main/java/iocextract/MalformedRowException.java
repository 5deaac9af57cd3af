package iocextract;

/**
 * A source row lacks one of the identity fields required to build an IOC record.
 * The row is dropped and counted; the run continues.
 */
public final class MalformedRowException extends ExtractionException {
  private final Long attributeId;

  public MalformedRowException(String message, Long attributeId) {
    super(message);
    this.attributeId = attributeId;
  }

  /**
   * Returns the attribute id of the offending row, or {@code null} when that is the missing
   * field.
   */
  public Long attributeId() {
    return attributeId;
  }
}
