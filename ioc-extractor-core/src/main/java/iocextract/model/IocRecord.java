package iocextract.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Canonical indicator-of-compromise record built from one MISP (event, attribute) row.
 *
 * <p>Instances are immutable and are created fresh on every run. {@code attributeId} is unique
 * within one MISP instance and keys the cache sink.
 *
 * @param eventId            MISP event id
 * @param eventUuid          globally unique event uuid
 * @param eventInfo          free-text event label
 * @param eventDate          event calendar date, may be {@code null}
 * @param eventTimestamp     last change of the event, may be {@code null}
 * @param attributeId        MISP attribute id
 * @param attributeType      MISP attribute type, e.g. {@code ip-dst} or {@code md5}
 * @param attributeCategory  MISP category, e.g. {@code Network activity}
 * @param attributeValue     the indicator itself
 * @param attributeTimestamp last change of the attribute, may be {@code null}
 * @param attributeComment   analyst comment, empty when absent at the source
 * @param attributeToIds     whether the attribute is flagged for detection
 * @param importTime         when this extractor captured the record
 */
public record IocRecord(
    long eventId,
    String eventUuid,
    String eventInfo,
    LocalDate eventDate,
    Instant eventTimestamp,
    long attributeId,
    String attributeType,
    String attributeCategory,
    String attributeValue,
    Instant attributeTimestamp,
    String attributeComment,
    boolean attributeToIds,
    Instant importTime
) {

  public IocRecord {
    Objects.requireNonNull(attributeType, "attributeType");
    Objects.requireNonNull(attributeValue, "attributeValue");
    Objects.requireNonNull(attributeComment, "attributeComment");
    Objects.requireNonNull(importTime, "importTime");
  }
}
