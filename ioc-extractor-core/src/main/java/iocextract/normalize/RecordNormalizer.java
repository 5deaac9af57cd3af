package iocextract.normalize;

import iocextract.MalformedRowException;
import iocextract.model.IocRecord;
import iocextract.model.SourceRow;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps raw {@link SourceRow}s to {@link IocRecord}s.
 *
 * <p>Only the identity fields ({@code event_id}, {@code attribute_id}, {@code attribute_type},
 * {@code attribute_value}) are mandatory. A missing comment becomes an empty string.
 *
 * <p>{@code to_ids} coercion: {@code null} is {@code false}; a {@link Boolean} is kept; a
 * {@link Number} is {@code true} when non-zero; a {@link String} is {@code true} for
 * {@code "1"} or {@code "true"} and {@code false} for {@code "0"}, {@code "false"} or blank,
 * case-insensitive. Anything else makes the row malformed.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class RecordNormalizer {

  /**
   * Normalizes one row.
   *
   * @param row        raw source row
   * @param importTime capture time of the current run
   * @return the canonical record
   * @throws MalformedRowException if an identity field is missing or {@code to_ids} is not
   *     boolean-like
   */
  public IocRecord normalize(SourceRow row, Instant importTime) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(importTime, "importTime");

    Long attributeId = row.attributeId();
    if (attributeId == null) {
      throw new MalformedRowException("Row has no attribute_id (event_id=" + row.eventId() + ")", null);
    }
    if (row.eventId() == null) {
      throw malformed("event_id", attributeId);
    }
    if (isBlank(row.attributeType())) {
      throw malformed("attribute_type", attributeId);
    }
    if (row.attributeValue() == null) {
      throw malformed("attribute_value", attributeId);
    }

    return new IocRecord(
        row.eventId(),
        row.eventUuid(),
        row.eventInfo(),
        row.eventDate(),
        row.eventTimestamp(),
        attributeId,
        row.attributeType(),
        row.attributeCategory(),
        row.attributeValue(),
        row.attributeTimestamp(),
        row.attributeComment() == null ? "" : row.attributeComment(),
        toIds(row.attributeToIds(), attributeId),
        importTime);
  }

  static boolean toIds(Object raw, long attributeId) {
    if (raw == null) {
      return false;
    }
    if (raw instanceof Boolean b) {
      return b;
    }
    if (raw instanceof Number n) {
      return n.longValue() != 0L;
    }
    if (raw instanceof String s) {
      switch (s.trim().toLowerCase(Locale.ROOT)) {
        case "1":
        case "true":
          return true;
        case "0":
        case "false":
        case "":
          return false;
        default:
          break;
      }
    }
    throw new MalformedRowException(
        "Row attribute_id=" + attributeId + " has non-boolean attribute_to_ids: " + raw, attributeId);
  }

  private static MalformedRowException malformed(String field, long attributeId) {
    return new MalformedRowException("Row attribute_id=" + attributeId + " has no " + field, attributeId);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
