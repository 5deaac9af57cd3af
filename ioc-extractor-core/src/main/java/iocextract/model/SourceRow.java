package iocextract.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Raw joined (event, attribute) row as read from the MISP database, before normalization.
 *
 * <p>Every field may be {@code null}; the {@link iocextract.normalize.RecordNormalizer} decides
 * which absences are tolerated. {@code attributeToIds} keeps the driver's native value
 * ({@link Boolean}, a {@link Number} or a {@link String}) for the normalizer to coerce.
 */
public record SourceRow(
    Long eventId,
    String eventUuid,
    String eventInfo,
    LocalDate eventDate,
    Instant eventTimestamp,
    Long attributeId,
    String attributeType,
    String attributeCategory,
    String attributeValue,
    Instant attributeTimestamp,
    String attributeComment,
    Object attributeToIds
) {}
