/**
 * Spring Boot auto-configuration for the MISP IOC extractor.
 *
 * <p>Add the starter and point {@code ioc-extractor.source.*} at the MISP database:
 * <pre>{@code
 * ioc-extractor:
 *   source:
 *     host: misp-db.internal
 *     username: misp_reader
 *     password: ${MISP_DB_PASSWORD}
 *   schedule:
 *     enabled: true
 *     interval: 24h
 * }</pre>
 *
 * @see iocextract.spring.boot.IocExtractorProperties
 */
package iocextract.spring.boot;
