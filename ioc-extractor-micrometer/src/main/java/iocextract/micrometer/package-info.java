/**
 * Micrometer integration for extraction run metrics.
 *
 * @see iocextract.micrometer.MicrometerMetricsExporter
 */
package iocextract.micrometer;
