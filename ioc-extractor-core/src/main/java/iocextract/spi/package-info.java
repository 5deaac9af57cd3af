/**
 * Service Provider Interfaces (SPI) for plugging sources, sinks and metrics into the extractor.
 *
 * @see iocextract.spi.ConnectionProvider
 * @see iocextract.spi.SourceReader
 * @see iocextract.spi.CacheSink
 * @see iocextract.spi.SnapshotSink
 * @see iocextract.spi.MetricsExporter
 */
package iocextract.spi;
