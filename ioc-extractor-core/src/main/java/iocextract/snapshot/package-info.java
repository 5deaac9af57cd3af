/**
 * File-based {@link iocextract.spi.SnapshotSink} implementations.
 */
package iocextract.snapshot;
