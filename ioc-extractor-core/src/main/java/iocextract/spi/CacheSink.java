package iocextract.spi;

import iocextract.model.IocRecord;

import java.nio.file.Path;
import java.sql.Connection;

/**
 * Cumulative IOC store keyed by attribute id.
 *
 * <p>The extractor opens one connection per run, calls {@link #ensureSchema} once and then
 * {@link #write} for each record. Rows already written stay written if a later write fails.
 */
public interface CacheSink {

  /**
   * Creates the cache table and its indexes if they do not exist. Never drops data.
   *
   * @throws iocextract.StorageException if the schema cannot be created
   */
  void ensureSchema(Connection conn);

  /**
   * Inserts the record, or replaces the stored row with the same attribute id.
   * Writing the same record twice leaves the same stored row.
   *
   * @throws iocextract.StorageException if the row cannot be written
   */
  void write(Connection conn, IocRecord record);

  /**
   * Copies the current cache contents to {@code target}, replacing an earlier copy.
   *
   * @throws iocextract.StorageException if the copy cannot be made
   * @throws UnsupportedOperationException if this store cannot back itself up
   */
  default void backup(Connection conn, Path target) {
    throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support backups");
  }
}
