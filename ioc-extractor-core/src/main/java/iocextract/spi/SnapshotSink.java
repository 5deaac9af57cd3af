package iocextract.spi;

import iocextract.model.IocRecord;

import java.util.List;

/**
 * Non-cumulative sink holding exactly the records of the latest completed run.
 */
public interface SnapshotSink {

  /**
   * Replaces the snapshot with {@code records}. An empty list is written, not skipped.
   * Readers never observe a partially written snapshot.
   *
   * @throws iocextract.StorageException if the snapshot cannot be replaced
   */
  void write(List<IocRecord> records);
}
