package iocextract.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import iocextract.StorageException;
import iocextract.model.IocRecord;
import iocextract.spi.SnapshotSink;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SnapshotSink} writing the run's records as a JSON array.
 *
 * <p>Field names are snake_case ({@code event_id}, {@code attribute_to_ids}, ...). Dates and
 * instants are ISO-8601 strings, {@code attribute_to_ids} is a JSON boolean.
 *
 * <p>The array is first written to {@code .<name>.tmp} next to the target and then moved over
 * it, atomically where the file system supports it. On POSIX file systems an existing
 * snapshot's permissions carry over to the replacement.
 */
public final class JsonSnapshotSink implements SnapshotSink {
  private static final Logger logger = Logger.getLogger(JsonSnapshotSink.class.getName());

  private final Path target;
  private final ObjectMapper objectMapper;

  public JsonSnapshotSink(Path target) {
    this(target, defaultObjectMapper());
  }

  public JsonSnapshotSink(Path target, ObjectMapper objectMapper) {
    this.target = Objects.requireNonNull(target, "target").toAbsolutePath();
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /**
   * Returns a mapper producing the snapshot wire format.
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);
  }

  public Path target() {
    return target;
  }

  @Override
  public void write(List<IocRecord> records) {
    Objects.requireNonNull(records, "records");
    Path tmp = target.resolveSibling("." + target.getFileName() + ".tmp");
    try {
      Files.createDirectories(target.getParent());
      try (OutputStream out = Files.newOutputStream(tmp)) {
        objectMapper.writeValue(out, records);
      }
      copyPermissions(tmp);
      replace(tmp);
      logger.log(Level.INFO, "Saved {0} IOCs to snapshot {1}", new Object[]{records.size(), target});
    } catch (IOException e) {
      StorageException failure = new StorageException("Failed to write snapshot " + target, e);
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        failure.addSuppressed(cleanup);
      }
      throw failure;
    }
  }

  private void copyPermissions(Path tmp) throws IOException {
    PosixFileAttributeView view = Files.getFileAttributeView(target, PosixFileAttributeView.class);
    if (view != null && Files.exists(target)) {
      Files.setPosixFilePermissions(tmp, view.readAttributes().permissions());
    }
  }

  private void replace(Path tmp) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      logger.log(Level.FINE, "Atomic move unsupported for {0}, falling back to replace", target);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
