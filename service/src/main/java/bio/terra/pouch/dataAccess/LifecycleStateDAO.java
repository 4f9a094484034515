package bio.terra.pouch.dataAccess;

import bio.terra.pouch.PouchException;
import bio.terra.pouch.config.PouchConfig;
import bio.terra.pouch.models.LifecycleState;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

/**
 * Keeps the lifecycle state in a json file. The state holds secret values, so the file is only
 * readable by its owner.
 */
@Repository
@Slf4j
public class LifecycleStateDAO {

  private final ObjectMapper objectMapper;
  private final Path statePath;

  public LifecycleStateDAO(PouchConfig pouchConfig, ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.statePath = pouchConfig.getStatePath();
  }

  public LifecycleState load() {
    if (!Files.exists(statePath)) {
      log.info("No state found in {}, starting from scratch", statePath);
      return new LifecycleState();
    }
    try {
      var state = objectMapper.readValue(statePath.toFile(), LifecycleState.class);
      log.info("Loaded state of {} secrets from {}", state.getSecrets().size(), statePath);
      return state;
    } catch (IOException e) {
      throw new PouchException("Failed to read state from " + statePath, e);
    }
  }

  /**
   * Write the state to a temporary sibling file, force it to disk and move it over the previous
   * state, so a crash leaves either the old or the new state behind.
   */
  public void save(LifecycleState state) throws IOException {
    var directory = statePath.toAbsolutePath().getParent();
    Files.createDirectories(directory);
    var tempFile =
        Files.createTempFile(
            directory,
            statePath.getFileName().toString(),
            ".tmp",
            PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
    try {
      var bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);
      try (var channel = FileChannel.open(tempFile, StandardOpenOption.WRITE)) {
        var buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      Files.move(
          tempFile,
          statePath,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(tempFile);
    }
  }

  /** Save the state, logging instead of failing. The in-memory state stays authoritative. */
  public void saveQuietly(LifecycleState state) {
    try {
      save(state);
    } catch (IOException | RuntimeException e) {
      log.error("Couldn't save state to {}", statePath, e);
    }
  }
}
