package bio.terra.pouch.services;

import bio.terra.pouch.PouchException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

/** Signals readiness by writing a marker file, e.g. for a container readiness probe. */
@Slf4j
public class ReadyFileObserver implements ReadinessObserver {

  private final Path readyFile;
  private final Clock clock;

  public ReadyFileObserver(Path readyFile, Clock clock) {
    this.readyFile = readyFile;
    this.clock = clock;
  }

  @Override
  public void notifyReady() {
    try {
      var directory = readyFile.toAbsolutePath().getParent();
      if (directory != null) {
        Files.createDirectories(directory);
      }
      Files.writeString(readyFile, clock.instant().toString());
      log.info("Marked ready in {}", readyFile);
    } catch (IOException e) {
      throw new PouchException("Couldn't write ready file " + readyFile, e);
    }
  }
}
