package bio.terra.pouch.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.pouch.PouchException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class ReadyFileObserverTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @TempDir Path tempDir;

  @Test
  void testWritesReadyFile() throws IOException {
    var readyFile = tempDir.resolve("run/ready");

    new ReadyFileObserver(readyFile, Clock.fixed(NOW, ZoneOffset.UTC)).notifyReady();

    assertEquals("2024-05-01T12:00:00Z", Files.readString(readyFile));
  }

  @Test
  void testUnwritableReadyFile() throws IOException {
    var readyFile = tempDir.resolve("ready");
    Files.createDirectory(readyFile);
    var observer = new ReadyFileObserver(readyFile, Clock.fixed(NOW, ZoneOffset.UTC));

    assertThrows(PouchException.class, observer::notifyReady);
  }
}
