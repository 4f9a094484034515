package bio.terra.pouch.services;

import bio.terra.pouch.exception.MaterializationException;
import bio.terra.pouch.models.FileSpec;
import bio.terra.pouch.models.LifecycleState;
import bio.terra.pouch.util.FileModes;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Renders a file from the current secrets and writes it to disk. */
@Slf4j
@Service
public class FileMaterializer {

  private final TemplateRenderer templateRenderer;
  private final NotificationDispatcher notificationDispatcher;

  public FileMaterializer(
      TemplateRenderer templateRenderer, NotificationDispatcher notificationDispatcher) {
    this.templateRenderer = templateRenderer;
    this.notificationDispatcher = notificationDispatcher;
  }

  /**
   * Render the file, register it as user of every secret the template looked up, replace its
   * content on disk and queue its notifiers. The write is synced before returning.
   */
  public void materialize(FileSpec fileSpec, LifecycleState state) {
    var path = fileSpec.getPath();
    var mode = fileSpec.getMode() == 0 ? FileSpec.DEFAULT_MODE : fileSpec.getMode();

    var lookup = new UsageRecordingLookup(state);
    var content = templateRenderer.render(fileSpec, lookup);
    lookup.commit(path, fileSpec.getPriority());

    createParentDirectories(path, FileModes.directoryMode(mode));
    var bytesWritten = write(path, content.getBytes(StandardCharsets.UTF_8), mode);
    log.info("Written {} bytes into {}", bytesWritten, path);

    notificationDispatcher.markPending(fileSpec.getNotifiers());
  }

  private void createParentDirectories(Path path, int directoryMode) {
    var directory = path.toAbsolutePath().getParent();
    if (directory == null || Files.isDirectory(directory)) {
      return;
    }
    try {
      Files.createDirectories(
          directory,
          PosixFilePermissions.asFileAttribute(FileModes.toPermissions(directoryMode)));
    } catch (IOException e) {
      throw new MaterializationException(
          "couldn't create directory %s with mode %s"
              .formatted(directory, FileModes.toOctalString(directoryMode)),
          e);
    }
  }

  private int write(Path path, byte[] content, int mode) {
    var permissions = FileModes.toPermissions(mode);
    FileChannel channel;
    try {
      channel =
          FileChannel.open(
              path,
              EnumSet.of(
                  StandardOpenOption.WRITE,
                  StandardOpenOption.CREATE,
                  StandardOpenOption.TRUNCATE_EXISTING),
              PosixFilePermissions.asFileAttribute(permissions));
    } catch (IOException e) {
      throw new MaterializationException("couldn't open %s file to be written".formatted(path), e);
    }
    try (channel) {
      var buffer = ByteBuffer.wrap(content);
      try {
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
      } catch (IOException e) {
        throw new MaterializationException("couldn't write secret in '%s'".formatted(path), e);
      }
      try {
        channel.force(true);
      } catch (IOException e) {
        throw new MaterializationException(
            "not able to commit the file '%s' to disk".formatted(path), e);
      }
      // creation is subject to the umask and existing files keep their mode otherwise
      Files.setPosixFilePermissions(path, permissions);
    } catch (IOException e) {
      throw new MaterializationException("couldn't finish writing " + path, e);
    }
    return content.length;
  }
}
