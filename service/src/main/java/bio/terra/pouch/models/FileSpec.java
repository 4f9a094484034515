package bio.terra.pouch.models;

import bio.terra.pouch.config.FileProperties;
import bio.terra.pouch.exception.ConfigurationException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface FileSpec extends WithFileSpec {
  int DEFAULT_MODE = 0600;

  Path getPath();

  Optional<String> getTemplate();

  Optional<Path> getTemplateFile();

  @Value.Default
  default int getMode() {
    return DEFAULT_MODE;
  }

  List<String> getNotifiers();

  @Value.Default
  default int getPriority() {
    return 0;
  }

  class Builder extends ImmutableFileSpec.Builder {}

  static FileSpec fromProperties(FileProperties properties) {
    var builder =
        new FileSpec.Builder()
            .path(properties.getPath())
            .template(Optional.ofNullable(properties.getTemplate()))
            .templateFile(Optional.ofNullable(properties.getTemplateFile()))
            .notifiers(properties.getNotify())
            .priority(properties.getPriority());
    if (properties.getMode() != null) {
      builder.mode(parseMode(properties.getPath(), properties.getMode()));
    }
    return builder.build();
  }

  static int parseMode(Path path, String mode) {
    try {
      var parsed = Integer.parseInt(mode.trim(), 8);
      if (parsed < 0 || parsed > 0777) {
        throw new ConfigurationException(
            "Mode %s of file %s is out of range".formatted(mode, path));
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Mode %s of file %s is not an octal number".formatted(mode, path), e);
    }
  }
}
