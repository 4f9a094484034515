package bio.terra.pouch.config;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.util.List;
import org.immutables.value.Value;

@Value.Modifiable
@PropertiesInterfaceStyle
public interface FilePropertiesInterface {
  Path getPath();

  @Nullable
  String getTemplate();

  @Nullable
  Path getTemplateFile();

  /** Octal permission string, e.g. "0640". Quote it in yaml. */
  @Nullable
  String getMode();

  List<String> getNotify();

  @Value.Default
  default int getPriority() {
    return 0;
  }
}
