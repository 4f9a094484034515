package bio.terra.pouch.config;

import jakarta.annotation.Nullable;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import org.immutables.value.Value;

@Value.Modifiable
@PropertiesInterfaceStyle
public interface VaultPropertiesInterface {
  URI getAddress();

  @Nullable
  String getToken();

  /** Read the token from this file when no inline token is configured */
  @Nullable
  Path getTokenPath();

  @Value.Default
  default Duration getRequestTimeout() {
    return Duration.ofSeconds(30);
  }
}
