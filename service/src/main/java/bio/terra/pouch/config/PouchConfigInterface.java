package bio.terra.pouch.config;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

@Value.Modifiable
@PropertiesInterfaceStyle
public interface PouchConfigInterface {

  /** Where the lifecycle state is persisted between runs */
  Path getStatePath();

  /** Delay between attempts when the secret store is transiently unavailable */
  @Value.Default
  default Duration getSecretRetryPeriod() {
    return Duration.ofSeconds(5);
  }

  /** Fraction of a lease after which the secret is resolved again */
  @Value.Default
  default double getRenewalRatio() {
    return 0.75;
  }

  /** Start the run loop with the application. Off in tests. */
  @Value.Default
  default boolean isRunnerEnabled() {
    return true;
  }

  // Nullable so spring can call the getter before the setter, see VaultProperties
  @Nullable
  Path getReadyFile();

  @Nullable
  VaultProperties getVault();

  Map<String, SecretProperties> getSecrets();

  List<FileProperties> getFiles();

  Map<String, NotifierProperties> getNotifiers();
}
