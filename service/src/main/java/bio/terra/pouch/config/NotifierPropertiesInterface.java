package bio.terra.pouch.config;

import java.time.Duration;
import java.util.List;
import org.immutables.value.Value;

@Value.Modifiable
@PropertiesInterfaceStyle
public interface NotifierPropertiesInterface {

  /** Command line run to reload the dependent service */
  List<String> getCommand();

  @Value.Default
  default Duration getTimeout() {
    return Duration.ofSeconds(30);
  }
}
