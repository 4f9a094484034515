package bio.terra.pouch.config;

import java.util.Map;
import org.immutables.value.Value;

@Value.Modifiable
@PropertiesInterfaceStyle
public interface SecretPropertiesInterface {

  @Value.Default
  default String getHttpMethod() {
    return "GET";
  }

  String getUrl();

  /** Request payload; string values may use env('VAR') and hostname() in #{...} expressions */
  Map<String, Object> getData();
}
