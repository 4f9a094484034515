package bio.terra.pouch.models;

import bio.terra.pouch.config.SecretProperties;
import java.util.Map;
import org.immutables.value.Value;

@Value.Immutable
public interface SecretSpec extends WithSecretSpec {
  String getName();

  String getHttpMethod();

  String getUrl();

  Map<String, Object> getData();

  class Builder extends ImmutableSecretSpec.Builder {}

  static SecretSpec fromProperties(String name, SecretProperties properties) {
    return new SecretSpec.Builder()
        .name(name)
        .httpMethod(properties.getHttpMethod())
        .url(properties.getUrl())
        .data(properties.getData())
        .build();
  }
}
