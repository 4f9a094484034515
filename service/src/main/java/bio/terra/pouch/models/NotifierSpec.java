package bio.terra.pouch.models;

import bio.terra.pouch.config.NotifierProperties;
import java.time.Duration;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
public interface NotifierSpec extends WithNotifierSpec {
  String getName();

  List<String> getCommand();

  Duration getTimeout();

  class Builder extends ImmutableNotifierSpec.Builder {}

  static NotifierSpec fromProperties(String name, NotifierProperties properties) {
    return new NotifierSpec.Builder()
        .name(name)
        .command(properties.getCommand())
        .timeout(properties.getTimeout())
        .build();
  }
}
