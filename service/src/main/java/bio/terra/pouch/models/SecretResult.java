package bio.terra.pouch.models;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/** What the secret store returned for one request. */
@Value.Immutable
public interface SecretResult extends WithSecretResult {
  Map<String, Object> getData();

  Optional<String> getLeaseId();

  /** Zero when the secret has no lease and never needs renewing */
  @Value.Default
  default Duration getLeaseDuration() {
    return Duration.ZERO;
  }

  @Value.Default
  default boolean isRenewable() {
    return false;
  }

  class Builder extends ImmutableSecretResult.Builder {}
}
