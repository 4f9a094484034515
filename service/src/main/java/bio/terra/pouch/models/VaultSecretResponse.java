package bio.terra.pouch.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VaultSecretResponse(
    @JsonProperty("lease_id") String leaseId,
    @JsonProperty("lease_duration") long leaseDuration,
    @JsonProperty("renewable") boolean renewable,
    @JsonProperty("data") Map<String, Object> data) {

  public SecretResult toSecretResult() {
    var builder =
        new SecretResult.Builder()
            .leaseDuration(Duration.ofSeconds(leaseDuration))
            .isRenewable(renewable);
    if (data != null) {
      // vault uses null for fields without value, immutable maps don't take them
      data.forEach((key, value) -> builder.putData(key, value == null ? "" : value));
    }
    if (leaseId != null && !leaseId.isEmpty()) {
      builder.leaseId(leaseId);
    }
    return builder.build();
  }
}
