package bio.terra.pouch.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/** Resolved secrets by name plus the current secret store token. */
public class LifecycleState {

  @Nullable private String token;
  private Map<String, SecretState> secrets = new TreeMap<>();

  @Nullable
  public String getToken() {
    return token;
  }

  public void setToken(@Nullable String token) {
    this.token = token;
  }

  public Map<String, SecretState> getSecrets() {
    return secrets;
  }

  void setSecrets(Map<String, SecretState> secrets) {
    this.secrets = secrets == null ? new TreeMap<>() : new TreeMap<>(secrets);
  }

  public Optional<SecretState> getSecret(String name) {
    return Optional.ofNullable(secrets.get(name));
  }

  public SecretState setSecret(
      String name, SecretResult result, Instant resolvedAt, @Nullable Instant renewAt) {
    var state = secrets.computeIfAbsent(name, SecretState::new);
    state.update(result, resolvedAt, renewAt);
    return state;
  }

  public boolean deleteSecret(String name) {
    return secrets.remove(name) != null;
  }

  /**
   * Replace every usage entry of a file with the given set of secrets, so a file never keeps
   * entries from a previous rendering.
   */
  public void replaceUsages(Path path, int priority, Set<String> secretNames) {
    secrets.values().forEach(secret -> secret.removeUsage(path));
    secretNames.forEach(
        name -> getSecret(name).ifPresent(secret -> secret.registerUsage(path, priority)));
  }

  /** The tracked secret with the earliest renewal instant, if any expires at all. */
  @JsonIgnore
  public Optional<SecretState> getNextToRenew() {
    return secrets.values().stream()
        .filter(secret -> secret.getRenewAt() != null)
        .min(Comparator.comparing(SecretState::getRenewAt));
  }

  @JsonIgnore
  public Collection<String> getSecretNames() {
    return secrets.keySet();
  }
}
