package bio.terra.pouch.services;

import bio.terra.pouch.exception.TemplateRenderException;
import bio.terra.pouch.models.LifecycleState;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Looks secrets up in the lifecycle state and remembers which ones were used. Nothing is written
 * to the state until {@link #commit} is called, so a failed render leaves usage untouched.
 */
class UsageRecordingLookup implements SecretLookup {

  private final LifecycleState state;
  private final Set<String> usedSecrets = new LinkedHashSet<>();

  UsageRecordingLookup(LifecycleState state) {
    this.state = state;
  }

  @Override
  public Object lookup(String secretName, String key) {
    var secret =
        state
            .getSecret(secretName)
            .orElseThrow(() -> new TemplateRenderException("unknown secret: " + secretName));
    if (!secret.getData().containsKey(key)) {
      throw new TemplateRenderException(
          "unknown key in secret '%s': %s".formatted(secretName, key));
    }
    usedSecrets.add(secretName);
    return secret.getData().get(key);
  }

  Set<String> getUsedSecrets() {
    return Collections.unmodifiableSet(usedSecrets);
  }

  void commit(Path path, int priority) {
    state.replaceUsages(path, priority, usedSecrets);
  }
}
