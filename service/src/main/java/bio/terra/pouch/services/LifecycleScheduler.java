package bio.terra.pouch.services;

import bio.terra.pouch.PouchException;
import bio.terra.pouch.dataAccess.LifecycleStateDAO;
import bio.terra.pouch.exception.ConfigurationException;
import bio.terra.pouch.exception.SecretStoreException;
import bio.terra.pouch.models.FileSpec;
import bio.terra.pouch.models.FileUsage;
import bio.terra.pouch.models.LifecycleState;
import bio.terra.pouch.models.SecretSpec;
import bio.terra.pouch.models.SecretState;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * The run loop. Logs in, resolves every configured secret, writes every configured file, and then
 * keeps waking up for the secret whose lease runs out first, resolving it again and rewriting the
 * files that use it.
 *
 * <p>Everything runs on the calling thread. The only waits are the sleep until the next renewal,
 * which can be cancelled, and the back-off between resolution attempts, which can't.
 */
@Slf4j
public class LifecycleScheduler {

  private static final Comparator<FileSpec> FILE_ORDER =
      Comparator.comparingInt(FileSpec::getPriority).thenComparing(FileSpec::getPath);

  private final Map<String, SecretSpec> secrets = new TreeMap<>();
  private final Map<Path, FileSpec> files = new LinkedHashMap<>();
  private final SecretStoreClient secretStoreClient;
  private final SecretResolver secretResolver;
  private final FileMaterializer fileMaterializer;
  private final NotificationDispatcher notificationDispatcher;
  private final LifecycleStateDAO lifecycleStateDAO;
  private final Clock clock;

  private LifecycleState state;

  public LifecycleScheduler(
      Collection<SecretSpec> secretSpecs,
      Collection<FileSpec> fileSpecs,
      SecretStoreClient secretStoreClient,
      SecretResolver secretResolver,
      FileMaterializer fileMaterializer,
      NotificationDispatcher notificationDispatcher,
      LifecycleStateDAO lifecycleStateDAO,
      Clock clock) {
    secretSpecs.forEach(spec -> secrets.put(spec.getName(), spec));
    fileSpecs.stream()
        .sorted(FILE_ORDER)
        .forEach(
            spec -> {
              if (files.put(spec.getPath(), spec) != null) {
                throw new ConfigurationException(
                    "File %s is configured more than once".formatted(spec.getPath()));
              }
            });
    this.secretStoreClient = secretStoreClient;
    this.secretResolver = secretResolver;
    this.fileMaterializer = fileMaterializer;
    this.notificationDispatcher = notificationDispatcher;
    this.lifecycleStateDAO = lifecycleStateDAO;
    this.clock = clock;
  }

  /** Run until cancelled. Any exception escaping this method is fatal. */
  public void run(CancellationToken cancellationToken) {
    state = lifecycleStateDAO.load();

    login();
    reconcileSecrets();
    files.values().forEach(fileSpec -> fileMaterializer.materialize(fileSpec, state));
    notificationDispatcher.notifyReady();

    while (true) {
      notificationDispatcher.flushPending();
      lifecycleStateDAO.saveQuietly(state);

      var next = state.getNextToRenew();
      if (next.isEmpty()) {
        log.info("No secret to update");
        cancellationToken.await();
        log.info("Stopped");
        return;
      }

      var secret = next.get();
      var waitTime = Duration.between(clock.instant(), secret.getRenewAt());
      log.debug("Next update is secret '{}' in {}", secret.getName(), waitTime);
      if (cancellationToken.await(waitTime)) {
        log.info("Stopped");
        return;
      }
      renew(secret.getName());
    }
  }

  public LifecycleState getState() {
    return state;
  }

  private void login() {
    try {
      secretStoreClient.login();
    } catch (SecretStoreException e) {
      throw new PouchException("Couldn't log in to the secret store", e);
    }
    state.setToken(secretStoreClient.getToken());
    lifecycleStateDAO.saveQuietly(state);
  }

  /**
   * Resolve the secrets that are not known yet and forget the ones no longer configured. Known
   * secrets lose their usage entries, templates may have changed since they were recorded and the
   * file pass that follows registers them again.
   */
  private void reconcileSecrets() {
    var now = clock.instant();
    secrets.forEach(
        (name, spec) -> {
          var existing = state.getSecret(name);
          if (existing.isEmpty()) {
            secretResolver.resolveWithRetry(name, spec, state);
            return;
          }
          existing.get().clearUsages();
          if (existing.get().isDue(now)) {
            log.info("Secret '{}' expired while stopped", name);
            secretResolver.resolveWithRetry(name, spec, state);
          }
        });

    for (var name : List.copyOf(state.getSecretNames())) {
      if (!secrets.containsKey(name)) {
        log.info("Removing secret '{}', it is no longer configured", name);
        state.deleteSecret(name);
        lifecycleStateDAO.saveQuietly(state);
      }
    }
  }

  private void renew(String name) {
    log.info("Updating secret '{}'", name);
    var spec = secrets.get(name);
    SecretState secretState = secretResolver.resolveWithRetry(name, spec, state);

    for (FileUsage usage : new ArrayList<>(secretState.getFilesUsing())) {
      var fileSpec = files.get(usage.path());
      if (fileSpec == null) {
        log.warn("Secret '{}' is used by unknown file {}", name, usage.path());
        secretState.removeUsage(usage.path());
        continue;
      }
      log.info("Updating file '{}'", usage.path());
      fileMaterializer.materialize(fileSpec, state);
    }
  }
}
