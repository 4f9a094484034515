package bio.terra.pouch.services;

import bio.terra.pouch.config.PouchConfig;
import bio.terra.pouch.dataAccess.LifecycleStateDAO;
import bio.terra.pouch.exception.FatalSecretStoreException;
import bio.terra.pouch.exception.SecretResolutionException;
import bio.terra.pouch.exception.SecretStoreException;
import bio.terra.pouch.exception.TransientSecretStoreException;
import bio.terra.pouch.models.LifecycleState;
import bio.terra.pouch.models.SecretResult;
import bio.terra.pouch.models.SecretSpec;
import bio.terra.pouch.models.SecretState;
import jakarta.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.AlwaysRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SecretResolver {

  private final SecretStoreClient secretStoreClient;
  private final SecretDataExpander secretDataExpander;
  private final LifecycleStateDAO lifecycleStateDAO;
  private final Clock clock;
  private final double renewalRatio;
  private final RetryTemplate retryTemplate;

  public SecretResolver(
      SecretStoreClient secretStoreClient,
      SecretDataExpander secretDataExpander,
      LifecycleStateDAO lifecycleStateDAO,
      PouchConfig pouchConfig,
      Clock clock,
      Sleeper sleeper) {
    this.secretStoreClient = secretStoreClient;
    this.secretDataExpander = secretDataExpander;
    this.lifecycleStateDAO = lifecycleStateDAO;
    this.clock = clock;
    this.renewalRatio = pouchConfig.getRenewalRatio();
    this.retryTemplate = buildRetryTemplate(pouchConfig.getSecretRetryPeriod(), sleeper);
  }

  /**
   * Make a single request for the secret and store the result in the state.
   *
   * @throws TransientSecretStoreException if there was no response or a 5xx one
   * @throws FatalSecretStoreException for any other failure
   */
  public SecretState resolve(String name, SecretSpec secretSpec, LifecycleState state) {
    var data = secretDataExpander.expand(secretSpec.getData());
    SecretResult result;
    try {
      result = secretStoreClient.request(secretSpec.getHttpMethod(), secretSpec.getUrl(), data);
    } catch (SecretStoreException e) {
      throw classify(name, e);
    }
    var now = clock.instant();
    var secretState = state.setSecret(name, result, now, renewalInstant(result, now));
    log.info(
        "Resolved secret '{}', next renewal {}",
        name,
        secretState.getNextRenewal().map(Instant::toString).orElse("never"));
    lifecycleStateDAO.saveQuietly(state);
    return secretState;
  }

  /**
   * Resolve the secret, trying again after the configured retry period for as long as the
   * failures are transient.
   */
  public SecretState resolveWithRetry(String name, SecretSpec secretSpec, LifecycleState state) {
    return retryTemplate.execute(context -> resolve(name, secretSpec, state));
  }

  static SecretResolutionException classify(String name, SecretStoreException e) {
    var statusCode = e.getStatusCode();
    if (statusCode.isEmpty()) {
      // connection error, no response from the server at all
      return new TransientSecretStoreException(name, e);
    }
    if (statusCode.get().is5xxServerError()) {
      // unavailable behind a proxy, or sealed
      return new TransientSecretStoreException(name, e);
    }
    // 4xx: the request or our permissions are wrong, trying again won't help
    return new FatalSecretStoreException(name, e);
  }

  @Nullable
  Instant renewalInstant(SecretResult result, Instant resolvedAt) {
    var leaseDuration = result.getLeaseDuration();
    if (leaseDuration.isZero() || leaseDuration.isNegative()) {
      return null;
    }
    var renewAfter = Duration.ofMillis((long) (leaseDuration.toMillis() * renewalRatio));
    return resolvedAt.plus(renewAfter);
  }

  private static RetryTemplate buildRetryTemplate(Duration retryPeriod, Sleeper sleeper) {
    var backOffPolicy = new FixedBackOffPolicy();
    backOffPolicy.setBackOffPeriod(retryPeriod.toMillis());
    backOffPolicy.setSleeper(sleeper);
    return RetryTemplate.builder()
        .customPolicy(new RetryableResolutionPolicy())
        .customBackoff(backOffPolicy)
        .withListener(
            new RetryListener() {
              @Override
              public <T, E extends Throwable> void onError(
                  RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                if (throwable instanceof SecretResolutionException e && e.isRetryable()) {
                  log.warn(
                      "Secret '{}' not resolved (attempt {}), trying again in {}: {}",
                      e.getSecretName(),
                      context.getRetryCount(),
                      retryPeriod,
                      e.getCause().getMessage());
                }
              }
            })
        .build();
  }

  /** Retries for as long as the last failure says it is worth another attempt. */
  static class RetryableResolutionPolicy extends AlwaysRetryPolicy {
    @Override
    public boolean canRetry(RetryContext context) {
      var lastThrowable = context.getLastThrowable();
      return lastThrowable == null
          || (lastThrowable instanceof SecretResolutionException e && e.isRetryable());
    }
  }
}
