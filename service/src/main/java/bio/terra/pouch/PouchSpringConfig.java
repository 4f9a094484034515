package bio.terra.pouch;

import bio.terra.pouch.config.PouchConfig;
import bio.terra.pouch.dataAccess.LifecycleStateDAO;
import bio.terra.pouch.exception.ConfigurationException;
import bio.terra.pouch.models.FileSpec;
import bio.terra.pouch.models.NotifierSpec;
import bio.terra.pouch.models.SecretSpec;
import bio.terra.pouch.services.CommandReloader;
import bio.terra.pouch.services.FileMaterializer;
import bio.terra.pouch.services.LifecycleScheduler;
import bio.terra.pouch.services.NotificationDispatcher;
import bio.terra.pouch.services.ReadinessObserver;
import bio.terra.pouch.services.ReadyFileObserver;
import bio.terra.pouch.services.Reloader;
import bio.terra.pouch.services.SecretResolver;
import bio.terra.pouch.services.SecretStoreClient;
import bio.terra.pouch.services.VaultRestClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/** Spring configuration class for loading application config and code defined beans. */
@Configuration
@EnableConfigurationProperties
public class PouchSpringConfig {

  @Bean
  @ConfigurationProperties(value = "pouch", ignoreUnknownFields = false)
  public PouchConfig getPouchConfig() {
    return PouchConfig.create();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper retrySleeper() {
    return new ThreadWaitSleeper();
  }

  @Bean
  public SecretStoreClient secretStoreClient(
      PouchConfig pouchConfig,
      RestTemplateBuilder restTemplateBuilder,
      ObjectMapper objectMapper) {
    var vaultProperties = pouchConfig.getVault();
    if (vaultProperties == null) {
      throw new ConfigurationException("pouch.vault is not configured");
    }
    var restTemplate =
        restTemplateBuilder
            .rootUri(vaultProperties.getAddress().toString())
            .setConnectTimeout(vaultProperties.getRequestTimeout())
            .setReadTimeout(vaultProperties.getRequestTimeout())
            .build();
    return new VaultRestClient(vaultProperties, restTemplate, objectMapper);
  }

  @Bean
  public Reloader reloader(PouchConfig pouchConfig) {
    var notifiers = new HashMap<String, NotifierSpec>();
    pouchConfig
        .getNotifiers()
        .forEach(
            (name, properties) ->
                notifiers.put(name, NotifierSpec.fromProperties(name, properties)));
    return new CommandReloader(notifiers);
  }

  @Bean
  public NotificationDispatcher notificationDispatcher(
      Reloader reloader,
      ObjectProvider<ReadinessObserver> readinessObservers,
      PouchConfig pouchConfig,
      Clock clock) {
    var observers = new ArrayList<ReadinessObserver>(readinessObservers.orderedStream().toList());
    if (pouchConfig.getReadyFile() != null) {
      observers.add(new ReadyFileObserver(pouchConfig.getReadyFile(), clock));
    }
    return new NotificationDispatcher(reloader, observers);
  }

  @Bean
  public LifecycleScheduler lifecycleScheduler(
      PouchConfig pouchConfig,
      SecretStoreClient secretStoreClient,
      SecretResolver secretResolver,
      FileMaterializer fileMaterializer,
      NotificationDispatcher notificationDispatcher,
      LifecycleStateDAO lifecycleStateDAO,
      Clock clock) {
    var secretSpecs =
        pouchConfig.getSecrets().entrySet().stream()
            .map(entry -> SecretSpec.fromProperties(entry.getKey(), entry.getValue()))
            .toList();
    var fileSpecs = pouchConfig.getFiles().stream().map(FileSpec::fromProperties).toList();
    return new LifecycleScheduler(
        secretSpecs,
        fileSpecs,
        secretStoreClient,
        secretResolver,
        fileMaterializer,
        notificationDispatcher,
        lifecycleStateDAO,
        clock);
  }
}
