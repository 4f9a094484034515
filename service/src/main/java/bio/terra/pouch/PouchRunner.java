package bio.terra.pouch;

import bio.terra.pouch.services.CancellationToken;
import bio.terra.pouch.services.LifecycleScheduler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the scheduler on the main thread once the context is up. A failure propagates out of
 * {@code SpringApplication.run} and ends the process with a non-zero status.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pouch.runner-enabled", havingValue = "true", matchIfMissing = true)
public class PouchRunner implements ApplicationRunner {

  private final LifecycleScheduler lifecycleScheduler;
  private final CancellationToken cancellationToken = new CancellationToken();

  public PouchRunner(LifecycleScheduler lifecycleScheduler) {
    this.lifecycleScheduler = lifecycleScheduler;
  }

  @Override
  public void run(ApplicationArguments args) {
    log.info("beginning secret lifecycle");
    lifecycleScheduler.run(cancellationToken);
  }

  @PreDestroy
  void stop() {
    log.info("Shutting down, cancelling secret lifecycle");
    cancellationToken.cancel();
  }
}
