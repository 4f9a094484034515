package bio.terra.pouch.services;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CancellationTokenTest {

  private final CancellationToken cancellationToken = new CancellationToken();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void testTimeoutElapses() {
    assertFalse(cancellationToken.await(Duration.ofMillis(10)));
    assertFalse(cancellationToken.isCancelled());
  }

  @Test
  void testNonPositiveTimeoutDoesNotWait() {
    assertFalse(cancellationToken.await(Duration.ZERO));
    assertFalse(cancellationToken.await(Duration.ofSeconds(-5)));

    cancellationToken.cancel();

    assertTrue(cancellationToken.await(Duration.ofSeconds(-5)));
  }

  @Test
  void testCancelledBeforeWait() {
    cancellationToken.cancel();

    assertTimeoutPreemptively(
        Duration.ofSeconds(5),
        () -> {
          assertTrue(cancellationToken.await(Duration.ofHours(1)));
          cancellationToken.await();
        });
  }

  @Test
  void testCancelledFromAnotherThread() throws InterruptedException {
    var canceller = new Thread(cancellationToken::cancel);
    canceller.start();

    assertTrue(cancellationToken.await(Duration.ofMinutes(1)));
    canceller.join();
  }

  @Test
  void testInterruptCountsAsCancelled() {
    Thread.currentThread().interrupt();

    assertTrue(cancellationToken.await(Duration.ofMinutes(1)));
    assertTrue(Thread.currentThread().isInterrupted());
  }
}
