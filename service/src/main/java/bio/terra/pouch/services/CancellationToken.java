package bio.terra.pouch.services;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Lets another thread stop the run loop while it waits for the next renewal. */
public class CancellationToken {

  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * Wait until cancelled or until the timeout elapses. An interrupted wait counts as cancelled.
   *
   * @return true if cancelled
   */
  public boolean await(Duration timeout) {
    if (timeout.isNegative() || timeout.isZero()) {
      return isCancelled();
    }
    try {
      return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  /** Wait with no timeout. */
  public void await() {
    try {
      cancelled.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
