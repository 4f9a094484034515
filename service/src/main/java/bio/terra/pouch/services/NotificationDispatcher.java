package bio.terra.pouch.services;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects the notifiers of changed files and reloads each of them once per flush. Failures are
 * logged and never retried within the same flush.
 */
@Slf4j
public class NotificationDispatcher {

  private final Reloader reloader;
  private final List<ReadinessObserver> readinessObservers;
  private final Set<String> pendingNotifiers = new LinkedHashSet<>();

  public NotificationDispatcher(Reloader reloader, List<ReadinessObserver> readinessObservers) {
    this.reloader = reloader;
    this.readinessObservers = List.copyOf(readinessObservers);
  }

  public void markPending(Collection<String> notifierNames) {
    pendingNotifiers.addAll(notifierNames);
  }

  public void markPending(String... notifierNames) {
    markPending(List.of(notifierNames));
  }

  public Set<String> getPendingNotifiers() {
    return Collections.unmodifiableSet(pendingNotifiers);
  }

  public void flushPending() {
    var notifierNames = List.copyOf(pendingNotifiers);
    pendingNotifiers.clear();
    notifierNames.forEach(this::reload);
  }

  public void notifyReady() {
    readinessObservers.forEach(
        observer -> {
          try {
            observer.notifyReady();
          } catch (Exception e) {
            log.error("Readiness observer {} failed", observer.getClass().getSimpleName(), e);
          }
        });
  }

  private void reload(String notifierName) {
    try {
      log.info("Reloading '{}'", notifierName);
      reloader.reload(notifierName);
    } catch (Exception e) {
      log.error("Failed to reload '{}'", notifierName, e);
    }
  }
}
