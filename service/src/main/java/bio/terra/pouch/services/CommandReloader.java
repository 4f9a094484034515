package bio.terra.pouch.services;

import bio.terra.pouch.exception.ReloadException;
import bio.terra.pouch.models.NotifierSpec;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/** Reloads a notifier by running its configured command. */
@Slf4j
public class CommandReloader implements Reloader {

  private final Map<String, NotifierSpec> notifiers;

  public CommandReloader(Map<String, NotifierSpec> notifiers) {
    this.notifiers = Map.copyOf(notifiers);
  }

  @Override
  public void reload(String notifierName) {
    var notifier = notifiers.get(notifierName);
    if (notifier == null) {
      throw new ReloadException("Unknown notifier: " + notifierName);
    }
    if (notifier.getCommand().isEmpty()) {
      throw new ReloadException("No command configured for notifier " + notifierName);
    }
    Process process;
    try {
      process =
          new ProcessBuilder(notifier.getCommand())
              .redirectErrorStream(true)
              .redirectOutput(ProcessBuilder.Redirect.INHERIT)
              .start();
    } catch (IOException e) {
      throw new ReloadException("Couldn't run reload command of " + notifierName, e);
    }
    try {
      if (!process.waitFor(notifier.getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new ReloadException(
            "Reload command of %s did not finish within %s"
                .formatted(notifierName, notifier.getTimeout()));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ReloadException("Interrupted while reloading " + notifierName, e);
    }
    if (process.exitValue() != 0) {
      throw new ReloadException(
          "Reload command of %s exited with %d".formatted(notifierName, process.exitValue()));
    }
    log.debug("Reload command of {} finished", notifierName);
  }
}
