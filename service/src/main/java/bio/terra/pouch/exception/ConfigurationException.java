package bio.terra.pouch.exception;

import bio.terra.pouch.PouchException;

/** A file, secret or notifier definition that can never be served correctly. */
public class ConfigurationException extends PouchException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
