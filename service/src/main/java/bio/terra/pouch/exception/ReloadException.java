package bio.terra.pouch.exception;

import bio.terra.pouch.PouchException;

public class ReloadException extends PouchException {

  public ReloadException(String message) {
    super(message);
  }

  public ReloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
