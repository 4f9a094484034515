package bio.terra.pouch.exception;

import bio.terra.pouch.PouchException;

public class MaterializationException extends PouchException {

  public MaterializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
