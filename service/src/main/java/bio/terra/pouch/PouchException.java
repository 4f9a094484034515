package bio.terra.pouch;

public class PouchException extends RuntimeException {

  public PouchException(String message) {
    super(message);
  }

  public PouchException(String message, Throwable cause) {
    super(message, cause);
  }
}
