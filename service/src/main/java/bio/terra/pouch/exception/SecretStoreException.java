package bio.terra.pouch.exception;

import bio.terra.pouch.PouchException;
import jakarta.annotation.Nullable;
import java.util.Optional;
import org.springframework.http.HttpStatusCode;

/**
 * Raised by a secret store client. The status code is absent when no response was received at
 * all, e.g. on connection failures.
 */
public class SecretStoreException extends PouchException {

  @Nullable private final HttpStatusCode statusCode;

  public SecretStoreException(String message, @Nullable HttpStatusCode statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public SecretStoreException(
      String message, @Nullable HttpStatusCode statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public Optional<HttpStatusCode> getStatusCode() {
    return Optional.ofNullable(statusCode);
  }
}
