package bio.terra.pouch.exception;

/** The store did not answer or answered with a 5xx. Worth trying again. */
public class TransientSecretStoreException extends SecretResolutionException {

  public TransientSecretStoreException(String secretName, Throwable cause) {
    super(
        secretName,
        "Transient failure resolving secret '%s': %s".formatted(secretName, cause.getMessage()),
        cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
