package bio.terra.pouch.exception;

public class FatalSecretStoreException extends SecretResolutionException {

  public FatalSecretStoreException(String secretName, Throwable cause) {
    super(
        secretName,
        "Could not resolve secret '%s': %s".formatted(secretName, cause.getMessage()),
        cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
