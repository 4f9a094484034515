package bio.terra.pouch.exception;

import bio.terra.pouch.PouchException;

public abstract class SecretResolutionException extends PouchException {

  private final String secretName;

  protected SecretResolutionException(String secretName, String message, Throwable cause) {
    super(message, cause);
    this.secretName = secretName;
  }

  public String getSecretName() {
    return secretName;
  }

  public abstract boolean isRetryable();
}
