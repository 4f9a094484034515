package bio.terra.pouch.services;

import bio.terra.pouch.exception.SecretStoreException;
import bio.terra.pouch.models.SecretResult;
import java.util.Map;

/**
 * The operations the daemon needs from a secret store. Implementations report failures with a
 * {@link SecretStoreException} carrying the response status, or no status when nothing was
 * received.
 */
public interface SecretStoreClient {

  void login();

  String getToken();

  SecretResult request(String httpMethod, String url, Map<String, Object> data);
}
