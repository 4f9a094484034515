package bio.terra.pouch.services;

import bio.terra.pouch.config.VaultProperties;
import bio.terra.pouch.exception.ConfigurationException;
import bio.terra.pouch.exception.SecretStoreException;
import bio.terra.pouch.models.SecretResult;
import bio.terra.pouch.models.VaultSecretResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/** Talks to a Vault server over its http api using a pre-issued token. */
@Slf4j
public class VaultRestClient implements SecretStoreClient {

  static final String TOKEN_HEADER = "X-Vault-Token";
  static final String LOOKUP_SELF_PATH = "/v1/auth/token/lookup-self";

  private final VaultProperties vaultProperties;
  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private String token;

  public VaultRestClient(
      VaultProperties vaultProperties, RestTemplate restTemplate, ObjectMapper objectMapper) {
    this.vaultProperties = vaultProperties;
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
  }

  /** Load the configured token and check that vault accepts it. */
  @Override
  public void login() {
    token = readToken();
    exchange(HttpMethod.GET.name(), LOOKUP_SELF_PATH, Map.of());
    log.info("Logged in to vault at {}", vaultProperties.getAddress());
  }

  @Override
  public String getToken() {
    return token;
  }

  @Override
  public SecretResult request(String httpMethod, String url, Map<String, Object> data) {
    return exchange(httpMethod, url, data).toSecretResult();
  }

  private VaultSecretResponse exchange(String httpMethod, String url, Map<String, Object> data) {
    var method = HttpMethod.valueOf(httpMethod.toUpperCase(Locale.ROOT));
    var headers = new HttpHeaders();
    if (token != null) {
      headers.set(TOKEN_HEADER, token);
    }
    HttpEntity<?> entity;
    if (data.isEmpty() || HttpMethod.GET.equals(method)) {
      entity = new HttpEntity<>(headers);
    } else {
      headers.setContentType(MediaType.APPLICATION_JSON);
      entity = new HttpEntity<>(data, headers);
    }
    ResponseEntity<String> response;
    try {
      response = restTemplate.exchange(url, method, entity, String.class);
    } catch (RestClientResponseException e) {
      throw new SecretStoreException(
          "%s %s failed with status %s".formatted(method, url, e.getStatusCode()),
          e.getStatusCode(),
          e);
    } catch (RestClientException e) {
      throw new SecretStoreException(
          "%s %s got no response: %s".formatted(method, url, e.getMessage()), null, e);
    }

    // the store answered, so from here on failures carry its status
    var body = response.getBody();
    if (body == null || body.isBlank()) {
      throw new SecretStoreException(
          "Got a successful response from %s %s, but the body was empty".formatted(method, url),
          response.getStatusCode());
    }
    try {
      return objectMapper.readValue(body, VaultSecretResponse.class);
    } catch (JsonProcessingException e) {
      throw new SecretStoreException(
          "Couldn't parse the response of %s %s: %s".formatted(method, url, e.getOriginalMessage()),
          response.getStatusCode(),
          e);
    }
  }

  private String readToken() {
    if (vaultProperties.getToken() != null) {
      return vaultProperties.getToken();
    }
    if (vaultProperties.getTokenPath() != null) {
      try {
        return Files.readString(vaultProperties.getTokenPath()).trim();
      } catch (IOException e) {
        throw new ConfigurationException(
            "Couldn't read vault token from " + vaultProperties.getTokenPath(), e);
      }
    }
    throw new ConfigurationException("Neither pouch.vault.token nor pouch.vault.token-path is set");
  }
}
