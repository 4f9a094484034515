package bio.terra.pouch.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import bio.terra.pouch.TestUtils;
import bio.terra.pouch.dataAccess.LifecycleStateDAO;
import bio.terra.pouch.exception.FatalSecretStoreException;
import bio.terra.pouch.exception.SecretStoreException;
import bio.terra.pouch.exception.TransientSecretStoreException;
import bio.terra.pouch.models.LifecycleState;
import bio.terra.pouch.models.SecretResult;
import bio.terra.pouch.models.SecretSpec;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

@Tag("unit")
class SecretResolverTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final SecretSpec secretSpec =
      new SecretSpec.Builder()
          .name("db")
          .httpMethod("POST")
          .url("/v1/database/creds/app")
          .putData("ttl", "1h")
          .putData("host", "#{hostname()}")
          .build();

  private final SecretResult secretResult =
      TestUtils.createSecretResult(Map.of("username", "app"), Duration.ofHours(1));

  private SecretStoreClient secretStoreClient;
  private LifecycleStateDAO lifecycleStateDAO;
  private List<Long> sleeps;
  private SecretResolver secretResolver;
  private LifecycleState state;

  @BeforeEach
  void setup() {
    secretStoreClient = mock(SecretStoreClient.class);
    lifecycleStateDAO = mock(LifecycleStateDAO.class);
    sleeps = new ArrayList<>();
    secretResolver =
        new SecretResolver(
            secretStoreClient,
            new SecretDataExpander(name -> null, () -> "worker-1"),
            lifecycleStateDAO,
            TestUtils.createPouchConfig(Path.of("/unused")),
            Clock.fixed(NOW, ZoneOffset.UTC),
            sleeps::add);
    state = new LifecycleState();
  }

  private void requestReturns(Object... outcomes) {
    var stubbing = when(secretStoreClient.request(eq("POST"), eq("/v1/database/creds/app"), any()));
    for (var outcome : outcomes) {
      if (outcome instanceof RuntimeException e) {
        stubbing = stubbing.thenThrow(e);
      } else {
        stubbing = stubbing.thenReturn((SecretResult) outcome);
      }
    }
  }

  @Nested
  class Resolve {

    @Test
    void testStoresResultAndSaves() {
      requestReturns(secretResult);

      var secretState = secretResolver.resolve("db", secretSpec, state);

      assertEquals(Map.of("username", "app"), secretState.getData());
      assertEquals(NOW, secretState.getResolvedAt());
      assertEquals(NOW.plus(Duration.ofMinutes(45)), secretState.getRenewAt());
      assertEquals(secretState, state.getSecret("db").orElseThrow());
      verify(lifecycleStateDAO).saveQuietly(state);
    }

    @Test
    void testExpandsRequestData() {
      requestReturns(secretResult);

      secretResolver.resolve("db", secretSpec, state);

      verify(secretStoreClient)
          .request("POST", "/v1/database/creds/app", Map.of("ttl", "1h", "host", "worker-1"));
    }

    @Test
    void testFailureLeavesStateUntouched() {
      requestReturns(new SecretStoreException("forbidden", HttpStatus.FORBIDDEN));

      assertThrows(
          FatalSecretStoreException.class, () -> secretResolver.resolve("db", secretSpec, state));

      assertTrue(state.getSecret("db").isEmpty());
      verify(lifecycleStateDAO, never()).saveQuietly(any());
    }
  }

  @Nested
  class Classify {

    @Test
    void testNoResponseIsTransient() {
      var e = SecretResolver.classify("db", new SecretStoreException("refused", null));

      assertInstanceOf(TransientSecretStoreException.class, e);
      assertTrue(e.isRetryable());
      assertEquals("db", e.getSecretName());
    }

    @Test
    void testServerErrorIsTransient() {
      assertInstanceOf(
          TransientSecretStoreException.class,
          SecretResolver.classify(
              "db", new SecretStoreException("sealed", HttpStatus.SERVICE_UNAVAILABLE)));
      assertInstanceOf(
          TransientSecretStoreException.class,
          SecretResolver.classify(
              "db", new SecretStoreException("error", HttpStatus.INTERNAL_SERVER_ERROR)));
    }

    @Test
    void testClientErrorIsFatal() {
      var e =
          SecretResolver.classify("db", new SecretStoreException("denied", HttpStatus.FORBIDDEN));

      assertInstanceOf(FatalSecretStoreException.class, e);
      assertFalse(e.isRetryable());
    }

    @Test
    void testEmptySuccessfulResponseIsFatal() {
      assertInstanceOf(
          FatalSecretStoreException.class,
          SecretResolver.classify("db", new SecretStoreException("empty", HttpStatus.OK)));
    }
  }

  @Nested
  class ResolveWithRetry {

    @Test
    void testRetriesTransientFailures() {
      requestReturns(
          new SecretStoreException("sealed", HttpStatus.SERVICE_UNAVAILABLE),
          new SecretStoreException("refused", null),
          secretResult);

      var secretState = secretResolver.resolveWithRetry("db", secretSpec, state);

      assertEquals(Map.of("username", "app"), secretState.getData());
      verify(secretStoreClient, times(3)).request(any(), any(), any());
      assertEquals(List.of(5000L, 5000L), sleeps);
    }

    @Test
    void testFatalFailureIsNotRetried() {
      requestReturns(new SecretStoreException("denied", HttpStatus.FORBIDDEN), secretResult);

      assertThrows(
          FatalSecretStoreException.class,
          () -> secretResolver.resolveWithRetry("db", secretSpec, state));

      verify(secretStoreClient, times(1)).request(any(), any(), any());
      assertTrue(sleeps.isEmpty());
    }

    @Test
    void testUnexpectedFailureIsNotRetried() {
      when(secretStoreClient.request(any(), any(), any()))
          .thenThrow(new IllegalStateException("bug"));

      assertThrows(
          IllegalStateException.class,
          () -> secretResolver.resolveWithRetry("db", secretSpec, state));

      verify(secretStoreClient, times(1)).request(any(), any(), any());
      assertTrue(sleeps.isEmpty());
    }

    @Test
    void testFatalFailureAfterTransientOne() {
      requestReturns(
          new SecretStoreException("sealed", HttpStatus.SERVICE_UNAVAILABLE),
          new SecretStoreException("not found", HttpStatus.NOT_FOUND));

      assertThrows(
          FatalSecretStoreException.class,
          () -> secretResolver.resolveWithRetry("db", secretSpec, state));

      verify(secretStoreClient, times(2)).request(any(), any(), any());
      assertEquals(List.of(5000L), sleeps);
    }
  }

  @Nested
  class RenewalInstant {

    @Test
    void testFractionOfLease() {
      assertEquals(
          NOW.plus(Duration.ofMinutes(45)), secretResolver.renewalInstant(secretResult, NOW));
    }

    @Test
    void testNoLease() {
      assertNull(
          secretResolver.renewalInstant(
              TestUtils.createSecretResult(Map.of(), Duration.ZERO), NOW));
    }
  }
}
