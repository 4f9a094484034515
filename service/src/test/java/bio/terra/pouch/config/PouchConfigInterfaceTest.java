package bio.terra.pouch.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PouchConfigInterfaceTest {

  @Test
  void testDefaults() {
    var pouchConfig = PouchConfig.create().setStatePath(Path.of("/var/lib/pouch/state.json"));

    assertEquals(Duration.ofSeconds(5), pouchConfig.getSecretRetryPeriod());
    assertEquals(0.75, pouchConfig.getRenewalRatio());
    assertTrue(pouchConfig.isRunnerEnabled());
    assertNull(pouchConfig.getVault());
    assertNull(pouchConfig.getReadyFile());
    assertTrue(pouchConfig.getSecrets().isEmpty());
    assertTrue(pouchConfig.getFiles().isEmpty());
  }

  @Test
  void testNestedDefaults() {
    var secretProperties = SecretProperties.create().setUrl("/v1/secret/tls");
    var notifierProperties = NotifierProperties.create();
    var fileProperties = FileProperties.create().setPath(Path.of("/etc/tls.pem"));

    assertEquals("GET", secretProperties.getHttpMethod());
    assertTrue(secretProperties.getData().isEmpty());
    assertEquals(Duration.ofSeconds(30), notifierProperties.getTimeout());
    assertEquals(0, fileProperties.getPriority());
    assertNull(fileProperties.getMode());
  }
}
