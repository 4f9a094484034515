package bio.terra.pouch.services;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.net.UnknownHostException;
import java.util.Map;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SecretDataExpanderTest {

  private final Map<String, String> environment = Map.of("REGION", "us-east1");

  private final SecretDataExpander secretDataExpander =
      new SecretDataExpander(environment::get, () -> "worker-1");

  @Test
  void testExpandEnvAndHostname() {
    var expanded =
        secretDataExpander.expand(
            Map.of("common_name", "#{hostname()}.#{env('REGION')}.example.com"));

    assertEquals(Map.of("common_name", "worker-1.us-east1.example.com"), expanded);
  }

  @Test
  void testUnsetVariableIsEmpty() {
    assertEquals(
        Map.of("value", "[]"), secretDataExpander.expand(Map.of("value", "[#{env('MISSING')}]")));
  }

  @Test
  void testNonStringValuesUnchanged() {
    var data = Map.<String, Object>of("ttl", 3600, "exclude_cn", true, "name", "plain");

    assertEquals(data, secretDataExpander.expand(data));
  }

  @Test
  void testFailedExpansionKeepsValue() {
    var failing =
        new SecretDataExpander(
            environment::get,
            () -> {
              throw new UnknownHostException("no network");
            });

    var expanded =
        failing.expand(
            Map.of("host", "#{hostname()}", "broken", "#{env(}", "region", "#{env('REGION')}"));

    assertEquals(
        Map.of("host", "#{hostname()}", "broken", "#{env(}", "region", "us-east1"), expanded);
  }
}
