package bio.terra.pouch.services;

import bio.terra.pouch.exception.TemplateRenderException;
import java.net.InetAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Expands {@code #{env('VAR')}} and {@code #{hostname()}} in the string values of secret request
 * data. A value that fails to expand is sent as written.
 */
@Slf4j
@Component
public class SecretDataExpander {

  private final DataFunctions functions;

  public SecretDataExpander() {
    this(System::getenv, () -> InetAddress.getLocalHost().getHostName());
  }

  SecretDataExpander(UnaryOperator<String> environment, Callable<String> hostname) {
    this.functions = new DataFunctions(environment, hostname);
  }

  public Map<String, Object> expand(Map<String, Object> data) {
    var result = new LinkedHashMap<String, Object>();
    data.forEach((key, value) -> result.put(key, expandValue(key, value)));
    return result;
  }

  private Object expandValue(String key, Object value) {
    if (!(value instanceof String template)) {
      return value;
    }
    try {
      return TemplateRenderer.evaluate("secret-data", template, functions);
    } catch (TemplateRenderException e) {
      log.warn("When resolving data template '{}' for '{}': {}", template, key, e.getMessage());
      return value;
    }
  }

  public static class DataFunctions {
    private final UnaryOperator<String> environment;
    private final Callable<String> hostname;

    DataFunctions(UnaryOperator<String> environment, Callable<String> hostname) {
      this.environment = environment;
      this.hostname = hostname;
    }

    public String env(String name) {
      var value = environment.apply(name);
      return value == null ? "" : value;
    }

    public String hostname() {
      try {
        return hostname.call();
      } catch (Exception e) {
        throw new TemplateRenderException("Couldn't get hostname: " + e.getMessage(), e);
      }
    }
  }
}
