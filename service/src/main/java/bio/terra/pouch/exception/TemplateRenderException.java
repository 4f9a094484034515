package bio.terra.pouch.exception;

public class TemplateRenderException extends ConfigurationException {

  public TemplateRenderException(String message) {
    super(message);
  }

  public TemplateRenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
