package bio.terra.pouch.services;

/** Gives file templates access to secret fields. */
@FunctionalInterface
public interface SecretLookup {

  /**
   * @throws bio.terra.pouch.exception.TemplateRenderException if the secret or the field is
   *     unknown
   */
  Object lookup(String secretName, String key);
}
