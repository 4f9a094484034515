package bio.terra.pouch.services;

/** Makes a dependent service pick up its new configuration. */
public interface Reloader {
  void reload(String notifierName);
}
