package bio.terra.pouch.services;

/** Told once when every configured file has been written for the first time. */
public interface ReadinessObserver {
  void notifyReady();
}
