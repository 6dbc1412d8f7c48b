package ca.gc.cra.logrelay.application.target;

/**
 * Kinds of ingestion targets managed by the relay.
 *
 * @since 0.1.0
 */
public enum TargetType {
  /** Google Cloud Pub/Sub log target, in push or pull mode. */
  GCPLOG("Gcplog");

  private final String displayName;

  TargetType(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the name shown in target listings.
   *
   * @return display name
   */
  public String displayName() {
    return displayName;
  }
}
