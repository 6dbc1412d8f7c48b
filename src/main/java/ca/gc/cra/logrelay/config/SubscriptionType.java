package ca.gc.cra.logrelay.config;

import java.util.Locale;

/**
 * How a target receives messages from Pub/Sub.
 *
 * @since 0.1.0
 */
public enum SubscriptionType {
  /** The relay holds a streaming pull subscription. */
  PULL,
  /** Pub/Sub delivers messages to the relay over HTTP. */
  PUSH;

  /**
   * Parses a configuration value; blank defaults to {@link #PULL}.
   *
   * @param raw value such as {@code pull} or {@code push}
   * @return subscription type
   * @throws IllegalArgumentException if the value is unknown
   */
  public static SubscriptionType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return PULL;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "pull" -> PULL;
      case "push" -> PUSH;
      default -> throw new IllegalArgumentException("subscription_type must be pull or push (was " + raw + ")");
    };
  }
}
