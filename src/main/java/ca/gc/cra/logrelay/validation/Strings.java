package ca.gc.cra.logrelay.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings read from relay configuration and CLI arguments.
 * <p><strong>Why:</strong> Job names, topics, and subscription identifiers flow into metric attributes, Kafka
 * producers, and Pub/Sub resource names; rejecting bad values early keeps adapters from failing at runtime.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Restrict Kafka topic identifiers to the supported character set.</li>
 *   <li>Check that job names form valid metric-name components.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> Failures raise {@link IllegalArgumentException} naming the offending key.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");
  private static final Pattern METRIC_NAME_PATTERN = Pattern.compile("^[a-zA-Z_:][a-zA-Z0-9_:]*$");
  private static final Pattern RESOURCE_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._~%+-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Returns {@code null} for null or blank input, otherwise the trimmed value.
   *
   * @param value candidate text
   * @return trimmed text or {@code null}
   */
  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name logical parameter name for diagnostics
   * @param topic candidate topic
   * @return trimmed topic
   * @throws IllegalArgumentException if the topic is blank or uses unsupported characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates that a value can be used as a metric-name component ({@code [a-zA-Z_:][a-zA-Z0-9_:]*}).
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @return trimmed value
   * @throws IllegalArgumentException if the value is not a valid metric-name component
   */
  public static String requireMetricName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!METRIC_NAME_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "is not a valid metric name component: " + sanitized));
    }
    return sanitized;
  }

  /**
   * Validates a cloud resource identifier such as a project or subscription id.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate identifier
   * @return trimmed identifier
   * @throws IllegalArgumentException if the identifier is blank or contains path separators or spaces
   */
  public static String requireResourceId(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!RESOURCE_ID_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "contains unsupported characters: " + sanitized));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
