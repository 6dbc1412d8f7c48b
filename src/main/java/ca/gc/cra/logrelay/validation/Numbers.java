package ca.gc.cra.logrelay.validation;

import java.time.Duration;
import java.util.Locale;

/**
 * Numeric and duration checks for relay configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if the value is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer configuration value.
   *
   * @param name logical parameter name for diagnostics
   * @param raw textual value
   * @return parsed value
   * @throws IllegalArgumentException if the value is not numeric
   */
  public static long parseLong(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + value + ")", ex);
    }
  }

  /**
   * Parses a duration written as a number followed by {@code ms}, {@code s}, {@code m}, or {@code h}. A bare number
   * is read as seconds.
   *
   * @param name logical parameter name for diagnostics
   * @param raw textual value such as {@code 5s} or {@code 250ms}
   * @return parsed, non-negative duration
   * @throws IllegalArgumentException if the value cannot be parsed
   */
  public static Duration parseDuration(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    int split = 0;
    while (split < value.length() && Character.isDigit(value.charAt(split))) {
      split++;
    }
    if (split == 0) {
      throw new IllegalArgumentException(label(name) + " must start with a number (was " + raw + ")");
    }
    long amount = parseLong(name, value.substring(0, split));
    String unit = value.substring(split).trim();
    return switch (unit) {
      case "ms" -> Duration.ofMillis(amount);
      case "", "s" -> Duration.ofSeconds(amount);
      case "m" -> Duration.ofMinutes(amount);
      case "h" -> Duration.ofHours(amount);
      default -> throw new IllegalArgumentException(label(name) + " has unknown unit '" + unit + "'");
    };
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
