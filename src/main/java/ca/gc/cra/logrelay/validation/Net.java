package ca.gc.cra.logrelay.validation;

import java.util.regex.Pattern;

/**
 * Host and port checks for Kafka bootstrap servers, emulator endpoints, and listen addresses.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final Pattern HOST_PATTERN =
      Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*$");

  private Net() {
    // Utility
  }

  /**
   * Validates a {@code HOST:PORT} pair. IPv6 literals must be bracketed.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException if the value is malformed
   */
  public static String validateHostPort(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    int lastColon = sanitized.lastIndexOf(':');
    if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
      throw new IllegalArgumentException(name + " must use HOST:PORT format (was " + sanitized + ")");
    }
    String host = sanitized.substring(0, lastColon);
    validateHost(name, host);
    int port = (int) Numbers.parseLong(name + " port", sanitized.substring(lastColon + 1));
    Numbers.requireRange(name + " port", port, 1, 65535);
    return host + ':' + port;
  }

  /**
   * Validates a comma-separated list of {@code HOST:PORT} pairs.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate list
   * @return normalized list
   * @throws IllegalArgumentException if any element is malformed
   */
  public static String validateHostPortList(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    StringBuilder normalized = new StringBuilder();
    for (String part : sanitized.split(",")) {
      if (normalized.length() > 0) {
        normalized.append(',');
      }
      normalized.append(validateHostPort(name, part.trim()));
    }
    return normalized.toString();
  }

  /**
   * Validates a bare host name, IPv4 address, or bracketed IPv6 literal.
   *
   * @param name logical parameter name for diagnostics
   * @param host candidate host
   * @return {@code host}
   * @throws IllegalArgumentException if the host is malformed
   */
  public static String validateHost(String name, String host) {
    String sanitized = Strings.requireNonBlank(name, host);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      return sanitized;
    }
    if (sanitized.indexOf(':') >= 0) {
      throw new IllegalArgumentException(name + ": IPv6 host must be wrapped in [ ]");
    }
    if (sanitized.length() > 253 || !HOST_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(name + ": invalid host '" + sanitized + "'");
    }
    return sanitized;
  }
}
