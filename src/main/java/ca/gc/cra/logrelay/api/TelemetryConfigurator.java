package ca.gc.cra.logrelay.api;

import ca.gc.cra.logrelay.config.RelayConfig;
import ca.gc.cra.logrelay.logging.Logs;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies metrics settings into the {@code otel.*} system properties read by the OpenTelemetry bootstrap.
 * Command-line values take precedence over the {@code metrics} section of the config file.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";

  private TelemetryConfigurator() {}

  /**
   * Applies and removes {@code metricsExporter} and {@code otelEndpoint} from the argument map.
   *
   * @param args parsed CLI arguments; consumed keys are removed
   * @throws IllegalArgumentException if a value is invalid
   */
  static void configureFromArgs(Map<String, String> args) {
    String exporter = args.remove("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      System.setProperty(EXPORTER_PROPERTY, normalizeExporter(exporter));
    }
    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      System.setProperty(ENDPOINT_PROPERTY, validateEndpoint(endpoint.trim()));
    }
  }

  /**
   * Applies the config file's metrics section where the command line left a property unset.
   *
   * @param config loaded relay configuration
   * @throws IllegalArgumentException if a value is invalid
   */
  static void configureFromFile(RelayConfig config) {
    applyIfUnset(EXPORTER_PROPERTY, config.metricsExporter().map(TelemetryConfigurator::normalizeExporter));
    applyIfUnset(ENDPOINT_PROPERTY, config.metricsEndpoint().map(e -> validateEndpoint(e.trim())));
  }

  private static void applyIfUnset(String property, Optional<String> value) {
    if (value.isPresent() && System.getProperty(property) == null) {
      log.debug("Configuring {} from config file", property);
      System.setProperty(property, value.get());
    }
  }

  static String normalizeExporter(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metrics exporter must be 'otlp' or 'none' (was '" + raw + "')");
    }
    return normalized;
  }

  static String validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("metrics endpoint must use http or https: " + Logs.redactUserInfo(raw));
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("metrics endpoint must include a host: " + Logs.redactUserInfo(raw));
      }
      return raw;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("metrics endpoint must be a valid URI", ex);
    }
  }
}
