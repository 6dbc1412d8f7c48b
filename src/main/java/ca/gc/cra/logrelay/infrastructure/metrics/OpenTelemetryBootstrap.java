package ca.gc.cra.logrelay.infrastructure.metrics;

import ca.gc.cra.logrelay.logging.Logs;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the relay.
 *
 * <p>The exporter and endpoint are read from the {@code otel.metrics.exporter} and
 * {@code otel.exporter.otlp.endpoint} system properties (the CLI copies the {@code metrics} section of the relay
 * config there) and then from the {@code OTEL_METRICS_EXPORTER} and {@code OTEL_EXPORTER_OTLP_ENDPOINT}
 * environment variables. Exporter {@code none} yields a noop result, as does any initialization failure.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.logrelay";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    return initialize(Settings.resolve(System.getProperties()::getProperty, System::getenv));
  }

  static BootstrapResult initialize(Settings settings) {
    Objects.requireNonNull(settings, "settings");
    if (settings.exporter() == ExporterMode.NONE) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = build(reader);
      log.info("OpenTelemetry metrics exporting via OTLP to {}", Logs.redactUserInfo(settings.endpoint()));
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = detectServiceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new BootstrapResult(meter, provider);
  }

  private static Resource buildResource(String version) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "logrelay")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    String instanceId = detectInstanceId();
    if (!instanceId.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instanceId);
    }
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static String detectInstanceId() {
    String override = System.getenv("OTEL_RESOURCE_SERVICE_INSTANCE");
    if (override != null && !override.isBlank()) {
      return override.trim();
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Unable to resolve local host name for service.instance.id", ex);
      return "";
    }
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/logrelay/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        return props.getProperty("version", "0.0.0-dev");
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  /**
   * Resolved exporter settings.
   *
   * @param exporter exporter mode
   * @param endpoint OTLP endpoint
   */
  record Settings(ExporterMode exporter, String endpoint) {
    Settings {
      Objects.requireNonNull(exporter, "exporter");
      Objects.requireNonNull(endpoint, "endpoint");
    }

    static Settings resolve(Function<String, String> properties, Function<String, String> environment) {
      String exporter = firstNonBlank(
          properties.apply("otel.metrics.exporter"), environment.apply("OTEL_METRICS_EXPORTER"), "otlp");
      String endpoint = firstNonBlank(
          properties.apply("otel.exporter.otlp.endpoint"),
          environment.apply("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      return new Settings(ExporterMode.from(exporter), endpoint);
    }

    private static String firstNonBlank(String first, String second, String defaultValue) {
      if (first != null && !first.isBlank()) {
        return first.trim();
      }
      if (second != null && !second.isBlank()) {
        return second.trim();
      }
      return defaultValue;
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; defaulting to otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within {}", SHUTDOWN_TIMEOUT);
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
