package ca.gc.cra.logrelay.infrastructure.metrics;

import ca.gc.cra.logrelay.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableLongGauge;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards relay counters, histograms, and gauges to OpenTelemetry.
 *
 * <p>Every data point carries a {@code logrelay.metric.key} attribute with the unsanitized key, plus the attributes
 * supplied by the caller. Gauges are observable instruments reading the last value set per attribute set.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("logrelay.metric.key");
  private static final String FALLBACK_METRIC_NAME = "logrelay.metric";

  private final MetricsDelegate delegate;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void increment(String key, Map<String, String> attributes) {
    delegate.increment(key, attributes);
  }

  @Override
  public void observe(String key, long value, Map<String, String> attributes) {
    delegate.observe(key, value, attributes);
  }

  @Override
  public void gauge(String key, long value, Map<String, String> attributes) {
    delegate.gauge(key, value, attributes);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes pending data points and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private interface MetricsDelegate {
    void increment(String key, Map<String, String> attributes);

    void observe(String key, long value, Map<String, String> attributes);

    void gauge(String key, long value, Map<String, String> attributes);
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void increment(String key, Map<String, String> attributes) {
      // no-op
    }

    @Override
    public void observe(String key, long value, Map<String, String> attributes) {
      // no-op
    }

    @Override
    public void gauge(String key, long value, Map<String, String> attributes) {
      // no-op
    }
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final Meter meter;
    private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, GaugeInstrument> gauges = new ConcurrentHashMap<>();
    private final Map<String, String> sanitizedNames = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key, Map<String, String> attributes) {
      String effectiveKey = Objects.requireNonNull(key, "key");
      LongCounter counter = counters.computeIfAbsent(effectiveKey, this::createCounter);
      counter.add(1, attributes(effectiveKey, attributes));
    }

    @Override
    public void observe(String key, long value, Map<String, String> attributes) {
      String effectiveKey = Objects.requireNonNull(key, "key");
      LongHistogram histogram = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
      histogram.record(value, attributes(effectiveKey, attributes));
    }

    @Override
    public void gauge(String key, long value, Map<String, String> attributes) {
      String effectiveKey = Objects.requireNonNull(key, "key");
      GaugeInstrument instrument = gauges.computeIfAbsent(effectiveKey, this::createGauge);
      instrument.values()
          .computeIfAbsent(attributes(effectiveKey, attributes), ignored -> new AtomicLong())
          .set(value);
    }

    private LongCounter createCounter(String key) {
      String sanitized = sanitizedName(key);
      return meter
          .counterBuilder(sanitized)
          .setUnit("1")
          .setDescription("logrelay counter for " + key)
          .build();
    }

    private LongHistogram createHistogram(String key) {
      String sanitized = sanitizedName(key);
      return meter
          .histogramBuilder(sanitized)
          .ofLongs()
          .setDescription("logrelay observation for " + key)
          .build();
    }

    private GaugeInstrument createGauge(String key) {
      String sanitized = sanitizedName(key);
      ConcurrentMap<Attributes, AtomicLong> values = new ConcurrentHashMap<>();
      ObservableLongGauge gauge = meter
          .gaugeBuilder(sanitized)
          .ofLongs()
          .setDescription("logrelay gauge for " + key)
          .buildWithCallback(measurement ->
              values.forEach((attributes, value) -> measurement.record(value.get(), attributes)));
      return new GaugeInstrument(gauge, values);
    }

    private String sanitizedName(String key) {
      String sanitized = sanitizedNames.computeIfAbsent(key, OtelDelegate::sanitizeName);
      if (!sanitized.equals(key)) {
        log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
      }
      return sanitized;
    }

    private static Attributes attributes(String key, Map<String, String> extra) {
      AttributesBuilder builder = Attributes.builder().put(METRIC_KEY_ATTRIBUTE, key);
      if (extra != null) {
        extra.forEach((name, value) -> builder.put(AttributeKey.stringKey(name), value == null ? "" : value));
      }
      return builder.build();
    }

    private static String sanitizeName(String key) {
      if (key == null || key.isBlank()) {
        return FALLBACK_METRIC_NAME;
      }
      String lower = key.trim().toLowerCase(Locale.ROOT);
      StringBuilder result = new StringBuilder(lower.length() + 4);
      if (!Character.isLetter(lower.charAt(0))) {
        result.append('m');
      }
      for (int i = 0; i < lower.length(); i++) {
        char c = lower.charAt(i);
        if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
          result.append(c);
        } else {
          result.append('_');
        }
      }
      return result.toString();
    }
  }

  private record GaugeInstrument(ObservableLongGauge gauge, ConcurrentMap<Attributes, AtomicLong> values) {}
}
