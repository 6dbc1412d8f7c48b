package ca.gc.cra.logrelay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("logrelay.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  private MetricData metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream()
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported: " + metrics));
  }

  @Test
  void countersCarryCallerAttributesAndMetricKey() {
    adapter.increment("gcplog.push.entries", Map.of("job", "a"));
    adapter.increment("gcplog.push.entries", Map.of("job", "a"));
    adapter.increment("gcplog.push.entries", Map.of("job", "b"));

    MetricData data = metric("gcplog.push.entries");

    assertEquals(2, data.getLongSumData().getPoints().size());
    LongPointData jobA = data.getLongSumData().getPoints().stream()
        .filter(p -> "a".equals(p.getAttributes().get(AttributeKey.stringKey("job"))))
        .findFirst()
        .orElseThrow();
    assertEquals(2, jobA.getValue());
    assertEquals("gcplog.push.entries", jobA.getAttributes().get(METRIC_KEY));
  }

  @Test
  void histogramNamesAreLowercased() {
    adapter.observe("gcplog.submit.latencyNanos", 1_500, Map.of("job", "a"));
    adapter.observe("gcplog.submit.latencyNanos", 500, Map.of("job", "a"));

    MetricData data = metric("gcplog.submit.latencynanos");
    HistogramPointData point = data.getHistogramData().getPoints().iterator().next();

    assertEquals(2, point.getCount());
    assertEquals(2_000.0, point.getSum());
    assertEquals("gcplog.submit.latencyNanos", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void gaugeReportsLatestValuePerAttributeSet() {
    Map<String, String> attributes = Map.of("project", "p", "subscription", "s");
    adapter.gauge("gcplog.pull.last_success_scrape", 100, attributes);
    adapter.gauge("gcplog.pull.last_success_scrape", 200, attributes);

    MetricData data = metric("gcplog.pull.last_success_scrape");

    assertEquals(1, data.getLongGaugeData().getPoints().size());
    LongPointData point = data.getLongGaugeData().getPoints().iterator().next();
    assertEquals(200, point.getValue());
    assertEquals(
        Attributes.builder()
            .put(METRIC_KEY, "gcplog.pull.last_success_scrape")
            .put("project", "p")
            .put("subscription", "s")
            .build(),
        point.getAttributes());
  }

  @Test
  void invalidCharactersAreReplaced() {
    adapter.increment("9 bad/name");

    assertTrue(reader.collectAllMetrics().stream().anyMatch(m -> m.getName().equals("m9_bad_name")));
  }

  @Test
  void exporterNoneYieldsNoopAdapter() {
    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(
        key -> key.equals("otel.metrics.exporter") ? "none" : null, key -> null);

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(settings);

    assertTrue(result.isNoop());
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(result)) {
      noop.increment("gcplog.push.entries", Map.of("job", "a"));
      noop.gauge("gcplog.pull.last_success_scrape", 1, Map.of());
    }
  }

  @Test
  void settingsPreferPropertiesOverEnvironment() {
    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(
        key -> key.equals("otel.exporter.otlp.endpoint") ? "http://collector:4317" : null,
        key -> switch (key) {
          case "OTEL_EXPORTER_OTLP_ENDPOINT" -> "http://ignored:4317";
          case "OTEL_METRICS_EXPORTER" -> "otlp";
          default -> null;
        });

    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
  }
}
