package ca.gc.cra.logrelay.application.target;

import ca.gc.cra.logrelay.application.port.MetricsPort;
import java.util.Map;
import java.util.Objects;

/**
 * Metrics recorder scoped to one target; attributes are fixed at construction.
 *
 * <p>Push targets count {@code gcplog.push.entries} and {@code gcplog.push.errors} by {@code job}. Pull targets
 * count {@code gcplog.pull.entries} and {@code gcplog.pull.errors} by {@code project} and {@code job}, and set
 * {@code gcplog.pull.last_success_scrape} by {@code project} and {@code subscription}.</p>
 *
 * @since 0.1.0
 */
public final class TargetMetrics {
  public static final String PUSH_ENTRIES = "gcplog.push.entries";
  public static final String PUSH_ERRORS = "gcplog.push.errors";
  public static final String PULL_ENTRIES = "gcplog.pull.entries";
  public static final String PULL_ERRORS = "gcplog.pull.errors";
  public static final String PULL_LAST_SUCCESS_SCRAPE = "gcplog.pull.last_success_scrape";
  public static final String SUBMIT_LATENCY = "gcplog.submit.latencyNanos";

  private final MetricsPort metrics;
  private final String entriesKey;
  private final String errorsKey;
  private final Map<String, String> attributes;
  private final Map<String, String> scrapeAttributes;

  private TargetMetrics(
      MetricsPort metrics,
      String entriesKey,
      String errorsKey,
      Map<String, String> attributes,
      Map<String, String> scrapeAttributes) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.entriesKey = entriesKey;
    this.errorsKey = errorsKey;
    this.attributes = attributes;
    this.scrapeAttributes = scrapeAttributes;
  }

  /**
   * Recorder for a push target.
   *
   * @param metrics metrics port
   * @param jobName job name
   * @return recorder
   */
  public static TargetMetrics forPush(MetricsPort metrics, String jobName) {
    return new TargetMetrics(metrics, PUSH_ENTRIES, PUSH_ERRORS, Map.of("job", jobName), Map.of());
  }

  /**
   * Recorder for a pull target.
   *
   * @param metrics metrics port
   * @param jobName job name
   * @param projectId project id
   * @param subscription subscription id
   * @return recorder
   */
  public static TargetMetrics forPull(MetricsPort metrics, String jobName, String projectId, String subscription) {
    return new TargetMetrics(
        metrics,
        PULL_ENTRIES,
        PULL_ERRORS,
        Map.of("project", projectId, "job", jobName),
        Map.of("project", projectId, "subscription", subscription));
  }

  void entryAccepted() {
    metrics.increment(entriesKey, attributes);
  }

  void entryFailed() {
    metrics.increment(errorsKey, attributes);
  }

  void submitLatency(long nanos) {
    metrics.observe(SUBMIT_LATENCY, nanos, attributes);
  }

  void lastScrape(long epochSeconds) {
    metrics.gauge(PULL_LAST_SUCCESS_SCRAPE, epochSeconds, scrapeAttributes);
  }
}
