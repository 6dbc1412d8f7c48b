package ca.gc.cra.logrelay.application.port;

import java.util.Map;

/**
 * <strong>What:</strong> Port abstracting metrics emission for ingestion targets and sinks.
 * <p><strong>Why:</strong> Lets targets count accepted entries and failures without binding to a vendor SDK or a
 * process-wide registry.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments partitioned by attributes (job, project, subscription).</li>
 *   <li>Record histogram observations such as submission latency.</li>
 *   <li>Set gauge values such as the last successful scrape time.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from HTTP workers,
 * subscription callbacks, and consumer threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code gcplog.push.entries}); must not be {@code null}
   */
  default void increment(String key) {
    increment(key, Map.of());
  }

  /**
   * Increments the named counter by one for the given attribute combination.
   *
   * @param key metric identifier; must not be {@code null}
   * @param attributes attribute values partitioning the counter; must not be {@code null}
   */
  void increment(String key, Map<String, String> attributes);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  default void observe(String key, long value) {
    observe(key, value, Map.of());
  }

  /**
   * Records an observation for the given attribute combination.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value
   * @param attributes attribute values; must not be {@code null}
   */
  void observe(String key, long value, Map<String, String> attributes);

  /**
   * Sets the current value of a gauge.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value new gauge value
   * @param attributes attribute values; must not be {@code null}
   */
  void gauge(String key, long value, Map<String, String> attributes);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p><strong>Concurrency:</strong> Thread-safe.</p>
   * <p><strong>Observability:</strong> Drops all metrics; useful for tests.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key, Map<String, String> attributes) {}

    @Override public void observe(String key, long value, Map<String, String> attributes) {}

    @Override public void gauge(String key, long value, Map<String, String> attributes) {}
  };
}
