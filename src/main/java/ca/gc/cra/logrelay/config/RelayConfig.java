package ca.gc.cra.logrelay.config;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Root of the relay configuration document.
 *
 * @param metricsExporter OpenTelemetry exporter ({@code otlp} or {@code none}); empty keeps the environment default
 * @param metricsEndpoint OTLP endpoint; empty keeps the environment default
 * @param sink downstream delivery settings
 * @param targets scrape jobs; job names are unique
 * @since 0.1.0
 */
public record RelayConfig(
    Optional<String> metricsExporter,
    Optional<String> metricsEndpoint,
    SinkConfig sink,
    List<TargetConfig> targets) {

  public RelayConfig {
    metricsExporter = Objects.requireNonNullElse(metricsExporter, Optional.empty());
    metricsEndpoint = Objects.requireNonNullElse(metricsEndpoint, Optional.empty());
    sink = Objects.requireNonNullElse(sink, SinkConfig.defaults());
    targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
    Set<String> seen = new HashSet<>();
    for (TargetConfig target : targets) {
      if (!seen.add(target.jobName())) {
        throw new IllegalArgumentException("duplicate job_name: " + target.jobName());
      }
    }
  }
}
