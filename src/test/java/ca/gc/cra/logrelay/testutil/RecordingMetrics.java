package ca.gc.cra.logrelay.testutil;

import ca.gc.cra.logrelay.application.port.MetricsPort;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe metrics double that keeps every call for assertions.
 */
public final class RecordingMetrics implements MetricsPort {
  /** One recorded call. */
  public record Sample(String key, long value, Map<String, String> attributes) {}

  private final List<Sample> increments = new CopyOnWriteArrayList<>();
  private final List<Sample> observations = new CopyOnWriteArrayList<>();
  private final Map<String, Sample> gauges = new ConcurrentHashMap<>();

  @Override
  public void increment(String key, Map<String, String> attributes) {
    increments.add(new Sample(key, 1, Map.copyOf(attributes)));
  }

  @Override
  public void observe(String key, long value, Map<String, String> attributes) {
    observations.add(new Sample(key, value, Map.copyOf(attributes)));
  }

  @Override
  public void gauge(String key, long value, Map<String, String> attributes) {
    gauges.put(key, new Sample(key, value, Map.copyOf(attributes)));
  }

  public int count(String key) {
    return (int) increments.stream().filter(s -> s.key().equals(key)).count();
  }

  public List<Sample> increments(String key) {
    return increments.stream().filter(s -> s.key().equals(key)).toList();
  }

  public List<Sample> observations(String key) {
    return observations.stream().filter(s -> s.key().equals(key)).toList();
  }

  public Sample gauge(String key) {
    return gauges.get(key);
  }
}
