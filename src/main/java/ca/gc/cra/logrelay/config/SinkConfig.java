package ca.gc.cra.logrelay.config;

import ca.gc.cra.logrelay.validation.Net;
import ca.gc.cra.logrelay.validation.Numbers;
import ca.gc.cra.logrelay.validation.Strings;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Downstream delivery settings shared by every target.
 *
 * @param type publisher kind
 * @param kafkaBootstrap bootstrap servers; present when {@code type} is {@link Type#KAFKA}
 * @param topic Kafka topic
 * @param queueCapacity per-target sink queue capacity
 * @since 0.1.0
 */
public record SinkConfig(Type type, Optional<String> kafkaBootstrap, String topic, int queueCapacity) {
  public static final String DEFAULT_TOPIC = "logrelay.entries";
  public static final int DEFAULT_QUEUE_CAPACITY = 1024;

  /** Publisher kinds. */
  public enum Type {
    /** Writes entries to the application log. */
    LOG,
    /** Writes entries to a Kafka topic. */
    KAFKA;

    /**
     * Parses a configuration value; blank defaults to {@link #LOG}.
     *
     * @param raw value
     * @return type
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Type fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        return LOG;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "log" -> LOG;
        case "kafka" -> KAFKA;
        default -> throw new IllegalArgumentException("sink.type must be log or kafka (was " + raw + ")");
      };
    }
  }

  public SinkConfig {
    type = Objects.requireNonNullElse(type, Type.LOG);
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.<String>empty())
        .map(value -> Net.validateHostPortList("sink.kafka_bootstrap", value));
    topic = Strings.sanitizeTopic("sink.topic", topic == null ? DEFAULT_TOPIC : topic);
    Numbers.requireRange("sink.queue_capacity", queueCapacity, 1, 1_000_000);
    if (type == Type.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("sink.kafka_bootstrap is required when sink.type is kafka");
    }
  }

  /**
   * Log sink with default queue capacity.
   *
   * @return defaults
   */
  public static SinkConfig defaults() {
    return new SinkConfig(Type.LOG, Optional.empty(), DEFAULT_TOPIC, DEFAULT_QUEUE_CAPACITY);
  }
}
