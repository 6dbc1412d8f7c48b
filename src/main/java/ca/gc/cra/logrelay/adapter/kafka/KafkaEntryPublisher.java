package ca.gc.cra.logrelay.adapter.kafka;

import ca.gc.cra.logrelay.application.port.EntryPublisher;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.validation.Strings;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Publishes entries to a Kafka topic as JSON records.
 * <p><strong>Why:</strong> Hands translated log entries to the rest of the log-shipping pipeline through a durable
 * topic.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link EntryPublisher}; shared by every target's sink.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize {@code {"ts", "line", "labels"}} with jackson-core; {@code ts} is the RFC 3339 instant.</li>
 *   <li>Key records by the label fingerprint so a stream stays on one partition.</li>
 *   <li>Log asynchronous send failures.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Delegates to the provided {@link Producer}; {@link KafkaProducer} is
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class KafkaEntryPublisher implements EntryPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaEntryPublisher.class);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final JsonFactory jsonFactory = new JsonFactory();
  private final AtomicLong sendFailures = new AtomicLong();

  /**
   * Builds a publisher backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated bootstrap servers
   * @param topic destination topic
   */
  public KafkaEntryPublisher(String bootstrapServers, String topic) {
    this(createProducer(bootstrapServers), topic);
  }

  KafkaEntryPublisher(Producer<String, byte[]> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("topic", topic);
  }

  @Override
  public void publish(Entry entry) throws IOException {
    Objects.requireNonNull(entry, "entry");
    String key = entry.labels().fingerprint();
    producer.send(new ProducerRecord<>(topic, key, toJson(entry)), (metadata, ex) -> {
      if (ex != null) {
        sendFailures.incrementAndGet();
        log.warn("Failed to publish entry {} to Kafka topic {}", key, topic, ex);
      }
    });
  }

  /**
   * Returns the number of records the producer reported as failed.
   *
   * @return failed sends
   */
  public long sendFailures() {
    return sendFailures.get();
  }

  byte[] toJson(Entry entry) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(entry.line().length() + 128);
    try (JsonGenerator generator = jsonFactory.createGenerator(out)) {
      generator.writeStartObject();
      generator.writeStringField("ts", entry.timestamp().toString());
      generator.writeStringField("line", entry.line());
      generator.writeObjectFieldStart("labels");
      for (Map.Entry<String, String> label : entry.labels().asMap().entrySet()) {
        generator.writeStringField(label.getKey(), label.getValue());
      }
      generator.writeEndObject();
      generator.writeEndObject();
    }
    return out.toByteArray();
  }

  @Override
  public void flush() {
    producer.flush();
  }

  @Override
  public void close() {
    try {
      producer.flush();
    } finally {
      producer.close(Duration.ofSeconds(5));
    }
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("bootstrapServers", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
