package ca.gc.cra.logrelay.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaEntryPublisherTest {
  private static final Entry ENTRY = new Entry(
      LabelSet.of(Map.of("job", "gcplog", "zone", "a")),
      Instant.parse("2024-01-01T00:00:00.000000123Z"),
      "hello \"world\"");

  @Test
  void publishesJsonRecordKeyedByLabelFingerprint() throws Exception {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    KafkaEntryPublisher publisher = new KafkaEntryPublisher(producer, "logrelay.entries");

    publisher.publish(ENTRY);
    publisher.close();

    assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> record = producer.history().get(0);
    assertEquals("logrelay.entries", record.topic());
    assertEquals("{job=\"gcplog\", zone=\"a\"}", record.key());
    assertEquals(
        "{\"ts\":\"2024-01-01T00:00:00.000000123Z\",\"line\":\"hello \\\"world\\\"\","
            + "\"labels\":{\"job\":\"gcplog\",\"zone\":\"a\"}}",
        new String(record.value(), StandardCharsets.UTF_8));
    assertTrue(producer.closed());
  }

  @Test
  void failedSendIsCountedWithoutThrowing() throws Exception {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaEntryPublisher publisher = new KafkaEntryPublisher(producer, "logrelay.entries");

    publisher.publish(ENTRY);
    producer.errorNext(new TimeoutException("broker unavailable"));

    assertEquals(1, publisher.sendFailures());
  }

  @Test
  void flushDelegatesToProducer() throws Exception {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaEntryPublisher publisher = new KafkaEntryPublisher(producer, "logrelay.entries");
    publisher.publish(ENTRY);

    publisher.flush();

    assertTrue(producer.flushed());
    assertEquals(1, producer.history().size());
  }

  @Test
  void invalidTopicIsRejected() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());

    assertThrows(IllegalArgumentException.class, () -> new KafkaEntryPublisher(producer, "bad topic!"));
  }
}
