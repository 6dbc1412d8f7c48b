package ca.gc.cra.logrelay.adapter.pubsub;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.logrelay.application.translate.EntryTranslator;
import ca.gc.cra.logrelay.application.translate.TranslationSettings;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;
import com.google.pubsub.v1.PubsubMessage;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class PubSubReceivedMessageTest {
  private final CountingReply reply = new CountingReply();

  @Test
  void exposesPayloadAttributesAndPublishTime() {
    PubsubMessage message = PubsubMessage.newBuilder()
        .setData(ByteString.copyFromUtf8("hello"))
        .putAttributes("severity", "INFO")
        .setMessageId("123")
        .setPublishTime(Timestamp.newBuilder().setSeconds(1_704_067_200L).setNanos(123).build())
        .build();

    PubSubReceivedMessage received = new PubSubReceivedMessage(message, reply);

    assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), received.data());
    assertEquals(Map.of("severity", "INFO"), received.attributes());
    assertEquals("123", received.messageId());
    assertEquals(Optional.of(Instant.parse("2024-01-01T00:00:00.000000123Z")), received.publishTime());
  }

  @Test
  void missingPublishTimeIsEmpty() {
    PubSubReceivedMessage received = new PubSubReceivedMessage(PubsubMessage.getDefaultInstance(), reply);

    assertEquals(Optional.empty(), received.publishTime());
    assertEquals(0, received.data().length);
  }

  @Test
  void messageWithoutDataTranslatesToEmptyLine() throws Exception {
    PubSubReceivedMessage received = new PubSubReceivedMessage(
        PubsubMessage.newBuilder().setMessageId("7").build(), reply);
    Instant now = Instant.parse("2030-05-05T12:00:00Z");

    Entry entry = new EntryTranslator(() -> now)
        .translate(received, TranslationSettings.of(LabelSet.of("job", "gcplog")));

    assertEquals("", entry.line());
    assertEquals(now, entry.timestamp());
  }

  @Test
  void onlyFirstReplyReachesTheClient() {
    PubSubReceivedMessage received = new PubSubReceivedMessage(PubsubMessage.getDefaultInstance(), reply);

    received.ack();
    received.ack();
    received.nack();

    assertEquals(1, reply.acks.get());
    assertEquals(0, reply.nacks.get());
  }

  @Test
  void nackWinsWhenFirst() {
    PubSubReceivedMessage received = new PubSubReceivedMessage(PubsubMessage.getDefaultInstance(), reply);

    received.nack();
    received.ack();

    assertEquals(0, reply.acks.get());
    assertEquals(1, reply.nacks.get());
  }

  @Test
  void clientDescribesFullSubscriptionName() {
    PubSubSubscriptionClient client =
        new PubSubSubscriptionClient("my-project", "my-sub", Optional.empty(), 1000, 1);

    assertEquals("projects/my-project/subscriptions/my-sub", client.describe());
    client.close();
  }

  private static final class CountingReply implements AckReplyConsumer {
    final AtomicInteger acks = new AtomicInteger();
    final AtomicInteger nacks = new AtomicInteger();

    @Override
    public void ack() {
      acks.incrementAndGet();
    }

    @Override
    public void nack() {
      nacks.incrementAndGet();
    }
  }
}
