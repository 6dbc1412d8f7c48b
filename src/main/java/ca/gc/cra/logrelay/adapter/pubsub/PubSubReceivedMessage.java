package ca.gc.cra.logrelay.adapter.pubsub;

import ca.gc.cra.logrelay.application.port.ReceivedMessage;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.protobuf.Timestamp;
import com.google.pubsub.v1.PubsubMessage;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ReceivedMessage} over a Pub/Sub message and its reply consumer. Only the first {@link #ack()} or
 * {@link #nack()} reaches the client library.
 */
final class PubSubReceivedMessage implements ReceivedMessage {
  private final PubsubMessage message;
  private final AckReplyConsumer reply;
  private final AtomicBoolean replied = new AtomicBoolean();

  PubSubReceivedMessage(PubsubMessage message, AckReplyConsumer reply) {
    this.message = Objects.requireNonNull(message, "message");
    this.reply = Objects.requireNonNull(reply, "reply");
  }

  @Override
  public byte[] data() {
    return message.getData().toByteArray();
  }

  @Override
  public Map<String, String> attributes() {
    return message.getAttributesMap();
  }

  @Override
  public String messageId() {
    return message.getMessageId();
  }

  @Override
  public Optional<Instant> publishTime() {
    if (!message.hasPublishTime()) {
      return Optional.empty();
    }
    Timestamp ts = message.getPublishTime();
    return Optional.of(Instant.ofEpochSecond(ts.getSeconds(), ts.getNanos()));
  }

  @Override
  public void ack() {
    if (replied.compareAndSet(false, true)) {
      reply.ack();
    }
  }

  @Override
  public void nack() {
    if (replied.compareAndSet(false, true)) {
      reply.nack();
    }
  }
}
