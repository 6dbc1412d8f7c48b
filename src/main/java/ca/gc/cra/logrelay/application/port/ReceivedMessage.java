package ca.gc.cra.logrelay.application.port;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Message envelope delivered by a pull subscription, together with its acknowledgment
 * capability.
 * <p><strong>Why:</strong> Decouples the pull target from the vendor client so acknowledgment discipline can be
 * exercised in tests.</p>
 * <p><strong>Responsibilities:</strong> Exactly one of {@link #ack()} or {@link #nack()} reaches the transport per
 * handle; repeated calls are ignored.</p>
 * <p><strong>Thread-safety:</strong> A handle may be acknowledged from a thread other than the one that received
 * it.</p>
 *
 * @since 0.1.0
 */
public interface ReceivedMessage {
  /**
   * Returns the raw payload.
   *
   * <p>The Pub/Sub adapter never returns {@code null}: a message without data yields an empty array.</p>
   *
   * @return payload bytes, or {@code null} when the transport delivered no payload
   */
  byte[] data();

  /**
   * Returns message attributes.
   *
   * @return unmodifiable attribute map, possibly empty
   */
  Map<String, String> attributes();

  /**
   * Returns the transport-assigned message id.
   *
   * @return message id; empty string when unknown
   */
  String messageId();

  /**
   * Returns the instant the message was published.
   *
   * @return publish time, or empty when the transport did not supply one
   */
  Optional<Instant> publishTime();

  /** Acknowledges the message so the transport will not redeliver it. */
  void ack();

  /** Returns the message to the transport for redelivery. */
  void nack();
}
