package ca.gc.cra.logrelay.application.translate;

import java.time.Instant;
import java.util.Map;

/**
 * Push delivery body: {@code {message: {data, attributes, messageId, publishTime}, subscription}}.
 *
 * @param message wrapped message; {@code null} when the body carried none
 * @param subscription full subscription name; empty when absent
 * @since 0.1.0
 */
public record PushMessage(Message message, String subscription) {

  public PushMessage {
    subscription = subscription == null ? "" : subscription;
  }

  /**
   * Pushed message.
   *
   * @param data base64 encoded payload; {@code null} when absent
   * @param attributes message attributes
   * @param messageId transport message id; empty when absent
   * @param publishTime publish instant; {@code null} when absent
   */
  public record Message(String data, Map<String, String> attributes, String messageId, Instant publishTime) {
    public Message {
      attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
      messageId = messageId == null ? "" : messageId;
    }
  }
}
