package ca.gc.cra.logrelay.application.translate;

import ca.gc.cra.logrelay.application.port.ClockPort;
import ca.gc.cra.logrelay.application.port.ReceivedMessage;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import ca.gc.cra.logrelay.domain.relabel.Relabeler;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps transport envelopes into {@link Entry} instances.
 *
 * <p>Both delivery modes share one pipeline: decode the payload as strict UTF-8, pick the timestamp, collect
 * discovered {@code __gcp_*} labels, overlay static labels, apply relabel rules, then strip internal labels.
 * The translator never records metrics; callers count successes and failures.</p>
 *
 * <p><strong>Concurrency:</strong> Stateless apart from the injected clock; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class EntryTranslator {
  /** Discovered label holding the transport message id. */
  public static final String MESSAGE_ID_LABEL = "__gcp_message_id";
  /** Discovered label holding the push subscription name. */
  public static final String SUBSCRIPTION_LABEL = "__gcp_subscription_name";
  /** Prefix of discovered labels derived from message attributes. */
  public static final String ATTRIBUTE_PREFIX = "__gcp_attributes_";
  /** Reserved label routing an entry to a tenant; survives internal-label stripping. */
  public static final String TENANT_LABEL = "__tenant_id__";

  private final ClockPort clock;

  /**
   * Creates a translator stamping entries with the supplied clock.
   *
   * @param clock wall-clock source used when incoming timestamps are not preferred
   */
  public EntryTranslator(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Translates a push delivery.
   *
   * @param push parsed push body
   * @param settings target translation settings
   * @param tenantId value of the {@code X-Scope-OrgID} header, or {@code null}
   * @return translated entry
   * @throws TranslationException when the payload is malformed or the series is dropped
   */
  public Entry translate(PushMessage push, TranslationSettings settings, String tenantId)
      throws TranslationException {
    Objects.requireNonNull(push, "push");
    Objects.requireNonNull(settings, "settings");
    PushMessage.Message message = push.message();
    if (message == null) {
      throw TranslationException.malformed("push body has no message");
    }
    if (message.data() == null) {
      throw TranslationException.malformed("push message has no data");
    }
    byte[] payload;
    try {
      payload = Base64.getDecoder().decode(stripLineBreaks(message.data()));
    } catch (IllegalArgumentException ex) {
      throw TranslationException.malformed("push message data is not valid base64", ex);
    }
    LabelSet.Builder discovered = discoveredLabels(message.messageId(), message.attributes());
    if (!push.subscription().isEmpty()) {
      discovered.put(SUBSCRIPTION_LABEL, push.subscription());
    }
    return build(payload, Optional.ofNullable(message.publishTime()), discovered, settings, tenantId);
  }

  /**
   * Translates a message received from a pull subscription.
   *
   * @param message received handle; acknowledgment is left to the caller
   * @param settings target translation settings
   * @return translated entry
   * @throws TranslationException when the payload is malformed or the series is dropped
   */
  public Entry translate(ReceivedMessage message, TranslationSettings settings) throws TranslationException {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(settings, "settings");
    byte[] payload = message.data();
    if (payload == null) {
      throw TranslationException.malformed("message " + message.messageId() + " has no data");
    }
    LabelSet.Builder discovered = discoveredLabels(message.messageId(), message.attributes());
    return build(payload, message.publishTime(), discovered, settings, null);
  }

  private Entry build(
      byte[] payload,
      Optional<Instant> publishTime,
      LabelSet.Builder labels,
      TranslationSettings settings,
      String tenantId) throws TranslationException {
    String line = decodeUtf8(payload);
    Instant timestamp;
    if (settings.useIncomingTimestamp()) {
      timestamp = publishTime.orElseThrow(
          () -> TranslationException.malformed("message has no publish time"));
    } else {
      timestamp = clock.now();
    }

    LabelSet result;
    try {
      result = finalLabels(labels, settings, tenantId);
    } catch (IllegalArgumentException ex) {
      throw TranslationException.malformed("cannot build labels: " + ex.getMessage(), ex);
    }
    return new Entry(result, timestamp, line);
  }

  private static LabelSet finalLabels(LabelSet.Builder labels, TranslationSettings settings, String tenantId)
      throws TranslationException {
    labels.putAll(settings.staticLabels());
    LabelSet merged = labels.build();
    if (!settings.relabelRules().isEmpty()) {
      Optional<LabelSet> processed = Relabeler.process(merged, settings.relabelRules());
      if (processed.isEmpty()) {
        throw new TranslationException(TranslationException.Reason.DROPPED, "dropped by relabel rules");
      }
      merged = processed.get();
    }

    LabelSet result = merged.withoutInternal();
    if (tenantId != null && !tenantId.isEmpty()) {
      result = result.toBuilder().put(TENANT_LABEL, tenantId).build();
    }
    return result;
  }

  private static LabelSet.Builder discoveredLabels(String messageId, Map<String, String> attributes) {
    LabelSet.Builder builder = LabelSet.builder();
    if (messageId != null && !messageId.isEmpty()) {
      builder.put(MESSAGE_ID_LABEL, messageId);
    }
    for (Map.Entry<String, String> attribute : attributes.entrySet()) {
      builder.put(ATTRIBUTE_PREFIX + toLabelName(attribute.getKey()), attribute.getValue());
    }
    return builder;
  }

  /**
   * Converts an attribute key into a label name suffix: snake case, with every character outside
   * {@code [a-zA-Z0-9_]} replaced by {@code _}.
   *
   * @param key attribute key
   * @return label-safe suffix
   */
  static String toLabelName(String key) {
    StringBuilder sb = new StringBuilder(key.length() + 4);
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (Character.isUpperCase(c) && i > 0) {
        char prev = key.charAt(i - 1);
        boolean nextLower = i + 1 < key.length() && Character.isLowerCase(key.charAt(i + 1));
        if (Character.isLowerCase(prev) || Character.isDigit(prev)
            || (Character.isUpperCase(prev) && nextLower)) {
          sb.append('_');
        }
      }
      sb.append(c);
    }
    String lower = sb.toString().toLowerCase(Locale.ROOT);
    StringBuilder sanitized = new StringBuilder(lower.length());
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean valid = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
      sanitized.append(valid ? c : '_');
    }
    return sanitized.toString();
  }

  private static String decodeUtf8(byte[] payload) throws TranslationException {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(payload))
          .toString();
    } catch (CharacterCodingException ex) {
      throw TranslationException.malformed("payload is not valid UTF-8", ex);
    }
  }

  private static String stripLineBreaks(String data) {
    if (data.indexOf('\n') < 0 && data.indexOf('\r') < 0) {
      return data;
    }
    return data.replace("\r", "").replace("\n", "");
  }
}
