package ca.gc.cra.logrelay.application.translate;

import java.util.Objects;

/**
 * Signals that a message could not be turned into an entry.
 *
 * @since 0.1.0
 */
public class TranslationException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Why translation failed. */
  public enum Reason {
    /** Payload could not be decoded or a required field is absent. */
    MALFORMED,
    /** A relabel rule dropped the series. */
    DROPPED
  }

  private final Reason reason;

  /**
   * Creates an exception.
   *
   * @param reason failure category
   * @param message human readable detail, returned to push callers
   */
  public TranslationException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /**
   * Creates an exception with a cause.
   *
   * @param reason failure category
   * @param message human readable detail
   * @param cause underlying decode failure
   */
  public TranslationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  static TranslationException malformed(String message) {
    return new TranslationException(Reason.MALFORMED, message);
  }

  static TranslationException malformed(String message, Throwable cause) {
    return new TranslationException(Reason.MALFORMED, message, cause);
  }

  /**
   * Returns the failure category.
   *
   * @return reason
   */
  public Reason reason() {
    return reason;
  }
}
