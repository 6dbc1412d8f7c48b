package ca.gc.cra.logrelay.application.port;

/**
 * Raised when a subscription receive loop ends unexpectedly.
 *
 * @since 0.1.0
 */
public class SubscriptionException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description of the failure
   */
  public SubscriptionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message description of the failure
   * @param cause underlying transport failure
   */
  public SubscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
