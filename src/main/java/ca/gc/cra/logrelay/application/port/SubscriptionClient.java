package ca.gc.cra.logrelay.application.port;

import ca.gc.cra.logrelay.application.util.CancellationSignal;

/**
 * <strong>What:</strong> Port over a long-lived pull subscription.
 * <p><strong>Why:</strong> Lets the pull target own its receive loop and acknowledgment discipline while the vendor
 * client handles leases, flow control, and reconnection.</p>
 * <p><strong>Role:</strong> Input port implemented by {@code PubSubSubscriptionClient}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deliver each received message to the handler, possibly from several callback threads at once.</li>
 *   <li>Stop delivering and return once the cancellation signal is raised.</li>
 *   <li>Throw {@link SubscriptionException} when the subscription fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #receive(CancellationSignal, MessageHandler)} is called once per client
 * by a single receive task.</p>
 *
 * @since 0.1.0
 */
public interface SubscriptionClient extends AutoCloseable {
  /**
   * Receives messages until the signal is raised or the subscription fails.
   *
   * @param signal cancellation signal observed by the client
   * @param handler callback invoked for each message; may block to apply backpressure
   * @throws SubscriptionException if the subscription terminates with an error
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  void receive(CancellationSignal signal, MessageHandler handler)
      throws SubscriptionException, InterruptedException;

  /**
   * Returns a short description of the subscription for logs and target details.
   *
   * @return description such as {@code projects/p/subscriptions/s}
   */
  String describe();

  /** Releases client resources. Default does nothing. */
  @Override
  default void close() {}

  /** Callback receiving one message handle. */
  @FunctionalInterface
  interface MessageHandler {
    /**
     * Handles one message. The handler takes ownership of the acknowledgment.
     *
     * @param message received handle; never {@code null}
     */
    void handle(ReceivedMessage message);
  }
}
