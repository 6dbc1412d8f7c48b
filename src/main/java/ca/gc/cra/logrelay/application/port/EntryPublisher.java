package ca.gc.cra.logrelay.application.port;

import ca.gc.cra.logrelay.domain.entry.Entry;

/**
 * <strong>What:</strong> Terminal writer that ships entries out of the process (Kafka topic, log output).
 * <p><strong>Why:</strong> Keeps queueing and backpressure in the sink while delivery stays pluggable.</p>
 * <p><strong>Role:</strong> Output port drained by {@code QueuedEntrySink} workers; shared by every target.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent {@link #publish(Entry)} calls from the
 * sink workers of different targets.</p>
 *
 * @since 0.1.0
 * @see EntrySink
 */
public interface EntryPublisher extends AutoCloseable {
  /**
   * Publishes one entry.
   *
   * @param entry entry to publish; never {@code null}
   * @throws Exception if the destination rejects the write
   */
  void publish(Entry entry) throws Exception;

  /**
   * Flushes buffered entries.
   *
   * @throws Exception if flushing fails
   */
  default void flush() throws Exception {}

  /**
   * Closes the publisher; invoked once by the runtime after every target has stopped.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
