package ca.gc.cra.logrelay.application.port;

import ca.gc.cra.logrelay.domain.entry.Entry;

/**
 * <strong>What:</strong> Downstream consumer of translated entries.
 * <p><strong>Why:</strong> Targets hand entries to the rest of the pipeline without knowing where they end up.</p>
 * <p><strong>Role:</strong> Output port; each target owns exactly one sink and stops it when the target stops.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept entries through a blocking submission queue; blocking is the backpressure signal.</li>
 *   <li>Release downstream resources on {@link #stop()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #submit(Entry)} must be safe for concurrent callers (push mode runs one
 * caller per in-flight request).</p>
 *
 * @since 0.1.0
 */
public interface EntrySink {
  /**
   * Enqueues an entry, blocking while the sink applies backpressure.
   *
   * @param entry entry to enqueue; must not be {@code null}
   * @throws InterruptedException if the calling thread is interrupted while waiting for capacity
   * @throws IllegalStateException if the sink has been stopped
   *
   * <p><strong>Performance:</strong> No timeout; a stalled sink stalls the caller indefinitely.</p>
   */
  void submit(Entry entry) throws InterruptedException;

  /**
   * Stops the sink and releases downstream resources. Idempotent.
   */
  void stop();
}
