package ca.gc.cra.logrelay.application.util;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot cancellation flag shared by the tasks of a single target.
 *
 * <p>The signal is raised at most once; later calls to {@link #cancel()} are ignored. Callbacks registered with
 * {@link #onCancel(Runnable)} run exactly once, on the thread that raised the signal, or immediately when the signal
 * is already raised.</p>
 *
 * <p><strong>Concurrency:</strong> Thread-safe; reads are lock-free.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

  private final CountDownLatch latch = new CountDownLatch(1);
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
  private final Object lock = new Object();
  private volatile boolean cancelled;

  /**
   * Raises the signal.
   *
   * @return {@code true} if this call raised the signal, {@code false} if it was already raised
   */
  public boolean cancel() {
    List<Runnable> toRun;
    synchronized (lock) {
      if (cancelled) {
        return false;
      }
      cancelled = true;
      toRun = List.copyOf(callbacks);
      callbacks.clear();
    }
    latch.countDown();
    for (Runnable callback : toRun) {
      runCallback(callback);
    }
    return true;
  }

  /**
   * Returns whether the signal has been raised.
   *
   * @return {@code true} once {@link #cancel()} has been called
   */
  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Registers a callback run once the signal is raised.
   *
   * @param callback action to run; must not be {@code null}
   */
  public void onCancel(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    synchronized (lock) {
      if (!cancelled) {
        callbacks.add(callback);
        return;
      }
    }
    runCallback(callback);
  }

  /**
   * Blocks until the signal is raised.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitCancelled() throws InterruptedException {
    latch.await();
  }

  /**
   * Blocks until the signal is raised or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @param unit unit of {@code timeout}
   * @return {@code true} if the signal was raised within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitCancelled(long timeout, TimeUnit unit) throws InterruptedException {
    return latch.await(timeout, unit);
  }

  private static void runCallback(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException ex) {
      log.warn("Cancellation callback failed", ex);
    }
  }
}
