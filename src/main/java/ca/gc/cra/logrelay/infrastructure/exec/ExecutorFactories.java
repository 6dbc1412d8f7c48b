package ca.gc.cra.logrelay.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named thread pools used by targets, sinks, and the push server.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for long-lived tasks. Each submitted task holds one thread for its lifetime, so
   * submitting more tasks than {@code size} is rejected.
   *
   * @param size number of threads to allocate
   * @param prefix thread-name prefix used to tag threads
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return configured executor service
   */
  public static ExecutorService newTaskPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        namedThreadFactory(prefix, false, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a thread factory naming threads {@code prefix-N}.
   *
   * @param prefix thread-name prefix; blank selects {@code logrelay}
   * @param daemon whether threads are daemon threads
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return thread factory
   */
  public static ThreadFactory namedThreadFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "logrelay" : prefix;
    UncaughtExceptionHandler effectiveHandler = handler != null
        ? handler
        : (thread, ex) -> log.error("Uncaught failure on thread {}", thread.getName(), ex);
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
