package ca.gc.cra.logrelay.infrastructure.sink;

import ca.gc.cra.logrelay.application.port.EntryPublisher;
import ca.gc.cra.logrelay.application.port.EntrySink;
import ca.gc.cra.logrelay.application.port.MetricsPort;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * {@link EntrySink} backed by a bounded queue drained by one worker thread into an {@link EntryPublisher}.
 *
 * <p>{@link #submit(Entry)} blocks while the queue is full. {@link #stop()} refuses new entries, lets the worker
 * publish everything already queued, then flushes the publisher. The publisher itself is shared between targets and
 * is closed by the runtime, not by the sink.</p>
 *
 * <p>Publish failures are logged and counted under {@code sink.entries.failed}; they never stop the worker.</p>
 *
 * @since 0.1.0
 */
public final class QueuedEntrySink implements EntrySink {
  private static final Logger log = LoggerFactory.getLogger(QueuedEntrySink.class);
  public static final String PUBLISHED_METRIC = "sink.entries.published";
  public static final String FAILED_METRIC = "sink.entries.failed";
  private static final long WORKER_IDLE_POLL_MILLIS = 50L;
  private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);

  private final String name;
  private final EntryPublisher publisher;
  private final MetricsPort metrics;
  private final Map<String, String> attributes;
  private final BlockingQueue<Entry> queue;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicInteger inFlightSubmits = new AtomicInteger();
  private final ExecutorService worker;

  /**
   * Creates the sink and starts its worker.
   *
   * @param name sink name, usually the job name; used in thread names and logs
   * @param publisher downstream publisher
   * @param capacity queue capacity; must be positive
   * @param metrics metrics port
   */
  public QueuedEntrySink(String name, EntryPublisher publisher, int capacity, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.attributes = Map.of("sink", name);
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.worker = ExecutorFactories.newTaskPool(1, "sink-" + name, null);
    this.worker.execute(this::drain);
  }

  @Override
  public void submit(Entry entry) throws InterruptedException {
    Objects.requireNonNull(entry, "entry");
    inFlightSubmits.incrementAndGet();
    try {
      if (closed.get()) {
        throw new IllegalStateException("sink " + name + " is stopped");
      }
      queue.put(entry);
    } finally {
      inFlightSubmits.decrementAndGet();
    }
  }

  /**
   * Returns the number of queued entries.
   *
   * @return queue depth
   */
  public int depth() {
    return queue.size();
  }

  private void drain() {
    MDC.put("sink", name);
    long published = 0;
    try {
      while (!(closed.get() && inFlightSubmits.get() == 0 && queue.isEmpty())) {
        Entry entry = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (entry == null) {
          continue;
        }
        try {
          publisher.publish(entry);
          published++;
          metrics.increment(PUBLISHED_METRIC, attributes);
        } catch (Exception ex) {
          metrics.increment(FAILED_METRIC, attributes);
          log.warn("Failed to publish entry from sink {}", name, ex);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Sink {} worker interrupted with {} entries queued", name, queue.size());
    } finally {
      log.debug("Sink {} worker exiting after {} entries", name, published);
      MDC.remove("sink");
    }
  }

  @Override
  public void stop() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    worker.shutdown();
    try {
      if (!worker.awaitTermination(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Sink {} did not drain within {}; {} entries abandoned", name, DRAIN_TIMEOUT, queue.size());
        worker.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      worker.shutdownNow();
    }
    try {
      publisher.flush();
    } catch (Exception ex) {
      log.warn("Failed to flush publisher for sink {}", name, ex);
    }
    log.info("Sink {} stopped", name);
  }
}
