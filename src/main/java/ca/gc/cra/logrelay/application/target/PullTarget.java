package ca.gc.cra.logrelay.application.target;

import ca.gc.cra.logrelay.application.port.ClockPort;
import ca.gc.cra.logrelay.application.port.EntrySink;
import ca.gc.cra.logrelay.application.port.MetricsPort;
import ca.gc.cra.logrelay.application.port.ReceivedMessage;
import ca.gc.cra.logrelay.application.port.SubscriptionClient;
import ca.gc.cra.logrelay.application.port.SubscriptionException;
import ca.gc.cra.logrelay.application.translate.EntryTranslator;
import ca.gc.cra.logrelay.application.translate.TranslationException;
import ca.gc.cra.logrelay.application.translate.TranslationSettings;
import ca.gc.cra.logrelay.application.util.CancellationSignal;
import ca.gc.cra.logrelay.config.TargetConfig;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import ca.gc.cra.logrelay.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Consumes a Pub/Sub pull subscription and submits one entry per message.
 *
 * <p>Two tasks run per target. The receive task drives {@link SubscriptionClient#receive} and hands every message
 * to the consumer through a zero-capacity {@link SynchronousQueue}; a callback stays blocked until the consumer
 * takes its message, which pushes backpressure into the client's flow control. The consumer task translates each
 * message, submits the entry, and acknowledges the message only after submission completes. Messages that cannot
 * be translated are logged, counted, and still acknowledged so they are not redelivered forever.</p>
 *
 * <p>Both tasks share one {@link CancellationSignal}. It is raised by {@link #stop()} or when the receive loop
 * ends on its own. A message that was never handed to the consumer before cancellation is nacked.</p>
 *
 * <p>State moves {@code CREATED -> RUNNING -> CANCELLING -> STOPPED}.</p>
 *
 * @since 0.1.0
 */
public final class PullTarget implements Target {
  private static final Logger log = LoggerFactory.getLogger(PullTarget.class);
  private static final long HANDOFF_POLL_MILLIS = 100L;
  private static final Duration RECEIVE_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  /** Lifecycle states. */
  public enum State {
    CREATED,
    RUNNING,
    CANCELLING,
    STOPPED
  }

  private final TargetConfig config;
  private final TranslationSettings settings;
  private final SubscriptionClient client;
  private final EntrySink sink;
  private final EntryTranslator translator;
  private final TargetMetrics metrics;
  private final ClockPort clock;
  private final CancellationSignal signal = new CancellationSignal();
  private final SynchronousQueue<ReceivedMessage> handoff = new SynchronousQueue<>();
  private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
  private final AtomicInteger startedTasks = new AtomicInteger();
  private final CountDownLatch started = new CountDownLatch(1);
  private final ExecutorService executor;
  private final Future<?> receiveTask;
  private final Future<?> consumerTask;
  private final Object stopLock = new Object();
  private boolean stopped;

  /**
   * Creates the target and starts its receive and consumer tasks.
   *
   * @param config pull job configuration
   * @param client subscription client owned by the target
   * @param sink entry sink owned by the target
   * @param translator entry translator
   * @param metrics metrics port
   * @param clock clock used for the last-scrape gauge
   */
  public PullTarget(
      TargetConfig config,
      SubscriptionClient client,
      EntrySink sink,
      EntryTranslator translator,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.client = Objects.requireNonNull(client, "client");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = TargetMetrics.forPull(
        Objects.requireNonNull(metrics, "metrics"), config.jobName(), config.projectId(), config.subscription());
    this.settings = config.translationSettings();
    this.signal.onCancel(() -> state.compareAndSet(State.RUNNING, State.CANCELLING));
    this.signal.onCancel(() -> state.compareAndSet(State.CREATED, State.CANCELLING));

    this.executor = ExecutorFactories.newTaskPool(2, "gcplog-pull-" + config.jobName(), null);
    log.info("Starting gcp pull target {} on {}", config.jobName(), client.describe());
    this.consumerTask = executor.submit(this::consumeLoop);
    this.receiveTask = executor.submit(this::receiveLoop);
  }

  private void receiveLoop() {
    MDC.put("target", config.jobName());
    try {
      markStarted();
      client.receive(signal, this::handOff);
      if (!signal.isCancelled()) {
        recordReceiveFailure(new SubscriptionException("receive loop ended unexpectedly"));
      }
    } catch (SubscriptionException | RuntimeException ex) {
      if (signal.isCancelled()) {
        log.debug("Receive task for job {} ended during shutdown: {}", config.jobName(), ex.toString());
      } else {
        recordReceiveFailure(ex);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Receive task for job {} interrupted", config.jobName());
    } finally {
      signal.cancel();
      MDC.remove("target");
    }
  }

  private void recordReceiveFailure(Exception ex) {
    log.error("Failed to receive pubsub messages for job {} from {}", config.jobName(), client.describe(), ex);
    metrics.entryFailed();
    metrics.lastScrape(clock.nowEpochSeconds());
  }

  private void handOff(ReceivedMessage message) {
    try {
      while (!signal.isCancelled()) {
        if (handoff.offer(message, HANDOFF_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
          return;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    message.nack();
  }

  private void consumeLoop() {
    MDC.put("target", config.jobName());
    try {
      markStarted();
      while (!signal.isCancelled()) {
        ReceivedMessage message = handoff.poll(HANDOFF_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (message != null) {
          process(message);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Consumer task for job {} interrupted", config.jobName());
    } finally {
      signal.cancel();
      MDC.remove("target");
    }
  }

  private void process(ReceivedMessage message) throws InterruptedException {
    Entry entry;
    try {
      entry = translator.translate(message, settings);
    } catch (TranslationException ex) {
      log.error("Error formatting log entry from message {} ({}): {}",
          message.messageId(), ex.reason(), ex.getMessage());
      metrics.entryFailed();
      message.ack();
      return;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure formatting log entry from message {}", message.messageId(), ex);
      metrics.entryFailed();
      message.ack();
      return;
    }

    long start = System.nanoTime();
    try {
      sink.submit(entry);
    } catch (InterruptedException ex) {
      message.nack();
      throw ex;
    } catch (IllegalStateException ex) {
      log.warn("Sink rejected entry from message {}: {}", message.messageId(), ex.getMessage());
      message.nack();
      return;
    }
    message.ack();
    metrics.submitLatency(System.nanoTime() - start);
    metrics.entryAccepted();
  }

  private void markStarted() {
    if (startedTasks.incrementAndGet() == 2) {
      state.compareAndSet(State.CREATED, State.RUNNING);
      started.countDown();
    }
  }

  /**
   * Waits until both tasks have started.
   *
   * @param timeout maximum wait
   * @return {@code true} if both tasks started within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  boolean awaitStarted(Duration timeout) throws InterruptedException {
    return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Returns the lifecycle state.
   *
   * @return current state
   */
  public State state() {
    return state.get();
  }

  @Override
  public TargetType type() {
    return TargetType.GCPLOG;
  }

  @Override
  public LabelSet labels() {
    return config.staticLabels();
  }

  @Override
  public LabelSet discoveredLabels() {
    return LabelSet.empty();
  }

  @Override
  public boolean ready() {
    return true;
  }

  @Override
  public Map<String, String> details() {
    return Map.of(
        "project", config.projectId(),
        "subscription", config.subscription(),
        "state", state.get().name().toLowerCase(Locale.ROOT));
  }

  @Override
  public void stop() {
    synchronized (stopLock) {
      if (stopped) {
        return;
      }
      stopped = true;
      log.info("Stopping gcp pull target {}", config.jobName());
      signal.cancel();
      Exception failure = null;

      try {
        consumerTask.get();
      } catch (ExecutionException ex) {
        failure = ex.getCause() instanceof Exception cause ? cause : ex;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        failure = ex;
      }

      try {
        sink.stop();
      } catch (RuntimeException ex) {
        failure = record(failure, ex);
      }

      executor.shutdown();
      try {
        if (!executor.awaitTermination(RECEIVE_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Receive task for job {} still running after {}", config.jobName(), RECEIVE_SHUTDOWN_TIMEOUT);
          receiveTask.cancel(true);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        failure = record(failure, ex);
      }

      try {
        client.close();
      } catch (RuntimeException ex) {
        failure = record(failure, ex);
      }

      state.set(State.STOPPED);
      if (failure != null) {
        log.error("Gcp pull target {} stopped with errors", config.jobName(), failure);
        throw new TargetStopException("pull target " + config.jobName() + " failed to stop cleanly", failure);
      }
      log.info("Gcp pull target {} stopped", config.jobName());
    }
  }

  private static Exception record(Exception first, Exception next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }
}
