package ca.gc.cra.logrelay.config;

import ca.gc.cra.logrelay.adapter.http.NettyPushServer;
import ca.gc.cra.logrelay.adapter.kafka.KafkaEntryPublisher;
import ca.gc.cra.logrelay.adapter.pubsub.PubSubSubscriptionClient;
import ca.gc.cra.logrelay.application.port.ClockPort;
import ca.gc.cra.logrelay.application.port.EntryPublisher;
import ca.gc.cra.logrelay.application.port.EntrySink;
import ca.gc.cra.logrelay.application.port.MetricsPort;
import ca.gc.cra.logrelay.application.port.SubscriptionClient;
import ca.gc.cra.logrelay.application.target.PullTarget;
import ca.gc.cra.logrelay.application.target.PushTarget;
import ca.gc.cra.logrelay.application.target.Target;
import ca.gc.cra.logrelay.application.target.TargetFactory;
import ca.gc.cra.logrelay.application.target.TargetManager;
import ca.gc.cra.logrelay.application.translate.EntryTranslator;
import ca.gc.cra.logrelay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.logrelay.infrastructure.sink.LoggingEntryPublisher;
import ca.gc.cra.logrelay.infrastructure.sink.QueuedEntrySink;
import ca.gc.cra.logrelay.validation.Strings;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns a {@link RelayConfig} into running targets.
 * <p><strong>Why:</strong> Keeps adapter selection (Netty, Pub/Sub, Kafka, OpenTelemetry) out of the application
 * layer.</p>
 * <p><strong>Role:</strong> {@link TargetFactory} handed to {@link TargetManager#start}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the shared {@link EntryPublisher} selected by the {@code sink} section.</li>
 *   <li>Give every target its own {@link QueuedEntrySink} over that publisher.</li>
 *   <li>Pick the push listener or the pull subscription client per target.</li>
 *   <li>Close the publisher and the metrics pipeline once the targets have stopped.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Used from the CLI thread during startup and shutdown only.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements TargetFactory, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  static final String EMULATOR_ENV = "PUBSUB_EMULATOR_HOST";

  private final RelayConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final EntryTranslator translator;
  private final EntryPublisher publisher;
  private final Function<String, String> environment;

  /**
   * Creates a composition root exporting metrics through OpenTelemetry.
   *
   * @param config validated relay configuration
   */
  public CompositionRoot(RelayConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), System::getenv);
  }

  /**
   * Creates a composition root with an explicit metrics port and environment lookup.
   *
   * @param config validated relay configuration
   * @param metrics metrics port shared by every target and sink
   * @param environment environment variable lookup
   */
  public CompositionRoot(RelayConfig config, MetricsPort metrics, Function<String, String> environment) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.environment = Objects.requireNonNull(environment, "environment");
    this.clock = ClockPort.SYSTEM;
    this.translator = new EntryTranslator(clock);
    this.publisher = createPublisher(config.sink());
  }

  private static EntryPublisher createPublisher(SinkConfig sink) {
    return switch (sink.type()) {
      case LOG -> new LoggingEntryPublisher();
      case KAFKA -> {
        String bootstrap = sink.kafkaBootstrap()
            .orElseThrow(() -> new IllegalArgumentException("sink.kafka_bootstrap is required for kafka sink"));
        log.info("Publishing entries to Kafka topic {} via {}", sink.topic(), bootstrap);
        yield new KafkaEntryPublisher(bootstrap, sink.topic());
      }
    };
  }

  /**
   * Starts one target per configured job.
   *
   * @return running target manager
   * @throws IOException if a push listener cannot be bound
   */
  public TargetManager startTargets() throws IOException {
    return TargetManager.start(config.targets(), this);
  }

  @Override
  public Target create(TargetConfig target) throws IOException {
    EntrySink sink = new QueuedEntrySink(target.jobName(), publisher, config.sink().queueCapacity(), metrics);
    return switch (target.subscriptionType()) {
      case PUSH -> new PushTarget(target, new NettyPushServer(target.server()), sink, translator, metrics);
      case PULL -> createPullTarget(target, sink);
    };
  }

  private Target createPullTarget(TargetConfig target, EntrySink sink) {
    SubscriptionClient client;
    try {
      client = new PubSubSubscriptionClient(
          target.projectId(),
          target.subscription(),
          emulatorHost(target),
          target.maxOutstandingMessages(),
          target.parallelPullCount());
    } catch (RuntimeException ex) {
      sink.stop();
      throw ex;
    }
    try {
      return new PullTarget(target, client, sink, translator, metrics, clock);
    } catch (RuntimeException ex) {
      client.close();
      sink.stop();
      throw ex;
    }
  }

  Optional<String> emulatorHost(TargetConfig target) {
    if (target.emulatorHost().isPresent()) {
      return target.emulatorHost();
    }
    return Optional.ofNullable(Strings.trimToNull(environment.apply(EMULATOR_ENV)));
  }

  /**
   * Returns the metrics port shared by the targets.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Closes the shared publisher and the metrics pipeline. Call after every target has stopped. */
  @Override
  public void close() {
    try {
      publisher.close();
    } catch (Exception ex) {
      log.warn("Failed to close entry publisher cleanly", ex);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }
}
