package ca.gc.cra.logrelay.adapter.pubsub;

import ca.gc.cra.logrelay.application.port.SubscriptionClient;
import ca.gc.cra.logrelay.application.port.SubscriptionException;
import ca.gc.cra.logrelay.application.util.CancellationSignal;
import com.google.api.core.ApiService;
import com.google.api.gax.batching.FlowControlSettings;
import com.google.api.gax.core.NoCredentialsProvider;
import com.google.api.gax.grpc.GrpcTransportChannel;
import com.google.api.gax.rpc.FixedTransportChannelProvider;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.pubsub.v1.ProjectSubscriptionName;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SubscriptionClient} backed by the Cloud Pub/Sub streaming-pull {@link Subscriber}.
 * <p><strong>Why:</strong> The client library owns leases, flow control, and stream reconnection; this adapter only
 * bridges its callbacks and lifecycle to the pull target.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build one subscriber per {@link #receive} call with the configured flow control.</li>
 *   <li>Stop the subscriber once the cancellation signal is raised and return.</li>
 *   <li>Report subscriber failures as {@link SubscriptionException}.</li>
 *   <li>Connect to the emulator over plaintext without credentials when an emulator host is set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The subscriber invokes the handler from its own executor threads.</p>
 *
 * @since 0.1.0
 */
public final class PubSubSubscriptionClient implements SubscriptionClient {
  private static final Logger log = LoggerFactory.getLogger(PubSubSubscriptionClient.class);

  private final ProjectSubscriptionName subscriptionName;
  private final long maxOutstandingMessages;
  private final int parallelPullCount;
  private final ManagedChannel emulatorChannel;

  /**
   * Creates a client for {@code projects/<projectId>/subscriptions/<subscription>}.
   *
   * @param projectId cloud project id
   * @param subscription subscription id
   * @param emulatorHost emulator {@code host:port}; empty uses Application Default Credentials
   * @param maxOutstandingMessages flow-control limit on unacknowledged messages
   * @param parallelPullCount number of streaming pull connections
   */
  public PubSubSubscriptionClient(
      String projectId,
      String subscription,
      Optional<String> emulatorHost,
      long maxOutstandingMessages,
      int parallelPullCount) {
    this.subscriptionName = ProjectSubscriptionName.of(
        Objects.requireNonNull(projectId, "projectId"), Objects.requireNonNull(subscription, "subscription"));
    this.maxOutstandingMessages = maxOutstandingMessages;
    this.parallelPullCount = parallelPullCount;
    this.emulatorChannel = Objects.requireNonNull(emulatorHost, "emulatorHost")
        .map(host -> ManagedChannelBuilder.forTarget(host).usePlaintext().build())
        .orElse(null);
    if (emulatorChannel != null) {
      log.info("Using Pub/Sub emulator at {} for {}", emulatorHost.get(), subscriptionName);
    }
  }

  @Override
  public void receive(CancellationSignal signal, MessageHandler handler) throws SubscriptionException {
    Objects.requireNonNull(signal, "signal");
    Objects.requireNonNull(handler, "handler");
    if (signal.isCancelled()) {
      return;
    }
    MessageReceiver receiver = (message, reply) -> handler.handle(new PubSubReceivedMessage(message, reply));
    Subscriber subscriber;
    try {
      subscriber = buildSubscriber(receiver);
    } catch (RuntimeException ex) {
      throw new SubscriptionException("failed to create subscriber for " + subscriptionName, ex);
    }

    signal.onCancel(subscriber::stopAsync);
    try {
      subscriber.startAsync().awaitRunning();
      log.info("Receiving from {}", subscriptionName);
      subscriber.awaitTerminated();
    } catch (IllegalStateException ex) {
      if (subscriber.state() != ApiService.State.FAILED) {
        if (signal.isCancelled()) {
          log.debug("Subscriber for {} stopped before it was running", subscriptionName);
          return;
        }
        throw new SubscriptionException("subscription " + subscriptionName + " failed", ex);
      }
      throw new SubscriptionException("subscription " + subscriptionName + " failed", subscriber.failureCause());
    } finally {
      subscriber.stopAsync();
    }
  }

  private Subscriber buildSubscriber(MessageReceiver receiver) {
    Subscriber.Builder builder = Subscriber.newBuilder(subscriptionName, receiver)
        .setParallelPullCount(parallelPullCount)
        .setFlowControlSettings(FlowControlSettings.newBuilder()
            .setMaxOutstandingElementCount(maxOutstandingMessages)
            .build());
    if (emulatorChannel != null) {
      builder
          .setChannelProvider(FixedTransportChannelProvider.create(GrpcTransportChannel.create(emulatorChannel)))
          .setCredentialsProvider(NoCredentialsProvider.create());
    }
    return builder.build();
  }

  @Override
  public String describe() {
    return subscriptionName.toString();
  }

  @Override
  public void close() {
    if (emulatorChannel == null) {
      return;
    }
    emulatorChannel.shutdown();
    try {
      if (!emulatorChannel.awaitTermination(5, TimeUnit.SECONDS)) {
        emulatorChannel.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      emulatorChannel.shutdownNow();
    }
  }
}
