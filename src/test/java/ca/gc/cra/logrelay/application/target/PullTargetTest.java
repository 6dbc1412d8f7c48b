package ca.gc.cra.logrelay.application.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logrelay.application.port.ClockPort;
import ca.gc.cra.logrelay.application.translate.EntryTranslator;
import ca.gc.cra.logrelay.config.TargetConfig;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import ca.gc.cra.logrelay.testutil.Eventually;
import ca.gc.cra.logrelay.testutil.FakeReceivedMessage;
import ca.gc.cra.logrelay.testutil.FakeSubscriptionClient;
import ca.gc.cra.logrelay.testutil.FakeSubscriptionClient.Ending;
import ca.gc.cra.logrelay.testutil.RecordingEntrySink;
import ca.gc.cra.logrelay.testutil.RecordingMetrics;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PullTargetTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);
  private static final Instant NOW = Instant.parse("2030-05-05T12:00:00Z");
  private static final ClockPort CLOCK = () -> NOW;
  private static final LabelSet STATIC_LABELS = LabelSet.of("job", "gcplog");

  private final RecordingEntrySink sink = new RecordingEntrySink();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private PullTarget target;

  @AfterEach
  void tearDown() {
    sink.release();
    if (target != null) {
      target.stop();
    }
  }

  private PullTarget start(FakeSubscriptionClient client, boolean useIncomingTimestamp) {
    return start(client, useIncomingTimestamp, new EntryTranslator(CLOCK));
  }

  private PullTarget start(FakeSubscriptionClient client, boolean useIncomingTimestamp, EntryTranslator translator) {
    TargetConfig config = TargetConfig.pull("gcp_pull", "test-project", "test-sub", STATIC_LABELS)
        .withTranslation(useIncomingTimestamp, List.of());
    target = new PullTarget(config, client, sink, translator, metrics, CLOCK);
    return target;
  }

  @Test
  void publishTimeBecomesEntryTimestampAndMessageIsAckedOnce() throws Exception {
    FakeReceivedMessage message =
        FakeReceivedMessage.text("m-1", "hello", Instant.parse("2024-01-01T00:00:00Z"));
    start(new FakeSubscriptionClient(List.of(message), Ending.AWAIT_CANCEL), true);

    Eventually.await("ack", TIMEOUT, () -> message.acks() == 1);

    assertEquals(
        List.of(new Entry(STATIC_LABELS, Instant.parse("2024-01-01T00:00:00Z"), "hello")), sink.entries());
    assertEquals(0, message.nacks());
    assertEquals(1, metrics.count(TargetMetrics.PULL_ENTRIES));
    assertEquals(
        Map.of("project", "test-project", "job", "gcp_pull"),
        metrics.increments(TargetMetrics.PULL_ENTRIES).get(0).attributes());
    assertEquals(1, metrics.observations(TargetMetrics.SUBMIT_LATENCY).size());
  }

  @Test
  void clockTimestampIsUsedWhenIncomingTimestampDisabled() throws Exception {
    FakeReceivedMessage message =
        FakeReceivedMessage.text("m-1", "hello", Instant.parse("2024-01-01T00:00:00Z"));
    start(new FakeSubscriptionClient(List.of(message), Ending.AWAIT_CANCEL), false);

    Eventually.await("ack", TIMEOUT, () -> message.acks() == 1);

    assertEquals(NOW, sink.entries().get(0).timestamp());
  }

  @Test
  void ackHappensOnlyAfterSubmissionCompletes() throws Exception {
    FakeReceivedMessage message = FakeReceivedMessage.text("m-1", "hello", null);
    AtomicInteger acksSeenAtSubmit = new AtomicInteger(-1);
    sink.beforeAccept(entry -> acksSeenAtSubmit.set(message.acks()));
    start(new FakeSubscriptionClient(List.of(message), Ending.AWAIT_CANCEL), false);

    Eventually.await("ack", TIMEOUT, () -> message.acks() == 1);

    assertEquals(0, acksSeenAtSubmit.get());
  }

  @Test
  void untranslatableMessageIsCountedAndAcknowledgedWithoutSubmission() throws Exception {
    FakeReceivedMessage invalidUtf8 =
        new FakeReceivedMessage(new byte[] {(byte) 0xC3, (byte) 0x28}, Map.of(), "bad", null);
    FakeReceivedMessage missingTimestamp = FakeReceivedMessage.text("no-ts", "hello", null);
    start(new FakeSubscriptionClient(List.of(invalidUtf8, missingTimestamp), Ending.AWAIT_CANCEL), true);

    Eventually.await("acks", TIMEOUT, () -> invalidUtf8.acks() == 1 && missingTimestamp.acks() == 1);

    assertTrue(sink.entries().isEmpty());
    assertEquals(2, metrics.count(TargetMetrics.PULL_ERRORS));
    assertEquals(0, metrics.count(TargetMetrics.PULL_ENTRIES));
  }

  @Test
  void unexpectedTranslationFailureIsCountedAcknowledgedAndTargetKeepsServing() throws Exception {
    AtomicInteger clockCalls = new AtomicInteger();
    ClockPort failingOnce = () -> {
      if (clockCalls.getAndIncrement() == 0) {
        throw new DateTimeException("clock unavailable");
      }
      return NOW;
    };
    FakeReceivedMessage first = FakeReceivedMessage.text("m-1", "one", null);
    FakeReceivedMessage second = FakeReceivedMessage.text("m-2", "two", null);
    start(new FakeSubscriptionClient(List.of(first, second), Ending.AWAIT_CANCEL), false,
        new EntryTranslator(failingOnce));

    Eventually.await("both acked", TIMEOUT, () -> first.acks() == 1 && second.acks() == 1);

    assertEquals(0, first.nacks() + second.nacks());
    assertEquals(PullTarget.State.RUNNING, target.state());
    assertEquals(List.of("two"), sink.entries().stream().map(Entry::line).toList());
    assertEquals(1, metrics.count(TargetMetrics.PULL_ERRORS));
    assertEquals(1, metrics.count(TargetMetrics.PULL_ENTRIES));
  }

  @Test
  void blockedSinkStopsTheReceiveSide() throws Exception {
    FakeReceivedMessage first = FakeReceivedMessage.text("m-1", "one", null);
    FakeReceivedMessage second = FakeReceivedMessage.text("m-2", "two", null);
    FakeReceivedMessage third = FakeReceivedMessage.text("m-3", "three", null);
    FakeSubscriptionClient client =
        new FakeSubscriptionClient(List.of(first, second, third), Ending.AWAIT_CANCEL);
    sink.block();
    start(client, false);

    Eventually.await("consumer blocked in submit", TIMEOUT, () -> sink.blockedSubmitters() == 1);
    Eventually.await("second message offered", TIMEOUT, () -> client.handedToHandler() == 2);
    Thread.sleep(300);
    assertEquals(2, client.handedToHandler());
    assertEquals(0, first.acks());

    Thread stopper = new Thread(target::stop);
    stopper.start();
    Eventually.await("pending handoff nacked", TIMEOUT, () -> second.nacks() == 1);
    sink.release();
    stopper.join(TIMEOUT.toMillis());

    assertEquals(PullTarget.State.STOPPED, target.state());
    assertEquals(1, first.acks());
    assertEquals(0, second.acks());
    assertEquals(0, third.acks() + third.nacks());
    assertEquals(List.of("one"), sink.entries().stream().map(Entry::line).toList());
  }

  @Test
  void sinkRejectionNacksTheMessage() throws Exception {
    FakeReceivedMessage message = FakeReceivedMessage.text("m-1", "hello", null);
    sink.stop();
    start(new FakeSubscriptionClient(List.of(message), Ending.AWAIT_CANCEL), false);

    Eventually.await("nack", TIMEOUT, () -> message.nacks() == 1);

    assertEquals(0, message.acks());
    assertEquals(0, metrics.count(TargetMetrics.PULL_ENTRIES));
  }

  @Test
  void receiveFailureCancelsTargetAndRecordsError() throws Exception {
    FakeSubscriptionClient client = new FakeSubscriptionClient(List.of(), Ending.FAIL);
    start(client, false);

    Eventually.await("cancellation", TIMEOUT, () -> target.state() == PullTarget.State.CANCELLING);

    assertEquals(1, metrics.count(TargetMetrics.PULL_ERRORS));
    RecordingMetrics.Sample scrape = metrics.gauge(TargetMetrics.PULL_LAST_SUCCESS_SCRAPE);
    assertNotNull(scrape);
    assertEquals(NOW.getEpochSecond(), scrape.value());
    assertEquals(Map.of("project", "test-project", "subscription", "test-sub"), scrape.attributes());

    target.stop();
    assertEquals(PullTarget.State.STOPPED, target.state());
    assertEquals(1, client.closeCount());
  }

  @Test
  void receiveEndingWithoutCancellationIsAnError() throws Exception {
    start(new FakeSubscriptionClient(List.of(), Ending.RETURN), false);

    Eventually.await("cancellation", TIMEOUT, () -> target.state() == PullTarget.State.CANCELLING);

    assertEquals(1, metrics.count(TargetMetrics.PULL_ERRORS));
  }

  @Test
  void receiveFailureCausedByStopIsNotAnError() throws Exception {
    FakeSubscriptionClient client = new FakeSubscriptionClient(List.of(), Ending.FAIL_AFTER_CANCEL);
    start(client, false);
    assertTrue(target.awaitStarted(TIMEOUT));

    target.stop();

    assertEquals(PullTarget.State.STOPPED, target.state());
    assertEquals(0, metrics.count(TargetMetrics.PULL_ERRORS));
    assertNull(metrics.gauge(TargetMetrics.PULL_LAST_SUCCESS_SCRAPE));
  }

  @Test
  void stopTwiceIsSameAsOnce() throws Exception {
    FakeSubscriptionClient client = new FakeSubscriptionClient(List.of(), Ending.AWAIT_CANCEL);
    start(client, false);
    assertTrue(target.awaitStarted(TIMEOUT));
    assertEquals(PullTarget.State.RUNNING, target.state());

    target.stop();
    target.stop();

    assertEquals(PullTarget.State.STOPPED, target.state());
    assertEquals(1, sink.stopCount());
    assertEquals(1, client.closeCount());
    assertEquals(0, metrics.count(TargetMetrics.PULL_ERRORS));
  }

  @Test
  void facadeReportsStaticLabelsAndSubscriptionDetails() {
    start(new FakeSubscriptionClient(List.of(), Ending.AWAIT_CANCEL), false);

    assertEquals(TargetType.GCPLOG, target.type());
    assertEquals(STATIC_LABELS, target.labels());
    assertTrue(target.discoveredLabels().isEmpty());
    assertTrue(target.ready());
    assertEquals("test-project", target.details().get("project"));
    assertEquals("test-sub", target.details().get("subscription"));
  }
}
