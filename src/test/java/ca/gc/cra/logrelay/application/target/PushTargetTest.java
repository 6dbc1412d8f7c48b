package ca.gc.cra.logrelay.application.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logrelay.application.port.ClockPort;
import ca.gc.cra.logrelay.application.port.PushServer;
import ca.gc.cra.logrelay.application.translate.EntryTranslator;
import ca.gc.cra.logrelay.config.ServerOptions;
import ca.gc.cra.logrelay.config.TargetConfig;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import ca.gc.cra.logrelay.domain.relabel.RelabelRule;
import ca.gc.cra.logrelay.testutil.RecordingEntrySink;
import ca.gc.cra.logrelay.testutil.RecordingMetrics;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PushTargetTest {
  private static final Instant NOW = Instant.parse("2030-05-05T12:00:00Z");
  private static final LabelSet STATIC_LABELS = LabelSet.of("job", "gcplog");
  private static final String VALID_BODY = """
      {"message":{"data":"aGVsbG8=","attributes":{"severity":"ERROR"},"messageId":"42",
      "publishTime":"2024-01-01T00:00:00Z"},"subscription":"projects/p/subscriptions/s"}
      """;

  private final FakePushServer server = new FakePushServer();
  private final RecordingEntrySink sink = new RecordingEntrySink();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private PushTarget start(TargetConfig config) throws IOException {
    return start(config, () -> NOW);
  }

  private PushTarget start(TargetConfig config, ClockPort clock) throws IOException {
    return new PushTarget(config, server, sink, new EntryTranslator(clock), metrics);
  }

  private static TargetConfig config() {
    return TargetConfig.push("gcp_push", ServerOptions.defaults().withListenPort(0), STATIC_LABELS);
  }

  @Test
  void validPayloadProducesOneEntryAndNoContent() throws IOException {
    PushTarget target = start(config());

    PushServer.Response response = target.handle(request(VALID_BODY, Map.of()));

    assertEquals(204, response.status());
    assertEquals(List.of(new Entry(STATIC_LABELS, NOW, "hello")), sink.entries());
    assertEquals(1, metrics.count(TargetMetrics.PUSH_ENTRIES));
    assertEquals(Map.of("job", "gcp_push"), metrics.increments(TargetMetrics.PUSH_ENTRIES).get(0).attributes());
    assertEquals(0, metrics.count(TargetMetrics.PUSH_ERRORS));
  }

  @Test
  void startRegistersConfiguredRoute() throws IOException {
    start(config());

    assertEquals(ServerOptions.DEFAULT_PATH, server.path);
  }

  @Test
  void relabelRulesSeeDiscoveredAttributesAndIncomingTimestamp() throws IOException {
    RelabelRule severity = RelabelRule.compile(
        List.of("__gcp_attributes_severity"), null, null, 0, "severity", null, null);
    PushTarget target = start(config().withTranslation(true, List.of(severity)));

    PushServer.Response response = target.handle(request(VALID_BODY, Map.of()));

    assertEquals(204, response.status());
    Entry entry = sink.entries().get(0);
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), entry.timestamp());
    assertEquals(LabelSet.of(Map.of("job", "gcplog", "severity", "ERROR")), entry.labels());
  }

  @Test
  void tenantHeaderIsCarriedAsTenantLabel() throws IOException {
    PushTarget target = start(config());

    target.handle(request(VALID_BODY, Map.of(PushTarget.TENANT_HEADER, "team-a")));

    assertEquals("team-a", sink.entries().get(0).labels().get(EntryTranslator.TENANT_LABEL));
  }

  @Test
  void unparseableJsonIsRejectedWithoutSubmission() throws IOException {
    PushTarget target = start(config());

    PushServer.Response response = target.handle(request("{not json", Map.of()));

    assertEquals(400, response.status());
    assertTrue(sink.entries().isEmpty());
    assertEquals(1, metrics.count(TargetMetrics.PUSH_ERRORS));
    assertEquals(0, metrics.count(TargetMetrics.PUSH_ENTRIES));
  }

  @Test
  void unexpectedTranslationFailureIsCountedAndRejected() throws IOException {
    ClockPort broken = () -> {
      throw new DateTimeException("clock unavailable");
    };
    PushTarget target = start(config(), broken);

    PushServer.Response response = target.handle(request(VALID_BODY, Map.of()));

    assertEquals(400, response.status());
    assertTrue(sink.entries().isEmpty());
    assertEquals(1, metrics.count(TargetMetrics.PUSH_ERRORS));
    assertEquals(0, metrics.count(TargetMetrics.PUSH_ENTRIES));
  }

  @Test
  void invalidBase64IsRejected() throws IOException {
    PushTarget target = start(config());

    PushServer.Response response =
        target.handle(request("{\"message\":{\"data\":\"***\",\"messageId\":\"1\"}}", Map.of()));

    assertEquals(400, response.status());
    assertTrue(sink.entries().isEmpty());
    assertEquals(1, metrics.count(TargetMetrics.PUSH_ERRORS));
  }

  @Test
  void droppedSeriesIsRejected() throws IOException {
    RelabelRule dropAll = RelabelRule.compile(List.of("job"), null, "gcplog", 0, null, null, "drop");
    PushTarget target = start(config().withTranslation(false, List.of(dropAll)));

    PushServer.Response response = target.handle(request(VALID_BODY, Map.of()));

    assertEquals(400, response.status());
    assertTrue(sink.entries().isEmpty());
  }

  @Test
  void bodyReadFailureIsRejected() throws IOException {
    PushTarget target = start(config());
    PushServer.Request failing = new PushServer.Request() {
      @Override
      public byte[] readBody() throws IOException {
        throw new IOException("connection reset");
      }

      @Override
      public String header(String name) {
        return null;
      }
    };

    PushServer.Response response = target.handle(failing);

    assertEquals(400, response.status());
    assertEquals(1, metrics.count(TargetMetrics.PUSH_ERRORS));
  }

  @Test
  void stoppedSinkAnswersServiceUnavailable() throws IOException {
    PushTarget target = start(config());
    sink.stop();

    PushServer.Response response = target.handle(request(VALID_BODY, Map.of()));

    assertEquals(503, response.status());
    assertEquals(0, metrics.count(TargetMetrics.PUSH_ENTRIES));
  }

  @Test
  void invalidJobNameStopsSinkAndFails() {
    TargetConfig config =
        TargetConfig.push("bad-job", ServerOptions.defaults().withListenPort(0), STATIC_LABELS);

    assertThrows(IllegalArgumentException.class, () -> start(config));
    assertEquals(1, sink.stopCount());
    assertEquals(null, server.path);
  }

  @Test
  void bindFailureStopsSink() {
    server.failStart = true;

    IOException thrown = assertThrows(IOException.class, () -> start(config()));

    assertEquals("address in use", thrown.getMessage());
    assertEquals(1, sink.stopCount());
  }

  @Test
  void stopTwiceShutsDownServerAndSinkOnce() throws IOException {
    PushTarget target = start(config());

    target.stop();
    target.stop();

    assertEquals(1, server.shutdowns);
    assertEquals(ServerOptions.DEFAULT_GRACEFUL_SHUTDOWN, server.grace);
    assertEquals(1, sink.stopCount());
  }

  @Test
  void serverShutdownFailureStillStopsSink() throws IOException {
    PushTarget target = start(config());
    server.failShutdown = true;

    TargetStopException thrown = assertThrows(TargetStopException.class, target::stop);

    assertSame(IOException.class, thrown.getCause().getClass());
    assertEquals(1, sink.stopCount());
  }

  @Test
  void detailsExposeListenAddressAndPath() throws IOException {
    PushTarget target = start(config());

    assertEquals("127.0.0.1:18080", target.details().get("listen_address"));
    assertEquals(ServerOptions.DEFAULT_PATH, target.details().get("path"));
    assertEquals(TargetType.GCPLOG, target.type());
    assertEquals(STATIC_LABELS, target.labels());
  }

  private static PushServer.Request request(String body, Map<String, String> headers) {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    return new PushServer.Request() {
      @Override
      public byte[] readBody() {
        return bytes;
      }

      @Override
      public String header(String name) {
        return headers.get(name);
      }
    };
  }

  private static final class FakePushServer implements PushServer {
    String path;
    Endpoint endpoint;
    Duration grace;
    int shutdowns;
    boolean failStart;
    boolean failShutdown;

    @Override
    public void start(String path, Endpoint endpoint) throws IOException {
      if (failStart) {
        throw new IOException("address in use");
      }
      this.path = path;
      this.endpoint = endpoint;
    }

    @Override
    public InetSocketAddress listenAddress() {
      return new InetSocketAddress("127.0.0.1", 18080);
    }

    @Override
    public void shutdown(Duration grace) throws IOException {
      shutdowns++;
      this.grace = grace;
      if (failShutdown) {
        throw new IOException("close failed");
      }
    }
  }
}
