package ca.gc.cra.logrelay.application.target;

import ca.gc.cra.logrelay.application.port.EntrySink;
import ca.gc.cra.logrelay.application.port.MetricsPort;
import ca.gc.cra.logrelay.application.port.PushServer;
import ca.gc.cra.logrelay.application.port.PushServer.Request;
import ca.gc.cra.logrelay.application.port.PushServer.Response;
import ca.gc.cra.logrelay.application.translate.EntryTranslator;
import ca.gc.cra.logrelay.application.translate.PushMessage;
import ca.gc.cra.logrelay.application.translate.PushMessageParser;
import ca.gc.cra.logrelay.application.translate.TranslationException;
import ca.gc.cra.logrelay.application.translate.TranslationSettings;
import ca.gc.cra.logrelay.config.ServerOptions;
import ca.gc.cra.logrelay.config.TargetConfig;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import ca.gc.cra.logrelay.logging.Logs;
import ca.gc.cra.logrelay.validation.Strings;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives Pub/Sub push deliveries on one HTTP route and submits one entry per request.
 *
 * <p>Each request is handled synchronously on a server worker thread: read the body, parse it, translate it, and
 * submit the entry. The {@code 204} is only sent after submission completes, so a slow sink throttles the push
 * sender. Malformed bodies and dropped series are answered with {@code 400} and counted.</p>
 *
 * <p>The constructor starts the listener; {@link #stop()} closes it, drains in-flight requests for the configured
 * grace period, then stops the sink.</p>
 *
 * @since 0.1.0
 */
public final class PushTarget implements Target {
  private static final Logger log = LoggerFactory.getLogger(PushTarget.class);
  static final String TENANT_HEADER = "X-Scope-OrgID";
  private static final String METRIC_NAMESPACE_PREFIX = "logrelay_gcp_push_target_";

  private final TargetConfig config;
  private final TranslationSettings settings;
  private final PushServer server;
  private final EntrySink sink;
  private final EntryTranslator translator;
  private final PushMessageParser parser;
  private final TargetMetrics metrics;
  private final Object stopLock = new Object();
  private boolean stopped;

  /**
   * Creates the target and starts its listener.
   *
   * @param config push job configuration
   * @param server unstarted HTTP server owned by the target
   * @param sink entry sink owned by the target
   * @param translator entry translator
   * @param metrics metrics port
   * @throws IOException if the listener cannot be bound; the sink is stopped before rethrowing
   * @throws IllegalArgumentException if the job name is not a valid metric-name component
   */
  public PushTarget(
      TargetConfig config,
      PushServer server,
      EntrySink sink,
      EntryTranslator translator,
      MetricsPort metrics) throws IOException {
    this.config = Objects.requireNonNull(config, "config");
    this.server = Objects.requireNonNull(server, "server");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.parser = new PushMessageParser();
    this.settings = config.translationSettings();
    try {
      Strings.requireMetricName("job_name", METRIC_NAMESPACE_PREFIX + config.jobName());
    } catch (IllegalArgumentException ex) {
      sink.stop();
      throw new IllegalArgumentException("invalid metric-compatible job name: " + config.jobName(), ex);
    }
    this.metrics = TargetMetrics.forPush(Objects.requireNonNull(metrics, "metrics"), config.jobName());

    ServerOptions options = config.server();
    log.info("Starting gcp push target {} on {}:{}{}",
        config.jobName(), options.listenAddress(), options.listenPort(), options.path());
    try {
      server.start(options.path(), this::handle);
    } catch (IOException | RuntimeException ex) {
      sink.stop();
      throw ex;
    }
  }

  Response handle(Request request) {
    byte[] body;
    try {
      body = request.readBody();
    } catch (IOException ex) {
      return reject("failed to read incoming gcp push request", ex.getMessage());
    }

    Entry entry;
    try {
      PushMessage message = parser.parse(body);
      entry = translator.translate(message, settings, request.header(TENANT_HEADER));
    } catch (TranslationException ex) {
      return reject("failed to translate gcp push request", ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Unexpected failure translating gcp push request for job {}", config.jobName(), ex);
      return reject("failed to translate gcp push request", ex.toString());
    }

    if (log.isDebugEnabled()) {
      log.debug("Received line: {}", Logs.preview(entry.line()));
    }

    long start = System.nanoTime();
    try {
      sink.submit(entry);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while submitting gcp push entry for job {}", config.jobName());
      return Response.text(503, "interrupted while submitting entry");
    } catch (IllegalStateException ex) {
      log.warn("Sink rejected gcp push entry for job {}: {}", config.jobName(), ex.getMessage());
      return Response.text(503, "target is stopping");
    }
    metrics.submitLatency(System.nanoTime() - start);
    metrics.entryAccepted();
    return Response.noContent();
  }

  private Response reject(String message, String reason) {
    metrics.entryFailed();
    log.warn("{} (job {}): {}", message, config.jobName(), reason);
    return Response.text(400, reason == null ? message : reason);
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
    InetSocketAddress address = server.listenAddress();
    String listen = address == null ? "" : address.getHostString() + ":" + address.getPort();
    return Map.of("listen_address", listen, "path", config.server().path());
  }

  @Override
  public void stop() {
    synchronized (stopLock) {
      if (stopped) {
        return;
      }
      stopped = true;
      log.info("Stopping gcp push target {}", config.jobName());
      RuntimeException failure = null;
      try {
        server.shutdown(config.server().gracefulShutdown());
      } catch (IOException | RuntimeException ex) {
        log.error("Failed to shut down gcp push listener for job {}", config.jobName(), ex);
        failure = new TargetStopException("push target " + config.jobName() + " failed to stop", ex);
      }
      try {
        sink.stop();
      } catch (RuntimeException ex) {
        log.error("Failed to stop sink for job {}", config.jobName(), ex);
        if (failure == null) {
          failure = new TargetStopException("push target " + config.jobName() + " failed to stop", ex);
        } else {
          failure.addSuppressed(ex);
        }
      }
      if (failure != null) {
        throw failure;
      }
    }
  }
}
