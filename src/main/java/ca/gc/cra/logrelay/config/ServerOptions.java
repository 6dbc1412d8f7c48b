package ca.gc.cra.logrelay.config;

import ca.gc.cra.logrelay.validation.Net;
import ca.gc.cra.logrelay.validation.Numbers;
import ca.gc.cra.logrelay.validation.Strings;
import java.time.Duration;
import java.util.Objects;

/**
 * HTTP listener settings for a push target.
 *
 * @param listenAddress interface to bind, e.g. {@code 0.0.0.0}
 * @param listenPort TCP port; {@code 0} binds an ephemeral port
 * @param path route served by the target
 * @param workerThreads blocking worker threads handling requests
 * @param maxBodyBytes largest accepted request body
 * @param gracefulShutdown time allowed for in-flight requests during stop
 * @since 0.1.0
 */
public record ServerOptions(
    String listenAddress,
    int listenPort,
    String path,
    int workerThreads,
    int maxBodyBytes,
    Duration gracefulShutdown) {

  public static final String DEFAULT_LISTEN_ADDRESS = "0.0.0.0";
  public static final int DEFAULT_LISTEN_PORT = 8080;
  public static final String DEFAULT_PATH = "/gcp/api/v1/push";
  public static final int DEFAULT_WORKER_THREADS = 16;
  public static final int DEFAULT_MAX_BODY_BYTES = 10 * 1024 * 1024;
  public static final Duration DEFAULT_GRACEFUL_SHUTDOWN = Duration.ofSeconds(5);

  public ServerOptions {
    listenAddress = Net.validateHost("http_listen_address", listenAddress);
    Numbers.requireRange("http_listen_port", listenPort, 0, 65535);
    path = Strings.requireNonBlank("http_path", path);
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("http_path must start with '/' (was " + path + ")");
    }
    Numbers.requireRange("worker_threads", workerThreads, 1, 1024);
    Numbers.requireRange("max_body_bytes", maxBodyBytes, 1, Integer.MAX_VALUE);
    Objects.requireNonNull(gracefulShutdown, "graceful_shutdown_timeout");
    if (gracefulShutdown.isNegative()) {
      throw new IllegalArgumentException("graceful_shutdown_timeout must not be negative");
    }
  }

  /**
   * Default listener settings.
   *
   * @return defaults
   */
  public static ServerOptions defaults() {
    return new ServerOptions(
        DEFAULT_LISTEN_ADDRESS,
        DEFAULT_LISTEN_PORT,
        DEFAULT_PATH,
        DEFAULT_WORKER_THREADS,
        DEFAULT_MAX_BODY_BYTES,
        DEFAULT_GRACEFUL_SHUTDOWN);
  }

  /**
   * Returns a copy listening on another port.
   *
   * @param port new port
   * @return updated options
   */
  public ServerOptions withListenPort(int port) {
    return new ServerOptions(listenAddress, port, path, workerThreads, maxBodyBytes, gracefulShutdown);
  }
}
