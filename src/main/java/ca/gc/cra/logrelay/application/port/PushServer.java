package ca.gc.cra.logrelay.application.port;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Port over an HTTP listener serving a single POST route.
 * <p><strong>Why:</strong> Keeps the push target independent from the HTTP stack while the server owns sockets,
 * method and path routing, and worker threads.</p>
 * <p><strong>Role:</strong> Input port implemented by {@code NettyPushServer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Invoke the endpoint for {@code POST} requests on the route, on a blocking worker thread.</li>
 *   <li>Answer {@code 404} for other paths and {@code 405} for other methods.</li>
 *   <li>Drain in-flight requests on {@link #shutdown(Duration)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The endpoint is called concurrently, one call per in-flight request.</p>
 *
 * @since 0.1.0
 */
public interface PushServer {
  /**
   * Binds the listener and starts serving the route.
   *
   * @param path route path, e.g. {@code /gcp/api/v1/push}
   * @param endpoint request handler
   * @throws IOException if the listener cannot be bound
   */
  void start(String path, Endpoint endpoint) throws IOException;

  /**
   * Returns the bound address.
   *
   * @return listen address; the actual port when an ephemeral port was requested
   */
  InetSocketAddress listenAddress();

  /**
   * Stops accepting connections and waits up to {@code grace} for in-flight requests. Idempotent.
   *
   * @param grace maximum time to wait for in-flight requests
   * @throws IOException if the listener fails to close
   */
  void shutdown(Duration grace) throws IOException;

  /** Handles one request on the route. */
  @FunctionalInterface
  interface Endpoint {
    /**
     * Handles a request.
     *
     * @param request request view
     * @return response to send
     */
    Response handle(Request request);
  }

  /** Read-only view of an HTTP request. */
  interface Request {
    /**
     * Returns the complete request body.
     *
     * @return body bytes
     * @throws IOException if the body could not be read
     */
    byte[] readBody() throws IOException;

    /**
     * Returns a request header.
     *
     * @param name header name, case-insensitive
     * @return header value or {@code null}
     */
    String header(String name);
  }

  /**
   * HTTP response produced by an endpoint.
   *
   * @param status HTTP status code
   * @param body plain-text body; empty for no content
   */
  record Response(int status, String body) {
    public Response {
      Objects.requireNonNull(body, "body");
    }

    /**
     * Creates a {@code 204 No Content} response.
     *
     * @return empty response
     */
    public static Response noContent() {
      return new Response(204, "");
    }

    /**
     * Creates a plain-text response.
     *
     * @param status HTTP status code
     * @param body text body
     * @return response
     */
    public static Response text(int status, String body) {
      return new Response(status, body);
    }

    /**
     * Returns the body encoded as UTF-8.
     *
     * @return body bytes
     */
    public byte[] bodyBytes() {
      return body.getBytes(StandardCharsets.UTF_8);
    }
  }
}
