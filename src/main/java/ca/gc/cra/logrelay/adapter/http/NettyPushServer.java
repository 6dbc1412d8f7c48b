package ca.gc.cra.logrelay.adapter.http;

import ca.gc.cra.logrelay.application.port.PushServer;
import ca.gc.cra.logrelay.config.ServerOptions;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Phaser;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty implementation of {@link PushServer}.
 *
 * <p>Requests are aggregated up to {@link ServerOptions#maxBodyBytes()} (larger bodies get {@code 413} from the
 * aggregator) and dispatched to the endpoint on a dedicated executor group so a blocking sink never stalls the I/O
 * threads.</p>
 *
 * @since 0.1.0
 */
public final class NettyPushServer implements PushServer {
  private static final Logger log = LoggerFactory.getLogger(NettyPushServer.class);

  private final ServerOptions options;
  /** One party per request being handled, plus one held by the server until shutdown. */
  private final Phaser inFlight = new Phaser(1);
  private final Object lifecycleLock = new Object();
  private EventLoopGroup boss;
  private EventLoopGroup workers;
  private EventExecutorGroup handlers;
  private Channel serverChannel;
  private InetSocketAddress boundAddress;
  private boolean shutdown;

  /**
   * Creates an unstarted server.
   *
   * @param options listener options
   */
  public NettyPushServer(ServerOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  @Override
  public void start(String path, Endpoint endpoint) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(endpoint, "endpoint");
    synchronized (lifecycleLock) {
      if (serverChannel != null || shutdown) {
        throw new IllegalStateException("server already started");
      }
      boss = new NioEventLoopGroup(1);
      workers = new NioEventLoopGroup();
      handlers = new DefaultEventExecutorGroup(options.workerThreads());

      ServerBootstrap bootstrap = new ServerBootstrap()
          .group(boss, workers)
          .channel(NioServerSocketChannel.class)
          .childHandler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
              ch.pipeline().addLast(new HttpServerCodec());
              ch.pipeline().addLast(new HttpObjectAggregator(options.maxBodyBytes()));
              ch.pipeline().addLast(handlers, new RouteHandler(path, endpoint));
            }
          });

      ChannelFuture bind = bootstrap
          .bind(new InetSocketAddress(options.listenAddress(), options.listenPort()))
          .awaitUninterruptibly();
      if (!bind.isSuccess()) {
        releaseGroups();
        Throwable cause = bind.cause();
        if (cause instanceof IOException io) {
          throw io;
        }
        throw new IOException("failed to bind " + options.listenAddress() + ":" + options.listenPort(), cause);
      }
      serverChannel = bind.channel();
      boundAddress = (InetSocketAddress) serverChannel.localAddress();
      log.info("Push listener bound to {} serving POST {}", boundAddress, path);
    }
  }

  @Override
  public InetSocketAddress listenAddress() {
    synchronized (lifecycleLock) {
      return boundAddress;
    }
  }

  @Override
  public void shutdown(Duration grace) throws IOException {
    Objects.requireNonNull(grace, "grace");
    ChannelFuture closed;
    synchronized (lifecycleLock) {
      if (shutdown) {
        return;
      }
      shutdown = true;
      if (serverChannel == null) {
        return;
      }
      closed = serverChannel.close().awaitUninterruptibly();
    }
    awaitInFlight(grace);
    releaseGroups();
    if (!closed.isSuccess()) {
      throw new IOException("failed to close push listener " + boundAddress, closed.cause());
    }
    log.info("Push listener {} stopped", boundAddress);
  }

  private void awaitInFlight(Duration grace) {
    int phase = inFlight.arrive();
    try {
      inFlight.awaitAdvanceInterruptibly(phase, grace.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      log.warn("Push listener {} closing with {} request(s) still in flight",
          boundAddress, inFlight.getUnarrivedParties());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while draining push listener {}", boundAddress);
    }
  }

  private void releaseGroups() {
    if (handlers != null) {
      handlers.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
    if (workers != null) {
      workers.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
    if (boss != null) {
      boss.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
  }

  private final class RouteHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private final String path;
    private final Endpoint endpoint;

    private RouteHandler(String path, Endpoint endpoint) {
      this.path = path;
      this.endpoint = endpoint;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
      if (request.decoderResult().isFailure()) {
        send(ctx, request, new Response(400, "malformed http request"), false);
        return;
      }
      String uri = request.uri();
      int query = uri.indexOf('?');
      String requestPath = query >= 0 ? uri.substring(0, query) : uri;
      if (!path.equals(requestPath)) {
        send(ctx, request, new Response(404, "not found"), HttpUtil.isKeepAlive(request));
        return;
      }
      if (!HttpMethod.POST.equals(request.method())) {
        send(ctx, request, new Response(405, "method not allowed"), HttpUtil.isKeepAlive(request));
        return;
      }

      inFlight.register();
      try {
        Response response;
        try {
          response = endpoint.handle(new NettyRequest(request));
        } catch (RuntimeException ex) {
          log.error("Push endpoint failed for {}", requestPath, ex);
          response = new Response(500, "internal error");
        }
        send(ctx, request, response, HttpUtil.isKeepAlive(request));
      } finally {
        inFlight.arriveAndDeregister();
      }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
      log.warn("Push connection {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
      ctx.close();
    }

    private void send(ChannelHandlerContext ctx, FullHttpRequest request, Response response, boolean keepAlive) {
      byte[] bytes = response.bodyBytes();
      FullHttpResponse reply = new DefaultFullHttpResponse(
          request.protocolVersion() == null ? HttpVersion.HTTP_1_1 : request.protocolVersion(),
          HttpResponseStatus.valueOf(response.status()),
          bytes.length == 0 ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(bytes));
      if (bytes.length > 0) {
        reply.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
      }
      HttpUtil.setContentLength(reply, bytes.length);
      HttpUtil.setKeepAlive(reply, keepAlive);
      ChannelFuture write = ctx.writeAndFlush(reply);
      if (!keepAlive) {
        write.addListener(ChannelFutureListener.CLOSE);
      }
    }
  }

  private static final class NettyRequest implements Request {
    private final byte[] body;
    private final HttpHeaders headers;

    private NettyRequest(FullHttpRequest request) {
      ByteBuf content = request.content();
      this.body = ByteBufUtil.getBytes(content);
      this.headers = request.headers().copy();
    }

    @Override
    public byte[] readBody() {
      return body;
    }

    @Override
    public String header(String name) {
      return headers.get(name);
    }
  }

  @Override
  public String toString() {
    InetSocketAddress address = listenAddress();
    return "NettyPushServer[" + (address == null ? "unbound" : address.toString()) + "]";
  }
}
