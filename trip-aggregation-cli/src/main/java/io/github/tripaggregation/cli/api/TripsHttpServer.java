package io.github.tripaggregation.cli.api;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server of the read API.
 * GET /trips/{tripId} → aggregated trip
 * GET /health         → 200 OK
 */
public class TripsHttpServer {

  private static final Logger log = LoggerFactory.getLogger(TripsHttpServer.class);

  private final TripsApiHandler handler;
  private final int port;
  private final int threads;
  private HttpServer server;
  private ExecutorService executor;

  /**
   * Instantiates a new Trips http server.
   *
   * @param handler the handler
   * @param port    the port, 0 for any free port
   * @param threads the number of request threads
   */
  public TripsHttpServer(final TripsApiHandler handler, final int port, final int threads) {
    this.handler = handler;
    this.port = port;
    this.threads = threads;
  }

  /**
   * Start serving.
   *
   * @throws IOException if the port cannot be bound
   */
  public void start() throws IOException {
    server = HttpServer.create(new InetSocketAddress(port), 0);
    server.createContext(TripsApiHandler.CONTEXT, handler);
    server.createContext("/health", exchange -> {
      final byte[] ok = "OK".getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(200, ok.length);
      try (var os = exchange.getResponseBody()) {
        os.write(ok);
      }
    });

    executor = Executors.newFixedThreadPool(threads);
    server.setExecutor(executor);
    server.start();
    log.info("Trips API started on http://localhost:{}{}", boundPort(), TripsApiHandler.CONTEXT);
  }

  /**
   * Port the server listens on.
   *
   * @return the port
   */
  public int boundPort() {
    return server.getAddress().getPort();
  }

  /**
   * Stop serving.
   */
  public void stop() {
    if (server != null) {
      server.stop(0);
    }
    if (executor != null) {
      executor.shutdown();
    }
  }
}
