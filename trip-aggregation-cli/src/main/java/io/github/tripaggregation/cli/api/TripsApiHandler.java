package io.github.tripaggregation.cli.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.github.tripaggregation.aggregation.TripAggregationCache;
import io.github.tripaggregation.exception.TripNotFoundException;
import io.github.tripaggregation.model.AggregatedTrip;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves {@code GET /trips/{tripId}}. A response is either the complete aggregated trip or an
 * error status with a JSON message.
 */
public class TripsApiHandler implements HttpHandler {

  /**
   * Path prefix the handler is mounted on.
   */
  public static final String CONTEXT = "/trips/";

  private static final Logger log = LoggerFactory.getLogger(TripsApiHandler.class);

  private final TripAggregationCache tripAggregationCache;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Trips api handler.
   *
   * @param tripAggregationCache the trip aggregation cache
   * @param objectMapper         the object mapper
   */
  public TripsApiHandler(final TripAggregationCache tripAggregationCache, final ObjectMapper objectMapper) {
    this.tripAggregationCache = tripAggregationCache;
    this.objectMapper = objectMapper;
  }

  @Override
  public void handle(final HttpExchange exchange) throws IOException {
    try {
      if (!"GET".equals(exchange.getRequestMethod())) {
        exchange.getResponseHeaders().add("Allow", "GET");
        exchange.sendResponseHeaders(405, -1);
        return;
      }

      final String path = exchange.getRequestURI().getPath();
      final String tripId = path.startsWith(CONTEXT) ? path.substring(CONTEXT.length()) : "";
      if (tripId.isEmpty() || tripId.contains("/")) {
        sendJson(exchange, 400, Map.of("message", "Expected /trips/{tripId}"));
        return;
      }

      try {
        final AggregatedTrip trip = tripAggregationCache.getAggregatedTrip(tripId);
        sendJson(exchange, 200, trip);
      } catch (TripNotFoundException e) {
        sendJson(exchange, 404, Map.of("message", e.getMessage()));
      } catch (RuntimeException e) {
        log.error("Unable to aggregate trip {}", tripId, e);
        sendJson(exchange, 500, Map.of("message", "Unable to aggregate trip " + tripId));
      }
    } finally {
      exchange.close();
    }
  }

  private void sendJson(final HttpExchange exchange, final int status, final Object body) throws IOException {
    final byte[] bytes = objectMapper.writeValueAsBytes(body);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
