package ca.gc.cra.ferry.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ferry.application.batch.BatchProcessorSettings;
import ca.gc.cra.ferry.application.batch.HttpBatchProcessor;
import ca.gc.cra.ferry.application.json.JsonSupport;
import ca.gc.cra.ferry.application.port.BatchResponse;
import ca.gc.cra.ferry.application.port.CredentialProvider.AccessToken;
import ca.gc.cra.ferry.domain.outcome.Operation;
import ca.gc.cra.ferry.domain.outcome.ProcessorResult;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdkHttpBatchTransportTest {
  private final JsonSupport json = new JsonSupport();
  private final List<Captured> requests = Collections.synchronizedList(new ArrayList<>());
  private HttpServer server;
  private volatile Reply reply = (exchange, request) -> respond(exchange, 200, "{}");

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/v1/assets", exchange -> {
      try {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        Captured request = new Captured(exchange.getRequestMethod(), exchange.getRequestHeaders(), raw);
        requests.add(request);
        reply.handle(exchange, request);
      } finally {
        exchange.close();
      }
    });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void sendsGzippedItemsWithBodyFieldsAndHeaders() throws Exception {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("mode", "upsert");
    fields.put("dryRun", Boolean.FALSE);
    HttpTransportSettings settings = new HttpTransportSettings(
        endpoint(), "post", Duration.ofSeconds(5), true, fields, "ferry-test/1.0");
    JdkHttpBatchTransport<Map<String, Object>> transport =
        JdkHttpBatchTransport.forGenericItems(settings, staticTokens("secret-token"));

    BatchResponse response = transport.send(List.of(
        Map.of("externalId", "a-1", "value", 1.5),
        Map.of("externalId", "a-2", "value", 2L)));

    assertEquals(200, response.statusCode());
    Captured request = requests.get(0);
    assertEquals("POST", request.method());
    assertEquals("Bearer secret-token", request.headers().getFirst("Authorization"));
    assertEquals("application/json", request.headers().getFirst("Content-Type"));
    assertEquals("gzip", request.headers().getFirst("Content-Encoding"));
    assertEquals("ferry-test/1.0", request.headers().getFirst("User-Agent"));

    Map<?, ?> body = (Map<?, ?>) json.parse(gunzip(request.body()));
    List<?> items = (List<?>) body.get("items");
    assertEquals(2, items.size());
    assertEquals("a-1", ((Map<?, ?>) items.get(0)).get("externalId"));
    assertEquals("upsert", body.get("mode"));
    assertEquals(Boolean.FALSE, body.get("dryRun"));
  }

  @Test
  void plainBodyWhenGzipDisabled() throws Exception {
    HttpTransportSettings settings = new HttpTransportSettings(
        endpoint(), "PUT", Duration.ofSeconds(5), false, Map.of(), null);
    JdkHttpBatchTransport<Map<String, Object>> transport =
        JdkHttpBatchTransport.forGenericItems(settings, staticTokens("t"));

    transport.send(List.of(Map.of("id", 7L)));

    Captured request = requests.get(0);
    assertEquals("PUT", request.method());
    assertNull(request.headers().getFirst("Content-Encoding"));
    assertEquals(HttpTransportSettings.DEFAULT_USER_AGENT, request.headers().getFirst("User-Agent"));
    assertEquals("{\"items\":[{\"id\":7}]}", new String(request.body(), StandardCharsets.UTF_8));
  }

  @Test
  void returnsErrorStatusBodyAndRetryAfterWithoutThrowing() throws Exception {
    reply = (exchange, request) -> {
      exchange.getResponseHeaders().add("Retry-After", "7");
      respond(exchange, 429, "{\"error\":{\"message\":\"Too many requests\"}}");
    };
    JdkHttpBatchTransport<Map<String, Object>> transport =
        JdkHttpBatchTransport.forGenericItems(HttpTransportSettings.post(endpoint()), staticTokens("t"));

    BatchResponse response = transport.send(List.of(Map.of("id", 1L)));

    assertEquals(429, response.statusCode());
    assertEquals("7", response.retryAfter().orElseThrow());
    assertTrue(response.body().contains("Too many requests"));
  }

  @Test
  void nonFiniteNumbersAreRejectedBeforeSending() {
    JdkHttpBatchTransport<Map<String, Object>> transport =
        JdkHttpBatchTransport.forGenericItems(HttpTransportSettings.post(endpoint()), staticTokens("t"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> transport.send(List.of(Map.of("value", Double.NaN))));

    assertTrue(ex.getMessage().contains("not JSON compliant"));
    assertTrue(requests.isEmpty());
  }

  @Test
  void processorUploadsThroughRealHttpInFixedBatches() {
    AtomicInteger received = new AtomicInteger();
    reply = (exchange, request) -> {
      Map<?, ?> body = (Map<?, ?>) json.parse(gunzip(request.body()));
      received.addAndGet(((List<?>) body.get("items")).size());
      respond(exchange, 201, "{}");
    };
    JdkHttpBatchTransport<Map<String, Object>> transport =
        JdkHttpBatchTransport.forGenericItems(HttpTransportSettings.post(endpoint()), staticTokens("t"));
    HttpBatchProcessor<Map<String, Object>, Object> processor = HttpBatchProcessor
        .builder(new BatchProcessorSettings(1000, 3, 1, Operation.CREATE), transport,
            (Map<String, Object> item) -> item.get("externalId"))
        .build();
    List<Map<String, Object>> items = IntStream.range(0, 2500)
        .mapToObj(i -> Map.<String, Object>of("externalId", "ts-" + i))
        .collect(Collectors.toList());

    ProcessorResult<Object> result = processor.process(items);

    assertEquals(2500, result.totalSuccessful());
    assertEquals(3, requests.size());
    assertEquals(2500, received.get());
  }

  private URI endpoint() {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/assets");
  }

  private static BearerTokenCache staticTokens(String value) {
    return new BearerTokenCache(() -> new AccessToken(value, Instant.now().plus(Duration.ofHours(1))));
  }

  private static String gunzip(byte[] body) throws IOException {
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  @FunctionalInterface
  private interface Reply {
    void handle(HttpExchange exchange, Captured request) throws IOException;
  }

  private record Captured(String method, Headers headers, byte[] body) {}
}
