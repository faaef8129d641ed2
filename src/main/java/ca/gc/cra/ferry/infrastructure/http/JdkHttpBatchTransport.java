package ca.gc.cra.ferry.infrastructure.http;

import ca.gc.cra.ferry.application.json.JsonSupport;
import ca.gc.cra.ferry.application.port.BatchResponse;
import ca.gc.cra.ferry.application.port.BatchTransport;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link BatchTransport} backed by the JDK {@link HttpClient}.
 * <p><strong>Request shape:</strong> {@code {"items": [...], <bodyFields>}} with {@code Authorization: Bearer},
 * {@code Content-Type}/{@code Accept: application/json} and {@code User-Agent} headers; optionally gzip-compressed
 * with {@code Content-Encoding: gzip}.</p>
 * <p><strong>Thread-safety:</strong> The client is shared by every worker; HTTP/1.1 connections are kept alive and
 * reused per worker.</p>
 * <p><strong>Error handling:</strong> Non-2xx statuses are returned, not thrown. Network failures and timeouts
 * surface as {@link IOException}. Items that cannot be encoded (NaN or infinite numbers) raise
 * {@link IllegalArgumentException}.</p>
 *
 * @param <T> raw item type
 * @since 0.1.0
 */
public final class JdkHttpBatchTransport<T> implements BatchTransport<T> {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpBatchTransport.class);
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(60);

  private final HttpTransportSettings settings;
  private final BearerTokenCache tokens;
  private final ItemJsonWriter<T> itemWriter;
  private final JsonSupport json;
  private final HttpClient client;

  /**
   * Creates a transport with its own HTTP client.
   *
   * @param settings endpoint, method, timeout and body options
   * @param tokens shared bearer-token cache
   * @param itemWriter writes each item into the {@code items} array
   */
  public JdkHttpBatchTransport(HttpTransportSettings settings, BearerTokenCache tokens, ItemJsonWriter<T> itemWriter) {
    this(settings, tokens, itemWriter, HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build());
  }

  JdkHttpBatchTransport(
      HttpTransportSettings settings, BearerTokenCache tokens, ItemJsonWriter<T> itemWriter, HttpClient client) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    this.itemWriter = Objects.requireNonNull(itemWriter, "itemWriter");
    this.client = Objects.requireNonNull(client, "client");
    this.json = new JsonSupport();
  }

  /**
   * Creates a transport for items shaped as maps, lists and primitives.
   *
   * @param settings endpoint, method, timeout and body options
   * @param tokens shared bearer-token cache
   * @param <T> raw item type
   * @return transport using {@link ItemJsonWriter#generic(JsonSupport)}
   */
  public static <T> JdkHttpBatchTransport<T> forGenericItems(HttpTransportSettings settings, BearerTokenCache tokens) {
    return new JdkHttpBatchTransport<>(settings, tokens, ItemJsonWriter.generic(new JsonSupport()));
  }

  @Override
  public BatchResponse send(List<T> items) throws IOException, InterruptedException {
    byte[] body = encode(items);
    HttpRequest.Builder request = HttpRequest.newBuilder(settings.endpoint())
        .timeout(settings.requestTimeout())
        .header("Authorization", "Bearer " + tokens.token())
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .header("User-Agent", settings.userAgent())
        .method(settings.method(), HttpRequest.BodyPublishers.ofByteArray(body));
    if (settings.gzip()) {
      request.header("Content-Encoding", "gzip");
    }
    HttpResponse<String> response =
        client.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    log.debug("{} {} with {} items returned {}", settings.method(), settings.endpoint(), items.size(),
        response.statusCode());
    return new BatchResponse(response.statusCode(), response.body(), response.headers().firstValue("Retry-After"));
  }

  byte[] encode(List<T> items) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(256, items.size() * 128));
    try (OutputStream out = settings.gzip() ? new GZIPOutputStream(buffer) : buffer;
        JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.writeStartObject();
      gen.writeFieldName("items");
      gen.writeStartArray();
      for (T item : items) {
        itemWriter.write(gen, item);
      }
      gen.writeEndArray();
      for (Map.Entry<String, Object> field : settings.bodyFields().entrySet()) {
        gen.writeFieldName(field.getKey());
        json.writeValue(gen, field.getValue());
      }
      gen.writeEndObject();
    }
    return buffer.toByteArray();
  }
}
