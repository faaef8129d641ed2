package ca.gc.cra.ferry.infrastructure.http;

import ca.gc.cra.ferry.validation.Numbers;
import ca.gc.cra.ferry.validation.Strings;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Request-level settings for {@link JdkHttpBatchTransport}.
 *
 * @param endpoint absolute {@code http} or {@code https} URI receiving every batch
 * @param method one of {@code POST}, {@code PUT}, {@code PATCH}
 * @param requestTimeout per-request timeout
 * @param gzip whether request bodies are gzip-compressed
 * @param bodyFields static top-level fields added next to {@code items} (e.g. {@code "mode": "upsert"})
 * @param userAgent value of the {@code User-Agent} header
 * @since 0.1.0
 */
public record HttpTransportSettings(
    URI endpoint,
    String method,
    Duration requestTimeout,
    boolean gzip,
    Map<String, Object> bodyFields,
    String userAgent) {
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
  public static final String DEFAULT_USER_AGENT = "ferry/0.1";
  private static final List<String> METHODS = List.of("POST", "PUT", "PATCH");

  public HttpTransportSettings {
    Objects.requireNonNull(endpoint, "endpoint");
    String scheme = endpoint.getScheme() == null ? "" : endpoint.getScheme().toLowerCase(Locale.ROOT);
    if (!endpoint.isAbsolute() || !(scheme.equals("http") || scheme.equals("https")) || endpoint.getHost() == null) {
      throw new IllegalArgumentException("endpoint must be an absolute http(s) URI (was " + endpoint + ")");
    }
    method = Strings.requireOneOf("method", method, METHODS);
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Numbers.requireRange("requestTimeout.seconds", requestTimeout.getSeconds(), 1, 3_600);
    bodyFields = bodyFields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bodyFields));
    if (bodyFields.containsKey("items")) {
      throw new IllegalArgumentException("bodyFields must not contain 'items'");
    }
    userAgent = Strings.requireHeaderValue("userAgent", userAgent == null ? DEFAULT_USER_AGENT : userAgent, 256);
  }

  /**
   * Returns POST settings with the default timeout, gzip enabled and no extra body fields.
   *
   * @param endpoint target URI
   * @return settings
   */
  public static HttpTransportSettings post(URI endpoint) {
    return new HttpTransportSettings(endpoint, "POST", DEFAULT_REQUEST_TIMEOUT, true, Map.of(), DEFAULT_USER_AGENT);
  }
}
