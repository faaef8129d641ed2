package ca.gc.cra.ferry.config;

import ca.gc.cra.ferry.application.batch.BatchProcessorSettings;
import ca.gc.cra.ferry.application.pipeline.PipelineSettings;
import ca.gc.cra.ferry.domain.outcome.Operation;
import ca.gc.cra.ferry.infrastructure.http.HttpTransportSettings;
import ca.gc.cra.ferry.validation.Numbers;
import ca.gc.cra.ferry.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Typed view of a flat transfer configuration map.
 * <p><strong>Why:</strong> Commands collect settings from embedded defaults, YAML and explicit overrides as strings;
 * this class validates them once and exposes the settings records consumed by processors, pipelines and
 * transports.</p>
 * <p><strong>Keys:</strong> {@code endpoint} (required), {@code method}, {@code batchSize}, {@code maxWorkers},
 * {@code maxRetries}, {@code maxQueueSize}, {@code iterationCount}, {@code operation}, {@code gzip},
 * {@code requestTimeoutSeconds}, {@code userAgent} and any number of {@code body.<field>} entries copied into every
 * request body.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 * @see ConfigMerger
 * @see YamlConfigLoader
 */
public final class TransferConfig {
  private static final String BODY_PREFIX = "body.";
  private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");

  private final BatchProcessorSettings batchSettings;
  private final PipelineSettings pipelineSettings;
  private final HttpTransportSettings transportSettings;

  private TransferConfig(
      BatchProcessorSettings batchSettings,
      PipelineSettings pipelineSettings,
      HttpTransportSettings transportSettings) {
    this.batchSettings = batchSettings;
    this.pipelineSettings = pipelineSettings;
    this.transportSettings = transportSettings;
  }

  /**
   * Returns the embedded defaults, suitable as the lowest precedence layer of {@link ConfigMerger#merge}.
   *
   * @return immutable defaults map
   */
  public static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("method", "POST");
    defaults.put("batchSize", Integer.toString(BatchProcessorSettings.DEFAULT_BATCH_SIZE));
    defaults.put("maxWorkers", Integer.toString(BatchProcessorSettings.DEFAULT_MAX_WORKERS));
    defaults.put("maxRetries", Integer.toString(BatchProcessorSettings.DEFAULT_MAX_RETRIES));
    defaults.put("maxQueueSize", Integer.toString(PipelineSettings.DEFAULT_MAX_QUEUE_SIZE));
    defaults.put("operation", Operation.CREATE.name());
    defaults.put("gzip", "true");
    defaults.put("requestTimeoutSeconds",
        Long.toString(HttpTransportSettings.DEFAULT_REQUEST_TIMEOUT.getSeconds()));
    defaults.put("userAgent", HttpTransportSettings.DEFAULT_USER_AGENT);
    return Map.copyOf(defaults);
  }

  /**
   * Builds a configuration from key/value pairs; missing optional keys fall back to {@link #defaults()}.
   *
   * @param args flat configuration map
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing, malformed or out of range
   */
  public static TransferConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Map<String, String> values = new LinkedHashMap<>(defaults());
    args.forEach((key, value) -> {
      if (key != null && value != null) {
        values.put(key, value);
      }
    });

    if (values.get("endpoint") == null) {
      throw new IllegalArgumentException("endpoint is required");
    }
    String endpointText = Strings.requireNonBlank("endpoint", values.get("endpoint"));
    URI endpoint;
    try {
      endpoint = new URI(endpointText);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("endpoint is not a valid URI: " + endpointText, ex);
    }

    BatchProcessorSettings batch = new BatchProcessorSettings(
        Numbers.parseIntInRange("batchSize", values.get("batchSize"), 1, Integer.MAX_VALUE),
        Numbers.parseIntInRange("maxWorkers", values.get("maxWorkers"), 1, Integer.MAX_VALUE),
        Numbers.parseIntInRange("maxRetries", values.get("maxRetries"), 0, Integer.MAX_VALUE),
        parseOperation(values.get("operation")));

    OptionalLong iterationCount = OptionalLong.empty();
    String iterations = values.get("iterationCount");
    if (iterations != null && !iterations.isBlank()) {
      iterationCount = OptionalLong.of(Numbers.parseIntInRange("iterationCount", iterations, 0, Integer.MAX_VALUE));
    }
    PipelineSettings pipeline = new PipelineSettings(
        Numbers.parseIntInRange("maxQueueSize", values.get("maxQueueSize"), 1, Integer.MAX_VALUE),
        iterationCount,
        "downloading",
        "processing",
        "uploading");

    Map<String, Object> bodyFields = new LinkedHashMap<>();
    values.forEach((key, value) -> {
      if (key.startsWith(BODY_PREFIX) && key.length() > BODY_PREFIX.length()) {
        bodyFields.put(key.substring(BODY_PREFIX.length()), bodyValue(value));
      }
    });
    HttpTransportSettings transport = new HttpTransportSettings(
        endpoint,
        values.get("method"),
        Duration.ofSeconds(Numbers.parseIntInRange("requestTimeoutSeconds", values.get("requestTimeoutSeconds"),
            1, 3_600)),
        parseBoolean("gzip", values.get("gzip")),
        bodyFields,
        values.get("userAgent"));

    return new TransferConfig(batch, pipeline, transport);
  }

  public BatchProcessorSettings batchSettings() {
    return batchSettings;
  }

  public PipelineSettings pipelineSettings() {
    return pipelineSettings;
  }

  public HttpTransportSettings transportSettings() {
    return transportSettings;
  }

  private static Operation parseOperation(String raw) {
    String value = Strings.requireNonBlank("operation", raw).toUpperCase(Locale.ROOT);
    try {
      return Operation.valueOf(value);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("operation must be one of create, update, delete (was " + raw + ")", ex);
    }
  }

  private static boolean parseBoolean(String name, String raw) {
    String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + raw + ")");
    };
  }

  private static Object bodyValue(String raw) {
    String value = raw.trim();
    if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
      return Boolean.parseBoolean(value);
    }
    if (INTEGER.matcher(value).matches()) {
      return Long.parseLong(value);
    }
    return raw;
  }
}
