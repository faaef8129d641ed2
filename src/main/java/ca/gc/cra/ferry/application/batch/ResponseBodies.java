package ca.gc.cra.ferry.application.batch;

import ca.gc.cra.ferry.application.json.JsonSupport;
import ca.gc.cra.ferry.application.port.BatchResponse;
import ca.gc.cra.ferry.logging.Logs;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Reads error messages and item counts out of API response bodies.
 */
final class ResponseBodies {
  static final int MAX_ERROR_MESSAGE_BYTES = 1000;

  private final JsonSupport json;

  ResponseBodies(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Extracts {@code error.message} or a string {@code error} field, falling back to the raw body.
   *
   * @param response failed response
   * @return truncated message, never blank
   */
  String errorMessage(BatchResponse response) {
    String body = response.body();
    if (body.isBlank()) {
      return "HTTP " + response.statusCode() + " with empty body";
    }
    String message = body;
    Object root = parseQuietly(body);
    if (root instanceof Map<?, ?> map) {
      Object error = map.get("error");
      if (error instanceof String text) {
        message = text;
      } else if (error instanceof Map<?, ?> details && details.get("message") instanceof String text) {
        message = text;
      }
    }
    return Logs.truncate(message, MAX_ERROR_MESSAGE_BYTES);
  }

  /**
   * Returns the length of the top-level {@code items} array of a JSON body.
   *
   * @param body response body
   * @return array length, or empty when the body has no such array
   */
  OptionalInt itemCount(String body) {
    if (body == null || body.isBlank()) {
      return OptionalInt.empty();
    }
    Object root = parseQuietly(body);
    if (root instanceof Map<?, ?> map && map.get("items") instanceof List<?> items) {
      return OptionalInt.of(items.size());
    }
    return OptionalInt.empty();
  }

  private Object parseQuietly(String body) {
    try {
      return json.parse(body);
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }
}
