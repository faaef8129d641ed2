package ca.gc.cra.ferry.application.port;

import java.util.Optional;

/**
 * Raw response of one batch request.
 *
 * @param statusCode HTTP status code
 * @param body response body decoded as UTF-8; empty when absent
 * @param retryAfter value of the {@code Retry-After} header when present
 * @since 0.1.0
 */
public record BatchResponse(int statusCode, String body, Optional<String> retryAfter) {

  public BatchResponse {
    body = body == null ? "" : body;
    retryAfter = retryAfter == null ? Optional.empty() : retryAfter;
  }

  /**
   * Convenience constructor for responses without a {@code Retry-After} header.
   *
   * @param statusCode HTTP status code
   * @param body response body
   */
  public BatchResponse(int statusCode, String body) {
    this(statusCode, body, Optional.empty());
  }

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }
}
