package ca.gc.cra.ferry.application.batch;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes jittered delays for transient-failure retries and rate-limit deferrals.
 *
 * <p>Transient failures wait {@code 2^attempt + jitter} seconds; rate limits wait {@code Retry-After + jitter}
 * seconds. Both are capped at {@value #MAX_DELAY_MILLIS} ms. Jitter is drawn from {@code [0, 1)}.</p>
 *
 * @since 0.1.0
 */
public final class BackoffPolicy {
  private static final Logger log = LoggerFactory.getLogger(BackoffPolicy.class);
  static final long MAX_DELAY_MILLIS = 60_000L;
  static final double DEFAULT_RETRY_AFTER_SECONDS = 1.0;
  private static final Pattern DELTA_SECONDS = Pattern.compile("\\d+(\\.\\d+)?");

  private final DoubleSupplier jitter;

  /**
   * Creates a policy with uniformly random jitter.
   */
  public BackoffPolicy() {
    this(() -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Creates a policy with a caller-supplied jitter source.
   *
   * @param jitter supplier of values in {@code [0, 1)}
   */
  public BackoffPolicy(DoubleSupplier jitter) {
    this.jitter = Objects.requireNonNull(jitter, "jitter");
  }

  /**
   * Returns the delay before retrying a batch whose attempt {@code attempt} failed transiently.
   *
   * @param attempt attempt number that failed, starting at 1
   * @return delay in milliseconds
   */
  public long transientDelayMillis(int attempt) {
    double seconds = Math.pow(2, Math.max(0, attempt)) + jitter.getAsDouble();
    return cap(seconds);
  }

  /**
   * Returns how long every worker must wait after a rate-limited response.
   *
   * @param retryAfter raw {@code Retry-After} header, as delta-seconds or HTTP date
   * @param nowMillis current epoch time used to resolve HTTP dates
   * @return delay in milliseconds
   */
  public long rateLimitDelayMillis(Optional<String> retryAfter, long nowMillis) {
    double seconds = retryAfter.map(value -> retryAfterSeconds(value, nowMillis))
        .orElse(DEFAULT_RETRY_AFTER_SECONDS);
    return cap(seconds + jitter.getAsDouble());
  }

  static double retryAfterSeconds(String raw, long nowMillis) {
    String trimmed = raw == null ? "" : raw.trim();
    if (DELTA_SECONDS.matcher(trimmed).matches()) {
      return Double.parseDouble(trimmed);
    }
    try {
      ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
      return Math.max(0.0, (at.toInstant().toEpochMilli() - nowMillis) / 1000.0);
    } catch (DateTimeParseException ex) {
      log.debug("Unparseable Retry-After header '{}'; using {}s", trimmed, DEFAULT_RETRY_AFTER_SECONDS);
      return DEFAULT_RETRY_AFTER_SECONDS;
    }
  }

  private static long cap(double seconds) {
    long millis = Math.round(seconds * 1000.0);
    return Math.max(0L, Math.min(millis, MAX_DELAY_MILLIS));
  }
}
