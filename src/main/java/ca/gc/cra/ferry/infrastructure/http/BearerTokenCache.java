package ca.gc.cra.ferry.infrastructure.http;

import ca.gc.cra.ferry.application.port.ClockPort;
import ca.gc.cra.ferry.application.port.CredentialProvider;
import ca.gc.cra.ferry.application.port.CredentialProvider.AccessToken;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shared bearer-token holder for every worker of a transport.
 * <p><strong>Why:</strong> Tokens expire mid-run; one worker refreshes while the others reuse the cached value.</p>
 * <p><strong>Thread-safety:</strong> Reads and refreshes happen under one lock, which is released before the
 * caller sends its request.</p>
 *
 * @since 0.1.0
 */
public final class BearerTokenCache {
  private static final Logger log = LoggerFactory.getLogger(BearerTokenCache.class);
  static final long REFRESH_MARGIN_MILLIS = 60_000L;

  private final CredentialProvider provider;
  private final ClockPort clock;
  private final ReentrantLock lock = new ReentrantLock();
  private AccessToken current;

  public BearerTokenCache(CredentialProvider provider) {
    this(provider, ClockPort.SYSTEM);
  }

  public BearerTokenCache(CredentialProvider provider, ClockPort clock) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns a token valid for at least the refresh margin, fetching a new one when needed.
   *
   * @return bearer token text
   * @throws IOException when the credential provider fails
   */
  public String token() throws IOException {
    lock.lock();
    try {
      long now = clock.nowMillis();
      if (current == null || current.expiresAt().toEpochMilli() - now <= REFRESH_MARGIN_MILLIS) {
        AccessToken fresh = Objects.requireNonNull(provider.fetchToken(), "credential provider returned null");
        log.debug("Refreshed access token; expires at {}", fresh.expiresAt());
        current = fresh;
      }
      return current.value();
    } finally {
      lock.unlock();
    }
  }
}
