package ca.gc.cra.ferry.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.ferry.application.port.CredentialProvider.AccessToken;
import ca.gc.cra.ferry.testutil.FakeClock;
import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BearerTokenCacheTest {
  private static final long START = 1_700_000_000_000L;

  @Test
  void reusesTokenUntilItNearsExpiry() throws IOException {
    FakeClock clock = new FakeClock(START);
    AtomicInteger fetches = new AtomicInteger();
    BearerTokenCache cache = new BearerTokenCache(() -> {
      int n = fetches.incrementAndGet();
      return new AccessToken("token-" + n, Instant.ofEpochMilli(clock.nowMillis() + 600_000L));
    }, clock);

    assertEquals("token-1", cache.token());
    clock.advance(500_000L);
    assertEquals("token-1", cache.token());
    clock.advance(40_001L);
    assertEquals("token-2", cache.token());
    assertEquals(2, fetches.get());
  }

  @Test
  void providerFailurePropagatesAndNextCallRetries() throws IOException {
    AtomicInteger calls = new AtomicInteger();
    BearerTokenCache cache = new BearerTokenCache(() -> {
      if (calls.incrementAndGet() == 1) {
        throw new IOException("identity provider unreachable");
      }
      return new AccessToken("ok", Instant.ofEpochMilli(START + 3_600_000L));
    }, new FakeClock(START));

    assertThrows(IOException.class, cache::token);
    assertEquals("ok", cache.token());
  }

  @Test
  void tokenTextIsRedactedInToString() {
    AccessToken token = new AccessToken("super-secret", Instant.ofEpochMilli(START));

    assertFalse(token.toString().contains("super-secret"));
  }
}
