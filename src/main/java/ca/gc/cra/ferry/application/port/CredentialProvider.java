package ca.gc.cra.ferry.application.port;

import ca.gc.cra.ferry.logging.Logs;
import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Port supplying bearer tokens for the remote API.
 * <p><strong>Why:</strong> Credential acquisition (client credentials, device flow, static tokens) lives outside the
 * engine; batch transports only need a token and its expiry.</p>
 * <p><strong>Thread-safety:</strong> Callers serialize refreshes; implementations need not be re-entrant.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CredentialProvider {

  /**
   * Acquires a fresh access token.
   *
   * @return token and its expiry instant
   * @throws IOException when the identity provider cannot be reached or rejects the request
   */
  AccessToken fetchToken() throws IOException;

  /**
   * Bearer token with its absolute expiry.
   *
   * @param value opaque token text
   * @param expiresAt instant after which the token is rejected
   */
  record AccessToken(String value, Instant expiresAt) {
    public AccessToken {
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(expiresAt, "expiresAt");
    }

    @Override
    public String toString() {
      return "AccessToken{value=" + Logs.redact(value) + ", expiresAt=" + expiresAt + '}';
    }
  }
}
