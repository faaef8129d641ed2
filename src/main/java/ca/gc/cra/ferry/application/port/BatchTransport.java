package ca.gc.cra.ferry.application.port;

import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port that submits one batch of items to the remote API and returns the raw response.
 * <p><strong>Why:</strong> Keeps status classification, splitting and retry policy in the processor while adapters
 * own the HTTP client, payload encoding and authentication headers.</p>
 * <p><strong>Role:</strong> Outbound port consumed by {@code HttpBatchProcessor}; production adapter is
 * {@code JdkHttpBatchTransport}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent {@link #send(List)} calls from every
 * worker.</p>
 *
 * @param <T> raw item type
 * @since 0.1.0
 */
public interface BatchTransport<T> {

  /**
   * Sends one request carrying {@code items}.
   *
   * @param items batch items in submission order
   * @return HTTP response of any status; non-2xx statuses are not exceptions
   * @throws IOException on connection failure, timeout or other network error
   * @throws InterruptedException if the calling worker is interrupted
   */
  BatchResponse send(List<T> items) throws IOException, InterruptedException;
}
