package ca.gc.cra.ferry.application.port;

/**
 * Counter and histogram sink used by the batch processor and the staged pipeline.
 *
 * <p>Keys are dotted names. The ones emitted today are:
 * <ul>
 *   <li>{@code batch.request.sent}, {@code batch.split}, {@code batch.retry}, {@code batch.ratelimited}</li>
 *   <li>{@code batch.request.latencyNanos}, {@code batch.items.succeeded}, {@code batch.items.failed}</li>
 *   <li>{@code pipeline.chunks.downloaded}, {@code pipeline.chunks.processed}, {@code pipeline.chunks.written},
 *       {@code pipeline.error}</li>
 * </ul>
 *
 * <p>Every worker thread reports through the same instance, so implementations must tolerate concurrent
 * calls and must not block.
 *
 * @since 0.1.0
 */
public interface MetricsPort {

  /**
   * Adds one to the counter named {@code key}.
   *
   * @param key dotted metric name; never {@code null}
   */
  void increment(String key);

  /**
   * Records one sample of {@code value} against the histogram named {@code key}.
   *
   * @param key dotted metric name; never {@code null}
   * @param value sample in the unit implied by the name
   */
  void observe(String key, long value);

  /** Discards everything. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override
    public void increment(String key) {}

    @Override
    public void observe(String key, long value) {}
  };
}
