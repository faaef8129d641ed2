package ca.gc.cra.ferry.application.batch;

import ca.gc.cra.ferry.domain.outcome.Operation;
import ca.gc.cra.ferry.validation.Numbers;
import java.util.Objects;

/**
 * Tuning knobs for {@link HttpBatchProcessor}.
 *
 * @param batchSize maximum items per request; between 1 and {@value #MAX_BATCH_SIZE}
 * @param maxWorkers concurrent request workers; between 1 and {@value #MAX_WORKERS}
 * @param maxRetries transient-failure retries per batch; between 0 and {@value #MAX_RETRIES}
 * @param operation operation recorded for accepted items
 * @since 0.1.0
 */
public record BatchProcessorSettings(int batchSize, int maxWorkers, int maxRetries, Operation operation) {
  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final int DEFAULT_MAX_WORKERS = 8;
  public static final int DEFAULT_MAX_RETRIES = 10;
  static final int MAX_BATCH_SIZE = 100_000;
  static final int MAX_WORKERS = 256;
  static final int MAX_RETRIES = 20;

  public BatchProcessorSettings {
    Numbers.requireRange("batchSize", batchSize, 1, MAX_BATCH_SIZE);
    Numbers.requireRange("maxWorkers", maxWorkers, 1, MAX_WORKERS);
    Numbers.requireRange("maxRetries", maxRetries, 0, MAX_RETRIES);
    Objects.requireNonNull(operation, "operation");
  }

  /**
   * Returns defaults suitable for create/update uploads.
   *
   * @return default settings
   */
  public static BatchProcessorSettings defaults() {
    return new BatchProcessorSettings(DEFAULT_BATCH_SIZE, DEFAULT_MAX_WORKERS, DEFAULT_MAX_RETRIES, Operation.CREATE);
  }

  /**
   * Number of batches the producer may queue ahead of the workers.
   *
   * @return {@code 2 * maxWorkers}
   */
  public int queueCapacity() {
    return maxWorkers * 2;
  }
}
