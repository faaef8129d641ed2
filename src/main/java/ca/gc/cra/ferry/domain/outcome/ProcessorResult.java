package ca.gc.cra.ferry.domain.outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Run-wide ledger reducing every {@link BatchResult} of a processing run.
 * <p><strong>Why:</strong> Commands print totals, a success rate and an error-code histogram, and must be able to
 * list exactly which items failed.</p>
 * <p><strong>Role:</strong> Domain aggregate returned by {@code HttpBatchProcessor#process}.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code totalProcessed() == totalSuccessful() + totalFailed()}.</li>
 *   <li>{@link Unknown} outcomes count as failures.</li>
 *   <li>{@code successRate()} is {@code 0.0} when nothing was processed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; build instances on a single thread through {@link Builder}.</p>
 *
 * @param <ID> item identifier type
 * @since 0.1.0
 */
public final class ProcessorResult<ID> {
  private final List<ItemOutcome.Success<ID>> successful;
  private final List<ItemOutcome.Failed<ID>> failed;
  private final List<ItemOutcome.Unknown<ID>> unknown;
  private final Map<Integer, Long> errorSummary;
  private final Throwable producerError;

  private ProcessorResult(
      List<ItemOutcome.Success<ID>> successful,
      List<ItemOutcome.Failed<ID>> failed,
      List<ItemOutcome.Unknown<ID>> unknown,
      Throwable producerError) {
    this.successful = List.copyOf(successful);
    this.failed = List.copyOf(failed);
    this.unknown = List.copyOf(unknown);
    this.producerError = producerError;
    Map<Integer, Long> summary = new TreeMap<>();
    for (ItemOutcome.Failed<ID> item : this.failed) {
      summary.merge(item.statusCode(), 1L, Long::sum);
    }
    for (ItemOutcome.Unknown<ID> item : this.unknown) {
      summary.merge(item.statusCode(), 1L, Long::sum);
    }
    this.errorSummary = Collections.unmodifiableMap(summary);
  }

  /**
   * Returns a result with no processed items.
   *
   * @param <ID> item identifier type
   * @return empty ledger
   */
  public static <ID> ProcessorResult<ID> empty() {
    return new ProcessorResult<>(List.of(), List.of(), List.of(), null);
  }

  /**
   * Creates a mutable builder used while draining batch results.
   *
   * @param <ID> item identifier type
   * @return new builder
   */
  public static <ID> Builder<ID> builder() {
    return new Builder<>();
  }

  public List<ItemOutcome.Success<ID>> successful() {
    return successful;
  }

  public List<ItemOutcome.Failed<ID>> failed() {
    return failed;
  }

  public List<ItemOutcome.Unknown<ID>> unknown() {
    return unknown;
  }

  public int totalSuccessful() {
    return successful.size();
  }

  public int totalFailed() {
    return failed.size() + unknown.size();
  }

  public int totalProcessed() {
    return totalSuccessful() + totalFailed();
  }

  /**
   * Returns the fraction of processed items that succeeded.
   *
   * @return value in {@code [0.0, 1.0]}; {@code 0.0} when nothing was processed
   */
  public double successRate() {
    int processed = totalProcessed();
    return processed == 0 ? 0.0 : (double) totalSuccessful() / processed;
  }

  /**
   * Returns failure counts keyed by status code ({@code 0} for failures without an HTTP response).
   *
   * @return immutable histogram ordered by status code
   */
  public Map<Integer, Long> errorSummary() {
    return errorSummary;
  }

  /**
   * Returns the exception raised by the item source while batches were being formed, if any.
   *
   * @return producer failure
   */
  public Optional<Throwable> producerError() {
    return Optional.ofNullable(producerError);
  }

  /**
   * Combines this ledger with another one; the first producer error wins.
   *
   * @param other ledger of a later run segment
   * @return combined ledger
   */
  public ProcessorResult<ID> merge(ProcessorResult<ID> other) {
    Objects.requireNonNull(other, "other");
    return new Builder<ID>().addAll(this).addAll(other).build();
  }

  @Override
  public String toString() {
    return "ProcessorResult{processed=" + totalProcessed()
        + ", successful=" + totalSuccessful()
        + ", failed=" + totalFailed()
        + ", errorSummary=" + errorSummary
        + (producerError == null ? "" : ", producerError=" + producerError)
        + '}';
  }

  /**
   * Single-threaded accumulator for {@link ProcessorResult}.
   *
   * @param <ID> item identifier type
   */
  public static final class Builder<ID> {
    private final List<ItemOutcome.Success<ID>> successful = new ArrayList<>();
    private final List<ItemOutcome.Failed<ID>> failed = new ArrayList<>();
    private final List<ItemOutcome.Unknown<ID>> unknown = new ArrayList<>();
    private Throwable producerError;

    private Builder() {}

    /**
     * Adds every outcome of a finished batch.
     *
     * @param result batch outcomes
     * @return this builder
     */
    public Builder<ID> add(BatchResult<ID> result) {
      Objects.requireNonNull(result, "result");
      for (ItemOutcome<ID> outcome : result.outcomes()) {
        add(outcome);
      }
      return this;
    }

    /**
     * Adds a single outcome.
     *
     * @param outcome item outcome
     * @return this builder
     */
    public Builder<ID> add(ItemOutcome<ID> outcome) {
      Objects.requireNonNull(outcome, "outcome");
      if (outcome instanceof ItemOutcome.Success<ID> success) {
        successful.add(success);
      } else if (outcome instanceof ItemOutcome.Failed<ID> failure) {
        failed.add(failure);
      } else if (outcome instanceof ItemOutcome.Unknown<ID> unresolved) {
        unknown.add(unresolved);
      }
      return this;
    }

    /**
     * Appends every outcome of an earlier ledger; its producer error is kept only if none was recorded yet.
     *
     * @param result ledger of a finished run segment
     * @return this builder
     */
    public Builder<ID> addAll(ProcessorResult<ID> result) {
      Objects.requireNonNull(result, "result");
      successful.addAll(result.successful);
      failed.addAll(result.failed);
      unknown.addAll(result.unknown);
      if (producerError == null) {
        producerError = result.producerError;
      }
      return this;
    }

    /**
     * Records the item-source failure that ended batching early.
     *
     * @param error producer exception
     * @return this builder
     */
    public Builder<ID> producerError(Throwable error) {
      this.producerError = error;
      return this;
    }

    public ProcessorResult<ID> build() {
      return new ProcessorResult<>(successful, failed, unknown, producerError);
    }
  }
}
