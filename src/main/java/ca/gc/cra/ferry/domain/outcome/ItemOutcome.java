package ca.gc.cra.ferry.domain.outcome;

import java.util.Objects;

/**
 * <strong>What:</strong> Terminal record of what happened to one item inside one batch operation.
 * <p><strong>Why:</strong> Upload commands report per-item results, so every item submitted must end with exactly
 * one outcome regardless of how many times its batch was split or retried.</p>
 * <p><strong>Role:</strong> Domain value produced by {@code HttpBatchProcessor} workers and reduced into
 * {@link ProcessorResult}.</p>
 * <p><strong>Variants:</strong>
 * <ul>
 *   <li>{@link Success} for items the remote API accepted.</li>
 *   <li>{@link Failed} for items rejected with a known identity.</li>
 *   <li>{@link Unknown} for items whose identity could not be derived.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable records; safe to share across worker threads.</p>
 *
 * @param <ID> caller-defined item identifier type
 * @since 0.1.0
 */
public sealed interface ItemOutcome<ID> permits ItemOutcome.Success, ItemOutcome.Failed, ItemOutcome.Unknown {

  /**
   * Item accepted by the remote API.
   *
   * @param itemId identifier derived from the submitted item
   * @param operation change applied remotely
   * @param <ID> identifier type
   */
  record Success<ID>(ID itemId, Operation operation) implements ItemOutcome<ID> {
    public Success {
      Objects.requireNonNull(itemId, "itemId");
      Objects.requireNonNull(operation, "operation");
    }
  }

  /**
   * Item rejected permanently; the status code is {@code 0} when no HTTP response was received.
   *
   * @param itemId identifier derived from the submitted item
   * @param statusCode HTTP status of the final attempt, or {@code 0}
   * @param errorMessage truncated diagnostic text
   * @param <ID> identifier type
   */
  record Failed<ID>(ID itemId, int statusCode, String errorMessage) implements ItemOutcome<ID> {
    public Failed {
      Objects.requireNonNull(itemId, "itemId");
      errorMessage = errorMessage == null ? "" : errorMessage;
    }
  }

  /**
   * Item that failed before its identity could be resolved.
   *
   * @param itemDescription shortened rendering of the raw item
   * @param statusCode HTTP status of the final attempt, or {@code 0}
   * @param errorMessage truncated diagnostic text
   * @param <ID> identifier type
   */
  record Unknown<ID>(String itemDescription, int statusCode, String errorMessage) implements ItemOutcome<ID> {
    public Unknown {
      itemDescription = itemDescription == null ? "<null>" : itemDescription;
      errorMessage = errorMessage == null ? "" : errorMessage;
    }
  }
}
