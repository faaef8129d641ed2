package ca.gc.cra.ferry.domain.outcome;

import java.util.List;
import java.util.Objects;

/**
 * Outcomes produced by submitting exactly one work batch, in request order.
 *
 * @param outcomes one outcome per item of the batch
 * @param <ID> item identifier type
 * @since 0.1.0
 */
public record BatchResult<ID>(List<ItemOutcome<ID>> outcomes) {

  public BatchResult {
    outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
  }

  /**
   * Returns the number of items the batch carried.
   *
   * @return outcome count
   */
  public int size() {
    return outcomes.size();
  }

  /**
   * Returns how many items of the batch succeeded.
   *
   * @return success count
   */
  public long successCount() {
    return outcomes.stream().filter(ItemOutcome::successful).count();
  }
}
