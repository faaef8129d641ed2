package ca.gc.cra.ferry.domain.batch;

import java.util.List;
import java.util.Objects;

/**
 * Ordered group of items submitted in one request together with its transient-failure attempt number.
 *
 * <p>The attempt starts at {@code 1}, increments only when a server or network failure is retried, and is inherited
 * unchanged by split halves and rate-limited resubmissions.</p>
 *
 * @param items items in submission order; never empty
 * @param attempt attempt number, at least {@code 1}
 * @param <T> raw item type
 * @since 0.1.0
 */
public record WorkBatch<T>(List<T> items, int attempt) {

  public WorkBatch {
    items = List.copyOf(Objects.requireNonNull(items, "items"));
    if (items.isEmpty()) {
      throw new IllegalArgumentException("items must not be empty");
    }
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1 (was " + attempt + ")");
    }
  }

  /**
   * Creates a first-attempt batch.
   *
   * @param items batch items
   * @param <T> raw item type
   * @return batch with {@code attempt == 1}
   */
  public static <T> WorkBatch<T> initial(List<T> items) {
    return new WorkBatch<>(items, 1);
  }

  public int size() {
    return items.size();
  }

  /**
   * Returns the same items scheduled for the next transient-failure attempt.
   *
   * @return batch with {@code attempt + 1}
   */
  public WorkBatch<T> nextAttempt() {
    return new WorkBatch<>(items, attempt + 1);
  }

  /**
   * Bisects the batch at {@code size / 2}; both halves keep the current attempt.
   *
   * @return two-element list holding the left and right halves
   * @throws IllegalStateException if the batch holds a single item
   */
  public List<WorkBatch<T>> split() {
    if (items.size() < 2) {
      throw new IllegalStateException("cannot split a batch of " + items.size() + " item");
    }
    int mid = items.size() / 2;
    return List.of(
        new WorkBatch<>(items.subList(0, mid), attempt),
        new WorkBatch<>(items.subList(mid, items.size()), attempt));
  }
}
