package ca.gc.cra.ferry.application.progress;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Thread-safe table of per-item, per-step status for multi-step commands
 * (e.g. download, convert, upload).
 * <p><strong>Why:</strong> Commands print which items reached which step; once a step fails the remaining steps
 * must read as aborted rather than pending.</p>
 * <p><strong>Role:</strong> Shared application component updated by pipeline stages and batch processors.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Items not yet seen read as {@link StepStatus#PENDING} for every step.</li>
 *   <li>Marking a step {@link StepStatus#FAILED} forces every later step to {@link StepStatus#ABORTED}.</li>
 *   <li>A failed or aborted step never changes again; repeating the same status is a no-op.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A single instance-wide lock guards the table.</p>
 *
 * @param <ID> item identifier type
 * @since 0.1.0
 */
public final class ProgressTracker<ID> {
  private final List<String> steps;
  private final Map<String, Integer> stepIndex;
  private final Map<ID, StepStatus[]> progress = new LinkedHashMap<>();
  private final Object lock = new Object();

  /**
   * Creates a tracker for the given ordered steps.
   *
   * @param steps step names in execution order; non-empty and duplicate-free
   * @throws IllegalArgumentException if the list is empty, contains blanks or duplicates
   */
  public ProgressTracker(List<String> steps) {
    Objects.requireNonNull(steps, "steps");
    if (steps.isEmpty()) {
      throw new IllegalArgumentException("steps must not be empty");
    }
    Map<String, Integer> index = new LinkedHashMap<>();
    for (String step : steps) {
      if (step == null || step.isBlank()) {
        throw new IllegalArgumentException("step names must not be blank");
      }
      if (index.putIfAbsent(step, index.size()) != null) {
        throw new IllegalArgumentException("duplicate step '" + step + "'");
      }
    }
    this.steps = List.copyOf(steps);
    this.stepIndex = Collections.unmodifiableMap(index);
  }

  public List<String> steps() {
    return steps;
  }

  /**
   * Records a status given by name.
   *
   * @param itemId item identifier
   * @param step step name
   * @param status status name, case-insensitive
   * @throws IllegalArgumentException if the step or status is unknown
   * @throws IllegalStateException if the step is failed or aborted and {@code status} differs
   */
  public void setProgress(ID itemId, String step, String status) {
    setProgress(itemId, step, StepStatus.fromString(status));
  }

  /**
   * Records a status for one item at one step.
   *
   * @param itemId item identifier
   * @param step step name
   * @param status new status
   * @throws IllegalArgumentException if the step is unknown
   * @throws IllegalStateException if the step is failed or aborted and {@code status} differs
   */
  public void setProgress(ID itemId, String step, StepStatus status) {
    StepStatus conflict = apply(itemId, step, status);
    if (conflict != null) {
      throw new IllegalStateException("Item " + itemId + " step '" + step + "' is " + conflict
          + " and cannot change to " + status);
    }
  }

  /**
   * Records a status unless the step is already failed or aborted with a different status.
   *
   * @param itemId item identifier
   * @param step step name
   * @param status new status
   * @return {@code false} if the step was left unchanged because it is failed or aborted
   * @throws IllegalArgumentException if the step is unknown
   */
  public boolean trySetProgress(ID itemId, String step, StepStatus status) {
    return apply(itemId, step, status) == null;
  }

  private StepStatus apply(ID itemId, String step, StepStatus status) {
    Objects.requireNonNull(itemId, "itemId");
    Objects.requireNonNull(status, "status");
    int index = indexOf(step);
    synchronized (lock) {
      StepStatus[] row = rowFor(itemId);
      StepStatus current = row[index];
      if (current == status) {
        return null;
      }
      if (current.poisoned()) {
        return current;
      }
      row[index] = status;
      if (status == StepStatus.FAILED) {
        for (int i = index + 1; i < row.length; i++) {
          row[i] = StepStatus.ABORTED;
        }
      }
      return null;
    }
  }

  /**
   * Returns every step status for one item, in step order.
   *
   * @param itemId item identifier
   * @return immutable ordered snapshot; all {@link StepStatus#PENDING} for unseen items
   */
  public Map<String, StepStatus> getProgress(ID itemId) {
    Objects.requireNonNull(itemId, "itemId");
    synchronized (lock) {
      return snapshot(rowFor(itemId));
    }
  }

  /**
   * Returns the status of one item at one step.
   *
   * @param itemId item identifier
   * @param step step name
   * @return current status
   * @throws IllegalArgumentException if the step is unknown
   */
  public StepStatus getProgress(ID itemId, String step) {
    Objects.requireNonNull(itemId, "itemId");
    int index = indexOf(step);
    synchronized (lock) {
      return rowFor(itemId)[index];
    }
  }

  /**
   * Counts statuses per step across all tracked items.
   *
   * @return step name to status histogram, in step order
   */
  public Map<String, Map<StepStatus, Long>> aggregate() {
    Map<String, Map<StepStatus, Long>> counts = new LinkedHashMap<>();
    for (String step : steps) {
      Map<StepStatus, Long> perStatus = new EnumMap<>(StepStatus.class);
      for (StepStatus status : StepStatus.values()) {
        perStatus.put(status, 0L);
      }
      counts.put(step, perStatus);
    }
    synchronized (lock) {
      for (StepStatus[] row : progress.values()) {
        for (int i = 0; i < row.length; i++) {
          counts.get(steps.get(i)).merge(row[i], 1L, Long::sum);
        }
      }
    }
    Map<String, Map<StepStatus, Long>> result = new LinkedHashMap<>();
    counts.forEach((step, perStatus) -> result.put(step, Collections.unmodifiableMap(perStatus)));
    return Collections.unmodifiableMap(result);
  }

  /**
   * Returns a snapshot of every tracked item.
   *
   * @return item identifier to ordered step statuses, in first-seen order
   */
  public Map<ID, Map<String, StepStatus>> result() {
    synchronized (lock) {
      Map<ID, Map<String, StepStatus>> copy = new LinkedHashMap<>();
      progress.forEach((id, row) -> copy.put(id, snapshot(row)));
      return Collections.unmodifiableMap(copy);
    }
  }

  /**
   * Returns identifiers of items that have a failed step.
   *
   * @return failed item identifiers in first-seen order
   */
  public List<ID> failedItems() {
    List<ID> failed = new ArrayList<>();
    synchronized (lock) {
      progress.forEach((id, row) -> {
        for (StepStatus status : row) {
          if (status == StepStatus.FAILED) {
            failed.add(id);
            return;
          }
        }
      });
    }
    return List.copyOf(failed);
  }

  private int indexOf(String step) {
    Integer index = step == null ? null : stepIndex.get(step);
    if (index == null) {
      throw new IllegalArgumentException("Unknown step '" + step + "'; expected one of " + steps);
    }
    return index;
  }

  private StepStatus[] rowFor(ID itemId) {
    return progress.computeIfAbsent(itemId, id -> {
      StepStatus[] row = new StepStatus[steps.size()];
      Arrays.fill(row, StepStatus.PENDING);
      return row;
    });
  }

  private Map<String, StepStatus> snapshot(StepStatus[] row) {
    Map<String, StepStatus> view = new LinkedHashMap<>();
    for (int i = 0; i < row.length; i++) {
      view.put(steps.get(i), row[i]);
    }
    return Collections.unmodifiableMap(view);
  }
}
