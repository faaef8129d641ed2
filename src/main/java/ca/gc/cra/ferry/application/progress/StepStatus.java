package ca.gc.cra.ferry.application.progress;

import java.util.Locale;

/**
 * Status of one item at one step of a multi-step command.
 *
 * @since 0.1.0
 */
public enum StepStatus {
  PENDING,
  SUCCESS,
  FAILED,
  ABORTED;

  /**
   * Parses a status name case-insensitively.
   *
   * @param raw status name such as {@code "success"}
   * @return matching status
   * @throws IllegalArgumentException if {@code raw} is {@code null} or names no status
   */
  public static StepStatus fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("status must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (StepStatus status : values()) {
      if (status.name().equals(normalized)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown status '" + raw + "'; expected one of pending, success, failed, aborted");
  }

  /**
   * Returns {@code true} for statuses that end an item's progression.
   *
   * @return whether the status is {@link #FAILED} or {@link #ABORTED}
   */
  public boolean poisoned() {
    return this == FAILED || this == ABORTED;
  }
}
