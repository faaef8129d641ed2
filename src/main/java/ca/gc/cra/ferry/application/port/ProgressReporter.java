package ca.gc.cra.ferry.application.port;

/**
 * Receives progress updates while a batch processor drains results.
 *
 * <p>Invoked only from the thread that called {@code process}, never concurrently.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProgressReporter {

  /**
   * Reports that another batch finished.
   *
   * @param processedItems items with a terminal outcome so far
   * @param expectedTotal total number of items when known, otherwise {@code -1}
   */
  void onProgress(long processedItems, long expectedTotal);

  /** Reporter that ignores all updates. */
  ProgressReporter NONE = (processedItems, expectedTotal) -> {};
}
