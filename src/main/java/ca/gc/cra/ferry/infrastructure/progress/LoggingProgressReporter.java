package ca.gc.cra.ferry.infrastructure.progress;

import ca.gc.cra.ferry.application.port.ProgressReporter;
import ca.gc.cra.ferry.validation.Numbers;
import ca.gc.cra.ferry.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress reporter that logs at INFO whenever another percentage step is crossed, or every {@code interval} items
 * when the total is unknown.
 */
public final class LoggingProgressReporter implements ProgressReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingProgressReporter.class);

  private final String label;
  private final int percentStep;
  private final long interval;
  private long lastBucket = -1L;

  /**
   * Creates a reporter.
   *
   * @param label prefix of every log line (e.g. {@code "Uploading assets"})
   * @param percentStep percentage granularity when the total is known, 1-100
   * @param interval item granularity when the total is unknown
   */
  public LoggingProgressReporter(String label, int percentStep, long interval) {
    this.label = Strings.requireNonBlank("label", label);
    this.percentStep = (int) Numbers.requireRange("percentStep", percentStep, 1, 100);
    this.interval = Numbers.requireRange("interval", interval, 1, Long.MAX_VALUE);
  }

  @Override
  public void onProgress(long processedItems, long expectedTotal) {
    if (expectedTotal > 0) {
      long percent = Math.min(100L, processedItems * 100L / expectedTotal);
      long bucket = percent / percentStep;
      if (bucket > lastBucket) {
        lastBucket = bucket;
        log.info("{}: {}/{} items ({}%)", label, processedItems, expectedTotal, percent);
      }
    } else {
      long bucket = processedItems / interval;
      if (bucket > lastBucket) {
        lastBucket = bucket;
        log.info("{}: {} items", label, processedItems);
      }
    }
  }
}
