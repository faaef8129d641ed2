package ca.gc.cra.ferry.application.pipeline;

import ca.gc.cra.ferry.validation.Numbers;
import ca.gc.cra.ferry.validation.Strings;
import java.util.OptionalLong;

/**
 * Settings for {@link ProducerWorkerExecutor}.
 *
 * @param maxQueueSize capacity of each of the two inter-stage queues
 * @param iterationCount expected number of chunks, used only for progress logs
 * @param downloadDescription phrase used in logs for the download stage (e.g. "downloading assets")
 * @param processDescription phrase used in logs for the process stage
 * @param writeDescription phrase used in logs for the write stage
 * @since 0.1.0
 */
public record PipelineSettings(
    int maxQueueSize,
    OptionalLong iterationCount,
    String downloadDescription,
    String processDescription,
    String writeDescription) {
  public static final int DEFAULT_MAX_QUEUE_SIZE = 10;
  static final int MAX_QUEUE_SIZE = 10_000;

  public PipelineSettings {
    Numbers.requireRange("maxQueueSize", maxQueueSize, 1, MAX_QUEUE_SIZE);
    iterationCount = iterationCount == null ? OptionalLong.empty() : iterationCount;
    iterationCount.ifPresent(count -> Numbers.requireRange("iterationCount", count, 0, Long.MAX_VALUE));
    downloadDescription = Strings.requireNonBlank("downloadDescription", downloadDescription);
    processDescription = Strings.requireNonBlank("processDescription", processDescription);
    writeDescription = Strings.requireNonBlank("writeDescription", writeDescription);
  }

  /**
   * Returns settings with generic stage descriptions.
   *
   * @param maxQueueSize queue capacity
   * @return settings without an expected iteration count
   */
  public static PipelineSettings of(int maxQueueSize) {
    return new PipelineSettings(maxQueueSize, OptionalLong.empty(), "downloading", "processing", "writing");
  }

  /**
   * Returns a copy carrying the expected number of chunks.
   *
   * @param count expected chunks
   * @return updated settings
   */
  public PipelineSettings withIterationCount(long count) {
    return new PipelineSettings(maxQueueSize, OptionalLong.of(count), downloadDescription, processDescription,
        writeDescription);
  }

  /**
   * Returns a copy with new stage descriptions.
   *
   * @param download download stage phrase
   * @param process process stage phrase
   * @param write write stage phrase
   * @return updated settings
   */
  public PipelineSettings withDescriptions(String download, String process, String write) {
    return new PipelineSettings(maxQueueSize, iterationCount, download, process, write);
  }
}
