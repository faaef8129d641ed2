package ca.gc.cra.ferry.application.transfer;

import ca.gc.cra.ferry.application.batch.HttpBatchProcessor;
import ca.gc.cra.ferry.application.pipeline.ChunkProcessor;
import ca.gc.cra.ferry.application.pipeline.PipelineSettings;
import ca.gc.cra.ferry.application.pipeline.ProducerWorkerExecutor;
import ca.gc.cra.ferry.application.port.MetricsPort;
import ca.gc.cra.ferry.domain.outcome.ProcessorResult;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs an upload command: download chunks, convert them to API items, upload them in batches.
 * <p><strong>Role:</strong> Command-level use case composing {@link ProducerWorkerExecutor} with a
 * {@link BatchUploadWriter}.</p>
 * <p><strong>Error handling:</strong> A stage failure surfaces as
 * {@link ca.gc.cra.ferry.application.pipeline.PipelineExecutionException}; item-level failures are reported in the
 * returned ledger.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code pipeline} to the run name for the duration of the call; stage
 * and batch worker threads inherit it.</p>
 *
 * @since 0.1.0
 */
public final class TransferUseCase {
  private static final Logger log = LoggerFactory.getLogger(TransferUseCase.class);

  private final MetricsPort metrics;

  public TransferUseCase() {
    this(MetricsPort.NO_OP);
  }

  public TransferUseCase(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Uploads every item of every downloaded chunk.
   *
   * @param name run name used in logs and MDC (e.g. {@code "upload-assets"})
   * @param download chunk source
   * @param convert converts a downloaded chunk into API items
   * @param processor batch processor performing the upload
   * @param settings pipeline queue sizing and stage descriptions
   * @param <D> downloaded chunk type
   * @param <T> API item type
   * @param <ID> item identifier type
   * @return totals and merged ledger
   * @throws ca.gc.cra.ferry.application.pipeline.PipelineExecutionException when any stage failed
   */
  public <D extends Collection<?>, T, ID> TransferReport<ID> run(
      String name,
      Iterable<D> download,
      ChunkProcessor<D, List<T>> convert,
      HttpBatchProcessor<T, ID> processor,
      PipelineSettings settings) {
    Objects.requireNonNull(name, "name");
    BatchUploadWriter<T, ID> writer = new BatchUploadWriter<>(processor);
    ProducerWorkerExecutor<D, List<T>> executor =
        new ProducerWorkerExecutor<>(download, convert, writer, settings, metrics);
    String previousPipeline = MDC.get("pipeline");
    MDC.put("pipeline", name);
    try {
      log.info("Starting {} (batchSize={}, maxWorkers={}, maxRetries={})", name,
          processor.settings().batchSize(), processor.settings().maxWorkers(), processor.settings().maxRetries());
      executor.run();
      executor.raiseOnError();
      ProcessorResult<ID> result = writer.result();
      log.info("{} finished: {} items, {} succeeded, {} failed ({}% success)", name, executor.totalItems(),
          result.totalSuccessful(), result.totalFailed(), Math.round(result.successRate() * 100.0));
      return new TransferReport<>(executor.totalItems(), result);
    } finally {
      if (previousPipeline == null) {
        MDC.remove("pipeline");
      } else {
        MDC.put("pipeline", previousPipeline);
      }
    }
  }
}
