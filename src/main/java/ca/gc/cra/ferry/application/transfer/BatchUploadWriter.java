package ca.gc.cra.ferry.application.transfer;

import ca.gc.cra.ferry.application.batch.HttpBatchProcessor;
import ca.gc.cra.ferry.application.pipeline.ChunkWriter;
import ca.gc.cra.ferry.domain.outcome.ProcessorResult;
import java.util.List;
import java.util.Objects;

/**
 * Write stage that uploads each converted chunk through an {@link HttpBatchProcessor} and keeps a running ledger.
 *
 * <p>Chunk outcomes are appended to one builder; the combined ledger is only materialized by {@link #result()}.
 *
 * @param <T> raw item type
 * @param <ID> item identifier type
 * @since 0.1.0
 */
public final class BatchUploadWriter<T, ID> implements ChunkWriter<List<T>> {
  private final HttpBatchProcessor<T, ID> processor;
  private final ProcessorResult.Builder<ID> ledger = ProcessorResult.builder();

  public BatchUploadWriter(HttpBatchProcessor<T, ID> processor) {
    this.processor = Objects.requireNonNull(processor, "processor");
  }

  @Override
  public void write(List<T> chunk) {
    ProcessorResult<ID> chunkResult = processor.process(chunk, chunk.size());
    synchronized (this) {
      ledger.addAll(chunkResult);
    }
  }

  /**
   * Returns the ledger of every chunk written so far.
   *
   * @return merged ledger
   */
  public synchronized ProcessorResult<ID> result() {
    return ledger.build();
  }
}
