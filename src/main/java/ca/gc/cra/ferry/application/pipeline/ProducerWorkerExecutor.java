package ca.gc.cra.ferry.application.pipeline;

import ca.gc.cra.ferry.application.port.MetricsPort;
import ca.gc.cra.ferry.infrastructure.exec.ExecutorFactories;
import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Three-stage concurrent pipeline (download, process, write) joined by two bounded queues.
 * <p><strong>Why:</strong> Downloading pages, converting them and writing them are each I/O or CPU bound; running
 * them on separate threads overlaps the work while the bounded queues cap memory when one stage is slower.</p>
 * <p><strong>Role:</strong> Application service used by download, upload and migrate commands; upload commands plug a
 * batch-upload writer in as the write stage.</p>
 * <p><strong>Failure model:</strong>
 * <ul>
 *   <li>The first stage exception is recorded; later ones are logged only.</li>
 *   <li>Every stage re-checks the shared error flag at least once per poll interval and stops.</li>
 *   <li>{@link #run()} never throws for stage failures; call {@link #raiseOnError()} or inspect
 *       {@link #errorOccurred()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} may be invoked once. Accessors are safe from any thread while the
 * pipeline runs.</p>
 * <p><strong>Observability:</strong> Emits {@code pipeline.chunks.downloaded}, {@code pipeline.chunks.processed},
 * {@code pipeline.chunks.written} and {@code pipeline.error}.</p>
 *
 * @param <D> downloaded chunk type; its size counts towards {@link #totalItems()}
 * @param <P> processed chunk type
 * @since 0.1.0
 */
public final class ProducerWorkerExecutor<D extends Collection<?>, P> {
  private static final Logger log = LoggerFactory.getLogger(ProducerWorkerExecutor.class);
  static final long DEFAULT_POLL_MILLIS = 500L;

  private final Iterable<D> download;
  private final ChunkProcessor<D, P> processor;
  private final ChunkWriter<P> writer;
  private final PipelineSettings settings;
  private final MetricsPort metrics;
  private final long pollMillis;

  private final BlockingQueue<D> processQueue;
  private final BlockingQueue<P> writeQueue;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean downloadComplete = new AtomicBoolean();
  private final AtomicBoolean processComplete = new AtomicBoolean();
  private final AtomicLong totalItems = new AtomicLong();
  private final AtomicLong chunksDownloaded = new AtomicLong();
  private final AtomicLong chunksWritten = new AtomicLong();
  private final Object errorLock = new Object();
  private volatile boolean errorOccurred;
  private volatile String errorMessage;
  private volatile Throwable errorCause;

  /**
   * Creates an executor without metrics.
   *
   * @param download chunk source, iterated once on the download thread
   * @param processor transform applied on the process thread
   * @param writer sink invoked on the write thread
   * @param settings queue sizing and stage descriptions
   */
  public ProducerWorkerExecutor(
      Iterable<D> download, ChunkProcessor<D, P> processor, ChunkWriter<P> writer, PipelineSettings settings) {
    this(download, processor, writer, settings, MetricsPort.NO_OP);
  }

  /**
   * Creates an executor.
   *
   * @param download chunk source, iterated once on the download thread
   * @param processor transform applied on the process thread
   * @param writer sink invoked on the write thread
   * @param settings queue sizing and stage descriptions
   * @param metrics metrics sink
   */
  public ProducerWorkerExecutor(
      Iterable<D> download,
      ChunkProcessor<D, P> processor,
      ChunkWriter<P> writer,
      PipelineSettings settings,
      MetricsPort metrics) {
    this(download, processor, writer, settings, metrics, DEFAULT_POLL_MILLIS);
  }

  ProducerWorkerExecutor(
      Iterable<D> download,
      ChunkProcessor<D, P> processor,
      ChunkWriter<P> writer,
      PipelineSettings settings,
      MetricsPort metrics,
      long pollMillis) {
    this.download = Objects.requireNonNull(download, "download");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (pollMillis <= 0) {
      throw new IllegalArgumentException("pollMillis must be positive");
    }
    this.pollMillis = pollMillis;
    this.processQueue = new ArrayBlockingQueue<>(settings.maxQueueSize());
    this.writeQueue = new ArrayBlockingQueue<>(settings.maxQueueSize());
  }

  /**
   * Runs the three stages and blocks until all of them stopped.
   *
   * @throws IllegalStateException if called more than once
   */
  public void run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("ProducerWorkerExecutor can only run once");
    }
    ExecutorService stages = ExecutorFactories.newFixedPool(3, "ferry-stage",
        (thread, ex) -> recordError("running " + thread.getName(), ex));
    stages.execute(this::downloadStage);
    stages.execute(this::processStage);
    stages.execute(this::writeStage);
    stages.shutdown();
    try {
      boolean terminated = false;
      while (!terminated) {
        terminated = stages.awaitTermination(pollMillis, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      recordError("waiting for pipeline stages", ex);
      ExecutorFactories.shutdown(stages, pollMillis * 4);
    }
    if (errorOccurred) {
      log.warn("Pipeline stopped after {} of {} chunks were written: {}", chunksWritten.get(),
          chunksDownloaded.get(), errorMessage);
    } else {
      log.info("Pipeline finished: {} chunks, {} items", chunksWritten.get(), totalItems.get());
    }
  }

  public boolean errorOccurred() {
    return errorOccurred;
  }

  /**
   * Returns the message of the first stage failure.
   *
   * @return message, or {@code null} when no stage failed
   */
  public String errorMessage() {
    return errorMessage;
  }

  /**
   * Returns the sum of chunk sizes yielded by the download stage so far.
   *
   * @return live item count
   */
  public long totalItems() {
    return totalItems.get();
  }

  /**
   * Throws when any stage failed.
   *
   * @throws PipelineExecutionException carrying the first recorded failure
   */
  public void raiseOnError() {
    if (errorOccurred) {
      throw new PipelineExecutionException("An error occurred during execution: " + errorMessage, errorCause);
    }
  }

  private void downloadStage() {
    String description = settings.downloadDescription();
    try {
      Iterator<D> chunks = download.iterator();
      while (!errorOccurred && chunks.hasNext()) {
        D chunk = chunks.next();
        totalItems.addAndGet(chunk.size());
        long count = chunksDownloaded.incrementAndGet();
        metrics.increment("pipeline.chunks.downloaded");
        logProgress(description, count);
        if (!put(processQueue, chunk)) {
          break;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      recordError(description, ex);
    } catch (Exception ex) {
      recordError(description, ex);
    } finally {
      downloadComplete.set(true);
    }
  }

  private void processStage() {
    String description = settings.processDescription();
    try {
      while (!errorOccurred) {
        boolean upstreamDone = downloadComplete.get();
        D chunk = processQueue.poll(pollMillis, TimeUnit.MILLISECONDS);
        if (chunk == null) {
          if (upstreamDone) {
            break;
          }
          continue;
        }
        P processed = processor.process(chunk);
        metrics.increment("pipeline.chunks.processed");
        if (!put(writeQueue, processed)) {
          break;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      recordError(description, ex);
    } catch (Exception ex) {
      recordError(description, ex);
    } finally {
      processComplete.set(true);
    }
  }

  private void writeStage() {
    String description = settings.writeDescription();
    try {
      while (!errorOccurred) {
        boolean upstreamDone = processComplete.get();
        P chunk = writeQueue.poll(pollMillis, TimeUnit.MILLISECONDS);
        if (chunk == null) {
          if (upstreamDone) {
            break;
          }
          continue;
        }
        writer.write(chunk);
        chunksWritten.incrementAndGet();
        metrics.increment("pipeline.chunks.written");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      recordError(description, ex);
    } catch (Exception ex) {
      recordError(description, ex);
    }
  }

  /** Offers with a timeout until accepted; returns {@code false} once another stage failed. */
  private <E> boolean put(BlockingQueue<E> queue, E element) throws InterruptedException {
    while (!errorOccurred) {
      if (queue.offer(element, pollMillis, TimeUnit.MILLISECONDS)) {
        return true;
      }
    }
    return false;
  }

  private void logProgress(String description, long count) {
    if (settings.iterationCount().isPresent()) {
      log.debug("{}: chunk {}/{}", description, count, settings.iterationCount().getAsLong());
    } else {
      log.debug("{}: chunk {}", description, count);
    }
  }

  private void recordError(String description, Throwable ex) {
    String message = "Error occurred while " + description + ": " + ex.getMessage();
    synchronized (errorLock) {
      if (errorMessage == null) {
        errorMessage = message;
        errorCause = ex;
        metrics.increment("pipeline.error");
        log.error(message, ex);
      } else {
        log.debug("Suppressed secondary pipeline failure: {}", message);
      }
      errorOccurred = true;
    }
  }
}
