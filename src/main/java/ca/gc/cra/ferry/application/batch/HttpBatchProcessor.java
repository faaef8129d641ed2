package ca.gc.cra.ferry.application.batch;

import ca.gc.cra.ferry.application.json.JsonSupport;
import ca.gc.cra.ferry.application.port.BatchResponse;
import ca.gc.cra.ferry.application.port.BatchTransport;
import ca.gc.cra.ferry.application.port.ClockPort;
import ca.gc.cra.ferry.application.port.MetricsPort;
import ca.gc.cra.ferry.application.port.ProgressReporter;
import ca.gc.cra.ferry.application.progress.ProgressTracker;
import ca.gc.cra.ferry.application.progress.StepStatus;
import ca.gc.cra.ferry.domain.batch.WorkBatch;
import ca.gc.cra.ferry.domain.outcome.BatchResult;
import ca.gc.cra.ferry.domain.outcome.ItemOutcome;
import ca.gc.cra.ferry.domain.outcome.ProcessorResult;
import ca.gc.cra.ferry.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.ferry.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Uploads an item stream in fixed-size batches through a worker pool and returns a per-item
 * outcome ledger.
 * <p><strong>Why:</strong> The remote API caps items per request, rate-limits callers and rejects whole batches when a
 * single item is invalid; the processor isolates invalid items by bisection, waits out rate limits and retries
 * transient failures so that every valid item is eventually written.</p>
 * <p><strong>Role:</strong> Application service; commands call {@link #process(Iterable)} directly or through the
 * write stage of a {@code ProducerWorkerExecutor}.</p>
 * <p><strong>Classification of each response:</strong>
 * <ul>
 *   <li>2xx: every item succeeds.</li>
 *   <li>400 on more than one item: the batch is bisected and both halves are re-queued with the same attempt.</li>
 *   <li>429: the shared rate-limit deadline is advanced and the batch is re-queued without using a retry.</li>
 *   <li>5xx or network failure: the worker backs off and re-queues with the next attempt while
 *       {@code attempt <= maxRetries}.</li>
 *   <li>Anything else, or retries exhausted: every item fails with the status code.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One {@code process} call at a time per instance. The rate-limit deadline
 * survives across calls.</p>
 * <p><strong>Observability:</strong> Emits {@code batch.request.sent}, {@code batch.request.latencyNanos},
 * {@code batch.split}, {@code batch.ratelimited}, {@code batch.retry}, {@code batch.items.succeeded} and
 * {@code batch.items.failed}.</p>
 *
 * @param <T> raw item type
 * @param <ID> item identifier type
 * @since 0.1.0
 */
public final class HttpBatchProcessor<T, ID> {
  private static final Logger log = LoggerFactory.getLogger(HttpBatchProcessor.class);
  private static final long POLL_TIMEOUT_MILLIS = 50L;
  private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000L;
  private static final int MAX_ITEM_DESCRIPTION_BYTES = 50;

  private final BatchProcessorSettings settings;
  private final BatchTransport<T> transport;
  private final Function<T, ID> identify;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final BackoffPolicy backoff;
  private final RateLimitState rateLimit;
  private final ProgressReporter progressReporter;
  private final ProgressTracker<ID> tracker;
  private final String trackerStep;
  private final ResponseBodies responses = new ResponseBodies(new JsonSupport());

  private HttpBatchProcessor(Builder<T, ID> builder) {
    this.settings = builder.settings;
    this.transport = builder.transport;
    this.identify = builder.identify;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.backoff = builder.jitter == null ? new BackoffPolicy() : new BackoffPolicy(builder.jitter);
    this.rateLimit = new RateLimitState(builder.clock);
    this.progressReporter = builder.progressReporter;
    this.tracker = builder.tracker;
    this.trackerStep = builder.trackerStep;
  }

  /**
   * Starts building a processor.
   *
   * @param settings batch sizing, concurrency and retry limits
   * @param transport transport that performs one request per batch
   * @param identify derives the identifier recorded in outcomes
   * @param <T> raw item type
   * @param <ID> item identifier type
   * @return builder with no-op metrics, the system clock and random jitter
   */
  public static <T, ID> Builder<T, ID> builder(
      BatchProcessorSettings settings, BatchTransport<T> transport, Function<T, ID> identify) {
    return new Builder<>(settings, transport, identify);
  }

  public BatchProcessorSettings settings() {
    return settings;
  }

  /**
   * Processes every item and blocks until each has a terminal outcome.
   *
   * @param items item source, iterated once on a dedicated producer thread
   * @return outcome ledger of the run
   */
  public ProcessorResult<ID> process(Iterable<T> items) {
    return process(items, -1L);
  }

  /**
   * Processes every item and blocks until each has a terminal outcome.
   *
   * @param items item source, iterated once on a dedicated producer thread
   * @param expectedTotal item count used for progress reporting, or a negative value when unknown
   * @return outcome ledger of the run
   */
  public ProcessorResult<ID> process(Iterable<T> items, long expectedTotal) {
    Objects.requireNonNull(items, "items");
    Run run = new Run(settings.queueCapacity());
    ExecutorService pool = ExecutorFactories.newFixedPool(
        settings.maxWorkers() + 1,
        "ferry-batch",
        (thread, ex) -> log.error("Batch thread {} terminated unexpectedly", thread.getName(), ex));
    pool.execute(() -> produce(items, run));
    for (int i = 0; i < settings.maxWorkers(); i++) {
      pool.execute(() -> work(run));
    }

    ProcessorResult.Builder<ID> ledger = ProcessorResult.builder();
    long processed = 0L;
    try {
      while (true) {
        BatchResult<ID> result = run.results.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        if (result != null) {
          ledger.add(result);
          processed += result.size();
          record(result);
          progressReporter.onProgress(processed, expectedTotal);
          continue;
        }
        if (run.producerDone.get() && run.outstanding.get() == 0 && run.results.isEmpty()) {
          break;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while draining batch results; returning {} processed items", processed);
    } finally {
      run.finished.set(true);
      ExecutorFactories.shutdown(pool, SHUTDOWN_TIMEOUT_MILLIS);
    }

    Throwable producerError = run.producerError.get();
    if (producerError != null) {
      ledger.producerError(producerError);
    }
    ProcessorResult<ID> result = ledger.build();
    log.info("Processed {} items: {} succeeded, {} failed", result.totalProcessed(), result.totalSuccessful(),
        result.totalFailed());
    if (!result.errorSummary().isEmpty()) {
      log.info("Failures by status code: {}", result.errorSummary());
    }
    return result;
  }

  private void produce(Iterable<T> items, Run run) {
    int batchSize = settings.batchSize();
    List<T> chunk = new ArrayList<>(batchSize);
    try {
      try {
        for (T item : items) {
          chunk.add(item);
          if (chunk.size() == batchSize) {
            enqueueNew(run, chunk);
            chunk = new ArrayList<>(batchSize);
          }
        }
      } catch (RuntimeException ex) {
        log.error("Item source failed after batching {} full batches; submitting the partial batch",
            run.submitted.get(), ex);
        run.producerError.set(ex);
      }
      if (!chunk.isEmpty()) {
        enqueueNew(run, chunk);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      run.producerError.compareAndSet(null, ex);
      log.warn("Producer interrupted; remaining items were not submitted");
    } finally {
      run.producerDone.set(true);
    }
  }

  private void enqueueNew(Run run, List<T> chunk) throws InterruptedException {
    WorkBatch<T> batch = WorkBatch.initial(chunk);
    run.outstanding.incrementAndGet();
    while (!run.fresh.offer(batch, POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
      if (run.finished.get()) {
        run.outstanding.decrementAndGet();
        throw new InterruptedException("processor finished before the batch could be queued");
      }
    }
    run.submitted.incrementAndGet();
  }

  private void work(Run run) {
    try {
      while (!run.finished.get()) {
        WorkBatch<T> batch = run.requeued.poll();
        if (batch == null) {
          batch = run.fresh.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        }
        if (batch == null) {
          continue;
        }
        try {
          handle(batch, run);
        } catch (InterruptedException ex) {
          complete(run, failAll(batch, 0, "Interrupted before the batch completed"));
          throw ex;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      if (!run.finished.get()) {
        log.warn("Batch worker interrupted");
      }
    }
  }

  private void handle(WorkBatch<T> batch, Run run) throws InterruptedException {
    rateLimit.awaitClearance();
    metrics.increment("batch.request.sent");
    long started = System.nanoTime();
    BatchResponse response;
    try {
      response = transport.send(batch.items());
    } catch (IOException ex) {
      metrics.observe("batch.request.latencyNanos", System.nanoTime() - started);
      retryOrFail(batch, run, 0, Logs.truncate("Network error: " + ex, ResponseBodies.MAX_ERROR_MESSAGE_BYTES));
      return;
    } catch (RuntimeException ex) {
      log.error("Unexpected error sending batch of {} items", batch.size(), ex);
      complete(run, failAll(batch, 0,
          Logs.truncate("Unexpected error: " + ex, ResponseBodies.MAX_ERROR_MESSAGE_BYTES)));
      return;
    }
    metrics.observe("batch.request.latencyNanos", System.nanoTime() - started);

    int status = response.statusCode();
    if (response.isSuccess()) {
      complete(run, succeed(batch, response));
    } else if (status == 400 && batch.size() > 1) {
      metrics.increment("batch.split");
      List<WorkBatch<T>> halves = batch.split();
      log.debug("Batch of {} items rejected with 400; splitting into {} and {}", batch.size(),
          halves.get(0).size(), halves.get(1).size());
      run.outstanding.incrementAndGet();
      run.requeued.addAll(halves);
    } else if (status == 429) {
      metrics.increment("batch.ratelimited");
      long delay = backoff.rateLimitDelayMillis(response.retryAfter(), clock.nowMillis());
      long deadline = rateLimit.deferFor(delay);
      log.warn("Rate limited (429); pausing requests for {} ms (until {})", delay, deadline);
      run.requeued.add(batch);
    } else if (status >= 500) {
      retryOrFail(batch, run, status, responses.errorMessage(response));
    } else {
      if (status == 401 || status == 403) {
        log.error("Request rejected with {}; check the configured credentials and their access scopes", status);
      }
      complete(run, failAll(batch, status, responses.errorMessage(response)));
    }
  }

  private void retryOrFail(WorkBatch<T> batch, Run run, int status, String message) throws InterruptedException {
    if (batch.attempt() <= settings.maxRetries()) {
      long delay = backoff.transientDelayMillis(batch.attempt());
      metrics.increment("batch.retry");
      log.warn("Batch of {} items failed on attempt {} ({}); retrying in {} ms", batch.size(), batch.attempt(),
          status == 0 ? "network error" : "HTTP " + status, delay);
      clock.sleepMillis(delay);
      run.requeued.add(batch.nextAttempt());
    } else {
      log.error("Batch of {} items failed after {} attempts: {}", batch.size(), batch.attempt(), message);
      complete(run, failAll(batch, status, message));
    }
  }

  private BatchResult<ID> succeed(WorkBatch<T> batch, BatchResponse response) {
    OptionalInt returned = responses.itemCount(response.body());
    int answered = returned.orElse(batch.size());
    if (answered > batch.size()) {
      log.warn("Response carried {} items for a request of {}; ignoring the extra items", answered, batch.size());
    }
    List<ItemOutcome<ID>> outcomes = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      T item = batch.items().get(i);
      if (i < answered) {
        outcomes.add(outcome(item, id -> new ItemOutcome.Success<>(id, settings.operation()),
            response.statusCode(), "Item identifier could not be determined"));
      } else {
        outcomes.add(outcome(item, id -> new ItemOutcome.Failed<>(id, response.statusCode(),
            "Response item missing for request item"), response.statusCode(),
            "Response item missing for request item"));
      }
    }
    metrics.observe("batch.items.succeeded", Math.min(answered, batch.size()));
    return new BatchResult<>(outcomes);
  }

  private BatchResult<ID> failAll(WorkBatch<T> batch, int status, String message) {
    List<ItemOutcome<ID>> outcomes = new ArrayList<>(batch.size());
    for (T item : batch.items()) {
      outcomes.add(outcome(item, id -> new ItemOutcome.Failed<>(id, status, message), status, message));
    }
    metrics.observe("batch.items.failed", batch.size());
    return new BatchResult<>(outcomes);
  }

  private ItemOutcome<ID> outcome(
      T item, Function<ID, ItemOutcome<ID>> known, int status, String unknownMessage) {
    ID id;
    try {
      id = identify.apply(item);
    } catch (RuntimeException ex) {
      log.debug("Unable to derive identifier for item", ex);
      id = null;
    }
    if (id == null) {
      return new ItemOutcome.Unknown<>(Logs.describe(item, MAX_ITEM_DESCRIPTION_BYTES), status, unknownMessage);
    }
    return known.apply(id);
  }

  private void complete(Run run, BatchResult<ID> result) {
    run.results.add(result);
    run.outstanding.decrementAndGet();
  }

  private void record(BatchResult<ID> result) {
    if (tracker == null) {
      return;
    }
    for (ItemOutcome<ID> outcome : result.outcomes()) {
      if (outcome instanceof ItemOutcome.Success<ID> success) {
        track(success.itemId(), StepStatus.SUCCESS);
      } else if (outcome instanceof ItemOutcome.Failed<ID> failed) {
        track(failed.itemId(), StepStatus.FAILED);
      }
    }
  }

  private void track(ID itemId, StepStatus status) {
    if (!tracker.trySetProgress(itemId, trackerStep, status)) {
      log.debug("Item {} step '{}' already {}; not recording {}", itemId, trackerStep,
          tracker.getProgress(itemId, trackerStep), status);
    }
  }

  /** Queues and flags shared by the threads of one {@code process} call. */
  private final class Run {
    private final BlockingQueue<WorkBatch<T>> fresh;
    private final BlockingQueue<WorkBatch<T>> requeued = new LinkedBlockingQueue<>();
    private final BlockingQueue<BatchResult<ID>> results = new LinkedBlockingQueue<>();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicInteger submitted = new AtomicInteger();
    private final AtomicBoolean producerDone = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicReference<Throwable> producerError = new AtomicReference<>();

    private Run(int capacity) {
      this.fresh = new ArrayBlockingQueue<>(capacity);
    }
  }

  /**
   * Builder for {@link HttpBatchProcessor}.
   *
   * @param <T> raw item type
   * @param <ID> item identifier type
   */
  public static final class Builder<T, ID> {
    private final BatchProcessorSettings settings;
    private final BatchTransport<T> transport;
    private final Function<T, ID> identify;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private ClockPort clock = ClockPort.SYSTEM;
    private DoubleSupplier jitter;
    private ProgressReporter progressReporter = ProgressReporter.NONE;
    private ProgressTracker<ID> tracker;
    private String trackerStep;

    private Builder(BatchProcessorSettings settings, BatchTransport<T> transport, Function<T, ID> identify) {
      this.settings = Objects.requireNonNull(settings, "settings");
      this.transport = Objects.requireNonNull(transport, "transport");
      this.identify = Objects.requireNonNull(identify, "identify");
    }

    public Builder<T, ID> metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder<T, ID> clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Overrides the jitter source added to every backoff delay.
     *
     * @param jitter supplier of values in {@code [0, 1)}
     * @return this builder
     */
    public Builder<T, ID> jitter(DoubleSupplier jitter) {
      this.jitter = Objects.requireNonNull(jitter, "jitter");
      return this;
    }

    public Builder<T, ID> progressReporter(ProgressReporter progressReporter) {
      this.progressReporter = Objects.requireNonNull(progressReporter, "progressReporter");
      return this;
    }

    /**
     * Marks each resolved item {@code SUCCESS} or {@code FAILED} at {@code step} as results are drained.
     *
     * @param tracker shared tracker
     * @param step step owned by this processor; must be one of the tracker's steps
     * @return this builder
     */
    public Builder<T, ID> tracker(ProgressTracker<ID> tracker, String step) {
      Objects.requireNonNull(tracker, "tracker");
      Objects.requireNonNull(step, "step");
      if (!tracker.steps().contains(step)) {
        throw new IllegalArgumentException("Unknown step '" + step + "'; expected one of " + tracker.steps());
      }
      this.tracker = tracker;
      this.trackerStep = step;
      return this;
    }

    public HttpBatchProcessor<T, ID> build() {
      return new HttpBatchProcessor<>(this);
    }
  }
}
