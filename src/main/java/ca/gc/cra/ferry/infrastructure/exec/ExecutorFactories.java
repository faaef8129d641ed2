package ca.gc.cra.ferry.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Factory helpers for the thread pools used by batch processors and staged pipelines.
 *
 * <p>Pools created here run each task with the MDC context of the thread that submitted it.</p>
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor that runs exactly {@code size} long-lived tasks; extra submissions are rejected.
   *
   * @param size number of threads to allocate
   * @param prefix thread-name prefix used to tag threads
   * @param handler uncaught exception handler installed on each thread; {@code null} logs the failure
   * @return configured executor service
   */
  public static ExecutorService newFixedPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "ferry-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Uncaught exception on {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy()) {
      @Override
      public void execute(Runnable command) {
        super.execute(withMdc(command));
      }
    };
  }

  /**
   * Wraps a task so that it runs with the caller's current MDC context; the worker's own context is restored
   * afterwards.
   *
   * @param task task to wrap
   * @return wrapped task
   */
  public static Runnable withMdc(Runnable task) {
    Objects.requireNonNull(task, "task");
    Map<String, String> context = MDC.getCopyOfContextMap();
    return () -> {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      apply(context);
      try {
        task.run();
      } finally {
        apply(previous);
      }
    };
  }

  private static void apply(Map<String, String> context) {
    if (context == null || context.isEmpty()) {
      MDC.clear();
    } else {
      MDC.setContextMap(context);
    }
  }

  /**
   * Stops an executor, waiting up to {@code timeoutMillis} before interrupting remaining threads.
   *
   * @param executor executor to stop
   * @param timeoutMillis graceful wait
   * @return {@code true} if every thread ended within the grace period
   */
  public static boolean shutdown(ExecutorService executor, long timeoutMillis) {
    executor.shutdown();
    try {
      if (executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Executor did not stop within {} ms; interrupting workers", timeoutMillis);
      executor.shutdownNow();
      return executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
