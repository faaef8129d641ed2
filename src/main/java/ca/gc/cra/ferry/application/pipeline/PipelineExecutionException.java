package ca.gc.cra.ferry.application.pipeline;

/**
 * Raised by {@link ProducerWorkerExecutor#raiseOnError()} when a stage failed.
 *
 * @since 0.1.0
 */
public final class PipelineExecutionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PipelineExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
