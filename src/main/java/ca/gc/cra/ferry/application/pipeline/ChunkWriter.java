package ca.gc.cra.ferry.application.pipeline;

/**
 * Persists one processed chunk (file sink, batch upload).
 *
 * @param <P> processed chunk type
 * @since 0.1.0
 */
@FunctionalInterface
public interface ChunkWriter<P> {

  /**
   * Writes a chunk.
   *
   * @param chunk processed chunk
   * @throws Exception any failure; the pipeline records it and stops
   */
  void write(P chunk) throws Exception;
}
