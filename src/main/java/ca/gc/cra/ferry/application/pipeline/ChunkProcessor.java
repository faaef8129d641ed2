package ca.gc.cra.ferry.application.pipeline;

/**
 * Transforms one downloaded chunk for the write stage.
 *
 * @param <D> downloaded chunk type
 * @param <P> processed chunk type
 * @since 0.1.0
 */
@FunctionalInterface
public interface ChunkProcessor<D, P> {

  /**
   * Transforms a chunk.
   *
   * @param chunk downloaded chunk
   * @return processed chunk; must not be {@code null}
   * @throws Exception any failure; the pipeline records it and stops
   */
  P process(D chunk) throws Exception;
}
