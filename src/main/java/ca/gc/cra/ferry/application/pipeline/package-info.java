/**
 * Staged download/process/write pipelines with bounded queues and first-error-wins failure signalling.
 * <p><strong>Concurrency:</strong> Exactly three stage threads per run.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code pipeline.*} namespace.</p>
 */
package ca.gc.cra.ferry.application.pipeline;
