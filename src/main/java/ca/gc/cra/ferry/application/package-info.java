/**
 * Application layer orchestration for ferry transfers.
 * <p><strong>Role:</strong> Hosts the batch processor, the staged pipeline executor, progress tracking and the ports
 * they depend on.</p>
 * <p><strong>Concurrency:</strong> Use cases manage worker pools explicitly; interfaces document caller
 * responsibilities.</p>
 * <p><strong>Performance:</strong> Pipelines stream items with bounded queues and backpressure controls.</p>
 * <p><strong>Metrics:</strong> Emits the {@code batch.*} and {@code pipeline.*} namespaces.</p>
 */
package ca.gc.cra.ferry.application;
