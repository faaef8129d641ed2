/**
 * Batched HTTP upload with adaptive splitting, rate-limit deferral and transient-failure retries.
 * <p><strong>Role:</strong> Application services driving the {@code BatchTransport} port.</p>
 * <p><strong>Concurrency:</strong> One producer, {@code maxWorkers} workers and the calling thread per run; the
 * rate-limit deadline is the only state shared across workers.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code batch.*} namespace.</p>
 */
package ca.gc.cra.ferry.application.batch;
