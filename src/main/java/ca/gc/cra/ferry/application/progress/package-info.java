/**
 * Per-item step tracking for multi-step commands such as migrations.
 * <p><strong>Concurrency:</strong> {@code ProgressTracker} is shared by stage and worker threads.</p>
 */
package ca.gc.cra.ferry.application.progress;
