/**
 * Core domain model for ferry batch uploads: work batches and per-item outcomes.
 * <p><strong>Role:</strong> Domain layer describing what was sent and what happened to each item, without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Outcome counts feed {@code batch.items.*} metrics.</p>
 */
package ca.gc.cra.ferry.domain;
