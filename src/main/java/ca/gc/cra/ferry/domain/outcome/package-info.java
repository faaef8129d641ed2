/**
 * Per-item outcome ledger types shared by batch processors and upload commands.
 * <p><strong>Role:</strong> Domain layer; no dependencies on ports or adapters.</p>
 * <p><strong>Concurrency:</strong> All exported values are immutable except {@code ProcessorResult.Builder}.</p>
 */
package ca.gc.cra.ferry.domain.outcome;
