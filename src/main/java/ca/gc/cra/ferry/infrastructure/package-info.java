/**
 * Infrastructure adapters binding ferry ports to external systems (HTTP APIs, OpenTelemetry, thread pools).
 * <p><strong>Role:</strong> Adapter layer implementing transport, metrics and progress contracts.</p>
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees; transports are shared by every batch
 * worker.</p>
 * <p><strong>Security:</strong> Bearer tokens come from an injected credential provider and are never logged.</p>
 */
package ca.gc.cra.ferry.infrastructure;
