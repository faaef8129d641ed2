/**
 * Ports decoupling batch processors and pipelines from transports, clocks, credentials and metrics.
 * <p><strong>Role:</strong> Application boundary; adapters live under {@code ca.gc.cra.ferry.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Unless stated otherwise, port implementations must be thread-safe.</p>
 */
package ca.gc.cra.ferry.application.port;
