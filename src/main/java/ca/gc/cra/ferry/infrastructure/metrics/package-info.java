/**
 * Metrics adapters bridging {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe from every worker.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code batch.*} and {@code pipeline.*} namespaces.</p>
 */
package ca.gc.cra.ferry.infrastructure.metrics;
