/**
 * Validation utilities for settings and configuration values.
 * <p><strong>Concurrency:</strong> Stateless helpers; safe from any thread.</p>
 */
package ca.gc.cra.ferry.validation;
