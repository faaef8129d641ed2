/**
 * Logging helpers that bound payload text in logs and outcome messages.
 * <p><strong>Security:</strong> Never log bearer tokens; use {@code Logs.redact}.</p>
 */
package ca.gc.cra.ferry.logging;
