/**
 * Configuration loading and validation for transfer commands.
 * <p><strong>Role:</strong> Bootstrap layer turning defaults, YAML and overrides into settings records.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Credentials are never read from configuration maps; they come from a
 * {@code CredentialProvider}.</p>
 */
package ca.gc.cra.ferry.config;
