/**
 * HTTP adapters for the batch transport port: JDK client, JSON request bodies and bearer-token caching.
 * <p><strong>Concurrency:</strong> Transports and token caches are shared by every batch worker.</p>
 * <p><strong>Security:</strong> Tokens are never logged.</p>
 */
package ca.gc.cra.ferry.infrastructure.http;
