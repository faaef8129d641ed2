/**
 * Streaming JSON helpers shared by batch processors and HTTP transports.
 */
package ca.gc.cra.ferry.application.json;
