/**
 * Thread pool construction and shutdown helpers.
 */
package ca.gc.cra.ferry.infrastructure.exec;
