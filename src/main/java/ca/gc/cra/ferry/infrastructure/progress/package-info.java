/**
 * Progress reporting adapters.
 */
package ca.gc.cra.ferry.infrastructure.progress;
