/**
 * Units of work moved through batch processor queues.
 */
package ca.gc.cra.ferry.domain.batch;
