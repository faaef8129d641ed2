/**
 * Command-level glue composing staged pipelines with batch uploads.
 */
package ca.gc.cra.ferry.application.transfer;
