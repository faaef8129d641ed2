package ca.gc.cra.ferry.domain.outcome;

/**
 * Kind of change the remote API applied to an item that was accepted.
 *
 * @since 0.1.0
 */
public enum Operation {
  CREATE,
  UPDATE,
  DELETE
}
