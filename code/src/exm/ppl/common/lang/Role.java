package exm.ppl.common.lang;

/**
 * Probabilistic role of a variable.
 */
public enum Role {
  /** Random variable without a supplied value */
  LATENT,
  /** Random variable constrained to data */
  OBSERVED,
  /** Computed from other values */
  DETERMINISTIC;
}
