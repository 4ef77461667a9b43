package exm.ppl.common.lang;

/**
 * Static element type of an expression, as far as it can be inferred.
 */
public enum ValueType {
  INT,
  REAL,
  BOOL,
  /** Model inputs and anything derived from them */
  UNKNOWN;

  /**
   * Type of an arithmetic combination of the two types
   */
  public static ValueType join(ValueType a, ValueType b) {
    if (a == UNKNOWN || b == UNKNOWN) {
      return UNKNOWN;
    } else if (a == REAL || b == REAL) {
      return REAL;
    } else {
      // int and bool both promote to int
      return INT;
    }
  }

  public boolean isIntegral() {
    return this == INT || this == BOOL;
  }
}
