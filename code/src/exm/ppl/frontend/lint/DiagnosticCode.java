package exm.ppl.frontend.lint;

/**
 * Stable identifiers for lint findings
 */
public enum DiagnosticCode {
  UNDEFINED_REFERENCE("undefined-reference"),
  REDECLARATION("redeclaration"),
  DISTRIBUTION_SIGNATURE("distribution-signature"),
  INDEX_OUT_OF_RANGE("index-out-of-range"),
  FLOAT_INDEX("float-index"),
  OBSERVED_ASSIGNMENT("observed-assignment"),
  PORTABILITY("portability"),
  UNKNOWN_FUNCTION("unknown-function"),
  BUILTIN_SIGNATURE("builtin-signature"),
  MISPLACED_DISTRIBUTION("misplaced-distribution"),
  INVALID_TARGET("invalid-target"),
  MISPLACED_RANGE("misplaced-range"),
  LOOP_RANGE("loop-range"),
  ZERO_STEP("zero-step"),
  LOOP_CONTROL("loop-control"),
  DUPLICATE_ADDRESS("duplicate-address");

  private final String id;

  private DiagnosticCode(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  @Override
  public String toString() {
    return id;
  }
}
