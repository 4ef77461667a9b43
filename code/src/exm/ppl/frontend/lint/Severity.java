package exm.ppl.frontend.lint;

public enum Severity {
  ERROR,
  WARNING;
}
