package exm.ppl.frontend.lint;

/**
 * One independent check.  Checks report through the context and never
 * stop the run: every check sees the whole program.
 */
public interface LintCheck {

  /**
   * @return short name for logging
   */
  public String name();

  public void check(LintContext ctx);
}
