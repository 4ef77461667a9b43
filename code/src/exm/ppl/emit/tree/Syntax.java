package exm.ppl.emit.tree;

/**
 * Block syntax of a target language
 */
public enum Syntax
{
  /** Blocks closed by "end" */
  JULIA,
  /** Blocks opened by ":" and delimited by indentation */
  PYTHON;

  /**
   * @return text after a block header
   */
  public String blockOpen()
  {
    return this == PYTHON ? ":" : "";
  }

  /**
   * @return line closing a block, or null if blocks have no terminator
   */
  public String blockClose()
  {
    return this == JULIA ? "end" : null;
  }

  /**
   * @return statement for a block with no statements, or null if an
   *         empty block is valid
   */
  public String emptyBlock()
  {
    return this == PYTHON ? "pass" : null;
  }

  public String commentPrefix()
  {
    return "# ";
  }
}
