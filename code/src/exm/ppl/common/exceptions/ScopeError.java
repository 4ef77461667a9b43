package exm.ppl.common.exceptions;

import java.util.Collection;

import org.apache.commons.lang3.StringUtils;

import exm.ppl.ast.SourcePos;

/**
 * One or more references could not be resolved.  All unresolved names
 * are reported together.
 */
public class ScopeError
extends UserException
{
  public ScopeError(SourcePos pos, String msg)
  {
    super(pos, msg);
  }

  /**
   * @param pos location of the first unresolved reference
   * @param descriptions one entry per unresolved reference
   */
  public static ScopeError fromNames(SourcePos pos,
                                     Collection<String> descriptions) {
    if (descriptions.size() == 1) {
      return new ScopeError(pos, "Variable with the following name was " +
          "undefined in this context: " + descriptions.iterator().next());
    }
    return new ScopeError(pos, "Variables with the following names were " +
        "undefined in this context: " + StringUtils.join(descriptions, ", "));
  }

  private static final long serialVersionUID = 1L;
}
