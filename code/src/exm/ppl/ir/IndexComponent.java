package exm.ppl.ir;

import com.google.common.base.Objects;

/**
 * One subscript of an indexed access.  Source indices are zero-based:
 * a non-slice component is tagged as needing the +1 offset, which
 * one-based backends apply.  A component holding a real value of
 * discrete origin is tagged for truncation to an integer.
 */
public class IndexComponent {
  private final IRExpr expr;
  private final boolean needsOffset;
  private final boolean requiresTruncation;

  public IndexComponent(IRExpr expr, boolean needsOffset,
                        boolean requiresTruncation) {
    this.expr = expr;
    this.needsOffset = needsOffset;
    this.requiresTruncation = requiresTruncation;
  }

  public static IndexComponent slice(IRExpr.Range range) {
    return new IndexComponent(range, false, false);
  }

  public static IndexComponent of(IRExpr expr) {
    return new IndexComponent(expr, true, false);
  }

  public IRExpr expr() {
    return expr;
  }

  public boolean isSlice() {
    return expr.kind() == IRExpr.Kind.RANGE;
  }

  public boolean needsOffset() {
    return needsOffset;
  }

  public boolean requiresTruncation() {
    return requiresTruncation;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof IndexComponent)) {
      return false;
    }
    IndexComponent other = (IndexComponent)o;
    return expr.equals(other.expr) && needsOffset == other.needsOffset &&
           requiresTruncation == other.requiresTruncation;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(expr, needsOffset, requiresTruncation);
  }

  @Override
  public String toString() {
    return requiresTruncation ? "trunc(" + expr + ")" : expr.toString();
  }
}
