package exm.ppl.ast;

/**
 * Line and column of a construct in the model source.  Lines count
 * from 1, columns from 0.  Line 0 means the position is unknown.
 */
public class SourcePos {
  public static final SourcePos NONE = new SourcePos(0, 0);

  public final int line;
  public final int column;

  public SourcePos(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public boolean isKnown() {
    return line > 0;
  }

  /**
   * @return this position if known, otherwise the fallback
   */
  public SourcePos orElse(SourcePos fallback) {
    return isKnown() ? this : fallback;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourcePos)) {
      return false;
    }
    SourcePos other = (SourcePos) obj;
    return line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
