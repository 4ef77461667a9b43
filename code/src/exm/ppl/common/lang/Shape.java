package exm.ppl.common.lang;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ppl.ast.Expression;

/**
 * Static shape of a value: scalar, vector or matrix.  Container shapes
 * carry the source expressions for their dimensions where known.
 */
public class Shape {

  public static enum Kind {
    SCALAR(0),
    VECTOR(1),
    MATRIX(2),
    /** Model inputs: shape is only known at run time */
    UNKNOWN(-1);

    private final int rank;

    private Kind(int rank) {
      this.rank = rank;
    }

    public int rank() {
      return rank;
    }

    public static Kind ofRank(int rank) {
      switch (rank) {
        case 0:
          return SCALAR;
        case 1:
          return VECTOR;
        case 2:
          return MATRIX;
        default:
          return UNKNOWN;
      }
    }
  }

  public static final Shape SCALAR = new Shape(Kind.SCALAR,
                                      ImmutableList.<Expression>of());
  public static final Shape UNKNOWN = new Shape(Kind.UNKNOWN,
                                      ImmutableList.<Expression>of());

  private final Kind kind;
  /** One entry per dimension, null entries for unknown lengths */
  private final List<Expression> dims;

  private Shape(Kind kind, List<Expression> dims) {
    this.kind = kind;
    this.dims = dims;
  }

  public static Shape vector(Expression length) {
    return new Shape(Kind.VECTOR, Collections.singletonList(length));
  }

  public static Shape matrix(Expression rows, Expression cols) {
    return new Shape(Kind.MATRIX, Arrays.asList(rows, cols));
  }

  /**
   * Shape of the given rank with unknown lengths
   */
  public static Shape ofKind(Kind kind) {
    switch (kind) {
      case SCALAR:
        return SCALAR;
      case VECTOR:
        return vector(null);
      case MATRIX:
        return matrix(null, null);
      default:
        return UNKNOWN;
    }
  }

  public Kind kind() {
    return kind;
  }

  public int rank() {
    return kind.rank();
  }

  public boolean isKnown() {
    return kind != Kind.UNKNOWN;
  }

  /**
   * @param dim dimension number, from 0
   * @return expression for the length, or null if not known
   */
  public Expression dim(int dim) {
    if (dim < 0 || dim >= dims.size()) {
      return null;
    }
    return dims.get(dim);
  }

  /**
   * Shapes are compatible if they have the same rank, or one is unknown.
   * Lengths are not compared.
   */
  public boolean compatibleWith(Shape other) {
    return !isKnown() || !other.isKnown() || kind == other.kind;
  }

  @Override
  public String toString() {
    switch (kind) {
      case SCALAR:
        return "scalar";
      case VECTOR:
        return "vector" + dimString();
      case MATRIX:
        return "matrix" + dimString();
      default:
        return "unknown";
    }
  }

  private String dimString() {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < dims.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      Expression d = dims.get(i);
      sb.append(d == null ? "?" : d.toString());
    }
    return sb.append(")").toString();
  }
}
