/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ppl.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ppl.common.lang.Operators.BinaryOperator;
import exm.ppl.common.lang.Operators.UnaryOperator;

/**
 * Expression node of the source language.  The set of subclasses is
 * closed: consumers switch over {@link Kind}.
 *
 * Nodes compare by identity so that analyses can key maps on them.
 */
public abstract class Expression {

  public static enum Kind {
    LITERAL,
    VARIABLE_REF,
    INDEX,
    BINARY_OP,
    UNARY_OP,
    CALL,
    RANGE,
  }

  private final SourcePos pos;

  protected Expression(SourcePos pos) {
    this.pos = pos;
  }

  public abstract Kind kind();

  public SourcePos pos() {
    return pos;
  }

  /**
   * @return direct sub-expressions, in evaluation order.  Absent range
   *         bounds are skipped.
   */
  public abstract List<Expression> children();

  public abstract void appendTo(StringBuilder sb);

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  public static enum LiteralKind {
    INT,
    FLOAT,
    BOOL,
  }

  public static class Literal extends Expression {
    private final LiteralKind literalKind;
    private final String text;

    public Literal(SourcePos pos, LiteralKind literalKind, String text) {
      super(pos);
      this.literalKind = literalKind;
      this.text = text;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    public LiteralKind literalKind() {
      return literalKind;
    }

    /**
     * @return source spelling: decimal digits, a float, or true/false
     */
    public String text() {
      return text;
    }

    @Override
    public List<Expression> children() {
      return ImmutableList.of();
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append(text);
    }
  }

  public static class VariableRef extends Expression {
    private final String name;

    public VariableRef(SourcePos pos, String name) {
      super(pos);
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.VARIABLE_REF;
    }

    public String name() {
      return name;
    }

    @Override
    public List<Expression> children() {
      return ImmutableList.of();
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append(name);
    }
  }

  /**
   * base[i, j, ...], zero-based.  An index component may be a
   * {@link Range} slice.
   */
  public static class Index extends Expression {
    private final Expression base;
    private final ImmutableList<Expression> indices;

    public Index(SourcePos pos, Expression base, List<Expression> indices) {
      super(pos);
      assert(!indices.isEmpty());
      this.base = base;
      this.indices = ImmutableList.copyOf(indices);
    }

    @Override
    public Kind kind() {
      return Kind.INDEX;
    }

    public Expression base() {
      return base;
    }

    public ImmutableList<Expression> indices() {
      return indices;
    }

    @Override
    public List<Expression> children() {
      return ImmutableList.<Expression>builder()
                  .add(base).addAll(indices).build();
    }

    @Override
    public void appendTo(StringBuilder sb) {
      base.appendTo(sb);
      sb.append("[");
      boolean first = true;
      for (Expression index: indices) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        index.appendTo(sb);
      }
      sb.append("]");
    }
  }

  public static class BinaryOp extends Expression {
    private final BinaryOperator op;
    private final Expression left;
    private final Expression right;

    public BinaryOp(SourcePos pos, BinaryOperator op, Expression left,
                    Expression right) {
      super(pos);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY_OP;
    }

    public BinaryOperator op() {
      return op;
    }

    public Expression left() {
      return left;
    }

    public Expression right() {
      return right;
    }

    @Override
    public List<Expression> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append("(");
      left.appendTo(sb);
      sb.append(" ").append(op.symbol()).append(" ");
      right.appendTo(sb);
      sb.append(")");
    }
  }

  public static class UnaryOp extends Expression {
    private final UnaryOperator op;
    private final Expression operand;

    public UnaryOp(SourcePos pos, UnaryOperator op, Expression operand) {
      super(pos);
      this.op = op;
      this.operand = operand;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY_OP;
    }

    public UnaryOperator op() {
      return op;
    }

    public Expression operand() {
      return operand;
    }

    @Override
    public List<Expression> children() {
      return ImmutableList.of(operand);
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append(op.symbol());
      if (op == UnaryOperator.NOT) {
        sb.append(" ");
      }
      operand.appendTo(sb);
    }
  }

  /**
   * Call of a distribution or builtin function by name
   */
  public static class Call extends Expression {
    private final String function;
    private final ImmutableList<Expression> args;

    public Call(SourcePos pos, String function, List<Expression> args) {
      super(pos);
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    public String function() {
      return function;
    }

    public ImmutableList<Expression> args() {
      return args;
    }

    @Override
    public List<Expression> children() {
      return args;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append(function).append("(");
      boolean first = true;
      for (Expression arg: args) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        arg.appendTo(sb);
      }
      sb.append(")");
    }
  }

  /**
   * start:step:stop, stop exclusive.  Any bound may be null when the
   * range is a slice; loop ranges need at least a stop.
   */
  public static class Range extends Expression {
    private final Expression start;
    private final Expression step;
    private final Expression stop;

    public Range(SourcePos pos, Expression start, Expression step,
                 Expression stop) {
      super(pos);
      this.start = start;
      this.step = step;
      this.stop = stop;
    }

    @Override
    public Kind kind() {
      return Kind.RANGE;
    }

    public Expression start() {
      return start;
    }

    public Expression step() {
      return step;
    }

    public Expression stop() {
      return stop;
    }

    public boolean isFullSlice() {
      return start == null && step == null && stop == null;
    }

    @Override
    public List<Expression> children() {
      ImmutableList.Builder<Expression> b = ImmutableList.builder();
      if (start != null) b.add(start);
      if (step != null) b.add(step);
      if (stop != null) b.add(stop);
      return b.build();
    }

    @Override
    public void appendTo(StringBuilder sb) {
      if (start != null) start.appendTo(sb);
      sb.append(":");
      if (step != null) {
        step.appendTo(sb);
        sb.append(":");
      }
      if (stop != null) stop.appendTo(sb);
    }
  }
}
