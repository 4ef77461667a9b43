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
package exm.ppl.ir;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import exm.ppl.common.lang.Builtins.Builtin;
import exm.ppl.common.lang.DistributionDescriptor;
import exm.ppl.common.lang.Operators.BinaryOperator;
import exm.ppl.common.lang.Operators.UnaryOperator;
import exm.ppl.common.lang.ValueType;

/**
 * Lowered expression.  Unlike source expressions, IR expressions are
 * compared structurally, so equal sub-expressions can be found and
 * shared.
 */
public abstract class IRExpr {

  public static enum Kind {
    LITERAL,
    VAR,
    INDEX,
    BINARY,
    UNARY,
    CALL,
    DISTRIBUTION,
    RANGE,
  }

  public abstract Kind kind();

  /**
   * @return direct sub-expressions, including slice bounds
   */
  public abstract List<IRExpr> children();

  /**
   * @return true if the value depends on a latent random choice
   */
  public boolean isRandom() {
    for (IRExpr child: children()) {
      if (child.isRandom()) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return true if this reads the named variable anywhere
   */
  public boolean references(String name) {
    for (IRExpr child: children()) {
      if (child.references(name)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return true for expressions worth a temporary: not a leaf or range
   */
  public boolean isCompound() {
    switch (kind()) {
      case LITERAL:
      case VAR:
      case RANGE:
        return false;
      default:
        return true;
    }
  }

  public static class Literal extends IRExpr {
    private final ValueType type;
    private final String text;

    public Literal(ValueType type, String text) {
      this.type = type;
      this.text = text;
    }

    public static Literal intLit(long value) {
      return new Literal(ValueType.INT, Long.toString(value));
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    public ValueType type() {
      return type;
    }

    /**
     * @return source spelling
     */
    public String text() {
      return text;
    }

    /**
     * @return integer value, or null if not an integer literal
     */
    public Long intValue() {
      if (type != ValueType.INT) {
        return null;
      }
      return Long.valueOf(text);
    }

    @Override
    public List<IRExpr> children() {
      return ImmutableList.of();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Literal)) {
        return false;
      }
      Literal other = (Literal)o;
      return type == other.type && text.equals(other.text);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(type, text);
    }

    @Override
    public String toString() {
      return text;
    }
  }

  public static class Var extends IRExpr {
    private final String name;
    private final boolean random;

    /**
     * @param random true if the variable holds a latent random choice
     */
    public Var(String name, boolean random) {
      this.name = name;
      this.random = random;
    }

    @Override
    public Kind kind() {
      return Kind.VAR;
    }

    public String name() {
      return name;
    }

    @Override
    public boolean isRandom() {
      return random;
    }

    @Override
    public boolean references(String name) {
      return this.name.equals(name);
    }

    @Override
    public List<IRExpr> children() {
      return ImmutableList.of();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Var)) {
        return false;
      }
      Var other = (Var)o;
      return name.equals(other.name) && random == other.random;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class Index extends IRExpr {
    private final IRExpr base;
    private final ImmutableList<IndexComponent> components;

    public Index(IRExpr base, List<IndexComponent> components) {
      this.base = base;
      this.components = ImmutableList.copyOf(components);
    }

    @Override
    public Kind kind() {
      return Kind.INDEX;
    }

    public IRExpr base() {
      return base;
    }

    public ImmutableList<IndexComponent> components() {
      return components;
    }

    @Override
    public List<IRExpr> children() {
      List<IRExpr> result = new ArrayList<IRExpr>();
      result.add(base);
      for (IndexComponent c: components) {
        result.add(c.expr());
      }
      return result;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Index)) {
        return false;
      }
      Index other = (Index)o;
      return base.equals(other.base) && components.equals(other.components);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(base, components);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder(base.toString()).append("[");
      for (int i = 0; i < components.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(components.get(i));
      }
      return sb.append("]").toString();
    }
  }

  public static class Binary extends IRExpr {
    private final BinaryOperator op;
    private final IRExpr left;
    private final IRExpr right;

    public Binary(BinaryOperator op, IRExpr left, IRExpr right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    public BinaryOperator op() {
      return op;
    }

    public IRExpr left() {
      return left;
    }

    public IRExpr right() {
      return right;
    }

    @Override
    public List<IRExpr> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Binary)) {
        return false;
      }
      Binary other = (Binary)o;
      return op == other.op && left.equals(other.left) &&
             right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(op, left, right);
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol() + " " + right + ")";
    }
  }

  public static class Unary extends IRExpr {
    private final UnaryOperator op;
    private final IRExpr operand;

    public Unary(UnaryOperator op, IRExpr operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY;
    }

    public UnaryOperator op() {
      return op;
    }

    public IRExpr operand() {
      return operand;
    }

    @Override
    public List<IRExpr> children() {
      return ImmutableList.of(operand);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Unary)) {
        return false;
      }
      Unary other = (Unary)o;
      return op == other.op && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(op, operand);
    }

    @Override
    public String toString() {
      return op.symbol() + operand;
    }
  }

  /**
   * Call to a builtin function
   */
  public static class Call extends IRExpr {
    private final Builtin function;
    private final ImmutableList<IRExpr> args;
    private final boolean integerElements;

    public Call(Builtin function, List<IRExpr> args) {
      this(function, args, false);
    }

    /**
     * @param integerElements for allocations: the container holds draws
     *          from discrete distributions
     */
    public Call(Builtin function, List<IRExpr> args,
                boolean integerElements) {
      this.function = function;
      this.args = ImmutableList.copyOf(args);
      this.integerElements = integerElements;
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    public Builtin function() {
      return function;
    }

    public ImmutableList<IRExpr> args() {
      return args;
    }

    public boolean integerElements() {
      return integerElements;
    }

    @Override
    public List<IRExpr> children() {
      return args;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Call)) {
        return false;
      }
      Call other = (Call)o;
      return function == other.function && args.equals(other.args) &&
             integerElements == other.integerElements;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(function, args);
    }

    @Override
    public String toString() {
      return function.sourceName() + args;
    }
  }

  /**
   * Canonical distribution from the catalog with lowered arguments.
   * The first argument of a wrapper is itself a Distribution.
   */
  public static class Distribution extends IRExpr {
    private final DistributionDescriptor descriptor;
    private final ImmutableList<IRExpr> args;

    public Distribution(DistributionDescriptor descriptor,
                        List<IRExpr> args) {
      assert(args.size() == descriptor.arity());
      this.descriptor = descriptor;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public Kind kind() {
      return Kind.DISTRIBUTION;
    }

    public DistributionDescriptor descriptor() {
      return descriptor;
    }

    public String name() {
      return descriptor.name();
    }

    public ImmutableList<IRExpr> args() {
      return args;
    }

    /**
     * @return true if draws are discrete, looking through wrappers
     */
    public boolean isDiscrete() {
      if (descriptor.isWrapper()) {
        return ((Distribution)args.get(0)).isDiscrete();
      }
      return descriptor.isDiscrete();
    }

    @Override
    public List<IRExpr> children() {
      return args;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Distribution)) {
        return false;
      }
      Distribution other = (Distribution)o;
      return descriptor.name().equals(other.descriptor.name()) &&
             args.equals(other.args);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(descriptor.name(), args);
    }

    @Override
    public String toString() {
      return descriptor.name() + args;
    }
  }

  /**
   * start:step:stop with exclusive stop.  Loop ranges always have all
   * three; slices may omit any.
   */
  public static class Range extends IRExpr {
    private final IRExpr start;
    private final IRExpr step;
    private final IRExpr stop;

    public Range(IRExpr start, IRExpr step, IRExpr stop) {
      this.start = start;
      this.step = step;
      this.stop = stop;
    }

    @Override
    public Kind kind() {
      return Kind.RANGE;
    }

    public IRExpr start() {
      return start;
    }

    public IRExpr step() {
      return step;
    }

    public IRExpr stop() {
      return stop;
    }

    public boolean isFullSlice() {
      return start == null && step == null && stop == null;
    }

    /**
     * @return constant step, or null if not an integer literal
     */
    public Long constantStep() {
      if (step == null) {
        return Long.valueOf(1);
      } else if (step.kind() == Kind.LITERAL) {
        return ((Literal)step).intValue();
      } else if (step.kind() == Kind.UNARY &&
                 ((Unary)step).op() == UnaryOperator.NEGATE &&
                 ((Unary)step).operand().kind() == Kind.LITERAL) {
        Long v = ((Literal)((Unary)step).operand()).intValue();
        return v == null ? null : -v;
      }
      return null;
    }

    @Override
    public List<IRExpr> children() {
      ImmutableList.Builder<IRExpr> b = ImmutableList.builder();
      if (start != null) b.add(start);
      if (step != null) b.add(step);
      if (stop != null) b.add(stop);
      return b.build();
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Range)) {
        return false;
      }
      Range other = (Range)o;
      return Objects.equal(start, other.start) &&
             Objects.equal(step, other.step) &&
             Objects.equal(stop, other.stop);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(start, step, stop);
    }

    @Override
    public String toString() {
      return (start == null ? "" : start.toString()) + ":" +
             (step == null ? "" : step + ":") +
             (stop == null ? "" : stop.toString());
    }
  }
}
