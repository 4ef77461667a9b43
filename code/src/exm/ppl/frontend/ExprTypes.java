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
package exm.ppl.frontend;

import java.util.ArrayList;
import java.util.List;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.BinaryOp;
import exm.ppl.ast.Expression.Call;
import exm.ppl.ast.Expression.Index;
import exm.ppl.ast.Expression.Literal;
import exm.ppl.ast.Expression.UnaryOp;
import exm.ppl.ast.Expression.VariableRef;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.Builtins;
import exm.ppl.common.lang.Builtins.Builtin;
import exm.ppl.common.lang.DistributionDescriptor;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Operators.BinaryOperator;
import exm.ppl.common.lang.Operators.OpCategory;
import exm.ppl.common.lang.Operators.UnaryOperator;
import exm.ppl.common.lang.Shape;
import exm.ppl.common.lang.Symbol;
import exm.ppl.common.lang.ValueType;

/**
 * Static typing of source expressions against a symbol table.
 * Unresolved references have unknown type and shape, so that they do
 * not cause further diagnostics.
 */
public class ExprTypes {

  public static ValueType typeOf(Expression expr, SymbolTable table) {
    switch (expr.kind()) {
      case LITERAL:
        switch (((Literal)expr).literalKind()) {
          case INT:
            return ValueType.INT;
          case FLOAT:
            return ValueType.REAL;
          case BOOL:
            return ValueType.BOOL;
          default:
            throw new PPLRuntimeError("Unknown literal kind: " + expr);
        }
      case VARIABLE_REF:
      case INDEX: {
        Symbol sym = table.baseSymbol(expr);
        return sym == null ? ValueType.UNKNOWN : sym.valueType();
      }
      case BINARY_OP: {
        BinaryOp op = (BinaryOp)expr;
        if (op.op().category() != OpCategory.ARITHMETIC) {
          return ValueType.BOOL;
        }
        ValueType l = typeOf(op.left(), table);
        ValueType r = typeOf(op.right(), table);
        if (op.op() == BinaryOperator.DIVIDE) {
          return ValueType.REAL;
        }
        return ValueType.join(l, r);
      }
      case UNARY_OP: {
        UnaryOp op = (UnaryOp)expr;
        if (op.op() == UnaryOperator.NOT) {
          return ValueType.BOOL;
        }
        ValueType t = typeOf(op.operand(), table);
        return t == ValueType.BOOL ? ValueType.INT : t;
      }
      case CALL: {
        Call call = (Call)expr;
        Builtin b = Builtins.lookup(call.function());
        if (b != null) {
          if (b.resultType() != null) {
            return b.resultType();
          }
          ValueType result = ValueType.INT;
          for (Expression arg: call.args()) {
            result = ValueType.join(result, typeOf(arg, table));
          }
          return result;
        }
        DistributionDescriptor d = Distributions.lookup(call.function());
        if (d != null) {
          return d.isDiscrete() ? ValueType.INT : ValueType.REAL;
        }
        return ValueType.UNKNOWN;
      }
      case RANGE:
        return ValueType.INT;
      default:
        throw new PPLRuntimeError("Unexpected expression kind: " +
                                  expr.kind());
    }
  }

  /**
   * @return true if the expression's value is a draw from a discrete
   *    distribution, possibly offset by integer arithmetic.  Such values
   *    may be held as reals even though they are integral.
   */
  public static boolean isDiscreteOrigin(Expression expr,
                                         SymbolTable table) {
    switch (expr.kind()) {
      case VARIABLE_REF:
      case INDEX: {
        Symbol sym = table.baseSymbol(expr);
        return sym != null && sym.isSampled() && sym.isDiscreteOrigin();
      }
      case BINARY_OP: {
        BinaryOp op = (BinaryOp)expr;
        switch (op.op()) {
          case PLUS:
          case MINUS:
          case MULTIPLY:
          case FLOOR_DIVIDE:
          case MODULO:
            break;
          default:
            return false;
        }
        boolean l = isDiscreteOrigin(op.left(), table);
        boolean r = isDiscreteOrigin(op.right(), table);
        return (l || r) &&
            (l || typeOf(op.left(), table).isIntegral()) &&
            (r || typeOf(op.right(), table).isIntegral());
      }
      case UNARY_OP: {
        UnaryOp op = (UnaryOp)expr;
        return op.op() != UnaryOperator.NOT &&
               isDiscreteOrigin(op.operand(), table);
      }
      default:
        return false;
    }
  }

  /**
   * @return true if a real-typed value of discrete origin, so a
   *   backend with integer-only array indices needs a truncating cast
   */
  public static boolean requiresTruncation(Expression index,
                                           SymbolTable table) {
    return typeOf(index, table) == ValueType.REAL &&
           isDiscreteOrigin(index, table);
  }

  /**
   * Evaluate integer constant expressions.
   * @return value, or null if not a compile-time integer constant
   */
  public static Long constantValue(Expression expr, SymbolTable table) {
    switch (expr.kind()) {
      case LITERAL: {
        Literal lit = (Literal)expr;
        if (lit.literalKind() != Expression.LiteralKind.INT) {
          return null;
        }
        try {
          return Long.parseLong(lit.text());
        } catch (NumberFormatException e) {
          throw new PPLRuntimeError("Bad integer literal " + lit.text());
        }
      }
      case VARIABLE_REF: {
        Symbol sym = table.lookup((VariableRef)expr);
        if (sym == null || sym.kind() != Symbol.SymbolKind.LOCAL) {
          return null;
        }
        return sym.constantValue();
      }
      case UNARY_OP: {
        UnaryOp op = (UnaryOp)expr;
        Long v = constantValue(op.operand(), table);
        if (v == null || op.op() == UnaryOperator.NOT) {
          return null;
        }
        return op.op() == UnaryOperator.NEGATE ? -v : v;
      }
      case BINARY_OP: {
        BinaryOp op = (BinaryOp)expr;
        Long l = constantValue(op.left(), table);
        Long r = constantValue(op.right(), table);
        if (l == null || r == null) {
          return null;
        }
        switch (op.op()) {
          case PLUS:
            return l + r;
          case MINUS:
            return l - r;
          case MULTIPLY:
            return l * r;
          case FLOOR_DIVIDE:
            return r == 0 ? null : Math.floorDiv(l, r);
          case MODULO:
            return r == 0 ? null : Math.floorMod(l, r);
          default:
            return null;
        }
      }
      default:
        return null;
    }
  }

  public static Shape shapeOf(Expression expr, SymbolTable table) {
    switch (expr.kind()) {
      case LITERAL:
        return Shape.SCALAR;
      case VARIABLE_REF: {
        Symbol sym = table.lookup((VariableRef)expr);
        return sym == null ? Shape.UNKNOWN : sym.shape();
      }
      case INDEX: {
        Index index = (Index)expr;
        Shape base = shapeOf(index.base(), table);
        if (!base.isKnown()) {
          return Shape.UNKNOWN;
        }
        int rank = base.rank();
        for (Expression component: index.indices()) {
          if (component.kind() != Expression.Kind.RANGE) {
            rank--;
          }
        }
        if (rank < 0) {
          return Shape.UNKNOWN;
        }
        return Shape.ofKind(Shape.Kind.ofRank(rank));
      }
      case BINARY_OP: {
        BinaryOp op = (BinaryOp)expr;
        Shape l = shapeOf(op.left(), table);
        Shape r = shapeOf(op.right(), table);
        if (!l.isKnown() || !r.isKnown()) {
          return Shape.UNKNOWN;
        }
        return l.rank() >= r.rank() ? l : r;
      }
      case UNARY_OP:
        return shapeOf(((UnaryOp)expr).operand(), table);
      case CALL: {
        Call call = (Call)expr;
        Builtin b = Builtins.lookup(call.function());
        if (b != null) {
          return builtinShape(b, call);
        }
        DistributionDescriptor d = Distributions.lookup(call.function());
        if (d != null) {
          if (d.name().equals(Distributions.IID)) {
            return Shape.vector(call.args().size() > 1 ?
                                call.args().get(1) : null);
          } else if (d.isWrapper() && !call.args().isEmpty()) {
            return shapeOf(call.args().get(0), table);
          }
          return Shape.ofKind(d.resultShape());
        }
        return Shape.UNKNOWN;
      }
      case RANGE:
        return Shape.vector(null);
      default:
        throw new PPLRuntimeError("Unexpected expression kind: " +
                                  expr.kind());
    }
  }

  private static Shape builtinShape(Builtin b, Call call) {
    List<Expression> args = call.args();
    switch (b) {
      case VECTOR:
        return Shape.vector(args.isEmpty() ? null : args.get(0));
      case MATRIX:
        return Shape.matrix(args.size() > 0 ? args.get(0) : null,
                            args.size() > 1 ? args.get(1) : null);
      default:
        return Shape.ofKind(b.resultShape());
    }
  }

  /**
   * @return true if the call allocates a container
   */
  public static boolean isAllocation(Expression expr) {
    if (expr.kind() != Expression.Kind.CALL) {
      return false;
    }
    Builtin b = Builtins.lookup(((Call)expr).function());
    return b != null && b.isAllocation();
  }

  /**
   * @return all variable references in the expression, in evaluation
   *         order
   */
  public static List<VariableRef> collectRefs(Expression expr) {
    List<VariableRef> refs = new ArrayList<VariableRef>();
    collectRefs(expr, refs);
    return refs;
  }

  private static void collectRefs(Expression expr, List<VariableRef> refs) {
    if (expr.kind() == Expression.Kind.VARIABLE_REF) {
      refs.add((VariableRef)expr);
    }
    for (Expression child: expr.children()) {
      collectRefs(child, refs);
    }
  }

  /**
   * @return true if any reference in the expression is to the name
   */
  public static boolean references(Expression expr, String name) {
    for (VariableRef ref: collectRefs(expr)) {
      if (ref.name().equals(name)) {
        return true;
      }
    }
    return false;
  }
}
