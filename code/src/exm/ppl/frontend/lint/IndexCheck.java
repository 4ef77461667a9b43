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
package exm.ppl.frontend.lint;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.BinaryOp;
import exm.ppl.ast.Expression.Index;
import exm.ppl.ast.Expression.Range;
import exm.ppl.ast.Expression.VariableRef;
import exm.ppl.ast.Statement;
import exm.ppl.common.lang.Operators.BinaryOperator;
import exm.ppl.common.lang.Shape;
import exm.ppl.common.lang.Symbol;
import exm.ppl.common.lang.Symbol.SymbolKind;
import exm.ppl.common.lang.ValueType;
import exm.ppl.frontend.ExprTypes;
import exm.ppl.frontend.SymbolTable;
import exm.ppl.frontend.lint.StatementWalker.WalkContext;

/**
 * Static bounds checks on indexing.  Indices are zero-based in source.
 *
 * Constant indices are checked against constant lengths.  An index
 * i + c, with i a loop index over a constant range, is checked at both
 * ends of the range.  Real-valued indices not drawn from a discrete
 * distribution are flagged, since they may not be integral.
 */
public class IndexCheck implements LintCheck {

  @Override
  public String name() {
    return "index-bounds";
  }

  @Override
  public void check(final LintContext ctx) {
    StatementWalker.walk(ctx.program().body(), new StatementWalker.Visitor() {
      @Override
      public void visit(Statement stmt, WalkContext wc) {
        for (Expression root: stmt.expressions()) {
          for (Expression expr: StatementWalker.subExpressions(root)) {
            if (expr.kind() == Expression.Kind.INDEX) {
              checkIndex(ctx, stmt, (Index)expr);
            }
          }
        }
      }
    });
  }

  private static void checkIndex(LintContext ctx, Statement stmt,
                                 Index index) {
    if (index.base().kind() != Expression.Kind.VARIABLE_REF) {
      return;
    }
    SymbolTable table = ctx.table();
    Symbol sym = table.lookup((VariableRef)index.base());
    if (sym == null) {
      return;
    }
    Shape shape = sym.shape();
    if (shape.isKnown() && index.indices().size() > shape.rank()) {
      ctx.error(DiagnosticCode.INDEX_OUT_OF_RANGE,
                LintContext.position(index, stmt), "Too many indices (" +
                index.indices().size() + ") for " + sym.name() +
                ", a " + shape);
      return;
    }

    for (int dim = 0; dim < index.indices().size(); dim++) {
      Expression component = index.indices().get(dim);
      if (component.kind() == Expression.Kind.RANGE) {
        continue;
      }
      Long length = null;
      Expression lengthExpr = shape.dim(dim);
      if (lengthExpr != null) {
        length = ExprTypes.constantValue(lengthExpr, table);
      }
      checkComponent(ctx, stmt, sym, component, length);
    }
  }

  private static void checkComponent(LintContext ctx, Statement stmt,
          Symbol sym, Expression component, Long length) {
    Long value = ExprTypes.constantValue(component, ctx.table());
    if (value != null) {
      if (value < 0) {
        ctx.error(DiagnosticCode.INDEX_OUT_OF_RANGE,
                  LintContext.position(component, stmt),
                  "Negative index " + value + " into " + sym.name());
      } else if (length != null && value >= length) {
        ctx.error(DiagnosticCode.INDEX_OUT_OF_RANGE,
                  LintContext.position(component, stmt), "Index " + value +
                  " is out of range for " + sym.name() + " of length " +
                  length);
      }
      return;
    }

    if (checkLoopIndex(ctx, stmt, sym, component, length)) {
      return;
    }

    if (ExprTypes.typeOf(component, ctx.table()) == ValueType.REAL &&
        !ExprTypes.isDiscreteOrigin(component, ctx.table())) {
      ctx.warning(DiagnosticCode.FLOAT_INDEX,
                  LintContext.position(component, stmt), "Index " +
                  component + " into " + sym.name() + " may not be integral");
    }
  }

  /**
   * Check i + c over the range of loop index i.
   * @return true if the component had that form
   */
  private static boolean checkLoopIndex(LintContext ctx, Statement stmt,
          Symbol sym, Expression component, Long length) {
    SymbolTable table = ctx.table();
    Expression ref = component;
    long offset = 0;
    if (component.kind() == Expression.Kind.BINARY_OP) {
      BinaryOp op = (BinaryOp)component;
      Long c = ExprTypes.constantValue(op.right(), table);
      if (c == null || (op.op() != BinaryOperator.PLUS &&
                        op.op() != BinaryOperator.MINUS)) {
        return false;
      }
      ref = op.left();
      offset = op.op() == BinaryOperator.PLUS ? c : -c;
    }
    if (ref.kind() != Expression.Kind.VARIABLE_REF) {
      return false;
    }
    Symbol loopIndex = table.lookup((VariableRef)ref);
    if (loopIndex == null || loopIndex.kind() != SymbolKind.LOOP_INDEX) {
      return false;
    }

    Range range = loopIndex.loopRange();
    Long start = range.start() == null ? Long.valueOf(0) :
                          ExprTypes.constantValue(range.start(), table);
    Long step = range.step() == null ? Long.valueOf(1) :
                          ExprTypes.constantValue(range.step(), table);
    Long stop = range.stop() == null ? null :
                          ExprTypes.constantValue(range.stop(), table);
    if (step == null || step <= 0) {
      return true;
    }
    if (start != null && stop != null && start >= stop) {
      // Loop body never runs
      return true;
    }
    if (start != null && start + offset < 0) {
      ctx.error(DiagnosticCode.INDEX_OUT_OF_RANGE,
                LintContext.position(component, stmt), "Index " +
                component + " into " + sym.name() + " is " +
                (start + offset) + " when " + loopIndex.name() + " = " +
                start);
    } else if (stop != null && length != null) {
      long last = start == null ? stop - 1 :
                  start + ((stop - 1 - start) / step) * step;
      if (last + offset >= length) {
        ctx.error(DiagnosticCode.INDEX_OUT_OF_RANGE,
                  LintContext.position(component, stmt), "Index " +
                  component + " into " + sym.name() + " reaches " +
                  (last + offset) + " when " + loopIndex.name() + " = " +
                  last + ", beyond length " + length);
      }
    }
    return true;
  }
}
