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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.Call;
import exm.ppl.ast.Expression.Index;
import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.Assignment;
import exm.ppl.ast.Statement.For;
import exm.ppl.ast.Statement.Observe;
import exm.ppl.ast.Statement.Sample;
import exm.ppl.common.lang.Builtins;
import exm.ppl.common.lang.Builtins.Builtin;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Shape;
import exm.ppl.common.lang.Symbol;
import exm.ppl.frontend.lint.StatementWalker.WalkContext;

/**
 * Calls outside distribution position must be builtins with a valid
 * number of arguments, ranges may only appear as loop ranges or index
 * slices, and assignment targets must be variables or elements.
 * Containers declared by their first element write inside a loop must
 * have lengths that follow from the loops indexing them.
 */
public class FunctionCallCheck implements LintCheck {

  @Override
  public String name() {
    return "function-calls";
  }

  @Override
  public void check(final LintContext ctx) {
    StatementWalker.walk(ctx.program().body(), new StatementWalker.Visitor() {
      @Override
      public void visit(Statement stmt, WalkContext wc) {
        Set<Expression> exempt = identitySet();
        Set<Expression> ranges = identitySet();
        switch (stmt.kind()) {
          case SAMPLE:
            exempt.addAll(DistributionSignatureCheck.distributionPositions(
                                      ((Sample)stmt).distribution()));
            checkTarget(ctx, stmt, ((Sample)stmt).target());
            break;
          case OBSERVE:
            exempt.addAll(DistributionSignatureCheck.distributionPositions(
                                      ((Observe)stmt).distribution()));
            break;
          case ASSIGNMENT:
            checkTarget(ctx, stmt, ((Assignment)stmt).target());
            break;
          case FOR:
            ranges.add(((For)stmt).range());
            break;
          default:
            break;
        }
        for (Expression root: stmt.expressions()) {
          for (Expression expr: StatementWalker.subExpressions(root)) {
            if (expr.kind() == Expression.Kind.INDEX) {
              ranges.addAll(((Index)expr).indices());
            }
            if (expr.kind() == Expression.Kind.RANGE) {
              if (!ranges.contains(expr)) {
                ctx.error(DiagnosticCode.MISPLACED_RANGE,
                    LintContext.position(expr, stmt), "Range " + expr +
                    " may only be used as a loop range or an index slice");
              }
            } else if (expr.kind() == Expression.Kind.CALL &&
                       !exempt.contains(expr)) {
              checkCall(ctx, stmt, (Call)expr);
            }
          }
        }
      }
    });
  }

  private static Set<Expression> identitySet() {
    return Collections.newSetFromMap(
                          new IdentityHashMap<Expression, Boolean>());
  }

  private static void checkCall(LintContext ctx, Statement stmt,
                                Call call) {
    Expression expr = call;
    Builtin b = Builtins.lookup(call.function());
    if (b != null) {
      int n = call.args().size();
      if (n < b.minArgs() || n > b.maxArgs()) {
        String expected = b.minArgs() == b.maxArgs() ?
              Integer.toString(b.minArgs()) :
              b.minArgs() + " to " + b.maxArgs();
        ctx.error(DiagnosticCode.BUILTIN_SIGNATURE,
                  LintContext.position(expr, stmt), b.sourceName() +
                  " takes " + expected + " argument(s) but was given " + n);
      }
    } else if (Distributions.isDistribution(call.function())) {
      ctx.error(DiagnosticCode.MISPLACED_DISTRIBUTION,
                LintContext.position(expr, stmt), "Distribution " +
                call.function() + " can only be used on the right of ~");
    } else {
      ctx.error(DiagnosticCode.UNKNOWN_FUNCTION,
                LintContext.position(expr, stmt),
                "Unknown function " + call.function());
    }
  }

  private static void checkTarget(LintContext ctx, Statement stmt,
                                  Expression target) {
    Expression root = target;
    while (root.kind() == Expression.Kind.INDEX) {
      root = ((Index)root).base();
    }
    if (root.kind() != Expression.Kind.VARIABLE_REF) {
      ctx.error(DiagnosticCode.INVALID_TARGET, stmt.pos(),
                "Cannot assign to " + target);
      return;
    }
    Symbol sym = ctx.table().target(stmt);
    if (sym != null && sym.implicitLoop() != null &&
        sym.declaration() == stmt) {
      checkImplicitShape(ctx, stmt, sym, target);
    }
  }

  private static void checkImplicitShape(LintContext ctx, Statement stmt,
                                         Symbol sym, Expression target) {
    Shape shape = sym.shape();
    if (shape.kind() != Shape.Kind.VECTOR &&
        shape.kind() != Shape.Kind.MATRIX) {
      ctx.error(DiagnosticCode.INVALID_TARGET, stmt.pos(),
                "Cannot infer the shape of " + sym.name() + " from " +
                target + "; allocate it before the loop");
      return;
    }
    for (int i = 0; i < shape.rank(); i++) {
      if (shape.dim(i) == null) {
        ctx.error(DiagnosticCode.INVALID_TARGET, stmt.pos(),
                  "Cannot infer the length of " + sym.name() + " from " +
                  target + " since an index is not a loop variable; " +
                  "allocate it before the loop");
        return;
      }
    }
  }
}
