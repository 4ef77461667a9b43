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
import java.util.List;
import java.util.Set;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.Call;
import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.Observe;
import exm.ppl.ast.Statement.Sample;
import exm.ppl.common.lang.Builtins;
import exm.ppl.common.lang.DistributionDescriptor;
import exm.ppl.common.lang.DistributionDescriptor.Param;
import exm.ppl.common.lang.DistributionDescriptor.ParamRole;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Shape;
import exm.ppl.frontend.ExprTypes;
import exm.ppl.frontend.lint.StatementWalker.WalkContext;

/**
 * The right side of ~ must be a catalog distribution called with the
 * right number of arguments, each of the expected shape.  An indexed
 * target must have the shape the distribution draws.
 */
public class DistributionSignatureCheck implements LintCheck {

  @Override
  public String name() {
    return "distribution-signature";
  }

  @Override
  public void check(final LintContext ctx) {
    StatementWalker.walk(ctx.program().body(), new StatementWalker.Visitor() {
      @Override
      public void visit(Statement stmt, WalkContext wc) {
        if (stmt.kind() == Statement.Kind.SAMPLE) {
          Sample s = (Sample)stmt;
          if (checkDistribution(ctx, stmt, s.distribution())) {
            checkTarget(ctx, stmt, s.target(), s.distribution());
          }
        } else if (stmt.kind() == Statement.Kind.OBSERVE) {
          Observe o = (Observe)stmt;
          if (checkDistribution(ctx, stmt, o.distribution())) {
            checkTarget(ctx, stmt, o.subject(), o.distribution());
          }
        }
      }
    });
  }

  /**
   * @return true if the distribution expression is well-formed
   */
  private static boolean checkDistribution(LintContext ctx, Statement stmt,
                                           Expression dist) {
    if (dist.kind() != Expression.Kind.CALL) {
      ctx.error(DiagnosticCode.DISTRIBUTION_SIGNATURE,
                LintContext.position(dist, stmt),
                "Expected a distribution after ~, found " + dist);
      return false;
    }
    Call call = (Call)dist;
    DistributionDescriptor d = Distributions.lookup(call.function());
    if (d == null) {
      if (Builtins.lookup(call.function()) != null) {
        ctx.error(DiagnosticCode.DISTRIBUTION_SIGNATURE,
                  LintContext.position(dist, stmt),
                  call.function() + " is a function, not a distribution");
      } else {
        ctx.error(DiagnosticCode.UNKNOWN_FUNCTION,
                  LintContext.position(dist, stmt),
                  "Unknown distribution " + call.function());
      }
      return false;
    }
    if (call.args().size() != d.arity()) {
      ctx.error(DiagnosticCode.DISTRIBUTION_SIGNATURE,
                LintContext.position(dist, stmt),
                d.name() + " takes " + d.arity() + " argument(s), " +
                d.signature() + ", but was given " + call.args().size());
      return false;
    }

    boolean ok = true;
    for (int i = 0; i < d.arity(); i++) {
      Param param = d.params().get(i);
      Expression arg = call.args().get(i);
      if (param.role == ParamRole.DISTRIBUTION) {
        if (!isPlainDistribution(arg)) {
          ctx.error(DiagnosticCode.DISTRIBUTION_SIGNATURE,
                    LintContext.position(arg, stmt),
                    d.name() + " wraps a distribution such as Normal(0, 1)" +
                    ", found " + arg);
          ok = false;
        } else if (!checkDistribution(ctx, stmt, arg)) {
          ok = false;
        }
        continue;
      }
      Shape expected = Shape.ofKind(param.shape);
      Shape actual = ExprTypes.shapeOf(arg, ctx.table());
      if (!expected.compatibleWith(actual)) {
        ctx.error(DiagnosticCode.DISTRIBUTION_SIGNATURE,
                  LintContext.position(arg, stmt),
                  "Argument " + (i + 1) + " of " + d.name() + ", the " +
                  param.role + ", should be a " + expected.kind()
                  .toString().toLowerCase() + " but " + arg + " is a " +
                  actual.kind().toString().toLowerCase());
        ok = false;
      }
    }
    return ok;
  }

  /**
   * Wrapper arguments are distributions other than wrappers
   */
  private static boolean isPlainDistribution(Expression expr) {
    if (expr.kind() != Expression.Kind.CALL) {
      return false;
    }
    DistributionDescriptor d = Distributions.lookup(((Call)expr).function());
    return d != null && !d.isWrapper();
  }

  /**
   * Only indexed targets are checked here: a plain name takes its shape
   * from its first declaration, and later mismatches are redeclarations.
   */
  private static void checkTarget(LintContext ctx, Statement stmt,
                                  Expression target, Expression dist) {
    if (target.kind() != Expression.Kind.INDEX) {
      return;
    }
    Shape targetShape = ExprTypes.shapeOf(target, ctx.table());
    Shape drawn = ExprTypes.shapeOf(dist, ctx.table());
    if (!targetShape.compatibleWith(drawn)) {
      ctx.error(DiagnosticCode.DISTRIBUTION_SIGNATURE, stmt.pos(),
                target + " is a " +
                targetShape.kind().toString().toLowerCase() + " but " +
                ((Call)dist).function() + " draws a " +
                drawn.kind().toString().toLowerCase());
    }
  }

  /**
   * @return calls in distribution position within the right side of ~:
   *        the call itself and the wrapped distributions of wrappers
   */
  static Set<Expression> distributionPositions(Expression dist) {
    Set<Expression> result = Collections.newSetFromMap(
                              new IdentityHashMap<Expression, Boolean>());
    Expression curr = dist;
    while (curr != null) {
      result.add(curr);
      Expression next = null;
      if (curr.kind() == Expression.Kind.CALL) {
        Call call = (Call)curr;
        DistributionDescriptor d = Distributions.lookup(call.function());
        List<Expression> args = call.args();
        if (d != null && d.isWrapper() && !args.isEmpty()) {
          next = args.get(0);
        }
      }
      curr = next;
    }
    return result;
  }
}
