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

import exm.ppl.ast.Expression.Range;
import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.For;
import exm.ppl.frontend.ExprTypes;
import exm.ppl.frontend.lint.StatementWalker.WalkContext;

/**
 * Loop ranges must have a stop and a nonzero step, and continue or
 * break must be inside a loop.
 */
public class LoopCheck implements LintCheck {

  @Override
  public String name() {
    return "loops";
  }

  @Override
  public void check(final LintContext ctx) {
    StatementWalker.walk(ctx.program().body(), new StatementWalker.Visitor() {
      @Override
      public void visit(Statement stmt, WalkContext wc) {
        switch (stmt.kind()) {
          case FOR:
            checkRange(ctx, (For)stmt);
            break;
          case CONTINUE:
          case BREAK:
            if (!wc.inLoop()) {
              ctx.error(DiagnosticCode.LOOP_CONTROL, stmt.pos(),
                  stmt.kind().toString().toLowerCase() + " outside of a loop");
            }
            break;
          default:
            break;
        }
      }
    });
  }

  private static void checkRange(LintContext ctx, For loop) {
    Range range = loop.range();
    if (range.stop() == null) {
      ctx.error(DiagnosticCode.LOOP_RANGE, loop.pos(),
                "Loop over " + loop.loopVar() + " has no upper bound");
    }
    if (range.step() != null) {
      Long step = ExprTypes.constantValue(range.step(), ctx.table());
      if (step != null && step == 0) {
        ctx.error(DiagnosticCode.ZERO_STEP, loop.pos(),
                  "Loop over " + loop.loopVar() + " has step 0");
      }
    }
  }
}
