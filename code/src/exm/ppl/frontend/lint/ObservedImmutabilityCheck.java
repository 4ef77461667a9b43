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

import java.util.HashMap;
import java.util.Map;

import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.Assignment;
import exm.ppl.ast.Statement.Observe;
import exm.ppl.common.lang.Symbol;
import exm.ppl.frontend.lint.StatementWalker.WalkContext;

/**
 * Once observed, data must not be assigned to again.
 */
public class ObservedImmutabilityCheck implements LintCheck {

  @Override
  public String name() {
    return "observed-immutability";
  }

  @Override
  public void check(final LintContext ctx) {
    // Observed symbol to first observation
    final Map<Symbol, Statement> observed = new HashMap<Symbol, Statement>();
    StatementWalker.walk(ctx.program().body(), new StatementWalker.Visitor() {
      @Override
      public void visit(Statement stmt, WalkContext wc) {
        if (stmt.kind() == Statement.Kind.OBSERVE) {
          Symbol sym = ctx.table().baseSymbol(((Observe)stmt).subject());
          if (sym != null && !observed.containsKey(sym)) {
            observed.put(sym, stmt);
          }
        } else if (stmt.kind() == Statement.Kind.ASSIGNMENT) {
          Symbol sym = ctx.table().baseSymbol(((Assignment)stmt).target());
          Statement first = observed.get(sym);
          if (first != null) {
            ctx.error(DiagnosticCode.OBSERVED_ASSIGNMENT, stmt.pos(),
                sym.name() + " is observed at line " + first.pos().line +
                " and cannot be assigned afterwards");
          }
        }
      }
    });
  }
}
