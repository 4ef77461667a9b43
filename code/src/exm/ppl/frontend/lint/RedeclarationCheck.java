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

import exm.ppl.common.lang.Symbol.SymbolKind;
import exm.ppl.frontend.SymbolTable.Conflict;

/**
 * Writes that contradict an earlier declaration of the same name:
 * a different shape, or random after deterministic and vice versa.
 * Writes to loop indices are reported as invalid targets.
 */
public class RedeclarationCheck implements LintCheck {

  @Override
  public String name() {
    return "redeclaration";
  }

  @Override
  public void check(LintContext ctx) {
    for (Conflict c: ctx.table().conflicts()) {
      DiagnosticCode code = c.symbol.kind() == SymbolKind.LOOP_INDEX ?
                DiagnosticCode.INVALID_TARGET : DiagnosticCode.REDECLARATION;
      ctx.error(code, c.statement.pos(), c.message);
    }
  }
}
