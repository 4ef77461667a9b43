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

import java.util.ArrayList;
import java.util.List;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Program;
import exm.ppl.ast.SourcePos;
import exm.ppl.ast.Statement;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.frontend.SymbolTable;

/**
 * Inputs for one linter run, and the diagnostics reported so far.
 * Owned by a single run.
 */
public class LintContext {
  private final Program program;
  private final SymbolTable table;
  private final BackendDescriptor backend;
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  LintContext(Program program, SymbolTable table, BackendDescriptor backend) {
    this.program = program;
    this.table = table;
    this.backend = backend;
  }

  public Program program() {
    return program;
  }

  public SymbolTable table() {
    return table;
  }

  /**
   * @return target backend, or null when linting without one
   */
  public BackendDescriptor backend() {
    return backend;
  }

  public void report(Diagnostic d) {
    diagnostics.add(d);
  }

  public void error(DiagnosticCode code, SourcePos pos, String message) {
    report(Diagnostic.error(code, pos, message));
  }

  public void warning(DiagnosticCode code, SourcePos pos, String message) {
    report(Diagnostic.warning(code, pos, message));
  }

  /**
   * Report a finding specific to the target backend
   */
  public void portability(Severity severity, SourcePos pos, String message) {
    report(new Diagnostic(severity, DiagnosticCode.PORTABILITY, pos, message,
                          backend.target()));
  }

  /**
   * @return position of the expression, or of its statement if the
   *        expression has none
   */
  public static SourcePos position(Expression expr, Statement stmt) {
    return expr.pos().orElse(stmt.pos());
  }

  List<Diagnostic> diagnostics() {
    return diagnostics;
  }
}
