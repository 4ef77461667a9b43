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

import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.ppl.ast.Program;
import exm.ppl.common.Logging;
import exm.ppl.common.Settings;
import exm.ppl.common.exceptions.InvalidOptionException;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.frontend.ScopeResolver;
import exm.ppl.frontend.SymbolTable;

/**
 * Runs every check over a program and collects the findings.
 * Linting never fails on a bad program: problems become diagnostics.
 */
public class Linter {

  private static final Logger logger = Logging.getPPLLogger();

  private static final List<LintCheck> CHECKS = ImmutableList.of(
      new UndefinedReferenceCheck(),
      new RedeclarationCheck(),
      new DistributionSignatureCheck(),
      new FunctionCallCheck(),
      new IndexCheck(),
      new LoopCheck(),
      new ObservedImmutabilityCheck(),
      new DuplicateAddressCheck(),
      new PortabilityCheck());

  /**
   * Lint without backend-specific checks
   */
  public static LintResult lint(Program program) {
    return lint(program, null);
  }

  /**
   * @param backend backend to check portability for, or null
   */
  public static LintResult lint(Program program, BackendDescriptor backend) {
    return lint(program, ScopeResolver.resolveLenient(program), backend);
  }

  /**
   * Lint with an existing symbol table for the program
   */
  public static LintResult lint(Program program, SymbolTable table,
                                BackendDescriptor backend) {
    LintContext ctx = new LintContext(program, table, backend);
    for (LintCheck check: CHECKS) {
      int before = ctx.diagnostics().size();
      check.check(ctx);
      if (logger.isTraceEnabled()) {
        logger.trace(check.name() + ": " +
                     (ctx.diagnostics().size() - before) + " finding(s)");
      }
    }

    List<Diagnostic> diagnostics = ctx.diagnostics();
    if (warningsAsErrors()) {
      Logging.uniqueWarn("Reporting lint warnings as errors (" +
                         Settings.LINT_WARNINGS_AS_ERRORS + ")");
      diagnostics = promoteWarnings(diagnostics);
    }
    LintResult result = new LintResult(diagnostics);
    logger.debug("lint " + program.name() +
                 (backend == null ? "" : " for " + backend) + ": " +
                 result.errors().size() + " error(s), " +
                 result.warnings().size() + " warning(s)");
    return result;
  }

  private static boolean warningsAsErrors() {
    try {
      return Settings.getBoolean(Settings.LINT_WARNINGS_AS_ERRORS);
    } catch (InvalidOptionException e) {
      throw new PPLRuntimeError(e.getMessage());
    }
  }

  private static List<Diagnostic> promoteWarnings(List<Diagnostic> in) {
    ImmutableList.Builder<Diagnostic> b = ImmutableList.builder();
    for (Diagnostic d: in) {
      if (d.isError()) {
        b.add(d);
      } else {
        b.add(new Diagnostic(Severity.ERROR, d.code(), d.pos(),
                             d.message(), d.backend()));
      }
    }
    return b.build();
  }
}
