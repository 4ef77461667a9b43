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
package exm.ppl.driver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.ppl.ast.Program;
import exm.ppl.backend.BackendGenerator;
import exm.ppl.backend.Backends;
import exm.ppl.common.Logging;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.exceptions.TranslationRefusedException;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.common.lang.Target;
import exm.ppl.frontend.ScopeResolver;
import exm.ppl.frontend.SymbolTable;
import exm.ppl.frontend.lint.LintResult;
import exm.ppl.frontend.lint.Linter;
import exm.ppl.ir.IRBuilder;
import exm.ppl.ir.IRProgram;

/**
 * Entry point for translating a model.  Each program is resolved and
 * linted for the target, lowered to IR, and handed to a fresh
 * generator.  Generation for one target never affects another.
 */
public class Translator {

  private static final Logger logger = Logging.getPPLLogger();

  public static LintResult lint(Program program, Target target) {
    return Linter.lint(program, BackendDescriptor.forTarget(target));
  }

  /**
   * @throws TranslationRefusedException if the linter reports errors
   * @throws CodegenError if the program cannot be lowered for the target
   */
  public static TranslationResult translate(Program program, Target target)
          throws TranslationRefusedException, CodegenError {
    logger.info("translating " + program.name() + " for " + target);
    SymbolTable table = ScopeResolver.resolveLenient(program);
    LintResult lint = Linter.lint(program, table,
                                  BackendDescriptor.forTarget(target));
    checkLint(program, lint);
    IRProgram ir = IRBuilder.build(program, table);
    return TranslationResult.translated(target, generate(ir, target),
                                        lint.diagnostics());
  }

  public static Map<Target, TranslationResult> translateAll(
          Program program, Collection<Target> targets) {
    Prepared prepared = prepare(program, targets);
    Map<Target, TranslationResult> results =
                      new LinkedHashMap<Target, TranslationResult>();
    for (Target target: targets) {
      results.put(target, prepared.translate(target));
    }
    return results;
  }

  /**
   * As {@link #translateAll(Program, Collection)}, generating code for
   * the targets concurrently.  The IR is built once and shared, since
   * generators do not modify it.
   */
  public static Map<Target, TranslationResult> translateAll(
          Program program, Collection<Target> targets,
          ExecutorService executor) throws InterruptedException {
    final Prepared prepared = prepare(program, targets);
    List<Target> order = ImmutableList.copyOf(targets);
    List<Future<TranslationResult>> futures =
                        new ArrayList<Future<TranslationResult>>();
    for (final Target target: order) {
      futures.add(executor.submit(new Callable<TranslationResult>() {
        @Override
        public TranslationResult call() {
          return prepared.translate(target);
        }
      }));
    }

    Map<Target, TranslationResult> results =
                      new LinkedHashMap<Target, TranslationResult>();
    for (int i = 0; i < order.size(); i++) {
      try {
        results.put(order.get(i), futures.get(i).get());
      } catch (ExecutionException e) {
        // Internal errors are bugs: do not report them as a failed target
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException)cause;
        } else if (cause instanceof Error) {
          throw (Error)cause;
        }
        throw new PPLRuntimeError("Translation for " + order.get(i) +
                                  " failed: " + cause);
      }
    }
    return results;
  }

  /**
   * Lint for every target, and lower once if any target accepts the
   * program
   */
  private static Prepared prepare(Program program,
                                  Collection<Target> targets) {
    SymbolTable table = ScopeResolver.resolveLenient(program);
    Map<Target, LintResult> lints = new LinkedHashMap<Target, LintResult>();
    for (Target target: targets) {
      lints.put(target, Linter.lint(program, table,
                                    BackendDescriptor.forTarget(target)));
    }
    IRProgram ir = null;
    CodegenError irError = null;
    if (anyAccepted(lints)) {
      try {
        ir = IRBuilder.build(program, table);
      } catch (CodegenError e) {
        irError = e;
      }
    }
    return new Prepared(program, lints, ir, irError);
  }

  private static boolean anyAccepted(Map<Target, LintResult> lints) {
    for (LintResult lint: lints.values()) {
      if (!lint.hasErrors()) {
        return true;
      }
    }
    return false;
  }

  private static class Prepared {
    final Program program;
    final Map<Target, LintResult> lints;
    /** Null if lowering failed or every target refused */
    final IRProgram ir;
    final CodegenError irError;

    Prepared(Program program, Map<Target, LintResult> lints, IRProgram ir,
             CodegenError irError) {
      this.program = program;
      this.lints = lints;
      this.ir = ir;
      this.irError = irError;
    }

    TranslationResult translate(Target target) {
      LintResult lint = lints.get(target);
      try {
        checkLint(program, lint);
        if (irError != null) {
          throw irError;
        }
        return TranslationResult.translated(target, generate(ir, target),
                                            lint.diagnostics());
      } catch (TranslationRefusedException e) {
        return TranslationResult.refused(target, lint.diagnostics(), e);
      } catch (CodegenError e) {
        logger.warn(target + ": " + e.getMessage());
        return TranslationResult.failed(target, lint.diagnostics(), e);
      }
    }
  }

  private static void checkLint(Program program, LintResult lint)
                                  throws TranslationRefusedException {
    if (lint.hasErrors()) {
      logger.debug("refusing " + program.name() + ": " +
                   lint.errors().size() + " error(s)");
      throw new TranslationRefusedException(program.name(),
                                            lint.diagnostics());
    }
  }

  private static String generate(IRProgram ir, Target target)
                                              throws CodegenError {
    BackendGenerator generator = Backends.create(target);
    generator.emitProgram(ir);
    generator.finalize();
    logger.debug("generated " + target + " code for " + ir.name());
    return generator.code();
  }
}
