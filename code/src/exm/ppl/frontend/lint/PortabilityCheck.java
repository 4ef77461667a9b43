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

import java.util.IdentityHashMap;
import java.util.Map;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.Call;
import exm.ppl.ast.Expression.Index;
import exm.ppl.ast.Expression.VariableRef;
import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.For;
import exm.ppl.ast.Statement.If;
import exm.ppl.ast.Statement.Observe;
import exm.ppl.ast.Statement.Sample;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Symbol;
import exm.ppl.common.lang.Symbol.SymbolKind;
import exm.ppl.common.lang.Target;
import exm.ppl.frontend.ExprTypes;
import exm.ppl.frontend.SymbolTable;
import exm.ppl.frontend.lint.StatementWalker.WalkContext;

/**
 * Constructs the target backend cannot express, or expresses by
 * rewriting.  Only runs when linting for a backend.
 */
public class PortabilityCheck implements LintCheck {

  @Override
  public String name() {
    return "portability";
  }

  @Override
  public void check(final LintContext ctx) {
    final BackendDescriptor backend = ctx.backend();
    if (backend == null) {
      return;
    }
    final RandomLoopExits exits = new RandomLoopExits(ctx.table());
    StatementWalker.walk(ctx.program().body(), exits);
    StatementWalker.walk(ctx.program().body(), new StatementWalker.Visitor() {
      @Override
      public void visit(Statement stmt, WalkContext wc) {
        switch (stmt.kind()) {
          case SAMPLE: {
            Sample s = (Sample)stmt;
            checkDistribution(ctx, stmt, s.distribution());
            Symbol sym = ctx.table().target(stmt);
            if (sym != null && sym.kind() == SymbolKind.PARAMETER) {
              checkObservation(ctx, stmt, s.target(), wc, exits);
            }
            break;
          }
          case OBSERVE: {
            Observe o = (Observe)stmt;
            checkDistribution(ctx, stmt, o.distribution());
            checkObservedSubject(ctx, o);
            checkObservation(ctx, stmt, o.subject(), wc, exits);
            break;
          }
          case FACTOR:
            checkConstruct(ctx, stmt, BackendDescriptor.FACTOR);
            break;
          default:
            break;
        }
      }
    });
  }

  private static void checkDistribution(LintContext ctx, Statement stmt,
                                        Expression dist) {
    for (Expression e:
         DistributionSignatureCheck.distributionPositions(dist)) {
      if (e.kind() == Expression.Kind.CALL) {
        String name = ((Call)e).function();
        // Names outside the catalog are reported elsewhere
        if (Distributions.isDistribution(name)) {
          checkConstruct(ctx, stmt, name);
        }
      }
    }
  }

  private static void checkConstruct(LintContext ctx, Statement stmt,
                                     String construct) {
    BackendDescriptor backend = ctx.backend();
    switch (backend.support(construct)) {
      case NATIVE:
        break;
      case REWRITE:
        ctx.portability(Severity.WARNING, stmt.pos(), construct + " is " +
                        backend.rewriteDescription(construct) + " for " +
                        backend.displayName());
        break;
      case UNSUPPORTED:
        ctx.portability(Severity.ERROR, stmt.pos(), construct +
                        " is not supported by " + backend.displayName());
        break;
    }
  }

  /**
   * Turing models observe their arguments: data must be passed in.
   */
  private static void checkObservedSubject(LintContext ctx, Observe o) {
    if (ctx.backend().target() != Target.TURING) {
      return;
    }
    Symbol sym = ctx.table().baseSymbol(o.subject());
    if (sym == null) {
      // Unresolved names are reported elsewhere
      Expression.Kind kind = o.subject().kind();
      if (kind != Expression.Kind.VARIABLE_REF &&
          kind != Expression.Kind.INDEX) {
        ctx.portability(Severity.ERROR, o.pos(), "Turing can only observe " +
            "model arguments, not " + o.subject());
      }
    } else if (sym.kind() != SymbolKind.PARAMETER) {
      ctx.portability(Severity.ERROR, o.pos(), "Turing can only observe " +
          "model arguments, and " + sym.name() + " is not an argument");
    }
  }

  /**
   * Gen collects observations into a constraint map outside the model,
   * which cannot follow control flow that depends on random choices.
   */
  private static void checkObservation(LintContext ctx, Statement stmt,
                                       Expression subject, WalkContext wc,
                                       RandomLoopExits exits) {
    if (ctx.backend().target() != Target.GEN) {
      return;
    }
    for (For loop: wc.loops()) {
      if (dependsOnLatent(loop.range(), ctx.table())) {
        ctx.portability(Severity.ERROR, stmt.pos(), "Gen cannot constrain " +
            "an observation inside a loop whose range depends on random " +
            "choices (line " + loop.pos().line + ")");
        return;
      }
    }
    for (If branch: wc.branches()) {
      if (dependsOnLatent(branch.condition(), ctx.table())) {
        ctx.portability(Severity.ERROR, stmt.pos(), "Gen cannot constrain " +
            "an observation inside an if whose condition depends on " +
            "random choices (line " + branch.pos().line + ")");
        return;
      }
    }
    for (For loop: wc.loops()) {
      Statement exit = exits.exitBefore(loop, stmt);
      if (exit != null) {
        ctx.portability(Severity.ERROR, stmt.pos(), "Gen cannot constrain " +
            "an observation that a " + exit.kind().toString().toLowerCase() +
            " depending on random choices may skip (line " +
            exit.pos().line + ")");
        return;
      }
    }
    Expression root = subject;
    while (root.kind() == Expression.Kind.INDEX) {
      for (Expression component: ((Index)root).indices()) {
        if (dependsOnLatent(component, ctx.table())) {
          ctx.portability(Severity.ERROR, stmt.pos(), "Gen cannot " +
              "constrain " + subject + " since its address depends on " +
              "random choices");
          return;
        }
      }
      root = ((Index)root).base();
    }
    if (dependsOnLatent(subject, ctx.table())) {
      ctx.portability(Severity.ERROR, stmt.pos(), "Gen cannot constrain " +
          subject + " since its value depends on random choices");
    }
  }

  /**
   * Finds continue and break statements taken under conditions that
   * depend on random choices.  A break skips the rest of its loop; a
   * continue skips what follows it in the loop body.
   */
  private static class RandomLoopExits implements StatementWalker.Visitor {
    private final SymbolTable table;
    /** Visit order of every statement */
    private final Map<Statement, Integer> order =
                            new IdentityHashMap<Statement, Integer>();
    private final Map<For, Statement> breaks =
                            new IdentityHashMap<For, Statement>();
    /** First random continue of each loop */
    private final Map<For, Statement> continues =
                            new IdentityHashMap<For, Statement>();

    RandomLoopExits(SymbolTable table) {
      this.table = table;
    }

    @Override
    public void visit(Statement stmt, WalkContext wc) {
      order.put(stmt, order.size());
      if ((stmt.kind() != Statement.Kind.CONTINUE &&
           stmt.kind() != Statement.Kind.BREAK) || !wc.inLoop()) {
        return;
      }
      boolean random = false;
      for (If branch: wc.branches()) {
        random |= dependsOnLatent(branch.condition(), table);
      }
      if (!random) {
        return;
      }
      For loop = wc.loops().get(wc.loops().size() - 1);
      Map<For, Statement> exits =
            stmt.kind() == Statement.Kind.BREAK ? breaks : continues;
      if (!exits.containsKey(loop)) {
        exits.put(loop, stmt);
      }
    }

    /**
     * @return a random exit of loop that may skip stmt, or null
     */
    Statement exitBefore(For loop, Statement stmt) {
      Statement brk = breaks.get(loop);
      if (brk != null) {
        return brk;
      }
      Statement cont = continues.get(loop);
      if (cont != null && order.get(cont) < order.get(stmt)) {
        return cont;
      }
      return null;
    }
  }

  static boolean dependsOnLatent(Expression expr, SymbolTable table) {
    for (VariableRef ref: ExprTypes.collectRefs(expr)) {
      Symbol sym = table.lookup(ref);
      if (sym != null && sym.isSampled() &&
          sym.kind() != SymbolKind.PARAMETER) {
        return true;
      }
    }
    return false;
  }
}
