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
package exm.ppl.backend.gen;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.ppl.backend.ExprRenderer;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.emit.tree.Assign;
import exm.ppl.emit.tree.ForLoop;
import exm.ppl.emit.tree.FunctionDef;
import exm.ppl.emit.tree.If;
import exm.ppl.emit.tree.Line;
import exm.ppl.emit.tree.Sequence;
import exm.ppl.ir.AddressTemplate;
import exm.ppl.ir.IRExpr;
import exm.ppl.ir.IRProgram;
import exm.ppl.ir.IRStatement;

/**
 * Builds the function that fills a Gen choice map with the observed
 * values of a model, by walking the model's IR again.
 *
 * Loops, branches and assignments that only depend on model inputs are
 * kept, so each observation computes its address as the model does.
 * Samples of names other than model inputs, and anything computed from
 * them, are omitted.  An observation the omitted code would have
 * governed is an error, never silently dropped.
 */
public class ConstraintAggregator {

  private final ExprRenderer renderer;
  private final String constraintsName;

  /** Model inputs: the only values known before the model runs */
  private final Set<String> inputs = new HashSet<String>();

  /** Names whose values depend on random choices */
  private final Set<String> tainted = new HashSet<String>();

  /** Names the generated function has assigned at the current point */
  private Set<String> bound = new HashSet<String>();

  /**
   * Innermost continue or break, governed by random choices, that may
   * leave an enclosing loop before the current statement.  Null if none.
   */
  private IRStatement earlyExit = null;

  private int loopDepth = 0;

  public ConstraintAggregator(ExprRenderer renderer,
                              String constraintsName) {
    this.renderer = renderer;
    this.constraintsName = constraintsName;
  }

  public FunctionDef build(IRProgram program, String functionName)
                                              throws CodegenError {
    inputs.addAll(program.params());
    bound.addAll(program.params());
    computeTainted(program.body());
    FunctionDef fn = new FunctionDef(null, functionName,
                                     ImmutableList.copyOf(program.params()));
    emitBlock(program.body(), fn.getBody());
    fn.getBody().add(new Line("return " + constraintsName));
    return fn;
  }

  /**
   * Propagate to a fixpoint through assignments, which may appear in
   * any order relative to their uses
   */
  private void computeTainted(List<IRStatement> body) {
    boolean changed = true;
    while (changed) {
      changed = taintBlock(body);
    }
  }

  private boolean taintBlock(List<IRStatement> block) {
    boolean changed = false;
    for (IRStatement stmt: block) {
      if (stmt.kind() == IRStatement.Kind.SAMPLE) {
        IRStatement.Sample s = (IRStatement.Sample)stmt;
        if (!isConstrained(s)) {
          changed |= tainted.add(baseName(s.target()));
        }
      } else if (stmt.kind() == IRStatement.Kind.ASSIGN) {
        IRStatement.Assign a = (IRStatement.Assign)stmt;
        if (dependsOnRandom(a.value()) || dependsOnRandom(a.target())) {
          changed |= tainted.add(baseName(a.target()));
        }
      }
      for (List<IRStatement> nested: stmt.blocks()) {
        changed |= taintBlock(nested);
      }
    }
    return changed;
  }

  /**
   * A sample is constrained when its value is data passed to the model.
   * Any other sample draws its value inside the model, even when the
   * name is observed later.
   */
  private boolean isConstrained(IRStatement.Sample s) {
    return s.isObserved() && inputs.contains(baseName(s.target()));
  }

  private boolean dependsOnRandom(IRExpr expr) {
    if (expr.isRandom()) {
      return true;
    }
    for (String name: tainted) {
      if (expr.references(name)) {
        return true;
      }
    }
    return false;
  }

  private static String baseName(IRExpr target) {
    IRExpr root = target;
    while (root.kind() == IRExpr.Kind.INDEX) {
      root = ((IRExpr.Index)root).base();
    }
    if (root.kind() != IRExpr.Kind.VAR) {
      throw new PPLRuntimeError("Not a variable target: " + target);
    }
    return ((IRExpr.Var)root).name();
  }

  private void emitBlock(List<IRStatement> block, Sequence out)
                                              throws CodegenError {
    for (IRStatement stmt: block) {
      emitStatement(stmt, out);
    }
  }

  private void emitStatement(IRStatement stmt, Sequence out)
                                              throws CodegenError {
    switch (stmt.kind()) {
      case ASSIGN: {
        IRStatement.Assign a = (IRStatement.Assign)stmt;
        String name = baseName(a.target());
        if (!tainted.contains(name)) {
          out.add(new Assign(renderer.render(a.target()),
                             renderer.render(a.value())));
          bound.add(name);
        }
        break;
      }
      case SAMPLE: {
        IRStatement.Sample s = (IRStatement.Sample)stmt;
        if (isConstrained(s)) {
          constrain(stmt, s.address(), s.target(), out);
        }
        break;
      }
      case OBSERVE: {
        IRStatement.Observe o = (IRStatement.Observe)stmt;
        constrain(stmt, o.address(), o.subject(), out);
        break;
      }
      case IF: {
        IRStatement.If i = (IRStatement.If)stmt;
        if (dependsOnRandom(i.condition())) {
          skip(i, "an if whose condition");
          if (loopDepth > 0 && (leavesLoop(i.thenBlock(), false) ||
                                leavesLoop(i.elseBlock(), false))) {
            earlyExit = i;
          }
          break;
        }
        If tree = new If(renderer.render(i.condition()));
        emitBlock(i.thenBlock(), tree.thenBlock());
        emitBlock(i.elseBlock(), tree.elseBlock());
        out.add(tree);
        break;
      }
      case FOR: {
        IRStatement.For loop = (IRStatement.For)stmt;
        if (dependsOnRandom(loop.range())) {
          skip(loop, "a loop whose range");
          break;
        }
        emitFor(loop, out);
        break;
      }
      case CONTINUE:
        out.add(new Line("continue"));
        break;
      case BREAK:
        out.add(new Line("break"));
        break;
      case FACTOR:
      case RETURN:
        break;
      default:
        throw new PPLRuntimeError("Unexpected IR statement kind " +
                                  stmt.kind());
    }
  }

  private void emitFor(IRStatement.For loop, Sequence out)
                                              throws CodegenError {
    IRStatement outerExit = earlyExit;
    Set<String> outerBound = bound;
    bound = new HashSet<String>(outerBound);
    bound.add(loop.loopVar());
    // A random break ends later iterations, so it governs the whole body
    IRStatement randomBreak = randomBreak(loop.body());
    if (randomBreak != null) {
      earlyExit = randomBreak;
    }
    ForLoop tree = new ForLoop(loop.loopVar(),
                               renderer.loopIteration(loop.range()));
    loopDepth++;
    emitBlock(loop.body(), tree.loopBody());
    loopDepth--;
    out.add(tree);
    earlyExit = outerExit;
    bound = outerBound;
  }

  /**
   * Omit a statement that depends on random choices
   * @throws CodegenError if it contains an observation
   */
  private void skip(IRStatement stmt, String construct)
                                              throws CodegenError {
    IRStatement observation = firstObservation(stmt.blocks());
    if (observation != null) {
      throw new CodegenError(observation.pos(), addressOf(observation),
          "Gen cannot constrain an observation inside " + construct +
          " depends on random choices (line " + stmt.pos().line + ")");
    }
  }

  private IRStatement firstObservation(List<List<IRStatement>> blocks) {
    for (List<IRStatement> block: blocks) {
      for (IRStatement stmt: block) {
        if (stmt.kind() == IRStatement.Kind.OBSERVE ||
            (stmt.kind() == IRStatement.Kind.SAMPLE &&
             isConstrained((IRStatement.Sample)stmt))) {
          return stmt;
        }
        IRStatement nested = firstObservation(stmt.blocks());
        if (nested != null) {
          return nested;
        }
      }
    }
    return null;
  }

  private static String addressOf(IRStatement observation) {
    if (observation.kind() == IRStatement.Kind.OBSERVE) {
      return ((IRStatement.Observe)observation).address().name();
    }
    return ((IRStatement.Sample)observation).address().name();
  }

  /**
   * @param breakOnly only look for break
   * @return true if the block contains a continue or break of the
   *        enclosing loop, outside any nested loop
   */
  private static boolean leavesLoop(List<IRStatement> block,
                                    boolean breakOnly) {
    for (IRStatement stmt: block) {
      switch (stmt.kind()) {
        case BREAK:
          return true;
        case CONTINUE:
          if (!breakOnly) {
            return true;
          }
          break;
        case IF:
          for (List<IRStatement> nested: stmt.blocks()) {
            if (leavesLoop(nested, breakOnly)) {
              return true;
            }
          }
          break;
        default:
          break;
      }
    }
    return false;
  }

  /**
   * @return an if in the loop body, outside nested loops, whose condition
   *        depends on random choices and which breaks out of the loop
   */
  private IRStatement randomBreak(List<IRStatement> body) {
    for (IRStatement stmt: body) {
      if (stmt.kind() != IRStatement.Kind.IF) {
        continue;
      }
      IRStatement.If i = (IRStatement.If)stmt;
      if (dependsOnRandom(i.condition())) {
        if (leavesLoop(i.thenBlock(), true) ||
            leavesLoop(i.elseBlock(), true)) {
          return i;
        }
      } else {
        for (List<IRStatement> nested: i.blocks()) {
          IRStatement found = randomBreak(nested);
          if (found != null) {
            return found;
          }
        }
      }
    }
    return null;
  }

  private void constrain(IRStatement stmt, AddressTemplate address,
                         IRExpr value, Sequence out) throws CodegenError {
    if (earlyExit != null) {
      throw new CodegenError(stmt.pos(), address.name(),
          "Gen cannot constrain an observation that a continue or break " +
          "depending on random choices may skip (line " +
          earlyExit.pos().line + ")");
    }
    for (IRExpr c: address.components()) {
      if (dependsOnRandom(c)) {
        throw new CodegenError(stmt.pos(), address.name(),
            "Address " + address + " of an observation depends on " +
            "random choices, so Gen cannot constrain it in advance");
      }
      checkBound(stmt, address, c);
    }
    if (dependsOnRandom(value)) {
      throw new CodegenError(stmt.pos(), address.name(),
          "Observed value " + value + " depends on random choices");
    }
    checkBound(stmt, address, value);
    out.add(new Assign(constraintsName + "[" + renderer.address(address) +
                       "]", renderer.render(value)));
  }

  /**
   * @throws CodegenError if expr reads a name this function never assigns
   */
  private void checkBound(IRStatement stmt, AddressTemplate address,
                          IRExpr expr) throws CodegenError {
    if (expr.kind() == IRExpr.Kind.VAR) {
      String name = ((IRExpr.Var)expr).name();
      if (!bound.contains(name)) {
        throw new CodegenError(stmt.pos(), address.name(),
            "Observation reads " + name + ", which is not computed " +
            "from model inputs at this point");
      }
      return;
    }
    for (IRExpr child: expr.children()) {
      checkBound(stmt, address, child);
    }
  }
}
