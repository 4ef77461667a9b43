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
package exm.ppl.backend.pyro;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.ppl.common.Settings;
import exm.ppl.common.exceptions.InvalidOptionException;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.ir.IRExpr;
import exm.ppl.ir.IRStatement;
import exm.ppl.ir.IndexComponent;

/**
 * Replace deterministic element-wise loops with sliced tensor
 * assignments, e.g.
 *   for i in range(0, n): y[i] = a * x[i] + b
 * becomes
 *   y[0:n] = a * x[0:n] + b
 *
 * A loop qualifies only if its body is assignments to elements indexed
 * directly by the loop variable, whose values are arithmetic over
 * scalars and elements indexed the same way, and no value reads an
 * array the loop writes.
 */
public class LoopVectorizer {

  public static boolean enabled() {
    try {
      return Settings.getBoolean(Settings.PYRO_VECTORIZE);
    } catch (InvalidOptionException e) {
      throw new PPLRuntimeError(e.getMessage());
    }
  }

  /**
   * @return sliced assignments replacing the loop, or null if the loop
   *         does not qualify
   */
  public static List<IRStatement.Assign> tryVectorize(Logger logger,
                                                IRStatement.For loop) {
    String loopVar = loop.loopVar();
    IRExpr.Range range = loop.range();
    Long step = range.constantStep();
    if (step == null || step <= 0 || loop.body().isEmpty()) {
      return null;
    }

    Set<String> written = new HashSet<String>();
    for (IRStatement stmt: loop.body()) {
      if (stmt.kind() != IRStatement.Kind.ASSIGN) {
        return null;
      }
      IRStatement.Assign a = (IRStatement.Assign)stmt;
      if (!elementOf(a.target(), loopVar, true)) {
        return null;
      }
      written.add(((IRExpr.Var)((IRExpr.Index)a.target()).base()).name());
    }

    for (IRStatement stmt: loop.body()) {
      IRExpr value = ((IRStatement.Assign)stmt).value();
      if (!elementwise(value, loopVar)) {
        return null;
      }
      for (String name: written) {
        if (value.references(name)) {
          logger.trace("not vectorizing loop over " + loopVar +
                       ": reads " + name + " which the loop writes");
          return null;
        }
      }
    }

    IRExpr.Range slice = new IRExpr.Range(range.start(),
                            step == 1 ? null : range.step(), range.stop());
    List<IRStatement.Assign> result = new ArrayList<IRStatement.Assign>();
    for (IRStatement stmt: loop.body()) {
      IRStatement.Assign a = (IRStatement.Assign)stmt;
      result.add(new IRStatement.Assign(a.pos(),
                    sliced(a.target(), loopVar, slice),
                    sliced(a.value(), loopVar, slice)));
    }
    logger.debug("vectorized loop over " + loopVar + " into " +
                 result.size() + " sliced assignments");
    return result;
  }

  /**
   * @param required true if the loop variable must be a component
   * @return true if expr is name[...] with the loop variable at most
   *    once, as a whole component, and nowhere else
   */
  private static boolean elementOf(IRExpr expr, String loopVar,
                                   boolean required) {
    if (expr.kind() != IRExpr.Kind.INDEX) {
      return false;
    }
    IRExpr.Index index = (IRExpr.Index)expr;
    if (index.base().kind() != IRExpr.Kind.VAR) {
      return false;
    }
    int uses = 0;
    for (IndexComponent c: index.components()) {
      if (isLoopVar(c.expr(), loopVar)) {
        uses++;
      } else if (c.isSlice() || c.expr().references(loopVar)) {
        return false;
      }
    }
    return required ? uses == 1 : uses <= 1;
  }

  private static boolean elementwise(IRExpr expr, String loopVar) {
    switch (expr.kind()) {
      case LITERAL:
        return true;
      case VAR:
        return !isLoopVar(expr, loopVar);
      case INDEX:
        return elementOf(expr, loopVar, false);
      case BINARY: {
        IRExpr.Binary b = (IRExpr.Binary)expr;
        return b.op().isElementwise() &&
               elementwise(b.left(), loopVar) &&
               elementwise(b.right(), loopVar);
      }
      case UNARY: {
        IRExpr.Unary u = (IRExpr.Unary)expr;
        switch (u.op()) {
          case NEGATE:
          case PLUS:
            return elementwise(u.operand(), loopVar);
          default:
            return false;
        }
      }
      default:
        return false;
    }
  }

  private static boolean isLoopVar(IRExpr expr, String loopVar) {
    return expr.kind() == IRExpr.Kind.VAR &&
           ((IRExpr.Var)expr).name().equals(loopVar);
  }

  private static IRExpr sliced(IRExpr expr, String loopVar,
                               IRExpr.Range slice) {
    switch (expr.kind()) {
      case INDEX: {
        IRExpr.Index index = (IRExpr.Index)expr;
        List<IndexComponent> components = new ArrayList<IndexComponent>();
        for (IndexComponent c: index.components()) {
          if (isLoopVar(c.expr(), loopVar)) {
            components.add(IndexComponent.slice(slice));
          } else {
            components.add(c);
          }
        }
        return new IRExpr.Index(index.base(), components);
      }
      case BINARY: {
        IRExpr.Binary b = (IRExpr.Binary)expr;
        return new IRExpr.Binary(b.op(), sliced(b.left(), loopVar, slice),
                                 sliced(b.right(), loopVar, slice));
      }
      case UNARY: {
        IRExpr.Unary u = (IRExpr.Unary)expr;
        return new IRExpr.Unary(u.op(), sliced(u.operand(), loopVar, slice));
      }
      default:
        return expr;
    }
  }
}
