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
package exm.ppl.frontend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.Call;
import exm.ppl.ast.Expression.Index;
import exm.ppl.ast.Expression.VariableRef;
import exm.ppl.ast.Program;
import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.Assignment;
import exm.ppl.ast.Statement.For;
import exm.ppl.ast.Statement.If;
import exm.ppl.ast.Statement.Observe;
import exm.ppl.ast.Statement.Sample;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.exceptions.ScopeError;
import exm.ppl.common.lang.DistributionDescriptor;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Role;
import exm.ppl.common.lang.Shape;
import exm.ppl.common.lang.Symbol;
import exm.ppl.common.lang.Symbol.SymbolKind;
import exm.ppl.common.lang.ValueType;
import exm.ppl.frontend.SymbolTable.UnresolvedRef;

/**
 * Builds the symbol table for a program.
 *
 * Loop bodies and if branches get child scopes.  Writes to a name
 * visible from an enclosing scope update that symbol; names first
 * declared inside a block are local to it, except that a name declared
 * in both branches of an if is visible after the if.  An indexed write
 * x[i] = ... to an undeclared x inside a loop over i declares x as a
 * container outside the outermost such loop.
 */
public class ScopeResolver {

  private static class LoopFrame {
    final For loop;
    /** Scope enclosing the loop statement */
    final Scope outer;
    final Symbol index;

    LoopFrame(For loop, Scope outer, Symbol index) {
      this.loop = loop;
      this.outer = outer;
      this.index = index;
    }
  }

  private final SymbolTable table = new SymbolTable();

  /** Enclosing loops, outermost first */
  private final List<LoopFrame> loops = new ArrayList<LoopFrame>();

  /** Else-branch scope to the then-branch scope of the same if */
  private final Map<Scope, Scope> siblings = new HashMap<Scope, Scope>();

  private ScopeResolver() {
  }

  /**
   * Resolve, recording unresolved references in the table instead of
   * failing.  Used by the linter.
   */
  public static SymbolTable resolveLenient(Program program) {
    ScopeResolver resolver = new ScopeResolver();
    resolver.resolveProgram(program);
    return resolver.table;
  }

  /**
   * @throws ScopeError listing every unresolved reference
   */
  public static SymbolTable resolve(Program program) throws ScopeError {
    SymbolTable table = resolveLenient(program);
    if (!table.isComplete()) {
      List<String> names = new ArrayList<String>();
      for (UnresolvedRef u: table.unresolved()) {
        names.add(u.ref.name() + " (" + u.pos() + ")");
      }
      throw ScopeError.fromNames(table.unresolved().get(0).pos(), names);
    }
    return table;
  }

  private void resolveProgram(Program program) {
    Scope global = new Scope();
    for (String param: program.params()) {
      Symbol sym = new Symbol(param, SymbolKind.PARAMETER, null,
                              Shape.UNKNOWN, global.depth());
      global.declare(sym);
      table.addSymbol(sym);
    }
    LogHelper.debug(0, program.pos(), "resolving model " + program.name());
    resolveBlock(program.body(), global);

    // Containers that were allocated but never written
    for (Symbol sym: table.symbols()) {
      if (sym.kind() == SymbolKind.LOCAL && sym.role() == null) {
        sym.setRole(Role.DETERMINISTIC);
      }
    }
  }

  private void resolveBlock(List<Statement> block, Scope scope) {
    for (Statement stmt: block) {
      resolveStatement(stmt, scope);
    }
  }

  private void resolveStatement(Statement stmt, Scope scope) {
    switch (stmt.kind()) {
      case ASSIGNMENT: {
        Assignment a = (Assignment)stmt;
        resolveExpr(a.value(), scope, stmt);
        resolveWrite(stmt, a.target(), a.value(), false, scope);
        break;
      }
      case SAMPLE: {
        Sample s = (Sample)stmt;
        resolveExpr(s.distribution(), scope, stmt);
        resolveWrite(stmt, s.target(), s.distribution(), true, scope);
        break;
      }
      case OBSERVE: {
        Observe o = (Observe)stmt;
        resolveExpr(o.subject(), scope, stmt);
        resolveExpr(o.distribution(), scope, stmt);
        Symbol sym = table.baseSymbol(o.subject());
        if (sym != null) {
          sym.markObserved();
        }
        break;
      }
      case IF:
        resolveIf((If)stmt, scope);
        break;
      case FOR:
        resolveFor((For)stmt, scope);
        break;
      case FACTOR:
      case RETURN:
      case CONTINUE:
      case BREAK:
        for (Expression expr: stmt.expressions()) {
          resolveExpr(expr, scope, stmt);
        }
        break;
      default:
        throw new PPLRuntimeError("Unexpected statement kind: " +
                                  stmt.kind());
    }
  }

  private void resolveIf(If stmt, Scope scope) {
    resolveExpr(stmt.condition(), scope, stmt);
    Scope thenScope = scope.makeChildScope();
    resolveBlock(stmt.thenBlock(), thenScope);
    Scope elseScope = scope.makeChildScope();
    siblings.put(elseScope, thenScope);
    resolveBlock(stmt.elseBlock(), elseScope);

    // Declared on both paths: visible after the if
    for (Symbol sym: thenScope.localSymbols()) {
      if (elseScope.lookupLocal(sym.name()) == sym) {
        LogHelper.trace(scope.depth(), stmt.pos(),
                        "promote " + sym.name() + " out of if branches");
        scope.declare(sym);
      }
    }
  }

  private void resolveFor(For stmt, Scope scope) {
    resolveExpr(stmt.range(), scope, stmt);
    Scope bodyScope = scope.makeChildScope();
    Symbol index = new Symbol(stmt.loopVar(), SymbolKind.LOOP_INDEX, stmt,
                              Shape.SCALAR, bodyScope.depth());
    index.setRole(Role.DETERMINISTIC);
    index.setValueType(ValueType.INT);
    index.setLoopRange(stmt.range());
    bodyScope.declare(index);
    table.addSymbol(index);

    loops.add(new LoopFrame(stmt, scope, index));
    resolveBlock(stmt.body(), bodyScope);
    loops.remove(loops.size() - 1);
  }

  private void resolveExpr(Expression expr, Scope scope, Statement stmt) {
    for (VariableRef ref: ExprTypes.collectRefs(expr)) {
      Symbol sym = scope.lookup(ref.name());
      if (sym != null) {
        table.bind(ref, sym);
      } else {
        LogHelper.trace(scope.depth(), ref.pos().orElse(stmt.pos()),
                        "unresolved: " + ref.name());
        table.addUnresolved(ref, stmt);
      }
    }
  }

  /**
   * Handle the target of an assignment or sample.
   * @param rhs assigned value, or the distribution sampled from
   */
  private void resolveWrite(Statement stmt, Expression target,
                            Expression rhs, boolean isSample, Scope scope) {
    List<Expression> indices = new ArrayList<Expression>();
    Expression root = target;
    while (root.kind() == Expression.Kind.INDEX) {
      Index index = (Index)root;
      indices.addAll(0, index.indices());
      root = index.base();
    }
    for (Expression index: indices) {
      resolveExpr(index, scope, stmt);
    }
    if (root.kind() != Expression.Kind.VARIABLE_REF) {
      // Not assignable; linter reports the target
      resolveExpr(root, scope, stmt);
      return;
    }

    VariableRef ref = (VariableRef)root;
    Symbol sym = scope.lookup(ref.name());
    if (sym == null) {
      sym = lookupSibling(scope, ref.name());
      if (sym != null) {
        scope.declare(sym);
      }
    }

    boolean discrete = isSample && isDiscrete(rhs);
    if (sym != null) {
      table.bind(ref, sym);
      table.bindTarget(stmt, sym);
      updateExisting(sym, stmt, rhs, isSample, !indices.isEmpty(), discrete);
      return;
    }

    if (!indices.isEmpty()) {
      sym = declareImplicitContainer(ref, stmt, indices);
      if (sym == null) {
        table.addUnresolved(ref, stmt);
        return;
      }
    } else {
      Shape shape = ExprTypes.shapeOf(rhs, table);
      sym = new Symbol(ref.name(), SymbolKind.LOCAL, stmt, shape,
                       scope.depth());
      scope.declare(sym);
    }
    table.addSymbol(sym);
    table.bind(ref, sym);
    table.bindTarget(stmt, sym);
    LogHelper.trace(scope.depth(), stmt.pos(), "declare " + sym);

    if (isSample) {
      sym.setRole(Role.LATENT);
      sym.setValueType(ValueType.REAL);
      sym.markSampled();
      sym.recordWrite(discrete);
    } else if (ExprTypes.isAllocation(rhs)) {
      // Role is set by the first element write
      sym.setValueType(ValueType.REAL);
    } else {
      sym.setRole(Role.DETERMINISTIC);
      sym.setValueType(ExprTypes.typeOf(rhs, table));
      sym.recordWrite(false);
      if (indices.isEmpty()) {
        sym.setConstantValue(ExprTypes.constantValue(rhs, table));
      }
    }
  }

  private void updateExisting(Symbol sym, Statement stmt, Expression rhs,
          boolean isSample, boolean indexed, boolean discrete) {
    if (sym.kind() == SymbolKind.LOOP_INDEX) {
      table.addConflict(sym, stmt, "Cannot write to loop index " +
                        sym.name());
      return;
    }
    boolean alloc = !isSample && ExprTypes.isAllocation(rhs);
    if (sym.kind() == SymbolKind.PARAMETER) {
      if (isSample) {
        sym.markSampled();
      }
      sym.recordWrite(discrete);
      return;
    }

    if (!indexed) {
      Shape written = ExprTypes.shapeOf(rhs, table);
      if (!sym.shape().compatibleWith(written)) {
        table.addConflict(sym, stmt, sym.name() + " was declared as " +
            sym.shape().kind().toString().toLowerCase() + declaredAt(sym) +
            " but is redeclared as " +
            written.kind().toString().toLowerCase());
        return;
      }
    }

    Role newRole = isSample ? Role.LATENT : Role.DETERMINISTIC;
    if (!alloc) {
      if (sym.role() == null) {
        sym.setRole(newRole);
      } else if (sym.role() != newRole) {
        table.addConflict(sym, stmt, sym.name() + " was declared " +
            roleDescription(sym.role()) + declaredAt(sym) +
            " but is redeclared " + roleDescription(newRole));
        return;
      }
    }

    if (isSample) {
      sym.markSampled();
      sym.recordWrite(discrete);
    } else if (!alloc) {
      sym.recordWrite(false);
      sym.setValueType(ValueType.join(sym.valueType(),
                                      ExprTypes.typeOf(rhs, table)));
    }
  }

  /**
   * Declare the container written by x[i, ...] inside loops.
   * @return the new symbol, or null if no enclosing loop index is used
   */
  private Symbol declareImplicitContainer(VariableRef ref, Statement stmt,
                                          List<Expression> indices) {
    LoopFrame outermost = null;
    for (LoopFrame frame: loops) {
      for (Expression index: indices) {
        if (usesIndex(index, frame)) {
          outermost = frame;
          break;
        }
      }
      if (outermost != null) {
        break;
      }
    }
    if (outermost == null) {
      return null;
    }

    // Lengths come from the stop of the loop indexing each dimension
    List<Expression> dims = new ArrayList<Expression>();
    for (Expression index: indices) {
      if (index.kind() == Expression.Kind.RANGE) {
        continue;
      }
      Expression dim = null;
      for (LoopFrame frame: loops) {
        if (index.kind() == Expression.Kind.VARIABLE_REF &&
            table.lookup((VariableRef)index) == frame.index) {
          dim = frame.loop.range().stop();
        }
      }
      dims.add(dim);
    }
    Shape shape;
    if (dims.size() == 1) {
      shape = Shape.vector(dims.get(0));
    } else if (dims.size() == 2) {
      shape = Shape.matrix(dims.get(0), dims.get(1));
    } else {
      shape = Shape.UNKNOWN;
    }

    Symbol sym = new Symbol(ref.name(), SymbolKind.LOCAL, stmt, shape,
                            outermost.outer.depth());
    sym.setImplicitLoop(outermost.loop);
    outermost.outer.declare(sym);
    return sym;
  }

  private boolean usesIndex(Expression expr, LoopFrame frame) {
    for (VariableRef ref: ExprTypes.collectRefs(expr)) {
      if (table.lookup(ref) == frame.index) {
        return true;
      }
    }
    return false;
  }

  /**
   * A name declared in the then-branch of an enclosing if is reused by
   * the else-branch, so both branches write the same symbol.
   */
  private Symbol lookupSibling(Scope scope, String name) {
    for (Scope curr = scope; curr != null; curr = curr.parent()) {
      Scope sibling = siblings.get(curr);
      if (sibling != null) {
        Symbol sym = sibling.lookupLocal(name);
        if (sym != null) {
          return sym;
        }
      }
    }
    return null;
  }

  private static boolean isDiscrete(Expression distribution) {
    if (distribution.kind() != Expression.Kind.CALL) {
      return false;
    }
    Call call = (Call)distribution;
    DistributionDescriptor d = Distributions.lookup(call.function());
    if (d == null) {
      return false;
    } else if (d.isWrapper() && !call.args().isEmpty()) {
      return isDiscrete(call.args().get(0));
    }
    return d.isDiscrete();
  }

  private static String declaredAt(Symbol sym) {
    if (sym.declaration() == null || !sym.declaration().pos().isKnown()) {
      return "";
    }
    return " at line " + sym.declaration().pos().line;
  }

  private static String roleDescription(Role role) {
    switch (role) {
      case LATENT:
      case OBSERVED:
        return "random";
      case DETERMINISTIC:
        return "deterministic";
      default:
        throw new PPLRuntimeError("Unknown role " + role);
    }
  }
}
