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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.VariableRef;
import exm.ppl.ast.SourcePos;
import exm.ppl.ast.Statement;
import exm.ppl.common.lang.Symbol;

/**
 * Result of scope resolution: every declared symbol, the symbol each
 * reference resolved to, and what could not be resolved.
 */
public class SymbolTable {

  /**
   * A reference with no visible declaration
   */
  public static class UnresolvedRef {
    public final VariableRef ref;
    public final Statement statement;

    public UnresolvedRef(VariableRef ref, Statement statement) {
      this.ref = ref;
      this.statement = statement;
    }

    public SourcePos pos() {
      return ref.pos().orElse(statement.pos());
    }
  }

  /**
   * A statement that declares a name again with a different shape or role
   */
  public static class Conflict {
    public final Symbol symbol;
    public final Statement statement;
    public final String message;

    public Conflict(Symbol symbol, Statement statement, String message) {
      this.symbol = symbol;
      this.statement = statement;
      this.message = message;
    }
  }

  private final List<Symbol> symbols = new ArrayList<Symbol>();
  private final ListMultimap<String, Symbol> byName =
                                  ArrayListMultimap.create();
  private final Map<VariableRef, Symbol> resolved =
                            new IdentityHashMap<VariableRef, Symbol>();
  private final Map<Statement, Symbol> targets =
                            new IdentityHashMap<Statement, Symbol>();
  private final List<UnresolvedRef> unresolved = new ArrayList<UnresolvedRef>();
  private final List<Conflict> conflicts = new ArrayList<Conflict>();

  void addSymbol(Symbol sym) {
    symbols.add(sym);
    byName.put(sym.name(), sym);
  }

  void bind(VariableRef ref, Symbol sym) {
    resolved.put(ref, sym);
  }

  void bindTarget(Statement stmt, Symbol sym) {
    targets.put(stmt, sym);
  }

  void addUnresolved(VariableRef ref, Statement stmt) {
    unresolved.add(new UnresolvedRef(ref, stmt));
  }

  void addConflict(Symbol sym, Statement stmt, String message) {
    conflicts.add(new Conflict(sym, stmt, message));
  }

  /**
   * @return all symbols in declaration order
   */
  public List<Symbol> symbols() {
    return Collections.unmodifiableList(symbols);
  }

  /**
   * @return symbols declared with this name, in declaration order.
   *    Names local to different blocks may be declared more than once.
   */
  public List<Symbol> symbolsNamed(String name) {
    return Collections.unmodifiableList(byName.get(name));
  }

  /**
   * @return the symbol the reference resolved to, or null
   */
  public Symbol lookup(VariableRef ref) {
    return resolved.get(ref);
  }

  /**
   * @return the symbol for the variable at the root of an expression
   *    such as x or x[i][j], or null
   */
  public Symbol baseSymbol(Expression expr) {
    while (expr.kind() == Expression.Kind.INDEX) {
      expr = ((Expression.Index)expr).base();
    }
    if (expr.kind() == Expression.Kind.VARIABLE_REF) {
      return lookup((VariableRef)expr);
    }
    return null;
  }

  /**
   * @return the symbol written by an assignment or sample, or null
   */
  public Symbol target(Statement stmt) {
    return targets.get(stmt);
  }

  public List<UnresolvedRef> unresolved() {
    return Collections.unmodifiableList(unresolved);
  }

  public List<Conflict> conflicts() {
    return Collections.unmodifiableList(conflicts);
  }

  public boolean isComplete() {
    return unresolved.isEmpty();
  }

  /**
   * @return symbols whose containers are declared by indexed writes in
   *         the given loop
   */
  public List<Symbol> implicitDeclarations(Statement.For loop) {
    List<Symbol> result = new ArrayList<Symbol>();
    for (Symbol sym: symbols) {
      if (sym.implicitLoop() == loop) {
        result.add(sym);
      }
    }
    return result;
  }
}
