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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.Symbol;

/**
 * One lexical scope.  Lookups fall back to the enclosing scope; names
 * declared here are invisible to the parent.
 */
public class Scope {
  private final Scope parent;
  private final int depth;
  private final Map<String, Symbol> symbols =
                            new LinkedHashMap<String, Symbol>();

  public Scope() {
    this(null);
  }

  private Scope(Scope parent) {
    this.parent = parent;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  public Scope makeChildScope() {
    return new Scope(this);
  }

  public Scope parent() {
    return parent;
  }

  /**
   * @return nesting depth, 0 for the model's top-level scope
   */
  public int depth() {
    return depth;
  }

  /**
   * @return the symbol visible under this name, or null
   */
  public Symbol lookup(String name) {
    Symbol sym = symbols.get(name);
    if (sym != null) {
      return sym;
    } else if (parent != null) {
      return parent.lookup(name);
    } else {
      return null;
    }
  }

  /**
   * @return the symbol declared in this scope only, or null
   */
  public Symbol lookupLocal(String name) {
    return symbols.get(name);
  }

  public void declare(Symbol sym) {
    Symbol prev = symbols.put(sym.name(), sym);
    if (prev != null && prev != sym) {
      throw new PPLRuntimeError("Redeclared " + sym.name() + " in scope " +
                                "at depth " + depth);
    }
  }

  /**
   * Declare at an ancestor scope
   * @param levelsUp 0 for this scope
   */
  public void declare(Symbol sym, int levelsUp) {
    Scope curr = this;
    for (int i = 0; i < levelsUp; i++) {
      curr = curr.parent;
      if (curr == null) {
        throw new PPLRuntimeError("Scope didn't have " + levelsUp +
                                  " ancestors");
      }
    }
    curr.declare(sym);
  }

  public Collection<Symbol> localSymbols() {
    return symbols.values();
  }
}
