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

import com.google.common.collect.ImmutableList;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.For;
import exm.ppl.ast.Statement.If;

/**
 * Visits statements in source order, tracking the enclosing loops and
 * if branches of each.
 */
public class StatementWalker {

  public static interface Visitor {
    public void visit(Statement stmt, WalkContext ctx);
  }

  /**
   * Control-flow position of a statement
   */
  public static class WalkContext {
    private final ImmutableList<For> loops;
    private final ImmutableList<If> branches;
    /** Parallel to branches: true for the then-branch */
    private final ImmutableList<Boolean> thenBranch;

    static final WalkContext TOP = new WalkContext(ImmutableList.<For>of(),
        ImmutableList.<If>of(), ImmutableList.<Boolean>of());

    private WalkContext(ImmutableList<For> loops, ImmutableList<If> branches,
                        ImmutableList<Boolean> thenBranch) {
      this.loops = loops;
      this.branches = branches;
      this.thenBranch = thenBranch;
    }

    WalkContext enterLoop(For loop) {
      return new WalkContext(ImmutableList.<For>builder().addAll(loops)
          .add(loop).build(), branches, thenBranch);
    }

    WalkContext enterBranch(If stmt, boolean then) {
      return new WalkContext(loops,
          ImmutableList.<If>builder().addAll(branches).add(stmt).build(),
          ImmutableList.<Boolean>builder().addAll(thenBranch)
                                          .add(then).build());
    }

    /**
     * @return enclosing loops, outermost first
     */
    public ImmutableList<For> loops() {
      return loops;
    }

    /**
     * @return enclosing if statements, outermost first
     */
    public ImmutableList<If> branches() {
      return branches;
    }

    public boolean inLoop() {
      return !loops.isEmpty();
    }

    /**
     * @return true if no execution reaches both positions, because they
     *        are in different branches of the same if
     */
    public boolean exclusiveWith(WalkContext other) {
      int n = Math.min(branches.size(), other.branches.size());
      for (int i = 0; i < n; i++) {
        if (branches.get(i) != other.branches.get(i)) {
          return false;
        }
        if (!thenBranch.get(i).equals(other.thenBranch.get(i))) {
          return true;
        }
      }
      return false;
    }
  }

  public static void walk(List<Statement> block, Visitor visitor) {
    walk(block, visitor, WalkContext.TOP);
  }

  private static void walk(List<Statement> block, Visitor visitor,
                           WalkContext ctx) {
    for (Statement stmt: block) {
      visitor.visit(stmt, ctx);
      switch (stmt.kind()) {
        case IF: {
          If ifStmt = (If)stmt;
          walk(ifStmt.thenBlock(), visitor, ctx.enterBranch(ifStmt, true));
          walk(ifStmt.elseBlock(), visitor, ctx.enterBranch(ifStmt, false));
          break;
        }
        case FOR: {
          For loop = (For)stmt;
          walk(loop.body(), visitor, ctx.enterLoop(loop));
          break;
        }
        default:
          break;
      }
    }
  }

  /**
   * @return the expression and all its sub-expressions, parents first
   */
  public static List<Expression> subExpressions(Expression root) {
    List<Expression> result = new ArrayList<Expression>();
    addSubExpressions(root, result);
    return result;
  }

  private static void addSubExpressions(Expression expr,
                                        List<Expression> result) {
    result.add(expr);
    for (Expression child: expr.children()) {
      addSubExpressions(child, result);
    }
  }
}
