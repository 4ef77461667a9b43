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

import org.apache.commons.lang3.StringUtils;

import exm.ppl.ast.Expression;
import exm.ppl.ast.Expression.Index;
import exm.ppl.ast.Statement;
import exm.ppl.ast.Statement.For;
import exm.ppl.ast.Statement.Observe;
import exm.ppl.ast.Statement.Sample;
import exm.ppl.frontend.ExprTypes;
import exm.ppl.frontend.lint.StatementWalker.WalkContext;

/**
 * Two random choices that can be reached in the same execution must
 * not share an address.  Addresses are the target name with its index
 * expressions, then any enclosing loop indices they do not mention.
 * Identical constant addresses always collide; identical addresses
 * that vary with loop indices may collide.
 */
public class DuplicateAddressCheck implements LintCheck {

  private static class Choice {
    final Statement stmt;
    final WalkContext wc;
    final String address;
    final boolean constant;

    Choice(Statement stmt, WalkContext wc, String address,
           boolean constant) {
      this.stmt = stmt;
      this.wc = wc;
      this.address = address;
      this.constant = constant;
    }
  }

  @Override
  public String name() {
    return "duplicate-address";
  }

  @Override
  public void check(final LintContext ctx) {
    final List<Choice> choices = new ArrayList<Choice>();
    StatementWalker.walk(ctx.program().body(), new StatementWalker.Visitor() {
      @Override
      public void visit(Statement stmt, WalkContext wc) {
        Expression target;
        if (stmt.kind() == Statement.Kind.SAMPLE) {
          target = ((Sample)stmt).target();
        } else if (stmt.kind() == Statement.Kind.OBSERVE) {
          target = ((Observe)stmt).subject();
        } else {
          return;
        }
        Choice c = choiceFor(stmt, wc, target);
        if (c == null) {
          return;
        }
        for (Choice prev: choices) {
          if (prev.address.equals(c.address) && !prev.wc.exclusiveWith(wc)) {
            report(ctx, prev, c);
            break;
          }
        }
        choices.add(c);
      }
    });
  }

  private static void report(LintContext ctx, Choice prev, Choice c) {
    String msg = "Address " + c.address + " is also used at line " +
                 prev.stmt.pos().line;
    if (c.constant) {
      ctx.error(DiagnosticCode.DUPLICATE_ADDRESS, c.stmt.pos(), msg);
    } else {
      ctx.warning(DiagnosticCode.DUPLICATE_ADDRESS, c.stmt.pos(),
                  msg + " and may collide");
    }
  }

  /**
   * @return null if the target is not a variable or element, since
   *        such subjects get a unique address
   */
  private static Choice choiceFor(Statement stmt, WalkContext wc,
                                  Expression target) {
    List<Expression> components = new ArrayList<Expression>();
    Expression root = target;
    while (root.kind() == Expression.Kind.INDEX) {
      Index index = (Index)root;
      List<Expression> nonSlice = new ArrayList<Expression>();
      for (Expression component: index.indices()) {
        if (component.kind() != Expression.Kind.RANGE) {
          nonSlice.add(component);
        }
      }
      components.addAll(0, nonSlice);
      root = index.base();
    }
    if (root.kind() != Expression.Kind.VARIABLE_REF) {
      return null;
    }

    List<String> parts = new ArrayList<String>();
    for (Expression component: components) {
      parts.add(component.toString());
    }
    for (For loop: wc.loops()) {
      boolean mentioned = false;
      for (Expression component: components) {
        if (ExprTypes.references(component, loop.loopVar())) {
          mentioned = true;
        }
      }
      if (!mentioned) {
        parts.add(loop.loopVar());
      }
    }

    boolean constant = true;
    for (Expression component: components) {
      if (!ExprTypes.collectRefs(component).isEmpty()) {
        constant = false;
      }
    }
    if (parts.size() > components.size()) {
      constant = false;
    }

    String address = root.toString();
    if (!parts.isEmpty()) {
      address += "[" + StringUtils.join(parts, ", ") + "]";
    }
    return new Choice(stmt, wc, address, constant);
  }
}
