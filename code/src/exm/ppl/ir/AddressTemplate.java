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
package exm.ppl.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import exm.ppl.common.exceptions.PPLRuntimeError;

/**
 * Address of a random choice: a name and ordered components whose
 * runtime values select the instance, e.g. y[i, j].  Backends render
 * templates in their own syntax.  Component values are zero-based,
 * whatever the backend's index base.
 */
public class AddressTemplate {
  private final String name;
  private final ImmutableList<IRExpr> components;

  public AddressTemplate(String name, List<IRExpr> components) {
    this.name = name;
    this.components = ImmutableList.copyOf(components);
  }

  public String name() {
    return name;
  }

  public ImmutableList<IRExpr> components() {
    return components;
  }

  /**
   * @return true if the address is the same on every execution
   */
  public boolean isConstant() {
    for (IRExpr c: components) {
      if (c.kind() != IRExpr.Kind.LITERAL) {
        return false;
      }
    }
    return true;
  }

  /**
   * Compute the concrete address for one assignment of the variables
   * used by the components, in the form "name[1,2]".
   */
  public String instantiate(Map<String, Long> bindings) {
    if (components.isEmpty()) {
      return name;
    }
    List<Long> values = new ArrayList<Long>();
    for (IRExpr c: components) {
      values.add(evaluate(c, bindings));
    }
    return name + "[" + StringUtils.join(values, ",") + "]";
  }

  private static long evaluate(IRExpr expr, Map<String, Long> bindings) {
    switch (expr.kind()) {
      case LITERAL: {
        Long v = ((IRExpr.Literal)expr).intValue();
        if (v == null) {
          throw new PPLRuntimeError("Non-integer address component " + expr);
        }
        return v;
      }
      case VAR: {
        Long v = bindings.get(((IRExpr.Var)expr).name());
        if (v == null) {
          throw new PPLRuntimeError("No value bound for " + expr);
        }
        return v;
      }
      case UNARY: {
        IRExpr.Unary u = (IRExpr.Unary)expr;
        long v = evaluate(u.operand(), bindings);
        switch (u.op()) {
          case NEGATE:
            return -v;
          case PLUS:
            return v;
          default:
            throw new PPLRuntimeError("Cannot evaluate " + expr);
        }
      }
      case BINARY: {
        IRExpr.Binary b = (IRExpr.Binary)expr;
        long l = evaluate(b.left(), bindings);
        long r = evaluate(b.right(), bindings);
        switch (b.op()) {
          case PLUS:
            return l + r;
          case MINUS:
            return l - r;
          case MULTIPLY:
            return l * r;
          case FLOOR_DIVIDE:
            return Math.floorDiv(l, r);
          case MODULO:
            return Math.floorMod(l, r);
          default:
            throw new PPLRuntimeError("Cannot evaluate " + expr);
        }
      }
      default:
        throw new PPLRuntimeError("Cannot evaluate address component " +
                                  expr);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AddressTemplate)) {
      return false;
    }
    AddressTemplate other = (AddressTemplate)o;
    return name.equals(other.name) && components.equals(other.components);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, components);
  }

  @Override
  public String toString() {
    if (components.isEmpty()) {
      return name;
    }
    return name + "[" + StringUtils.join(components, ", ") + "]";
  }
}
