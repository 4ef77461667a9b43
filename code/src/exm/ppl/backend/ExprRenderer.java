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
package exm.ppl.backend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.ppl.ast.SourcePos;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.ir.AddressTemplate;
import exm.ppl.ir.IRExpr;

/**
 * Renders IR expressions as target-language text.  While substitutions
 * are installed, hoisted sub-expressions render as their temporaries.
 */
public abstract class ExprRenderer {

  protected final BackendDescriptor backend;

  private final Map<IRExpr, String> substitutions =
                                          new HashMap<IRExpr, String>();

  protected ExprRenderer(BackendDescriptor backend) {
    this.backend = backend;
  }

  public void setSubstitutions(Map<IRExpr, String> subs) {
    substitutions.clear();
    substitutions.putAll(subs);
  }

  public void clearSubstitutions() {
    substitutions.clear();
  }

  public String render(IRExpr expr) {
    String temp = substitutions.get(expr);
    if (temp != null) {
      return temp;
    }
    switch (expr.kind()) {
      case LITERAL:
        return literal((IRExpr.Literal)expr);
      case VAR:
        return ((IRExpr.Var)expr).name();
      case INDEX:
        return index((IRExpr.Index)expr);
      case BINARY:
        return binary((IRExpr.Binary)expr);
      case UNARY:
        return unary((IRExpr.Unary)expr);
      case CALL:
        return call((IRExpr.Call)expr);
      case RANGE:
        return slice((IRExpr.Range)expr);
      case DISTRIBUTION:
        throw new PPLRuntimeError("Distribution " + expr +
                                  " rendered as a value");
      default:
        throw new PPLRuntimeError("Unexpected IR expression kind " +
                                  expr.kind());
    }
  }

  /**
   * Render an operand, parenthesized unless it is atomic
   */
  protected String operand(IRExpr expr) {
    String s = render(expr);
    if (substitutions.containsKey(expr)) {
      return s;
    }
    switch (expr.kind()) {
      case BINARY:
      case UNARY:
        return "(" + s + ")";
      default:
        return s;
    }
  }

  protected List<String> renderAll(List<IRExpr> exprs) {
    List<String> result = new ArrayList<String>(exprs.size());
    for (IRExpr e: exprs) {
      result.add(render(e));
    }
    return result;
  }

  /**
   * Render a distribution through the backend's table
   * @throws CodegenError if the backend has no template for it
   */
  public String distribution(SourcePos pos, IRExpr.Distribution d,
                    DistributionTable table) throws CodegenError {
    DistributionTemplate template = table.lookup(d.name());
    if (template == null) {
      throw CodegenError.unsupported(pos, d.name(), backend.displayName());
    }
    List<String> args = new ArrayList<String>();
    for (IRExpr arg: d.args()) {
      if (arg.kind() == IRExpr.Kind.DISTRIBUTION) {
        args.add(distribution(pos, (IRExpr.Distribution)arg, table));
      } else {
        args.add(render(arg));
      }
    }
    String result = template.render(args);
    distributionRendered(result);
    return result;
  }

  /**
   * Hook for renderers that track what generated code uses
   */
  protected void distributionRendered(String text) {
  }

  protected abstract String literal(IRExpr.Literal lit);

  protected abstract String index(IRExpr.Index index);

  protected abstract String binary(IRExpr.Binary binary);

  protected abstract String unary(IRExpr.Unary unary);

  protected abstract String call(IRExpr.Call call);

  /**
   * Render a range used as an index slice
   */
  protected abstract String slice(IRExpr.Range range);

  /**
   * Render the iteration space of a loop over a range with all bounds
   */
  public abstract String loopIteration(IRExpr.Range range);

  /**
   * Render an address as a string expression of the target language
   */
  public abstract String address(AddressTemplate address);
}
