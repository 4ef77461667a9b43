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
package exm.ppl.backend.julia;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.ppl.backend.ExprRenderer;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.ir.AddressTemplate;
import exm.ppl.ir.IRExpr;
import exm.ppl.ir.IndexComponent;

/**
 * Julia expressions for the one-based Julia backends.  Index components
 * get their +1 offset here; truncation tags are not needed since
 * discrete samplers return integers.
 */
public class JuliaExprRenderer extends ExprRenderer {

  public JuliaExprRenderer(BackendDescriptor backend) {
    super(backend);
    assert(backend.indexBase() == 1);
  }

  @Override
  protected String literal(IRExpr.Literal lit) {
    return lit.text();
  }

  @Override
  protected String index(IRExpr.Index index) {
    List<String> parts = new ArrayList<String>();
    for (IndexComponent c: index.components()) {
      if (c.isSlice()) {
        parts.add(slice((IRExpr.Range)c.expr()));
      } else if (c.needsOffset()) {
        parts.add("(" + render(c.expr()) + ")+1");
      } else {
        parts.add(render(c.expr()));
      }
    }
    return operand(index.base()) + "[" + StringUtils.join(parts, ", ") + "]";
  }

  @Override
  protected String binary(IRExpr.Binary binary) {
    String l = operand(binary.left());
    String r = operand(binary.right());
    switch (binary.op()) {
      case FLOOR_DIVIDE:
        return "div(" + render(binary.left()) + ", " +
                        render(binary.right()) + ")";
      case MODULO:
        return "mod(" + render(binary.left()) + ", " +
                        render(binary.right()) + ")";
      case POWER:
        return l + " ^ " + r;
      case AND:
        return l + " && " + r;
      case OR:
        return l + " || " + r;
      default:
        return l + " " + binary.op().symbol() + " " + r;
    }
  }

  @Override
  protected String unary(IRExpr.Unary unary) {
    String operand = render(unary.operand());
    switch (unary.op()) {
      case NEGATE:
        return "-(" + operand + ")";
      case PLUS:
        return "+(" + operand + ")";
      case NOT:
        return "!(" + operand + ")";
      default:
        throw new PPLRuntimeError("Unknown unary operator " + unary.op());
    }
  }

  @Override
  protected String call(IRExpr.Call call) {
    List<String> args = renderAll(call.args());
    switch (call.function()) {
      case VECTOR:
      case MATRIX: {
        int rank = call.function().allocationRank();
        String fill;
        if (args.size() > rank) {
          fill = args.get(rank);
        } else {
          fill = call.integerElements() ? "0" : "0.0";
        }
        return "fill(" + fill + ", " +
               StringUtils.join(args.subList(0, rank), ", ") + ")";
      }
      case LEN:
        return "length(" + args.get(0) + ")";
      case FLOOR:
        return "floor(Int, " + args.get(0) + ")";
      case ROUND:
        return "round(Int, " + args.get(0) + ")";
      case ABS:
      case MIN:
      case MAX:
      case SUM:
      case EXP:
      case LOG:
      case SQRT:
        return call.function().sourceName() + "(" +
               StringUtils.join(args, ", ") + ")";
      default:
        throw new PPLRuntimeError("Unknown builtin " + call.function());
    }
  }

  /**
   * Zero-based exclusive source bounds become one-based inclusive
   * bounds: lo:hi is (lo)+1:hi
   */
  @Override
  protected String slice(IRExpr.Range range) {
    if (range.isFullSlice()) {
      return ":";
    }
    String lo = range.start() == null ? "begin" :
                "(" + render(range.start()) + ")+1";
    String hi = range.stop() == null ? "end" : render(range.stop());
    if (range.step() == null) {
      return lo + ":" + hi;
    }
    return lo + ":" + render(range.step()) + ":" + hi;
  }

  @Override
  public String loopIteration(IRExpr.Range range) {
    Long step = range.constantStep();
    String last = step != null && step < 0 ?
                  "(" + render(range.stop()) + ")+1" :
                  "(" + render(range.stop()) + ")-1";
    return render(range.start()) + ":" + render(range.step()) + ":" + last;
  }

  /**
   * "name[$(i),$(j)]", component values zero-based
   */
  @Override
  public String address(AddressTemplate address) {
    if (address.components().isEmpty()) {
      return "\"" + address.name() + "\"";
    }
    List<String> parts = new ArrayList<String>();
    for (IRExpr c: address.components()) {
      if (c.kind() == IRExpr.Kind.LITERAL) {
        parts.add(render(c));
      } else {
        parts.add("$(" + render(c) + ")");
      }
    }
    return "\"" + address.name() + "[" + StringUtils.join(parts, ",") + "]\"";
  }
}
