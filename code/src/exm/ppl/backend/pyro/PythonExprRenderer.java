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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.ppl.backend.ExprRenderer;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.ir.AddressTemplate;
import exm.ppl.ir.IRExpr;
import exm.ppl.ir.IndexComponent;

/**
 * Python expressions over torch tensors.  Indices stay zero-based;
 * components tagged for truncation are cast with int(), since tensors
 * reject float indices.
 */
public class PythonExprRenderer extends ExprRenderer {

  private boolean usesTorch = false;
  private boolean usesMath = false;

  public PythonExprRenderer(BackendDescriptor backend) {
    super(backend);
    assert(backend.indexBase() == 0);
  }

  public boolean usesTorch() {
    return usesTorch;
  }

  public boolean usesMath() {
    return usesMath;
  }

  @Override
  protected void distributionRendered(String text) {
    if (text.contains("torch.")) {
      usesTorch = true;
    }
  }

  @Override
  protected String literal(IRExpr.Literal lit) {
    switch (lit.type()) {
      case BOOL:
        return Boolean.parseBoolean(lit.text()) ? "True" : "False";
      default:
        return lit.text();
    }
  }

  @Override
  protected String index(IRExpr.Index index) {
    List<String> parts = new ArrayList<String>();
    for (IndexComponent c: index.components()) {
      if (c.isSlice()) {
        parts.add(slice((IRExpr.Range)c.expr()));
      } else if (c.requiresTruncation() &&
                 backend.requiresIntegerIndices()) {
        parts.add("int(" + render(c.expr()) + ")");
      } else {
        parts.add(render(c.expr()));
      }
    }
    return operand(index.base()) + "[" + StringUtils.join(parts, ", ") + "]";
  }

  @Override
  protected String binary(IRExpr.Binary binary) {
    return operand(binary.left()) + " " + binary.op().symbol() + " " +
           operand(binary.right());
  }

  @Override
  protected String unary(IRExpr.Unary unary) {
    switch (unary.op()) {
      case NEGATE:
        return "-" + operand(unary.operand());
      case PLUS:
        return "+" + operand(unary.operand());
      case NOT:
        return "not " + operand(unary.operand());
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
        usesTorch = true;
        int rank = call.function().allocationRank();
        String dims = StringUtils.join(args.subList(0, rank), ", ");
        String dtype = call.integerElements() ? ", dtype=torch.long" : "";
        if (args.size() > rank) {
          String shape = rank == 1 ? "(" + dims + ",)" : "(" + dims + ")";
          return "torch.full(" + shape + ", " + args.get(rank) + dtype + ")";
        }
        return "torch.zeros(" + dims + dtype + ")";
      }
      case EXP:
      case LOG:
      case SQRT:
      case FLOOR:
        usesMath = true;
        return "math." + call.function().sourceName() + "(" +
               args.get(0) + ")";
      case LEN:
      case ABS:
      case MIN:
      case MAX:
      case SUM:
      case ROUND:
        return call.function().sourceName() + "(" +
               StringUtils.join(args, ", ") + ")";
      default:
        throw new PPLRuntimeError("Unknown builtin " + call.function());
    }
  }

  /**
   * Source slices are already start:stop:step with exclusive stop
   */
  @Override
  protected String slice(IRExpr.Range range) {
    if (range.isFullSlice()) {
      return ":";
    }
    String s = (range.start() == null ? "" : render(range.start())) + ":" +
               (range.stop() == null ? "" : render(range.stop()));
    if (range.step() != null) {
      s += ":" + render(range.step());
    }
    return s;
  }

  @Override
  public String loopIteration(IRExpr.Range range) {
    Long step = range.constantStep();
    if (step != null && step == 1) {
      return "range(" + render(range.start()) + ", " +
             render(range.stop()) + ")";
    }
    return "range(" + render(range.start()) + ", " + render(range.stop()) +
           ", " + render(range.step()) + ")";
  }

  /**
   * f"name[{i},{j}]", or a plain string if no component varies
   */
  @Override
  public String address(AddressTemplate address) {
    if (address.components().isEmpty()) {
      return "\"" + address.name() + "\"";
    }
    List<String> parts = new ArrayList<String>();
    boolean constant = true;
    for (IRExpr c: address.components()) {
      if (c.kind() == IRExpr.Kind.LITERAL) {
        parts.add(render(c));
      } else {
        parts.add("{" + render(c) + "}");
        constant = false;
      }
    }
    return (constant ? "" : "f") + "\"" + address.name() + "[" +
           StringUtils.join(parts, ",") + "]\"";
  }
}
