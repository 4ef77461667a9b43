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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.ppl.backend.AbstractGenerator;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.common.lang.Target;
import exm.ppl.emit.tree.Assign;
import exm.ppl.emit.tree.FunctionDef;
import exm.ppl.emit.tree.Line;
import exm.ppl.emit.tree.Sequence;
import exm.ppl.emit.tree.Syntax;
import exm.ppl.ir.IRProgram;
import exm.ppl.ir.IRStatement;

/**
 * Pyro models as plain Python functions.  Random choices are named by
 * address strings passed to pyro.sample; observed values are passed as
 * obs=.  Element-wise deterministic loops become tensor slices when
 * vectorization is enabled.
 */
public class PyroGenerator extends AbstractGenerator {

  private final PythonExprRenderer python;
  private final boolean vectorize;

  public PyroGenerator() {
    this(BackendDescriptor.forTarget(Target.PYRO));
  }

  private PyroGenerator(BackendDescriptor descriptor) {
    this(descriptor, new PythonExprRenderer(descriptor));
  }

  private PyroGenerator(BackendDescriptor descriptor,
                        PythonExprRenderer python) {
    super(descriptor, python, PyroDistributions.TABLE);
    this.python = python;
    this.vectorize = LoopVectorizer.enabled();
  }

  @Override
  protected Syntax syntax() {
    return Syntax.PYTHON;
  }

  @Override
  public void emitProgram(IRProgram program) throws CodegenError {
    programName = program.name();
    addPreamble("import pyro");
    addPreamble("import pyro.distributions as dist");
    FunctionDef model = new FunctionDef(null, program.name(),
                                ImmutableList.copyOf(program.params()));
    emitBlock(program.body(), model.getBody());
    root.add(model);
    logger.debug("Pyro: generated model " + program.name());
  }

  @Override
  protected Set<String> finalPreamble() {
    Set<String> lines = new LinkedHashSet<String>();
    if (python.usesMath()) {
      lines.add("import math");
    }
    if (python.usesTorch()) {
      lines.add("import torch");
    }
    return lines;
  }

  @Override
  protected void emitFor(IRStatement.For loop, Sequence out)
                                          throws CodegenError {
    if (vectorize) {
      List<IRStatement.Assign> sliced =
                      LoopVectorizer.tryVectorize(logger, loop);
      if (sliced != null) {
        for (IRStatement.Assign a: sliced) {
          emitStatement(a, out);
        }
        return;
      }
    }
    super.emitFor(loop, out);
  }

  @Override
  protected void emitSample(IRStatement.Sample sample, Sequence out)
                                                throws CodegenError {
    String address = renderer.address(sample.address());
    String dist = renderDistribution(sample, sample.distribution());
    if (sample.isObserved()) {
      out.add(new Line("pyro.sample(" + address + ", " + dist + ", obs=" +
                       emitExpression(sample.target()) + ")"));
    } else {
      out.add(new Assign(emitExpression(sample.target()),
                         "pyro.sample(" + address + ", " + dist + ")"));
    }
  }

  @Override
  protected void emitObserve(IRStatement.Observe observe, Sequence out)
                                                throws CodegenError {
    out.add(new Line("pyro.sample(" + renderer.address(observe.address()) +
                     ", " + renderDistribution(observe,
                                               observe.distribution()) +
                     ", obs=" + emitExpression(observe.subject()) + ")"));
  }

  @Override
  protected void emitFactor(IRStatement.Factor factor, Sequence out)
                                                throws CodegenError {
    out.add(new Line(table.lookup(BackendDescriptor.FACTOR).render(
        ImmutableList.of(renderer.address(factor.address()),
                         emitExpression(factor.value())))));
  }
}
