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
package exm.ppl.backend.turing;

import com.google.common.collect.ImmutableList;

import exm.ppl.backend.AbstractGenerator;
import exm.ppl.backend.julia.JuliaExprRenderer;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.common.lang.Target;
import exm.ppl.emit.tree.FunctionDef;
import exm.ppl.emit.tree.Line;
import exm.ppl.emit.tree.Sequence;
import exm.ppl.emit.tree.Syntax;
import exm.ppl.ir.IRProgram;
import exm.ppl.ir.IRStatement;

/**
 * Turing.jl models.  Turing addresses random choices by the assigned
 * variable, so samples and observations are both target ~ distribution
 * and no address strings are generated.
 */
public class TuringGenerator extends AbstractGenerator {

  public TuringGenerator() {
    this(BackendDescriptor.forTarget(Target.TURING));
  }

  private TuringGenerator(BackendDescriptor descriptor) {
    super(descriptor, new JuliaExprRenderer(descriptor),
          TuringDistributions.TABLE);
  }

  @Override
  protected Syntax syntax() {
    return Syntax.JULIA;
  }

  @Override
  public void emitProgram(IRProgram program) throws CodegenError {
    programName = program.name();
    addPreamble("using Turing");
    FunctionDef model = new FunctionDef("@model", program.name(),
                                ImmutableList.copyOf(program.params()));
    emitBlock(program.body(), model.getBody());
    root.add(model);
    logger.debug("Turing: generated model " + program.name());
  }

  @Override
  protected void emitSample(IRStatement.Sample sample, Sequence out)
                                                throws CodegenError {
    out.add(new Line(emitExpression(sample.target()) + " ~ " +
                     renderDistribution(sample, sample.distribution())));
  }

  @Override
  protected void emitObserve(IRStatement.Observe observe, Sequence out)
                                                throws CodegenError {
    out.add(new Line(emitExpression(observe.subject()) + " ~ " +
                     renderDistribution(observe, observe.distribution())));
  }

  @Override
  protected void emitFactor(IRStatement.Factor factor, Sequence out)
                                                throws CodegenError {
    out.add(new Line(table.lookup(BackendDescriptor.FACTOR).render(
        ImmutableList.of(emitExpression(factor.value())))));
  }
}
