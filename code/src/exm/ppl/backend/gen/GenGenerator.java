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
package exm.ppl.backend.gen;

import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.ppl.backend.AbstractGenerator;
import exm.ppl.backend.julia.JuliaExprRenderer;
import exm.ppl.common.Settings;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Target;
import exm.ppl.emit.tree.Assign;
import exm.ppl.emit.tree.FunctionDef;
import exm.ppl.emit.tree.Line;
import exm.ppl.emit.tree.Sequence;
import exm.ppl.emit.tree.Syntax;
import exm.ppl.ir.AddressTemplate;
import exm.ppl.ir.IRExpr;
import exm.ppl.ir.IRProgram;
import exm.ppl.ir.IRStatement;

/**
 * Gen.jl generative functions.  Every random choice has an explicit
 * string address.  Observations are not part of the model: a second
 * function collects the observed values into a choice map, which the
 * caller passes as constraints to inference.
 */
public class GenGenerator extends AbstractGenerator {

  private final String constraintsName;
  private final String aggregatorName;
  private boolean usesCategorical = false;

  public GenGenerator() {
    this(BackendDescriptor.forTarget(Target.GEN));
  }

  private GenGenerator(BackendDescriptor descriptor) {
    super(descriptor, new JuliaExprRenderer(descriptor),
          GenDistributions.TABLE);
    this.constraintsName = Settings.get(Settings.GEN_CONSTRAINTS_NAME);
    this.aggregatorName = Settings.get(Settings.GEN_AGGREGATOR_NAME);
  }

  @Override
  protected Syntax syntax() {
    return Syntax.JULIA;
  }

  @Override
  public void emitProgram(IRProgram program) throws CodegenError {
    programName = program.name();
    addPreamble("using Gen");
    addPreamble("using Distributions");

    FunctionDef model = new FunctionDef("@gen", program.name(),
                                ImmutableList.copyOf(program.params()));
    emitBlock(program.body(), model.getBody());
    root.add(model);

    root.add(new Line(""));
    root.add(new Assign(constraintsName, "Gen.choicemap()"));
    root.add(new Line(""));
    ConstraintAggregator aggregator =
              new ConstraintAggregator(renderer, constraintsName);
    root.add(aggregator.build(program, aggregatorName));
    logger.debug("Gen: generated model " + program.name() + " and " +
                 aggregatorName);
  }

  @Override
  protected Set<String> finalPreamble() {
    if (usesCategorical) {
      return ImmutableSet.of("", GenDistributions.LABELED_CATEGORICAL);
    }
    return ImmutableSet.of();
  }

  @Override
  protected void emitSample(IRStatement.Sample sample, Sequence out)
                                                throws CodegenError {
    out.add(new Assign(emitExpression(sample.target()),
                       choice(sample, sample.address(),
                              sample.distribution())));
  }

  @Override
  protected void emitObserve(IRStatement.Observe observe, Sequence out)
                                                throws CodegenError {
    out.add(new Line(choice(observe, observe.address(),
                            observe.distribution())));
  }

  /**
   * Gen has no factor statement; the linter reports this before
   * translation
   */
  @Override
  protected void emitFactor(IRStatement.Factor factor, Sequence out)
                                                throws CodegenError {
    throw CodegenError.unsupported(factor.pos(), BackendDescriptor.FACTOR,
                                   descriptor.displayName());
  }

  private String choice(IRStatement stmt, AddressTemplate address,
        IRExpr.Distribution dist) throws CodegenError {
    if (dist.name().equals(Distributions.CATEGORICAL)) {
      usesCategorical = true;
    }
    return "{" + renderer.address(address) + "} ~ " +
           renderDistribution(stmt, dist);
  }
}
