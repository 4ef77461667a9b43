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
package exm.ppl.common.lang;

import static exm.ppl.common.lang.Shape.Kind.MATRIX;
import static exm.ppl.common.lang.Shape.Kind.SCALAR;
import static exm.ppl.common.lang.Shape.Kind.UNKNOWN;
import static exm.ppl.common.lang.Shape.Kind.VECTOR;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

import exm.ppl.common.lang.DistributionDescriptor.Param;
import exm.ppl.common.lang.DistributionDescriptor.ParamRole;

/**
 * The fixed catalog of distributions the source language supports.
 */
public class Distributions {

  public static final String TRUNCATED = "Truncated";
  public static final String CATEGORICAL = "Categorical";
  public static final String IID = "IID";

  private static final ImmutableMap<String, DistributionDescriptor> CATALOG;

  static {
    ImmutableMap.Builder<String, DistributionDescriptor> b =
                                              ImmutableMap.builder();
    // Continuous
    add(b, "Dirac", SCALAR, false, ParamRole.VALUE, UNKNOWN);
    add(b, "Normal", SCALAR, false,
        ParamRole.MEAN, SCALAR, ParamRole.STANDARD_DEVIATION, SCALAR);
    add(b, "Beta", SCALAR, false,
        ParamRole.ALPHA, SCALAR, ParamRole.BETA, SCALAR);
    add(b, "Cauchy", SCALAR, false,
        ParamRole.LOCATION, SCALAR, ParamRole.SCALE, SCALAR);
    add(b, "Exponential", SCALAR, false, ParamRole.RATE, SCALAR);
    add(b, "Gamma", SCALAR, false,
        ParamRole.SHAPE, SCALAR, ParamRole.RATE, SCALAR);
    add(b, "HalfCauchy", SCALAR, false, ParamRole.SCALE, SCALAR);
    add(b, "HalfNormal", SCALAR, false, ParamRole.SCALE, SCALAR);
    add(b, "InverseGamma", SCALAR, false,
        ParamRole.SHAPE, SCALAR, ParamRole.SCALE, SCALAR);
    add(b, "StudentT", SCALAR, false,
        ParamRole.DEGREES_OF_FREEDOM, SCALAR);
    add(b, "Uniform", SCALAR, false,
        ParamRole.LOWER, SCALAR, ParamRole.UPPER, SCALAR);

    // Discrete
    add(b, "Bernoulli", SCALAR, true, ParamRole.PROBABILITY, SCALAR);
    add(b, "Binomial", SCALAR, true,
        ParamRole.TRIALS, SCALAR, ParamRole.PROBABILITY, SCALAR);
    add(b, "DiscreteUniform", SCALAR, true,
        ParamRole.LOWER, SCALAR, ParamRole.UPPER, SCALAR);
    add(b, "Geometric", SCALAR, true, ParamRole.PROBABILITY, SCALAR);
    add(b, "HyperGeometric", SCALAR, true, ParamRole.SUCCESSES, SCALAR,
        ParamRole.FAILURES, SCALAR, ParamRole.DRAWS, SCALAR);
    add(b, "Poisson", SCALAR, true, ParamRole.RATE, SCALAR);
    add(b, CATEGORICAL, SCALAR, true, ParamRole.PROBABILITIES, VECTOR);

    // Multivariate
    add(b, "Dirichlet", VECTOR, false, ParamRole.CONCENTRATION, VECTOR);
    add(b, "MultivariateNormal", VECTOR, false,
        ParamRole.MEAN, VECTOR, ParamRole.COVARIANCE, MATRIX);

    // Wrapper: result shape and discreteness are those of the inner
    // distribution, which the descriptor cannot know
    add(b, TRUNCATED, SCALAR, false, ParamRole.DISTRIBUTION, UNKNOWN,
        ParamRole.LOWER, SCALAR, ParamRole.UPPER, SCALAR);
    // Wrapper: a vector of independent draws of the inner distribution
    add(b, IID, VECTOR, false, ParamRole.DISTRIBUTION, UNKNOWN,
        ParamRole.SIZE, SCALAR);
    CATALOG = b.build();
  }

  /**
   * @param paramSpec alternating ParamRole and Shape.Kind
   */
  private static void add(
          ImmutableMap.Builder<String, DistributionDescriptor> b,
          String name, Shape.Kind result, boolean discrete,
          Object... paramSpec) {
    assert(paramSpec.length % 2 == 0);
    List<Param> params = new ArrayList<Param>();
    for (int i = 0; i < paramSpec.length; i += 2) {
      params.add(new Param((ParamRole)paramSpec[i],
                           (Shape.Kind)paramSpec[i + 1]));
    }
    b.put(name, new DistributionDescriptor(name, params, result, discrete));
  }

  /**
   * @return descriptor, or null if name is not in the catalog
   */
  public static DistributionDescriptor lookup(String name) {
    return CATALOG.get(name);
  }

  public static boolean isDistribution(String name) {
    return CATALOG.containsKey(name);
  }

  public static Set<String> names() {
    return CATALOG.keySet();
  }
}
