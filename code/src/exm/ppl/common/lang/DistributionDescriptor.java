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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Canonical description of a catalog distribution.
 */
public class DistributionDescriptor {

  /**
   * Meaning of a parameter, used in diagnostics
   */
  public static enum ParamRole {
    VALUE,
    LOCATION,
    MEAN,
    SCALE,
    STANDARD_DEVIATION,
    RATE,
    SHAPE,
    ALPHA,
    BETA,
    LOWER,
    UPPER,
    PROBABILITY,
    PROBABILITIES,
    TRIALS,
    DEGREES_OF_FREEDOM,
    SUCCESSES,
    FAILURES,
    DRAWS,
    CONCENTRATION,
    COVARIANCE,
    SIZE,
    /** Inner distribution of a wrapper */
    DISTRIBUTION;

    @Override
    public String toString() {
      return name().toLowerCase().replace('_', ' ');
    }
  }

  public static class Param {
    public final ParamRole role;
    public final Shape.Kind shape;

    public Param(ParamRole role, Shape.Kind shape) {
      this.role = role;
      this.shape = shape;
    }

    @Override
    public String toString() {
      return role + " (" + shape.toString().toLowerCase() + ")";
    }
  }

  private final String name;
  private final ImmutableList<Param> params;
  private final Shape.Kind resultShape;
  private final boolean discrete;

  public DistributionDescriptor(String name, List<Param> params,
                                Shape.Kind resultShape, boolean discrete) {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.resultShape = resultShape;
    this.discrete = discrete;
  }

  public String name() {
    return name;
  }

  public ImmutableList<Param> params() {
    return params;
  }

  public int arity() {
    return params.size();
  }

  /**
   * @return shape of one draw
   */
  public Shape.Kind resultShape() {
    return resultShape;
  }

  /**
   * @return true if draws are integer or boolean valued
   */
  public boolean isDiscrete() {
    return discrete;
  }

  /**
   * @return true for wrappers whose first argument is a distribution
   */
  public boolean isWrapper() {
    return !params.isEmpty() &&
           params.get(0).role == ParamRole.DISTRIBUTION;
  }

  /**
   * @return signature for messages, e.g. Normal(mean, standard deviation)
   */
  public String signature() {
    StringBuilder sb = new StringBuilder(name).append("(");
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(params.get(i).role);
    }
    return sb.append(")").toString();
  }

  @Override
  public String toString() {
    return signature();
  }
}
