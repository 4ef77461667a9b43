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

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * What a target framework can express: index base, addressing scheme
 * and which catalog constructs it supports.
 */
public class BackendDescriptor {

  public static enum AddressingScheme {
    /** The variable name identifies the random choice */
    IMPLICIT,
    /** Each random choice carries an explicit string address */
    EXPLICIT_STRING,
  }

  public static enum Support {
    NATIVE,
    /** Supported through an equivalent rewrite */
    REWRITE,
    UNSUPPORTED,
  }

  /** Construct name for factor statements */
  public static final String FACTOR = "factor";

  private static final ImmutableMap<Target, BackendDescriptor> DESCRIPTORS;

  static {
    Set<String> all = ImmutableSet.<String>builder()
        .addAll(Distributions.names()).add(FACTOR).build();

    BackendDescriptor turing = new BackendDescriptor(Target.TURING, "Turing",
        1, AddressingScheme.IMPLICIT, false, all,
        ImmutableMap.of(
          "HalfCauchy", "rewritten as a Cauchy truncated to [0, Inf)",
          "HalfNormal", "rewritten as a Normal truncated to [0, Inf)",
          FACTOR, "rewritten as Turing.@addlogprob!"),
        ImmutableSet.<String>of());

    BackendDescriptor gen = new BackendDescriptor(Target.GEN, "Gen",
        1, AddressingScheme.EXPLICIT_STRING, false, all,
        ImmutableMap.<String, String>of(),
        ImmutableSet.of("Dirac", "HalfCauchy", "HalfNormal", "StudentT",
                        "HyperGeometric", Distributions.TRUNCATED,
                        Distributions.IID, FACTOR));

    BackendDescriptor pyro = new BackendDescriptor(Target.PYRO, "Pyro",
        0, AddressingScheme.EXPLICIT_STRING, true, all,
        ImmutableMap.<String, String>of(),
        ImmutableSet.of("DiscreteUniform", "HyperGeometric",
                        Distributions.TRUNCATED));

    DESCRIPTORS = ImmutableMap.of(Target.TURING, turing, Target.GEN, gen,
                                  Target.PYRO, pyro);
  }

  private final Target target;
  private final String displayName;
  private final int indexBase;
  private final AddressingScheme addressing;
  private final boolean integerIndices;
  private final ImmutableSet<String> supported;
  private final ImmutableMap<String, String> rewrites;

  private BackendDescriptor(Target target, String displayName, int indexBase,
          AddressingScheme addressing, boolean integerIndices,
          Set<String> all, Map<String, String> rewrites,
          Set<String> unsupported) {
    this.target = target;
    this.displayName = displayName;
    this.indexBase = indexBase;
    this.addressing = addressing;
    this.integerIndices = integerIndices;
    ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (String construct: all) {
      if (!unsupported.contains(construct) &&
          !rewrites.containsKey(construct)) {
        b.add(construct);
      }
    }
    this.supported = b.build();
    this.rewrites = ImmutableMap.copyOf(rewrites);
  }

  public static BackendDescriptor forTarget(Target target) {
    return DESCRIPTORS.get(target);
  }

  public Target target() {
    return target;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * @return 0 or 1
   */
  public int indexBase() {
    return indexBase;
  }

  public AddressingScheme addressing() {
    return addressing;
  }

  /**
   * @return true if host arrays reject non-integer indices, so indices
   *    tagged for truncation need an explicit cast
   */
  public boolean requiresIntegerIndices() {
    return integerIndices;
  }

  /**
   * @return constructs supported without rewriting
   */
  public ImmutableSet<String> supported() {
    return supported;
  }

  /**
   * @param construct distribution name or {@link #FACTOR}
   */
  public Support support(String construct) {
    if (supported.contains(construct)) {
      return Support.NATIVE;
    } else if (rewrites.containsKey(construct)) {
      return Support.REWRITE;
    } else {
      return Support.UNSUPPORTED;
    }
  }

  /**
   * @return description of the rewrite applied, or null
   */
  public String rewriteDescription(String construct) {
    return rewrites.get(construct);
  }

  @Override
  public String toString() {
    return displayName;
  }
}
