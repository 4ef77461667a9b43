package exm.ppl.backend.turing;

import exm.ppl.backend.DistributionTable;
import exm.ppl.common.lang.BackendDescriptor;

/**
 * Distributions.jl constructors.  Rates become scales where the Julia
 * constructor takes a scale, and half distributions are truncated at
 * zero since Distributions.jl has no Half types.
 */
public class TuringDistributions {

  public static final DistributionTable TABLE = DistributionTable.builder()
      .put("Dirac", "Dirac(%1)")
      .put("Normal", "Normal(%1, %2)")
      .put("Beta", "Beta(%1, %2)")
      .put("Cauchy", "Cauchy(%1, %2)")
      .put("Exponential", "Exponential(1 / (%1))")
      .put("Gamma", "Gamma(%1, 1 / (%2))")
      .put("HalfCauchy", "truncated(Cauchy(0, %1), 0, Inf)")
      .put("HalfNormal", "truncated(Normal(0, %1), 0, Inf)")
      .put("InverseGamma", "InverseGamma(%1, %2)")
      .put("StudentT", "TDist(%1)")
      .put("Uniform", "Uniform(%1, %2)")
      .put("Bernoulli", "Bernoulli(%1)")
      .put("Binomial", "Binomial(%1, %2)")
      .put("DiscreteUniform", "DiscreteUniform(%1, %2)")
      .put("Geometric", "Geometric(%1)")
      .put("HyperGeometric", "Hypergeometric(%1, %2, %3)")
      .put("Poisson", "Poisson(%1)")
      .put("Categorical", "DiscreteNonParametric(0:length(%1)-1, %1)")
      .put("Dirichlet", "Dirichlet(%1)")
      .put("MultivariateNormal", "MvNormal(%1, %2)")
      .put("Truncated", "truncated(%1, %2, %3)")
      .put("IID", "filldist(%1, %2)")
      .put(BackendDescriptor.FACTOR, "Turing.@addlogprob! %1", 1)
      .build();
}
