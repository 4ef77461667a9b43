package exm.ppl.backend.gen;

import exm.ppl.backend.DistributionTable;

/**
 * Gen's built-in distributions.  Gen has no Dirac, half or Student-t
 * distributions, no truncation wrapper and no factor statement.
 */
public class GenDistributions {

  /** Declares labeled_categorical, used for zero-based Categorical */
  public static final String LABELED_CATEGORICAL =
      "@dist labeled_categorical(labels, probs) = labels[categorical(probs)]";

  public static final DistributionTable TABLE = DistributionTable.builder()
      .put("Normal", "normal(%1, %2)")
      .put("Beta", "beta(%1, %2)")
      .put("Cauchy", "cauchy(%1, %2)")
      .put("Exponential", "exponential(%1)")
      .put("Gamma", "gamma(%1, 1 / (%2))")
      .put("InverseGamma", "inv_gamma(%1, %2)")
      .put("Uniform", "uniform(%1, %2)")
      .put("Bernoulli", "bernoulli(%1)")
      .put("Binomial", "binom(%1, %2)")
      .put("DiscreteUniform", "uniform_discrete(%1, %2)")
      .put("Geometric", "geometric(%1)")
      .put("Poisson", "poisson(%1)")
      .put("Categorical", "labeled_categorical(0:length(%1)-1, %1)")
      .put("Dirichlet", "dirichlet(%1)")
      .put("MultivariateNormal", "mvnormal(%1, %2)")
      .build();
}
