package exm.ppl.backend.pyro;

import exm.ppl.backend.DistributionTable;
import exm.ppl.common.lang.BackendDescriptor;

/**
 * pyro.distributions constructors.  Vector parameters are converted to
 * float tensors, since models may be passed Python lists.
 */
public class PyroDistributions {

  public static final DistributionTable TABLE = DistributionTable.builder()
      .put("Dirac", "dist.Delta(torch.as_tensor(%1, dtype=torch.float))")
      .put("Normal", "dist.Normal(%1, %2)")
      .put("Beta", "dist.Beta(%1, %2)")
      .put("Cauchy", "dist.Cauchy(%1, %2)")
      .put("Exponential", "dist.Exponential(%1)")
      .put("Gamma", "dist.Gamma(%1, %2)")
      .put("HalfCauchy", "dist.HalfCauchy(%1)")
      .put("HalfNormal", "dist.HalfNormal(%1)")
      .put("InverseGamma", "dist.InverseGamma(%1, %2)")
      .put("StudentT", "dist.StudentT(%1)")
      .put("Uniform", "dist.Uniform(%1, %2)")
      .put("Bernoulli", "dist.Bernoulli(%1)")
      .put("Binomial", "dist.Binomial(%1, %2)")
      .put("Geometric", "dist.Geometric(%1)")
      .put("Poisson", "dist.Poisson(%1)")
      .put("Categorical",
           "dist.Categorical(torch.as_tensor(%1, dtype=torch.float))")
      .put("Dirichlet",
           "dist.Dirichlet(torch.as_tensor(%1, dtype=torch.float))")
      .put("MultivariateNormal",
           "dist.MultivariateNormal(torch.as_tensor(%1, dtype=torch.float)" +
           ", torch.as_tensor(%2, dtype=torch.float))")
      .put("IID", "%1.expand((%2,))")
      .put(BackendDescriptor.FACTOR, "pyro.factor(%1, %2)", 2)
      .build();
}
