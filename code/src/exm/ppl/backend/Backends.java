package exm.ppl.backend;

import exm.ppl.backend.gen.GenGenerator;
import exm.ppl.backend.pyro.PyroGenerator;
import exm.ppl.backend.turing.TuringGenerator;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.common.lang.Target;

public class Backends {

  /**
   * @return a fresh generator, to be used for one translation only
   */
  public static BackendGenerator create(Target target) {
    switch (target) {
      case TURING:
        return new TuringGenerator();
      case GEN:
        return new GenGenerator();
      case PYRO:
        return new PyroGenerator();
      default:
        throw new PPLRuntimeError("No generator for target " + target);
    }
  }
}
