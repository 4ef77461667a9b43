package exm.ppl.testing;

import exm.ppl.ast.Program;
import exm.ppl.backend.BackendGenerator;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.frontend.ScopeResolver;
import exm.ppl.ir.IRBuilder;

/**
 * Runs one generator over a model without the lint gate
 */
public class Generation {

  public static String generate(BackendGenerator generator, Program prog)
                                                    throws CodegenError {
    generator.emitProgram(
        IRBuilder.build(prog, ScopeResolver.resolveLenient(prog)));
    generator.finalize();
    return generator.code();
  }
}
