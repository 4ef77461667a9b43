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
package exm.ppl.backend;

import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.emit.tree.Sequence;
import exm.ppl.ir.IRExpr;
import exm.ppl.ir.IRProgram;
import exm.ppl.ir.IRStatement;

/**
 * The generic interface for a code generation backend.  A generator
 * instance serves exactly one translation: emit the program, finalize,
 * then take the source text.
 */
public interface BackendGenerator {

  public BackendDescriptor descriptor();

  /**
   * Generate code for the whole model
   * @throws CodegenError if the program uses a construct the backend
   *        cannot express
   */
  public void emitProgram(IRProgram program) throws CodegenError;

  /**
   * Generate code for one statement, appending to out
   */
  public void emitStatement(IRStatement stmt, Sequence out)
                                            throws CodegenError;

  /**
   * @return target-language text for a value expression
   */
  public String emitExpression(IRExpr expr);

  /**
   * Complete generation.  Further calls have no effect.
   */
  public void finalize();

  /**
   * @return generated source text, available after finalize
   */
  public String code();
}
