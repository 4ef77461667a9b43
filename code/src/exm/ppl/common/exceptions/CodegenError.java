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
package exm.ppl.common.exceptions;

import exm.ppl.ast.SourcePos;

/**
 * A construct could not be lowered for the backend in progress.
 * Aborts that backend only.
 */
public class CodegenError
extends UserException
{
  private final String construct;

  public CodegenError(SourcePos pos, String construct, String message)
  {
    super(pos, message);
    this.construct = construct;
  }

  public static CodegenError unsupported(SourcePos pos, String construct,
                                         String backend) {
    return new CodegenError(pos, construct, construct +
                            " is not supported by the " + backend + " backend");
  }

  /**
   * @return name of the offending construct, e.g. a distribution name
   */
  public String getConstruct() {
    return construct;
  }

  private static final long serialVersionUID = 1L;
}
