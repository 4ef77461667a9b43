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
package exm.ppl.frontend.lint;

import exm.ppl.ast.SourcePos;
import exm.ppl.common.lang.Target;

/**
 * One lint finding.  Portability findings carry the backend they apply
 * to; all others have a null backend.
 */
public class Diagnostic {
  private final Severity severity;
  private final DiagnosticCode code;
  private final int line;
  private final int column;
  private final String message;
  private final Target backend;

  public Diagnostic(Severity severity, DiagnosticCode code, SourcePos pos,
                    String message, Target backend) {
    this.severity = severity;
    this.code = code;
    this.line = pos.line;
    this.column = pos.column;
    this.message = message;
    this.backend = backend;
  }

  public static Diagnostic error(DiagnosticCode code, SourcePos pos,
                                 String message) {
    return new Diagnostic(Severity.ERROR, code, pos, message, null);
  }

  public static Diagnostic warning(DiagnosticCode code, SourcePos pos,
                                   String message) {
    return new Diagnostic(Severity.WARNING, code, pos, message, null);
  }

  public Severity severity() {
    return severity;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  public DiagnosticCode code() {
    return code;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  public SourcePos pos() {
    return new SourcePos(line, column);
  }

  public String message() {
    return message;
  }

  /**
   * @return backend for portability findings, otherwise null
   */
  public Target backend() {
    return backend;
  }

  @Override
  public String toString() {
    String s = String.format("%4d:%d: %s: %s [%s]", line, column, severity,
                             message, code);
    if (backend != null) {
      s += " (" + backend + ")";
    }
    return s;
  }
}
