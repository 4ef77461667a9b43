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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Diagnostics from one linter run, ordered by source position.
 */
public class LintResult {
  private final ImmutableList<Diagnostic> diagnostics;

  LintResult(List<Diagnostic> diagnostics) {
    List<Diagnostic> sorted = new ArrayList<Diagnostic>(diagnostics);
    // Stable sort: findings at one position stay in check order
    Collections.sort(sorted, new Comparator<Diagnostic>() {
      @Override
      public int compare(Diagnostic a, Diagnostic b) {
        if (a.line() != b.line()) {
          return Integer.compare(a.line(), b.line());
        }
        return Integer.compare(a.column(), b.column());
      }
    });
    this.diagnostics = ImmutableList.copyOf(sorted);
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> errors() {
    return filter(Severity.ERROR);
  }

  public List<Diagnostic> warnings() {
    return filter(Severity.WARNING);
  }

  public boolean hasErrors() {
    return !errors().isEmpty();
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }

  public int count(DiagnosticCode code) {
    int n = 0;
    for (Diagnostic d: diagnostics) {
      if (d.code() == code) {
        n++;
      }
    }
    return n;
  }

  private List<Diagnostic> filter(Severity severity) {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d: diagnostics) {
      if (d.severity() == severity) {
        result.add(d);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Diagnostic d: diagnostics) {
      sb.append(d).append("\n");
    }
    return sb.toString();
  }
}
