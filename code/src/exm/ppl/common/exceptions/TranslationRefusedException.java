package exm.ppl.common.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ppl.frontend.lint.Diagnostic;

/**
 * Thrown when the linter reported errors, so no code is generated.
 * Carries the full diagnostic list.
 */
public class TranslationRefusedException
extends UserException
{
  private final ImmutableList<Diagnostic> diagnostics;

  public TranslationRefusedException(String programName,
                                     List<Diagnostic> diagnostics)
  {
    super(buildMessage(programName, diagnostics));
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  private static String buildMessage(String programName,
                                     List<Diagnostic> diagnostics) {
    StringBuilder sb = new StringBuilder();
    sb.append("Refusing to translate ").append(programName).append(": ");
    sb.append(diagnostics.size()).append(" diagnostic(s)");
    for (Diagnostic d: diagnostics) {
      sb.append("\n").append(d.toString());
    }
    return sb.toString();
  }

  private static final long serialVersionUID = 1L;
}
