package exm.ppl.driver;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ppl.common.exceptions.UserException;
import exm.ppl.common.lang.Target;
import exm.ppl.frontend.lint.Diagnostic;

/**
 * Outcome of translating one program for one target
 */
public class TranslationResult {

  public static enum Status {
    TRANSLATED,
    /** The linter reported errors */
    REFUSED,
    /** Lowering or code generation failed */
    FAILED,
  }

  private final Target target;
  private final Status status;
  private final String code;
  private final ImmutableList<Diagnostic> diagnostics;
  private final UserException error;

  private TranslationResult(Target target, Status status, String code,
          List<Diagnostic> diagnostics, UserException error) {
    this.target = target;
    this.status = status;
    this.code = code;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
    this.error = error;
  }

  public static TranslationResult translated(Target target, String code,
                                    List<Diagnostic> diagnostics) {
    return new TranslationResult(target, Status.TRANSLATED, code,
                                 diagnostics, null);
  }

  public static TranslationResult refused(Target target,
                                          List<Diagnostic> diagnostics,
                                          UserException error) {
    return new TranslationResult(target, Status.REFUSED, null, diagnostics,
                                 error);
  }

  public static TranslationResult failed(Target target,
                                         List<Diagnostic> diagnostics,
                                         UserException error) {
    return new TranslationResult(target, Status.FAILED, null, diagnostics,
                                 error);
  }

  public Target target() {
    return target;
  }

  public Status status() {
    return status;
  }

  public boolean succeeded() {
    return status == Status.TRANSLATED;
  }

  /**
   * @return generated source, or null unless translated
   */
  public String code() {
    return code;
  }

  /**
   * @return lint diagnostics for this target, warnings only if translated
   */
  public ImmutableList<Diagnostic> diagnostics() {
    return diagnostics;
  }

  /**
   * @return cause of refusal or failure, null if translated
   */
  public UserException error() {
    return error;
  }

  @Override
  public String toString() {
    return target + ": " + status +
           (error == null ? "" : " (" + error.getMessage() + ")");
  }
}
