package exm.ppl.driver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ppl.backend.turing.TuringGenerator;
import exm.ppl.common.Logging;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.exceptions.TranslationRefusedException;
import exm.ppl.common.lang.Target;
import exm.ppl.frontend.lint.Diagnostic;
import exm.ppl.frontend.lint.DiagnosticCode;
import exm.ppl.frontend.lint.LintResult;
import exm.ppl.testing.Generation;
import exm.ppl.testing.Models;

public class TranslatorTest {

  private static final List<Target> ALL =
      Arrays.asList(Target.TURING, Target.GEN, Target.PYRO);

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, true);
  }

  @Test
  public void testTranslate() throws Exception {
    TranslationResult r = Translator.translate(Models.coinToss(),
                                               Target.TURING);
    assertEquals(TranslationResult.Status.TRANSLATED, r.status());
    assertTrue(r.succeeded());
    assertNull(r.error());
    assertTrue(r.diagnostics().isEmpty());
    assertEquals(Generation.generate(new TuringGenerator(),
                                     Models.coinToss()), r.code());
  }

  @Test
  public void testRefused() throws CodegenError {
    try {
      Translator.translate(Models.linearRegression(), Target.GEN);
      fail("Expected TranslationRefusedException");
    } catch (TranslationRefusedException e) {
      List<Diagnostic> errors = new ArrayList<Diagnostic>();
      for (Diagnostic d: e.getDiagnostics()) {
        if (d.isError()) {
          errors.add(d);
        }
      }
      assertEquals(e.getDiagnostics().toString(), 1, errors.size());
      assertEquals(DiagnosticCode.PORTABILITY, errors.get(0).code());
      assertEquals(4, errors.get(0).line());
      assertEquals(Target.GEN, errors.get(0).backend());
    }
  }

  @Test
  public void testLint() {
    LintResult lint = Translator.lint(Models.linearRegression(),
                                      Target.TURING);
    assertFalse(lint.hasErrors());
    assertEquals("HalfNormal is rewritten for Turing", 1,
                 lint.warnings().size());
  }

  private static void checkLinearRegression(
                        Map<Target, TranslationResult> results) {
    assertEquals(ALL, new ArrayList<Target>(results.keySet()));

    TranslationResult turing = results.get(Target.TURING);
    assertEquals(TranslationResult.Status.TRANSLATED, turing.status());
    assertEquals(1, turing.diagnostics().size());
    assertTrue(turing.code(), turing.code().contains(
        "truncated(Normal(0, 1.0), 0, Inf)"));

    TranslationResult gen = results.get(Target.GEN);
    assertEquals(TranslationResult.Status.REFUSED, gen.status());
    assertNull(gen.code());
    assertTrue(gen.error() instanceof TranslationRefusedException);

    TranslationResult pyro = results.get(Target.PYRO);
    assertEquals(TranslationResult.Status.TRANSLATED, pyro.status());
    assertTrue(pyro.diagnostics().isEmpty());
    assertNotNull(pyro.code());
  }

  @Test
  public void testTranslateAll() {
    checkLinearRegression(
        Translator.translateAll(Models.linearRegression(), ALL));
  }

  @Test
  public void testTranslateAllConcurrent() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(3);
    try {
      Map<Target, TranslationResult> concurrent =
          Translator.translateAll(Models.linearRegression(), ALL, executor);
      checkLinearRegression(concurrent);

      Map<Target, TranslationResult> sequential =
          Translator.translateAll(Models.linearRegression(), ALL);
      for (Target t: ALL) {
        assertEquals(t.toString(), sequential.get(t).code(),
                     concurrent.get(t).code());
      }
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Translating for several targets gives each the code it gets alone
   */
  @Test
  public void testTargetsIndependent() throws Exception {
    Map<Target, TranslationResult> all =
        Translator.translateAll(Models.hmm(), ALL);
    for (Target t: ALL) {
      assertEquals(t.toString(),
                   Translator.translate(Models.hmm(), t).code(),
                   all.get(t).code());
    }
  }
}
