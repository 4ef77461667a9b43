package exm.ppl.frontend.lint;

import static exm.ppl.ast.Ast.assign;
import static exm.ppl.ast.Ast.at;
import static exm.ppl.ast.Ast.block;
import static exm.ppl.ast.Ast.brk;
import static exm.ppl.ast.Ast.call;
import static exm.ppl.ast.Ast.cont;
import static exm.ppl.ast.Ast.eq;
import static exm.ppl.ast.Ast.factor;
import static exm.ppl.ast.Ast.forLoop;
import static exm.ppl.ast.Ast.ifElse;
import static exm.ppl.ast.Ast.ifThen;
import static exm.ppl.ast.Ast.index;
import static exm.ppl.ast.Ast.lit;
import static exm.ppl.ast.Ast.negate;
import static exm.ppl.ast.Ast.observe;
import static exm.ppl.ast.Ast.params;
import static exm.ppl.ast.Ast.plus;
import static exm.ppl.ast.Ast.program;
import static exm.ppl.ast.Ast.range;
import static exm.ppl.ast.Ast.sample;
import static exm.ppl.ast.Ast.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ppl.ast.Program;
import exm.ppl.common.Logging;
import exm.ppl.common.Settings;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.common.lang.Target;
import exm.ppl.testing.Models;

public class LinterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, true);
  }

  private static LintResult lintFor(Program prog, Target target) {
    return Linter.lint(prog, BackendDescriptor.forTarget(target));
  }

  @Test
  public void testModelsAreClean() {
    List<Program> models = Arrays.asList(Models.coinToss(), Models.hmm(),
        Models.gaussianMixture(), Models.linearRegression(),
        Models.burglary());
    for (Program model: models) {
      LintResult result = Linter.lint(model);
      assertTrue(model.name() + " should lint clean but got:\n" + result,
                 result.isEmpty());
    }
  }

  @Test
  public void testOneDiagnosticPerUndefinedName() {
    Program prog = program("m", params(),
        assign(at(2), "a", plus(var("u1"), lit(1))),
        assign(at(3), "b", var("u2")),
        sample(at(4), "c", call("Normal", var("u3"), lit(1.0))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 3, result.diagnostics().size());
    assertEquals(3, result.count(DiagnosticCode.UNDEFINED_REFERENCE));
    assertEquals("Sorted by line", 2, result.diagnostics().get(0).line());
    assertEquals(4, result.diagnostics().get(2).line());
  }

  @Test
  public void testIndependentErrorsAllReported() {
    Program prog = program("m", params("n"),
        assign(at(2), "a", var("undefined")),
        sample(at(3), "x", call("Foo", lit(1.0))),
        forLoop(at(4), "i", range(lit(0), lit(0), var("n")),
          assign(at(5), "s", var("i"))),
        brk(at(6)));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 4, result.diagnostics().size());
    assertEquals(1, result.count(DiagnosticCode.UNDEFINED_REFERENCE));
    assertEquals(1, result.count(DiagnosticCode.UNKNOWN_FUNCTION));
    assertEquals(1, result.count(DiagnosticCode.ZERO_STEP));
    assertEquals(1, result.count(DiagnosticCode.LOOP_CONTROL));
  }

  @Test
  public void testDistributionArity() {
    Program prog = program("m", params(),
        sample(at(2), "x", call("Normal", lit(0.0))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 1, result.diagnostics().size());
    assertEquals(DiagnosticCode.DISTRIBUTION_SIGNATURE,
                 result.diagnostics().get(0).code());
  }

  @Test
  public void testDistributionOutsideSample() {
    Program prog = program("m", params(),
        assign(at(2), "y", call("Normal", lit(0.0), lit(1.0))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 1,
                 result.count(DiagnosticCode.MISPLACED_DISTRIBUTION));
    assertTrue(result.hasErrors());
  }

  @Test
  public void testBuiltinArity() {
    Program prog = program("m", params("v"),
        assign(at(2), "n", call("len", var("v"), var("v"))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 1,
                 result.count(DiagnosticCode.BUILTIN_SIGNATURE));
  }

  @Test
  public void testAssignAfterObserve() {
    Program prog = program("m", params("x"),
        observe(at(2), var("x"), call("Normal", lit(0.0), lit(1.0))),
        assign(at(3), "x", lit(2.0)));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 1,
                 result.count(DiagnosticCode.OBSERVED_ASSIGNMENT));
    assertEquals(3, result.errors().get(0).line());
  }

  @Test
  public void testConstantIndexBounds() {
    Program prog = program("m", params(),
        assign(at(2), "v", call("Vector", lit(3))),
        assign(at(3), index("v", lit(3)), lit(1.0)),
        assign(at(4), index("v", negate(lit(1))), lit(1.0)),
        assign(at(5), index("v", lit(2)), lit(1.0)));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 2,
                 result.count(DiagnosticCode.INDEX_OUT_OF_RANGE));
    assertEquals(3, result.diagnostics().get(0).line());
    assertEquals(4, result.diagnostics().get(1).line());
  }

  @Test
  public void testLoopIndexBounds() {
    Program prog = program("m", params(),
        assign(at(2), "v", call("Vector", lit(3))),
        forLoop(at(3), "i", range(lit(0), lit(3)),
          assign(at(4), index("v", plus(var("i"), lit(1))), lit(0.0))),
        forLoop(at(5), "j", range(lit(0), lit(2)),
          assign(at(6), index("v", plus(var("j"), lit(1))), lit(0.0))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 1, result.diagnostics().size());
    assertEquals(DiagnosticCode.INDEX_OUT_OF_RANGE,
                 result.diagnostics().get(0).code());
    assertEquals(4, result.diagnostics().get(0).line());
  }

  @Test
  public void testRealIndexWarning() {
    Program prog = program("m", params(),
        sample(at(2), "x", call("Normal", lit(0.0), lit(1.0))),
        assign(at(3), "v", call("Vector", lit(3))),
        assign(at(4), "y", index("v", var("x"))));
    LintResult result = Linter.lint(prog);
    assertFalse(result.toString(), result.hasErrors());
    assertEquals(1, result.warnings().size());
    assertEquals(DiagnosticCode.FLOAT_INDEX,
                 result.warnings().get(0).code());
  }

  @Test
  public void testDiscreteIndexNoWarning() {
    Program prog = program("m", params(),
        sample(at(2), "k", call("Poisson", lit(3.0))),
        assign(at(3), "v", call("Vector", lit(10))),
        assign(at(4), "y", index("v", var("k"))));
    LintResult result = Linter.lint(prog);
    assertTrue(result.toString(), result.isEmpty());
  }

  @Test
  public void testDuplicateConstantAddress() {
    Program prog = program("m", params(),
        sample(at(2), "x", call("Normal", lit(0.0), lit(1.0))),
        sample(at(3), "x", call("Normal", lit(1.0), lit(1.0))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 1, result.diagnostics().size());
    Diagnostic d = result.diagnostics().get(0);
    assertEquals(DiagnosticCode.DUPLICATE_ADDRESS, d.code());
    assertTrue(d.isError());
    assertEquals("Reported at the later statement", 3, d.line());
  }

  @Test
  public void testExclusiveBranchesShareAddress() {
    Program prog = program("m", params("flag"),
        ifElse(at(2), var("flag"),
          block(sample(at(3), "x", call("Normal", lit(0.0), lit(1.0)))),
          block(sample(at(5), "x", call("Normal", lit(5.0), lit(1.0))))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 0,
                 result.count(DiagnosticCode.DUPLICATE_ADDRESS));
  }

  @Test
  public void testDuplicateIndexedAddressWarns() {
    Program prog = program("m", params("n"),
        forLoop(at(2), "i", range(lit(0), var("n")),
          sample(at(3), index("y", var("i")),
                 call("Normal", lit(0.0), lit(1.0))),
          sample(at(4), index("y", var("i")),
                 call("Normal", lit(1.0), lit(1.0)))));
    LintResult result = Linter.lint(prog);
    assertFalse(result.toString(), result.hasErrors());
    assertEquals(1, result.count(DiagnosticCode.DUPLICATE_ADDRESS));
  }

  @Test
  public void testPortabilityPerBackend() {
    Program linreg = Models.linearRegression();

    LintResult gen = lintFor(linreg, Target.GEN);
    assertEquals(gen.toString(), 1, gen.errors().size());
    Diagnostic d = gen.errors().get(0);
    assertEquals(DiagnosticCode.PORTABILITY, d.code());
    assertEquals(Target.GEN, d.backend());
    assertEquals(4, d.line());

    LintResult turing = lintFor(linreg, Target.TURING);
    assertFalse(turing.toString(), turing.hasErrors());
    assertEquals("HalfNormal is rewritten", 1, turing.warnings().size());

    assertTrue(lintFor(linreg, Target.PYRO).isEmpty());
  }

  @Test
  public void testFactorPortability() {
    Program prog = program("m", params(),
        sample(at(2), "x", call("Normal", lit(0.0), lit(1.0))),
        factor(at(3), negate(var("x"))));
    assertTrue(lintFor(prog, Target.GEN).hasErrors());
    assertFalse(lintFor(prog, Target.PYRO).hasErrors());
    LintResult turing = lintFor(prog, Target.TURING);
    assertEquals(turing.toString(), 1, turing.warnings().size());
  }

  @Test
  public void testTuringObservesArgumentsOnly() {
    Program prog = program("m", params(),
        assign(at(2), "z", lit(1.0)),
        observe(at(3), var("z"), call("Normal", lit(0.0), lit(1.0))));
    LintResult turing = lintFor(prog, Target.TURING);
    assertEquals(turing.toString(), 1,
                 turing.count(DiagnosticCode.PORTABILITY));
    assertTrue(turing.hasErrors());
    assertFalse(lintFor(prog, Target.PYRO).hasErrors());
  }

  @Test
  public void testGenObservationUnderRandomLoop() {
    Program prog = program("m", params("y"),
        sample(at(2), "k", call("Poisson", lit(3.0))),
        forLoop(at(3), "i", range(lit(0), var("k")),
          observe(at(4), index("y", var("i")),
                  call("Normal", lit(0.0), lit(1.0)))));
    LintResult gen = lintFor(prog, Target.GEN);
    assertEquals(gen.toString(), 1, gen.errors().size());
    assertEquals(4, gen.errors().get(0).line());
    assertFalse(lintFor(prog, Target.PYRO).hasErrors());
    assertFalse(lintFor(prog, Target.TURING).hasErrors());
  }

  @Test
  public void testGenObservationAfterRandomContinue() {
    Program prog = program("m", params("y", "N"),
        forLoop(at(2), "i", range(lit(0), var("N")),
          sample(at(3), "s", call("Bernoulli", lit(0.5))),
          ifThen(at(4), eq(var("s"), lit(1)), cont(at(5))),
          observe(at(6), index("y", var("i")),
                  call("Normal", lit(0.0), lit(1.0)))));
    LintResult gen = lintFor(prog, Target.GEN);
    assertEquals(gen.toString(), 1, gen.errors().size());
    assertEquals(6, gen.errors().get(0).line());
    assertTrue(gen.toString(),
               gen.errors().get(0).message().contains("line 5"));
    assertFalse(lintFor(prog, Target.TURING).hasErrors());
    assertFalse(lintFor(prog, Target.PYRO).hasErrors());
  }

  @Test
  public void testGenObservationBeforeRandomContinue() {
    Program prog = program("m", params("y", "N"),
        forLoop(at(2), "i", range(lit(0), var("N")),
          observe(at(3), index("y", var("i")),
                  call("Normal", lit(0.0), lit(1.0))),
          sample(at(4), "s", call("Bernoulli", lit(0.5))),
          ifThen(at(5), eq(var("s"), lit(1)), cont(at(6)))));
    assertFalse(lintFor(prog, Target.GEN).hasErrors());
  }

  @Test
  public void testGenObservationBeforeRandomBreak() {
    Program prog = program("m", params("y", "N"),
        forLoop(at(2), "i", range(lit(0), var("N")),
          observe(at(3), index("y", var("i")),
                  call("Normal", lit(0.0), lit(1.0))),
          sample(at(4), "s", call("Bernoulli", lit(0.5))),
          ifThen(at(5), eq(var("s"), lit(1)), brk(at(6)))));
    LintResult gen = lintFor(prog, Target.GEN);
    assertEquals(gen.toString(), 1, gen.errors().size());
    assertEquals(3, gen.errors().get(0).line());
  }

  @Test
  public void testIidPortability() {
    Program prog = program("m", params("N"),
        sample(at(2), "x", call("IID", call("Normal", lit(0.0), lit(1.0)),
                                var("N"))));
    assertTrue(Linter.lint(prog).isEmpty());
    LintResult gen = lintFor(prog, Target.GEN);
    assertEquals(gen.toString(), 1, gen.count(DiagnosticCode.PORTABILITY));
    assertTrue(gen.hasErrors());
    assertTrue(lintFor(prog, Target.TURING).isEmpty());
    assertTrue(lintFor(prog, Target.PYRO).isEmpty());
  }

  @Test
  public void testIidDrawsVector() {
    Program prog = program("m", params(),
        assign(at(2), "v", call("Vector", lit(3))),
        sample(at(3), index("v", lit(0)),
               call("IID", call("Normal", lit(0.0), lit(1.0)), lit(2))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 1,
                 result.count(DiagnosticCode.DISTRIBUTION_SIGNATURE));
    assertEquals(3, result.errors().get(0).line());
  }

  @Test
  public void testImplicitContainerNeedsLoopIndex() {
    Program prog = program("m", params("z", "N"),
        forLoop(at(2), "i", range(lit(0), var("N")),
          sample(at(3), index("x", index("z", var("i"))),
                 call("Normal", lit(0.0), lit(1.0)))));
    LintResult result = Linter.lint(prog);
    assertEquals(result.toString(), 1,
                 result.count(DiagnosticCode.INVALID_TARGET));
    assertEquals(3, result.errors().get(0).line());
  }

  @Test
  public void testWarningsAsErrors() {
    Settings.set(Settings.LINT_WARNINGS_AS_ERRORS, "true");
    try {
      LintResult turing = lintFor(Models.linearRegression(), Target.TURING);
      assertTrue(turing.hasErrors());
      assertEquals(0, turing.warnings().size());
    } finally {
      Settings.set(Settings.LINT_WARNINGS_AS_ERRORS, "false");
    }
  }

  @Test
  public void testDiagnosticFormat() {
    Diagnostic d = new Diagnostic(Severity.ERROR,
        DiagnosticCode.PORTABILITY, at(12, 3), "HalfNormal is not supported",
        Target.GEN);
    assertEquals("  12:3: ERROR: HalfNormal is not supported [portability]" +
                 " (gen)", d.toString());
  }
}
