package exm.ppl.backend.turing;

import static exm.ppl.ast.Ast.at;
import static exm.ppl.ast.Ast.call;
import static exm.ppl.ast.Ast.factor;
import static exm.ppl.ast.Ast.lit;
import static exm.ppl.ast.Ast.params;
import static exm.ppl.ast.Ast.program;
import static exm.ppl.ast.Ast.sample;
import static exm.ppl.ast.Ast.var;
import static exm.ppl.testing.Generation.generate;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ppl.ast.Program;
import exm.ppl.common.Logging;
import exm.ppl.common.Settings;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.exceptions.PPLRuntimeError;
import exm.ppl.testing.Models;

public class TuringGeneratorTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, true);
  }

  @Test
  public void testCoinToss() throws CodegenError {
    String expected =
        "using Turing\n" +
        "\n" +
        "@model function cointoss(data, M)\n" +
        "    p ~ Beta(1.0, 1.0)\n" +
        "    for i = 0:1:(M)-1\n" +
        "        if (data[(i)+1] == 0) || (data[(i)+1] == 1)\n" +
        "            data[(i)+1] ~ Bernoulli(p)\n" +
        "        end\n" +
        "    end\n" +
        "end\n";
    assertEquals(expected, generate(new TuringGenerator(), Models.coinToss()));
  }

  @Test
  public void testHiddenMarkovModel() throws CodegenError {
    String code = generate(new TuringGenerator(), Models.hmm());
    assertTrue(code, code.contains("    z = fill(0, T)\n"));
    assertTrue(code, code.contains(
        "    z[(0)+1] ~ DiscreteNonParametric(0:length(pi0)-1, pi0)\n"));
    assertTrue(code, code.contains(
        "    y[(0)+1] ~ Normal(mu[(z[(0)+1])+1], 1.0)\n"));
    assertTrue("Row used twice by the template is computed once: " + code,
        code.contains(
        "        __tmp0 = trans[(z[(t - 1)+1])+1, :]\n" +
        "        z[(t)+1] ~ DiscreteNonParametric(" +
        "0:length(__tmp0)-1, __tmp0)\n"));
    assertFalse("No address strings", code.contains("\"z"));
  }

  @Test
  public void testRewrittenDistributionAndFactor() throws CodegenError {
    Program prog = program("m", params("w"),
        sample(at(2), "s", call("HalfNormal", var("w"))),
        factor(at(3), var("w")));
    String code = generate(new TuringGenerator(), prog);
    assertTrue(code, code.contains(
        "    s ~ truncated(Normal(0, w), 0, Inf)\n"));
    assertTrue(code, code.contains("    Turing.@addlogprob! w\n"));
  }

  @Test
  public void testIidDraws() throws CodegenError {
    Program prog = program("m", params("N"),
        sample(at(2), "x", call("IID", call("Normal", lit(0.0), lit(1.0)),
                                var("N"))));
    String code = generate(new TuringGenerator(), prog);
    assertTrue(code, code.contains(
        "    x ~ filldist(Normal(0.0, 1.0), N)\n"));
  }

  @Test
  public void testBanner() throws CodegenError {
    Settings.set(Settings.EMIT_BANNER, "header");
    try {
      String code = generate(new TuringGenerator(), Models.coinToss());
      assertTrue(code, code.startsWith(
          "# Generated from model cointoss for Turing\nusing Turing\n"));
    } finally {
      Settings.set(Settings.EMIT_BANNER, "off");
    }
  }

  @Test
  public void testFinalizeIdempotent() throws CodegenError {
    TuringGenerator g = new TuringGenerator();
    String first = generate(g, Models.burglary());
    g.finalize();
    assertEquals(first, g.code());
  }

  @Test(expected=PPLRuntimeError.class)
  public void testCodeBeforeFinalize() {
    new TuringGenerator().code();
  }
}
