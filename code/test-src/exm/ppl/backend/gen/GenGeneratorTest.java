package exm.ppl.backend.gen;

import static exm.ppl.ast.Ast.assign;
import static exm.ppl.ast.Ast.at;
import static exm.ppl.ast.Ast.call;
import static exm.ppl.ast.Ast.cont;
import static exm.ppl.ast.Ast.eq;
import static exm.ppl.ast.Ast.factor;
import static exm.ppl.ast.Ast.forLoop;
import static exm.ppl.ast.Ast.ifThen;
import static exm.ppl.ast.Ast.index;
import static exm.ppl.ast.Ast.lit;
import static exm.ppl.ast.Ast.observe;
import static exm.ppl.ast.Ast.params;
import static exm.ppl.ast.Ast.program;
import static exm.ppl.ast.Ast.range;
import static exm.ppl.ast.Ast.sample;
import static exm.ppl.ast.Ast.var;
import static exm.ppl.testing.Generation.generate;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ppl.ast.Program;
import exm.ppl.common.Logging;
import exm.ppl.common.Settings;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.testing.Models;

public class GenGeneratorTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, true);
  }

  @Test
  public void testCoinToss() throws CodegenError {
    String expected =
        "using Gen\n" +
        "using Distributions\n" +
        "\n" +
        "@gen function cointoss(data, M)\n" +
        "    p = {\"p\"} ~ beta(1.0, 1.0)\n" +
        "    for i = 0:1:(M)-1\n" +
        "        if (data[(i)+1] == 0) || (data[(i)+1] == 1)\n" +
        "            data[(i)+1] = {\"data[$(i)]\"} ~ bernoulli(p)\n" +
        "        end\n" +
        "    end\n" +
        "end\n" +
        "\n" +
        "__observe_constraints = Gen.choicemap()\n" +
        "\n" +
        "function __choicemap_aggregation(data, M)\n" +
        "    for i = 0:1:(M)-1\n" +
        "        if (data[(i)+1] == 0) || (data[(i)+1] == 1)\n" +
        "            __observe_constraints[\"data[$(i)]\"] = data[(i)+1]\n" +
        "        end\n" +
        "    end\n" +
        "    return __observe_constraints\n" +
        "end\n";
    assertEquals(expected, generate(new GenGenerator(), Models.coinToss()));
  }

  @Test
  public void testHiddenMarkovModel() throws CodegenError {
    String code = generate(new GenGenerator(), Models.hmm());
    assertTrue("Categorical helper declared: " + code, code.startsWith(
        "using Gen\nusing Distributions\n\n" +
        GenDistributions.LABELED_CATEGORICAL + "\n\n"));
    assertTrue(code, code.contains(
        "        __tmp0 = trans[(z[(t - 1)+1])+1, :]\n" +
        "        z[(t)+1] = {\"z[$(t)]\"} ~ " +
        "labeled_categorical(0:length(__tmp0)-1, __tmp0)\n" +
        "        {\"y[$(t)]\"} ~ normal(mu[(z[(t)+1])+1], 1.0)\n"));
    assertTrue(code, code.contains(
        "    __observe_constraints[\"y[0]\"] = y[(0)+1]\n" +
        "    for t = 1:1:(T)-1\n" +
        "        __observe_constraints[\"y[$(t)]\"] = y[(t)+1]\n" +
        "    end\n"));
    assertTrue("Latent allocation stays in the model: " + code,
               code.contains("function __choicemap_aggregation" +
                   "(y, T, pi0, trans, mu)\n    __observe_constraints"));
  }

  @Test
  public void testAggregatorKeepsLoops() throws CodegenError {
    String code = generate(new GenGenerator(), Models.gaussianMixture());
    assertTrue(code, code.contains(
        "function __choicemap_aggregation(x, N, K, w)\n" +
        "    for k = 0:1:(K)-1\n" +
        "    end\n" +
        "    for n = 0:1:(N)-1\n" +
        "        __observe_constraints[\"x[$(n)]\"] = x[(n)+1]\n" +
        "    end\n" +
        "    return __observe_constraints\n" +
        "end\n"));
  }

  @Test
  public void testObservationInsideRandomBranch() throws CodegenError {
    String code = generate(new GenGenerator(), Models.burglary());
    assertTrue(code, code.contains(
        "    __observe_constraints[\"alarm\"] = alarm\n" +
        "    return __observe_constraints\n"));
  }

  @Test
  public void testCustomNames() throws CodegenError {
    Settings.set(Settings.GEN_CONSTRAINTS_NAME, "cm");
    Settings.set(Settings.GEN_AGGREGATOR_NAME, "constraints");
    try {
      String code = generate(new GenGenerator(), Models.coinToss());
      assertTrue(code, code.contains("cm = Gen.choicemap()\n"));
      assertTrue(code, code.contains("function constraints(data, M)\n"));
      assertTrue(code, code.contains("    return cm\n"));
    } finally {
      Settings.set(Settings.GEN_CONSTRAINTS_NAME, "__observe_constraints");
      Settings.set(Settings.GEN_AGGREGATOR_NAME, "__choicemap_aggregation");
    }
  }

  @Test
  public void testUnsupportedDistribution() {
    Program prog = program("m", params(),
        sample(at(2), "s", call("HalfNormal", lit(1.0))));
    try {
      generate(new GenGenerator(), prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals("HalfNormal", e.getConstruct());
      assertEquals(2, e.getPos().line);
    }
  }

  @Test
  public void testFactorUnsupported() {
    Program prog = program("m", params("w"), factor(at(2), var("w")));
    try {
      generate(new GenGenerator(), prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals("factor", e.getConstruct());
    }
  }

  /**
   * The observed value is only known inside the model
   */
  @Test
  public void testRandomObservedValue() {
    Program prog = program("m", params("N"),
        sample(at(2), "z", call("Normal", lit(0.0), lit(1.0))),
        forLoop(at(3), "i", range(lit(0), var("N")),
          observe(at(4), var("z"), call("Normal", lit(0.0), lit(1.0)))));
    try {
      generate(new GenGenerator(), prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals(4, e.getPos().line);
    }
  }

  @Test
  public void testObservationAfterRandomContinue() {
    Program prog = program("m", params("y", "N"),
        forLoop(at(2), "i", range(lit(0), var("N")),
          sample(at(3), "s", call("Bernoulli", lit(0.5))),
          ifThen(at(4), eq(var("s"), lit(1)), cont(at(5))),
          observe(at(6), index("y", var("i")),
                  call("Normal", lit(0.0), lit(1.0)))));
    try {
      generate(new GenGenerator(), prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals(6, e.getPos().line);
      assertTrue(e.getMessage(), e.getMessage().contains("line 4"));
    }
  }

  @Test
  public void testRandomContinueAfterObservation() throws CodegenError {
    Program prog = program("m", params("y", "N"),
        forLoop(at(2), "i", range(lit(0), var("N")),
          observe(at(3), index("y", var("i")),
                  call("Normal", lit(0.0), lit(1.0))),
          sample(at(4), "s", call("Bernoulli", lit(0.5))),
          ifThen(at(5), eq(var("s"), lit(1)), cont(at(6)))));
    String code = generate(new GenGenerator(), prog);
    assertTrue(code, code.contains(
        "        __observe_constraints[\"y[$(i)]\"] = y[(i)+1]\n"));
  }

  @Test
  public void testObservationUnderDerivedRandomCondition() {
    Program prog = program("m", params("y"),
        sample(at(2), "z", call("Normal", lit(0.0), lit(1.0))),
        assign(at(3), "a", var("z")),
        ifThen(at(4), eq(var("a"), lit(1.0)),
          observe(at(5), var("y"), call("Normal", lit(0.0), lit(1.0)))));
    try {
      generate(new GenGenerator(), prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals(5, e.getPos().line);
    }
  }

  @Test
  public void testAddressReadsObservedLocal() {
    Program prog = program("m", params("y"),
        sample(at(2), "z", call("Poisson", lit(3.0))),
        observe(at(3), index("y", var("z")),
                call("Normal", lit(0.0), lit(1.0))),
        observe(at(4), var("z"), call("Poisson", lit(3.0))));
    try {
      generate(new GenGenerator(), prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals(3, e.getPos().line);
      assertTrue(e.getMessage(), e.getMessage().contains("Address"));
    }
  }
}
