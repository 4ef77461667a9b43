package exm.ppl.backend.pyro;

import static exm.ppl.ast.Ast.assign;
import static exm.ppl.ast.Ast.at;
import static exm.ppl.ast.Ast.call;
import static exm.ppl.ast.Ast.factor;
import static exm.ppl.ast.Ast.forLoop;
import static exm.ppl.ast.Ast.index;
import static exm.ppl.ast.Ast.lit;
import static exm.ppl.ast.Ast.params;
import static exm.ppl.ast.Ast.program;
import static exm.ppl.ast.Ast.range;
import static exm.ppl.ast.Ast.sample;
import static exm.ppl.ast.Ast.times;
import static exm.ppl.ast.Ast.var;
import static exm.ppl.testing.Generation.generate;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ppl.ast.Program;
import exm.ppl.common.Logging;
import exm.ppl.common.Settings;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.testing.Models;

public class PyroGeneratorTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, true);
  }

  @Test
  public void testCoinToss() throws CodegenError {
    String expected =
        "import pyro\n" +
        "import pyro.distributions as dist\n" +
        "\n" +
        "def cointoss(data, M):\n" +
        "    p = pyro.sample(\"p\", dist.Beta(1.0, 1.0))\n" +
        "    for i in range(0, M):\n" +
        "        if (data[i] == 0) or (data[i] == 1):\n" +
        "            pyro.sample(f\"data[{i}]\", dist.Bernoulli(p), " +
        "obs=data[i])\n";
    assertEquals(expected, generate(new PyroGenerator(), Models.coinToss()));
  }

  @Test
  public void testHiddenMarkovModel() throws CodegenError {
    String code = generate(new PyroGenerator(), Models.hmm());
    assertTrue(code, code.startsWith("import pyro\n" +
        "import pyro.distributions as dist\nimport torch\n\n"));
    assertTrue(code, code.contains(
        "    z = torch.zeros(T, dtype=torch.long)\n"));
    assertTrue("Discrete draws cast before indexing: " + code,
        code.contains("    pyro.sample(\"y[0]\", " +
                      "dist.Normal(mu[int(z[0])], 1.0), obs=y[0])\n"));
    assertTrue(code, code.contains(
        "        z[t] = pyro.sample(f\"z[{t}]\", dist.Categorical(" +
        "torch.as_tensor(trans[int(z[t - 1]), :], dtype=torch.float)))\n"));
  }

  @Test
  public void testVectorizedLoop() throws CodegenError {
    String code = generate(new PyroGenerator(), Models.linearRegression());
    assertTrue(code, code.contains(
        "    sigma = pyro.sample(\"sigma\", dist.HalfNormal(1.0))\n" +
        "    mean = torch.zeros(N)\n" +
        "    mean[0:N] = alpha + (beta * x[0:N])\n" +
        "    for j in range(0, N):\n" +
        "        pyro.sample(f\"y[{j}]\", dist.Normal(mean[j], sigma), " +
        "obs=y[j])\n"));
  }

  @Test
  public void testVectorizationDisabled() throws CodegenError {
    Settings.set(Settings.PYRO_VECTORIZE, "false");
    try {
      String code = generate(new PyroGenerator(),
                             Models.linearRegression());
      assertTrue(code, code.contains(
          "    for i in range(0, N):\n" +
          "        mean[i] = alpha + (beta * x[i])\n"));
    } finally {
      Settings.set(Settings.PYRO_VECTORIZE, "true");
    }
  }

  @Test
  public void testLoopReadingItsOwnOutput() throws CodegenError {
    Program prog = program("scale", params("x", "N"),
        forLoop(at(2), "i", range(lit(0), var("N")),
          assign(at(3), index("x", var("i")),
                 times(index("x", var("i")), lit(2.0)))));
    String code = generate(new PyroGenerator(), prog);
    assertTrue(code, code.contains(
        "    for i in range(0, N):\n        x[i] = x[i] * 2.0\n"));
    assertFalse(code, code.contains("import torch"));
  }

  @Test
  public void testFactor() throws CodegenError {
    Program prog = program("m", params("w"), factor(at(2), var("w")));
    String code = generate(new PyroGenerator(), prog);
    assertTrue(code, code.contains("    pyro.factor(\"__factor0\", w)\n"));
  }

  @Test
  public void testIidDraws() throws CodegenError {
    Program prog = program("m", params("N"),
        sample(at(2), "x", call("IID", call("Normal", lit(0.0), lit(1.0)),
                                var("N"))));
    String code = generate(new PyroGenerator(), prog);
    assertTrue(code, code.contains(
        "    x = pyro.sample(\"x\", dist.Normal(0.0, 1.0).expand((N,)))\n"));
  }

  @Test
  public void testUnsupportedDistribution() {
    Program prog = program("m", params(),
        sample(at(2), "k", call("DiscreteUniform", lit(0), lit(5))));
    try {
      generate(new PyroGenerator(), prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals("DiscreteUniform", e.getConstruct());
      assertTrue(e.getMessage(), e.getMessage().contains("Pyro"));
    }
  }
}
