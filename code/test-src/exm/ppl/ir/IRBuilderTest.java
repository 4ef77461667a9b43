package exm.ppl.ir;

import static exm.ppl.ast.Ast.assign;
import static exm.ppl.ast.Ast.at;
import static exm.ppl.ast.Ast.call;
import static exm.ppl.ast.Ast.factor;
import static exm.ppl.ast.Ast.forLoop;
import static exm.ppl.ast.Ast.lit;
import static exm.ppl.ast.Ast.observe;
import static exm.ppl.ast.Ast.params;
import static exm.ppl.ast.Ast.program;
import static exm.ppl.ast.Ast.sample;
import static exm.ppl.ast.Ast.slice;
import static exm.ppl.ast.Ast.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ppl.ast.Program;
import exm.ppl.common.Logging;
import exm.ppl.common.exceptions.CodegenError;
import exm.ppl.common.lang.Builtins.Builtin;
import exm.ppl.common.lang.Role;
import exm.ppl.frontend.ScopeResolver;
import exm.ppl.testing.Models;

public class IRBuilderTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, true);
  }

  private static IRProgram build(Program prog) throws CodegenError {
    return IRBuilder.build(prog, ScopeResolver.resolveLenient(prog));
  }

  @Test
  public void testImplicitAllocationsBeforeLoops() throws CodegenError {
    IRProgram ir = build(Models.gaussianMixture());
    assertEquals(ir.toString(), 4, ir.body().size());

    IRStatement.Assign allocMu = (IRStatement.Assign)ir.body().get(0);
    assertTrue(allocMu.isAllocation());
    assertEquals("mu", allocMu.target().toString());
    IRExpr.Call muCall = (IRExpr.Call)allocMu.value();
    assertEquals(Builtin.VECTOR, muCall.function());
    assertEquals("K", muCall.args().get(0).toString());
    assertFalse("Normal draws are reals", muCall.integerElements());

    assertEquals(IRStatement.Kind.FOR, ir.body().get(1).kind());

    IRStatement.Assign allocC = (IRStatement.Assign)ir.body().get(2);
    assertEquals("c", allocC.target().toString());
    assertTrue("Categorical draws are integers",
               ((IRExpr.Call)allocC.value()).integerElements());
  }

  @Test
  public void testRoles() throws CodegenError {
    IRProgram ir = build(Models.coinToss());
    assertEquals(Role.OBSERVED, ir.paramRole("data"));
    assertEquals(Role.DETERMINISTIC, ir.paramRole("M"));

    IRStatement.Sample p = (IRStatement.Sample)ir.body().get(0);
    assertEquals(Role.LATENT, p.role());
    assertTrue("Latent targets are random", p.target().isRandom());
    assertTrue(p.address().isConstant());
    assertEquals("p", p.address().toString());

    IRStatement.For loop = (IRStatement.For)ir.body().get(1);
    IRStatement.If branch = (IRStatement.If)loop.body().get(0);
    IRStatement.Sample data = (IRStatement.Sample)branch.thenBlock().get(0);
    assertTrue(data.isObserved());
    assertFalse(data.target().isRandom());
    assertEquals("data[i]", data.address().toString());
  }

  @Test
  public void testLoopDefaults() throws CodegenError {
    Program prog = program("m", params("n"),
        forLoop(at(2), "i", slice(null, var("n")),
          sample(at(3), "x", call("Normal", lit(0.0), lit(1.0)))));
    IRProgram ir = build(prog);
    IRStatement.For loop = (IRStatement.For)ir.body().get(0);
    assertEquals(Long.valueOf(0),
                 ((IRExpr.Literal)loop.range().start()).intValue());
    assertEquals(Long.valueOf(1), loop.range().constantStep());

    IRStatement.Sample x = (IRStatement.Sample)loop.body().get(0);
    assertEquals("Loop index added to keep addresses distinct",
                 "x[i]", x.address().toString());
  }

  @Test
  public void testTruncationTags() throws CodegenError {
    IRProgram ir = build(Models.hmm());
    IRStatement.For loop = (IRStatement.For)ir.body().get(3);
    IRStatement.Sample z = (IRStatement.Sample)loop.body().get(0);
    IRExpr.Index row = (IRExpr.Index)z.distribution().args().get(0);
    IndexComponent state = row.components().get(0);
    assertTrue("Indexed by a discrete draw held as a real",
               state.requiresTruncation());
    assertTrue(state.needsOffset());
    assertTrue(row.components().get(1).isSlice());
    assertTrue(row.isRandom());

    IRStatement.Assign alloc = (IRStatement.Assign)ir.body().get(0);
    assertTrue(((IRExpr.Call)alloc.value()).integerElements());
  }

  @Test
  public void testSynthesizedAddresses() throws CodegenError {
    Program prog = program("m", params("n"),
        observe(at(2), lit(1.0), call("Normal", lit(0.0), lit(1.0))),
        forLoop(at(3), "i", slice(lit(0), var("n")),
          observe(at(4), lit(2.0), call("Normal", lit(0.0), lit(1.0))),
          factor(at(5), lit(-1.0))));
    IRProgram ir = build(prog);
    IRStatement.Observe first = (IRStatement.Observe)ir.body().get(0);
    assertEquals("__observe0", first.address().toString());

    IRStatement.For loop = (IRStatement.For)ir.body().get(1);
    IRStatement.Observe second = (IRStatement.Observe)loop.body().get(0);
    assertEquals("__observe1[i]", second.address().toString());
    IRStatement.Factor f = (IRStatement.Factor)loop.body().get(1);
    assertEquals("__factor0[i]", f.address().toString());
  }

  @Test
  public void testMissingStop() {
    Program prog = program("m", params(),
        forLoop(at(2), "i", slice(lit(0), null),
          sample(at(3), "x", call("Normal", lit(0.0), lit(1.0)))));
    try {
      build(prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals("for", e.getConstruct());
      assertEquals(2, e.getPos().line);
    }
  }

  @Test
  public void testUnknownDistribution() {
    Program prog = program("m", params(),
        sample(at(2), "x", call("Foo", lit(0.0))));
    try {
      build(prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals("Foo", e.getConstruct());
    }
  }

  @Test
  public void testDistributionAsValue() {
    Program prog = program("m", params(),
        assign(at(2), "y",
            call("Normal", lit(0.0), lit(1.0))));
    try {
      build(prog);
      fail("Expected CodegenError");
    } catch (CodegenError e) {
      assertEquals("Normal", e.getConstruct());
    }
  }
}
