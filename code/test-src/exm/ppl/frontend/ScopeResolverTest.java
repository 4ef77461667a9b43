package exm.ppl.frontend;

import static exm.ppl.ast.Ast.assign;
import static exm.ppl.ast.Ast.at;
import static exm.ppl.ast.Ast.call;
import static exm.ppl.ast.Ast.forLoop;
import static exm.ppl.ast.Ast.ifThen;
import static exm.ppl.ast.Ast.lit;
import static exm.ppl.ast.Ast.params;
import static exm.ppl.ast.Ast.plus;
import static exm.ppl.ast.Ast.program;
import static exm.ppl.ast.Ast.range;
import static exm.ppl.ast.Ast.sample;
import static exm.ppl.ast.Ast.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.ppl.ast.Program;
import exm.ppl.ast.Statement;
import exm.ppl.common.Logging;
import exm.ppl.common.exceptions.ScopeError;
import exm.ppl.common.lang.Role;
import exm.ppl.common.lang.Shape;
import exm.ppl.common.lang.Symbol;
import exm.ppl.common.lang.Symbol.SymbolKind;
import exm.ppl.testing.Models;

public class ScopeResolverTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, true);
  }

  private static Symbol only(SymbolTable table, String name) {
    List<Symbol> syms = table.symbolsNamed(name);
    assertEquals("Expected one symbol named " + name, 1, syms.size());
    return syms.get(0);
  }

  @Test
  public void testCoinTossRoles() throws ScopeError {
    SymbolTable table = ScopeResolver.resolve(Models.coinToss());
    Symbol p = only(table, "p");
    assertEquals(SymbolKind.LOCAL, p.kind());
    assertEquals(Role.LATENT, p.role());
    assertTrue(p.isSampled());

    Symbol data = only(table, "data");
    assertEquals(SymbolKind.PARAMETER, data.kind());
    assertTrue("Sampling into a parameter observes it", data.isSampled());
    assertTrue("Bernoulli draws are discrete", data.isDiscreteOrigin());

    assertEquals(SymbolKind.LOOP_INDEX, only(table, "i").kind());
  }

  @Test
  public void testImplicitContainers() throws ScopeError {
    Program gmm = Models.gaussianMixture();
    SymbolTable table = ScopeResolver.resolve(gmm);

    Symbol mu = only(table, "mu");
    assertEquals(Shape.Kind.VECTOR, mu.shape().kind());
    assertEquals("Length comes from the loop stop", "K",
                 mu.shape().dim(0).toString());
    assertEquals("Declared outside the loop", 0, mu.scopeDepth());

    Statement.For kLoop = (Statement.For)gmm.body().get(0);
    Statement.For nLoop = (Statement.For)gmm.body().get(1);
    assertEquals(1, table.implicitDeclarations(kLoop).size());
    assertSame(mu, table.implicitDeclarations(kLoop).get(0));

    Symbol c = only(table, "c");
    assertSame(nLoop, c.implicitLoop());
    assertTrue(c.isDiscreteOrigin());
    assertFalse(mu.isDiscreteOrigin());
  }

  @Test
  public void testAllocatedContainerTakesRoleFromFirstWrite()
                                              throws ScopeError {
    SymbolTable table = ScopeResolver.resolve(Models.hmm());
    Symbol z = only(table, "z");
    assertEquals(Role.LATENT, z.role());
    assertEquals(Shape.Kind.VECTOR, z.shape().kind());
    assertTrue(z.isDiscreteOrigin());
    assertTrue(table.conflicts().isEmpty());
  }

  @Test
  public void testBranchPromotion() throws ScopeError {
    SymbolTable table = ScopeResolver.resolve(Models.burglary());
    assertEquals("p is written on every path, so visible after the if",
                 1, table.symbolsNamed("p").size());
    assertTrue(table.isComplete());
  }

  @Test
  public void testOneBranchNotPromoted() {
    Program prog = program("m", params(),
        ifThen(at(2), lit(true), assign(at(3), "x", lit(1))),
        assign(at(4), "y", var(at(4, 5), "x")));
    SymbolTable table = ScopeResolver.resolveLenient(prog);
    assertEquals(1, table.unresolved().size());
    assertEquals(4, table.unresolved().get(0).pos().line);
    assertEquals(5, table.unresolved().get(0).pos().column);
  }

  @Test
  public void testLoopLocalNotVisibleAfterLoop() {
    Program prog = program("m", params("n"),
        forLoop(at(2), "i", range(lit(0), var("n")),
          assign(at(3), "acc", var("i"))),
        assign(at(4), "out", plus(var("acc"), var("i"))));
    SymbolTable table = ScopeResolver.resolveLenient(prog);
    assertEquals("Both acc and i are out of scope", 2,
                 table.unresolved().size());
  }

  @Test
  public void testRoleConflict() {
    Program prog = program("m", params(),
        assign(at(2), "x", lit(1.0)),
        sample(at(3), "x", call("Normal", lit(0.0), lit(1.0))));
    SymbolTable table = ScopeResolver.resolveLenient(prog);
    assertEquals(1, table.conflicts().size());
    assertEquals(3, table.conflicts().get(0).statement.pos().line);
  }

  @Test
  public void testWriteToLoopIndexIsConflict() {
    Program prog = program("m", params("n"),
        forLoop(at(2), "i", range(lit(0), var("n")),
          assign(at(3), "i", lit(0))));
    SymbolTable table = ScopeResolver.resolveLenient(prog);
    assertEquals(1, table.conflicts().size());
    assertEquals(SymbolKind.LOOP_INDEX,
                 table.conflicts().get(0).symbol.kind());
  }

  @Test
  public void testConstantTracking() throws ScopeError {
    Program prog = program("m", params(),
        assign(at(2), "n", lit(3)),
        assign(at(3), "m", plus(var("n"), lit(2))));
    SymbolTable table = ScopeResolver.resolve(prog);
    assertEquals(Long.valueOf(3), only(table, "n").constantValue());
    assertEquals(Long.valueOf(5), only(table, "m").constantValue());
  }

  @Test
  public void testStrictResolveThrows() throws ScopeError {
    Program prog = program("m", params(),
        assign(at(2), "y", plus(var("a"), var("b"))));
    exception.expect(ScopeError.class);
    ScopeResolver.resolve(prog);
  }
}
