package exm.ppl.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.ppl.backend.gen.GenDistributions;
import exm.ppl.backend.turing.TuringDistributions;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Operators.BinaryOperator;
import exm.ppl.ir.AddressTemplate;
import exm.ppl.ir.IRExpr;
import exm.ppl.ir.IndexComponent;

public class HoisterTest {

  private static final IRExpr T = new IRExpr.Var("t", false);
  private static final IRExpr I = new IRExpr.Var("i", false);

  /** z[t - 1] where z is latent */
  private static IRExpr previousState() {
    return new IRExpr.Index(new IRExpr.Var("z", true),
        Arrays.asList(new IndexComponent(
            new IRExpr.Binary(BinaryOperator.MINUS, T,
                              IRExpr.Literal.intLit(1)), true, false)));
  }

  /** trans[z[t - 1], :] */
  private static IRExpr transitionRow() {
    return new IRExpr.Index(new IRExpr.Var("trans", false),
        Arrays.asList(new IndexComponent(previousState(), true, true),
                      IndexComponent.slice(
                          new IRExpr.Range(null, null, null))));
  }

  private static IRExpr.Distribution dist(String name, IRExpr... args) {
    return new IRExpr.Distribution(Distributions.lookup(name),
                                   Arrays.asList(args));
  }

  @Test
  public void testRepeatedTemplateArgument() {
    GeneratorState state = new GeneratorState("__tmp");
    Hoister h = Hoister.analyze(null, dist("Categorical", transitionRow()),
        Collections.<IRExpr>emptyList(), GenDistributions.TABLE, state);
    assertEquals(1, h.hoisted().size());
    assertEquals("Outermost repeated expression only",
                 transitionRow(), h.hoisted().get("__tmp0"));
    assertEquals("__tmp0", h.substitutions().get(transitionRow()));
    assertEquals(1, state.tempCount());
  }

  @Test
  public void testSingleUseNotHoisted() {
    Hoister h = Hoister.analyze(null, dist("Normal", previousState(),
                                           IRExpr.Literal.intLit(1)),
        Collections.<IRExpr>emptyList(), TuringDistributions.TABLE,
        new GeneratorState("__tmp"));
    assertTrue(h.isEmpty());
  }

  @Test
  public void testAddressAndArgument() {
    IRExpr zi = new IRExpr.Index(new IRExpr.Var("z", true),
        Arrays.asList(new IndexComponent(I, true, false)));
    AddressTemplate address = new AddressTemplate("y",
        Arrays.<IRExpr>asList(zi));
    IRExpr.Distribution normal = dist("Normal",
        new IRExpr.Index(new IRExpr.Var("mu", false),
            Arrays.asList(new IndexComponent(zi, true, true))),
        IRExpr.Literal.intLit(1));

    Hoister h = Hoister.analyze(address, normal,
        Collections.<IRExpr>emptyList(), GenDistributions.TABLE,
        new GeneratorState("__tmp"));
    assertEquals(1, h.hoisted().size());
    assertEquals(zi, h.hoisted().get("__tmp0"));

    // Without a rendered address z[i] is evaluated once
    h = Hoister.analyze(null, normal, Collections.<IRExpr>emptyList(),
                        GenDistributions.TABLE, new GeneratorState("__tmp"));
    assertTrue(h.isEmpty());
  }

  @Test
  public void testDeterministicNotHoisted() {
    IRExpr row = new IRExpr.Index(new IRExpr.Var("trans", false),
        Arrays.asList(new IndexComponent(T, true, false),
                      IndexComponent.slice(
                          new IRExpr.Range(null, null, null))));
    Hoister h = Hoister.analyze(null, dist("Categorical", row),
        Collections.<IRExpr>emptyList(), GenDistributions.TABLE,
        new GeneratorState("__tmp"));
    assertTrue(h.isEmpty());
  }
}
