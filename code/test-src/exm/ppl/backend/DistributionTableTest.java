package exm.ppl.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import exm.ppl.backend.gen.GenDistributions;
import exm.ppl.backend.pyro.PyroDistributions;
import exm.ppl.backend.turing.TuringDistributions;
import exm.ppl.common.lang.BackendDescriptor;
import exm.ppl.common.lang.BackendDescriptor.Support;
import exm.ppl.common.lang.DistributionDescriptor;
import exm.ppl.common.lang.Distributions;
import exm.ppl.common.lang.Target;

/**
 * The linter's view of each backend must agree with what its generator
 * can render.
 */
public class DistributionTableTest {

  private static final Map<Target, DistributionTable> TABLES =
      ImmutableMap.of(Target.TURING, TuringDistributions.TABLE,
                      Target.GEN, GenDistributions.TABLE,
                      Target.PYRO, PyroDistributions.TABLE);

  @Test
  public void testTablesMatchDescriptors() {
    for (Map.Entry<Target, DistributionTable> e: TABLES.entrySet()) {
      BackendDescriptor backend = BackendDescriptor.forTarget(e.getKey());
      DistributionTable table = e.getValue();
      for (String name: Distributions.names()) {
        check(backend, table, name);
      }
      check(backend, table, BackendDescriptor.FACTOR);
      for (String construct: table.constructs()) {
        assertTrue(backend + " renders unknown " + construct,
                   construct.equals(BackendDescriptor.FACTOR) ||
                   Distributions.isDistribution(construct));
      }
    }
  }

  private static void check(BackendDescriptor backend,
                            DistributionTable table, String construct) {
    if (backend.support(construct) == Support.UNSUPPORTED) {
      assertNull(backend + " renders unsupported " + construct,
                 table.lookup(construct));
    } else {
      assertNotNull(backend + " has no template for " + construct,
                    table.lookup(construct));
    }
  }

  @Test
  public void testTemplateArity() {
    for (Map.Entry<Target, DistributionTable> e: TABLES.entrySet()) {
      for (String name: e.getValue().constructs()) {
        DistributionDescriptor d = Distributions.lookup(name);
        if (d == null) {
          continue;
        }
        assertEquals(e.getKey() + " " + name, d.arity(),
                     e.getValue().lookup(name).arity());
      }
    }
  }

  @Test
  public void testSupportLevels() {
    BackendDescriptor turing = BackendDescriptor.forTarget(Target.TURING);
    assertEquals(Support.REWRITE, turing.support("HalfNormal"));
    assertEquals(Support.NATIVE, turing.support("Normal"));
    assertEquals(Support.UNSUPPORTED,
        BackendDescriptor.forTarget(Target.GEN).support("HalfNormal"));
    assertEquals(Support.UNSUPPORTED,
        BackendDescriptor.forTarget(Target.PYRO).support("DiscreteUniform"));
  }

  @Test
  public void testTemplateRendering() {
    DistributionTemplate t = GenDistributions.TABLE.lookup("Categorical");
    assertEquals(2, t.occurrences(1));
    assertEquals("labeled_categorical(0:length(p)-1, p)",
                 t.render(Arrays.asList("p")));
  }

  @Test
  public void testSupportedSet() {
    BackendDescriptor turing = BackendDescriptor.forTarget(Target.TURING);
    assertTrue(turing.supported().contains("Normal"));
    assertFalse("Rewritten constructs are listed separately",
                turing.supported().contains("HalfNormal"));
    BackendDescriptor gen = BackendDescriptor.forTarget(Target.GEN);
    assertFalse(gen.supported().contains(BackendDescriptor.FACTOR));
    assertTrue(BackendDescriptor.forTarget(Target.PYRO).supported()
                        .contains(BackendDescriptor.FACTOR));
  }

  @Test
  public void testTargetIds() {
    assertEquals(Target.PYRO, Target.fromId("PYRO"));
    assertEquals(Target.GEN, Target.fromId(Target.GEN.id()));
    assertNull(Target.fromId("stan"));
  }
}
