package exm.ppl.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.After;
import org.junit.Test;

import exm.ppl.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void restore() {
    System.clearProperty(Settings.EMIT_INDENT);
    System.clearProperty(Settings.TEMP_PREFIX);
    Settings.set(Settings.EMIT_INDENT, "4");
    Settings.set(Settings.EMIT_BANNER, "off");
    Settings.set(Settings.TEMP_PREFIX, "__tmp");
    Settings.set(Settings.PYRO_VECTORIZE, "true");
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(4, Settings.getInt(Settings.EMIT_INDENT));
    assertEquals("off", Settings.get(Settings.EMIT_BANNER));
    assertEquals("__tmp", Settings.get(Settings.TEMP_PREFIX));
    assertTrue(Settings.getBoolean(Settings.PYRO_VECTORIZE));
    assertFalse(Settings.getBoolean(Settings.LINT_WARNINGS_AS_ERRORS));
    assertTrue(Settings.getKeys().contains(Settings.GEN_AGGREGATOR_NAME));
  }

  @Test
  public void testSystemOverride() throws InvalidOptionException {
    System.setProperty(Settings.EMIT_INDENT, "2");
    Settings.initPPLProperties();
    assertEquals(2, Settings.getInt(Settings.EMIT_INDENT));
  }

  @Test
  public void testBooleanCase() throws InvalidOptionException {
    Settings.set(Settings.PYRO_VECTORIZE, " FALSE ");
    assertFalse(Settings.getBoolean(Settings.PYRO_VECTORIZE));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.PYRO_VECTORIZE, "yes");
    Settings.getBoolean(Settings.PYRO_VECTORIZE);
  }

  @Test
  public void testIndentRange() {
    System.setProperty(Settings.EMIT_INDENT, "0");
    try {
      Settings.initPPLProperties();
      fail("Expected InvalidOptionException");
    } catch (InvalidOptionException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("1-16"));
    }
  }

  @Test
  public void testIdentifierValidated() {
    System.setProperty(Settings.TEMP_PREFIX, "tmp-");
    try {
      Settings.initPPLProperties();
      fail("Expected InvalidOptionException");
    } catch (InvalidOptionException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("'-'"));
    }
  }

  @Test
  public void testBannerChoices() throws InvalidOptionException {
    Settings.set(Settings.EMIT_BANNER, "Header");
    Settings.initPPLProperties();

    Settings.set(Settings.EMIT_BANNER, "always");
    try {
      Settings.initPPLProperties();
      fail("Expected InvalidOptionException");
    } catch (InvalidOptionException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("'header'"));
    }
  }
}
