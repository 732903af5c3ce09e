package minic.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import minic.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void restoreDefaults() {
    System.clearProperty(Settings.MAX_TREE_DEPTH);
    Settings.reset(Settings.MAX_TREE_DEPTH);
    Settings.reset(Settings.OPT_CONSTANT_FOLD);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertTrue(Settings.getBoolean(Settings.OPT_CONSTANT_FOLD));
    assertEquals(1024, Settings.getInt(Settings.MAX_TREE_DEPTH));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", Settings.get(Settings.DOT_OUTPUT_FILE));
    assertTrue(Settings.getKeys().contains(Settings.INPUT_FILENAME));
  }

  @Test
  public void testSetAndReset() throws InvalidOptionException {
    Settings.set(Settings.OPT_CONSTANT_FOLD, "False");
    assertFalse(Settings.getBoolean(Settings.OPT_CONSTANT_FOLD));
    Settings.reset(Settings.OPT_CONSTANT_FOLD);
    assertTrue(Settings.getBoolean(Settings.OPT_CONSTANT_FOLD));
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.MAX_TREE_DEPTH, "12");
    Settings.initProperties();
    assertEquals(12, Settings.getInt(Settings.MAX_TREE_DEPTH));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.OPT_CONSTANT_FOLD, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.OPT_CONSTANT_FOLD);
  }

  @Test
  public void testNonPositiveDepthRejected() throws InvalidOptionException {
    System.setProperty(Settings.MAX_TREE_DEPTH, "0");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.MAX_TREE_DEPTH);
    Settings.initProperties();
  }

  @Test
  public void testBadInteger() throws InvalidOptionException {
    Settings.set(Settings.MAX_TREE_DEPTH, "deep");
    exception.expect(InvalidOptionException.class);
    Settings.getInt(Settings.MAX_TREE_DEPTH);
  }
}
