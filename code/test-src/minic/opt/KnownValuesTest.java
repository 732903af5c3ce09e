package minic.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import minic.frontend.tree.FloatLiteral;
import minic.frontend.tree.IntLiteral;
import minic.frontend.tree.Literal;

public class KnownValuesTest {

  @Test
  public void testBindLookupUnbind() {
    KnownValues known = new KnownValues();
    assertNull(known.lookup("x"));

    IntLiteral five = new IntLiteral(5);
    known.bind("x", five);
    assertTrue(known.isKnown("x"));
    Literal val = known.lookup("x");
    assertEquals(five, val);
    assertNotSame(five, val);
    assertNotSame(val, known.lookup("x"));

    known.bind("x", new FloatLiteral(2.5));
    assertEquals(new FloatLiteral(2.5), known.lookup("x"));
    assertEquals(1, known.size());

    assertTrue(known.unbind("x"));
    assertFalse(known.unbind("x"));
    assertFalse(known.isKnown("x"));
  }
}
