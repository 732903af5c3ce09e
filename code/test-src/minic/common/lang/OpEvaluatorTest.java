package minic.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import org.junit.Test;

import minic.common.lang.Operators.BinaryOpcode;
import minic.common.lang.Operators.UnaryOpcode;
import minic.frontend.tree.CharLiteral;
import minic.frontend.tree.FloatLiteral;
import minic.frontend.tree.IntLiteral;
import minic.frontend.tree.Literal;

public class OpEvaluatorTest {

  private static IntLiteral i(long v) {
    return new IntLiteral(v);
  }

  private static FloatLiteral f(double v) {
    return new FloatLiteral(v);
  }

  private static Literal bin(BinaryOpcode op, Literal l, Literal r) {
    return OpEvaluator.eval(op, l, r);
  }

  @Test
  public void testIntArithmetic() {
    assertEquals(i(5), bin(BinaryOpcode.PLUS, i(2), i(3)));
    assertEquals(i(-1), bin(BinaryOpcode.MINUS, i(2), i(3)));
    assertEquals(i(6), bin(BinaryOpcode.MULT, i(2), i(3)));
  }

  @Test
  public void testDivisionTruncatesTowardZero() {
    assertEquals(i(3), bin(BinaryOpcode.DIV, i(7), i(2)));
    assertEquals(i(-3), bin(BinaryOpcode.DIV, i(-7), i(2)));
    assertEquals(i(1), bin(BinaryOpcode.MOD, i(7), i(2)));
    assertEquals(i(-1), bin(BinaryOpcode.MOD, i(-7), i(2)));
    assertEquals(i(1), bin(BinaryOpcode.MOD, i(7), i(-2)));
  }

  @Test
  public void testOverflowWraps() {
    assertEquals(i(Long.MIN_VALUE),
                 bin(BinaryOpcode.PLUS, i(Long.MAX_VALUE), i(1)));
    assertEquals(i(Long.MIN_VALUE),
                 OpEvaluator.eval(UnaryOpcode.NEGATE, i(Long.MIN_VALUE)));
  }

  @Test
  public void testComparisonsAndLogic() {
    assertEquals(i(1), bin(BinaryOpcode.LT, i(1), i(2)));
    assertEquals(i(0), bin(BinaryOpcode.GTE, i(1), i(2)));
    assertEquals(i(1), bin(BinaryOpcode.EQ, i(4), i(4)));
    assertEquals(i(1), bin(BinaryOpcode.NEQ, i(4), i(5)));
    assertEquals(i(0), bin(BinaryOpcode.AND, i(3), i(0)));
    assertEquals(i(1), bin(BinaryOpcode.AND, i(3), i(-2)));
    assertEquals(i(1), bin(BinaryOpcode.OR, i(0), i(7)));
    assertEquals(i(0), bin(BinaryOpcode.OR, i(0), i(0)));
  }

  @Test
  public void testBitwiseAndShift() {
    assertEquals(i(0x8), bin(BinaryOpcode.BIT_AND, i(0xC), i(0xA)));
    assertEquals(i(0xE), bin(BinaryOpcode.BIT_OR, i(0xC), i(0xA)));
    assertEquals(i(0x6), bin(BinaryOpcode.BIT_XOR, i(0xC), i(0xA)));
    assertEquals(i(40), bin(BinaryOpcode.SHL, i(5), i(3)));
    assertEquals(i(-4), bin(BinaryOpcode.SHR, i(-16), i(2)));
  }

  @Test
  public void testUnsafeOperationsNotEvaluated() {
    assertNotNull(OpEvaluator.unsafeReason(BinaryOpcode.DIV, i(5), i(0)));
    assertNotNull(OpEvaluator.unsafeReason(BinaryOpcode.MOD, i(5), i(0)));
    assertNotNull(OpEvaluator.unsafeReason(BinaryOpcode.DIV, f(5), f(0)));
    assertNotNull(OpEvaluator.unsafeReason(BinaryOpcode.SHL, i(1), i(64)));
    assertNotNull(OpEvaluator.unsafeReason(BinaryOpcode.SHR, i(1), i(-1)));
    assertNull(OpEvaluator.unsafeReason(BinaryOpcode.SHL, i(1), i(63)));
    assertNull(OpEvaluator.unsafeReason(BinaryOpcode.MULT, i(5), i(0)));

    assertNull(bin(BinaryOpcode.DIV, i(5), i(0)));
    assertNull(bin(BinaryOpcode.DIV, f(5), i(0)));
    assertNull(bin(BinaryOpcode.SHL, i(1), i(100)));
  }

  @Test
  public void testFloatPromotion() {
    assertEquals(f(3.5), bin(BinaryOpcode.PLUS, i(1), f(2.5)));
    assertEquals(f(2.5), bin(BinaryOpcode.DIV, f(5.0), i(2)));
    assertEquals(i(1), bin(BinaryOpcode.LT, f(1.5), i(2)));
    // Only integral operands for these
    assertNull(bin(BinaryOpcode.MOD, f(5.0), i(2)));
    assertNull(bin(BinaryOpcode.BIT_AND, f(5.0), i(2)));
    assertNull(bin(BinaryOpcode.AND, f(1.0), i(1)));
  }

  @Test
  public void testCharPromotesToInt() {
    assertEquals(i('a' + 1), bin(BinaryOpcode.PLUS, new CharLiteral("a"), i(1)));
    assertEquals(i(1), bin(BinaryOpcode.EQ, new CharLiteral("A"), i(65)));
    assertEquals(i(-'a'),
        OpEvaluator.eval(UnaryOpcode.NEGATE, new CharLiteral("a")));
  }

  @Test
  public void testUnary() {
    assertEquals(i(-5), OpEvaluator.eval(UnaryOpcode.NEGATE, i(5)));
    assertEquals(i(5), OpEvaluator.eval(UnaryOpcode.PLUS, i(5)));
    assertEquals(i(1), OpEvaluator.eval(UnaryOpcode.NOT, i(0)));
    assertEquals(i(0), OpEvaluator.eval(UnaryOpcode.NOT, i(9)));
    assertEquals(i(-6), OpEvaluator.eval(UnaryOpcode.BIT_NOT, i(5)));
    assertEquals(f(-2.5), OpEvaluator.eval(UnaryOpcode.NEGATE, f(2.5)));
    assertNull(OpEvaluator.eval(UnaryOpcode.BIT_NOT, f(2.5)));
  }
}
