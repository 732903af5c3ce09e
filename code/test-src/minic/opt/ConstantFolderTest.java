package minic.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import minic.common.Logging;
import minic.common.Settings;
import minic.common.exceptions.TreeDepthException;
import minic.common.exceptions.UserException;
import minic.frontend.ParsedProgram;
import minic.frontend.TreeLowering;
import minic.frontend.tree.Node;
import minic.frontend.tree.Program;
import minic.frontend.tree.VariableDeclaration;

public class ConstantFolderTest {

  private static final ConstantFolder FOLDER = new ConstantFolder(true, 256);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ConstantFolderTest.minic.log", true);
  }

  private static Program lower(String body) throws UserException {
    ParsedProgram parsed = ParsedProgram.parseString("fold.c",
                                  "int main() {\n" + body + "\n}\n");
    return new TreeLowering(256).lower(parsed);
  }

  private static FoldResult fold(String body) throws UserException {
    return FOLDER.fold(lower(body));
  }

  private static Node stmt(FoldResult result, int i) {
    return ((Program)result.tree).mainFunction.statements.get(i);
  }

  private static String stmtStr(FoldResult result, int i) {
    return stmt(result, i).toString();
  }

  @Test
  public void testPropagateConstant() throws UserException {
    FoldResult r = fold("const int x = 5; int y = x + 2;");
    assertEquals("VarDecl(const int x = Int(5))", stmtStr(r, 0));
    assertEquals("VarDecl(int y = Int(7))", stmtStr(r, 1));
    assertEquals(2, r.folds);
    assertFalse(r.hasWarnings());
  }

  @Test
  public void testNestedFolding() throws UserException {
    FoldResult r = fold("int a = -(2 * 3) + 4; int t = 1 && 0 || 3;");
    assertEquals("VarDecl(int a = Int(-2))", stmtStr(r, 0));
    assertEquals("VarDecl(int t = Int(1))", stmtStr(r, 1));
  }

  @Test
  public void testReassignment() throws UserException {
    FoldResult r = fold("int x = 5; x = 10; int y = x;");
    assertEquals("Assign(Identifier(x) = Int(10))", stmtStr(r, 1));
    assertEquals("VarDecl(int y = Int(10))", stmtStr(r, 2));
  }

  @Test
  public void testSelfAssignment() throws UserException {
    FoldResult r = fold("int x = 1; x = x + 1; int y = x;");
    assertEquals("Assign(Identifier(x) = Int(2))", stmtStr(r, 1));
    assertEquals("VarDecl(int y = Int(2))", stmtStr(r, 2));
  }

  @Test
  public void testIncrementInvalidates() throws UserException {
    FoldResult r = fold("int x = 5; x++; int y = x + 1;");
    assertEquals("Increment(Identifier(x)++)", stmtStr(r, 1));
    assertEquals("VarDecl(int y = BinaryOp(Identifier(x) + Int(1)))",
                 stmtStr(r, 2));

    r = fold("int x = 5; --x; int y = x;");
    assertEquals("Decrement(--Identifier(x))", stmtStr(r, 1));
    assertEquals("VarDecl(int y = Identifier(x))", stmtStr(r, 2));
  }

  @Test
  public void testNonLiteralAssignmentInvalidates() throws UserException {
    FoldResult r = fold("int x = 5; x = y; int z = x;");
    assertEquals("VarDecl(int z = Identifier(x))", stmtStr(r, 2));
  }

  @Test
  public void testRedeclarationInvalidates() throws UserException {
    FoldResult r = fold("int x = 5; int x; int z = x;");
    assertEquals("VarDecl(int z = Identifier(x))", stmtStr(r, 2));
  }

  @Test
  public void testZeroDivisorNotFolded() throws UserException {
    FoldResult r = fold("int a = 5 / 0; int b = 1 + 2;");
    assertEquals("VarDecl(int a = BinaryOp(Int(5) / Int(0)))",
                 stmtStr(r, 0));
    assertEquals("VarDecl(int b = Int(3))", stmtStr(r, 1));
    assertEquals(1, r.warnings.size());
    assertTrue(r.warnings.get(0).contains("division by zero"));
  }

  @Test
  public void testPropagatedZeroDivisor() throws UserException {
    FoldResult r = fold("int z = 0; int a = 10 % z; float f = 1.0 / 0.0;");
    assertEquals("VarDecl(int a = BinaryOp(Int(10) % Int(0)))",
                 stmtStr(r, 1));
    assertEquals("VarDecl(float f = BinaryOp(Float(1.0) / Float(0.0)))",
                 stmtStr(r, 2));
    assertEquals(2, r.warnings.size());
  }

  @Test
  public void testShiftOutOfRangeNotFolded() throws UserException {
    FoldResult r = fold("int s = 1 << 64; int t = 1 << 4;");
    assertEquals("VarDecl(int s = BinaryOp(Int(1) << Int(64)))",
                 stmtStr(r, 0));
    assertEquals("VarDecl(int t = Int(16))", stmtStr(r, 1));
    assertEquals(1, r.warnings.size());
  }

  @Test
  public void testCastRetained() throws UserException {
    FoldResult r = fold("int x = (int) 3; float f = (float)(1 + 2);");
    assertEquals("VarDecl(int x = Cast((int) Int(3)))", stmtStr(r, 0));
    assertEquals("VarDecl(float f = Cast((float) Int(3)))", stmtStr(r, 1));
  }

  @Test
  public void testAddressOfNotSubstituted() throws UserException {
    FoldResult r = fold("int x = 5; int* p = &x; *p = 7; int y = x;");
    assertEquals("VarDecl(int* p = AddressOf(Identifier(x)))",
                 stmtStr(r, 1));
    assertEquals("Assign(Deref(Identifier(p)) = Int(7))", stmtStr(r, 2));
    // Writes through pointers aren't tracked
    assertEquals("VarDecl(int y = Int(5))", stmtStr(r, 3));
  }

  @Test
  public void testMixedTypes() throws UserException {
    FoldResult r = fold("char c = 'a'; int d = c + 1; float f = 1.5 * 2;" +
                        " float g = 5.0 % 2;");
    assertEquals("VarDecl(int d = Int(98))", stmtStr(r, 1));
    assertEquals("VarDecl(float f = Float(3.0))", stmtStr(r, 2));
    assertEquals("VarDecl(float g = BinaryOp(Float(5.0) % Int(2)))",
                 stmtStr(r, 3));
    assertEquals(1, r.warnings.size());
    assertTrue(r.warnings.get(0).contains("integer operands"));
  }

  @Test
  public void testFloatOperandWarningsPerPass() throws UserException {
    Program p = lower("float g = 5.0 << 1; float h = ~2.5;");
    for (int pass = 0; pass < 2; pass++) {
      FoldResult r = FOLDER.fold(p);
      assertSame(p, r.tree);
      assertEquals(2, r.warnings.size());
      assertTrue(r.warnings.get(1).contains("not defined on Float"));
    }
  }

  @Test
  public void testReturnFolded() throws UserException {
    FoldResult r = fold("int x = 2; return x * x;");
    assertEquals("Return(Int(4))", stmtStr(r, 1));
  }

  @Test
  public void testPropagatedLiteralsAreCopies() throws UserException {
    FoldResult r = fold("int x = 5; int y = x; int z = x;");
    Node y = ((VariableDeclaration)stmt(r, 1)).initializer;
    Node z = ((VariableDeclaration)stmt(r, 2)).initializer;
    assertEquals(y, z);
    assertNotSame(y, z);
    assertNotSame(((VariableDeclaration)stmt(r, 0)).initializer, y);
  }

  @Test
  public void testIdempotent() throws UserException {
    FoldResult once = fold("int x = 5; x++; int y = x + 2 * 3; " +
                           "int z = y / 0; return (int) z;");
    FoldResult twice = FOLDER.fold(once.tree);
    assertEquals(once.tree, twice.tree);
    assertEquals(0, twice.folds);
  }

  @Test
  public void testInputUnchanged() throws UserException {
    Program p = lower("int x = 1 + 2; int y = x;");
    String before = p.toString();
    FOLDER.fold(p);
    assertEquals(before, p.toString());
  }

  @Test
  public void testUnchangedTreeShared() throws UserException {
    Program p = lower("int x; x++; return y;");
    assertSame(p, FOLDER.fold(p).tree);
  }

  @Test
  public void testDisabled() throws UserException {
    Program p = lower("int x = 1 + 2;");
    FoldResult r = new ConstantFolder(false, 256).fold(p);
    assertSame(p, r.tree);
    assertEquals(0, r.folds);
  }

  @Test
  public void testDepthLimit() throws UserException {
    Program p = lower("int x = 1 + (2 + (3 + 4));");
    exception.expect(TreeDepthException.class);
    new ConstantFolder(true, 5).fold(p);
  }

  @Test
  public void testOptimizerPass() throws UserException {
    Program p = lower("int x = 6 * 7;");
    Program folded = FOLDER.optimize(Logging.getLogger(), p);
    assertEquals("VarDecl(int x = Int(42))",
                 folded.mainFunction.statements.get(0).toString());
    assertEquals(Settings.OPT_CONSTANT_FOLD, FOLDER.getConfigEnabledKey());
  }
}
