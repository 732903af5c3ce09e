package minic.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.antlr.runtime.CommonToken;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import minic.ast.MiniCTree;
import minic.ast.antlr.MiniCParser;
import minic.common.Logging;
import minic.common.exceptions.CompilerRuntimeError;
import minic.common.exceptions.InvalidSyntaxException;
import minic.common.exceptions.TreeDepthException;
import minic.common.exceptions.UserException;
import minic.common.lang.Operators.BinaryOpcode;
import minic.frontend.tree.BinaryOp;
import minic.frontend.tree.CharLiteral;
import minic.frontend.tree.FloatLiteral;
import minic.frontend.tree.Identifier;
import minic.frontend.tree.IntLiteral;
import minic.frontend.tree.MainFunction;
import minic.frontend.tree.Node;
import minic.frontend.tree.Program;
import minic.frontend.tree.VariableDeclaration;

public class TreeLoweringTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TreeLoweringTest.minic.log", true);
  }

  private static Program lower(int maxDepth, String body)
      throws UserException {
    ParsedProgram parsed = ParsedProgram.parseString("test.c",
                                  "int main() {\n" + body + "\n}\n");
    return new TreeLowering(maxDepth).lower(parsed);
  }

  private static Program lower(String body) throws UserException {
    return lower(256, body);
  }

  private static Node first(String body) throws UserException {
    return lower(body).mainFunction.statements.get(0);
  }

  @Test
  public void testDeclarations() throws UserException {
    Program p = lower("const int x = 5; int y = x + 2;");
    assertEquals("Program(MainFunction([VarDecl(const int x = Int(5)), " +
        "VarDecl(int y = BinaryOp(Identifier(x) + Int(2)))]))",
        p.toString());

    Program expected = new Program(new MainFunction(Arrays.<Node>asList(
        new VariableDeclaration(true, "int", 0, "x", new IntLiteral(5)),
        new VariableDeclaration(false, "int", 0, "y",
            new BinaryOp(BinaryOpcode.PLUS, new Identifier("x"),
                         new IntLiteral(2))))));
    assertEquals(expected, p);
  }

  @Test
  public void testPointers() throws UserException {
    Program p = lower("int **p; float* q = (float*) p; *p = &x;");
    assertEquals("Program(MainFunction([VarDecl(int** p), " +
        "VarDecl(float* q = Cast((float*) Identifier(p))), " +
        "Assign(Deref(Identifier(p)) = AddressOf(Identifier(x)))]))",
        p.toString());
    VariableDeclaration decl =
        (VariableDeclaration)p.mainFunction.statements.get(0);
    assertEquals(2, decl.pointerDepth);
    assertEquals("int", decl.typeName);
  }

  @Test
  public void testPrecedenceAndAssociativity() throws UserException {
    assertEquals("BinaryOp(Int(1) + BinaryOp(Int(2) * Int(3)))",
                 first("1 + 2 * 3;").toString());
    assertEquals("BinaryOp(BinaryOp(Int(10) - Int(4)) - Int(3))",
                 first("10 - 4 - 3;").toString());
    assertEquals("BinaryOp(BinaryOp(Int(1) + Int(2)) * Int(3))",
                 first("(1 + 2) * 3;").toString());
    assertEquals("BinaryOp(BinaryOp(Identifier(a) < Int(1)) || " +
        "BinaryOp(Identifier(b) && BinaryOp(Int(1) << Int(2))))",
        first("a < 1 || b && 1 << 2;").toString());
  }

  @Test
  public void testUnaryAndIncrement() throws UserException {
    Program p = lower("x++; --y; -x; !x; ~x; +x;");
    assertEquals("Program(MainFunction([Increment(Identifier(x)++), " +
        "Decrement(--Identifier(y)), UnaryOp(-, Identifier(x)), " +
        "UnaryOp(!, Identifier(x)), UnaryOp(~, Identifier(x)), " +
        "UnaryOp(+, Identifier(x))]))", p.toString());
  }

  @Test
  public void testLiterals() throws UserException {
    assertEquals(new FloatLiteral(3.14),
        ((VariableDeclaration)first("float f = 3.14;")).initializer);
    assertEquals(new FloatLiteral(0.5), first(".5;"));
    assertEquals(new FloatLiteral(1000.0), first("1e3;"));
    assertEquals(new CharLiteral("a"), first("'a';"));
    assertEquals(new CharLiteral("\n"), first("'\\n';"));
    assertEquals(new CharLiteral("'"), first("'\\'';"));
    assertEquals(new IntLiteral(Long.MAX_VALUE),
                 first("9223372036854775807;"));
  }

  @Test
  public void testIntLiteralTooLarge() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("9223372036854775808");
    lower("int x = 9223372036854775808;");
  }

  @Test
  public void testReturn() throws UserException {
    Program p = lower("return; return 1 + x;");
    assertEquals("Program(MainFunction([Return(), " +
        "Return(BinaryOp(Int(1) + Identifier(x)))]))", p.toString());
  }

  @Test
  public void testDepthLimit() throws UserException {
    // Program, MainFunction, VarDecl, four operators and a literal
    String body = "int x = (((1 + 1) + 1) + 1) + 1;";
    assertTrue(lower(8, body) != null);
    exception.expect(TreeDepthException.class);
    lower(7, body);
  }

  @Test
  public void testDeepNestingReported() throws UserException {
    StringBuilder expr = new StringBuilder();
    for (int i = 0; i < 300; i++) {
      expr.append("- ");
    }
    expr.append("1;");
    exception.expect(TreeDepthException.class);
    lower(expr.toString());
  }

  @Test
  public void testUnexpectedProgramShape() throws UserException {
    MiniCTree prog = new MiniCTree(
        new CommonToken(MiniCParser.PROGRAM, "PROGRAM"));
    exception.expect(CompilerRuntimeError.class);
    new TreeLowering(10).lowerProgram(
        new Context(Logging.getLogger(), "bad.c"), prog);
  }

  @Test
  public void testUnexpectedExpressionToken() throws UserException {
    MiniCTree tree = new MiniCTree(
        new CommonToken(MiniCParser.MAIN_FUNCTION, "MAIN_FUNCTION"));
    exception.expect(CompilerRuntimeError.class);
    exception.expectMessage("MAIN_FUNCTION");
    new TreeLowering(10).lowerExpr(
        new Context(Logging.getLogger(), "bad.c"), tree);
  }

  @Test
  public void testBinaryOpMissingOperand() throws UserException {
    MiniCTree tree = new MiniCTree(
        new CommonToken(MiniCParser.BINARY_OP, "BINARY_OP"));
    tree.addChild(new MiniCTree(new CommonToken(MiniCParser.PLUS, "+")));
    exception.expect(CompilerRuntimeError.class);
    new TreeLowering(10).lowerExpr(
        new Context(Logging.getLogger(), "bad.c"), tree);
  }
}
