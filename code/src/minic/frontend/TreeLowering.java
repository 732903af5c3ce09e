/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package minic.frontend;

import java.util.ArrayList;
import java.util.List;

import minic.ast.MiniCTree;
import minic.ast.antlr.MiniCParser;
import minic.common.Logging;
import minic.common.exceptions.CompilerRuntimeError;
import minic.common.exceptions.TreeDepthException;
import minic.common.exceptions.UserException;
import minic.common.lang.Operators;
import minic.frontend.tree.AddressOf;
import minic.frontend.tree.Assignment;
import minic.frontend.tree.BinaryOp;
import minic.frontend.tree.Cast;
import minic.frontend.tree.CharLiteral;
import minic.frontend.tree.Decrement;
import minic.frontend.tree.Dereference;
import minic.frontend.tree.FloatLiteral;
import minic.frontend.tree.Identifier;
import minic.frontend.tree.Increment;
import minic.frontend.tree.IntLiteral;
import minic.frontend.tree.Literals;
import minic.frontend.tree.MainFunction;
import minic.frontend.tree.Node;
import minic.frontend.tree.Program;
import minic.frontend.tree.Return;
import minic.frontend.tree.UnaryOp;
import minic.frontend.tree.VariableDeclaration;

/**
 * Translates the ANTLR parse tree into the AST.  One AST node is built
 * for each labelled construct; nothing is evaluated here.
 *
 * The parser guarantees the shape of the tree, so any mismatch is an
 * internal error rather than a problem with the user's program.
 */
public class TreeLowering {

  private final int maxDepth;

  public TreeLowering(int maxDepth) {
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be positive: "
                                         + maxDepth);
    }
    this.maxDepth = maxDepth;
  }

  public Program lower(ParsedProgram parsed) throws UserException {
    Context context = new Context(Logging.getLogger(),
                                  parsed.inputFilePath);
    return lowerProgram(context, parsed.ast);
  }

  /**
   * Lower a whole program
   * @param tree a PROGRAM tree
   * @throws TreeDepthException if nesting exceeds the maximum depth
   * @throws UserException if a literal is malformed
   */
  public Program lowerProgram(Context context, MiniCTree tree)
      throws UserException {
    enter(context, tree);
    try {
      checkType(tree, MiniCParser.PROGRAM);
      checkChildCount(tree, 1);
      return new Program(lowerMainFunction(context, tree.child(0)));
    } finally {
      context.exit();
    }
  }

  private MainFunction lowerMainFunction(Context context, MiniCTree tree)
      throws UserException {
    enter(context, tree);
    try {
      checkType(tree, MiniCParser.MAIN_FUNCTION);
      List<Node> statements = new ArrayList<Node>(tree.childCount());
      for (MiniCTree stmt: tree.children()) {
        statements.add(lowerStatement(context, stmt));
      }
      return new MainFunction(statements);
    } finally {
      context.exit();
    }
  }

  private Node lowerStatement(Context context, MiniCTree tree)
      throws UserException {
    switch (tree.getType()) {
      case MiniCParser.VAR_DECL:
        return lowerVarDecl(context, tree);
      case MiniCParser.ASSIGN_STMT:
        return lowerAssignment(context, tree);
      case MiniCParser.RETURN_STMT:
        return lowerReturn(context, tree);
      default:
        // Expression statement
        return lowerExpr(context, tree);
    }
  }

  private VariableDeclaration lowerVarDecl(Context context, MiniCTree tree)
      throws UserException {
    enter(context, tree);
    try {
      int pos = 0;
      boolean isConst = false;
      if (childType(tree, pos) == MiniCParser.CONST) {
        isConst = true;
        pos++;
      }
      String typeName = typeName(tree, pos++);
      int pointerDepth = countPointers(tree, pos);
      pos += pointerDepth;

      MiniCTree nameTree = child(tree, pos++);
      checkType(nameTree, MiniCParser.ID);
      String name = nameTree.getText();

      Node init = null;
      if (pos < tree.childCount()) {
        init = lowerExpr(context, tree.child(pos++));
      }
      checkChildCount(tree, pos);

      LogHelper.trace(context, "declare " + name);
      return new VariableDeclaration(isConst, typeName, pointerDepth, name,
                                     init);
    } finally {
      context.exit();
    }
  }

  private Assignment lowerAssignment(Context context, MiniCTree tree)
      throws UserException {
    enter(context, tree);
    try {
      checkChildCount(tree, 2);
      Node target = lowerExpr(context, tree.child(0));
      Node value = lowerExpr(context, tree.child(1));
      return new Assignment(target, value);
    } finally {
      context.exit();
    }
  }

  private Return lowerReturn(Context context, MiniCTree tree)
      throws UserException {
    enter(context, tree);
    try {
      if (tree.childCount() == 0) {
        return new Return(null);
      }
      checkChildCount(tree, 1);
      return new Return(lowerExpr(context, tree.child(0)));
    } finally {
      context.exit();
    }
  }

  /**
   * Lower an expression tree
   */
  public Node lowerExpr(Context context, MiniCTree tree)
      throws UserException {
    enter(context, tree);
    try {
      switch (tree.getType()) {
        case MiniCParser.ID:
          checkChildCount(tree, 0);
          return new Identifier(tree.getText());
        case MiniCParser.INT_LITERAL:
          checkChildCount(tree, 1);
          return new IntLiteral(Literals.parseIntToken(context,
                                                       tree.child(0)));
        case MiniCParser.FLOAT_LITERAL:
          checkChildCount(tree, 1);
          return new FloatLiteral(Literals.parseFloatToken(context,
                                                           tree.child(0)));
        case MiniCParser.CHAR_LITERAL:
          checkChildCount(tree, 1);
          return new CharLiteral(Literals.parseCharToken(context,
                                                         tree.child(0)));
        case MiniCParser.UNARY_OP:
          checkChildCount(tree, 2);
          return new UnaryOp(Operators.unaryOp(tree.child(0).getText()),
                             lowerExpr(context, tree.child(1)));
        case MiniCParser.BINARY_OP:
          checkChildCount(tree, 3);
          return new BinaryOp(Operators.binaryOp(tree.child(0).getText()),
                              lowerExpr(context, tree.child(1)),
                              lowerExpr(context, tree.child(2)));
        case MiniCParser.DEREFERENCE:
          return new Dereference(lowerOperand(context, tree));
        case MiniCParser.ADDRESS_OF:
          return new AddressOf(lowerOperand(context, tree));
        case MiniCParser.PRE_INCREMENT:
          return new Increment(lowerOperand(context, tree), true);
        case MiniCParser.POST_INCREMENT:
          return new Increment(lowerOperand(context, tree), false);
        case MiniCParser.PRE_DECREMENT:
          return new Decrement(lowerOperand(context, tree), true);
        case MiniCParser.POST_DECREMENT:
          return new Decrement(lowerOperand(context, tree), false);
        case MiniCParser.CAST:
          return lowerCast(context, tree);
        default:
          throw new CompilerRuntimeError("Unexpected token type in " +
              "expression context: " + LogHelper.tokName(tree.getType()));
      }
    } finally {
      context.exit();
    }
  }

  private Node lowerOperand(Context context, MiniCTree tree)
      throws UserException {
    checkChildCount(tree, 1);
    return lowerExpr(context, tree.child(0));
  }

  private Cast lowerCast(Context context, MiniCTree tree)
      throws UserException {
    String typeName = typeName(tree, 0);
    int pointerDepth = countPointers(tree, 1);
    checkChildCount(tree, pointerDepth + 2);
    Node operand = lowerExpr(context, tree.child(pointerDepth + 1));
    return new Cast(typeName, pointerDepth, operand);
  }

  private void enter(Context context, MiniCTree tree)
      throws TreeDepthException {
    int level = context.enter();
    context.syncFilePos(tree);
    if (level > maxDepth) {
      throw new TreeDepthException(context, maxDepth);
    }
    LogHelper.trace(level, LogHelper.tokName(tree.getType()));
  }

  private static String typeName(MiniCTree tree, int pos) {
    MiniCTree typeTree = child(tree, pos);
    switch (typeTree.getType()) {
      case MiniCParser.INT:
      case MiniCParser.FLOAT:
      case MiniCParser.CHAR:
        return typeTree.getText();
      default:
        throw new CompilerRuntimeError("Expected type specifier, got " +
                                    LogHelper.tokName(typeTree.getType()));
    }
  }

  /**
   * Count consecutive pointer markers starting at position
   */
  private static int countPointers(MiniCTree tree, int start) {
    int count = 0;
    for (MiniCTree child: tree.children(start)) {
      if (child.getType() != MiniCParser.STAR) {
        break;
      }
      count++;
    }
    return count;
  }

  private static int childType(MiniCTree tree, int pos) {
    return child(tree, pos).getType();
  }

  private static MiniCTree child(MiniCTree tree, int pos) {
    if (pos >= tree.childCount()) {
      throw new CompilerRuntimeError("Missing child " + pos + " of " +
                                  LogHelper.tokName(tree.getType()));
    }
    return tree.child(pos);
  }

  private static void checkType(MiniCTree tree, int expected) {
    if (tree.getType() != expected) {
      throw new CompilerRuntimeError("Expected " +
          LogHelper.tokName(expected) + " but got " +
          LogHelper.tokName(tree.getType()));
    }
  }

  private static void checkChildCount(MiniCTree tree, int expected) {
    if (tree.childCount() != expected) {
      throw new CompilerRuntimeError("Expected " + expected +
          " children of " + LogHelper.tokName(tree.getType()) +
          " but got " + tree.childCount());
    }
  }
}
