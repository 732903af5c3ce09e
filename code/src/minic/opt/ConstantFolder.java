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
package minic.opt;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import minic.common.Logging;
import minic.common.Settings;
import minic.common.exceptions.InvalidOptionException;
import minic.common.exceptions.TreeDepthException;
import minic.common.exceptions.UserException;
import minic.common.lang.OpEvaluator;
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
import minic.frontend.tree.Literal;
import minic.frontend.tree.MainFunction;
import minic.frontend.tree.Node;
import minic.frontend.tree.NodeVisitor;
import minic.frontend.tree.Program;
import minic.frontend.tree.Return;
import minic.frontend.tree.UnaryOp;
import minic.frontend.tree.VariableDeclaration;

/**
 * Constant folding and propagation over the AST.
 *
 * A single depth-first pass.  Expression children are folded before
 * their parent is evaluated.  Statements are processed in order, and
 * each statement's effect on the known values is visible to the
 * statements after it.
 *
 * A variable is known once it is declared or assigned with a value that
 * folds to a literal.  It becomes unknown again when it is assigned a
 * non-literal, incremented or decremented.  Writes through pointers are
 * not tracked, so a value changed with {@code *p = ...} may still be
 * propagated from its last direct assignment.
 */
public class ConstantFolder implements OptimizerPass {

  private final boolean enabled;
  private final int maxDepth;

  public ConstantFolder(boolean enabled, int maxDepth) {
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be positive: "
                                         + maxDepth);
    }
    this.enabled = enabled;
    this.maxDepth = maxDepth;
  }

  /**
   * Create a folder configured from {@link Settings}
   */
  public static ConstantFolder fromSettings() throws InvalidOptionException {
    return new ConstantFolder(Settings.getBoolean(Settings.OPT_CONSTANT_FOLD),
                              Settings.getInt(Settings.MAX_TREE_DEPTH));
  }

  @Override
  public String getPassName() {
    return "Constant folding";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_CONSTANT_FOLD;
  }

  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public Program optimize(Logger logger, Program program)
      throws UserException {
    return (Program)fold(logger, program).tree;
  }

  public FoldResult fold(Node root) throws TreeDepthException {
    return fold(Logging.getLogger(), root);
  }

  /**
   * Fold a tree.  Each call uses its own table of known values.
   * @param root any node; usually a Program
   * @return the folded tree.  Unchanged subtrees are shared with the
   *         input.  If folding is disabled, root itself is returned.
   * @throws TreeDepthException if nesting exceeds the maximum depth
   */
  public FoldResult fold(Logger logger, Node root)
      throws TreeDepthException {
    if (!enabled) {
      logger.debug(getPassName() + " disabled");
      return new FoldResult(root, 0, new ArrayList<String>());
    }
    FoldPass pass = new FoldPass(logger);
    Node result = pass.fold(root);
    if (logger.isDebugEnabled()) {
      logger.debug(getPassName() + ": " + pass.folds + " folds, " +
                   pass.warnings.size() + " warnings, " +
                   pass.known.size() + " known at end");
    }
    return new FoldResult(result, pass.folds, pass.warnings);
  }

  /**
   * State for one pass over a tree
   */
  private class FoldPass implements NodeVisitor<Node, TreeDepthException> {
    private final Logger logger;
    private final KnownValues known = new KnownValues();
    private final List<String> warnings = new ArrayList<String>();
    private int folds = 0;
    private int depth = 0;

    FoldPass(Logger logger) {
      this.logger = logger;
    }

    Node fold(Node node) throws TreeDepthException {
      depth++;
      try {
        if (depth > maxDepth) {
          throw new TreeDepthException(maxDepth);
        }
        return node.accept(this);
      } finally {
        depth--;
      }
    }

    /**
     * Fold an expression whose location is written or whose address is
     * taken.  A bare variable must stay a variable.
     */
    private Node foldLValue(Node node) throws TreeDepthException {
      if (node instanceof Identifier) {
        return node;
      }
      return fold(node);
    }

    private Node replaced(Node orig, Literal result) {
      folds++;
      if (logger.isDebugEnabled()) {
        logger.debug("Folded " + orig + " => " + result);
      }
      return result;
    }

    private void warn(String msg) {
      warnings.add(msg);
      logger.warn(msg);
    }

    private void updateKnown(String name, Node value) {
      if (value instanceof Literal) {
        known.bind(name, (Literal)value);
        logger.trace("Known: " + name + " = " + value);
      } else if (known.unbind(name)) {
        logger.trace("No longer known: " + name);
      }
    }

    private void invalidate(Node operand) {
      if (operand instanceof Identifier) {
        String name = ((Identifier)operand).name;
        if (known.unbind(name)) {
          logger.trace("No longer known: " + name);
        }
      }
    }

    @Override
    public Node visitProgram(Program node) throws TreeDepthException {
      Node main = fold(node.mainFunction);
      if (main == node.mainFunction) {
        return node;
      }
      return new Program((MainFunction)main);
    }

    @Override
    public Node visitMainFunction(MainFunction node)
        throws TreeDepthException {
      List<Node> statements = new ArrayList<Node>(node.statements.size());
      boolean changed = false;
      for (Node stmt: node.statements) {
        Node folded = fold(stmt);
        changed = changed || folded != stmt;
        statements.add(folded);
      }
      return changed ? new MainFunction(statements) : node;
    }

    @Override
    public Node visitVariableDeclaration(VariableDeclaration node)
        throws TreeDepthException {
      if (!node.hasInitializer()) {
        // Fresh declaration hides any earlier value of the same name
        updateKnown(node.name, null);
        return node;
      }
      Node init = fold(node.initializer);
      updateKnown(node.name, init);
      return init == node.initializer ? node : node.withInitializer(init);
    }

    @Override
    public Node visitAssignment(Assignment node) throws TreeDepthException {
      Node target = foldLValue(node.target);
      Node value = fold(node.value);
      if (target instanceof Identifier) {
        updateKnown(((Identifier)target).name, value);
      }
      if (target == node.target && value == node.value) {
        return node;
      }
      return new Assignment(target, value);
    }

    @Override
    public Node visitReturn(Return node) throws TreeDepthException {
      if (!node.hasExpression()) {
        return node;
      }
      Node expr = fold(node.expression);
      return expr == node.expression ? node : new Return(expr);
    }

    @Override
    public Node visitIntLiteral(IntLiteral node) {
      return node;
    }

    @Override
    public Node visitFloatLiteral(FloatLiteral node) {
      return node;
    }

    @Override
    public Node visitCharLiteral(CharLiteral node) {
      return node;
    }

    @Override
    public Node visitIdentifier(Identifier node) {
      Literal val = known.lookup(node.name);
      if (val == null) {
        return node;
      }
      return replaced(node, val);
    }

    @Override
    public Node visitUnaryOp(UnaryOp node) throws TreeDepthException {
      Node operand = fold(node.operand);
      if (operand instanceof Literal) {
        Literal result = OpEvaluator.eval(node.op, (Literal)operand);
        if (result != null) {
          return replaced(node, result);
        }
        warn("Operator " + node.op.symbol + " not defined on " +
             operand.kindName() + " operand, left unfolded");
      }
      return operand == node.operand ? node
                                     : new UnaryOp(node.op, operand);
    }

    @Override
    public Node visitBinaryOp(BinaryOp node) throws TreeDepthException {
      Node left = fold(node.left);
      Node right = fold(node.right);
      if (left instanceof Literal && right instanceof Literal) {
        Literal l = (Literal)left, r = (Literal)right;
        String unsafe = OpEvaluator.unsafeReason(node.op, l, r);
        if (unsafe != null) {
          warn("Not folding " + l + " " + node.op.symbol + " " + r +
               ": " + unsafe);
        } else {
          Literal result = OpEvaluator.eval(node.op, l, r);
          if (result != null) {
            return replaced(node, result);
          }
          assert(Operators.isIntegralOnly(node.op));
          warn("Not folding " + l + " " + node.op.symbol + " " + r +
               ": operator only defined on integer operands");
        }
      }
      if (left == node.left && right == node.right) {
        return node;
      }
      return new BinaryOp(node.op, left, right);
    }

    @Override
    public Node visitDereference(Dereference node)
        throws TreeDepthException {
      Node operand = fold(node.operand);
      return operand == node.operand ? node : new Dereference(operand);
    }

    @Override
    public Node visitAddressOf(AddressOf node) throws TreeDepthException {
      Node operand = foldLValue(node.operand);
      return operand == node.operand ? node : new AddressOf(operand);
    }

    @Override
    public Node visitIncrement(Increment node) throws TreeDepthException {
      Node operand = foldLValue(node.operand);
      invalidate(operand);
      return operand == node.operand ? node
                              : new Increment(operand, node.prefix);
    }

    @Override
    public Node visitDecrement(Decrement node) throws TreeDepthException {
      Node operand = foldLValue(node.operand);
      invalidate(operand);
      return operand == node.operand ? node
                              : new Decrement(operand, node.prefix);
    }

    @Override
    public Node visitCast(Cast node) throws TreeDepthException {
      // Casts are never collapsed, even around a literal
      Node operand = fold(node.operand);
      return operand == node.operand ? node
                  : new Cast(node.typeName, node.pointerDepth, operand);
    }
  }
}
