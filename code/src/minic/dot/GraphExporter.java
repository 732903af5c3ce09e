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
package minic.dot;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import minic.common.Logging;
import minic.common.exceptions.TreeDepthException;
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
import minic.frontend.tree.NodeVisitor;
import minic.frontend.tree.Program;
import minic.frontend.tree.Return;
import minic.frontend.tree.UnaryOp;
import minic.frontend.tree.VariableDeclaration;

/**
 * Writes an AST as a Graphviz DOT digraph.
 *
 * Node ids are node1, node2, ... assigned in pre-order, starting again
 * from node1 on each export.  All node declarations are written before
 * the edges.  Edges are also in pre-order of their target node, so
 * output for a given tree is always identical.
 */
public class GraphExporter {
  private static final Logger logger = Logging.getLogger();

  public static final String GRAPH_NAME = "AST";

  static final String INDENT = "    ";
  static final String RECTANGLE = "rectangle";
  static final String ELLIPSE = "ellipse";

  private final int maxDepth;

  public GraphExporter(int maxDepth) {
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be positive: "
                                         + maxDepth);
    }
    this.maxDepth = maxDepth;
  }

  /**
   * @return the DOT document for the tree rooted at root
   */
  public String export(Node root) throws TreeDepthException {
    Walk walk = new Walk();
    walk.visit(root);

    StringBuilder sb = new StringBuilder();
    sb.append("digraph ").append(GRAPH_NAME).append(" {\n");
    sb.append(INDENT).append("node [fontname=\"Helvetica\"];\n");
    for (String line: walk.nodes) {
      sb.append(INDENT).append(line).append('\n');
    }
    for (String line: walk.edges) {
      sb.append(INDENT).append(line).append('\n');
    }
    sb.append("}\n");
    logger.debug("Exported " + walk.nodes.size() + " graph nodes");
    return sb.toString();
  }

  /**
   * Export the tree to a file, replacing any existing contents
   */
  public void export(Node root, File output)
      throws IOException, TreeDepthException {
    String dot = export(root);
    FileUtils.writeStringToFile(output, dot, StandardCharsets.UTF_8);
    logger.debug("Wrote graph to " + output.getPath());
  }

  /**
   * Escape a label for use inside a double-quoted DOT string
   */
  public static String escapeLabel(String label) {
    // Backslashes first so later escapes aren't doubled
    String res = StringUtils.replace(label, "\\", "\\\\");
    res = StringUtils.replace(res, "\"", "\\\"");
    res = StringUtils.replace(res, "\r", "\\r");
    return StringUtils.replace(res, "\n", "\\n");
  }

  /**
   * Visits each node, returning its id
   */
  private class Walk implements NodeVisitor<String, TreeDepthException> {
    private final List<String> nodes = new ArrayList<String>();
    private final List<String> edges = new ArrayList<String>();
    private int counter = 0;
    private int depth = 0;

    /** Id of node whose children are being visited, null at root */
    private String parent = null;

    String visit(Node node) throws TreeDepthException {
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

    private void visitChild(String parentId, Node child)
        throws TreeDepthException {
      String saved = parent;
      parent = parentId;
      try {
        visit(child);
      } finally {
        parent = saved;
      }
    }

    /**
     * Declare a node, along with the edge from its parent
     */
    private String addNode(String label, String shape) {
      counter++;
      String id = "node" + counter;
      nodes.add(id + " [label=\"" + escapeLabel(label) + "\", shape=" +
                shape + "];");
      if (parent != null) {
        edges.add(parent + " -> " + id + ";");
      }
      return id;
    }

    private String withChildren(String label, String shape,
                                Node... children)
        throws TreeDepthException {
      String id = addNode(label, shape);
      for (Node child: children) {
        visitChild(id, child);
      }
      return id;
    }

    @Override
    public String visitProgram(Program node) throws TreeDepthException {
      return withChildren("Program", RECTANGLE, node.mainFunction);
    }

    @Override
    public String visitMainFunction(MainFunction node)
        throws TreeDepthException {
      return withChildren("MainFunction", RECTANGLE,
                          node.statements.toArray(new Node[0]));
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node)
        throws TreeDepthException {
      String label = "VarDecl: " + (node.isConst ? "const " : "") +
                     node.typeString() + " " + node.name;
      if (node.hasInitializer()) {
        return withChildren(label, RECTANGLE, node.initializer);
      }
      return addNode(label, RECTANGLE);
    }

    @Override
    public String visitAssignment(Assignment node)
        throws TreeDepthException {
      return withChildren("Assign", RECTANGLE, node.target, node.value);
    }

    @Override
    public String visitReturn(Return node) throws TreeDepthException {
      if (node.hasExpression()) {
        return withChildren("Return", RECTANGLE, node.expression);
      }
      return addNode("Return", RECTANGLE);
    }

    @Override
    public String visitIntLiteral(IntLiteral node) {
      return addNode(Long.toString(node.value), RECTANGLE);
    }

    @Override
    public String visitFloatLiteral(FloatLiteral node) {
      return addNode(Double.toString(node.value), RECTANGLE);
    }

    @Override
    public String visitCharLiteral(CharLiteral node) {
      return addNode("'" + Literals.escapeChar(node.value) + "'", RECTANGLE);
    }

    @Override
    public String visitIdentifier(Identifier node) {
      return addNode(node.name, ELLIPSE);
    }

    @Override
    public String visitUnaryOp(UnaryOp node) throws TreeDepthException {
      return withChildren(node.op.symbol, ELLIPSE, node.operand);
    }

    @Override
    public String visitBinaryOp(BinaryOp node) throws TreeDepthException {
      return withChildren(node.op.symbol, ELLIPSE, node.left, node.right);
    }

    @Override
    public String visitDereference(Dereference node)
        throws TreeDepthException {
      return withChildren("Deref", ELLIPSE, node.operand);
    }

    @Override
    public String visitAddressOf(AddressOf node) throws TreeDepthException {
      return withChildren("AddressOf", ELLIPSE, node.operand);
    }

    @Override
    public String visitIncrement(Increment node) throws TreeDepthException {
      return withChildren(fixity("++", node.prefix), ELLIPSE, node.operand);
    }

    @Override
    public String visitDecrement(Decrement node) throws TreeDepthException {
      return withChildren(fixity("--", node.prefix), ELLIPSE, node.operand);
    }

    @Override
    public String visitCast(Cast node) throws TreeDepthException {
      return withChildren("(" + node.typeString() + ")", ELLIPSE,
                          node.operand);
    }

    private String fixity(String op, boolean prefix) {
      return op + (prefix ? " (prefix)" : " (postfix)");
    }
  }
}
