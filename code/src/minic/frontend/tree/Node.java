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
package minic.frontend.tree;

/**
 * Base of the abstract syntax tree.
 *
 * The set of node classes is closed: every subclass lives in this
 * package and has a matching method in {@link NodeVisitor}, so passes
 * that implement the visitor are checked for completeness by the
 * compiler.  A parent exclusively owns its children and nodes are never
 * shared between parents.  Nodes are immutable; passes that rewrite the
 * tree build replacement nodes and have the parent adopt them.
 *
 * {@link #toString()} gives the canonical textual rendering of the node
 * and all of its children.  {@link #equals(Object)} compares structure
 * and literal values.
 */
public abstract class Node {

  /** Package private: no subclasses outside the AST model */
  Node() {
  }

  public abstract <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E;

  /**
   * @return short name of the node kind, e.g. "BinaryOp"
   */
  public abstract String kindName();

  /**
   * @return true if this is a literal that folding can compute with
   */
  public boolean isLiteral() {
    return false;
  }

  @Override
  public abstract String toString();

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract int hashCode();
}
