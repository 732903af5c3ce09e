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

import com.google.common.base.Preconditions;

import minic.common.lang.Operators.UnaryOpcode;

/**
 * Arithmetic or logical prefix operator: + - ! ~
 */
public class UnaryOp extends Node {
  public final UnaryOpcode op;
  public final Node operand;

  public UnaryOp(UnaryOpcode op, Node operand) {
    this.op = Preconditions.checkNotNull(op);
    this.operand = Preconditions.checkNotNull(operand);
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitUnaryOp(this);
  }

  @Override
  public String kindName() {
    return "UnaryOp";
  }

  @Override
  public String toString() {
    return "UnaryOp(" + op.symbol + ", " + operand + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof UnaryOp))
      return false;
    UnaryOp other = (UnaryOp)obj;
    return op == other.op && operand.equals(other.operand);
  }

  @Override
  public int hashCode() {
    return 31 * op.hashCode() + operand.hashCode();
  }
}
