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

import minic.common.lang.Operators.BinaryOpcode;

public class BinaryOp extends Node {
  public final BinaryOpcode op;
  public final Node left;
  public final Node right;

  public BinaryOp(BinaryOpcode op, Node left, Node right) {
    this.op = Preconditions.checkNotNull(op);
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitBinaryOp(this);
  }

  @Override
  public String kindName() {
    return "BinaryOp";
  }

  @Override
  public String toString() {
    return "BinaryOp(" + left + " " + op.symbol + " " + right + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof BinaryOp))
      return false;
    BinaryOp other = (BinaryOp)obj;
    return op == other.op && left.equals(other.left) &&
           right.equals(other.right);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = op.hashCode();
    result = prime * result + left.hashCode();
    result = prime * result + right.hashCode();
    return result;
  }
}
