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

/**
 * ++x (prefix) or x++ (postfix).  Always has a side effect on
 * its operand, so it's never replaced by a value.
 */
public class Increment extends Node {
  public final Node operand;
  public final boolean prefix;

  public Increment(Node operand, boolean prefix) {
    this.operand = Preconditions.checkNotNull(operand);
    this.prefix = prefix;
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitIncrement(this);
  }

  @Override
  public String kindName() {
    return "Increment";
  }

  @Override
  public String toString() {
    if (prefix) {
      return "Increment(++" + operand + ")";
    }
    return "Increment(" + operand + "++)";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Increment))
      return false;
    Increment other = (Increment)obj;
    return prefix == other.prefix && operand.equals(other.operand);
  }

  @Override
  public int hashCode() {
    return 31 * operand.hashCode() + (prefix ? 1 : 0);
  }
}
