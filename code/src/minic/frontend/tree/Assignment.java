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
 * Assignment statement, e.g. x = 5; or *ptr = 3;
 *
 * The target is any expression the parser accepted on the left hand
 * side; only an Identifier or a Dereference is meaningful.
 */
public class Assignment extends Node {
  public final Node target;
  public final Node value;

  public Assignment(Node target, Node value) {
    this.target = Preconditions.checkNotNull(target);
    this.value = Preconditions.checkNotNull(value);
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitAssignment(this);
  }

  @Override
  public String kindName() {
    return "Assign";
  }

  @Override
  public String toString() {
    return "Assign(" + target + " = " + value + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Assignment))
      return false;
    Assignment other = (Assignment)obj;
    return target.equals(other.target) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * target.hashCode() + value.hashCode();
  }
}
