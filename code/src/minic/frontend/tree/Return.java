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

import com.google.common.base.Objects;

public class Return extends Node {
  /** null for a bare return; */
  public final Node expression;

  public Return(Node expression) {
    this.expression = expression;
  }

  public boolean hasExpression() {
    return expression != null;
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitReturn(this);
  }

  @Override
  public String kindName() {
    return "Return";
  }

  @Override
  public String toString() {
    return "Return(" + (expression == null ? "" : expression.toString()) + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Return))
      return false;
    return Objects.equal(expression, ((Return)obj).expression);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode("Return", expression);
  }
}
