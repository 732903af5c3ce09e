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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

/**
 * The int main() { ... } function.  Statements are declarations,
 * assignments, returns, or expressions evaluated for their effect.
 */
public class MainFunction extends Node {
  public final List<Node> statements;

  public MainFunction(List<Node> statements) {
    for (Node stmt: statements) {
      Preconditions.checkNotNull(stmt, "null statement");
    }
    this.statements = Collections.unmodifiableList(
                                  new ArrayList<Node>(statements));
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitMainFunction(this);
  }

  @Override
  public String kindName() {
    return "MainFunction";
  }

  @Override
  public String toString() {
    return "MainFunction([" + StringUtils.join(statements, ", ") + "])";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof MainFunction))
      return false;
    return statements.equals(((MainFunction)obj).statements);
  }

  @Override
  public int hashCode() {
    return statements.hashCode();
  }
}
