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
import com.google.common.base.Preconditions;

import minic.common.lang.Types;

/**
 * A variable declaration, with or without initializer.
 * Examples:
 *    int x;
 *    const float y = 3.14;
 *    int* ptr = &x;
 */
public class VariableDeclaration extends Node {
  public final boolean isConst;
  public final String typeName;
  /** number of pointer markers, 0 if not a pointer */
  public final int pointerDepth;
  public final String name;
  /** null if no initializer */
  public final Node initializer;

  public VariableDeclaration(boolean isConst, String typeName,
                    int pointerDepth, String name, Node initializer) {
    Preconditions.checkArgument(pointerDepth >= 0,
                                "negative pointer depth %s", pointerDepth);
    this.isConst = isConst;
    Preconditions.checkArgument(Types.isBaseType(typeName),
                                "unknown type %s", typeName);
    this.typeName = typeName;
    this.pointerDepth = pointerDepth;
    this.name = Preconditions.checkNotNull(name);
    this.initializer = initializer;
  }

  public boolean hasInitializer() {
    return initializer != null;
  }

  /**
   * @return copy of this declaration with a different initializer
   */
  public VariableDeclaration withInitializer(Node newInitializer) {
    return new VariableDeclaration(isConst, typeName, pointerDepth, name,
                                   newInitializer);
  }

  public String typeString() {
    return Types.typeString(typeName, pointerDepth);
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitVariableDeclaration(this);
  }

  @Override
  public String kindName() {
    return "VarDecl";
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("VarDecl(");
    if (isConst) {
      sb.append("const ");
    }
    sb.append(typeString()).append(' ').append(name);
    if (initializer != null) {
      sb.append(" = ").append(initializer);
    }
    return sb.append(')').toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof VariableDeclaration))
      return false;
    VariableDeclaration other = (VariableDeclaration)obj;
    return isConst == other.isConst &&
           typeName.equals(other.typeName) &&
           pointerDepth == other.pointerDepth &&
           name.equals(other.name) &&
           Objects.equal(initializer, other.initializer);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(isConst, typeName, pointerDepth, name,
                            initializer);
  }
}
