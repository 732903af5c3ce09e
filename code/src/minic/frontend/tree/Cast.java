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

import minic.common.lang.Types;

/**
 * Explicit type cast: (int) x, (float*) p.  No conversion is performed
 * at compile time, so a cast of a literal stays a cast.
 */
public class Cast extends Node {
  public final String typeName;
  public final int pointerDepth;
  public final Node operand;

  public Cast(String typeName, int pointerDepth, Node operand) {
    Preconditions.checkArgument(pointerDepth >= 0,
                                "negative pointer depth %s", pointerDepth);
    Preconditions.checkArgument(Types.isBaseType(typeName),
                                "unknown type %s", typeName);
    this.typeName = typeName;
    this.pointerDepth = pointerDepth;
    this.operand = Preconditions.checkNotNull(operand);
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitCast(this);
  }

  @Override
  public String kindName() {
    return "Cast";
  }

  public String typeString() {
    return Types.typeString(typeName, pointerDepth);
  }

  @Override
  public String toString() {
    return "Cast((" + typeString() + ") " + operand + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Cast))
      return false;
    Cast other = (Cast)obj;
    return typeName.equals(other.typeName) &&
           pointerDepth == other.pointerDepth &&
           operand.equals(other.operand);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = typeName.hashCode();
    result = prime * result + pointerDepth;
    result = prime * result + operand.hashCode();
    return result;
  }
}
