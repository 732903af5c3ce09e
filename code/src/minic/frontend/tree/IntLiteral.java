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

public class IntLiteral extends Literal {
  public final long value;

  public IntLiteral(long value) {
    this.value = value;
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitIntLiteral(this);
  }

  @Override
  public String kindName() {
    return "Int";
  }

  @Override
  public IntLiteral copy() {
    return new IntLiteral(value);
  }

  @Override
  public boolean isIntegral() {
    return true;
  }

  @Override
  public long longValue() {
    return value;
  }

  @Override
  public double doubleValue() {
    return value;
  }

  @Override
  public String toString() {
    return "Int(" + value + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof IntLiteral))
      return false;
    return value == ((IntLiteral)obj).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }
}
