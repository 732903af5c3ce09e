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

public class FloatLiteral extends Literal {
  public final double value;

  public FloatLiteral(double value) {
    this.value = value;
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitFloatLiteral(this);
  }

  @Override
  public String kindName() {
    return "Float";
  }

  @Override
  public FloatLiteral copy() {
    return new FloatLiteral(value);
  }

  @Override
  public boolean isIntegral() {
    return false;
  }

  @Override
  public long longValue() {
    throw new UnsupportedOperationException("Float literal has no " +
                                            "integer value: " + this);
  }

  @Override
  public double doubleValue() {
    return value;
  }

  @Override
  public String toString() {
    return "Float(" + value + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof FloatLiteral))
      return false;
    // Bitwise comparison so that NaN equals itself
    return Double.doubleToLongBits(value) ==
           Double.doubleToLongBits(((FloatLiteral)obj).value);
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }
}
