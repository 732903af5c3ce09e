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
 * A character literal.  The value is the single character after
 * delimiters have been removed and escapes decoded.
 */
public class CharLiteral extends Literal {
  public final String value;

  public CharLiteral(String value) {
    Preconditions.checkNotNull(value);
    Preconditions.checkArgument(value.length() == 1,
        "Character literal must hold exactly one character: '%s'", value);
    this.value = value;
  }

  @Override
  public <R, E extends Exception> R accept(NodeVisitor<R, E> visitor)
      throws E {
    return visitor.visitCharLiteral(this);
  }

  @Override
  public String kindName() {
    return "Char";
  }

  @Override
  public CharLiteral copy() {
    return new CharLiteral(value);
  }

  @Override
  public boolean isIntegral() {
    return true;
  }

  /**
   * Characters promote to their character code
   */
  @Override
  public long longValue() {
    return value.charAt(0);
  }

  @Override
  public double doubleValue() {
    return value.charAt(0);
  }

  @Override
  public String toString() {
    return "Char('" + Literals.escapeChar(value) + "')";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof CharLiteral))
      return false;
    return value.equals(((CharLiteral)obj).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }
}
