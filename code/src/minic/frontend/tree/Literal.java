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

/**
 * A compile-time known value: integer, floating point or character.
 */
public abstract class Literal extends Node {

  Literal() {
  }

  @Override
  public boolean isLiteral() {
    return true;
  }

  /**
   * @return a new node with the same value.  Used whenever a literal is
   *         placed into the tree from somewhere other than its own
   *         parent, so that no two parents own the same node
   */
  public abstract Literal copy();

  /**
   * @return true for integer and character literals, which take part in
   *         integer arithmetic
   */
  public abstract boolean isIntegral();

  /**
   * @return integer value of an integral literal
   */
  public abstract long longValue();

  /**
   * @return value as a double, promoting integral literals
   */
  public abstract double doubleValue();

  /**
   * @return true if the value is zero (0, 0.0 or the NUL character)
   */
  public boolean isZero() {
    if (isIntegral()) {
      return longValue() == 0;
    } else {
      return doubleValue() == 0.0;
    }
  }
}
