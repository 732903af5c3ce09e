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
package minic.opt;

import java.util.HashMap;
import java.util.Map;

import minic.frontend.tree.Literal;

/**
 * Variables whose current value is a known literal.  One instance is
 * owned by a single folding pass and discarded when it completes.
 */
public class KnownValues {
  private final Map<String, Literal> values = new HashMap<String, Literal>();

  /**
   * Record that the variable now holds this value, replacing any
   * earlier binding
   */
  public void bind(String name, Literal value) {
    values.put(name, value.copy());
  }

  /**
   * Forget the variable's value.  No-op if not known.
   * @return true if a binding was removed
   */
  public boolean unbind(String name) {
    return values.remove(name) != null;
  }

  public boolean isKnown(String name) {
    return values.containsKey(name);
  }

  /**
   * @return a fresh copy of the known value, or null if not known
   */
  public Literal lookup(String name) {
    Literal val = values.get(name);
    return val == null ? null : val.copy();
  }

  public int size() {
    return values.size();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
