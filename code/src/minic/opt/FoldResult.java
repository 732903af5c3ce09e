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

import java.util.List;

import com.google.common.collect.ImmutableList;

import minic.frontend.tree.Node;

/**
 * Output of a folding pass
 */
public class FoldResult {
  /** Rewritten tree */
  public final Node tree;

  /** Number of expressions replaced by literals */
  public final int folds;

  /** Operations left unfolded because evaluating them would fault */
  public final List<String> warnings;

  public FoldResult(Node tree, int folds, List<String> warnings) {
    this.tree = tree;
    this.folds = folds;
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  @Override
  public String toString() {
    return "FoldResult(" + folds + " folds, " + warnings.size() +
           " warnings): " + tree;
  }
}
