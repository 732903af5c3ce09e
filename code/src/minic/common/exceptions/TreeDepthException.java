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
package minic.common.exceptions;

import minic.frontend.Context;

/**
 * Program nests expressions or statements more deeply than the
 * configured maximum tree depth.
 */
public class TreeDepthException extends UserException {

  public final int maxDepth;

  public TreeDepthException(Context context, int maxDepth) {
    super(context, message(maxDepth));
    this.maxDepth = maxDepth;
  }

  public TreeDepthException(int maxDepth) {
    super(message(maxDepth));
    this.maxDepth = maxDepth;
  }

  private static String message(int maxDepth) {
    return "Program nesting exceeds maximum tree depth of " + maxDepth +
           " (see setting minic.max-tree-depth)";
  }

  private static final long serialVersionUID = 1L;
}
