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
package minic.frontend;

import java.io.File;

import org.apache.log4j.Logger;

import minic.ast.MiniCTree;

/**
 * Tracks the current source position and nesting level while a tree is
 * walked.  The nesting level is used both to indent log output and to
 * enforce the maximum tree depth.
 */
public class Context {

  public static final int ROOT_LEVEL = 0;

  private final Logger logger;

  private final String inputFile;
  private int line = 0;
  private int col = 0;

  private int level = ROOT_LEVEL;

  public Context(Logger logger, String inputFile) {
    this.logger = logger;
    this.inputFile = inputFile;
  }

  public String getInputFile() {
    return inputFile;
  }

  /**
   * Update current position from tree node
   * @param tree antlr tree for current position
   */
  public void syncFilePos(MiniCTree tree) {
    // Imaginary nodes created by rewrite rules may have no position
    if (tree.getLine() > 0) {
      this.line = tree.getLine();
      this.col = tree.getCharPositionInLine();
    }
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return col;
  }

  /**
     @return E.g.; "file.c:42:3: "
   */
  public String getLocation() {
    String res = new File(inputFile).getName() + ":" + line;
    if (col > 0) {
      res += ":" + (col + 1);
    }
    return res + ": ";
  }

  public final int getLevel() {
    return level;
  }

  /**
   * Descend one level into the tree
   * @return the new level
   */
  public int enter() {
    return ++level;
  }

  public void exit() {
    assert(level > ROOT_LEVEL);
    level--;
  }

  public final Logger getLogger() {
    return logger;
  }
}
