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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.antlr.runtime.ANTLRFileStream;
import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CharStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import minic.ast.MiniCTree;
import minic.ast.antlr.MiniCLexer;
import minic.ast.antlr.MiniCParser;
import minic.common.Logging;
import minic.common.exceptions.CompilerRuntimeError;
import minic.common.exceptions.InvalidSyntaxException;

/**
 * Represents a parsed mini C source file
 */
public class ParsedProgram {
  private static final Logger logger = Logging.getLogger();

  public ParsedProgram(String inputFilePath, MiniCTree ast) {
    this.inputFilePath = inputFilePath;
    this.ast = ast;
  }

  public final String inputFilePath;
  public final MiniCTree ast;

  /**
   * Parse the specified file
   * @throws IOException if the file can't be read
   * @throws InvalidSyntaxException if the source has syntax errors or
   *          nests too deeply for the parser
   */
  public static ParsedProgram parse(String path)
      throws IOException, InvalidSyntaxException {
    return new ParsedProgram(path,
                  runANTLR(path, new ANTLRFileStream(path, "UTF-8")));
  }

  /**
   * Parse source text held in memory
   * @param name name to use in error messages
   */
  public static ParsedProgram parseString(String name, String source)
      throws InvalidSyntaxException {
    ANTLRStringStream input = new ANTLRStringStream(source);
    input.name = name;
    return new ParsedProgram(name, runANTLR(name, input));
  }

  /**
     Use ANTLR to parse the input and get the Tree
   */
  private static MiniCTree runANTLR(String name, CharStream input)
      throws InvalidSyntaxException {
    MiniCLexer lexer = new MiniCLexer(input);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    MiniCParser parser = new MiniCParser(tokens);
    parser.setTreeAdaptor(new MiniCTree.Adaptor());

    MiniCParser.program_return program;
    try {
      program = parser.program();
    } catch (RecognitionException e) {
      // Parser reports and recovers from recognition errors itself
      throw new CompilerRuntimeError("Parsing failed: internal error: "
                                     + e.getMessage());
    } catch (StackOverflowError e) {
      // The parser recurses once per nested parenthesis or prefix operator
      throw new InvalidSyntaxException(name +
          ": expressions are nested too deeply to parse");
    }

    /* The antlr parser can recover from errors, report them and
     * carry on building the tree it thinks is most plausible.
     * Any reported error means the tree can't be trusted. */
    List<String> errors = new ArrayList<String>();
    errors.addAll(lexer.errors);
    errors.addAll(parser.errors);
    if (!errors.isEmpty()) {
      throw new InvalidSyntaxException(name + ": " +
          errors.size() + " syntax error(s): " +
          StringUtils.join(errors, "; "));
    }

    if (program == null || program.getTree() == null)
      throw new CompilerRuntimeError("Parser produced no tree for " + name);

    MiniCTree tree = (MiniCTree)program.getTree();
    if (logger.isTraceEnabled()) {
      logger.trace(tree.printTree());
    }
    return tree;
  }
}
