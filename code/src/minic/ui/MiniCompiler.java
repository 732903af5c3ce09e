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
package minic.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import minic.common.Settings;
import minic.common.exceptions.CompilerFatal;
import minic.common.exceptions.InvalidOptionException;
import minic.common.exceptions.InvalidSyntaxException;
import minic.common.exceptions.UserException;
import minic.dot.GraphExporter;
import minic.frontend.ParsedProgram;
import minic.frontend.TreeLowering;
import minic.frontend.tree.Program;
import minic.opt.ConstantFolder;
import minic.opt.FoldResult;

/**
 * Runs the passes in order: parse, lower, fold, export.
 */
public class MiniCompiler {

  private final Logger logger;

  /** Where the AST is printed */
  private final PrintStream out;

  public MiniCompiler(Logger logger, PrintStream out) {
    this.logger = logger;
    this.out = out;
  }

  /**
   * Compile a source file.
   * @param inputFile path of source file
   * @param dotOutput file to write graph to, or null for none
   * @return the final AST
   * @throws CompilerFatal with exit code for any failure
   */
  public Program compile(String inputFile, File dotOutput) {
    ParsedProgram parsed;
    try {
      parsed = ParsedProgram.parse(inputFile);
    } catch (IOException e) {
      System.err.println("Error reading input file " + inputFile + ": " +
                         e.getMessage());
      throw new CompilerFatal(ExitCode.ERROR_IO.code());
    } catch (InvalidSyntaxException e) {
      System.err.println("minic error:");
      System.err.println(e.getMessage());
      throw new CompilerFatal(ExitCode.ERROR_PARSER.code());
    } catch (Throwable e) {
      reportInternalError(e);
      throw new CompilerFatal(ExitCode.ERROR_INTERNAL.code());
    }
    return process(parsed, dotOutput);
  }

  /**
   * Run the passes after parsing
   * @throws CompilerFatal with exit code for any failure
   */
  public Program process(ParsedProgram parsed, File dotOutput) {
    try {
      logger.debug("minic starting: " + parsed.inputFilePath);
      int maxDepth = Settings.getInt(Settings.MAX_TREE_DEPTH);

      Program program = new TreeLowering(maxDepth).lower(parsed);
      out.println("AST before folding:");
      out.println(program);

      ConstantFolder folder = ConstantFolder.fromSettings();
      if (folder.isEnabled()) {
        FoldResult result = folder.fold(logger, program);
        program = (Program)result.tree;
        out.println("AST after folding:");
        out.println(program);
      }

      if (dotOutput != null) {
        writeGraph(program, maxDepth, dotOutput);
      }
      logger.debug("minic done");
      return program;
    } catch (CompilerFatal e) {
      throw e;
    } catch (InvalidOptionException e) {
      System.err.println("Invalid setting: " + e.getMessage());
      throw new CompilerFatal(ExitCode.ERROR_COMMAND.code());
    } catch (UserException e) {
      System.err.println("minic error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(ExceptionUtils.getStackTrace(e));
      throw new CompilerFatal(ExitCode.ERROR_USER.code());
    } catch (StackOverflowError e) {
      System.err.println("minic error:");
      System.err.println("Program nesting is too deep for the available " +
                         "stack, lower " + Settings.MAX_TREE_DEPTH);
      throw new CompilerFatal(ExitCode.ERROR_USER.code());
    } catch (Throwable e) {
      // Includes CompilerRuntimeError
      reportInternalError(e);
      throw new CompilerFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  private void writeGraph(Program program, int maxDepth, File dotOutput)
      throws UserException {
    try {
      new GraphExporter(maxDepth).export(program, dotOutput);
    } catch (IOException e) {
      System.err.println("I/O error while writing " + dotOutput + ": " +
                         e.getMessage());
      throw new CompilerFatal(ExitCode.ERROR_IO.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("MINIC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
