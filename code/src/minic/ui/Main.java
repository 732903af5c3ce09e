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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import minic.common.Logging;
import minic.common.Settings;
import minic.common.exceptions.CompilerFatal;
import minic.common.exceptions.InvalidOptionException;

/**
 * Command line entry point.
 *
 * Usage: minic [-n] [-o file.dot] input.c
 */
public class Main {
  static final String NO_FOLD_FLAG = "n";
  static final String OUTPUT_FLAG = "o";

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Run the compiler
   * @return process exit code
   */
  public static int run(String[] args) {
    try {
      Settings.initProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }

    Args parsedArgs;
    try {
      parsedArgs = processArgs(args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(initOptions());
      return ExitCode.ERROR_COMMAND.code();
    }

    Logger logger;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }

    File dotOutput = null;
    String dotFile = Settings.get(Settings.DOT_OUTPUT_FILE);
    if (dotFile != null && dotFile.length() > 0) {
      dotOutput = new File(dotFile);
    }

    try {
      MiniCompiler compiler = new MiniCompiler(logger, System.out);
      compiler.compile(parsedArgs.inputFilename, dotOutput);
    } catch (CompilerFatal ex) {
      return ex.exitCode;
    }
    return ExitCode.SUCCESS.code();
  }

  static Options initOptions() {
    Options opts = new Options();

    opts.addOption(new Option(NO_FOLD_FLAG, "no-fold", false,
                              "Disable constant folding and propagation"));

    Option output = new Option(OUTPUT_FLAG, "output", true,
                               "Write AST as Graphviz DOT to this file");
    output.setArgName("file.dot");
    opts.addOption(output);
    return opts;
  }

  /**
   * Parse arguments and record their values in settings
   * @throws ParseException if the command line is invalid
   */
  static Args processArgs(String[] args) throws ParseException {
    Options opts = initOptions();

    CommandLineParser parser = new GnuParser();
    CommandLine cmd = parser.parse(opts, args);

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      throw new ParseException("Expected one input file, but got "
              + remainingArgs.length + " arguments");
    }

    Args result = new Args(remainingArgs[0],
                           cmd.getOptionValue(OUTPUT_FLAG),
                           cmd.hasOption(NO_FOLD_FLAG));
    recordArgValues(result);
    return result;
  }

  /**
   * Store in settings so later passes see them
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.dotFilename != null) {
      Settings.set(Settings.DOT_OUTPUT_FILE, args.dotFilename);
    }
    if (args.noFold) {
      Settings.set(Settings.OPT_CONSTANT_FOLD, "false");
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("minic [options] <input.c>", opts);
  }

  static class Args {
    final String inputFilename;
    final String dotFilename;
    final boolean noFold;

    Args(String inputFilename, String dotFilename, boolean noFold) {
      this.inputFilename = inputFilename;
      this.dotFilename = dotFilename;
      this.noFold = noFold;
    }
  }
}
