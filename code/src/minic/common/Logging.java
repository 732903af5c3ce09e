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

package minic.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import minic.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String LOGGER_NAME = "minic";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getLogger()
  {
    return Logger.getLogger(LOGGER_NAME);
  }

  /**
   * Configure the compiler logger.
   * @param logfile file to append log output to; null or empty for none
   * @param trace if true, log at TRACE level, otherwise DEBUG when a
   *        log file is given and the configured level when it isn't
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger logger = getLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                      new PatternLayout(LOG_PATTERN), logfile, false);
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file \"" +
                                         logfile + "\": " + e.getMessage());
      }
      logger.setLevel(Level.DEBUG);
    }
    if (trace) {
      logger.setLevel(Level.TRACE);
    }
    // Even if logging is disabled, this must be valid:
    return logger;
  }
}
