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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import minic.common.exceptions.InvalidOptionException;

/**
 * General compiler settings
 *
 * Defaults are set here and can be overridden with Java system
 * properties of the same name, or from the command line in Main.
 * */
public class Settings
{
  public static final String OPT_CONSTANT_FOLD = "minic.opt.constant-fold";

  /** Maximum nesting of the program tree for any pass */
  public static final String MAX_TREE_DEPTH = "minic.max-tree-depth";

  public static final String INPUT_FILENAME = "minic.input_filename";
  public static final String DOT_OUTPUT_FILE = "minic.dot.output-file";

  public static final String LOG_FILE = "minic.log.file";
  public static final String LOG_TRACE = "minic.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(OPT_CONSTANT_FOLD, "true");
    defaults.setProperty(MAX_TREE_DEPTH, "1024");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(DOT_OUTPUT_FILE, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup so the default applies again
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(OPT_CONSTANT_FOLD);
    getBoolean(LOG_TRACE);
    if (getInt(MAX_TREE_DEPTH) <= 0) {
      throw new InvalidOptionException("option " + MAX_TREE_DEPTH +
                      " must be positive, but was " + get(MAX_TREE_DEPTH));
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
