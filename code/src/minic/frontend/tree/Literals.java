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

import minic.ast.MiniCTree;
import minic.ast.antlr.MiniCParser;
import minic.common.exceptions.CompilerRuntimeError;
import minic.common.exceptions.InvalidSyntaxException;
import minic.frontend.Context;
import minic.frontend.LogHelper;

/**
 * Conversion of literal tokens to values
 */
public class Literals {

  /**
   * Parse a decimal integer token
   * @throws InvalidSyntaxException if it doesn't fit in 64 bits
   */
  public static long parseIntToken(Context context, MiniCTree tree)
      throws InvalidSyntaxException {
    if (tree.getType() != MiniCParser.DECIMAL_INT) {
      throw new CompilerRuntimeError("Bad token: " +
                                  LogHelper.tokName(tree.getType()));
    }
    try {
      return Long.parseLong(tree.getText(), 10);
    } catch (NumberFormatException e) {
      throw new InvalidSyntaxException(context, "Invalid decimal literal: "
                                                + tree.getText());
    }
  }

  public static double parseFloatToken(Context context, MiniCTree tree)
      throws InvalidSyntaxException {
    if (tree.getType() != MiniCParser.DECIMAL) {
      throw new CompilerRuntimeError("Bad token: " +
                                  LogHelper.tokName(tree.getType()));
    }
    try {
      return Double.parseDouble(tree.getText());
    } catch (NumberFormatException e) {
      throw new InvalidSyntaxException(context,
                  "Invalid floating point literal: " + tree.getText());
    }
  }

  /**
   * Extract the character from a quoted character token, e.g. 'a' or '\n'
   * @return a one-character string
   */
  public static String parseCharToken(Context context, MiniCTree tree)
      throws InvalidSyntaxException {
    if (tree.getType() != MiniCParser.CHARACTER) {
      throw new CompilerRuntimeError("Bad token: " +
                                  LogHelper.tokName(tree.getType()));
    }
    String result = unescapeChar(context, unquote(tree.getText()));
    LogHelper.trace(context, "Unescaped character " + tree.getText() +
                    ", resulting in code " + (int)result.charAt(0));
    return result;
  }

  static String unquote(String s) {
    if (s.length() >= 2 && s.charAt(0) == '\'' &&
        s.charAt(s.length() - 1) == '\'') {
      return s.substring(1, s.length() - 1);
    }
    throw new CompilerRuntimeError("Character not quoted: " + s);
  }

  /**
   * @param escaped body of character literal without quotes
   */
  static String unescapeChar(Context context, String escaped)
      throws InvalidSyntaxException {
    if (escaped.length() == 1 && escaped.charAt(0) != '\\') {
      return escaped;
    }
    if (escaped.length() != 2 || escaped.charAt(0) != '\\') {
      throw new InvalidSyntaxException(context,
          "Character literal must contain a single character: '"
          + escaped + "'");
    }
    char c = escaped.charAt(1);
    switch (c) {
      case 'n':
        return "\n";
      case 't':
        return "\t";
      case 'r':
        return "\r";
      case '0':
        return "\0";
      case '\\':
      case '\'':
      case '"':
        return String.valueOf(c);
      default:
        throw new InvalidSyntaxException(context,
              "Don't recognise escape code '\\" + c + "'");
    }
  }

  /**
   * Inverse of {@link #unescapeChar}: render a character value with
   * C escapes so that it fits on one line inside single quotes.
   */
  public static String escapeChar(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\0':
          sb.append("\\0");
          break;
        case '\\':
        case '\'':
          sb.append('\\').append(c);
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }
}
