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
package minic.common.lang;

import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import minic.common.exceptions.CompilerRuntimeError;

/**
 * This class serves to define details of builtin operators in the
 * language.  The operator tables are fixed: any symbol that isn't in
 * them indicates the grammar and this class have diverged.
 */
public class Operators {

  public static enum UnaryOpcode {
    PLUS("+"), NEGATE("-"), NOT("!"), BIT_NOT("~");

    public final String symbol;

    private UnaryOpcode(String symbol) {
      this.symbol = symbol;
    }
  }

  public static enum BinaryOpcode {
    PLUS("+"), MINUS("-"), MULT("*"), DIV("/"), MOD("%"),
    AND("&&"), OR("||"),
    EQ("=="), NEQ("!="), LT("<"), GT(">"), LTE("<="), GTE(">="),
    SHL("<<"), SHR(">>"), BIT_AND("&"), BIT_OR("|"), BIT_XOR("^");

    public final String symbol;

    private BinaryOpcode(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Map of operator symbol -> opcode */
  private static final ImmutableMap<String, UnaryOpcode> unaryOps;
  private static final ImmutableMap<String, BinaryOpcode> binaryOps;

  /** Operators only defined on integral operands */
  private static final Set<BinaryOpcode> integralOnly = Sets.immutableEnumSet(
      BinaryOpcode.MOD, BinaryOpcode.AND, BinaryOpcode.OR,
      BinaryOpcode.SHL, BinaryOpcode.SHR,
      BinaryOpcode.BIT_AND, BinaryOpcode.BIT_OR, BinaryOpcode.BIT_XOR);

  private static final Set<BinaryOpcode> comparisons = Sets.immutableEnumSet(
      BinaryOpcode.EQ, BinaryOpcode.NEQ, BinaryOpcode.LT, BinaryOpcode.GT,
      BinaryOpcode.LTE, BinaryOpcode.GTE);

  static {
    // Builder rejects duplicate symbols
    ImmutableMap.Builder<String, UnaryOpcode> unary = ImmutableMap.builder();
    for (UnaryOpcode op: UnaryOpcode.values()) {
      unary.put(op.symbol, op);
    }
    unaryOps = unary.build();

    ImmutableMap.Builder<String, BinaryOpcode> binary = ImmutableMap.builder();
    for (BinaryOpcode op: BinaryOpcode.values()) {
      binary.put(op.symbol, op);
    }
    binaryOps = binary.build();
  }

  /**
   * @param symbol operator text as written in the source
   * @return the opcode
   * @throws CompilerRuntimeError if the symbol isn't a unary operator
   */
  public static UnaryOpcode unaryOp(String symbol) {
    UnaryOpcode op = unaryOps.get(symbol);
    if (op == null) {
      throw new CompilerRuntimeError("Unknown unary operator: " + symbol);
    }
    return op;
  }

  /**
   * @param symbol operator text as written in the source
   * @return the opcode
   * @throws CompilerRuntimeError if the symbol isn't a binary operator
   */
  public static BinaryOpcode binaryOp(String symbol) {
    BinaryOpcode op = binaryOps.get(symbol);
    if (op == null) {
      throw new CompilerRuntimeError("Unknown binary operator: " + symbol);
    }
    return op;
  }

  public static boolean isDivision(BinaryOpcode op) {
    return op == BinaryOpcode.DIV || op == BinaryOpcode.MOD;
  }

  public static boolean isShift(BinaryOpcode op) {
    return op == BinaryOpcode.SHL || op == BinaryOpcode.SHR;
  }

  public static boolean isComparison(BinaryOpcode op) {
    return comparisons.contains(op);
  }

  /**
   * @return true if operator can only be evaluated with integral
   *        operands: modulus, logical, shift and bitwise operators
   */
  public static boolean isIntegralOnly(BinaryOpcode op) {
    return integralOnly.contains(op);
  }

  /**
   * @return true if operator can only be evaluated with an integral
   *        operand
   */
  public static boolean isIntegralOnly(UnaryOpcode op) {
    return op == UnaryOpcode.NOT || op == UnaryOpcode.BIT_NOT;
  }
}
