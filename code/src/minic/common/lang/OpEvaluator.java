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

import minic.common.exceptions.CompilerRuntimeError;
import minic.common.lang.Operators.BinaryOpcode;
import minic.common.lang.Operators.UnaryOpcode;
import minic.frontend.tree.FloatLiteral;
import minic.frontend.tree.IntLiteral;
import minic.frontend.tree.Literal;

/**
 * Compile time evaluation of operators applied to literals.
 *
 * Integer arithmetic is 64-bit two's complement.  Division and modulus
 * truncate toward zero.  Character operands promote to their character
 * code.  If either operand is floating point, the other is promoted and
 * the result is floating point, except for comparisons, which always
 * produce 0 or 1.
 */
public class OpEvaluator {

  /** Width of integer values in bits */
  public static final int INT_BITS = 64;

  /**
   * Check whether evaluating the operator at compile time would fault.
   *
   * @return description of the problem, or null if it's safe to evaluate
   */
  public static String unsafeReason(BinaryOpcode op, Literal left,
                                    Literal right) {
    if (Operators.isDivision(op) && right.isZero()) {
      return "division by zero";
    }
    if (Operators.isShift(op) && left.isIntegral() && right.isIntegral()) {
      long count = right.longValue();
      if (count < 0 || count >= INT_BITS) {
        return "shift count " + count + " out of range";
      }
    }
    return null;
  }

  /**
   * Try to do compile-time evaluation of binary operator
   *
   * @return result of op if it could be evaluated at compile-time, null
   *         otherwise.  Null is returned for unsafe operations (see
   *         {@link #unsafeReason}) and for operand types the operator
   *         isn't defined on
   */
  public static Literal eval(BinaryOpcode op, Literal left, Literal right) {
    if (unsafeReason(op, left, right) != null) {
      return null;
    }

    if (left.isIntegral() && right.isIntegral()) {
      return evalIntOp(op, left.longValue(), right.longValue());
    } else if (Operators.isIntegralOnly(op)) {
      return null;
    } else {
      return evalFloatOp(op, left.doubleValue(), right.doubleValue());
    }
  }

  /**
   * Try to do compile-time evaluation of unary operator
   *
   * @return result, or null if operator isn't defined on operand type
   */
  public static Literal eval(UnaryOpcode op, Literal operand) {
    if (operand.isIntegral()) {
      long arg = operand.longValue();
      switch (op) {
        case PLUS:
          return new IntLiteral(arg);
        case NEGATE:
          return new IntLiteral(0 - arg);
        case NOT:
          return boolLit(arg == 0);
        case BIT_NOT:
          return new IntLiteral(~arg);
        default:
          throw new CompilerRuntimeError("Unknown unary operator: " + op);
      }
    } else {
      double arg = operand.doubleValue();
      switch (op) {
        case PLUS:
          return new FloatLiteral(arg);
        case NEGATE:
          return new FloatLiteral(-arg);
        case NOT:
        case BIT_NOT:
          return null;
        default:
          throw new CompilerRuntimeError("Unknown unary operator: " + op);
      }
    }
  }

  private static Literal evalIntOp(BinaryOpcode op, long arg1, long arg2) {
    switch (op) {
      case PLUS:
        return new IntLiteral(arg1 + arg2);
      case MINUS:
        return new IntLiteral(arg1 - arg2);
      case MULT:
        return new IntLiteral(arg1 * arg2);
      case DIV:
        // Java division truncates toward zero, as C does
        return new IntLiteral(arg1 / arg2);
      case MOD:
        return new IntLiteral(arg1 % arg2);
      case EQ:
        return boolLit(arg1 == arg2);
      case NEQ:
        return boolLit(arg1 != arg2);
      case LT:
        return boolLit(arg1 < arg2);
      case GT:
        return boolLit(arg1 > arg2);
      case LTE:
        return boolLit(arg1 <= arg2);
      case GTE:
        return boolLit(arg1 >= arg2);
      case AND:
        return boolLit(arg1 != 0 && arg2 != 0);
      case OR:
        return boolLit(arg1 != 0 || arg2 != 0);
      case BIT_AND:
        return new IntLiteral(arg1 & arg2);
      case BIT_OR:
        return new IntLiteral(arg1 | arg2);
      case BIT_XOR:
        return new IntLiteral(arg1 ^ arg2);
      case SHL:
        return new IntLiteral(arg1 << arg2);
      case SHR:
        return new IntLiteral(arg1 >> arg2);
      default:
        throw new CompilerRuntimeError("Unknown binary operator: " + op);
    }
  }

  private static Literal evalFloatOp(BinaryOpcode op, double arg1,
                                     double arg2) {
    switch (op) {
      case PLUS:
        return new FloatLiteral(arg1 + arg2);
      case MINUS:
        return new FloatLiteral(arg1 - arg2);
      case MULT:
        return new FloatLiteral(arg1 * arg2);
      case DIV:
        return new FloatLiteral(arg1 / arg2);
      case EQ:
        return boolLit(arg1 == arg2);
      case NEQ:
        return boolLit(arg1 != arg2);
      case LT:
        return boolLit(arg1 < arg2);
      case GT:
        return boolLit(arg1 > arg2);
      case LTE:
        return boolLit(arg1 <= arg2);
      case GTE:
        return boolLit(arg1 >= arg2);
      default:
        throw new CompilerRuntimeError("Operator " + op.symbol +
                              " can't be applied to floating point values");
    }
  }

  private static IntLiteral boolLit(boolean val) {
    return new IntLiteral(val ? 1 : 0);
  }
}
