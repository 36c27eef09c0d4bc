/*
 * Copyright 2025 The Retrospect Authors
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
 * limitations under the License.
 */

package org.tailrec.eval;

import com.google.common.math.LongMath;
import java.util.List;
import org.tailrec.ast.Expr.BinaryOp;
import org.tailrec.ast.Expr.UnaryOp;
import org.tailrec.eval.Value.IntValue;

/** Operators and methods on primitive values. All integer arithmetic is checked for overflow. */
final class Builtins {

  private Builtins() {}

  static Value unary(UnaryOp op, Value operand) {
    return switch (op) {
      case NEGATE -> Value.of(checked(() -> Math.negateExact(asInt(operand))));
      case NOT -> Value.of(!Interpreter.asBool(operand));
    };
  }

  /** Applies a binary operator other than {@code &&} and {@code ||}, which are short-circuiting. */
  static Value binary(BinaryOp op, Value left, Value right) {
    switch (op) {
      case EQ:
        return Value.of(left.equals(right));
      case NE:
        return Value.of(!left.equals(right));
      default:
        break;
    }
    long x = asInt(left);
    long y = asInt(right);
    return switch (op) {
      case ADD -> Value.of(checked(() -> Math.addExact(x, y)));
      case SUBTRACT -> Value.of(checked(() -> Math.subtractExact(x, y)));
      case MULTIPLY -> Value.of(checked(() -> Math.multiplyExact(x, y)));
      case DIVIDE -> Value.of(divide(x, y));
      case REMAINDER -> Value.of(x % nonZero(y));
      case LT -> Value.of(x < y);
      case LE -> Value.of(x <= y);
      case GT -> Value.of(x > y);
      case GE -> Value.of(x >= y);
      default -> throw new AssertionError(op);
    };
  }

  /** Calls a builtin method on an integer, e.g. {@code x.abs()} or {@code x.pow(2)}. */
  static Value callMethod(Value receiver, String method, List<Value> args) {
    long x = asInt(receiver);
    switch (method) {
      case "abs":
        checkArgCount(method, args, 0);
        return Value.of(checked(() -> Math.absExact(x)));
      case "signum":
        checkArgCount(method, args, 0);
        return Value.of(Long.signum(x));
      case "min":
        checkArgCount(method, args, 1);
        return Value.of(Math.min(x, asInt(args.get(0))));
      case "max":
        checkArgCount(method, args, 1);
        return Value.of(Math.max(x, asInt(args.get(0))));
      case "pow":
        checkArgCount(method, args, 1);
        return Value.of(pow(x, asInt(args.get(0))));
      default:
        throw EvaluationException.error("Int has no method '%s'", method);
    }
  }

  private static long divide(long x, long y) {
    if (x == Long.MIN_VALUE && y == -1) {
      throw new EvaluationException("Integer overflow");
    }
    return x / nonZero(y);
  }

  private static long pow(long base, long exponent) {
    if (exponent < 0) {
      throw EvaluationException.error("Negative exponent %s", exponent);
    }
    // Any base other than 0, 1 or -1 overflows well before exponent 64, so larger exponents only
    // matter for their parity.
    int k = (int) (exponent <= Long.SIZE ? exponent : Long.SIZE + (exponent & 1));
    return checked(() -> LongMath.checkedPow(base, k));
  }

  private static long nonZero(long y) {
    if (y == 0) {
      throw new EvaluationException("Division by zero");
    }
    return y;
  }

  private static void checkArgCount(String method, List<Value> args, int expected) {
    if (args.size() != expected) {
      throw EvaluationException.error(
          "%s expects %d arguments but got %d", method, expected, args.size());
    }
  }

  static long asInt(Value value) {
    if (value instanceof IntValue i) {
      return i.value();
    }
    throw EvaluationException.error("Expected an integer, got %s", value);
  }

  private interface LongOp {
    long apply();
  }

  private static long checked(LongOp op) {
    try {
      return op.apply();
    } catch (ArithmeticException e) {
      throw new EvaluationException("Integer overflow", e);
    }
  }
}
