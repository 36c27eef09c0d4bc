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

package org.tailrec.ast;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * An expression. Expressions form a pure tree: each node exclusively owns its children, and all
 * implementations are immutable records, so two trees are equal iff they have the same shape.
 *
 * <p>The variants that the tail-call rewrite distinguishes are {@link Call}, {@link MethodCall},
 * {@link Match}, {@link If}, {@link Block}, {@link Return} and {@link Opaque}; everything else is
 * treated uniformly as a value-producing expression.
 */
public interface Expr {

  /** The unit value, written {@code ()}. */
  Tuple UNIT = new Tuple(ImmutableList.of());

  /** Returns a {@link Path} with a single segment. */
  static Path ident(String name) {
    return new Path(ImmutableList.of(name));
  }

  /** Returns a {@link Path} with the given segments, e.g. {@code path("Action", "Return")}. */
  static Path path(String... segments) {
    return new Path(ImmutableList.copyOf(segments));
  }

  /** Returns a call of the given callee with the given arguments. */
  static Call call(Expr callee, Expr... args) {
    return new Call(callee, ImmutableList.copyOf(args));
  }

  static IntLiteral of(long value) {
    return new IntLiteral(value);
  }

  static BoolLiteral of(boolean value) {
    return value ? BoolLiteral.TRUE : BoolLiteral.FALSE;
  }

  /** A 64-bit integer constant. */
  record IntLiteral(long value) implements Expr {}

  record BoolLiteral(boolean value) implements Expr {
    public static final BoolLiteral TRUE = new BoolLiteral(true);
    public static final BoolLiteral FALSE = new BoolLiteral(false);
  }

  /**
   * A reference to a local, a function, or an enum variant. Variable and function references have a
   * single segment; {@code Action::Return} has two.
   */
  record Path(ImmutableList<String> segments) implements Expr {
    public Path {
      Preconditions.checkArgument(!segments.isEmpty(), "empty path");
    }

    /** Returns true if this path is the single identifier {@code name}. */
    public boolean isIdent(String name) {
      return segments.size() == 1 && segments.get(0).equals(name);
    }

    @Override
    public String toString() {
      return Joiner.on("::").join(segments);
    }
  }

  /** A tuple; the empty tuple is {@link #UNIT}. */
  record Tuple(ImmutableList<Expr> elements) implements Expr {
    public boolean isUnit() {
      return elements.isEmpty();
    }
  }

  /** A call of a function or enum variant constructor, e.g. {@code f(x, y)}. */
  record Call(Expr callee, ImmutableList<Expr> args) implements Expr {
    /** Returns the callee's name if it is a single identifier, otherwise null. */
    public @Nullable String calleeName() {
      if (callee instanceof Path path && path.segments().size() == 1) {
        return path.segments().get(0);
      }
      return null;
    }
  }

  /** A method-style call, e.g. {@code x.max(y)}. */
  record MethodCall(Expr receiver, String method, ImmutableList<Expr> args) implements Expr {}

  enum UnaryOp {
    NEGATE("-"),
    NOT("!");

    public final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }
  }

  record Unary(UnaryOp op, Expr operand) implements Expr {}

  /** Binary operators, ordered by the precedence level they bind at (higher binds tighter). */
  enum BinaryOp {
    MULTIPLY("*", 5),
    DIVIDE("/", 5),
    REMAINDER("%", 5),
    ADD("+", 4),
    SUBTRACT("-", 4),
    EQ("==", 3),
    NE("!=", 3),
    LT("<", 3),
    LE("<=", 3),
    GT(">", 3),
    GE(">=", 3),
    AND("&&", 2),
    OR("||", 1);

    public final String symbol;
    public final int precedence;

    BinaryOp(String symbol, int precedence) {
      this.symbol = symbol;
      this.precedence = precedence;
    }

    /** Returns the operator with the given source symbol. */
    public static BinaryOp fromSymbol(String symbol) {
      for (BinaryOp op : values()) {
        if (op.symbol.equals(symbol)) {
          return op;
        }
      }
      throw new IllegalArgumentException("Unknown operator: " + symbol);
    }
  }

  record Binary(BinaryOp op, Expr left, Expr right) implements Expr {}

  /** {@code target = value}; the target is a local. */
  record Assign(Expr target, Expr value) implements Expr {}

  /**
   * {@code if condition { ... } else ...}. The else branch, if present, is either a {@link Block}
   * or another {@link If}.
   */
  record If(Expr condition, Block thenBlock, @Nullable Expr elseBranch) implements Expr {
    public If {
      Preconditions.checkArgument(
          elseBranch == null || elseBranch instanceof Block || elseBranch instanceof If,
          "else branch must be a block or an if");
    }
  }

  record MatchArm(Pattern pattern, @Nullable Expr guard, Expr body) {}

  record Match(Expr scrutinee, ImmutableList<MatchArm> arms) implements Expr {}

  /** {@code loop { ... }}; only exits via {@code break} or {@code return}. */
  record Loop(Block body) implements Expr {}

  record While(Expr condition, Block body) implements Expr {}

  record Break(@Nullable Expr value) implements Expr {}

  /** {@code return} or {@code return value}. */
  record Return(@Nullable Expr value) implements Expr {}

  /** {@code |a, b| body}. */
  record Closure(ImmutableList<Pattern> params, Expr body) implements Expr {}

  /**
   * An expression that has already been finalized by a rewrite and must be passed through unchanged
   * by any later pass. Opaque has no surface syntax; it prints and evaluates as its contents.
   */
  record Opaque(Expr expr) implements Expr {
    public Opaque {
      Preconditions.checkArgument(!(expr instanceof Opaque), "nested Opaque");
    }
  }
}
