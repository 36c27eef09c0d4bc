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

import com.google.common.collect.ImmutableList;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.tailrec.ast.Expr.Assign;
import org.tailrec.ast.Expr.Binary;
import org.tailrec.ast.Expr.Break;
import org.tailrec.ast.Expr.Call;
import org.tailrec.ast.Expr.Closure;
import org.tailrec.ast.Expr.If;
import org.tailrec.ast.Expr.Loop;
import org.tailrec.ast.Expr.Match;
import org.tailrec.ast.Expr.MatchArm;
import org.tailrec.ast.Expr.MethodCall;
import org.tailrec.ast.Expr.Opaque;
import org.tailrec.ast.Expr.Return;
import org.tailrec.ast.Expr.Tuple;
import org.tailrec.ast.Expr.Unary;
import org.tailrec.ast.Expr.While;

/**
 * A copy-on-change tree transformer. The default implementation of each {@code transformX} method
 * transforms the node's children and returns the original node if none of them changed, or a new
 * node with the transformed children otherwise. Subclasses override the methods for the node kinds
 * they rewrite.
 *
 * <p>{@link Opaque} nodes are never entered, and nested {@link Item}s are returned unchanged (they
 * are separate scopes; a subclass that wants to rewrite them can override {@link #transformItem}).
 */
public abstract class ExprTransformer {

  public Expr transform(Expr expr) {
    if (expr instanceof Block block) {
      return transformBlock(block);
    } else if (expr instanceof Call call) {
      return transformCall(call);
    } else if (expr instanceof MethodCall methodCall) {
      return transformMethodCall(methodCall);
    } else if (expr instanceof If ifExpr) {
      return transformIf(ifExpr);
    } else if (expr instanceof Match match) {
      return transformMatch(match);
    } else if (expr instanceof Return ret) {
      return transformReturn(ret);
    } else if (expr instanceof Opaque opaque) {
      return transformOpaque(opaque);
    } else if (expr instanceof Closure closure) {
      return transformClosure(closure);
    } else if (expr instanceof Tuple tuple) {
      ImmutableList<Expr> elements = transformAll(tuple.elements());
      return (elements == tuple.elements()) ? tuple : new Tuple(elements);
    } else if (expr instanceof Unary unary) {
      Expr operand = transform(unary.operand());
      return (operand == unary.operand()) ? unary : new Unary(unary.op(), operand);
    } else if (expr instanceof Binary binary) {
      Expr left = transform(binary.left());
      Expr right = transform(binary.right());
      return (left == binary.left() && right == binary.right())
          ? binary
          : new Binary(binary.op(), left, right);
    } else if (expr instanceof Assign assign) {
      Expr target = transform(assign.target());
      Expr value = transform(assign.value());
      return (target == assign.target() && value == assign.value())
          ? assign
          : new Assign(target, value);
    } else if (expr instanceof Loop loop) {
      Block body = transformBlock(loop.body());
      return (body == loop.body()) ? loop : new Loop(body);
    } else if (expr instanceof While whileExpr) {
      Expr condition = transform(whileExpr.condition());
      Block body = transformBlock(whileExpr.body());
      return (condition == whileExpr.condition() && body == whileExpr.body())
          ? whileExpr
          : new While(condition, body);
    } else if (expr instanceof Break breakExpr) {
      Expr value = transformNullable(breakExpr.value());
      return (value == breakExpr.value()) ? breakExpr : new Break(value);
    }
    // Literals and paths have no children.
    return expr;
  }

  public Block transformBlock(Block block) {
    ImmutableList<Stmt> stmts = transformList(block.stmts(), this::transformStmt);
    Expr tail = transformNullable(block.tail());
    return (stmts == block.stmts() && tail == block.tail()) ? block : new Block(stmts, tail);
  }

  protected Stmt transformStmt(Stmt stmt) {
    if (stmt instanceof Stmt.Let let) {
      Expr init = transformNullable(let.init());
      return (init == let.init()) ? let : new Stmt.Let(let.pattern(), let.type(), init);
    } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
      Expr expr = transform(exprStmt.expr());
      return (expr == exprStmt.expr()) ? exprStmt : new Stmt.ExprStmt(expr, exprStmt.semicolon());
    } else {
      return transformItem((Item) stmt);
    }
  }

  protected Item transformItem(Item item) {
    return item;
  }

  protected Expr transformCall(Call call) {
    Expr callee = transform(call.callee());
    ImmutableList<Expr> args = transformAll(call.args());
    return (callee == call.callee() && args == call.args()) ? call : new Call(callee, args);
  }

  protected Expr transformMethodCall(MethodCall call) {
    Expr receiver = transform(call.receiver());
    ImmutableList<Expr> args = transformAll(call.args());
    return (receiver == call.receiver() && args == call.args())
        ? call
        : new MethodCall(receiver, call.method(), args);
  }

  protected Expr transformIf(If ifExpr) {
    Expr condition = transform(ifExpr.condition());
    Block thenBlock = transformBlock(ifExpr.thenBlock());
    Expr elseBranch = transformNullable(ifExpr.elseBranch());
    return (condition == ifExpr.condition()
            && thenBlock == ifExpr.thenBlock()
            && elseBranch == ifExpr.elseBranch())
        ? ifExpr
        : new If(condition, thenBlock, elseBranch);
  }

  protected Expr transformMatch(Match match) {
    Expr scrutinee = transform(match.scrutinee());
    ImmutableList<MatchArm> arms = transformList(match.arms(), this::transformArm);
    return (scrutinee == match.scrutinee() && arms == match.arms())
        ? match
        : new Match(scrutinee, arms);
  }

  protected MatchArm transformArm(MatchArm arm) {
    Expr guard = transformNullable(arm.guard());
    Expr body = transform(arm.body());
    return (guard == arm.guard() && body == arm.body())
        ? arm
        : new MatchArm(arm.pattern(), guard, body);
  }

  protected Expr transformReturn(Return ret) {
    Expr value = transformNullable(ret.value());
    return (value == ret.value()) ? ret : new Return(value);
  }

  protected Expr transformOpaque(Opaque opaque) {
    return opaque;
  }

  protected Expr transformClosure(Closure closure) {
    Expr body = transform(closure.body());
    return (body == closure.body()) ? closure : new Closure(closure.params(), body);
  }

  protected final @Nullable Expr transformNullable(@Nullable Expr expr) {
    return (expr == null) ? null : transform(expr);
  }

  protected final ImmutableList<Expr> transformAll(ImmutableList<Expr> exprs) {
    return transformList(exprs, this::transform);
  }

  /** Applies {@code fn} to each element; returns {@code list} itself if nothing changed. */
  private static <T> ImmutableList<T> transformList(ImmutableList<T> list, UnaryOperator<T> fn) {
    ImmutableList.Builder<T> builder = null;
    for (int i = 0; i < list.size(); i++) {
      T element = list.get(i);
      T transformed = fn.apply(element);
      if (builder == null && transformed != element) {
        builder = ImmutableList.builderWithExpectedSize(list.size());
        builder.addAll(list.subList(0, i));
      }
      if (builder != null) {
        builder.add(transformed);
      }
    }
    return (builder == null) ? list : builder.build();
  }
}
