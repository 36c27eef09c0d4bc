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

package org.tailrec.rewrite;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.tailrec.ast.Block;
import org.tailrec.ast.Expr;
import org.tailrec.ast.Expr.Closure;
import org.tailrec.ast.Expr.If;
import org.tailrec.ast.Expr.Match;
import org.tailrec.ast.Expr.MatchArm;
import org.tailrec.ast.Expr.Return;
import org.tailrec.ast.ExprTransformer;
import org.tailrec.ast.Stmt;

/**
 * Rewrites each expression in tail position of a function body into an action: {@code
 * Action::Continue((args))} for a call of the function itself, {@code Action::Return(value)} for
 * anything else.
 *
 * <p>The tail positions of a body are
 *
 * <ul>
 *   <li>the operand of any {@code return} (outside closures and nested items), and
 *   <li>the tail expression of the body block,
 * </ul>
 *
 * <p>and recursively, for a block, if or match in tail position: the block's tail expression, both
 * branches of the if, and the body of each match arm. An if without an else gets an else branch
 * that returns unit, and a block without a tail expression gets a tail that returns unit unless it
 * ends with a {@code return}, so that every path through the body produces an action.
 *
 * <p>Expressions that are not in tail position are not changed; in particular a self call nested in
 * another expression (an argument, a closure body, a loop body) remains an ordinary recursive call.
 */
final class TailCallRewriter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RewriteContext context;
  private final IdempotenceGuard guard;

  private int continues;
  private int returns;

  TailCallRewriter(RewriteContext context, IdempotenceGuard guard) {
    this.context = context;
    this.guard = guard;
  }

  /** The number of self calls rewritten to {@code Continue} so far. */
  int continues() {
    return continues;
  }

  /** The number of values rewritten to {@code Return} so far. */
  int returns() {
    return returns;
  }

  /**
   * Rewrites the body of the function. Explicit returns are rewritten first, so nested returns are
   * already finalized when the body's own tail is rewritten.
   */
  Block rewriteBody(Block body) {
    Block withReturns = new ReturnRewriter().transformBlock(body);
    return rewriteTailBlock(withReturns);
  }

  /** Rewrites an expression that is in tail position. */
  Expr rewriteTail(Expr expr) {
    if (guard.isFinalized(expr) || expr instanceof Return) {
      // Returns are handled by ReturnRewriter wherever they appear.
      return expr;
    } else if (expr instanceof Block block) {
      return rewriteTailBlock(block);
    } else if (expr instanceof If ifExpr) {
      Block thenBlock = rewriteTailBlock(ifExpr.thenBlock());
      Expr elseBranch =
          (ifExpr.elseBranch() == null)
              ? Block.of(returnValue(Expr.UNIT))
              : rewriteTail(ifExpr.elseBranch());
      return new If(ifExpr.condition(), thenBlock, elseBranch);
    } else if (expr instanceof Match match) {
      ImmutableList<MatchArm> arms =
          match.arms().stream()
              .map(arm -> new MatchArm(arm.pattern(), arm.guard(), rewriteTail(arm.body())))
              .collect(ImmutableList.toImmutableList());
      return new Match(match.scrutinee(), arms);
    }
    return classify(expr);
  }

  private Block rewriteTailBlock(Block block) {
    if (block.tail() != null) {
      return block.withTail(rewriteTail(block.tail()));
    }
    Stmt last = block.lastStmt();
    if (last instanceof Stmt.ExprStmt exprStmt) {
      if (!exprStmt.semicolon()) {
        // A trailing block-like statement without a semicolon is the block's value.
        ImmutableList<Stmt> init = block.stmts().subList(0, block.stmts().size() - 1);
        return new Block(init, rewriteTail(exprStmt.expr()));
      } else if (exprStmt.expr() instanceof Return) {
        return block;
      }
    }
    // Falls off the end with value ().
    return block.withTail(returnValue(Expr.UNIT));
  }

  /** Applies the rewrite rules to a single expression in tail position. */
  private Expr classify(Expr expr) {
    if (guard.isFinalized(expr)) {
      return expr;
    }
    ImmutableList<Expr> args = context.selfCallArguments(expr);
    if (args == null) {
      return returnValue(expr);
    }
    if (args.size() != context.arity()) {
      // Not our problem to fix; the compiler will reject the Continue payload's type.
      logger.atWarning().log(
          "%s: self call passes %d arguments but the function takes %d",
          context.functionName(),
          args.size(),
          context.arity());
    }
    continues++;
    return guard.seal(context.names().continueWith(args));
  }

  private Expr returnValue(Expr value) {
    returns++;
    return guard.seal(context.names().returnWith(value));
  }

  /**
   * Rewrites the operand of every return as a tail position. Returns inside closures and nested
   * items exit those, not the function being transformed, so they are left alone.
   */
  private class ReturnRewriter extends ExprTransformer {
    @Override
    protected Expr transformReturn(Return ret) {
      if (ret.value() == null) {
        return new Return(returnValue(Expr.UNIT));
      }
      // Bottom-up: returns nested in the operand are finalized first.
      Expr value = rewriteTail(transform(ret.value()));
      return (value == ret.value()) ? ret : new Return(value);
    }

    @Override
    protected Expr transformClosure(Closure closure) {
      return closure;
    }
  }
}
