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

import org.tailrec.ast.Block;
import org.tailrec.ast.EnumDef;
import org.tailrec.ast.Expr;
import org.tailrec.ast.Expr.Call;
import org.tailrec.ast.Expr.Loop;
import org.tailrec.ast.Expr.Opaque;
import org.tailrec.ast.FunctionDef;
import org.tailrec.ast.Stmt;

/**
 * Keeps the rewrite stable under repeated application.
 *
 * <p>Every expression produced by the rewriter is sealed in an {@link Opaque} node, which later
 * passes leave alone. Since Opaque has no surface syntax, a tree that has been printed and parsed
 * again has lost those markers; calls of the generated {@code Action} constructors are therefore
 * also treated as finalized, and a function whose body already has the trampoline shape is not
 * transformed again.
 */
final class IdempotenceGuard {
  private final TrampolineNames names;

  IdempotenceGuard(TrampolineNames names) {
    this.names = names;
  }

  /** Marks {@code expr} as finalized. */
  Expr seal(Expr expr) {
    return (expr instanceof Opaque) ? expr : new Opaque(expr);
  }

  /** Returns true if {@code expr} must not be rewritten again. */
  boolean isFinalized(Expr expr) {
    if (expr instanceof Opaque) {
      return true;
    }
    return expr instanceof Call call
        && (call.callee().equals(names.continuePath()) || call.callee().equals(names.returnPath()));
  }

  /**
   * Returns true if {@code fn} looks like the output of {@link FunctionRebuilder}: its body
   * declares the action enum and the step function, and ends with a loop.
   */
  boolean isTrampolined(FunctionDef fn) {
    Block body = fn.body();
    Expr tail = body.tail();
    if (tail instanceof Opaque opaque) {
      tail = opaque.expr();
    }
    if (!(tail instanceof Loop)) {
      return false;
    }
    String innerName = names.innerName(fn.name());
    boolean hasEnum = false;
    boolean hasInner = false;
    for (Stmt stmt : body.stmts()) {
      if (stmt instanceof EnumDef enumDef && enumDef.name().equals(names.actionType())) {
        hasEnum = true;
      } else if (stmt instanceof FunctionDef inner && inner.name().equals(innerName)) {
        hasInner = true;
      }
    }
    return hasEnum && hasInner;
  }
}
