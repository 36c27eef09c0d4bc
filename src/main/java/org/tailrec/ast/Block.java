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
import com.google.common.collect.Iterables;
import org.jspecify.annotations.Nullable;

/**
 * A sequence of statements optionally followed by a tail expression, which is the block's value.
 * A block without a tail evaluates to unit (unless it exits early).
 */
public record Block(ImmutableList<Stmt> stmts, @Nullable Expr tail) implements Expr {

  public static final Block EMPTY = new Block(ImmutableList.of(), null);

  /** Returns a block with no statements whose value is {@code tail}. */
  public static Block of(Expr tail) {
    return new Block(ImmutableList.of(), tail);
  }

  /** Returns a copy of this block with a different tail expression. */
  public Block withTail(@Nullable Expr newTail) {
    return new Block(stmts, newTail);
  }

  /** Returns the last statement, or null if there are none. */
  public @Nullable Stmt lastStmt() {
    return Iterables.getLast(stmts, null);
  }
}
