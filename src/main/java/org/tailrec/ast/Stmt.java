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

import org.jspecify.annotations.Nullable;

/** A statement in a {@link Block}: a local binding, an expression, or a nested {@link Item}. */
public interface Stmt {

  /** {@code let pattern: type = init;} (type and initializer are optional). */
  record Let(Pattern pattern, @Nullable TypeRef type, @Nullable Expr init) implements Stmt {}

  /**
   * An expression evaluated for its effect. {@code semicolon} is false only for block-like
   * expressions ({@code if}, {@code match}, loops, blocks), which may omit it.
   */
  record ExprStmt(Expr expr, boolean semicolon) implements Stmt {}
}
