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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.tailrec.ast.Expr;
import org.tailrec.ast.Expr.Path;
import org.tailrec.ast.Expr.Tuple;

/**
 * The names used for the generated parts of a trampolined function. {@link #DEFAULT} produces
 *
 * <pre>
 *   enum Action&lt;C, R&gt; { Continue(C), Return(R), }
 *   fn f_inner(...) -&gt; Action&lt;..., ...&gt; { ... }
 *   let mut acc = (...);
 * </pre>
 *
 * <p>The generated names are not hygienic: a function that itself declares an {@code Action} type
 * or an {@code f_inner} function should be given different names.
 */
public record TrampolineNames(
    String actionType,
    String continueVariant,
    String returnVariant,
    String innerSuffix,
    String accumulator) {

  public static final TrampolineNames DEFAULT =
      new TrampolineNames("Action", "Continue", "Return", "_inner", "acc");

  public TrampolineNames {
    Preconditions.checkArgument(!continueVariant.equals(returnVariant), "variants must differ");
    Preconditions.checkArgument(!innerSuffix.isEmpty(), "inner suffix must not be empty");
  }

  /** The name of the step function generated for {@code functionName}. */
  public String innerName(String functionName) {
    return functionName + innerSuffix;
  }

  public Path continuePath() {
    return Expr.path(actionType, continueVariant);
  }

  public Path returnPath() {
    return Expr.path(actionType, returnVariant);
  }

  /** {@code Action::Continue((args...))}; the payload is always a tuple, even for one argument. */
  public Expr continueWith(ImmutableList<Expr> args) {
    return Expr.call(continuePath(), new Tuple(args));
  }

  /** {@code Action::Return(value)}. */
  public Expr returnWith(Expr value) {
    return Expr.call(returnPath(), value);
  }
}
