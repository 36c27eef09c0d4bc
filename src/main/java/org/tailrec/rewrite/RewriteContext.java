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
import org.jspecify.annotations.Nullable;
import org.tailrec.ast.Expr;
import org.tailrec.ast.Expr.Call;
import org.tailrec.ast.Expr.MethodCall;

/**
 * What the rewriter knows about the function being transformed.
 *
 * <p>Self calls are recognized by name only: a call of a local closure or a nested function that
 * shadows the function's name is (incorrectly) treated as a self call.
 */
record RewriteContext(String functionName, int arity, TrampolineNames names) {

  /**
   * If {@code expr} is a call of the function being transformed, either {@code f(args)} or {@code
   * receiver.f(args)}, returns its arguments; otherwise returns null. The receiver of a
   * method-style call is dropped.
   */
  @Nullable ImmutableList<Expr> selfCallArguments(Expr expr) {
    if (expr instanceof Call call && functionName.equals(call.calleeName())) {
      return call.args();
    } else if (expr instanceof MethodCall call && functionName.equals(call.method())) {
      return call.args();
    }
    return null;
  }
}
