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
import com.google.common.flogger.FluentLogger;
import org.tailrec.ast.Block;
import org.tailrec.ast.FunctionDef;
import org.tailrec.rewrite.SignatureExtractor.ExtractedSignature;

/**
 * Rewrites a self-recursive function into an equivalent function whose self calls in tail position
 * don't grow the stack.
 *
 * <p>The result has the same name, parameter types and return type as the original. Its body
 * defines a step function that runs the original body once and returns either {@code
 * Action::Continue(nextArguments)} (where the original made a tail call of itself) or {@code
 * Action::Return(value)}, and a loop that calls the step function until it returns.
 *
 * <p>The transformation is purely syntactic. It doesn't check types: a self call with the wrong
 * number or types of arguments produces a {@code Continue} payload that the downstream compiler
 * will reject. Applying it to its own output returns that output unchanged.
 *
 * <p>Instances are immutable and may be shared.
 */
public final class TailRecursionTransformer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** A transformer that uses {@link TrampolineNames#DEFAULT}. */
  public static final TailRecursionTransformer DEFAULT =
      new TailRecursionTransformer(TrampolineNames.DEFAULT);

  private final TrampolineNames names;

  public TailRecursionTransformer(TrampolineNames names) {
    this.names = Preconditions.checkNotNull(names);
  }

  public TrampolineNames names() {
    return names;
  }

  public FunctionDef transform(FunctionDef fn) {
    Preconditions.checkNotNull(fn);
    IdempotenceGuard guard = new IdempotenceGuard(names);
    if (guard.isTrampolined(fn)) {
      logger.atFine().log("%s is already trampolined", fn.name());
      return fn;
    }
    ExtractedSignature signature = SignatureExtractor.extract(fn.signature());
    TailCallRewriter rewriter =
        new TailCallRewriter(new RewriteContext(fn.name(), signature.arity(), names), guard);
    Block body = rewriter.rewriteBody(fn.body());
    logger.atFine().log(
        "%s: rewrote %d tail self calls and %d returned values",
        fn.name(),
        rewriter.continues(),
        rewriter.returns());
    if (rewriter.continues() == 0) {
      logger.atInfo().log("%s has no self calls in tail position", fn.name());
    }
    return new FunctionRebuilder(guard, names).rebuild(fn, signature, body);
  }
}
