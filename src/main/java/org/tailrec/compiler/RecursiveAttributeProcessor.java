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

package org.tailrec.compiler;

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import org.tailrec.ast.FunctionDef;
import org.tailrec.ast.SourceFile;
import org.tailrec.rewrite.TailRecursionTransformer;

/**
 * Applies a {@link TailRecursionTransformer} to each top-level function marked with {@code
 * #[recursive]}, removing the attribute; other items are passed through unchanged.
 */
public final class RecursiveAttributeProcessor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String ATTRIBUTE = "recursive";

  private final TailRecursionTransformer transformer;

  public RecursiveAttributeProcessor(TailRecursionTransformer transformer) {
    this.transformer = Preconditions.checkNotNull(transformer);
  }

  public RecursiveAttributeProcessor() {
    this(TailRecursionTransformer.DEFAULT);
  }

  public SourceFile process(SourceFile file) {
    return file.mapFunctions(this::process);
  }

  /** Parses {@code source}, rewrites the marked functions and returns the resulting text. */
  public String process(String source) {
    return SourceEmitter.emit(process(Compiler.parse(source)));
  }

  private FunctionDef process(FunctionDef fn) {
    if (!fn.hasAttribute(ATTRIBUTE)) {
      return fn;
    }
    logger.atFine().log("Rewriting #[%s] fn %s", ATTRIBUTE, fn.name());
    return transformer.transform(fn.withoutAttribute(ATTRIBUTE));
  }
}
