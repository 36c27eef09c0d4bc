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

/** The top-level items of one source text, in order. */
public record SourceFile(ImmutableList<Item> items) {

  /** Returns the top-level function with the given name, or null if there is none. */
  public @Nullable FunctionDef function(String name) {
    for (Item item : items) {
      if (item instanceof FunctionDef fn && fn.name().equals(name)) {
        return fn;
      }
    }
    return null;
  }

  /** Returns a copy of this file with {@code update} applied to each top-level function. */
  public SourceFile mapFunctions(UnaryOperator<FunctionDef> update) {
    return new SourceFile(
        items.stream()
            .map(item -> (item instanceof FunctionDef fn) ? update.apply(fn) : item)
            .collect(ImmutableList.toImmutableList()));
  }
}
