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

/** A pattern, as used by function parameters, {@code let}, match arms and closures. */
public interface Pattern {

  Wildcard WILDCARD = new Wildcard();

  static Binding binding(String name) {
    return new Binding(name, false);
  }

  /**
   * Returns true if this pattern matches every value of its type, i.e. it contains no literal or
   * enum variant patterns.
   */
  default boolean isIrrefutable() {
    if (this instanceof TuplePattern tuple) {
      return tuple.elements().stream().allMatch(Pattern::isIrrefutable);
    }
    return this instanceof Wildcard || this instanceof Binding;
  }

  /** {@code _} */
  record Wildcard() implements Pattern {}

  /** {@code name} or {@code mut name}. */
  record Binding(String name, boolean mutable) implements Pattern {}

  record IntPattern(long value) implements Pattern {}

  record BoolPattern(boolean value) implements Pattern {}

  /** {@code (a, b)}; a one-element tuple pattern is written {@code (a,)}. */
  record TuplePattern(ImmutableList<Pattern> elements) implements Pattern {}

  /** {@code Action::Continue(c)}. */
  record VariantPattern(ImmutableList<String> path, ImmutableList<Pattern> fields)
      implements Pattern {}
}
