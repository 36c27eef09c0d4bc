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

/** A syntactic type. Types are carried through the rewrite but never checked. */
public interface TypeRef {

  TupleType UNIT = new TupleType(ImmutableList.of());

  static Named named(String name, TypeRef... args) {
    return new Named(name, ImmutableList.copyOf(args));
  }

  /** {@code Int}, {@code Action<C, R>}. */
  record Named(String name, ImmutableList<TypeRef> args) implements TypeRef {}

  /** {@code (A, B)}; {@code ()} is unit and {@code (A,)} is a one-element tuple. */
  record TupleType(ImmutableList<TypeRef> elements) implements TypeRef {}
}
