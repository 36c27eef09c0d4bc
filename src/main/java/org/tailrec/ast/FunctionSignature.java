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
import org.jspecify.annotations.Nullable;

/**
 * The signature of a function: its name, its parameters in declaration order, and its return type
 * (null if the function returns unit).
 */
public record FunctionSignature(
    String name, ImmutableList<Param> params, @Nullable TypeRef returnType) {

  /** A single parameter; the pattern may be a simple binding or a destructuring pattern. */
  public record Param(Pattern pattern, TypeRef type) {}

  public int arity() {
    return params.size();
  }

  public FunctionSignature withParams(ImmutableList<Param> newParams) {
    return new FunctionSignature(name, newParams, returnType);
  }
}
