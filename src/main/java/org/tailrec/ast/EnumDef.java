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

/** {@code enum Name<T, U> { A(T), B(U), C }}. */
public record EnumDef(
    String name, ImmutableList<String> typeParams, ImmutableList<Variant> variants)
    implements Item {

  /** A variant, with at most one payload type. */
  public record Variant(String name, @Nullable TypeRef payload) {}

  /** Returns the variant with the given name, or null if there is none. */
  public @Nullable Variant variant(String variantName) {
    return variants.stream().filter(v -> v.name().equals(variantName)).findFirst().orElse(null);
  }
}
