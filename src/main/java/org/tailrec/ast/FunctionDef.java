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

/**
 * A function definition: attributes (e.g. {@code #[recursive]}), a signature, and a body.
 *
 * <p>Attributes are kept in source order and compared by name only.
 */
public record FunctionDef(ImmutableList<String> attributes, FunctionSignature signature, Block body)
    implements Item {

  public FunctionDef(FunctionSignature signature, Block body) {
    this(ImmutableList.of(), signature, body);
  }

  @Override
  public String name() {
    return signature.name();
  }

  public boolean hasAttribute(String attribute) {
    return attributes.contains(attribute);
  }

  /** Returns a copy of this function without the given attribute. */
  public FunctionDef withoutAttribute(String attribute) {
    ImmutableList<String> remaining =
        attributes.stream()
            .filter(a -> !a.equals(attribute))
            .collect(ImmutableList.toImmutableList());
    return new FunctionDef(remaining, signature, body);
  }
}
