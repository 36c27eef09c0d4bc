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
import org.tailrec.ast.FunctionSignature;
import org.tailrec.ast.FunctionSignature.Param;
import org.tailrec.ast.Pattern;
import org.tailrec.ast.TypeRef;

/** Splits a function signature into the pieces needed to build its trampoline. */
public final class SignatureExtractor {

  private SignatureExtractor() {}

  /**
   * The parameter patterns and types of a signature, in declaration order, and its return type
   * ({@link TypeRef#UNIT} if the signature didn't declare one).
   */
  public record ExtractedSignature(
      ImmutableList<Pattern> patterns, ImmutableList<TypeRef> types, TypeRef returnType) {

    public int arity() {
      return patterns.size();
    }

    /** The type of the state carried from one step to the next: a tuple of the parameter types. */
    public TypeRef stateType() {
      return new TypeRef.TupleType(types);
    }

    /** A pattern that destructures a state tuple back into the original parameter patterns. */
    public Pattern statePattern() {
      return new Pattern.TuplePattern(patterns);
    }
  }

  public static ExtractedSignature extract(FunctionSignature signature) {
    ImmutableList<Param> params = signature.params();
    TypeRef returnType = signature.returnType();
    return new ExtractedSignature(
        params.stream().map(Param::pattern).collect(ImmutableList.toImmutableList()),
        params.stream().map(Param::type).collect(ImmutableList.toImmutableList()),
        (returnType == null) ? TypeRef.UNIT : returnType);
  }
}
