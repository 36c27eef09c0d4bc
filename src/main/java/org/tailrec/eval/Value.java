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

package org.tailrec.eval;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.tailrec.ast.Expr;
import org.tailrec.ast.FunctionDef;
import org.tailrec.ast.Pattern;
import org.tailrec.util.StringUtil;

/** A runtime value. {@code toString()} returns the value as it would be written in source. */
public interface Value {

  TupleValue UNIT = new TupleValue(ImmutableList.of());

  static IntValue of(long value) {
    return new IntValue(value);
  }

  static BoolValue of(boolean value) {
    return value ? BoolValue.TRUE : BoolValue.FALSE;
  }

  static TupleValue tuple(Value... elements) {
    return new TupleValue(ImmutableList.copyOf(elements));
  }

  record IntValue(long value) implements Value {
    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  record BoolValue(boolean value) implements Value {
    static final BoolValue TRUE = new BoolValue(true);
    static final BoolValue FALSE = new BoolValue(false);

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  record TupleValue(ImmutableList<Value> elements) implements Value {
    @Override
    public String toString() {
      return StringUtil.joinElements(
          "(", elements.size() == 1 ? ",)" : ")", elements.size(), elements::get);
    }
  }

  /** A value of an enum type, e.g. {@code Action::Return(3)}; a bare variant has no payload. */
  record VariantValue(String enumName, String variant, @Nullable Value payload) implements Value {
    @Override
    public String toString() {
      String name = enumName + "::" + variant;
      return (payload == null) ? name : name + "(" + payload + ")";
    }
  }

  /** A closure together with the scope it was created in. */
  record ClosureValue(ImmutableList<Pattern> params, Expr body, Scope scope) implements Value {
    @Override
    public String toString() {
      return "<closure/" + params.size() + ">";
    }
  }

  /** A named function, used as a value (e.g. passed as an argument). */
  record FunctionValue(FunctionDef fn, Scope scope) implements Value {
    @Override
    public String toString() {
      return "<fn " + fn.name() + ">";
    }
  }
}
