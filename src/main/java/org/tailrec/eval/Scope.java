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

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tailrec.ast.Item;

/**
 * A lexical scope: local bindings plus the items declared in a block.
 *
 * <p>Each {@code let} starts a new Scope, so a closure created before a shadowing {@code let} keeps
 * seeing the earlier binding. Function bodies start a <i>boundary</i> scope: lookups of locals stop
 * there (nested functions can't see the enclosing function's locals), while item lookups continue
 * outward.
 */
final class Scope {
  private final @Nullable Scope parent;
  private final boolean isBoundary;

  /** A null value means declared but not yet assigned ({@code let x;}). */
  private final Map<String, @Nullable Value> locals = new HashMap<>();

  private final Map<String, Item> items = new HashMap<>();

  private Scope(@Nullable Scope parent, boolean isBoundary) {
    this.parent = parent;
    this.isBoundary = isBoundary;
  }

  static Scope global() {
    return new Scope(null, true);
  }

  /** Returns a new scope for a function body defined in this scope. */
  Scope newFunctionScope() {
    return new Scope(this, true);
  }

  Scope newChild() {
    return new Scope(this, false);
  }

  void declare(String name, @Nullable Value value) {
    locals.put(name, value);
  }

  void declareItem(Item item) {
    items.put(item.name(), item);
  }

  /** Returns the scope that holds local {@code name}, or null if it's not visible from here. */
  private @Nullable Scope findLocal(String name) {
    for (Scope scope = this; scope != null; scope = scope.parent) {
      if (scope.locals.containsKey(name)) {
        return scope;
      }
      if (scope.isBoundary) {
        break;
      }
    }
    return null;
  }

  boolean hasLocal(String name) {
    return findLocal(name) != null;
  }

  Value lookup(String name) {
    Scope scope = findLocal(name);
    if (scope == null) {
      throw EvaluationException.error("'%s' is not defined", name);
    }
    Value value = scope.locals.get(name);
    if (value == null) {
      throw EvaluationException.error("'%s' is used before being assigned", name);
    }
    return value;
  }

  void assign(String name, Value value) {
    Scope scope = findLocal(name);
    if (scope == null) {
      throw EvaluationException.error("Can't assign to undefined '%s'", name);
    }
    scope.locals.put(name, value);
  }

  /** Returns the item with the given name together with the scope it was declared in. */
  @Nullable Scope scopeOfItem(String name) {
    for (Scope scope = this; scope != null; scope = scope.parent) {
      if (scope.items.containsKey(name)) {
        return scope;
      }
    }
    return null;
  }

  @Nullable Item item(String name) {
    return items.get(name);
  }
}
