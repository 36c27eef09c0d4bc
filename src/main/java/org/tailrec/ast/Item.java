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

/**
 * A named declaration ({@link FunctionDef} or {@link EnumDef}). Items may appear at the top level
 * of a {@link SourceFile} or as statements in a block, where they are visible to the whole block
 * but cannot see the block's locals.
 */
public interface Item extends Stmt {
  String name();
}
