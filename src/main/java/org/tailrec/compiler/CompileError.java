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

package org.tailrec.compiler;

/** Thrown when source text can't be parsed. */
public class CompileError extends RuntimeException {
  public final int line;
  public final int column;

  public CompileError(int line, int column, String message) {
    super(String.format("%d:%d: %s", line, column, message));
    this.line = line;
    this.column = column;
  }
}
