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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tailrec.ast.Expr;
import org.tailrec.ast.FunctionDef;
import org.tailrec.compiler.Compiler;
import org.tailrec.compiler.SourceEmitter;

@RunWith(JUnit4.class)
public class IdempotenceGuardTest {

  private final IdempotenceGuard guard = new IdempotenceGuard(TrampolineNames.DEFAULT);

  @Test
  public void sealedExpressionsAreFinalized() {
    Expr call = Expr.call(Expr.ident("f"), Expr.of(1));
    assertThat(guard.isFinalized(call)).isFalse();
    Expr sealed = guard.seal(call);
    assertThat(guard.isFinalized(sealed)).isTrue();
    assertThat(guard.seal(sealed)).isSameInstanceAs(sealed);
  }

  @Test
  public void actionConstructorsAreFinalized() {
    assertThat(guard.isFinalized(Compiler.parseExpression("Action::Return(x + 1)"))).isTrue();
    assertThat(guard.isFinalized(Compiler.parseExpression("Action::Continue((x,))"))).isTrue();
    assertThat(guard.isFinalized(Compiler.parseExpression("Other::Return(x)"))).isFalse();
    assertThat(guard.isFinalized(Compiler.parseExpression("Return(x)"))).isFalse();

    IdempotenceGuard custom =
        new IdempotenceGuard(new TrampolineNames("Step", "More", "Done", "_step", "state"));
    assertThat(custom.isFinalized(Compiler.parseExpression("Step::Done(x)"))).isTrue();
    assertThat(custom.isFinalized(Compiler.parseExpression("Action::Return(x)"))).isFalse();
  }

  @Test
  public void recognizesTrampolinedFunctions() {
    FunctionDef fn =
        Compiler.parseFunction("fn f(n: Int) -> Int { if n == 0 { 0 } else { f(n - 1) } }");
    assertThat(guard.isTrampolined(fn)).isFalse();

    FunctionDef rewritten = TailRecursionTransformer.DEFAULT.transform(fn);
    assertThat(guard.isTrampolined(rewritten)).isTrue();
    FunctionDef reparsed = Compiler.parseFunction(SourceEmitter.emit(rewritten));
    assertThat(guard.isTrampolined(reparsed)).isTrue();
  }

  @Test
  public void aLoopAloneIsNotATrampoline() {
    FunctionDef fn =
        Compiler.parseFunction(
            """
            fn f(n: Int) -> Int {
                enum Action<C, R> {
                    Continue(C),
                    Return(R),
                }
                loop {
                    break n;
                }
            }
            """);
    assertThat(guard.isTrampolined(fn)).isFalse();
  }
}
