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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tailrec.ast.FunctionDef;
import org.tailrec.compiler.Compiler;
import org.tailrec.compiler.SourceEmitter;

@RunWith(JUnit4.class)
public class TailRecursionTransformerTest {

  private static final TailRecursionTransformer transformer = TailRecursionTransformer.DEFAULT;

  private static String transform(String source) {
    return SourceEmitter.emit(transformer.transform(Compiler.parseFunction(source)));
  }

  @Test
  public void sumTo() {
    assertThat(
            transform(
                """
                fn sum_to(n: Int, acc: Int) -> Int {
                    if n == 0 {
                        return acc;
                    }
                    sum_to(n - 1, acc + n)
                }
                """))
        .isEqualTo(
            """
            fn sum_to(n: Int, acc: Int) -> Int {
                enum Action<C, R> {
                    Continue(C),
                    Return(R),
                }
                fn sum_to_inner((n, acc): (Int, Int)) -> Action<(Int, Int), Int> {
                    if n == 0 {
                        return Action::Return(acc);
                    }
                    Action::Continue((n - 1, acc + n))
                }
                let mut acc = (n, acc);
                loop {
                    match sum_to_inner(acc) {
                        Action::Return(r) => return r,
                        Action::Continue(c) => acc = c,
                    }
                }
            }
            """);
  }

  @Test
  public void signatureIsPreserved() {
    FunctionDef fn =
        Compiler.parseFunction(
            """
            #[inline]
            fn gcd(a: Int, mut b: Int) -> Int {
                if b == 0 { a } else { gcd(b, a % b) }
            }
            """);
    FunctionDef rewritten = transformer.transform(fn);
    assertThat(rewritten.signature()).isEqualTo(fn.signature());
    assertThat(rewritten.attributes()).containsExactly("inline");
  }

  @Test
  public void destructuredParamsAreRenamed() {
    String rewritten =
        transform(
            """
            fn fib((a, b): (Int, Int), n: Int) -> Int {
                if n == 0 { a } else { fib((b, a + b), n - 1) }
            }
            """);
    assertThat(rewritten).startsWith("fn fib(arg0: (Int, Int), n: Int) -> Int {\n");
    assertThat(rewritten)
        .contains(
            "fn fib_inner(((a, b), n): ((Int, Int), Int))"
                + " -> Action<((Int, Int), Int), Int> {");
    assertThat(rewritten).contains("Action::Continue(((b, a + b), n - 1))");
    assertThat(rewritten).contains("let mut acc = (arg0, n);");
  }

  @Test
  public void renamedParamsAvoidExistingNames() {
    String rewritten =
        transform(
            """
            fn g((x, _): (Int, Int), arg0: Int, _: Bool) -> Int {
                if x == 0 { arg0 } else { g((x - 1, 0), arg0 + 1, true) }
            }
            """);
    assertThat(rewritten).startsWith("fn g(_arg0: (Int, Int), arg0: Int, arg2: Bool) -> Int {\n");
    assertThat(rewritten).contains("let mut acc = (_arg0, arg0, arg2);");
  }

  @Test
  public void unitReturnType() {
    String rewritten =
        transform(
            """
            fn countdown(n: Int) {
                if n > 0 {
                    countdown(n - 1)
                }
            }
            """);
    assertThat(rewritten).startsWith("fn countdown(n: Int) {\n");
    assertThat(rewritten).contains("fn countdown_inner((n,): (Int,)) -> Action<(Int,), ()> {");
  }

  @Test
  public void customNames() {
    TailRecursionTransformer custom =
        new TailRecursionTransformer(
            new TrampolineNames("Step", "More", "Done", "_step", "state"));
    String rewritten =
        SourceEmitter.emit(
            custom.transform(
                Compiler.parseFunction(
                    "fn is_even(n: Int) -> Bool { if n == 0 { true } else { is_even(n - 1) } }")));
    assertThat(rewritten)
        .isEqualTo(
            """
            fn is_even(n: Int) -> Bool {
                enum Step<C, R> {
                    More(C),
                    Done(R),
                }
                fn is_even_step((n,): (Int,)) -> Step<(Int,), Bool> {
                    if n == 0 {
                        Step::Done(true)
                    } else {
                        Step::More((n - 1,))
                    }
                }
                let mut state = (n,);
                loop {
                    match is_even_step(state) {
                        Step::Done(r) => return r,
                        Step::More(c) => state = c,
                    }
                }
            }
            """);
  }

  @Test
  public void transformIsIdempotent() {
    FunctionDef fn =
        Compiler.parseFunction(
            """
            fn f(x: Int) -> Int {
                match x {
                    0 => 1,
                    n => f(n - 1),
                }
            }
            """);
    FunctionDef once = transformer.transform(fn);
    assertThat(transformer.transform(once)).isSameInstanceAs(once);

    FunctionDef reparsed = Compiler.parseFunction(SourceEmitter.emit(once));
    assertThat(transformer.transform(reparsed)).isEqualTo(reparsed);
    assertThat(SourceEmitter.emit(reparsed)).isEqualTo(SourceEmitter.emit(once));
  }

  @Test
  public void functionWithoutSelfCalls() {
    String rewritten = transform("fn answer() -> Int { 42 }");
    assertThat(rewritten)
        .contains(
            "    fn answer_inner((): ()) -> Action<(), Int> {\n"
                + "        Action::Return(42)\n"
                + "    }\n");
    assertThat(rewritten).contains("let mut acc = ();");
    // Only the driver loop's match arm mentions Continue.
    assertThat(rewritten.split("Action::Continue\\(", -1)).hasLength(2);
  }

  @Test
  public void namesMustBeDistinct() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new TrampolineNames("Action", "Next", "Next", "_inner", "acc"));
    assertThrows(
        IllegalArgumentException.class,
        () -> new TrampolineNames("Action", "Continue", "Return", "", "acc"));
  }
}
