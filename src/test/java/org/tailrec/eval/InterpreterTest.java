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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tailrec.compiler.Compiler;

@RunWith(JUnit4.class)
public class InterpreterTest {

  private static Interpreter interpreter(String source) {
    return new Interpreter(Compiler.parse(source));
  }

  /** Evaluates {@code expr} in a program with no items. */
  private static String eval(String expr) {
    return interpreter("").eval(Compiler.parseExpression(expr)).toString();
  }

  private static String evalError(String expr) {
    EvaluationException e =
        assertThrows(
            EvaluationException.class,
            () -> interpreter("").eval(Compiler.parseExpression(expr)));
    return e.getMessage();
  }

  @Test
  public void arithmetic() {
    assertThat(eval("1 + 2 * 3 - 4")).isEqualTo("3");
    assertThat(eval("-7 / 2")).isEqualTo("-3");
    assertThat(eval("-7 % 2")).isEqualTo("-1");
    assertThat(eval("-(3 - 5)")).isEqualTo("2");
    assertThat(eval("(-5).abs() + 2.pow(10) + 3.min(1) + 3.max(1) + (-9).signum()"))
        .isEqualTo("1032");
  }

  @Test
  public void arithmeticErrors() {
    assertThat(evalError("9223372036854775807 + 1")).isEqualTo("Integer overflow");
    assertThat(evalError("-9223372036854775808 / -1")).isEqualTo("Integer overflow");
    assertThat(evalError("-(-9223372036854775808)")).isEqualTo("Integer overflow");
    assertThat(evalError("1 % 0")).isEqualTo("Division by zero");
    assertThat(evalError("2.pow(-1)")).isEqualTo("Negative exponent -1");
    assertThat(evalError("2.sqrt()")).isEqualTo("Int has no method 'sqrt'");
    assertThat(evalError("1 + true")).isEqualTo("Expected an integer, got true");
    assertThat(evalError("if 1 { 2 } else { 3 }")).isEqualTo("Expected a boolean, got 1");
  }

  @Test
  public void powWithHugeExponents() {
    assertThat(eval("3.pow(39)")).isEqualTo("4052555153018976267");
    assertThat(eval("(-2).pow(63)")).isEqualTo("-9223372036854775808");
    assertThat(eval("1.pow(4000000000000000000)")).isEqualTo("1");
    assertThat(eval("0.pow(4000000000000000000)")).isEqualTo("0");
    assertThat(eval("(-1).pow(4000000000000000001)")).isEqualTo("-1");
    assertThat(eval("(-1).pow(4000000000000000000)")).isEqualTo("1");
    assertThat(evalError("3.pow(40)")).isEqualTo("Integer overflow");
    assertThat(evalError("2.pow(4000000000000000000)")).isEqualTo("Integer overflow");
  }

  @Test
  public void booleansShortCircuit() {
    assertThat(eval("1 < 2 && 2 <= 2 && !(3 > 4) && 4 >= 4")).isEqualTo("true");
    assertThat(eval("false && 1 / 0 == 0")).isEqualTo("false");
    assertThat(eval("true || 1 / 0 == 0")).isEqualTo("true");
    assertThat(eval("(1, (true,)) == (1, (true,))")).isEqualTo("true");
    assertThat(eval("(1, 2) != (2, 1)")).isEqualTo("true");
  }

  @Test
  public void valuesPrintAsSource() {
    assertThat(eval("()")).isEqualTo("()");
    assertThat(eval("(1,)")).isEqualTo("(1,)");
    assertThat(eval("(1, (false, ()))")).isEqualTo("(1, (false, ()))");
    assertThat(eval("|x| x")).isEqualTo("<closure/1>");
  }

  @Test
  public void functionsAndEnums() {
    Interpreter interpreter =
        interpreter(
            """
            enum Option<T> {
                Some(T),
                None,
            }

            fn find(n: Int, limit: Int) -> Option<Int> {
                if n > limit {
                    Option::None
                } else if n * n % 7 == 2 {
                    Option::Some(n)
                } else {
                    find(n + 1, limit)
                }
            }

            fn unwrap_or(o: Option<Int>, d: Int) -> Int {
                match o {
                    Option::Some(x) => x,
                    Option::None() => d,
                }
            }
            """);
    assertThat(interpreter.call("find", Value.of(1), Value.of(10)).toString())
        .isEqualTo("Option::Some(3)");
    assertThat(interpreter.call("find", Value.of(4), Value.of(3)).toString())
        .isEqualTo("Option::None");
    assertThat(interpreter.eval(Compiler.parseExpression("unwrap_or(find(4, 9), 0)")))
        .isEqualTo(Value.of(4));
    assertThat(interpreter.eval(Compiler.parseExpression("unwrap_or(Option::None, 0)")))
        .isEqualTo(Value.of(0));
  }

  @Test
  public void functionsAsValues() {
    Interpreter interpreter =
        interpreter(
            """
            fn twice(f: Fn, x: Int) -> Int {
                f(f(x))
            }

            fn inc(x: Int) -> Int {
                x + 1
            }

            fn main(k: Int) -> Int {
                twice(inc, 0) + twice(|x| x * k, 1)
            }
            """);
    assertThat(interpreter.call("main", Value.of(3))).isEqualTo(Value.of(11));
  }

  @Test
  public void closuresCaptureTheirScope() {
    Interpreter interpreter =
        interpreter(
            """
            fn f() -> Int {
                let x = 1;
                let get = || x;
                let x = 10;
                let mut y = 0;
                let add = |n| {
                    y = y + n;
                    return y;
                    y = 100;
                };
                add(x);
                add(get()) + x
            }
            """);
    assertThat(interpreter.call("f")).isEqualTo(Value.of(21));
  }

  @Test
  public void nestedFunctionsCantSeeLocals() {
    Interpreter interpreter =
        interpreter(
            """
            fn f(x: Int) -> Int {
                fn g() -> Int {
                    x
                }
                g()
            }

            fn h(x: Int) -> Int {
                fn k(y: Int) -> Int {
                    y * 2
                }
                k(x) + f2(x)
            }

            fn f2(x: Int) -> Int {
                x
            }
            """);
    EvaluationException e =
        assertThrows(EvaluationException.class, () -> interpreter.call("f", Value.of(1)));
    assertThat(e).hasMessageThat().isEqualTo("'x' is not defined");
    assertThat(interpreter.call("h", Value.of(5))).isEqualTo(Value.of(15));
  }

  @Test
  public void loops() {
    Interpreter interpreter =
        interpreter(
            """
            fn triangle(n: Int) -> Int {
                let mut i = 0;
                let mut sum = 0;
                while i < n {
                    i = i + 1;
                    if i == 100 {
                        break;
                    }
                    sum = sum + i;
                }
                sum
            }

            fn first_square_above(n: Int) -> Int {
                let mut i = 0;
                loop {
                    if i * i > n {
                        break i * i;
                    }
                    i = i + 1;
                }
            }

            fn early(n: Int) -> Int {
                loop {
                    return n;
                }
            }
            """);
    assertThat(interpreter.call("triangle", Value.of(10))).isEqualTo(Value.of(55));
    assertThat(interpreter.call("triangle", Value.of(1000))).isEqualTo(Value.of(4950));
    assertThat(interpreter.call("first_square_above", Value.of(50))).isEqualTo(Value.of(64));
    assertThat(interpreter.call("early", Value.of(7))).isEqualTo(Value.of(7));
  }

  @Test
  public void matchPatterns() {
    Interpreter interpreter =
        interpreter(
            """
            fn classify(p: (Int, Bool)) -> Int {
                match p {
                    (0, _) => 0,
                    (n, true) if n < 0 => -1,
                    (-5, false) => -5,
                    (n, b) => match b {
                        true => n,
                        false => n * 10,
                    },
                }
            }
            """);
    assertThat(interpreter.call("classify", Value.tuple(Value.of(0), Value.of(true))))
        .isEqualTo(Value.of(0));
    assertThat(interpreter.call("classify", Value.tuple(Value.of(-3), Value.of(true))))
        .isEqualTo(Value.of(-1));
    assertThat(interpreter.call("classify", Value.tuple(Value.of(-5), Value.of(false))))
        .isEqualTo(Value.of(-5));
    assertThat(interpreter.call("classify", Value.tuple(Value.of(4), Value.of(false))))
        .isEqualTo(Value.of(40));
    assertThat(interpreter.call("classify", Value.tuple(Value.of(4), Value.of(true))))
        .isEqualTo(Value.of(4));
  }

  @Test
  public void runtimeErrors() {
    Interpreter interpreter =
        interpreter(
            """
            fn f(n: Int) -> Int {
                match n {
                    0 => 1,
                }
            }

            fn g(n: Int) -> Int {
                let x;
                x
            }
            """);
    assertThat(assertThrows(EvaluationException.class, () -> interpreter.call("f", Value.of(1))))
        .hasMessageThat()
        .isEqualTo("No match arm matches 1");
    assertThat(assertThrows(EvaluationException.class, () -> interpreter.call("f")))
        .hasMessageThat()
        .isEqualTo("f expects 1 arguments but got 0");
    assertThat(assertThrows(EvaluationException.class, () -> interpreter.call("g", Value.of(1))))
        .hasMessageThat()
        .isEqualTo("'x' is used before being assigned");
    assertThat(assertThrows(EvaluationException.class, () -> interpreter.call("nope")))
        .hasMessageThat()
        .isEqualTo("No function named 'nope'");
    assertThat(evalError("Action::Return(1)")).isEqualTo("No enum named 'Action'");
    assertThat(evalError("break 1")).isEqualTo("return or break outside of a function or loop");
  }

  @Test
  public void deepRecursionIsReportedAsAnError() {
    Interpreter interpreter =
        interpreter("fn down(n: Int) -> Int { if n == 0 { 0 } else { 1 + down(n - 1) } }");
    assertThat(interpreter.call("down", Value.of(100))).isEqualTo(Value.of(100));
    EvaluationException e =
        assertThrows(
            EvaluationException.class, () -> interpreter.call("down", Value.of(100_000_000)));
    assertThat(e).hasMessageThat().isEqualTo("Stack overflow");
  }
}
