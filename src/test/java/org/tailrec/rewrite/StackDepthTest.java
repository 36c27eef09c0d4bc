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

import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tailrec.ast.SourceFile;
import org.tailrec.compiler.Compiler;
import org.tailrec.compiler.RecursiveAttributeProcessor;
import org.tailrec.eval.EvaluationException;
import org.tailrec.eval.Interpreter;
import org.tailrec.eval.Value;

/**
 * Runs deep recursions on a thread with a small stack: the original functions run out of stack,
 * while their rewritten versions run in constant stack as long as all the recursion is in tail
 * position.
 */
@RunWith(JUnit4.class)
public class StackDepthTest {

  private static final long STACK_SIZE = 1 << 20;

  private static final String SUM_TO =
      """
      #[recursive]
      fn sum_to(n: Int, acc: Int) -> Int {
          if n == 0 {
              return acc
          }
          return sum_to(n - 1, acc + n)
      }
      """;

  private static final String IS_EVEN =
      """
      #[recursive]
      fn is_even(n: Int) -> Bool {
          if n == 0 {
              true
          } else if n == 1 {
              false
          } else {
              is_even(n - 2)
          }
      }
      """;

  private static final String NON_TAIL =
      """
      fn helper(x: Int) -> Int {
          x + 1
      }

      #[recursive]
      fn recurse(n: Int) -> Int {
          if n == 0 {
              0
          } else {
              helper(recurse(n - 1))
          }
      }
      """;

  @Test
  public void originalOverflows() {
    Interpreter interpreter = new Interpreter(Compiler.parse(SUM_TO));
    ExecutionException e =
        assertThrows(
            ExecutionException.class,
            () -> callOnSmallStack(interpreter, "sum_to", Value.of(100_000), Value.of(0)));
    assertThat(e).hasCauseThat().isInstanceOf(EvaluationException.class);
    assertThat(e).hasCauseThat().hasMessageThat().isEqualTo("Stack overflow");
  }

  @Test
  public void sumTo() throws Exception {
    Interpreter interpreter = new Interpreter(rewrite(SUM_TO));
    assertThat(callOnSmallStack(interpreter, "sum_to", Value.of(100_000), Value.of(0)))
        .isEqualTo(Value.of(5_000_050_000L));
  }

  @Test
  public void isEven() throws Exception {
    Interpreter interpreter = new Interpreter(rewrite(IS_EVEN));
    assertThat(callOnSmallStack(interpreter, "is_even", Value.of(10_000)))
        .isEqualTo(Value.of(true));
    assertThat(callOnSmallStack(interpreter, "is_even", Value.of(1_000_001)))
        .isEqualTo(Value.of(false));
  }

  @Test
  public void nonTailRecursionStillGrowsTheStack() throws Exception {
    Interpreter interpreter = new Interpreter(rewrite(NON_TAIL));
    assertThat(callOnSmallStack(interpreter, "recurse", Value.of(100))).isEqualTo(Value.of(100));
    ExecutionException e =
        assertThrows(
            ExecutionException.class,
            () -> callOnSmallStack(interpreter, "recurse", Value.of(100_000)));
    assertThat(e).hasCauseThat().hasMessageThat().isEqualTo("Stack overflow");
  }

  private static SourceFile rewrite(String source) {
    return new RecursiveAttributeProcessor().process(Compiler.parse(source));
  }

  private static Value callOnSmallStack(Interpreter interpreter, String function, Value... args)
      throws ExecutionException, InterruptedException {
    FutureTask<Value> task = new FutureTask<>(() -> interpreter.call(function, args));
    Thread thread = new Thread(null, task, "small-stack", STACK_SIZE);
    thread.start();
    return task.get();
  }
}
