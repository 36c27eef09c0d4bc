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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tailrec.ast.Block;
import org.tailrec.ast.EnumDef;
import org.tailrec.ast.Expr;
import org.tailrec.ast.Expr.Binary;
import org.tailrec.ast.Expr.BinaryOp;
import org.tailrec.ast.Expr.If;
import org.tailrec.ast.Expr.Match;
import org.tailrec.ast.FunctionDef;
import org.tailrec.ast.Pattern;
import org.tailrec.ast.SourceFile;
import org.tailrec.ast.Stmt;
import org.tailrec.ast.TypeRef;

@RunWith(JUnit4.class)
public class CompilerTest {

  @Test
  public void functionSignature() {
    FunctionDef fn =
        Compiler.parseFunction(
            """
            #[recursive]
            fn sum_to(n: Int, (a, _): (Int, Bool)) -> Int {
                n
            }
            """);
    assertThat(fn.name()).isEqualTo("sum_to");
    assertThat(fn.attributes()).containsExactly("recursive");
    assertThat(fn.signature().arity()).isEqualTo(2);
    assertThat(fn.signature().params().get(1).pattern())
        .isEqualTo(
            new Pattern.TuplePattern(ImmutableList.of(Pattern.binding("a"), Pattern.WILDCARD)));
    assertThat(fn.signature().returnType()).isEqualTo(TypeRef.named("Int"));
    assertThat(fn.body()).isEqualTo(Block.of(Expr.ident("n")));
  }

  @Test
  public void trailingBlockLikeStatementIsTheValue() {
    FunctionDef fn =
        Compiler.parseFunction("fn f(n: Int) -> Int { let m = n; if m == 0 { 1 } else { 2 } }");
    assertThat(fn.body().stmts()).hasSize(1);
    assertThat(fn.body().tail()).isInstanceOf(If.class);

    FunctionDef withSemicolon = Compiler.parseFunction("fn f(n: Int) { match n { _ => 1, }; }");
    assertThat(withSemicolon.body().tail()).isNull();
    assertThat(withSemicolon.body().lastStmt()).isInstanceOf(Stmt.ExprStmt.class);
  }

  @Test
  public void blockLikeStatementsNeedNoSemicolon() {
    FunctionDef fn =
        Compiler.parseFunction(
            """
            fn f(n: Int) -> Int {
                if n == 0 {
                    return 1
                }
                match n {
                    1 => 2,
                    _ => 3,
                }
                n
            }
            """);
    assertThat(fn.body().stmts()).hasSize(2);
    assertThat(((Stmt.ExprStmt) fn.body().stmts().get(1)).expr()).isInstanceOf(Match.class);
    assertThat(fn.body().tail()).isEqualTo(Expr.ident("n"));
  }

  @Test
  public void operatorPrecedence() {
    Expr expr = Compiler.parseExpression("a + b * c == d || !e && f");
    assertThat(SourceEmitter.emit(expr)).isEqualTo("a + b * c == d || !e && f");
    Binary or = (Binary) expr;
    assertThat(or.op()).isEqualTo(BinaryOp.OR);
    assertThat(((Binary) or.right()).op()).isEqualTo(BinaryOp.AND);
    Binary eq = (Binary) or.left();
    assertThat(eq.op()).isEqualTo(BinaryOp.EQ);
    assertThat(((Binary) eq.left()).op()).isEqualTo(BinaryOp.ADD);

    Binary sub = (Binary) Compiler.parseExpression("a - b - c");
    assertThat(sub.left()).isInstanceOf(Binary.class);
    assertThat(sub.right()).isEqualTo(Expr.ident("c"));
  }

  @Test
  public void literalsAndTuples() {
    assertThat(Compiler.parseExpression("-9223372036854775808"))
        .isEqualTo(Expr.of(Long.MIN_VALUE));
    assertThat(Compiler.parseExpression("(1)")).isEqualTo(Expr.of(1));
    assertThat(Compiler.parseExpression("(1,)"))
        .isEqualTo(new Expr.Tuple(ImmutableList.of(Expr.of(1))));
    assertThat(Compiler.parseExpression("()")).isEqualTo(Expr.UNIT);
    assertThat(Compiler.parseExpression("Action::Return(true)"))
        .isEqualTo(Expr.call(Expr.path("Action", "Return"), Expr.of(true)));
  }

  @Test
  public void enumsAndNestedItems() {
    SourceFile file =
        Compiler.parse(
            """
            enum Option<T> {
                Some(T),
                None,
            }

            fn f() -> Int {
                fn g() -> Int { 1 }
                g()
            }
            """);
    assertThat(file.items()).hasSize(2);
    EnumDef option = (EnumDef) file.items().get(0);
    assertThat(option.typeParams()).containsExactly("T");
    assertThat(option.variant("Some").payload()).isEqualTo(TypeRef.named("T"));
    assertThat(option.variant("None").payload()).isNull();
    assertThat(option.variant("Other")).isNull();
    assertThat(file.function("f").body().stmts().get(0)).isInstanceOf(FunctionDef.class);
    assertThat(file.function("g")).isNull();
  }

  @Test
  public void syntaxErrorHasPosition() {
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.parse("fn f(n: Int) {\n  n +\n}"));
    assertThat(e.line).isEqualTo(3);
    assertThat(e).hasMessageThat().startsWith("3:");
  }

  @Test
  public void lexerErrorIsACompileError() {
    CompileError e = assertThrows(CompileError.class, () -> Compiler.parse("fn f() { $ }"));
    assertThat(e.line).isEqualTo(1);
    assertThat(e.column).isEqualTo(9);
  }

  @Test
  public void duplicateDefinitions() {
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.parse("fn f() {}\nenum f { A }"));
    assertThat(e).hasMessageThat().isEqualTo("2:0: Duplicate definition of enum f");

    assertThrows(CompileError.class, () -> Compiler.parse("fn f() { fn g() {} fn g() {} }"));
  }

  @Test
  public void refutableParameterIsRejected() {
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.parseFunction("fn f(0: Int) {}"));
    assertThat(e).hasMessageThat().contains("Refutable pattern '0'");
  }

  @Test
  public void invalidConstructs() {
    assertThrows(CompileError.class, () -> Compiler.parse("#[recursive] enum E { A }"));
    assertThrows(CompileError.class, () -> Compiler.parseFunction("fn f() { 1 + 2 = 3; }"));
    assertThrows(CompileError.class, () -> Compiler.parseExpression("99999999999999999999"));
    assertThrows(CompileError.class, () -> Compiler.parseFunction("fn f() {} fn g() {}"));
  }
}
