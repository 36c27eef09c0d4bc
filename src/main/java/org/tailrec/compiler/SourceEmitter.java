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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import java.util.List;
import java.util.function.Consumer;
import org.tailrec.ast.Block;
import org.tailrec.ast.EnumDef;
import org.tailrec.ast.Expr;
import org.tailrec.ast.Expr.Assign;
import org.tailrec.ast.Expr.Binary;
import org.tailrec.ast.Expr.BoolLiteral;
import org.tailrec.ast.Expr.Break;
import org.tailrec.ast.Expr.Call;
import org.tailrec.ast.Expr.Closure;
import org.tailrec.ast.Expr.If;
import org.tailrec.ast.Expr.IntLiteral;
import org.tailrec.ast.Expr.Loop;
import org.tailrec.ast.Expr.Match;
import org.tailrec.ast.Expr.MatchArm;
import org.tailrec.ast.Expr.MethodCall;
import org.tailrec.ast.Expr.Opaque;
import org.tailrec.ast.Expr.Path;
import org.tailrec.ast.Expr.Return;
import org.tailrec.ast.Expr.Tuple;
import org.tailrec.ast.Expr.Unary;
import org.tailrec.ast.Expr.While;
import org.tailrec.ast.FunctionDef;
import org.tailrec.ast.FunctionSignature.Param;
import org.tailrec.ast.Item;
import org.tailrec.ast.Pattern;
import org.tailrec.ast.SourceFile;
import org.tailrec.ast.Stmt;
import org.tailrec.ast.TypeRef;

/**
 * Prints an AST as source text that {@link Compiler#parse} will read back as an equal tree (except
 * that {@link Opaque} markers, which have no syntax, are dropped).
 *
 * <p>Blocks are indented by four spaces per level, and parentheses are only added where operator
 * precedence requires them.
 */
public final class SourceEmitter {

  private static final String INDENT = "    ";

  // Precedence levels; higher binds tighter.  Binary operators use BinaryOp.precedence + 1.
  private static final int PREC_JUMP = 0;
  private static final int PREC_ASSIGN = 1;
  private static final int PREC_UNARY = 7;
  private static final int PREC_POSTFIX = 8;
  private static final int PREC_PRIMARY = 9;

  private final StringBuilder sb = new StringBuilder();
  private int depth;

  private SourceEmitter() {}

  /** Returns the source text for a file; items are separated by blank lines. */
  public static String emit(SourceFile file) {
    SourceEmitter emitter = new SourceEmitter();
    List<Item> items = file.items();
    for (int i = 0; i < items.size(); i++) {
      if (i != 0) {
        emitter.sb.append("\n");
      }
      emitter.item(items.get(i));
      emitter.sb.append("\n");
    }
    return emitter.sb.toString();
  }

  /** Returns the source text for a single function, ending with a newline. */
  public static String emit(FunctionDef fn) {
    SourceEmitter emitter = new SourceEmitter();
    emitter.item(fn);
    return emitter.sb.append("\n").toString();
  }

  /** Returns the source text for an expression, as it would appear at the top level. */
  public static String emit(Expr expr) {
    SourceEmitter emitter = new SourceEmitter();
    emitter.expr(expr, PREC_JUMP);
    return emitter.sb.toString();
  }

  public static String emit(Pattern pattern) {
    SourceEmitter emitter = new SourceEmitter();
    emitter.pattern(pattern);
    return emitter.sb.toString();
  }

  public static String emit(TypeRef type) {
    SourceEmitter emitter = new SourceEmitter();
    emitter.type(type);
    return emitter.sb.toString();
  }

  private void newLine() {
    sb.append("\n").append(Strings.repeat(INDENT, depth));
  }

  private void item(Item item) {
    if (item instanceof FunctionDef fn) {
      function(fn);
    } else {
      enumDef((EnumDef) item);
    }
  }

  private void function(FunctionDef fn) {
    for (String attribute : fn.attributes()) {
      sb.append("#[").append(attribute).append("]");
      newLine();
    }
    sb.append("fn ").append(fn.name());
    separated(
        "(",
        ")",
        fn.signature().params(),
        (Param p) -> {
          pattern(p.pattern());
          sb.append(": ");
          type(p.type());
        });
    if (fn.signature().returnType() != null) {
      sb.append(" -> ");
      type(fn.signature().returnType());
    }
    sb.append(" ");
    block(fn.body());
  }

  private void enumDef(EnumDef enumDef) {
    sb.append("enum ").append(enumDef.name());
    if (!enumDef.typeParams().isEmpty()) {
      sb.append("<").append(Joiner.on(", ").join(enumDef.typeParams())).append(">");
    }
    sb.append(" {");
    depth++;
    for (EnumDef.Variant variant : enumDef.variants()) {
      newLine();
      sb.append(variant.name());
      if (variant.payload() != null) {
        sb.append("(");
        type(variant.payload());
        sb.append(")");
      }
      sb.append(",");
    }
    depth--;
    newLine();
    sb.append("}");
  }

  private void block(Block block) {
    if (block.stmts().isEmpty() && block.tail() == null) {
      sb.append("{}");
      return;
    }
    sb.append("{");
    depth++;
    for (Stmt stmt : block.stmts()) {
      newLine();
      stmt(stmt);
    }
    if (block.tail() != null) {
      newLine();
      statementExpr(block.tail());
    }
    depth--;
    newLine();
    sb.append("}");
  }

  private void stmt(Stmt stmt) {
    if (stmt instanceof Stmt.Let let) {
      sb.append("let ");
      pattern(let.pattern());
      if (let.type() != null) {
        sb.append(": ");
        type(let.type());
      }
      if (let.init() != null) {
        sb.append(" = ");
        expr(let.init(), PREC_JUMP);
      }
      sb.append(";");
    } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
      statementExpr(exprStmt.expr());
      if (exprStmt.semicolon()) {
        sb.append(";");
      }
    } else {
      item((Item) stmt);
    }
  }

  /**
   * Emits an expression in statement position. An expression that starts with (but isn't) a
   * block-like expression is parenthesized, since otherwise e.g. {@code if a {b} else {c} - 1}
   * would be read back as two statements.
   */
  private void statementExpr(Expr expr) {
    if (!isBlockLike(expr) && startsWithBlockLike(expr)) {
      sb.append("(");
      expr(expr, PREC_JUMP);
      sb.append(")");
    } else {
      expr(expr, PREC_JUMP);
    }
  }

  private static boolean isBlockLike(Expr expr) {
    if (expr instanceof Opaque opaque) {
      return isBlockLike(opaque.expr());
    }
    return expr instanceof Block
        || expr instanceof If
        || expr instanceof Match
        || expr instanceof Loop
        || expr instanceof While;
  }

  private static boolean startsWithBlockLike(Expr expr) {
    if (isBlockLike(expr)) {
      return true;
    } else if (expr instanceof Opaque opaque) {
      return startsWithBlockLike(opaque.expr());
    } else if (expr instanceof Binary binary) {
      return startsWithBlockLike(binary.left());
    } else if (expr instanceof Call call) {
      return startsWithBlockLike(call.callee());
    } else if (expr instanceof MethodCall call) {
      return startsWithBlockLike(call.receiver());
    } else if (expr instanceof Assign assign) {
      return startsWithBlockLike(assign.target());
    }
    return false;
  }

  private static int precedence(Expr expr) {
    if (expr instanceof Opaque opaque) {
      return precedence(opaque.expr());
    } else if (expr instanceof Return || expr instanceof Break || expr instanceof Closure) {
      return PREC_JUMP;
    } else if (expr instanceof Assign) {
      return PREC_ASSIGN;
    } else if (expr instanceof Binary binary) {
      return binary.op().precedence + 1;
    } else if (expr instanceof Unary) {
      return PREC_UNARY;
    } else if (expr instanceof IntLiteral literal && literal.value() < 0) {
      return PREC_UNARY;
    } else if (expr instanceof Call || expr instanceof MethodCall) {
      return PREC_POSTFIX;
    }
    return PREC_PRIMARY;
  }

  /** Emits {@code expr}, parenthesized if it binds less tightly than {@code minPrecedence}. */
  private void expr(Expr expr, int minPrecedence) {
    if (precedence(expr) < minPrecedence) {
      sb.append("(");
      expr(expr, PREC_JUMP);
      sb.append(")");
      return;
    }
    if (expr instanceof Opaque opaque) {
      expr(opaque.expr(), minPrecedence);
    } else if (expr instanceof IntLiteral literal) {
      sb.append(literal.value());
    } else if (expr instanceof BoolLiteral literal) {
      sb.append(literal.value());
    } else if (expr instanceof Path path) {
      sb.append(path);
    } else if (expr instanceof Tuple tuple) {
      separated("(", tuple.elements().size() == 1 ? ",)" : ")", tuple.elements(), this::expr);
    } else if (expr instanceof Call call) {
      expr(call.callee(), PREC_POSTFIX);
      separated("(", ")", call.args(), this::expr);
    } else if (expr instanceof MethodCall call) {
      expr(call.receiver(), PREC_POSTFIX);
      sb.append(".").append(call.method());
      separated("(", ")", call.args(), this::expr);
    } else if (expr instanceof Unary unary) {
      sb.append(unary.op().symbol);
      expr(unary.operand(), PREC_UNARY);
    } else if (expr instanceof Binary binary) {
      int precedence = binary.op().precedence + 1;
      expr(binary.left(), precedence);
      sb.append(" ").append(binary.op().symbol).append(" ");
      expr(binary.right(), precedence + 1);
    } else if (expr instanceof Assign assign) {
      expr(assign.target(), PREC_POSTFIX);
      sb.append(" = ");
      expr(assign.value(), PREC_ASSIGN);
    } else if (expr instanceof Return ret) {
      jump("return", ret.value());
    } else if (expr instanceof Break breakExpr) {
      jump("break", breakExpr.value());
    } else if (expr instanceof Closure closure) {
      if (closure.params().isEmpty()) {
        sb.append("||");
      } else {
        separated("|", "|", closure.params(), this::pattern);
      }
      sb.append(" ");
      expr(closure.body(), PREC_JUMP);
    } else if (expr instanceof Block block) {
      block(block);
    } else if (expr instanceof If ifExpr) {
      ifExpr(ifExpr);
    } else if (expr instanceof Match match) {
      match(match);
    } else if (expr instanceof Loop loop) {
      sb.append("loop ");
      block(loop.body());
    } else if (expr instanceof While whileExpr) {
      sb.append("while ");
      expr(whileExpr.condition(), PREC_JUMP);
      sb.append(" ");
      block(whileExpr.body());
    } else {
      throw new IllegalArgumentException("Unexpected expression: " + expr);
    }
  }

  private void expr(Expr expr) {
    expr(expr, PREC_JUMP);
  }

  private void jump(String keyword, Expr value) {
    sb.append(keyword);
    if (value != null) {
      sb.append(" ");
      expr(value, PREC_JUMP);
    }
  }

  private void ifExpr(If ifExpr) {
    sb.append("if ");
    expr(ifExpr.condition(), PREC_JUMP);
    sb.append(" ");
    block(ifExpr.thenBlock());
    Expr elseBranch = ifExpr.elseBranch();
    if (elseBranch != null) {
      sb.append(" else ");
      if (elseBranch instanceof If elseIf) {
        ifExpr(elseIf);
      } else {
        block((Block) elseBranch);
      }
    }
  }

  private void match(Match match) {
    sb.append("match ");
    expr(match.scrutinee(), PREC_JUMP);
    sb.append(" {");
    depth++;
    for (MatchArm arm : match.arms()) {
      newLine();
      pattern(arm.pattern());
      if (arm.guard() != null) {
        sb.append(" if ");
        expr(arm.guard(), PREC_JUMP);
      }
      sb.append(" => ");
      expr(arm.body(), PREC_JUMP);
      sb.append(",");
    }
    depth--;
    newLine();
    sb.append("}");
  }

  private void pattern(Pattern pattern) {
    if (pattern instanceof Pattern.Wildcard) {
      sb.append("_");
    } else if (pattern instanceof Pattern.Binding binding) {
      sb.append(binding.mutable() ? "mut " : "").append(binding.name());
    } else if (pattern instanceof Pattern.IntPattern intPattern) {
      sb.append(intPattern.value());
    } else if (pattern instanceof Pattern.BoolPattern boolPattern) {
      sb.append(boolPattern.value());
    } else if (pattern instanceof Pattern.TuplePattern tuple) {
      separated("(", tuple.elements().size() == 1 ? ",)" : ")", tuple.elements(), this::pattern);
    } else {
      Pattern.VariantPattern variant = (Pattern.VariantPattern) pattern;
      sb.append(Joiner.on("::").join(variant.path()));
      separated("(", ")", variant.fields(), this::pattern);
    }
  }

  private void type(TypeRef type) {
    if (type instanceof TypeRef.Named named) {
      sb.append(named.name());
      if (!named.args().isEmpty()) {
        separated("<", ">", named.args(), this::type);
      }
    } else {
      TypeRef.TupleType tuple = (TypeRef.TupleType) type;
      separated("(", tuple.elements().size() == 1 ? ",)" : ")", tuple.elements(), this::type);
    }
  }

  /** Emits the elements of {@code list}, comma separated, inside {@code open} and {@code close}. */
  private <T> void separated(String open, String close, List<T> list, Consumer<T> emitElement) {
    sb.append(open);
    for (int i = 0; i < list.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      emitElement.accept(list.get(i));
    }
    sb.append(close);
  }
}
