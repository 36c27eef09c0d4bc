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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.antlr.v4.runtime.Token;
import org.jspecify.annotations.Nullable;
import org.tailrec.ast.Block;
import org.tailrec.ast.EnumDef;
import org.tailrec.ast.Expr;
import org.tailrec.ast.Expr.BinaryOp;
import org.tailrec.ast.Expr.MatchArm;
import org.tailrec.ast.Expr.UnaryOp;
import org.tailrec.ast.FunctionDef;
import org.tailrec.ast.FunctionSignature;
import org.tailrec.ast.FunctionSignature.Param;
import org.tailrec.ast.Item;
import org.tailrec.ast.Pattern;
import org.tailrec.ast.SourceFile;
import org.tailrec.ast.Stmt;
import org.tailrec.ast.TypeRef;
import org.tailrec.compiler.TailrecParser.ArgumentsContext;
import org.tailrec.compiler.TailrecParser.AssignExpressionContext;
import org.tailrec.compiler.TailrecParser.BindingPatternContext;
import org.tailrec.compiler.TailrecParser.BinaryExpressionContext;
import org.tailrec.compiler.TailrecParser.BlockBlockLikeContext;
import org.tailrec.compiler.TailrecParser.BlockContext;
import org.tailrec.compiler.TailrecParser.BlockLikePrimaryContext;
import org.tailrec.compiler.TailrecParser.BlockLikeStatementContext;
import org.tailrec.compiler.TailrecParser.BoolPatternContext;
import org.tailrec.compiler.TailrecParser.BoolPrimaryContext;
import org.tailrec.compiler.TailrecParser.BreakExpressionContext;
import org.tailrec.compiler.TailrecParser.CallExpressionContext;
import org.tailrec.compiler.TailrecParser.ClosureExpressionContext;
import org.tailrec.compiler.TailrecParser.EmptyClosureExpressionContext;
import org.tailrec.compiler.TailrecParser.EnumItemContext;
import org.tailrec.compiler.TailrecParser.ExpressionContext;
import org.tailrec.compiler.TailrecParser.ExpressionStatementContext;
import org.tailrec.compiler.TailrecParser.FnItemContext;
import org.tailrec.compiler.TailrecParser.IfBlockLikeContext;
import org.tailrec.compiler.TailrecParser.IfExprContext;
import org.tailrec.compiler.TailrecParser.IntPatternContext;
import org.tailrec.compiler.TailrecParser.IntPrimaryContext;
import org.tailrec.compiler.TailrecParser.ItemContext;
import org.tailrec.compiler.TailrecParser.ItemStatementContext;
import org.tailrec.compiler.TailrecParser.LetStatementContext;
import org.tailrec.compiler.TailrecParser.LoopBlockLikeContext;
import org.tailrec.compiler.TailrecParser.MatchArmContext;
import org.tailrec.compiler.TailrecParser.MatchBlockLikeContext;
import org.tailrec.compiler.TailrecParser.MethodCallExpressionContext;
import org.tailrec.compiler.TailrecParser.NamedTypeContext;
import org.tailrec.compiler.TailrecParser.ParamContext;
import org.tailrec.compiler.TailrecParser.PathContext;
import org.tailrec.compiler.TailrecParser.PathPrimaryContext;
import org.tailrec.compiler.TailrecParser.PatternContext;
import org.tailrec.compiler.TailrecParser.PrimaryExpressionContext;
import org.tailrec.compiler.TailrecParser.ReturnExpressionContext;
import org.tailrec.compiler.TailrecParser.SourceFileContext;
import org.tailrec.compiler.TailrecParser.StatementContext;
import org.tailrec.compiler.TailrecParser.TuplePatternContext;
import org.tailrec.compiler.TailrecParser.TuplePrimaryContext;
import org.tailrec.compiler.TailrecParser.TupleTypeContext;
import org.tailrec.compiler.TailrecParser.TypeContext;
import org.tailrec.compiler.TailrecParser.UnaryExpressionContext;
import org.tailrec.compiler.TailrecParser.VariantPatternContext;
import org.tailrec.compiler.TailrecParser.WhileBlockLikeContext;
import org.tailrec.compiler.TailrecParser.WildcardPatternContext;

/** Converts a parse tree into the immutable AST. */
final class AstBuilder {

  private static final ExpressionBuilder EXPRESSIONS = new ExpressionBuilder();
  private static final PatternBuilder PATTERNS = new PatternBuilder();
  private static final TypeBuilder TYPES = new TypeBuilder();

  private AstBuilder() {}

  static SourceFile sourceFile(SourceFileContext ctx) {
    return new SourceFile(items(ctx.item()));
  }

  /** Converts a sequence of items, rejecting duplicate names. */
  private static ImmutableList<Item> items(List<ItemContext> contexts) {
    Set<String> names = new HashSet<>();
    ImmutableList.Builder<Item> result = ImmutableList.builder();
    for (ItemContext ctx : contexts) {
      Item item = item(ctx);
      if (!names.add(item.name())) {
        throw Compiler.error(ctx.start, "Duplicate definition of %s", Compiler.describe(item));
      }
      result.add(item);
    }
    return result.build();
  }

  private static Item item(ItemContext ctx) {
    if (ctx.fnItem() != null) {
      ImmutableList<String> attributes =
          ctx.attribute().stream().map(a -> a.name.getText()).collect(toImmutableList());
      return function(attributes, ctx.fnItem());
    } else if (!ctx.attribute().isEmpty()) {
      throw Compiler.error(ctx.start, "Attributes are only allowed on functions");
    }
    return enumDef(ctx.enumItem());
  }

  private static FunctionDef function(ImmutableList<String> attributes, FnItemContext ctx) {
    ImmutableList.Builder<Param> params = ImmutableList.builder();
    for (ParamContext param : ctx.param()) {
      Pattern pattern = irrefutable(param.pattern());
      params.add(new Param(pattern, type(param.type())));
    }
    TypeRef returnType = (ctx.returnType == null) ? null : type(ctx.returnType);
    return new FunctionDef(
        attributes,
        new FunctionSignature(ctx.name.getText(), params.build(), returnType),
        block(ctx.block()));
  }

  private static EnumDef enumDef(EnumItemContext ctx) {
    ImmutableList<String> typeParams =
        ctx.typeParam.stream().map(Token::getText).collect(toImmutableList());
    ImmutableList<EnumDef.Variant> variants =
        ctx.variant().stream()
            .map(
                v ->
                    new EnumDef.Variant(
                        v.name.getText(), (v.type() == null) ? null : type(v.type())))
            .collect(toImmutableList());
    return new EnumDef(ctx.name.getText(), typeParams, variants);
  }

  static Block block(BlockContext ctx) {
    List<Stmt> stmts = new ArrayList<>();
    List<ItemContext> itemContexts = new ArrayList<>();
    for (StatementContext stmtContext : ctx.statement()) {
      if (stmtContext instanceof ItemStatementContext itemStatement) {
        itemContexts.add(itemStatement.item());
      }
      Stmt stmt = statement(stmtContext);
      if (stmt != null) {
        stmts.add(stmt);
      }
    }
    // Checks for duplicate item names.
    items(itemContexts);
    Expr tail = (ctx.expression() == null) ? null : expression(ctx.expression());
    if (tail == null
        && !stmts.isEmpty()
        && stmts.get(stmts.size() - 1) instanceof Stmt.ExprStmt last
        && !last.semicolon()) {
      // A block-like expression at the end of a block is its value, even without a semicolon.
      stmts.remove(stmts.size() - 1);
      tail = last.expr();
    }
    return new Block(ImmutableList.copyOf(stmts), tail);
  }

  private static @Nullable Stmt statement(StatementContext ctx) {
    if (ctx instanceof ItemStatementContext itemStatement) {
      return item(itemStatement.item());
    } else if (ctx instanceof LetStatementContext let) {
      return new Stmt.Let(
          irrefutable(let.pattern()),
          (let.type() == null) ? null : type(let.type()),
          (let.expression() == null) ? null : expression(let.expression()));
    } else if (ctx instanceof BlockLikeStatementContext blockLike) {
      return new Stmt.ExprStmt(EXPRESSIONS.visit(blockLike.blockLike()), blockLike.semi != null);
    } else if (ctx instanceof ExpressionStatementContext exprStatement) {
      return new Stmt.ExprStmt(expression(exprStatement.expression()), true);
    }
    // An empty statement (";").
    return null;
  }

  static Expr expression(ExpressionContext ctx) {
    return EXPRESSIONS.visit(ctx);
  }

  static Pattern pattern(PatternContext ctx) {
    return PATTERNS.visit(ctx);
  }

  private static Pattern irrefutable(PatternContext ctx) {
    Pattern pattern = pattern(ctx);
    if (!pattern.isIrrefutable()) {
      throw Compiler.error(ctx.start, "Refutable pattern '%s' is not allowed here", ctx.getText());
    }
    return pattern;
  }

  static TypeRef type(TypeContext ctx) {
    return TYPES.visit(ctx);
  }

  private static ImmutableList<String> path(PathContext ctx) {
    return ctx.ID().stream().map(id -> id.getText()).collect(toImmutableList());
  }

  private static long parseLong(Token token, String text) {
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw Compiler.error(token, "Integer constant out of range: %s", text);
    }
  }

  private static class ExpressionBuilder extends TailrecBaseVisitor<Expr> {
    private ImmutableList<Expr> arguments(@Nullable ArgumentsContext ctx) {
      return (ctx == null)
          ? ImmutableList.of()
          : ctx.expression().stream().map(this::visit).collect(toImmutableList());
    }

    @Override
    public Expr visitPrimaryExpression(PrimaryExpressionContext ctx) {
      return visit(ctx.primary());
    }

    @Override
    public Expr visitMethodCallExpression(MethodCallExpressionContext ctx) {
      return new Expr.MethodCall(
          visit(ctx.expression()), ctx.name.getText(), arguments(ctx.arguments()));
    }

    @Override
    public Expr visitCallExpression(CallExpressionContext ctx) {
      return new Expr.Call(visit(ctx.expression()), arguments(ctx.arguments()));
    }

    @Override
    public Expr visitUnaryExpression(UnaryExpressionContext ctx) {
      if (ctx.op.getText().equals("-")
          && ctx.expression() instanceof PrimaryExpressionContext primary
          && primary.primary() instanceof IntPrimaryContext intPrimary) {
        // Negative constants are folded here so that Long.MIN_VALUE can be written.
        return Expr.of(parseLong(ctx.start, "-" + intPrimary.INT().getText()));
      }
      UnaryOp op = ctx.op.getText().equals("-") ? UnaryOp.NEGATE : UnaryOp.NOT;
      return new Expr.Unary(op, visit(ctx.expression()));
    }

    @Override
    public Expr visitBinaryExpression(BinaryExpressionContext ctx) {
      return new Expr.Binary(
          BinaryOp.fromSymbol(ctx.op.getText()),
          visit(ctx.expression(0)),
          visit(ctx.expression(1)));
    }

    @Override
    public Expr visitAssignExpression(AssignExpressionContext ctx) {
      Expr target = visit(ctx.expression(0));
      if (!(target instanceof Expr.Path path) || path.segments().size() != 1) {
        throw Compiler.error(ctx.start, "Can only assign to a local");
      }
      return new Expr.Assign(target, visit(ctx.expression(1)));
    }

    @Override
    public Expr visitReturnExpression(ReturnExpressionContext ctx) {
      return new Expr.Return((ctx.expression() == null) ? null : visit(ctx.expression()));
    }

    @Override
    public Expr visitBreakExpression(BreakExpressionContext ctx) {
      return new Expr.Break((ctx.expression() == null) ? null : visit(ctx.expression()));
    }

    @Override
    public Expr visitClosureExpression(ClosureExpressionContext ctx) {
      ImmutableList<Pattern> params =
          ctx.pattern().stream().map(AstBuilder::irrefutable).collect(toImmutableList());
      return new Expr.Closure(params, visit(ctx.expression()));
    }

    @Override
    public Expr visitEmptyClosureExpression(EmptyClosureExpressionContext ctx) {
      return new Expr.Closure(ImmutableList.of(), visit(ctx.expression()));
    }

    @Override
    public Expr visitBlockLikePrimary(BlockLikePrimaryContext ctx) {
      return visit(ctx.blockLike());
    }

    @Override
    public Expr visitTuplePrimary(TuplePrimaryContext ctx) {
      List<ExpressionContext> elements = ctx.expression();
      if (elements.size() == 1 && ctx.trailing == null) {
        // Just parentheses.
        return visit(elements.get(0));
      }
      return new Expr.Tuple(elements.stream().map(this::visit).collect(toImmutableList()));
    }

    @Override
    public Expr visitIntPrimary(IntPrimaryContext ctx) {
      return Expr.of(parseLong(ctx.start, ctx.INT().getText()));
    }

    @Override
    public Expr visitBoolPrimary(BoolPrimaryContext ctx) {
      return Expr.of(ctx.value.getText().equals("true"));
    }

    @Override
    public Expr visitPathPrimary(PathPrimaryContext ctx) {
      return new Expr.Path(path(ctx.path()));
    }

    @Override
    public Expr visitBlockBlockLike(BlockBlockLikeContext ctx) {
      return block(ctx.block());
    }

    @Override
    public Expr visitIfBlockLike(IfBlockLikeContext ctx) {
      return ifExpr(ctx.ifExpr());
    }

    private Expr.If ifExpr(IfExprContext ctx) {
      Expr elseBranch = null;
      if (ctx.ifExpr() != null) {
        elseBranch = ifExpr(ctx.ifExpr());
      } else if (ctx.block().size() > 1) {
        elseBranch = block(ctx.block(1));
      }
      return new Expr.If(visit(ctx.expression()), block(ctx.block(0)), elseBranch);
    }

    @Override
    public Expr visitMatchBlockLike(MatchBlockLikeContext ctx) {
      ImmutableList.Builder<MatchArm> arms = ImmutableList.builder();
      for (MatchArmContext arm : ctx.matchArm()) {
        arms.add(
            new MatchArm(
                pattern(arm.pattern()),
                (arm.guard == null) ? null : visit(arm.guard),
                visit(arm.body)));
      }
      return new Expr.Match(visit(ctx.expression()), arms.build());
    }

    @Override
    public Expr visitLoopBlockLike(LoopBlockLikeContext ctx) {
      return new Expr.Loop(block(ctx.block()));
    }

    @Override
    public Expr visitWhileBlockLike(WhileBlockLikeContext ctx) {
      return new Expr.While(visit(ctx.expression()), block(ctx.block()));
    }
  }

  private static class PatternBuilder extends TailrecBaseVisitor<Pattern> {
    @Override
    public Pattern visitWildcardPattern(WildcardPatternContext ctx) {
      return Pattern.WILDCARD;
    }

    @Override
    public Pattern visitVariantPattern(VariantPatternContext ctx) {
      return new Pattern.VariantPattern(
          path(ctx.path()), ctx.pattern().stream().map(this::visit).collect(toImmutableList()));
    }

    @Override
    public Pattern visitBindingPattern(BindingPatternContext ctx) {
      return new Pattern.Binding(ctx.name.getText(), ctx.isMut != null);
    }

    @Override
    public Pattern visitIntPattern(IntPatternContext ctx) {
      String sign = (ctx.minus == null) ? "" : "-";
      return new Pattern.IntPattern(parseLong(ctx.start, sign + ctx.INT().getText()));
    }

    @Override
    public Pattern visitBoolPattern(BoolPatternContext ctx) {
      return new Pattern.BoolPattern(ctx.value.getText().equals("true"));
    }

    @Override
    public Pattern visitTuplePattern(TuplePatternContext ctx) {
      List<PatternContext> elements = ctx.pattern();
      if (elements.size() == 1 && ctx.trailing == null) {
        return visit(elements.get(0));
      }
      return new Pattern.TuplePattern(
          elements.stream().map(this::visit).collect(toImmutableList()));
    }
  }

  private static class TypeBuilder extends TailrecBaseVisitor<TypeRef> {
    @Override
    public TypeRef visitTupleType(TupleTypeContext ctx) {
      List<TypeContext> elements = ctx.type();
      if (elements.size() == 1 && ctx.trailing == null) {
        return visit(elements.get(0));
      }
      return new TypeRef.TupleType(elements.stream().map(this::visit).collect(toImmutableList()));
    }

    @Override
    public TypeRef visitNamedType(NamedTypeContext ctx) {
      return new TypeRef.Named(
          ctx.name.getText(), ctx.type().stream().map(this::visit).collect(toImmutableList()));
    }
  }
}
