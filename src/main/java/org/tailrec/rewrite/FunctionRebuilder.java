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

import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import org.tailrec.ast.Block;
import org.tailrec.ast.EnumDef;
import org.tailrec.ast.Expr;
import org.tailrec.ast.Expr.Assign;
import org.tailrec.ast.Expr.Closure;
import org.tailrec.ast.Expr.If;
import org.tailrec.ast.Expr.Loop;
import org.tailrec.ast.Expr.Match;
import org.tailrec.ast.Expr.MatchArm;
import org.tailrec.ast.Expr.Path;
import org.tailrec.ast.Expr.Return;
import org.tailrec.ast.Expr.Tuple;
import org.tailrec.ast.ExprTransformer;
import org.tailrec.ast.FunctionDef;
import org.tailrec.ast.FunctionSignature;
import org.tailrec.ast.FunctionSignature.Param;
import org.tailrec.ast.Pattern;
import org.tailrec.ast.Stmt;
import org.tailrec.ast.TypeRef;
import org.tailrec.rewrite.SignatureExtractor.ExtractedSignature;

/**
 * Assembles the trampolined function from the original signature and the rewritten body:
 *
 * <pre>
 * fn f(a: A, b: B) -&gt; R {
 *     enum Action&lt;C, R&gt; {
 *         Continue(C),
 *         Return(R),
 *     }
 *     fn f_inner((a, b): (A, B)) -&gt; Action&lt;(A, B), R&gt; {
 *         ...rewritten body...
 *     }
 *     let mut acc = (a, b);
 *     loop {
 *         match f_inner(acc) {
 *             Action::Return(r) =&gt; return r,
 *             Action::Continue(c) =&gt; acc = c,
 *         }
 *     }
 * }
 * </pre>
 *
 * The outer function keeps the original name, parameter types and return type. A parameter whose
 * pattern is not a simple binding is renamed to a fresh binding in the outer function so that the
 * initial state can refer to it; the step function still destructures it with the original pattern.
 */
final class FunctionRebuilder {
  private static final String CONTINUE_TYPE_PARAM = "C";
  private static final String RETURN_TYPE_PARAM = "R";
  private static final String RESULT_BINDING = "r";
  private static final String STATE_BINDING = "c";

  private final IdempotenceGuard guard;
  private final TrampolineNames names;

  FunctionRebuilder(IdempotenceGuard guard, TrampolineNames names) {
    this.guard = guard;
    this.names = names;
  }

  FunctionDef rebuild(FunctionDef original, ExtractedSignature extracted, Block rewrittenBody) {
    verifyAllTailsFinalized(original.name(), rewrittenBody);
    String innerName = names.innerName(original.name());
    TypeRef stateType = extracted.stateType();

    FunctionDef inner =
        new FunctionDef(
            new FunctionSignature(
                innerName,
                ImmutableList.of(new Param(extracted.statePattern(), stateType)),
                TypeRef.named(names.actionType(), stateType, extracted.returnType())),
            rewrittenBody);

    ImmutableList<Param> outerParams = outerParams(original.signature().params());
    Expr initialState =
        new Tuple(
            outerParams.stream()
                .map(p -> (Expr) Expr.ident(((Pattern.Binding) p.pattern()).name()))
                .collect(ImmutableList.toImmutableList()));

    Path acc = Expr.ident(names.accumulator());
    Match step =
        new Match(
            Expr.call(Expr.ident(innerName), acc),
            ImmutableList.of(
                new MatchArm(
                    variantPattern(names.returnVariant(), RESULT_BINDING),
                    null,
                    new Return(Expr.ident(RESULT_BINDING))),
                new MatchArm(
                    variantPattern(names.continueVariant(), STATE_BINDING),
                    null,
                    new Assign(acc, Expr.ident(STATE_BINDING)))));

    Block body =
        new Block(
            ImmutableList.of(
                actionEnum(),
                inner,
                new Stmt.Let(new Pattern.Binding(names.accumulator(), true), null, initialState)),
            new Loop(Block.of(step)));
    return new FunctionDef(
        original.attributes(), original.signature().withParams(outerParams), body);
  }

  /** {@code enum Action<C, R> { Continue(C), Return(R) }} */
  private EnumDef actionEnum() {
    return new EnumDef(
        names.actionType(),
        ImmutableList.of(CONTINUE_TYPE_PARAM, RETURN_TYPE_PARAM),
        ImmutableList.of(
            new EnumDef.Variant(names.continueVariant(), TypeRef.named(CONTINUE_TYPE_PARAM)),
            new EnumDef.Variant(names.returnVariant(), TypeRef.named(RETURN_TYPE_PARAM))));
  }

  private Pattern variantPattern(String variant, String binding) {
    return new Pattern.VariantPattern(
        ImmutableList.of(names.actionType(), variant), ImmutableList.of(Pattern.binding(binding)));
  }

  /**
   * Returns the outer function's parameters: simple bindings are kept (including {@code mut}), any
   * other pattern is replaced by a fresh binding {@code argN} of the same type.
   */
  private static ImmutableList<Param> outerParams(ImmutableList<Param> params) {
    Set<String> used = new HashSet<>();
    params.forEach(p -> collectBindings(p.pattern(), used));
    ImmutableList.Builder<Param> result = ImmutableList.builder();
    for (int i = 0; i < params.size(); i++) {
      Param param = params.get(i);
      if (param.pattern() instanceof Pattern.Binding) {
        result.add(param);
        continue;
      }
      String name = "arg" + i;
      while (!used.add(name)) {
        name = "_" + name;
      }
      result.add(new Param(Pattern.binding(name), param.type()));
    }
    return result.build();
  }

  private static void collectBindings(Pattern pattern, Set<String> names) {
    if (pattern instanceof Pattern.Binding binding) {
      names.add(binding.name());
    } else if (pattern instanceof Pattern.TuplePattern tuple) {
      tuple.elements().forEach(p -> collectBindings(p, names));
    } else if (pattern instanceof Pattern.VariantPattern variant) {
      variant.fields().forEach(p -> collectBindings(p, names));
    }
  }

  /**
   * Walks the tail positions of the rewritten body again and checks that each one ends in a
   * finalized action or a return; anything else would leave a path that produces no action.
   */
  private void verifyAllTailsFinalized(String functionName, Block body) {
    new ExprTransformer() {
      @Override
      protected Expr transformReturn(Return ret) {
        verify(ret.value() != null, "%s: bare return left in body", functionName);
        verifyTail(functionName, ret.value());
        return super.transformReturn(ret);
      }

      @Override
      protected Expr transformClosure(Closure closure) {
        return closure;
      }
    }.transformBlock(body);
    verifyTail(functionName, body);
  }

  private void verifyTail(String functionName, Expr expr) {
    if (expr instanceof Block block) {
      if (block.tail() != null) {
        verifyTail(functionName, block.tail());
      } else {
        verify(
            block.lastStmt() instanceof Stmt.ExprStmt last && last.expr() instanceof Return,
            "%s: block in tail position has no value",
            functionName);
      }
    } else if (expr instanceof If ifExpr) {
      verifyTail(functionName, ifExpr.thenBlock());
      verify(ifExpr.elseBranch() != null, "%s: if in tail position has no else", functionName);
      verifyTail(functionName, ifExpr.elseBranch());
    } else if (expr instanceof Match match) {
      match.arms().forEach(arm -> verifyTail(functionName, arm.body()));
    } else {
      verify(
          guard.isFinalized(expr) || expr instanceof Return,
          "%s: tail expression was not rewritten: %s",
          functionName,
          expr);
    }
  }
}
