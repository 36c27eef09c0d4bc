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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
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
import org.tailrec.eval.Value.BoolValue;
import org.tailrec.eval.Value.ClosureValue;
import org.tailrec.eval.Value.FunctionValue;
import org.tailrec.eval.Value.IntValue;
import org.tailrec.eval.Value.TupleValue;
import org.tailrec.eval.Value.VariantValue;

/**
 * A tree-walking interpreter for a {@link SourceFile}.
 *
 * <p>Each call in the program is a Java call, so recursion in the program uses Java stack in
 * proportion to its depth; running out of stack is reported as an {@link EvaluationException}.
 * Loops run in constant Java stack.
 *
 * <p>Integer arithmetic is 64-bit and overflow is an error. The interpreter doesn't type-check;
 * operations applied to the wrong kinds of values fail when they are evaluated.
 */
public final class Interpreter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Scope globals = Scope.global();

  public Interpreter(SourceFile file) {
    file.items().forEach(globals::declareItem);
  }

  /** Calls the top-level function with the given name. */
  public Value call(String function, Value... args) {
    logger.atFine().log("call %s%s", function, Value.tuple(args));
    if (!(globals.item(function) instanceof FunctionDef fn)) {
      throw EvaluationException.error("No function named '%s'", function);
    }
    return run(() -> invoke(fn, globals, ImmutableList.copyOf(args)));
  }

  /** Evaluates an expression, such as a call of a top-level function, in the top-level scope. */
  public Value eval(Expr expr) {
    return run(() -> eval(expr, globals.newChild()));
  }

  private static Value run(Supplier<Value> body) {
    try {
      return body.get();
    } catch (StackOverflowError e) {
      throw new EvaluationException("Stack overflow", e);
    } catch (ReturnSignal | BreakSignal e) {
      throw new EvaluationException("return or break outside of a function or loop");
    }
  }

  private Value invoke(FunctionDef fn, Scope definedIn, List<Value> args) {
    ImmutableList<Param> params = fn.signature().params();
    if (args.size() != params.size()) {
      throw EvaluationException.error(
          "%s expects %d arguments but got %d", fn.name(), params.size(), args.size());
    }
    Scope scope = definedIn.newFunctionScope();
    for (int i = 0; i < args.size(); i++) {
      bindOrFail(params.get(i).pattern(), args.get(i), scope);
    }
    try {
      return evalBlock(fn.body(), scope);
    } catch (ReturnSignal r) {
      return r.value;
    }
  }

  private Value apply(Value callee, List<Value> args) {
    if (callee instanceof ClosureValue closure) {
      if (args.size() != closure.params().size()) {
        throw EvaluationException.error(
            "closure expects %d arguments but got %d", closure.params().size(), args.size());
      }
      Scope scope = closure.scope().newChild();
      for (int i = 0; i < args.size(); i++) {
        bindOrFail(closure.params().get(i), args.get(i), scope);
      }
      try {
        return eval(closure.body(), scope);
      } catch (ReturnSignal r) {
        return r.value;
      }
    } else if (callee instanceof FunctionValue fn) {
      return invoke(fn.fn(), fn.scope(), args);
    }
    throw EvaluationException.error("%s is not callable", callee);
  }

  @CanIgnoreReturnValue
  private Value evalBlock(Block block, Scope outer) {
    Scope scope = outer.newChild();
    for (Stmt stmt : block.stmts()) {
      if (stmt instanceof Item item) {
        scope.declareItem(item);
      }
    }
    for (Stmt stmt : block.stmts()) {
      if (stmt instanceof Stmt.Let let) {
        Value value = (let.init() == null) ? null : eval(let.init(), scope);
        scope = scope.newChild();
        if (value == null) {
          declareUnassigned(let.pattern(), scope);
        } else {
          bindOrFail(let.pattern(), value, scope);
        }
      } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
        eval(exprStmt.expr(), scope);
      }
    }
    return (block.tail() == null) ? Value.UNIT : eval(block.tail(), scope);
  }

  @CanIgnoreReturnValue
  private Value eval(Expr expr, Scope scope) {
    if (expr instanceof IntLiteral literal) {
      return Value.of(literal.value());
    } else if (expr instanceof BoolLiteral literal) {
      return Value.of(literal.value());
    } else if (expr instanceof Path path) {
      return evalPath(path, scope);
    } else if (expr instanceof Opaque opaque) {
      return eval(opaque.expr(), scope);
    } else if (expr instanceof Block block) {
      return evalBlock(block, scope);
    } else if (expr instanceof Tuple tuple) {
      return new TupleValue(evalAll(tuple.elements(), scope));
    } else if (expr instanceof Call call) {
      return evalCall(call, scope);
    } else if (expr instanceof MethodCall call) {
      return Builtins.callMethod(
          eval(call.receiver(), scope), call.method(), evalAll(call.args(), scope));
    } else if (expr instanceof Unary unary) {
      return Builtins.unary(unary.op(), eval(unary.operand(), scope));
    } else if (expr instanceof Binary binary) {
      return evalBinary(binary, scope);
    } else if (expr instanceof Assign assign) {
      String name = ((Path) assign.target()).segments().get(0);
      scope.assign(name, eval(assign.value(), scope));
      return Value.UNIT;
    } else if (expr instanceof If ifExpr) {
      if (asBool(eval(ifExpr.condition(), scope))) {
        return evalBlock(ifExpr.thenBlock(), scope);
      }
      return (ifExpr.elseBranch() == null) ? Value.UNIT : eval(ifExpr.elseBranch(), scope);
    } else if (expr instanceof Match match) {
      return evalMatch(match, scope);
    } else if (expr instanceof Loop loop) {
      for (; ; ) {
        try {
          evalBlock(loop.body(), scope);
        } catch (BreakSignal b) {
          return b.value;
        }
      }
    } else if (expr instanceof While whileExpr) {
      while (asBool(eval(whileExpr.condition(), scope))) {
        try {
          evalBlock(whileExpr.body(), scope);
        } catch (BreakSignal b) {
          break;
        }
      }
      return Value.UNIT;
    } else if (expr instanceof Break breakExpr) {
      throw new BreakSignal(evalOrUnit(breakExpr.value(), scope));
    } else if (expr instanceof Return ret) {
      throw new ReturnSignal(evalOrUnit(ret.value(), scope));
    } else if (expr instanceof Closure closure) {
      return new ClosureValue(closure.params(), closure.body(), scope);
    }
    throw new IllegalArgumentException("Unexpected expression: " + expr);
  }

  private Value evalOrUnit(@Nullable Expr expr, Scope scope) {
    return (expr == null) ? Value.UNIT : eval(expr, scope);
  }

  private ImmutableList<Value> evalAll(List<Expr> exprs, Scope scope) {
    ImmutableList.Builder<Value> values = ImmutableList.builderWithExpectedSize(exprs.size());
    for (Expr expr : exprs) {
      values.add(eval(expr, scope));
    }
    return values.build();
  }

  private Value evalPath(Path path, Scope scope) {
    ImmutableList<String> segments = path.segments();
    if (segments.size() == 2) {
      EnumDef.Variant variant = variant(path, scope);
      if (variant.payload() != null) {
        throw EvaluationException.error("%s requires an argument", path);
      }
      return new VariantValue(segments.get(0), segments.get(1), null);
    }
    String name = segments.get(0);
    if (segments.size() == 1 && !scope.hasLocal(name)) {
      Scope itemScope = scope.scopeOfItem(name);
      if (itemScope != null && itemScope.item(name) instanceof FunctionDef fn) {
        return new FunctionValue(fn, itemScope);
      }
    }
    return scope.lookup(name);
  }

  private Value evalCall(Call call, Scope scope) {
    if (call.callee() instanceof Path path) {
      ImmutableList<String> segments = path.segments();
      if (segments.size() == 2) {
        EnumDef.Variant variant = variant(path, scope);
        ImmutableList<Value> args = evalAll(call.args(), scope);
        if (variant.payload() == null ? !args.isEmpty() : args.size() != 1) {
          throw EvaluationException.error("Wrong number of arguments to %s", path);
        }
        return new VariantValue(
            segments.get(0), segments.get(1), args.isEmpty() ? null : args.get(0));
      }
      String name = segments.get(0);
      if (segments.size() == 1 && !scope.hasLocal(name)) {
        Scope itemScope = scope.scopeOfItem(name);
        if (itemScope != null && itemScope.item(name) instanceof FunctionDef fn) {
          return invoke(fn, itemScope, evalAll(call.args(), scope));
        }
      }
    }
    Value callee = eval(call.callee(), scope);
    return apply(callee, evalAll(call.args(), scope));
  }

  private EnumDef.Variant variant(Path path, Scope scope) {
    Preconditions.checkArgument(path.segments().size() == 2);
    String enumName = path.segments().get(0);
    Scope itemScope = scope.scopeOfItem(enumName);
    if (itemScope == null || !(itemScope.item(enumName) instanceof EnumDef enumDef)) {
      throw EvaluationException.error("No enum named '%s'", enumName);
    }
    EnumDef.Variant variant = enumDef.variant(path.segments().get(1));
    if (variant == null) {
      throw EvaluationException.error("%s has no variant %s", enumName, path.segments().get(1));
    }
    return variant;
  }

  private Value evalBinary(Binary binary, Scope scope) {
    switch (binary.op()) {
      case AND:
        return asBool(eval(binary.left(), scope)) ? eval(binary.right(), scope) : Value.of(false);
      case OR:
        return asBool(eval(binary.left(), scope)) ? Value.of(true) : eval(binary.right(), scope);
      default:
        Value left = eval(binary.left(), scope);
        return Builtins.binary(binary.op(), left, eval(binary.right(), scope));
    }
  }

  private Value evalMatch(Match match, Scope scope) {
    Value value = eval(match.scrutinee(), scope);
    for (MatchArm arm : match.arms()) {
      Scope armScope = scope.newChild();
      if (bind(arm.pattern(), value, armScope)
          && (arm.guard() == null || asBool(eval(arm.guard(), armScope)))) {
        return eval(arm.body(), armScope);
      }
    }
    throw EvaluationException.error("No match arm matches %s", value);
  }

  /**
   * Matches {@code value} against {@code pattern}, declaring any bindings in {@code scope}. Returns
   * false if it doesn't match (in which case some bindings may already have been declared).
   */
  private static boolean bind(Pattern pattern, Value value, Scope scope) {
    if (pattern instanceof Pattern.Wildcard) {
      return true;
    } else if (pattern instanceof Pattern.Binding binding) {
      scope.declare(binding.name(), value);
      return true;
    } else if (pattern instanceof Pattern.IntPattern intPattern) {
      return value instanceof IntValue i && i.value() == intPattern.value();
    } else if (pattern instanceof Pattern.BoolPattern boolPattern) {
      return value instanceof BoolValue b && b.value() == boolPattern.value();
    } else if (pattern instanceof Pattern.TuplePattern tuplePattern) {
      if (!(value instanceof TupleValue tuple)
          || tuple.elements().size() != tuplePattern.elements().size()) {
        return false;
      }
      for (int i = 0; i < tuple.elements().size(); i++) {
        if (!bind(tuplePattern.elements().get(i), tuple.elements().get(i), scope)) {
          return false;
        }
      }
      return true;
    }
    Pattern.VariantPattern variantPattern = (Pattern.VariantPattern) pattern;
    List<String> path = variantPattern.path();
    if (!(value instanceof VariantValue variant)
        || path.size() != 2
        || !path.get(0).equals(variant.enumName())
        || !path.get(1).equals(variant.variant())) {
      return false;
    }
    List<Pattern> fields = variantPattern.fields();
    if (fields.isEmpty()) {
      return variant.payload() == null;
    } else if (fields.size() == 1 && variant.payload() != null) {
      return bind(fields.get(0), variant.payload(), scope);
    }
    throw EvaluationException.error("Pattern %s doesn't fit %s", path, variant);
  }

  private static void bindOrFail(Pattern pattern, Value value, Scope scope) {
    if (!bind(pattern, value, scope)) {
      throw EvaluationException.error("%s doesn't match the expected pattern", value);
    }
  }

  private static void declareUnassigned(Pattern pattern, Scope scope) {
    if (pattern instanceof Pattern.Binding binding) {
      scope.declare(binding.name(), null);
    } else if (pattern instanceof Pattern.TuplePattern tuple) {
      tuple.elements().forEach(p -> declareUnassigned(p, scope));
    }
  }

  static boolean asBool(Value value) {
    if (value instanceof BoolValue b) {
      return b.value();
    }
    throw EvaluationException.error("Expected a boolean, got %s", value);
  }

  /** Unwinds to the enclosing function or closure call. */
  private static final class ReturnSignal extends RuntimeException {
    final Value value;

    ReturnSignal(Value value) {
      super(null, null, false, false);
      this.value = value;
    }
  }

  /** Unwinds to the enclosing loop. */
  private static final class BreakSignal extends RuntimeException {
    final Value value;

    BreakSignal(Value value) {
      super(null, null, false, false);
      this.value = value;
    }
  }
}
