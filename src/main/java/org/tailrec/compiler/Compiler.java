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

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.tailrec.ast.Expr;
import org.tailrec.ast.FunctionDef;
import org.tailrec.ast.Item;
import org.tailrec.ast.SourceFile;

/** Static-only class for parsing source text into a {@link SourceFile} or {@link Expr}. */
public class Compiler {

  private Compiler() {}

  /** Reports the first syntax error as a CompileError rather than printing it and recovering. */
  private static final BaseErrorListener THROWING_LISTENER =
      new BaseErrorListener() {
        @Override
        public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
          throw new CompileError(line, charPositionInLine, msg);
        }
      };

  /** Parses a complete source text. */
  public static SourceFile parse(CharStream input) {
    return AstBuilder.sourceFile(newParser(input).sourceFile());
  }

  /** Parses a single expression, such as {@code sum_to(10, 0)}. */
  public static Expr parseExpression(String source) {
    TailrecParser parser = newParser(CharStreams.fromString(source));
    return AstBuilder.expression(parser.singleExpression().expression());
  }

  private static TailrecParser newParser(CharStream input) {
    TailrecLexer lexer = new TailrecLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(THROWING_LISTENER);
    TailrecParser parser = new TailrecParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(THROWING_LISTENER);
    return parser;
  }

  public static SourceFile parse(String source) {
    return parse(CharStreams.fromString(source));
  }

  /** Parses a source text that must consist of exactly one function definition. */
  public static FunctionDef parseFunction(String source) {
    SourceFile file = parse(source);
    if (file.items().size() != 1 || !(file.items().get(0) instanceof FunctionDef)) {
      throw new CompileError(1, 0, "Expected a single function definition");
    }
    return (FunctionDef) file.items().get(0);
  }

  /** Returns a CompileError positioned at the given token. */
  static CompileError error(Token token, String format, Object... args) {
    return new CompileError(
        token.getLine(), token.getCharPositionInLine(), String.format(format, args));
  }

  /** Returns the item's name, for error messages. */
  static String describe(Item item) {
    return (item instanceof FunctionDef ? "fn " : "enum ") + item.name();
  }
}
