/*
 * Copyright 2025 The Leolang Authors
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

package org.leolang.compiler;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.Map;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.leolang.CompilerOptions;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Expression;
import org.leolang.asg.Program;
import org.leolang.asg.Span;
import org.leolang.asg.Type;
import org.leolang.compiler.LeoParser.FileContext;
import org.leolang.compiler.LeoParser.LiteralInputContext;
import org.leolang.synth.CompiledCircuit;
import org.leolang.synth.Synthesizer;

/**
 * Parses Leo source code, resolves it into a semantic graph, and synthesizes the constraint system
 * for its entry function.
 */
public final class Compiler {

  // Static methods only
  private Compiler() {}

  /**
   * Compiles a Leo program into a constraint system.
   *
   * @param input the program text
   * @param path identifies the source of the program (e.g. a filename) in error spans
   * @param packages previously resolved programs that {@code import} statements may refer to,
   *     keyed by package name
   * @param options selects the entry function and supplies its {@code const} parameters
   * @throws CompileError if the program is syntactically invalid
   * @throws CompileErrors if resolution fails
   * @throws org.leolang.synth.SynthesisError if synthesis fails
   */
  public static CompiledCircuit compile(
      CharStream input, String path, Map<String, Program> packages, CompilerOptions options) {
    Program program = resolve(parse(input, path), path, packages);
    return Synthesizer.synthesize(program, options);
  }

  /** Compiles a program with no imports, using the default options. */
  public static CompiledCircuit compile(String source, String path) {
    return compile(source, path, CompilerOptions.DEFAULTS);
  }

  /** Compiles a program with no imports. */
  public static CompiledCircuit compile(String source, String path, CompilerOptions options) {
    return compile(CharStreams.fromString(source), path, ImmutableMap.of(), options);
  }

  /** Parses and resolves a program with no imports. */
  public static Program resolve(String source, String path) {
    return resolve(parse(CharStreams.fromString(source), path), path, ImmutableMap.of());
  }

  /**
   * Builds the semantic graph for a parsed program.
   *
   * @throws CompileErrors if any declaration fails to resolve
   */
  public static Program resolve(FileContext file, String path, Map<String, Program> packages) {
    return Symbols.resolve(file, path, packages);
  }

  /** Parses a Leo program. */
  public static FileContext parse(CharStream input, String path) {
    return newParser(input, path).file();
  }

  /**
   * Parses and resolves a constant expression (such as an input value {@code "[1u8, 2u8]"}) with
   * the given expected type. Circuit names in the expression refer to those of {@code program}.
   */
  public static Expression parseLiteral(String text, Type expected, Program program) {
    LiteralInputContext ctx = newParser(CharStreams.fromString(text), program.path).literalInput();
    Symbols symbols = Symbols.forProgram(program);
    return ExpressionResolver.resolveConstant(ctx.expression(), expected, symbols);
  }

  private static LeoParser newParser(CharStream input, String path) {
    // Throw CompileErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            Span span;
            if (offendingSymbol instanceof Token) {
              span = span((Token) offendingSymbol, path);
            } else {
              span =
                  new Span(
                      lineNum, lineNum, charPositionInLine + 1, charPositionInLine + 2, path, "");
            }
            throw new CompileError(ErrorKind.SYNTAX, msg, span);
          }
        };
    LeoLexer lexer = new LeoLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    LeoParser parser = new LeoParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser;
  }

  /** Returns the span of source text covered by the given parse tree node. */
  static Span span(ParserRuleContext ctx, String path) {
    Token start = ctx.getStart();
    Token stop = ctx.getStop();
    if (stop == null || stop.getStopIndex() < start.getStartIndex()) {
      // An empty match (only possible at the end of input).
      stop = start;
    }
    String content =
        start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
    return new Span(
        start.getLine(),
        stop.getLine(),
        start.getCharPositionInLine() + 1,
        endColumn(stop),
        path,
        content);
  }

  /** Returns the span of a single token. */
  static Span span(Token token, String path) {
    String text = (token.getType() == Token.EOF) ? "" : token.getText();
    return new Span(
        token.getLine(),
        token.getLine(),
        token.getCharPositionInLine() + 1,
        endColumn(token),
        path,
        text);
  }

  /** The column just past the last character of {@code token} (on its last line). */
  private static int endColumn(Token token) {
    if (token.getType() == Token.EOF) {
      return token.getCharPositionInLine() + 1;
    }
    String text = token.getText();
    int lastNewline = text.lastIndexOf('\n');
    if (lastNewline < 0) {
      return token.getCharPositionInLine() + text.length() + 1;
    }
    return text.length() - lastNewline;
  }

  /** Returns a new CompileError with the given span. */
  @FormatMethod
  static CompileError error(ErrorKind kind, Span span, String fmt, Object... fmtArgs) {
    return new CompileError(kind, String.format(fmt, fmtArgs), span);
  }

  /** Returns a new "Cannot assign to '%s'" CompileError. */
  static CompileError cannotAssign(Span span, String place, String binding) {
    return error(
        ErrorKind.IMMUTABLE_ASSIGNMENT,
        span,
        "Cannot assign to '%s': '%s' is not mutable",
        place,
        binding);
  }

  /** Returns a new "Expected %s but found %s" CompileError. */
  static CompileError typeMismatch(Span span, Type expected, Type actual) {
    return error(ErrorKind.TYPE_MISMATCH, span, "Expected %s but found %s", expected, actual);
  }
}
