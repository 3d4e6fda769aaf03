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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Span;

/**
 * A base class for the resolution visitors that provides two useful functions:
 *
 * <ul>
 *   <li>It disables the default "do nothing" behavior for node types that haven't been overridden.
 *       Visiting a node that doesn't have an explicit visit* method will throw an AssertionError.
 *   <li>It provides error() methods that automatically fill in the span of the node currently
 *       being visited.
 * </ul>
 */
class VisitorBase<T> extends LeoBaseVisitor<T> {

  /** Identifies the source in spans. */
  final String path;

  /** The node currently being visited. */
  private ParseTree currentNode;

  VisitorBase(String path) {
    this.path = path;
  }

  @Override
  protected final T defaultResult() {
    // Only reached from a visitXXX() method we forgot to override.
    throw new AssertionError();
  }

  @Override
  public final T visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  /**
   * Calls {@code visitor} with the given node, binding {@link #currentNode} for the duration of the
   * call.
   *
   * <p>Assumes that if the function throws an exception, this Visitor will not be used again (no
   * attempt is made to restore the correct currentNode state).
   */
  @CanIgnoreReturnValue
  T visitWithCurrentNode(ParseTree node, Function<ParseTree, T> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    T result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  /** Returns the span of the given node. */
  Span span(ParserRuleContext ctx) {
    return Compiler.span(ctx, path);
  }

  /** Returns the span of the current node. */
  Span currentSpan() {
    return span((ParserRuleContext) currentNode);
  }

  /** Returns a {@link CompileError} pointing at the current node. */
  @FormatMethod
  CompileError error(ErrorKind kind, String fmt, Object... fmtArgs) {
    return Compiler.error(kind, currentSpan(), fmt, fmtArgs);
  }

  /** Returns a {@link CompileError} pointing at the given node. */
  @FormatMethod
  CompileError error(ParserRuleContext ctx, ErrorKind kind, String fmt, Object... fmtArgs) {
    return Compiler.error(kind, span(ctx), fmt, fmtArgs);
  }
}
