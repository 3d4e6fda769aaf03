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

package org.leolang.asg;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** A node of the semantic graph that is executed for its effect. */
public abstract class Statement {
  public final Span span;

  private Statement(Span span) {
    this.span = span;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  public interface Visitor<T> {
    T visitBlock(Block stmt);

    T visitDefinition(Definition stmt);

    T visitAssign(Assign stmt);

    T visitConditional(Conditional stmt);

    T visitIteration(Iteration stmt);

    T visitConsoleAssert(ConsoleAssert stmt);

    T visitConsolePrint(ConsolePrint stmt);

    T visitExpression(ExpressionStatement stmt);

    T visitReturn(Return stmt);
  }

  public static final class Block extends Statement {
    public final ImmutableList<Statement> statements;

    public Block(ImmutableList<Statement> statements, Span span) {
      super(span);
      this.statements = statements;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBlock(this);
    }
  }

  /**
   * {@code let x = e;}, {@code const x = e;} or {@code let (a, b) = e;}. If there is more than one
   * variable the value is a tuple with one element per variable.
   */
  public static final class Definition extends Statement {
    public final ImmutableList<Variable> variables;
    public final Expression value;

    public Definition(ImmutableList<Variable> variables, Expression value, Span span) {
      super(span);
      this.variables = variables;
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitDefinition(this);
    }
  }

  /** {@code place = value;} or a compound assignment such as {@code place += value;}. */
  public static final class Assign extends Statement {
    public final Assignee target;

    /** Null for a simple assignment. */
    public final Expression.@Nullable BinaryOp op;

    public final Expression value;

    public Assign(
        Assignee target, Expression.@Nullable BinaryOp op, Expression value, Span span) {
      super(span);
      this.target = target;
      this.op = op;
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssign(this);
    }
  }

  public static final class Conditional extends Statement {
    public final Expression condition;
    public final Block thenBlock;

    /** A Block, another Conditional (for {@code else if}), or null. */
    public final @Nullable Statement otherwise;

    public Conditional(
        Expression condition, Block thenBlock, @Nullable Statement otherwise, Span span) {
      super(span);
      this.condition = condition;
      this.thenBlock = thenBlock;
      this.otherwise = otherwise;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConditional(this);
    }
  }

  /** {@code for v in start..stop { body }}; the bounds are constant and the range half-open. */
  public static final class Iteration extends Statement {
    public final Variable variable;
    public final Expression start;
    public final Expression stop;
    public final Block body;

    public Iteration(Variable variable, Expression start, Expression stop, Block body, Span span) {
      super(span);
      this.variable = variable;
      this.start = start;
      this.stop = stop;
      this.body = body;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIteration(this);
    }
  }

  public static final class ConsoleAssert extends Statement {
    public final Expression condition;

    public ConsoleAssert(Expression condition, Span span) {
      super(span);
      this.condition = condition;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConsoleAssert(this);
    }
  }

  public enum ConsoleKind {
    LOG,
    DEBUG,
    ERROR
  }

  /**
   * {@code console.log("a {} b", x);}. The format string is split at each {@code {}}, so there is
   * one more fragment than there are arguments.
   */
  public static final class ConsolePrint extends Statement {
    public final ConsoleKind kind;
    public final ImmutableList<String> fragments;
    public final ImmutableList<Expression> args;

    public ConsolePrint(
        ConsoleKind kind,
        ImmutableList<String> fragments,
        ImmutableList<Expression> args,
        Span span) {
      super(span);
      this.kind = kind;
      this.fragments = fragments;
      this.args = args;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConsolePrint(this);
    }
  }

  public static final class ExpressionStatement extends Statement {
    public final Expression expression;

    public ExpressionStatement(Expression expression, Span span) {
      super(span);
      this.expression = expression;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExpression(this);
    }
  }

  public static final class Return extends Statement {
    /** An empty tuple if the source omitted the value. */
    public final Expression value;

    public Return(Expression value, Span span) {
      super(span);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }
}
