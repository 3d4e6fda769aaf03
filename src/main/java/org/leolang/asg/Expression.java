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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/**
 * A node of the semantic graph that produces a value. Every expression has a resolved type and the
 * span of the source it was built from.
 */
public abstract class Expression {
  public final Type type;
  public final Span span;

  private Expression(Type type, Span span) {
    this.type = type;
    this.span = span;
  }

  /**
   * True if the value of this expression will be known at synthesis time (it depends only on
   * literals, {@code const} bindings, {@code const} parameters and loop variables).
   */
  public abstract boolean isConstant();

  public abstract <T> T accept(Visitor<T> visitor);

  /** A visitor with one method per expression class. */
  public interface Visitor<T> {
    T visitBoolean(BooleanLiteral expr);

    T visitInteger(IntegerLiteral expr);

    T visitField(FieldLiteral expr);

    T visitGroup(GroupLiteralExpression expr);

    T visitAddress(AddressLiteral expr);

    T visitVariable(VariableRef expr);

    T visitUnary(Unary expr);

    T visitBinary(Binary expr);

    T visitTernary(Ternary expr);

    T visitCast(Cast expr);

    T visitTupleInit(TupleInit expr);

    T visitTupleAccess(TupleAccess expr);

    T visitArrayInline(ArrayInline expr);

    T visitArrayInit(ArrayInit expr);

    T visitArrayAccess(ArrayAccess expr);

    T visitArrayRange(ArrayRangeAccess expr);

    T visitCircuitInit(CircuitInit expr);

    T visitMemberAccess(MemberAccess expr);

    T visitCall(Call expr);
  }

  private static boolean allConstant(ImmutableList<Expression> exprs) {
    return exprs.stream().allMatch(Expression::isConstant);
  }

  /** Literals are the leaves of the graph. */
  public abstract static class Literal extends Expression {
    private Literal(Type type, Span span) {
      super(type, span);
    }

    @Override
    public final boolean isConstant() {
      return true;
    }
  }

  public static final class BooleanLiteral extends Literal {
    public final boolean value;

    public BooleanLiteral(boolean value, Span span) {
      super(Type.BOOLEAN, span);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBoolean(this);
    }
  }

  public static final class IntegerLiteral extends Literal {
    public final BigInteger value;

    public IntegerLiteral(IntegerType integerType, BigInteger value, Span span) {
      super(Type.integer(integerType), span);
      Preconditions.checkArgument(integerType.contains(value));
      this.value = value;
    }

    public IntegerType integerType() {
      return type.asInteger();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInteger(this);
    }
  }

  /** A field element; the value is not yet reduced and may be negative. */
  public static final class FieldLiteral extends Literal {
    public final BigInteger value;

    public FieldLiteral(BigInteger value, Span span) {
      super(Type.FIELD, span);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitField(this);
    }
  }

  public static final class GroupLiteralExpression extends Literal {
    public final GroupLiteral value;

    public GroupLiteralExpression(GroupLiteral value, Span span) {
      super(Type.GROUP, span);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitGroup(this);
    }
  }

  public static final class AddressLiteral extends Literal {
    /** The bech32 text, e.g. {@code "aleo1..."}. */
    public final String value;

    public AddressLiteral(String value, Span span) {
      super(Type.ADDRESS, span);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAddress(this);
    }
  }

  public static final class VariableRef extends Expression {
    public final Variable variable;

    public VariableRef(Variable variable, Span span) {
      super(variable.type, span);
      this.variable = variable;
    }

    @Override
    public boolean isConstant() {
      return variable.constant;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitVariable(this);
    }
  }

  public enum UnaryOp {
    NOT("!"),
    NEGATE("-");

    public final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }
  }

  public static final class Unary extends Expression {
    public final UnaryOp op;
    public final Expression operand;

    public Unary(UnaryOp op, Expression operand, Span span) {
      super(operand.type, span);
      this.op = op;
      this.operand = operand;
    }

    @Override
    public boolean isConstant() {
      return operand.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnary(this);
    }
  }

  public enum BinaryOp {
    POW("**"),
    MUL("*"),
    DIV("/"),
    ADD("+"),
    SUB("-"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EQ("=="),
    NE("!="),
    AND("&&"),
    OR("||");

    public final String symbol;

    BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public boolean isArithmetic() {
      return compareTo(SUB) <= 0;
    }

    public boolean isOrdering() {
      return this == LT || this == LE || this == GT || this == GE;
    }

    public boolean isEquality() {
      return this == EQ || this == NE;
    }

    public boolean isLogical() {
      return this == AND || this == OR;
    }

    /** Returns the operator with the given source symbol, or null. */
    public static @Nullable BinaryOp fromSymbol(String symbol) {
      for (BinaryOp op : values()) {
        if (op.symbol.equals(symbol)) {
          return op;
        }
      }
      return null;
    }
  }

  public static final class Binary extends Expression {
    public final BinaryOp op;
    public final Expression left;
    public final Expression right;

    public Binary(Type type, BinaryOp op, Expression left, Expression right, Span span) {
      super(type, span);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public boolean isConstant() {
      return left.isConstant() && right.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinary(this);
    }
  }

  public static final class Ternary extends Expression {
    public final Expression condition;
    public final Expression ifTrue;
    public final Expression ifFalse;

    public Ternary(Expression condition, Expression ifTrue, Expression ifFalse, Span span) {
      super(ifTrue.type, span);
      this.condition = condition;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    @Override
    public boolean isConstant() {
      return condition.isConstant() && ifTrue.isConstant() && ifFalse.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTernary(this);
    }
  }

  /** {@code operand as type}; the operand is an integer, the target an integer or field. */
  public static final class Cast extends Expression {
    public final Expression operand;

    public Cast(Type target, Expression operand, Span span) {
      super(target, span);
      this.operand = operand;
    }

    @Override
    public boolean isConstant() {
      return operand.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCast(this);
    }
  }

  public static final class TupleInit extends Expression {
    public final ImmutableList<Expression> elements;

    public TupleInit(Type.Tuple type, ImmutableList<Expression> elements, Span span) {
      super(type, span);
      this.elements = elements;
    }

    @Override
    public boolean isConstant() {
      return allConstant(elements);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTupleInit(this);
    }
  }

  public static final class TupleAccess extends Expression {
    public final Expression tuple;
    public final int index;

    public TupleAccess(Expression tuple, int index, Span span) {
      super(((Type.Tuple) tuple.type).elements.get(index), span);
      this.tuple = tuple;
      this.index = index;
    }

    @Override
    public boolean isConstant() {
      return tuple.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTupleAccess(this);
    }
  }

  /** {@code [a, ...b, c]}; spread elements contribute all of their elements. */
  public static final class ArrayInline extends Expression {
    public final ImmutableList<Expression> elements;

    /** Parallel to {@link #elements}. */
    public final ImmutableList<Boolean> spread;

    public ArrayInline(
        Type.Array type,
        ImmutableList<Expression> elements,
        ImmutableList<Boolean> spread,
        Span span) {
      super(type, span);
      Preconditions.checkArgument(elements.size() == spread.size());
      this.elements = elements;
      this.spread = spread;
    }

    @Override
    public boolean isConstant() {
      return allConstant(elements);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArrayInline(this);
    }
  }

  /** {@code [element; length]}. */
  public static final class ArrayInit extends Expression {
    public final Expression element;

    public ArrayInit(Type.Array type, Expression element, Span span) {
      super(type, span);
      this.element = element;
    }

    public int length() {
      return ((Type.Array) type).length;
    }

    @Override
    public boolean isConstant() {
      return element.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArrayInit(this);
    }
  }

  public static final class ArrayAccess extends Expression {
    public final Expression array;
    public final Expression index;

    public ArrayAccess(Expression array, Expression index, Span span) {
      super(((Type.Array) array.type).element, span);
      this.array = array;
      this.index = index;
    }

    @Override
    public boolean isConstant() {
      return array.isConstant() && index.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArrayAccess(this);
    }
  }

  /** {@code array[from..to]} with bounds known at resolution. */
  public static final class ArrayRangeAccess extends Expression {
    public final Expression array;
    public final int from;
    public final int to;

    public ArrayRangeAccess(Expression array, int from, int to, Span span) {
      super(Type.array(((Type.Array) array.type).element, to - from), span);
      this.array = array;
      this.from = from;
      this.to = to;
    }

    @Override
    public boolean isConstant() {
      return array.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArrayRange(this);
    }
  }

  /** {@code Foo { x: 1u8, y }}; values are in member declaration order. */
  public static final class CircuitInit extends Expression {
    public final Circuit circuit;
    public final ImmutableList<Expression> values;

    public CircuitInit(Circuit circuit, ImmutableList<Expression> values, Span span) {
      super(circuit.type(), span);
      this.circuit = circuit;
      this.values = values;
    }

    @Override
    public boolean isConstant() {
      return allConstant(values);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCircuitInit(this);
    }
  }

  public static final class MemberAccess extends Expression {
    public final Expression base;
    public final String member;

    /** The member's position in its circuit. */
    public final int index;

    public MemberAccess(Expression base, String member, int index, Type type, Span span) {
      super(type, span);
      this.base = base;
      this.member = member;
      this.index = index;
    }

    @Override
    public boolean isConstant() {
      return base.isConstant();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMemberAccess(this);
    }
  }

  /** The forms a call can take. */
  public enum CallKind {
    /** {@code f(args)}: a top-level function. */
    FUNCTION,
    /** {@code value.f(args)}: a circuit function with a receiver. */
    METHOD,
    /** {@code Circuit::f(args)}: a circuit function without a receiver. */
    STATIC
  }

  public static final class Call extends Expression {
    public final CallKind kind;
    public final Function function;

    /** Non-null iff {@code kind} is {@link CallKind#METHOD}. */
    public final @Nullable Expression receiver;

    public final ImmutableList<Expression> args;

    /**
     * For a call to a {@code mut self} function on a variable (or part of one), the place that
     * receives the updated instance when the call returns.
     */
    public final @Nullable Assignee writeBack;

    public Call(
        CallKind kind,
        Function function,
        @Nullable Expression receiver,
        ImmutableList<Expression> args,
        @Nullable Assignee writeBack,
        Span span) {
      super(function.returnType, span);
      Preconditions.checkArgument((kind == CallKind.METHOD) == (receiver != null));
      this.kind = kind;
      this.function = function;
      this.receiver = receiver;
      this.args = args;
      this.writeBack = writeBack;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }
}
