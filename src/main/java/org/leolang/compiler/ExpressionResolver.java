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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.antlr.v4.runtime.Token;
import org.jspecify.annotations.Nullable;
import org.leolang.asg.Assignee;
import org.leolang.asg.Circuit;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Expression;
import org.leolang.asg.Expression.BinaryOp;
import org.leolang.asg.Function;
import org.leolang.asg.GroupLiteral;
import org.leolang.asg.IntegerType;
import org.leolang.asg.Span;
import org.leolang.asg.Type;
import org.leolang.asg.Variable;
import org.leolang.compiler.LeoParser.AddressLiteralContext;
import org.leolang.compiler.LeoParser.AffineGroupLiteralContext;
import org.leolang.compiler.LeoParser.ArrayAccessContext;
import org.leolang.compiler.LeoParser.ArrayElementContext;
import org.leolang.compiler.LeoParser.ArrayInitContext;
import org.leolang.compiler.LeoParser.ArrayInlineContext;
import org.leolang.compiler.LeoParser.ArrayRangeAccessContext;
import org.leolang.compiler.LeoParser.BinaryExpressionContext;
import org.leolang.compiler.LeoParser.BooleanLiteralContext;
import org.leolang.compiler.LeoParser.CallExpressionContext;
import org.leolang.compiler.LeoParser.CastExpressionContext;
import org.leolang.compiler.LeoParser.CircuitInitContext;
import org.leolang.compiler.LeoParser.CircuitInitMemberContext;
import org.leolang.compiler.LeoParser.ExpressionContext;
import org.leolang.compiler.LeoParser.GroupCoordinateContext;
import org.leolang.compiler.LeoParser.IdentifierContext;
import org.leolang.compiler.LeoParser.InferredContext;
import org.leolang.compiler.LeoParser.IntegerLiteralContext;
import org.leolang.compiler.LeoParser.MemberAccessContext;
import org.leolang.compiler.LeoParser.NumberCoordinateContext;
import org.leolang.compiler.LeoParser.ParenExpressionContext;
import org.leolang.compiler.LeoParser.PrimaryContext;
import org.leolang.compiler.LeoParser.PrimaryExpressionContext;
import org.leolang.compiler.LeoParser.SelfReferenceContext;
import org.leolang.compiler.LeoParser.SignHighContext;
import org.leolang.compiler.LeoParser.SingletonTupleContext;
import org.leolang.compiler.LeoParser.StaticAccessContext;
import org.leolang.compiler.LeoParser.TernaryExpressionContext;
import org.leolang.compiler.LeoParser.TupleAccessContext;
import org.leolang.compiler.LeoParser.TupleExpressionContext;
import org.leolang.compiler.LeoParser.TypeReferenceContext;
import org.leolang.compiler.LeoParser.UnaryExpressionContext;
import org.leolang.compiler.LeoParser.UnitExpressionContext;
import org.leolang.gadgets.Bech32;

/**
 * Resolves expression syntax to typed Expressions.
 *
 * <p>Each expression is resolved with an optional expected type, which is only used to give a
 * type to integer literals written without a suffix (and to the elements of tuple and array
 * literals containing them); callers that need an exact type use {@link #expect}.
 */
class ExpressionResolver extends VisitorBase<Expression> {
  private final Symbols symbols;

  /** The function whose body is being resolved, or null when resolving an input value. */
  private final @Nullable Function function;

  /** The variables currently in scope; maintained by the BlockResolver. */
  Scope scope;

  /** The expected type of the expression currently being visited, if any. */
  private @Nullable Type expected;

  /** The functions called so far. */
  private final Set<Function> callees = new LinkedHashSet<>();

  ExpressionResolver(Symbols symbols, @Nullable Function function, Scope scope) {
    super(symbols.path);
    this.symbols = symbols;
    this.function = function;
    this.scope = scope;
  }

  /** Resolves an expression that must be a compile-time constant of the given type. */
  static Expression resolveConstant(ExpressionContext ctx, Type type, Symbols symbols) {
    ExpressionResolver resolver = new ExpressionResolver(symbols, null, new Scope(null));
    Expression result = resolver.expect(ctx, type);
    if (!result.isConstant()) {
      throw resolver.error(
          ctx, ErrorKind.NON_CONSTANT_ARGUMENT, "Expected a constant value of type %s", type);
    }
    return result;
  }

  ImmutableSet<Function> callees() {
    return ImmutableSet.copyOf(callees);
  }

  private @Nullable Circuit owner() {
    return (function == null) ? null : function.owner;
  }

  /** Resolves an expression, using {@code expected} to type any unsuffixed integer literals. */
  Expression resolve(ExpressionContext ctx, @Nullable Type expected) {
    Type saved = this.expected;
    this.expected = expected;
    try {
      return visit(ctx);
    } finally {
      this.expected = saved;
    }
  }

  /** Resolves an expression that must have the given type. */
  Expression expect(ExpressionContext ctx, Type type) {
    Expression result = resolve(ctx, type);
    if (!result.type.equals(type)) {
      throw Compiler.typeMismatch(span(ctx), type, result.type);
    }
    return result;
  }

  /**
   * Resolves an array index. Unsuffixed literals are given type u32; otherwise any unsigned integer
   * type is accepted.
   */
  Expression resolveIndex(ExpressionContext ctx, int length) {
    Expression index = resolve(ctx, Type.integer(IntegerType.U32));
    if (!index.type.isInteger() || index.type.asInteger().signed) {
      throw error(
          ctx,
          ErrorKind.TYPE_MISMATCH,
          "Array index must be an unsigned integer, found %s",
          index.type);
    }
    if (index instanceof Expression.IntegerLiteral) {
      BigInteger value = ((Expression.IntegerLiteral) index).value;
      if (value.compareTo(BigInteger.valueOf(length)) >= 0) {
        throw error(
            ctx,
            ErrorKind.INDEX_OUT_OF_BOUNDS,
            "Index %s is out of bounds for an array of length %s",
            value,
            length);
      }
    }
    return index;
  }

  /**
   * Returns the value of an array range bound, which must be an integer literal; returns {@code
   * dflt} if the bound was omitted.
   */
  int rangeBound(@Nullable ExpressionContext ctx, int dflt) {
    if (ctx == null) {
      return dflt;
    }
    IntegerLiteralContext literal = directIntegerLiteral(ctx);
    if (literal != null) {
      String text = literal.INTEGER().getText();
      String digits = text.substring(0, suffixStart(text));
      IntegerType type = IntegerType.fromKeyword(text.substring(digits.length()));
      if (digits.length() == text.length() || (type != null && !type.signed)) {
        BigInteger value = new BigInteger(digits);
        if (value.bitLength() < 31) {
          return value.intValue();
        }
      }
    }
    throw error(ctx, ErrorKind.INVALID_LITERAL, "Array range bounds must be integer literals");
  }

  /** Checks the bounds of {@code array[from..to]} and returns the resulting array type. */
  Type.Array rangeType(Type arrayType, int from, int to, Span span) {
    Type.Array array = (Type.Array) arrayType;
    if (from > to || to > array.length) {
      throw Compiler.error(
          ErrorKind.INDEX_OUT_OF_BOUNDS,
          span,
          "Range %s..%s is out of bounds for an array of length %s",
          from,
          to,
          array.length);
    }
    return Type.array(array.element, to - from);
  }

  /**
   * True if {@code ctx} takes its type from context: an integer literal without a type suffix
   * (possibly negated), or arithmetic combining only such literals.
   */
  static boolean isUntyped(ExpressionContext ctx) {
    if (ctx instanceof BinaryExpressionContext) {
      BinaryExpressionContext binary = (BinaryExpressionContext) ctx;
      BinaryOp op = BinaryOp.fromSymbol(binary.op.getText());
      // The exponent of '**' is typed on its own.
      return op.isArithmetic()
          && op != BinaryOp.POW
          && isUntyped(binary.left)
          && isUntyped(binary.right);
    } else if (ctx instanceof UnaryExpressionContext) {
      UnaryExpressionContext unary = (UnaryExpressionContext) ctx;
      return unary.op.getType() == TokenType.MINUS && isUntyped(unary.expression());
    } else if (ctx instanceof PrimaryExpressionContext) {
      PrimaryContext primary = ((PrimaryExpressionContext) ctx).primary();
      if (primary instanceof ParenExpressionContext) {
        return isUntyped(((ParenExpressionContext) primary).expression());
      } else if (primary instanceof IntegerLiteralContext) {
        String text = ((IntegerLiteralContext) primary).INTEGER().getText();
        return suffixStart(text) == text.length();
      }
    }
    return false;
  }

  /** If {@code ctx} is just an integer literal, returns it. */
  private static @Nullable IntegerLiteralContext directIntegerLiteral(ExpressionContext ctx) {
    if (ctx instanceof PrimaryExpressionContext) {
      PrimaryContext primary = ((PrimaryExpressionContext) ctx).primary();
      if (primary instanceof IntegerLiteralContext) {
        return (IntegerLiteralContext) primary;
      }
    }
    return null;
  }

  /** Returns the index of the first non-digit in an INTEGER token's text. */
  private static int suffixStart(String text) {
    int i = 0;
    while (i < text.length() && Character.isDigit(text.charAt(i))) {
      i++;
    }
    return i;
  }

  @Override
  public Expression visitPrimaryExpression(PrimaryExpressionContext ctx) {
    return visit(ctx.primary());
  }

  @Override
  public Expression visitParenExpression(ParenExpressionContext ctx) {
    // Parentheses don't change the interpretation (or expected type) of the expression.
    return visit(ctx.expression());
  }

  @Override
  public Expression visitIntegerLiteral(IntegerLiteralContext ctx) {
    return integerLiteral(ctx, false, currentSpan());
  }

  /**
   * Returns the literal's value with the type given by its suffix or, if it has none, by the
   * expected type. A negated literal is resolved as a single negative literal, so that e.g. {@code
   * -128i8} is in range.
   */
  private Expression integerLiteral(IntegerLiteralContext ctx, boolean negate, Span span) {
    String text = ctx.INTEGER().getText();
    int split = suffixStart(text);
    BigInteger value = new BigInteger(text.substring(0, split));
    if (negate) {
      value = value.negate();
    }
    String suffix = text.substring(split);
    Type type;
    if (suffix.isEmpty()) {
      if (expected == null) {
        throw Compiler.error(
            ErrorKind.UNTYPED_LITERAL, span, "Cannot infer a type for '%s'", span.content);
      }
      type = expected;
    } else if (suffix.equals("field")) {
      type = Type.FIELD;
    } else if (suffix.equals("group")) {
      type = Type.GROUP;
    } else {
      type = Type.integer(IntegerType.fromKeyword(suffix));
    }
    switch (type.kind()) {
      case INTEGER:
        IntegerType integerType = type.asInteger();
        if (!integerType.contains(value)) {
          throw Compiler.error(
              ErrorKind.LITERAL_OUT_OF_RANGE,
              span,
              "'%s' is out of range for %s",
              span.content,
              integerType);
        }
        return new Expression.IntegerLiteral(integerType, value, span);
      case FIELD:
        return new Expression.FieldLiteral(value, span);
      case GROUP:
        return new Expression.GroupLiteralExpression(GroupLiteral.product(value), span);
      default:
        throw Compiler.error(
            ErrorKind.TYPE_MISMATCH, span, "Expected %s but found an integer literal", type);
    }
  }

  @Override
  public Expression visitBooleanLiteral(BooleanLiteralContext ctx) {
    boolean value = ctx.getStart().getType() == TokenType.TRUE;
    return new Expression.BooleanLiteral(value, currentSpan());
  }

  @Override
  public Expression visitAddressLiteral(AddressLiteralContext ctx) {
    String text = ctx.getText();
    if (!Bech32.isValidAddress(text)) {
      throw error(ErrorKind.INVALID_LITERAL, "Invalid address '%s'", text);
    }
    return new Expression.AddressLiteral(text, currentSpan());
  }

  @Override
  public Expression visitAffineGroupLiteral(AffineGroupLiteralContext ctx) {
    GroupLiteral literal = GroupLiteral.affine(coordinate(ctx.x), coordinate(ctx.y));
    return new Expression.GroupLiteralExpression(literal, currentSpan());
  }

  private GroupLiteral.Coordinate coordinate(GroupCoordinateContext ctx) {
    if (ctx instanceof SignHighContext) {
      return GroupLiteral.Coordinate.SIGN_HIGH;
    } else if (ctx instanceof InferredContext) {
      return GroupLiteral.Coordinate.INFERRED;
    } else if (!(ctx instanceof NumberCoordinateContext)) {
      return GroupLiteral.Coordinate.SIGN_LOW;
    }
    NumberCoordinateContext number = (NumberCoordinateContext) ctx;
    String text = number.INTEGER().getText();
    if (suffixStart(text) != text.length()) {
      throw error(
          number, ErrorKind.INVALID_LITERAL, "Group coordinates must not have a type suffix");
    }
    BigInteger value = new BigInteger(text);
    return GroupLiteral.Coordinate.number((number.negative != null) ? value.negate() : value);
  }

  @Override
  public Expression visitIdentifier(IdentifierContext ctx) {
    String name = ctx.getText();
    Variable variable = scope.lookup(name);
    if (variable != null) {
      return new Expression.VariableRef(variable, currentSpan());
    } else if (symbols.isDeclared(name)) {
      throw error(ErrorKind.TYPE_MISMATCH, "'%s' is not a value", name);
    }
    throw error(ErrorKind.UNRESOLVED_IDENTIFIER, "Unknown variable '%s'", name);
  }

  @Override
  public Expression visitSelfReference(SelfReferenceContext ctx) {
    if (function == null || function.self == null) {
      throw error(
          ErrorKind.UNRESOLVED_IDENTIFIER,
          "'self' is only available in circuit functions with a self parameter");
    }
    return new Expression.VariableRef(function.self, currentSpan());
  }

  @Override
  public Expression visitTypeReference(TypeReferenceContext ctx) {
    throw error(ErrorKind.TYPE_MISMATCH, "'%s' is a type, not a value", ctx.getText());
  }

  private Circuit circuitNamed(Token name) {
    if (name.getType() == TokenType.SELF_TYPE) {
      if (owner() == null) {
        throw error(ErrorKind.UNRESOLVED_IDENTIFIER, "'Self' is only valid inside a circuit");
      }
      return owner();
    }
    Circuit circuit = symbols.circuit(name.getText());
    if (circuit == null) {
      throw error(ErrorKind.UNRESOLVED_IDENTIFIER, "Unknown circuit '%s'", name.getText());
    }
    return circuit;
  }

  @Override
  public Expression visitCircuitInit(CircuitInitContext ctx) {
    Circuit circuit = circuitNamed(ctx.name);
    Map<String, Type> members = circuit.members();
    Map<String, Expression> values = new LinkedHashMap<>();
    for (CircuitInitMemberContext member : ctx.circuitInitMember()) {
      String name = member.LOWER_ID().getText();
      Type memberType = members.get(name);
      if (memberType == null) {
        throw error(
            member,
            ErrorKind.UNRESOLVED_IDENTIFIER,
            "Circuit '%s' has no member '%s'",
            circuit.name,
            name);
      } else if (values.containsKey(name)) {
        throw error(member, ErrorKind.DUPLICATE_DECLARATION, "Duplicate member '%s'", name);
      }
      Expression value;
      if (member.expression() != null) {
        value = expect(member.expression(), memberType);
      } else {
        // Foo { x } is short for Foo { x: x }
        Variable variable = scope.lookup(name);
        if (variable == null) {
          throw error(member, ErrorKind.UNRESOLVED_IDENTIFIER, "Unknown variable '%s'", name);
        } else if (!variable.type.equals(memberType)) {
          throw Compiler.typeMismatch(span(member), memberType, variable.type);
        }
        value = new Expression.VariableRef(variable, span(member));
      }
      values.put(name, value);
    }
    ImmutableList.Builder<Expression> ordered = ImmutableList.builder();
    for (String name : members.keySet()) {
      Expression value = values.get(name);
      if (value == null) {
        throw error(
            ErrorKind.TYPE_MISMATCH,
            "Missing value for member '%s' of circuit '%s'",
            name,
            circuit.name);
      }
      ordered.add(value);
    }
    return new Expression.CircuitInit(circuit, ordered.build(), currentSpan());
  }

  @Override
  public Expression visitUnitExpression(UnitExpressionContext ctx) {
    return new Expression.TupleInit(Type.UNIT, ImmutableList.of(), currentSpan());
  }

  @Override
  public Expression visitSingletonTuple(SingletonTupleContext ctx) {
    throw error(ErrorKind.INVALID_TUPLE_ARITY, "Tuples must have zero or at least two elements");
  }

  @Override
  public Expression visitTupleExpression(TupleExpressionContext ctx) {
    List<ExpressionContext> elementCtxs = ctx.expression();
    List<Type> hints = null;
    if (expected instanceof Type.Tuple) {
      hints = ((Type.Tuple) expected).elements;
      if (hints.size() != elementCtxs.size()) {
        hints = null;
      }
    }
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    for (int i = 0; i < elementCtxs.size(); i++) {
      elements.add(resolve(elementCtxs.get(i), (hints == null) ? null : hints.get(i)));
    }
    ImmutableList<Expression> built = elements.build();
    Type.Tuple type =
        Type.tuple(built.stream().map(e -> e.type).collect(ImmutableList.toImmutableList()));
    return new Expression.TupleInit(type, built, currentSpan());
  }

  @Override
  public Expression visitArrayInline(ArrayInlineContext ctx) {
    Type element = (expected instanceof Type.Array) ? ((Type.Array) expected).element : null;
    if (element == null) {
      // Take the element type from the first element that doesn't need one.
      for (ArrayElementContext elementCtx : ctx.arrayElement()) {
        if (!isUntyped(elementCtx.expression())) {
          Type type = resolve(elementCtx.expression(), null).type;
          if (elementCtx.spread == null) {
            element = type;
          } else if (type instanceof Type.Array) {
            element = ((Type.Array) type).element;
          }
          break;
        }
      }
    }
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    ImmutableList.Builder<Boolean> spread = ImmutableList.builder();
    int length = 0;
    for (ArrayElementContext elementCtx : ctx.arrayElement()) {
      Expression e;
      if (elementCtx.spread != null) {
        e = resolve(elementCtx.expression(), null);
        if (!(e.type instanceof Type.Array)) {
          throw error(
              elementCtx, ErrorKind.TYPE_MISMATCH, "Only arrays can be spread, found %s", e.type);
        }
        Type.Array array = (Type.Array) e.type;
        if (element != null && !array.element.equals(element)) {
          throw Compiler.typeMismatch(
              span(elementCtx), Type.array(element, array.length), e.type);
        }
        element = array.element;
        length += array.length;
      } else {
        e = resolve(elementCtx.expression(), element);
        if (element != null && !e.type.equals(element)) {
          throw Compiler.typeMismatch(span(elementCtx), element, e.type);
        }
        element = e.type;
        length++;
      }
      elements.add(e);
      spread.add(elementCtx.spread != null);
    }
    return new Expression.ArrayInline(
        Type.array(element, length), elements.build(), spread.build(), currentSpan());
  }

  @Override
  public Expression visitArrayInit(ArrayInitContext ctx) {
    List<Integer> dims = TypeResolver.dimensions(ctx.dimensions(), path);
    Type elementHint = expected;
    for (int i = 0; i < dims.size() && elementHint instanceof Type.Array; i++) {
      elementHint = ((Type.Array) elementHint).element;
    }
    Span span = currentSpan();
    Expression result = resolve(ctx.expression(), elementHint);
    for (int i = dims.size() - 1; i >= 0; i--) {
      result = new Expression.ArrayInit(Type.array(result.type, dims.get(i)), result, span);
    }
    return result;
  }

  @Override
  public Expression visitMemberAccess(MemberAccessContext ctx) {
    Expression base = resolve(ctx.expression(), null);
    Circuit circuit = asCircuit(ctx.expression(), base);
    String name = ctx.LOWER_ID().getText();
    Type type = circuit.memberType(name);
    if (type == null) {
      if (circuit.function(name) != null) {
        throw error(ErrorKind.INVALID_CALL, "Circuit function '%s' must be called", name);
      }
      throw error(
          ErrorKind.UNRESOLVED_IDENTIFIER, "Circuit '%s' has no member '%s'", circuit.name, name);
    }
    return new Expression.MemberAccess(
        base, name, circuit.memberIndex(name), type, currentSpan());
  }

  private Circuit asCircuit(ExpressionContext ctx, Expression base) {
    if (!(base.type instanceof Type.CircuitRef)) {
      throw error(ctx, ErrorKind.TYPE_MISMATCH, "Expected a circuit but found %s", base.type);
    }
    return ((Type.CircuitRef) base.type).circuit();
  }

  @Override
  public Expression visitTupleAccess(TupleAccessContext ctx) {
    Expression base = resolve(ctx.expression(), null);
    if (!(base.type instanceof Type.Tuple)) {
      throw error(
          ctx.expression(), ErrorKind.TYPE_MISMATCH, "Expected a tuple but found %s", base.type);
    }
    int index = TypeResolver.natural(ctx.INTEGER(), path);
    int size = ((Type.Tuple) base.type).elements.size();
    if (index >= size) {
      throw error(
          ErrorKind.INDEX_OUT_OF_BOUNDS,
          "Index %s is out of bounds for a tuple of %s elements",
          index,
          size);
    }
    return new Expression.TupleAccess(base, index, currentSpan());
  }

  @Override
  public Expression visitStaticAccess(StaticAccessContext ctx) {
    throw error(ErrorKind.INVALID_CALL, "Static function '%s' must be called", ctx.getText());
  }

  @Override
  public Expression visitArrayAccess(ArrayAccessContext ctx) {
    Expression array = resolve(ctx.expression(0), null);
    Type.Array type = asArray(ctx.expression(0), array);
    Expression index = resolveIndex(ctx.index, type.length);
    return new Expression.ArrayAccess(array, index, currentSpan());
  }

  @Override
  public Expression visitArrayRangeAccess(ArrayRangeAccessContext ctx) {
    Expression array = resolve(ctx.expression(0), null);
    Type.Array type = asArray(ctx.expression(0), array);
    int from = rangeBound(ctx.left, 0);
    int to = rangeBound(ctx.right, type.length);
    rangeType(type, from, to, currentSpan());
    return new Expression.ArrayRangeAccess(array, from, to, currentSpan());
  }

  private Type.Array asArray(ExpressionContext ctx, Expression base) {
    if (!(base.type instanceof Type.Array)) {
      throw error(ctx, ErrorKind.TYPE_MISMATCH, "Expected an array but found %s", base.type);
    }
    return (Type.Array) base.type;
  }

  @Override
  public Expression visitCallExpression(CallExpressionContext ctx) {
    ExpressionContext callee = ctx.expression(0);
    List<ExpressionContext> argCtxs = ctx.expression().subList(1, ctx.expression().size());
    Expression.CallKind kind;
    Function fn;
    Expression receiver = null;
    Assignee writeBack = null;
    if (callee instanceof PrimaryExpressionContext
        && ((PrimaryExpressionContext) callee).primary() instanceof IdentifierContext) {
      String name = callee.getText();
      fn = symbols.function(name);
      if (fn == null) {
        if (scope.lookup(name) != null) {
          throw error(callee, ErrorKind.INVALID_CALL, "'%s' is not a function", name);
        }
        throw error(callee, ErrorKind.UNRESOLVED_IDENTIFIER, "Unknown function '%s'", name);
      }
      kind = Expression.CallKind.FUNCTION;
    } else if (callee instanceof MemberAccessContext) {
      MemberAccessContext access = (MemberAccessContext) callee;
      receiver = resolve(access.expression(), null);
      Circuit circuit = asCircuit(access.expression(), receiver);
      String name = access.LOWER_ID().getText();
      fn = circuit.function(name);
      if (fn == null) {
        throw error(
            callee,
            ErrorKind.UNRESOLVED_IDENTIFIER,
            "Circuit '%s' has no function '%s'",
            circuit.name,
            name);
      } else if (fn.isStatic()) {
        throw error(
            callee,
            ErrorKind.INVALID_CALL,
            "'%s' is a static function; call it as %s::%s()",
            name,
            circuit.name,
            name);
      }
      if (fn.receiver == Function.Receiver.MUT_SELF) {
        writeBack = placeOf(receiver);
        if (writeBack != null && !writeBack.root.mutable) {
          throw Compiler.cannotAssign(
              currentSpan(), access.expression().getText(), writeBack.root.name);
        }
      } else if (fn.receiver == Function.Receiver.CONST_SELF && !receiver.isConstant()) {
        throw error(
            access.expression(),
            ErrorKind.NON_CONSTANT_ARGUMENT,
            "'%s' requires a constant receiver",
            fn);
      }
      kind = Expression.CallKind.METHOD;
    } else if (callee instanceof StaticAccessContext) {
      StaticAccessContext access = (StaticAccessContext) callee;
      ExpressionContext target = access.expression();
      if (!(target instanceof PrimaryExpressionContext
          && ((PrimaryExpressionContext) target).primary() instanceof TypeReferenceContext)) {
        throw error(target, ErrorKind.TYPE_MISMATCH, "Expected a circuit name");
      }
      PrimaryContext typeName = ((PrimaryExpressionContext) target).primary();
      Circuit circuit = circuitNamed(((TypeReferenceContext) typeName).name);
      String name = access.LOWER_ID().getText();
      fn = circuit.function(name);
      if (fn == null) {
        throw error(
            callee,
            ErrorKind.UNRESOLVED_IDENTIFIER,
            "Circuit '%s' has no function '%s'",
            circuit.name,
            name);
      } else if (!fn.isStatic()) {
        throw error(
            callee,
            ErrorKind.INVALID_CALL,
            "'%s' must be called on an instance of %s",
            name,
            circuit.name);
      }
      kind = Expression.CallKind.STATIC;
    } else {
      throw error(callee, ErrorKind.INVALID_CALL, "Expression is not callable");
    }
    if (argCtxs.size() != fn.params.size()) {
      throw error(
          ErrorKind.WRONG_ARITY,
          "'%s' expects %s arguments but got %s",
          fn,
          fn.params.size(),
          argCtxs.size());
    }
    ImmutableList.Builder<Expression> args = ImmutableList.builder();
    for (int i = 0; i < argCtxs.size(); i++) {
      Variable param = fn.params.get(i);
      Expression arg = expect(argCtxs.get(i), param.type);
      if (param.constant && !arg.isConstant()) {
        throw error(
            argCtxs.get(i),
            ErrorKind.NON_CONSTANT_ARGUMENT,
            "Argument for const parameter '%s' must be a compile-time constant",
            param.name);
      }
      args.add(arg);
    }
    callees.add(fn);
    return new Expression.Call(kind, fn, receiver, args.build(), writeBack, currentSpan());
  }

  /**
   * If {@code expr} is a variable, or a member, element or range of one, returns it as an
   * Assignee; otherwise returns null.
   */
  private static @Nullable Assignee placeOf(Expression expr) {
    List<Assignee.Access> accesses = new ArrayList<>();
    Expression e = expr;
    while (!(e instanceof Expression.VariableRef)) {
      if (e instanceof Expression.MemberAccess) {
        Expression.MemberAccess member = (Expression.MemberAccess) e;
        accesses.add(Assignee.Access.member(member.index));
        e = member.base;
      } else if (e instanceof Expression.TupleAccess) {
        Expression.TupleAccess tuple = (Expression.TupleAccess) e;
        accesses.add(Assignee.Access.tupleIndex(tuple.index));
        e = tuple.tuple;
      } else if (e instanceof Expression.ArrayAccess) {
        Expression.ArrayAccess element = (Expression.ArrayAccess) e;
        accesses.add(Assignee.Access.arrayIndex(element.index));
        e = element.array;
      } else if (e instanceof Expression.ArrayRangeAccess) {
        Expression.ArrayRangeAccess range = (Expression.ArrayRangeAccess) e;
        accesses.add(Assignee.Access.arrayRange(range.from, range.to));
        e = range.array;
      } else {
        return null;
      }
    }
    // We walked from the outermost access inwards.
    Collections.reverse(accesses);
    return new Assignee(
        ((Expression.VariableRef) e).variable,
        ImmutableList.copyOf(accesses),
        expr.type,
        expr.span);
  }

  @Override
  public Expression visitCastExpression(CastExpressionContext ctx) {
    Type target = new TypeResolver(symbols, owner()).resolve(ctx.type());
    Expression operand = resolve(ctx.expression(), null);
    if (!operand.type.isInteger() || !(target.isInteger() || target.equals(Type.FIELD))) {
      throw error(ErrorKind.TYPE_MISMATCH, "Cannot cast %s to %s", operand.type, target);
    }
    return new Expression.Cast(target, operand, currentSpan());
  }

  @Override
  public Expression visitUnaryExpression(UnaryExpressionContext ctx) {
    if (ctx.op.getType() != TokenType.MINUS) {
      Expression operand = expect(ctx.expression(), Type.BOOLEAN);
      return new Expression.Unary(Expression.UnaryOp.NOT, operand, currentSpan());
    }
    IntegerLiteralContext literal = directIntegerLiteral(ctx.expression());
    if (literal != null) {
      return integerLiteral(literal, true, currentSpan());
    }
    Expression operand = resolve(ctx.expression(), expected);
    Type type = operand.type;
    boolean ok =
        type.equals(Type.FIELD)
            || type.equals(Type.GROUP)
            || (type.isInteger() && type.asInteger().signed);
    if (!ok) {
      throw error(ErrorKind.TYPE_MISMATCH, "Cannot negate a value of type %s", type);
    }
    return new Expression.Unary(Expression.UnaryOp.NEGATE, operand, currentSpan());
  }

  @Override
  public Expression visitBinaryExpression(BinaryExpressionContext ctx) {
    BinaryOp op = BinaryOp.fromSymbol(ctx.op.getText());
    if (op.isLogical()) {
      Expression left = expect(ctx.left, Type.BOOLEAN);
      Expression right = expect(ctx.right, Type.BOOLEAN);
      return new Expression.Binary(Type.BOOLEAN, op, left, right, currentSpan());
    }
    Expression[] operands = resolvePair(ctx.left, ctx.right, op.isArithmetic() ? expected : null);
    Expression left = operands[0];
    Expression right = operands[1];
    if (op == BinaryOp.MUL && isGroupScaling(left.type, right.type)) {
      return new Expression.Binary(Type.GROUP, op, left, right, currentSpan());
    }
    if (!left.type.equals(right.type)) {
      throw error(
          ErrorKind.TYPE_MISMATCH,
          "Operands of '%s' must have the same type, found %s and %s",
          op.symbol,
          left.type,
          right.type);
    }
    Type type = left.type;
    if (op.isArithmetic()) {
      checkArithmetic(op, type, currentSpan());
      return new Expression.Binary(type, op, left, right, currentSpan());
    } else if (op.isOrdering() && !type.isOrdered()) {
      throw error(ErrorKind.TYPE_MISMATCH, "'%s' is not defined for %s", op.symbol, type);
    }
    return new Expression.Binary(Type.BOOLEAN, op, left, right, currentSpan());
  }

  /** True if {@code a * b} is a scalar multiplication of a group element. */
  static boolean isGroupScaling(Type a, Type b) {
    return (a.equals(Type.GROUP) && isUnsigned(b)) || (b.equals(Type.GROUP) && isUnsigned(a));
  }

  private static boolean isUnsigned(Type type) {
    return type.isInteger() && !type.asInteger().signed;
  }

  /** Throws if the arithmetic operator is not defined for values of the given type. */
  static void checkArithmetic(BinaryOp op, Type type, Span span) {
    boolean ok;
    switch (type.kind()) {
      case INTEGER:
        ok = true;
        break;
      case FIELD:
        ok = op != BinaryOp.POW;
        break;
      case GROUP:
        ok = op == BinaryOp.ADD || op == BinaryOp.SUB;
        break;
      default:
        ok = false;
    }
    if (!ok) {
      throw Compiler.error(
          ErrorKind.TYPE_MISMATCH, span, "'%s' is not defined for %s", op.symbol, type);
    }
  }

  /**
   * Resolves two operands that should have the same type. If only the first is an unsuffixed
   * literal and there is no expected type, the second is resolved first and its type used for the
   * first.
   */
  private Expression[] resolvePair(
      ExpressionContext first, ExpressionContext second, @Nullable Type hint) {
    Expression a;
    Expression b;
    if (hint == null && isUntyped(first) && !isUntyped(second)) {
      b = resolve(second, null);
      a = resolve(first, b.type);
    } else {
      a = resolve(first, hint);
      b = resolve(second, (hint != null) ? hint : a.type);
    }
    return new Expression[] {a, b};
  }

  @Override
  public Expression visitTernaryExpression(TernaryExpressionContext ctx) {
    Expression condition = expect(ctx.expression(0), Type.BOOLEAN);
    Expression[] branches = resolvePair(ctx.expression(1), ctx.expression(2), expected);
    if (!branches[0].type.equals(branches[1].type)) {
      throw Compiler.typeMismatch(span(ctx.expression(2)), branches[0].type, branches[1].type);
    }
    return new Expression.Ternary(condition, branches[0], branches[1], currentSpan());
  }
}
