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
import java.util.List;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jspecify.annotations.Nullable;
import org.leolang.asg.Circuit;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.IntegerType;
import org.leolang.asg.Type;
import org.leolang.compiler.LeoParser.ArrayTypeContext;
import org.leolang.compiler.LeoParser.CircuitTypeContext;
import org.leolang.compiler.LeoParser.DimensionsContext;
import org.leolang.compiler.LeoParser.ScalarTypeContext;
import org.leolang.compiler.LeoParser.SelfTypeContext;
import org.leolang.compiler.LeoParser.TupleTypeContext;
import org.leolang.compiler.LeoParser.TypeContext;

/** Resolves type syntax to Types. */
class TypeResolver extends VisitorBase<Type> {
  private final Symbols symbols;

  /** The circuit that {@code Self} refers to, or null outside of a circuit. */
  private final @Nullable Circuit self;

  TypeResolver(Symbols symbols, @Nullable Circuit self) {
    super(symbols.path);
    this.symbols = symbols;
    this.self = self;
  }

  Type resolve(TypeContext ctx) {
    return visit(ctx);
  }

  @Override
  public Type visitScalarType(ScalarTypeContext ctx) {
    String keyword = ctx.getText();
    switch (keyword) {
      case "bool":
        return Type.BOOLEAN;
      case "field":
        return Type.FIELD;
      case "group":
        return Type.GROUP;
      case "address":
        return Type.ADDRESS;
      default:
        return Type.integer(IntegerType.fromKeyword(keyword));
    }
  }

  @Override
  public Type visitSelfType(SelfTypeContext ctx) {
    if (self == null) {
      throw error(ErrorKind.UNRESOLVED_IDENTIFIER, "'Self' is only valid inside a circuit");
    }
    return self.type();
  }

  @Override
  public Type visitCircuitType(CircuitTypeContext ctx) {
    String name = ctx.UPPER_ID().getText();
    Circuit circuit = symbols.circuit(name);
    if (circuit == null) {
      throw error(ErrorKind.UNRESOLVED_IDENTIFIER, "Unknown circuit '%s'", name);
    }
    return circuit.type();
  }

  @Override
  public Type visitTupleType(TupleTypeContext ctx) {
    List<TypeContext> elements = ctx.type();
    if (elements.size() == 1) {
      throw error(
          ErrorKind.INVALID_TUPLE_ARITY, "Tuples must have zero or at least two elements");
    }
    return Type.tuple(elements.stream().map(this::visit).collect(ImmutableList.toImmutableList()));
  }

  @Override
  public Type visitArrayType(ArrayTypeContext ctx) {
    Type element = visit(ctx.type());
    List<Integer> dims = dimensions(ctx.dimensions(), path);
    // [T; (2, 3)] is an array of 2 arrays of 3 Ts
    for (int i = dims.size() - 1; i >= 0; i--) {
      element = Type.array(element, dims.get(i));
    }
    return element;
  }

  /** Returns the lengths listed in an array type or array initializer, outermost first. */
  static ImmutableList<Integer> dimensions(DimensionsContext ctx, String path) {
    return ctx.INTEGER().stream()
        .map(n -> natural(n, path))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns the value of an INTEGER token that is used as an array length or tuple index; these
   * must be written without a type suffix.
   */
  static int natural(TerminalNode integer, String path) {
    String text = integer.getText();
    if (!text.chars().allMatch(Character::isDigit)) {
      throw Compiler.error(
          ErrorKind.INVALID_LITERAL,
          Compiler.span(integer.getSymbol(), path),
          "Expected a natural number without a type suffix, found '%s'",
          text);
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw Compiler.error(
          ErrorKind.LITERAL_OUT_OF_RANGE,
          Compiler.span(integer.getSymbol(), path),
          "'%s' is too large",
          text);
    }
  }
}
