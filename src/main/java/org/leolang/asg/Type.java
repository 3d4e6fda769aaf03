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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The type of a value. Types are compared structurally, except for circuit types which are equal
 * only if they refer to the same declaration.
 */
public abstract class Type {

  public enum Kind {
    BOOLEAN,
    INTEGER,
    FIELD,
    GROUP,
    ADDRESS,
    TUPLE,
    ARRAY,
    CIRCUIT
  }

  public static final Type BOOLEAN = new Primitive(Kind.BOOLEAN, "bool");
  public static final Type FIELD = new Primitive(Kind.FIELD, "field");
  public static final Type GROUP = new Primitive(Kind.GROUP, "group");
  public static final Type ADDRESS = new Primitive(Kind.ADDRESS, "address");

  /** The empty tuple; the result type of functions that don't declare one. */
  public static final Tuple UNIT = new Tuple(ImmutableList.of());

  private static final ImmutableMap<IntegerType, Int> INTEGERS;

  static {
    Map<IntegerType, Int> integers = new EnumMap<>(IntegerType.class);
    for (IntegerType t : IntegerType.values()) {
      integers.put(t, new Int(t));
    }
    INTEGERS = Maps.immutableEnumMap(integers);
  }

  private Type() {}

  public abstract Kind kind();

  public static Int integer(IntegerType integerType) {
    return INTEGERS.get(integerType);
  }

  /**
   * Returns a tuple type with the given elements. Tuples of exactly one element are not
   * representable; callers must check the arity first.
   */
  public static Tuple tuple(List<Type> elements) {
    Preconditions.checkArgument(elements.size() != 1, "Tuples may not have exactly one element");
    return elements.isEmpty() ? UNIT : new Tuple(ImmutableList.copyOf(elements));
  }

  public static Array array(Type element, int length) {
    return new Array(element, length);
  }

  public boolean isInteger() {
    return kind() == Kind.INTEGER;
  }

  /** Returns the integer type if this is an integer, or throws. */
  public IntegerType asInteger() {
    return ((Int) this).integerType;
  }

  /** True if arithmetic operators ({@code + - * /}) apply to values of this type. */
  public boolean isArithmetic() {
    Kind kind = kind();
    return kind == Kind.INTEGER || kind == Kind.FIELD || kind == Kind.GROUP;
  }

  /** True if ordering comparisons ({@code < <= > >=}) apply to values of this type. */
  public boolean isOrdered() {
    Kind kind = kind();
    return kind == Kind.INTEGER || kind == Kind.FIELD || kind == Kind.BOOLEAN;
  }

  static final class Primitive extends Type {
    private final Kind kind;
    private final String name;

    Primitive(Kind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A fixed-width integer type. There is only one instance for each {@link IntegerType}. */
  public static final class Int extends Type {
    public final IntegerType integerType;

    private Int(IntegerType integerType) {
      this.integerType = integerType;
    }

    @Override
    public Kind kind() {
      return Kind.INTEGER;
    }

    @Override
    public String toString() {
      return integerType.keyword();
    }
  }

  public static final class Tuple extends Type {
    public final ImmutableList<Type> elements;

    private Tuple(ImmutableList<Type> elements) {
      this.elements = elements;
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Tuple && ((Tuple) obj).elements.equals(elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public String toString() {
      return elements.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /** A fixed-length array. Multi-dimensional arrays are arrays of arrays. */
  public static final class Array extends Type {
    public final Type element;
    public final int length;

    private Array(Type element, int length) {
      Preconditions.checkArgument(length >= 0);
      this.element = element;
      this.length = length;
    }

    @Override
    public Kind kind() {
      return Kind.ARRAY;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Array)) {
        return false;
      }
      Array other = (Array) obj;
      return length == other.length && element.equals(other.element);
    }

    @Override
    public int hashCode() {
      return element.hashCode() * 31 + length;
    }

    @Override
    public String toString() {
      return String.format("[%s; %s]", element, length);
    }
  }

  /**
   * A reference to a circuit declaration by its index in a {@link DeclarationArena}. The circuit
   * itself is only looked up when needed, which allows a circuit's members and functions to refer
   * to its own type.
   */
  public static final class CircuitRef extends Type {
    final DeclarationArena arena;
    public final int index;

    CircuitRef(DeclarationArena arena, int index) {
      this.arena = arena;
      this.index = index;
    }

    @Override
    public Kind kind() {
      return Kind.CIRCUIT;
    }

    public Circuit circuit() {
      return arena.circuit(index);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof CircuitRef)) {
        return false;
      }
      CircuitRef other = (CircuitRef) obj;
      return arena == other.arena && index == other.index;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(arena) * 31 + index;
    }

    @Override
    public String toString() {
      return circuit().name;
    }
  }
}
