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

package org.leolang.synth;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Map;
import java.util.function.Function;
import org.leolang.asg.Circuit;
import org.leolang.asg.IntegerType;
import org.leolang.asg.Type;
import org.leolang.gadgets.Bech32;
import org.leolang.gadgets.Bit;
import org.leolang.gadgets.GroupElement;
import org.leolang.gadgets.IntegerGadgets;
import org.leolang.r1cs.LinearCombination;

/**
 * The value of an expression during synthesis: a tree whose leaves are linear combinations. A
 * value is constant if all of its leaves are.
 */
public abstract class Value {

  private Value() {}

  public abstract Type type();

  public abstract boolean isConstant();

  /**
   * Adds this value's scalar leaves to {@code leaves}, keyed by their paths below {@code path}
   * (e.g. {@code "p.x"}, {@code "a[1]"}).
   */
  abstract void addLeaves(String path, Map<String, LinearCombination> leaves);

  /** Renders this value as Leo source text, using {@code eval} to find the leaf values. */
  abstract String format(Function<LinearCombination, BigInteger> eval);

  /** Renders a constant value as Leo source text. */
  @Override
  public String toString() {
    return isConstant() ? format(LinearCombination::constantValue) : "<" + type() + ">";
  }

  static Bool bool(Bit bit) {
    return new Bool(bit);
  }

  static Int integer(IntegerType type, LinearCombination lc) {
    return new Int(type, lc);
  }

  static Field field(LinearCombination lc) {
    return new Field(lc);
  }

  static Group group(GroupElement point) {
    return new Group(point);
  }

  static final Tuple UNIT = new Tuple(Type.UNIT, ImmutableList.of());

  static final class Bool extends Value {
    final Bit bit;

    Bool(Bit bit) {
      this.bit = bit;
    }

    @Override
    public Type type() {
      return Type.BOOLEAN;
    }

    @Override
    public boolean isConstant() {
      return bit.isConstant();
    }

    @Override
    void addLeaves(String path, Map<String, LinearCombination> leaves) {
      leaves.put(path, bit.lc());
    }

    @Override
    String format(Function<LinearCombination, BigInteger> eval) {
      return String.valueOf(eval.apply(bit.lc()).signum() != 0);
    }
  }

  static final class Int extends Value {
    final IntegerType integerType;
    final LinearCombination lc;

    Int(IntegerType integerType, LinearCombination lc) {
      this.integerType = integerType;
      this.lc = lc;
    }

    @Override
    public Type type() {
      return Type.integer(integerType);
    }

    @Override
    public boolean isConstant() {
      return lc.isConstant();
    }

    BigInteger constantValue() {
      return IntegerGadgets.constantValue(lc, integerType);
    }

    @Override
    void addLeaves(String path, Map<String, LinearCombination> leaves) {
      leaves.put(path, lc);
    }

    @Override
    String format(Function<LinearCombination, BigInteger> eval) {
      return IntegerGadgets.decode(eval.apply(lc), integerType) + integerType.keyword();
    }
  }

  static final class Field extends Value {
    final LinearCombination lc;

    Field(LinearCombination lc) {
      this.lc = lc;
    }

    @Override
    public Type type() {
      return Type.FIELD;
    }

    @Override
    public boolean isConstant() {
      return lc.isConstant();
    }

    @Override
    void addLeaves(String path, Map<String, LinearCombination> leaves) {
      leaves.put(path, lc);
    }

    @Override
    String format(Function<LinearCombination, BigInteger> eval) {
      return eval.apply(lc) + "field";
    }
  }

  static final class Group extends Value {
    final GroupElement point;

    Group(GroupElement point) {
      this.point = point;
    }

    @Override
    public Type type() {
      return Type.GROUP;
    }

    @Override
    public boolean isConstant() {
      return point.isConstant();
    }

    @Override
    void addLeaves(String path, Map<String, LinearCombination> leaves) {
      leaves.put(path + ".x", point.x);
      leaves.put(path + ".y", point.y);
    }

    @Override
    String format(Function<LinearCombination, BigInteger> eval) {
      return "(" + eval.apply(point.x) + ", " + eval.apply(point.y) + ")group";
    }
  }

  /** An address, as two 128-bit limbs. */
  static final class Address extends Value {
    final LinearCombination high;
    final LinearCombination low;

    Address(LinearCombination high, LinearCombination low) {
      this.high = high;
      this.low = low;
    }

    @Override
    public Type type() {
      return Type.ADDRESS;
    }

    @Override
    public boolean isConstant() {
      return high.isConstant() && low.isConstant();
    }

    @Override
    void addLeaves(String path, Map<String, LinearCombination> leaves) {
      leaves.put(path + ".high", high);
      leaves.put(path + ".low", low);
    }

    @Override
    String format(Function<LinearCombination, BigInteger> eval) {
      return Bech32.encodeAddress(eval.apply(high), eval.apply(low));
    }
  }

  /** The common representation of tuples, arrays and circuit instances. */
  abstract static class Aggregate extends Value {
    final ImmutableList<Value> elements;

    Aggregate(ImmutableList<Value> elements) {
      this.elements = elements;
    }

    @Override
    public boolean isConstant() {
      return elements.stream().allMatch(Value::isConstant);
    }

    /** Returns a value of the same type with different elements. */
    abstract Aggregate withElements(ImmutableList<Value> newElements);

    /** Returns the path of element {@code i} below {@code path}. */
    abstract String elementPath(String path, int i);

    @Override
    void addLeaves(String path, Map<String, LinearCombination> leaves) {
      for (int i = 0; i < elements.size(); i++) {
        elements.get(i).addLeaves(elementPath(path, i), leaves);
      }
    }

    String formatElements(Function<LinearCombination, BigInteger> eval) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(elements.get(i).format(eval));
      }
      return sb.toString();
    }
  }

  static final class Tuple extends Aggregate {
    final Type.Tuple type;

    Tuple(Type.Tuple type, ImmutableList<Value> elements) {
      super(elements);
      Preconditions.checkArgument(type.elements.size() == elements.size());
      this.type = type;
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    Aggregate withElements(ImmutableList<Value> newElements) {
      return new Tuple(type, newElements);
    }

    @Override
    String elementPath(String path, int i) {
      return path + "." + i;
    }

    @Override
    String format(Function<LinearCombination, BigInteger> eval) {
      return "(" + formatElements(eval) + ")";
    }
  }

  static final class Array extends Aggregate {
    final Type.Array type;

    Array(Type.Array type, ImmutableList<Value> elements) {
      super(elements);
      Preconditions.checkArgument(type.length == elements.size());
      this.type = type;
    }

    @Override
    public Type type() {
      return type;
    }

    @Override
    Aggregate withElements(ImmutableList<Value> newElements) {
      return new Array(Type.array(type.element, newElements.size()), newElements);
    }

    @Override
    String elementPath(String path, int i) {
      return path + "[" + i + "]";
    }

    @Override
    String format(Function<LinearCombination, BigInteger> eval) {
      return "[" + formatElements(eval) + "]";
    }
  }

  /** An instance of a circuit; the elements are the members in declaration order. */
  static final class CircuitValue extends Aggregate {
    final Circuit circuit;

    CircuitValue(Circuit circuit, ImmutableList<Value> members) {
      super(members);
      this.circuit = circuit;
    }

    @Override
    public Type type() {
      return circuit.type();
    }

    @Override
    Aggregate withElements(ImmutableList<Value> newElements) {
      return new CircuitValue(circuit, newElements);
    }

    private String memberName(int i) {
      return circuit.members().keySet().asList().get(i);
    }

    @Override
    String elementPath(String path, int i) {
      return path + "." + memberName(i);
    }

    @Override
    String format(Function<LinearCombination, BigInteger> eval) {
      StringBuilder sb = new StringBuilder(circuit.name).append(" { ");
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(memberName(i)).append(": ").append(elements.get(i).format(eval));
      }
      return sb.append(" }").toString();
    }
  }
}
