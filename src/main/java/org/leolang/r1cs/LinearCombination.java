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

package org.leolang.r1cs;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * An immutable sum of a constant and field-multiples of wires. A linear combination with no wire
 * terms is a compile-time constant and costs nothing in the constraint system.
 */
public final class LinearCombination {
  public static final LinearCombination ZERO = constant(BigInteger.ZERO);
  public static final LinearCombination ONE = constant(BigInteger.ONE);

  /** Wire terms with non-zero, reduced coefficients, in wire order. */
  private final ImmutableSortedMap<Wire, BigInteger> terms;

  private final BigInteger constant;

  private LinearCombination(ImmutableSortedMap<Wire, BigInteger> terms, BigInteger constant) {
    this.terms = terms;
    this.constant = constant;
  }

  public static LinearCombination constant(BigInteger value) {
    return new LinearCombination(ImmutableSortedMap.of(), Fr.reduce(value));
  }

  public static LinearCombination constant(long value) {
    return constant(BigInteger.valueOf(value));
  }

  public static LinearCombination of(Wire wire) {
    return new LinearCombination(ImmutableSortedMap.of(wire, BigInteger.ONE), BigInteger.ZERO);
  }

  public boolean isConstant() {
    return terms.isEmpty();
  }

  /** Returns the value of a constant linear combination. */
  public BigInteger constantValue() {
    Preconditions.checkState(isConstant(), "Not a constant: %s", this);
    return constant;
  }

  public ImmutableSortedMap<Wire, BigInteger> terms() {
    return terms;
  }

  public BigInteger constantTerm() {
    return constant;
  }

  public LinearCombination add(LinearCombination other) {
    if (other.isConstant() && other.constant.signum() == 0) {
      return this;
    }
    TreeMap<Wire, BigInteger> sum = new TreeMap<>(terms);
    for (Map.Entry<Wire, BigInteger> term : other.terms.entrySet()) {
      BigInteger coeff = Fr.add(sum.getOrDefault(term.getKey(), BigInteger.ZERO), term.getValue());
      if (coeff.signum() == 0) {
        sum.remove(term.getKey());
      } else {
        sum.put(term.getKey(), coeff);
      }
    }
    return new LinearCombination(
        ImmutableSortedMap.copyOfSorted(sum), Fr.add(constant, other.constant));
  }

  public LinearCombination add(BigInteger value) {
    return new LinearCombination(terms, Fr.add(constant, value));
  }

  public LinearCombination subtract(LinearCombination other) {
    return add(other.negate());
  }

  public LinearCombination negate() {
    return scale(BigInteger.ONE.negate());
  }

  public LinearCombination scale(BigInteger factor) {
    BigInteger f = Fr.reduce(factor);
    if (f.signum() == 0) {
      return ZERO;
    }
    ImmutableSortedMap.Builder<Wire, BigInteger> scaled = ImmutableSortedMap.naturalOrder();
    terms.forEach((wire, coeff) -> scaled.put(wire, Fr.multiply(coeff, f)));
    return new LinearCombination(scaled.build(), Fr.multiply(constant, f));
  }

  public LinearCombination scale(long factor) {
    return scale(BigInteger.valueOf(factor));
  }

  /** Evaluates this linear combination given the values of its wires. */
  public BigInteger evaluate(Function<Wire, BigInteger> wireValues) {
    BigInteger result = constant;
    for (Map.Entry<Wire, BigInteger> term : terms.entrySet()) {
      result = result.add(term.getValue().multiply(wireValues.apply(term.getKey())));
    }
    return Fr.reduce(result);
  }

  /** True if any term refers to a diagnostic wire. */
  boolean isDiagnostic() {
    return terms.keySet().stream().anyMatch(w -> w.diagnostic);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LinearCombination)) {
      return false;
    }
    LinearCombination other = (LinearCombination) obj;
    return constant.equals(other.constant) && terms.equals(other.terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode() * 31 + constant.hashCode();
  }

  /** Returns e.g. {@code "5 + 2*w3(x) + w4(y)"}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (constant.signum() != 0 || terms.isEmpty()) {
      sb.append(constant);
    }
    terms.forEach(
        (wire, coeff) -> {
          if (sb.length() > 0) {
            sb.append(" + ");
          }
          if (!coeff.equals(BigInteger.ONE)) {
            sb.append(coeff).append('*');
          }
          sb.append(wire);
        });
    return sb.toString();
  }
}
