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

package org.leolang.gadgets;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.Fr;
import org.leolang.r1cs.LinearCombination;
import org.leolang.r1cs.Wire;

/** Gadgets over raw field elements: equality, inversion, bit decomposition and comparison. */
public final class FieldGadgets {

  /** The little-endian bits of the field modulus. */
  private static final ImmutableList<Bit> MODULUS_BITS = constantBits(Fr.MODULUS, Fr.BITS);

  // Statics only
  private FieldGadgets() {}

  /**
   * Returns a bit that is one iff {@code x} is zero. Uses the usual pair of constraints {@code x *
   * inv = 1 - out} and {@code x * out = 0}, which also force {@code out} to be boolean.
   */
  public static Bit isZero(ConstraintSystem cs, LinearCombination x) {
    if (x.isConstant()) {
      return Bit.constant(x.constantValue().signum() == 0);
    }
    LinearCombination inv = cs.auxiliary("isZero.inv", ev -> Fr.inverse(ev.value(x)));
    LinearCombination out =
        cs.auxiliary("isZero.out", ev -> Bit.toField(ev.value(x).signum() == 0));
    cs.enforce("isZero.inv", x, inv, LinearCombination.ONE.subtract(out));
    cs.enforce("isZero.out", x, out, LinearCombination.ZERO);
    return Bit.trusted(out);
  }

  public static Bit isEqual(ConstraintSystem cs, LinearCombination a, LinearCombination b) {
    return isZero(cs, a.subtract(b));
  }

  /**
   * Returns the inverse of {@code x}; the constraint {@code x * inv = 1} is unsatisfiable if
   * {@code x} is zero.
   *
   * @throws GadgetException if {@code x} is the constant zero
   */
  public static LinearCombination inverse(ConstraintSystem cs, LinearCombination x) {
    if (x.isConstant()) {
      if (x.constantValue().signum() == 0) {
        throw new GadgetException(GadgetException.Reason.DIVISION_BY_ZERO, "Division by zero");
      }
      return LinearCombination.constant(Fr.inverse(x.constantValue()));
    }
    LinearCombination inv = cs.auxiliary("inverse", ev -> Fr.inverse(ev.value(x)));
    cs.enforce("inverse", x, inv, LinearCombination.ONE);
    return inv;
  }

  /** Returns {@code a / b} in the field. */
  public static LinearCombination divide(
      ConstraintSystem cs, LinearCombination a, LinearCombination b) {
    LinearCombination inv = inverse(cs, b);
    if (a.isConstant() || b.isConstant()) {
      return cs.multiply("divide", a, inv);
    }
    LinearCombination quotient = cs.auxiliary("divide", ev -> Fr.divide(ev.value(a), ev.value(b)));
    cs.enforce("divide", b, quotient, a);
    return quotient;
  }

  /**
   * Decomposes {@code x} into {@code n} little-endian bits, constraining their weighted sum to
   * equal {@code x}. This is also a range check: the constraints are only satisfiable if {@code 0
   * <= x < 2^n}.
   */
  public static ImmutableList<Bit> toBits(
      ConstraintSystem cs, String name, LinearCombination x, int n) {
    if (x.isConstant()) {
      Preconditions.checkArgument(
          x.constantValue().bitLength() <= n, "%s needs more than %s bits", x, n);
      return constantBits(x.constantValue(), n);
    }
    ImmutableList.Builder<Bit> bits = ImmutableList.builder();
    LinearCombination sum = LinearCombination.ZERO;
    for (int i = 0; i < n; i++) {
      int bit = i;
      Bit b =
          Bit.allocate(
              cs,
              name + ".bit" + i,
              Wire.Visibility.AUXILIARY,
              ev -> Bit.toField(ev.value(x).testBit(bit)));
      bits.add(b);
      sum = sum.add(b.lc().scale(BigInteger.ONE.shiftLeft(i)));
    }
    cs.enforceEqual(name + ".pack", sum, x);
    return bits.build();
  }

  /** Returns the little-endian bits of a non-negative constant. */
  public static ImmutableList<Bit> constantBits(BigInteger value, int n) {
    ImmutableList.Builder<Bit> bits = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      bits.add(Bit.constant(value.testBit(i)));
    }
    return bits.build();
  }

  /** Returns the weighted sum of little-endian bits. */
  public static LinearCombination fromBits(List<Bit> bits) {
    LinearCombination sum = LinearCombination.ZERO;
    for (int i = 0; i < bits.size(); i++) {
      sum = sum.add(bits.get(i).lc().scale(BigInteger.ONE.shiftLeft(i)));
    }
    return sum;
  }

  /**
   * Returns a bit that is one iff the unsigned number with little-endian bits {@code a} is less
   * than the one with bits {@code b}. The bits are compared from the most significant down.
   */
  public static Bit lessThan(ConstraintSystem cs, List<Bit> a, List<Bit> b) {
    Preconditions.checkArgument(a.size() == b.size());
    Bit less = Bit.FALSE;
    Bit equal = Bit.TRUE;
    for (int i = a.size() - 1; i >= 0; i--) {
      Bit ai = a.get(i);
      Bit bi = b.get(i);
      less = less.or(cs, equal.and(cs, ai.not().and(cs, bi)));
      if (i > 0) {
        equal = equal.and(cs, ai.xor(cs, bi).not());
      }
    }
    return less;
  }

  /**
   * Decomposes {@code x} into the bits of its canonical representative in {@code [0, MODULUS)}.
   * A plain {@link #toBits} with {@link Fr#BITS} bits would also accept {@code x + MODULUS} for
   * small {@code x}.
   */
  public static ImmutableList<Bit> canonicalBits(ConstraintSystem cs, LinearCombination x) {
    ImmutableList<Bit> bits = toBits(cs, "canonical", x, Fr.BITS);
    if (!x.isConstant()) {
      Bit canonical = lessThan(cs, bits, MODULUS_BITS);
      cs.enforceEqual("canonical.lt", canonical.lc(), LinearCombination.ONE);
    }
    return bits;
  }

  /** Returns a bit that is one iff {@code a < b}, comparing canonical field representatives. */
  public static Bit lessThan(ConstraintSystem cs, LinearCombination a, LinearCombination b) {
    if (a.isConstant() && b.isConstant()) {
      return Bit.constant(a.constantValue().compareTo(b.constantValue()) < 0);
    }
    return lessThan(cs, canonicalBits(cs, a), canonicalBits(cs, b));
  }
}
