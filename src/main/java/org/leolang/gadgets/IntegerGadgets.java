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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import org.leolang.asg.IntegerType;
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.Fr;
import org.leolang.r1cs.LinearCombination;

/**
 * Arithmetic on fixed-width integers. An integer is represented by a single field element: an
 * unsigned value as itself, a negative signed value {@code v} as {@code MODULUS + v}. Every
 * operation on non-constant operands range-checks its result by decomposing it into bits, so that
 * overflow makes the constraint system unsatisfiable; operations on constants are folded and
 * report overflow immediately.
 *
 * <p>Products of 128-bit operands can exceed the field modulus, so they are computed from 64-bit
 * limbs.
 */
public final class IntegerGadgets {
  private static final int LIMB_BITS = 64;

  // Statics only
  private IntegerGadgets() {}

  /** Returns the integer value encoded by a field element. */
  public static BigInteger decode(BigInteger element, IntegerType type) {
    return type.signed ? Fr.toSigned(element) : Fr.reduce(element);
  }

  /** Returns the constant value of {@code x} as an integer of the given type. */
  public static BigInteger constantValue(LinearCombination x, IntegerType type) {
    return decode(x.constantValue(), type);
  }

  private static BigInteger offset(IntegerType type) {
    return type.signed ? BigInteger.ONE.shiftLeft(type.bits - 1) : BigInteger.ZERO;
  }

  /** Returns {@code value} as a constant, or throws if it is not representable. */
  private static LinearCombination fold(BigInteger value, IntegerType type) {
    if (!type.contains(value)) {
      throw new GadgetException(
          GadgetException.Reason.OVERFLOW, "Integer overflow: %s does not fit in %s", value, type);
    }
    return LinearCombination.constant(value);
  }

  /**
   * Constrains {@code x} to be a valid encoding of a value of the given type, and returns the
   * little-endian bits of {@code x + 2^(bits-1)} (for signed types) or {@code x} (for unsigned
   * types). Those bits order the same way as the values they encode.
   */
  public static ImmutableList<Bit> rangeCheck(
      ConstraintSystem cs, String name, LinearCombination x, IntegerType type) {
    if (x.isConstant()) {
      BigInteger value = constantValue(x, type);
      fold(value, type);
      return FieldGadgets.constantBits(value.add(offset(type)), type.bits);
    }
    return FieldGadgets.toBits(cs, name + ".range", x.add(offset(type)), type.bits);
  }

  /** Returns a bit that is one iff the signed value {@code x} is negative. */
  private static Bit isNegative(ConstraintSystem cs, LinearCombination x, IntegerType type) {
    if (!type.signed) {
      return Bit.FALSE;
    }
    return rangeCheck(cs, "sign", x, type).get(type.bits - 1).not();
  }

  public static LinearCombination add(
      ConstraintSystem cs, IntegerType type, LinearCombination a, LinearCombination b) {
    if (a.isConstant() && b.isConstant()) {
      return fold(constantValue(a, type).add(constantValue(b, type)), type);
    }
    LinearCombination sum = a.add(b);
    rangeCheck(cs, "add", sum, type);
    return sum;
  }

  public static LinearCombination subtract(
      ConstraintSystem cs, IntegerType type, LinearCombination a, LinearCombination b) {
    if (a.isConstant() && b.isConstant()) {
      return fold(constantValue(a, type).subtract(constantValue(b, type)), type);
    }
    LinearCombination difference = a.subtract(b);
    rangeCheck(cs, "sub", difference, type);
    return difference;
  }

  public static LinearCombination negate(
      ConstraintSystem cs, IntegerType type, LinearCombination a) {
    if (a.isConstant()) {
      return fold(constantValue(a, type).negate(), type);
    }
    LinearCombination negated = a.negate();
    rangeCheck(cs, "neg", negated, type);
    return negated;
  }

  public static LinearCombination multiply(
      ConstraintSystem cs, IntegerType type, LinearCombination a, LinearCombination b) {
    if (a.isConstant() && b.isConstant()) {
      return fold(constantValue(a, type).multiply(constantValue(b, type)), type);
    }
    LinearCombination product;
    if (2 * type.bits < Fr.BITS) {
      // The product of the encodings is the encoding of the product.
      product = cs.multiply("mul", a, b);
    } else {
      Bit negA = isNegative(cs, a, type);
      Bit negB = isNegative(cs, b, type);
      LinearCombination magnitude =
          boundedProduct(cs, magnitude(cs, negA, a), magnitude(cs, negB, b), type.bits);
      product = Bit.select(cs, negA.xor(cs, negB), magnitude.negate(), magnitude);
    }
    rangeCheck(cs, "mul", product, type);
    return product;
  }

  private static LinearCombination magnitude(
      ConstraintSystem cs, Bit negative, LinearCombination x) {
    return Bit.select(cs, negative, x.negate(), x);
  }

  /**
   * Returns the product of two values in {@code [0, 2^bits)}, and constrains it to be less than
   * {@code 2^bits}. The product is assembled from limb products, none of which can wrap around the
   * field modulus.
   */
  private static LinearCombination boundedProduct(
      ConstraintSystem cs, LinearCombination a, LinearCombination b, int bits) {
    if (2 * bits < Fr.BITS) {
      LinearCombination product = cs.multiply("product", a, b);
      FieldGadgets.toBits(cs, "product.range", product, bits);
      return product;
    }
    ImmutableList<Bit> aBits = FieldGadgets.toBits(cs, "product.a", a, bits);
    ImmutableList<Bit> bBits = FieldGadgets.toBits(cs, "product.b", b, bits);
    LinearCombination aLow = FieldGadgets.fromBits(aBits.subList(0, LIMB_BITS));
    LinearCombination aHigh = FieldGadgets.fromBits(aBits.subList(LIMB_BITS, bits));
    LinearCombination bLow = FieldGadgets.fromBits(bBits.subList(0, LIMB_BITS));
    LinearCombination bHigh = FieldGadgets.fromBits(bBits.subList(LIMB_BITS, bits));
    cs.enforce("product.high", aHigh, bHigh, LinearCombination.ZERO);
    LinearCombination cross =
        cs.multiply("product.cross", aLow, bHigh).add(cs.multiply("product.cross", aHigh, bLow));
    FieldGadgets.toBits(cs, "product.cross", cross, LIMB_BITS);
    LinearCombination product =
        cs.multiply("product.low", aLow, bLow)
            .add(cross.scale(BigInteger.ONE.shiftLeft(LIMB_BITS)));
    FieldGadgets.toBits(cs, "product.range", product, bits);
    return product;
  }

  /**
   * Returns {@code a / b}, rounded towards zero. A zero divisor makes the constraint system
   * unsatisfiable, as does dividing the minimum signed value by -1.
   *
   * @throws GadgetException if {@code b} is the constant zero
   */
  public static LinearCombination divide(
      ConstraintSystem cs, IntegerType type, LinearCombination a, LinearCombination b) {
    if (b.isConstant() && b.constantValue().signum() == 0) {
      throw new GadgetException(GadgetException.Reason.DIVISION_BY_ZERO, "Division by zero");
    }
    if (a.isConstant() && b.isConstant()) {
      // BigInteger.divide rounds towards zero.
      return fold(constantValue(a, type).divide(constantValue(b, type)), type);
    }
    Bit negA = isNegative(cs, a, type);
    Bit negB = isNegative(cs, b, type);
    LinearCombination dividend = magnitude(cs, negA, a);
    LinearCombination divisor = magnitude(cs, negB, b);
    LinearCombination quotient =
        cs.auxiliary(
            "div.q",
            ev -> {
              BigInteger d = ev.value(divisor);
              return d.signum() == 0 ? BigInteger.ZERO : ev.value(dividend).divide(d);
            });
    LinearCombination remainder =
        cs.auxiliary(
            "div.r",
            ev -> {
              BigInteger d = ev.value(divisor);
              return d.signum() == 0 ? ev.value(dividend) : ev.value(dividend).mod(d);
            });
    FieldGadgets.toBits(cs, "div.q", quotient, type.bits);
    FieldGadgets.toBits(cs, "div.r", remainder, type.bits);
    LinearCombination product = boundedProduct(cs, quotient, divisor, type.bits);
    cs.enforceEqual("div", product, dividend.subtract(remainder));
    // remainder < divisor
    FieldGadgets.toBits(
        cs, "div.lt", divisor.subtract(remainder).subtract(LinearCombination.ONE), type.bits);
    LinearCombination result = Bit.select(cs, negA.xor(cs, negB), quotient.negate(), quotient);
    if (type.signed) {
      rangeCheck(cs, "div", result, type);
    }
    return result;
  }

  /**
   * Returns {@code a ** b} by square-and-multiply over the bits of {@code b}, most significant
   * first, so that no intermediate result exceeds the final one.
   *
   * @throws GadgetException if {@code b} is not a constant, or is negative
   */
  public static LinearCombination pow(
      ConstraintSystem cs, IntegerType type, LinearCombination a, LinearCombination b) {
    if (!b.isConstant()) {
      throw new GadgetException(
          GadgetException.Reason.NON_CONSTANT_EXPONENT, "The exponent must be a constant");
    }
    BigInteger exponent = constantValue(b, type);
    if (exponent.signum() < 0) {
      throw new GadgetException(
          GadgetException.Reason.OVERFLOW, "Negative exponent %s for %s", exponent, type);
    }
    if (a.isConstant()) {
      return fold(constantPow(constantValue(a, type), exponent, type), type);
    }
    LinearCombination result = LinearCombination.ONE;
    for (int i = exponent.bitLength() - 1; i >= 0; i--) {
      result = multiply(cs, type, result, result);
      if (exponent.testBit(i)) {
        result = multiply(cs, type, result, a);
      }
    }
    return result;
  }

  private static BigInteger constantPow(BigInteger base, BigInteger exponent, IntegerType type) {
    if (base.abs().compareTo(BigInteger.ONE) <= 0) {
      boolean odd = exponent.testBit(0);
      return (exponent.signum() == 0) ? BigInteger.ONE : (odd ? base : base.abs());
    } else if (exponent.bitLength() > 8) {
      // |base| >= 2, so the result is out of range for every type.
      return type.max().add(BigInteger.ONE);
    }
    return base.pow(exponent.intValueExact());
  }

  /** Converts between integer types, range-checking the value if the target type is narrower. */
  public static LinearCombination cast(
      ConstraintSystem cs, IntegerType from, IntegerType to, LinearCombination a) {
    if (a.isConstant()) {
      return fold(constantValue(a, from), to);
    }
    boolean widening = from.min().compareTo(to.min()) >= 0 && from.max().compareTo(to.max()) <= 0;
    if (!widening) {
      rangeCheck(cs, "cast", a, to);
    }
    return a;
  }

  /** Returns a bit that is one iff {@code a < b}. */
  public static Bit lessThan(
      ConstraintSystem cs, IntegerType type, LinearCombination a, LinearCombination b) {
    if (a.isConstant() && b.isConstant()) {
      return Bit.constant(constantValue(a, type).compareTo(constantValue(b, type)) < 0);
    }
    return FieldGadgets.lessThan(
        cs, rangeCheck(cs, "lt.a", a, type), rangeCheck(cs, "lt.b", b, type));
  }
}
