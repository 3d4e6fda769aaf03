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

import java.math.BigInteger;
import org.bouncycastle.pqc.math.linearalgebra.IntegerFunctions;
import org.jspecify.annotations.Nullable;

/**
 * Arithmetic in the scalar field of BLS12-377, over which all constraints are expressed. Values
 * are BigIntegers in {@code [0, MODULUS)}; every method reduces its result.
 */
public final class Fr {

  public static final BigInteger MODULUS =
      new BigInteger(
          "8444461749428370424248824938781546531375899335154063827935233455917409239041");

  /** {@code (MODULUS - 1) / 2}; values above this are the "high" square roots. */
  public static final BigInteger HALF = MODULUS.subtract(BigInteger.ONE).shiftRight(1);

  /** The number of bits needed to represent any field element. */
  public static final int BITS = MODULUS.bitLength();

  // Statics only
  private Fr() {}

  /** Maps any integer (including negative ones) to its field element. */
  public static BigInteger reduce(BigInteger x) {
    return x.mod(MODULUS);
  }

  public static BigInteger add(BigInteger a, BigInteger b) {
    return a.add(b).mod(MODULUS);
  }

  public static BigInteger subtract(BigInteger a, BigInteger b) {
    return a.subtract(b).mod(MODULUS);
  }

  public static BigInteger multiply(BigInteger a, BigInteger b) {
    return a.multiply(b).mod(MODULUS);
  }

  public static BigInteger negate(BigInteger a) {
    return a.negate().mod(MODULUS);
  }

  /** Returns the multiplicative inverse of {@code a}, or zero if {@code a} is zero. */
  public static BigInteger inverse(BigInteger a) {
    BigInteger reduced = reduce(a);
    return reduced.signum() == 0 ? BigInteger.ZERO : reduced.modInverse(MODULUS);
  }

  /** Returns {@code a / b}, or zero if {@code b} is zero. */
  public static BigInteger divide(BigInteger a, BigInteger b) {
    return multiply(a, inverse(b));
  }

  /** True if {@code a} has a square root. */
  public static boolean isSquare(BigInteger a) {
    BigInteger reduced = reduce(a);
    return reduced.signum() == 0 || reduced.modPow(HALF, MODULUS).equals(BigInteger.ONE);
  }

  /**
   * Returns a square root of {@code a}, or null if there is none. Which of the two roots is
   * returned is unspecified; use {@link #isHigh} to choose between {@code r} and {@code -r}.
   */
  public static @Nullable BigInteger sqrt(BigInteger a) {
    if (!isSquare(a)) {
      return null;
    }
    BigInteger reduced = reduce(a);
    return reduced.signum() == 0 ? BigInteger.ZERO : IntegerFunctions.ressol(reduced, MODULUS);
  }

  /** True if {@code a} is greater than {@code (MODULUS - 1) / 2}. */
  public static boolean isHigh(BigInteger a) {
    return reduce(a).compareTo(HALF) > 0;
  }

  /**
   * Interprets a field element as a signed integer: values above {@link #HALF} are negative.
   */
  public static BigInteger toSigned(BigInteger a) {
    BigInteger reduced = reduce(a);
    return isHigh(reduced) ? reduced.subtract(MODULUS) : reduced;
  }
}
