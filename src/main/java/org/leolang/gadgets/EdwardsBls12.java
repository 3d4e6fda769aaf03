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

import java.math.BigInteger;
import org.jspecify.annotations.Nullable;
import org.leolang.asg.GroupLiteral;
import org.leolang.r1cs.Fr;

/**
 * The twisted Edwards curve {@code -x^2 + y^2 = 1 + d x^2 y^2} over the BLS12-377 scalar field,
 * whose prime-order subgroup provides the values of type {@code group}.
 *
 * <p>Since {@code d} is not a square the addition law is complete: it has no exceptional cases.
 */
public final class EdwardsBls12 {

  public static final BigInteger D = BigInteger.valueOf(3021);

  /** The order of the prime-order subgroup; the curve has cofactor 4. */
  public static final BigInteger SUBGROUP_ORDER =
      new BigInteger(
          "2111115437357092606062206234695386632838870926408408195193685246394721360383");

  public static final AffinePoint IDENTITY = new AffinePoint(BigInteger.ZERO, BigInteger.ONE);

  public static final AffinePoint GENERATOR =
      new AffinePoint(
          new BigInteger(
              "7810607721416582242904415504650443951498042435501746664987470571546413371306"),
          new BigInteger(
              "1867362672570137759132108893390349941423731440336755218616442213142473202417"));

  // Statics only
  private EdwardsBls12() {}

  /** A point on the curve in affine coordinates. */
  public static final class AffinePoint {
    public final BigInteger x;
    public final BigInteger y;

    public AffinePoint(BigInteger x, BigInteger y) {
      this.x = Fr.reduce(x);
      this.y = Fr.reduce(y);
    }

    public boolean isOnCurve() {
      BigInteger xx = Fr.multiply(x, x);
      BigInteger yy = Fr.multiply(y, y);
      BigInteger left = Fr.subtract(yy, xx);
      BigInteger right = Fr.add(BigInteger.ONE, Fr.multiply(D, Fr.multiply(xx, yy)));
      return left.equals(right);
    }

    /** True if this point is on the curve and in the prime-order subgroup. */
    public boolean isInSubgroup() {
      return isOnCurve() && multiplyUnreduced(SUBGROUP_ORDER).equals(IDENTITY);
    }

    public AffinePoint add(AffinePoint other) {
      BigInteger t = Fr.multiply(D, Fr.multiply(Fr.multiply(x, other.x), Fr.multiply(y, other.y)));
      BigInteger x3 =
          Fr.divide(
              Fr.add(Fr.multiply(x, other.y), Fr.multiply(y, other.x)), Fr.add(BigInteger.ONE, t));
      BigInteger y3 =
          Fr.divide(
              Fr.add(Fr.multiply(y, other.y), Fr.multiply(x, other.x)),
              Fr.subtract(BigInteger.ONE, t));
      return new AffinePoint(x3, y3);
    }

    public AffinePoint negate() {
      return new AffinePoint(Fr.negate(x), y);
    }

    /** Returns {@code scalar} times this point; negative scalars multiply the negated point. */
    public AffinePoint multiply(BigInteger scalar) {
      if (scalar.signum() < 0) {
        return negate().multiply(scalar.negate());
      }
      return multiplyUnreduced(scalar.mod(SUBGROUP_ORDER));
    }

    private AffinePoint multiplyUnreduced(BigInteger scalar) {
      AffinePoint result = IDENTITY;
      AffinePoint current = this;
      for (int i = 0; i < scalar.bitLength(); i++) {
        if (scalar.testBit(i)) {
          result = result.add(current);
        }
        current = current.add(current);
      }
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof AffinePoint)) {
        return false;
      }
      AffinePoint other = (AffinePoint) obj;
      return x.equals(other.x) && y.equals(other.y);
    }

    @Override
    public int hashCode() {
      return x.hashCode() * 31 + y.hashCode();
    }

    @Override
    public String toString() {
      return "(" + x + ", " + y + ")";
    }
  }

  /**
   * Returns the point denoted by a group literal. A coordinate given as a sign marker is recovered
   * from the other coordinate: {@code SignHigh} selects the root greater than {@code (p - 1) / 2},
   * {@code SignLow} the other one, and {@code Inferred} tries the low root and then the high root,
   * taking the first that lies in the prime-order subgroup.
   *
   * @throws GadgetException if the literal does not denote a point of the subgroup
   */
  public static AffinePoint fromLiteral(GroupLiteral literal) {
    if (literal instanceof GroupLiteral.Product) {
      return GENERATOR.multiply(((GroupLiteral.Product) literal).scalar);
    }
    GroupLiteral.Affine affine = (GroupLiteral.Affine) literal;
    GroupLiteral.Coordinate x = affine.x;
    GroupLiteral.Coordinate y = affine.y;
    AffinePoint result;
    if (x.number != null && y.number != null) {
      result = new AffinePoint(x.number, y.number);
    } else if (x.number != null) {
      result = recover(Fr.reduce(x.number), y.kind, true);
    } else if (y.number != null) {
      result = recover(Fr.reduce(y.number), x.kind, false);
    } else {
      result = null;
    }
    if (result == null || !result.isInSubgroup()) {
      throw new GadgetException(
          GadgetException.Reason.INVALID_GROUP, "%s is not a valid group element", literal);
    }
    return result;
  }

  /**
   * Recovers a point from one coordinate, choosing the root of the other according to {@code
   * sign}. Returns null if there is no such point.
   */
  private static @Nullable AffinePoint recover(
      BigInteger known, GroupLiteral.CoordinateKind sign, boolean knownIsX) {
    BigInteger root = knownIsX ? recoverY(known) : recoverX(known);
    if (root == null) {
      return null;
    }
    BigInteger low = Fr.isHigh(root) ? Fr.negate(root) : root;
    BigInteger high = Fr.negate(low);
    switch (sign) {
      case SIGN_HIGH:
        return point(known, high, knownIsX);
      case SIGN_LOW:
        return point(known, low, knownIsX);
      default:
        AffinePoint candidate = point(known, low, knownIsX);
        return candidate.isInSubgroup() ? candidate : point(known, high, knownIsX);
    }
  }

  private static AffinePoint point(BigInteger known, BigInteger other, boolean knownIsX) {
    return knownIsX ? new AffinePoint(known, other) : new AffinePoint(other, known);
  }

  /** Returns a y with {@code y^2 = (1 + x^2) / (1 - d x^2)}, or null if there is none. */
  static @Nullable BigInteger recoverY(BigInteger x) {
    BigInteger xx = Fr.multiply(x, x);
    BigInteger denominator = Fr.subtract(BigInteger.ONE, Fr.multiply(D, xx));
    if (denominator.signum() == 0) {
      return null;
    }
    return Fr.sqrt(Fr.divide(Fr.add(BigInteger.ONE, xx), denominator));
  }

  /** Returns an x with {@code x^2 = (y^2 - 1) / (d y^2 + 1)}, or null if there is none. */
  static @Nullable BigInteger recoverX(BigInteger y) {
    BigInteger yy = Fr.multiply(y, y);
    BigInteger denominator = Fr.add(Fr.multiply(D, yy), BigInteger.ONE);
    if (denominator.signum() == 0) {
      return null;
    }
    return Fr.sqrt(Fr.divide(Fr.subtract(yy, BigInteger.ONE), denominator));
  }
}
