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
import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The two source forms of a group element: a multiple of the generator ({@code 2group}), or an
 * affine coordinate pair ({@code (x, y)group}) in which either coordinate may be replaced by a
 * sign marker.
 */
public abstract class GroupLiteral {

  private GroupLiteral() {}

  public static Product product(BigInteger scalar) {
    return new Product(scalar);
  }

  public static Affine affine(Coordinate x, Coordinate y) {
    return new Affine(x, y);
  }

  /** {@code <scalar>group}. */
  public static final class Product extends GroupLiteral {
    public final BigInteger scalar;

    private Product(BigInteger scalar) {
      this.scalar = scalar;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Product && ((Product) obj).scalar.equals(scalar);
    }

    @Override
    public int hashCode() {
      return scalar.hashCode();
    }

    @Override
    public String toString() {
      return scalar + "group";
    }
  }

  /** {@code (<x>, <y>)group}. */
  public static final class Affine extends GroupLiteral {
    public final Coordinate x;
    public final Coordinate y;

    private Affine(Coordinate x, Coordinate y) {
      this.x = x;
      this.y = y;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Affine)) {
        return false;
      }
      Affine other = (Affine) obj;
      return x.equals(other.x) && y.equals(other.y);
    }

    @Override
    public int hashCode() {
      return Objects.hash(x, y);
    }

    /** Returns e.g. {@code "(SignHigh, Inferred)"}. */
    @Override
    public String toString() {
      return "(" + x + ", " + y + ")";
    }
  }

  public enum CoordinateKind {
    SIGN_HIGH("SignHigh"),
    SIGN_LOW("SignLow"),
    INFERRED("Inferred"),
    NUMBER("Number");

    final String displayName;

    CoordinateKind(String displayName) {
      this.displayName = displayName;
    }
  }

  /** One coordinate of an affine literal: a number, or a marker for a value to be recovered. */
  public static final class Coordinate {
    public static final Coordinate SIGN_HIGH = new Coordinate(CoordinateKind.SIGN_HIGH, null);
    public static final Coordinate SIGN_LOW = new Coordinate(CoordinateKind.SIGN_LOW, null);
    public static final Coordinate INFERRED = new Coordinate(CoordinateKind.INFERRED, null);

    public final CoordinateKind kind;

    /** Non-null iff {@code kind} is {@link CoordinateKind#NUMBER}; may be negative. */
    public final @Nullable BigInteger number;

    private Coordinate(CoordinateKind kind, @Nullable BigInteger number) {
      this.kind = kind;
      this.number = number;
    }

    public static Coordinate number(BigInteger number) {
      return new Coordinate(CoordinateKind.NUMBER, Preconditions.checkNotNull(number));
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Coordinate)) {
        return false;
      }
      Coordinate other = (Coordinate) obj;
      return kind == other.kind && Objects.equals(number, other.number);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, number);
    }

    @Override
    public String toString() {
      return (kind == CoordinateKind.NUMBER) ? number.toString() : kind.displayName;
    }
  }
}
