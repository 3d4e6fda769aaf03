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

import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/** The fixed-width integer types. */
public enum IntegerType {
  U8(8, false),
  U16(16, false),
  U32(32, false),
  U64(64, false),
  U128(128, false),
  I8(8, true),
  I16(16, true),
  I32(32, true),
  I64(64, true),
  I128(128, true);

  public final int bits;
  public final boolean signed;
  private final BigInteger min;
  private final BigInteger max;

  IntegerType(int bits, boolean signed) {
    this.bits = bits;
    this.signed = signed;
    if (signed) {
      this.min = BigInteger.ONE.shiftLeft(bits - 1).negate();
      this.max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
    } else {
      this.min = BigInteger.ZERO;
      this.max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }
  }

  public BigInteger min() {
    return min;
  }

  public BigInteger max() {
    return max;
  }

  /** Returns true if {@code value} is representable in this type. */
  public boolean contains(BigInteger value) {
    return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
  }

  /** The source keyword for this type, e.g. {@code "u32"}. */
  public String keyword() {
    return name().toLowerCase();
  }

  /** Returns the type named by {@code keyword}, or null if there is none. */
  public static @Nullable IntegerType fromKeyword(String keyword) {
    for (IntegerType type : values()) {
      if (type.keyword().equals(keyword)) {
        return type;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return keyword();
  }
}
