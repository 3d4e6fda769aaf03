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
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * Decoding of bech32 strings (BIP 173), as used for {@code aleo1...} account addresses. An address
 * carries 32 bytes of data, which the circuit represents as two 128-bit limbs.
 */
public final class Bech32 {
  public static final String ADDRESS_HRP = "aleo";

  /** The number of data bytes in an address. */
  public static final int ADDRESS_BYTES = 32;

  private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
  private static final int CHECKSUM_LENGTH = 6;
  private static final int[] GENERATOR = {
    0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3
  };

  // Statics only
  private Bech32() {}

  /** True if {@code text} is a well-formed address with a valid checksum. */
  public static boolean isValidAddress(String text) {
    return decodeAddress(text) != null;
  }

  /** Returns the data bytes of an address, or null if it is not valid. */
  public static byte @Nullable [] decodeAddress(String text) {
    byte[] data = decode(ADDRESS_HRP, text);
    return (data != null && data.length == ADDRESS_BYTES) ? data : null;
  }

  /**
   * Returns the address as two 128-bit limbs, most significant first.
   *
   * @throws IllegalArgumentException if {@code text} is not a valid address
   */
  public static ImmutableList<BigInteger> addressLimbs(String text) {
    byte[] data = decodeAddress(text);
    if (data == null) {
      throw new IllegalArgumentException("Invalid address: " + text);
    }
    int half = ADDRESS_BYTES / 2;
    return ImmutableList.of(
        new BigInteger(1, Arrays.copyOfRange(data, 0, half)),
        new BigInteger(1, Arrays.copyOfRange(data, half, ADDRESS_BYTES)));
  }

  /** Returns the address text for two 128-bit limbs; the inverse of {@link #addressLimbs}. */
  public static String encodeAddress(BigInteger high, BigInteger low) {
    byte[] data = new byte[ADDRESS_BYTES];
    copyLimb(high, data, 0);
    copyLimb(low, data, ADDRESS_BYTES / 2);
    int[] values = new int[(ADDRESS_BYTES * 8 + 4) / 5];
    int acc = 0;
    int bits = 0;
    int n = 0;
    for (byte b : data) {
      acc = ((acc << 8) | (b & 0xff)) & 0xfff;
      bits += 8;
      while (bits >= 5) {
        bits -= 5;
        values[n++] = (acc >>> bits) & 31;
      }
    }
    if (bits > 0) {
      values[n] = (acc << (5 - bits)) & 31;
    }
    int[] withChecksum = Arrays.copyOf(values, values.length + CHECKSUM_LENGTH);
    int mod = polymod(ADDRESS_HRP, withChecksum) ^ 1;
    StringBuilder sb = new StringBuilder(ADDRESS_HRP).append('1');
    for (int i = 0; i < withChecksum.length; i++) {
      int value =
          (i < values.length) ? values[i] : (mod >>> (5 * (withChecksum.length - 1 - i))) & 31;
      sb.append(CHARSET.charAt(value));
    }
    return sb.toString();
  }

  private static void copyLimb(BigInteger limb, byte[] dest, int offset) {
    byte[] bytes = limb.toByteArray();
    int limbBytes = ADDRESS_BYTES / 2;
    int length = Math.min(bytes.length, limbBytes);
    System.arraycopy(bytes, bytes.length - length, dest, offset + limbBytes - length, length);
  }

  /**
   * Decodes a lower-case bech32 string with the given human-readable part, returning its data
   * bytes or null if the string is malformed or the checksum is wrong.
   */
  static byte @Nullable [] decode(String hrp, String text) {
    String prefix = hrp + "1";
    if (!text.startsWith(prefix) || text.length() < prefix.length() + CHECKSUM_LENGTH) {
      return null;
    }
    String dataPart = text.substring(prefix.length());
    int[] values = new int[dataPart.length()];
    for (int i = 0; i < values.length; i++) {
      values[i] = CHARSET.indexOf(dataPart.charAt(i));
      if (values[i] < 0) {
        return null;
      }
    }
    if (polymod(hrp, values) != 1) {
      return null;
    }
    return convertBits(Arrays.copyOf(values, values.length - CHECKSUM_LENGTH));
  }

  private static int polymod(String hrp, int[] values) {
    int chk = 1;
    for (int i = 0; i < hrp.length(); i++) {
      chk = polymodStep(chk, hrp.charAt(i) >> 5);
    }
    chk = polymodStep(chk, 0);
    for (int i = 0; i < hrp.length(); i++) {
      chk = polymodStep(chk, hrp.charAt(i) & 31);
    }
    for (int value : values) {
      chk = polymodStep(chk, value);
    }
    return chk;
  }

  private static int polymodStep(int chk, int value) {
    int top = chk >>> 25;
    chk = ((chk & 0x1ffffff) << 5) ^ value;
    for (int i = 0; i < GENERATOR.length; i++) {
      if (((top >>> i) & 1) != 0) {
        chk ^= GENERATOR[i];
      }
    }
    return chk;
  }

  /** Regroups 5-bit values into bytes; returns null if the padding is not zero. */
  private static byte @Nullable [] convertBits(int[] values) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    int acc = 0;
    int bits = 0;
    for (int value : values) {
      acc = ((acc << 5) | value) & 0xfff;
      bits += 5;
      if (bits >= 8) {
        bits -= 8;
        out.write((acc >>> bits) & 0xff);
      }
    }
    if (bits >= 5 || ((acc << (8 - bits)) & 0xff) != 0) {
      return null;
    }
    return out.toByteArray();
  }
}
