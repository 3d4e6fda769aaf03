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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class Bech32Test {
  private static final String ADDRESS =
      "aleo1qnr4dkkvkgfqph0vzc3y6z2eu975wnpz2925ntjccd5cfqxtyu8sta57j8";
  private static final BigInteger HIGH = new BigInteger("6351940680303652161008522246857775585");
  private static final BigInteger LOW = new BigInteger("166523696732129252325620230215743252239");

  @Test
  public void limbs() {
    assertThat(Bech32.isValidAddress(ADDRESS)).isTrue();
    assertThat(Bech32.addressLimbs(ADDRESS)).containsExactly(HIGH, LOW).inOrder();
  }

  @Test
  public void encode() {
    assertThat(Bech32.encodeAddress(HIGH, LOW)).isEqualTo(ADDRESS);
    String zero = Bech32.encodeAddress(BigInteger.ZERO, BigInteger.ZERO);
    assertThat(Bech32.addressLimbs(zero)).containsExactly(BigInteger.ZERO, BigInteger.ZERO);
  }

  @Test
  public void badChecksum() {
    String corrupted = ADDRESS.substring(0, ADDRESS.length() - 1) + "9";
    assertThat(Bech32.isValidAddress(corrupted)).isFalse();
    assertThrows(IllegalArgumentException.class, () -> Bech32.addressLimbs(corrupted));
  }

  @Test
  public void malformed() {
    assertThat(Bech32.isValidAddress("")).isFalse();
    assertThat(Bech32.isValidAddress("aleo1")).isFalse();
    assertThat(Bech32.isValidAddress("btc1" + ADDRESS.substring(5))).isFalse();
    // 'b' is not in the bech32 alphabet.
    assertThat(Bech32.isValidAddress(ADDRESS.replace('q', 'b'))).isFalse();
    assertThat(Bech32.isValidAddress(ADDRESS.toUpperCase())).isFalse();
  }

  @Test
  public void wrongLength() {
    // A valid bech32 string whose payload is not 32 bytes.
    assertThat(Bech32.decode("a", "a12uel5l")).isNotNull();
    assertThat(Bech32.decodeAddress("a12uel5l")).isNull();
  }
}
