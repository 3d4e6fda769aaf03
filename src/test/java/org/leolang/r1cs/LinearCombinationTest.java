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

import static com.google.common.truth.Truth.assertThat;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LinearCombinationTest {

  private final ConstraintSystem cs = new ConstraintSystem();
  private final Wire x = cs.allocate("x", Wire.Visibility.PRIVATE, WitnessInstruction.input("x"));
  private final Wire y = cs.allocate("y", Wire.Visibility.PRIVATE, WitnessInstruction.input("y"));

  @Test
  public void constants() {
    LinearCombination five = LinearCombination.constant(5);
    assertThat(five.isConstant()).isTrue();
    assertThat(five.add(LinearCombination.constant(-5))).isEqualTo(LinearCombination.ZERO);
    assertThat(LinearCombination.constant(-1).constantValue())
        .isEqualTo(Fr.MODULUS.subtract(BigInteger.ONE));
  }

  @Test
  public void cancellingTermsAreDropped() {
    LinearCombination lc = LinearCombination.of(x).add(LinearCombination.of(y));
    LinearCombination difference = lc.subtract(LinearCombination.of(y));
    assertThat(difference).isEqualTo(LinearCombination.of(x));
    assertThat(difference.terms()).containsExactly(x, BigInteger.ONE);
    assertThat(lc.subtract(lc).isConstant()).isTrue();
  }

  @Test
  public void scale() {
    LinearCombination lc = LinearCombination.of(x).add(BigInteger.TWO).scale(3);
    assertThat(lc.terms()).containsExactly(x, BigInteger.valueOf(3));
    assertThat(lc.constantTerm()).isEqualTo(BigInteger.valueOf(6));
    assertThat(lc.scale(0)).isEqualTo(LinearCombination.ZERO);
  }

  @Test
  public void evaluate() {
    LinearCombination lc =
        LinearCombination.of(x).scale(2).subtract(LinearCombination.of(y)).add(BigInteger.ONE);
    BigInteger value = lc.evaluate(w -> w == x ? BigInteger.valueOf(10) : BigInteger.valueOf(30));
    assertThat(value).isEqualTo(Fr.MODULUS.subtract(BigInteger.valueOf(9)));
  }

  @Test
  public void format() {
    LinearCombination lc =
        LinearCombination.of(x)
            .scale(2)
            .add(LinearCombination.of(y))
            .add(BigInteger.valueOf(5));
    assertThat(lc.toString()).isEqualTo("5 + 2*w0(x) + w1(y)");
  }
}
