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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.Fr;
import org.leolang.r1cs.LinearCombination;
import org.leolang.r1cs.Wire;
import org.leolang.r1cs.Witness;
import org.leolang.r1cs.WitnessInstruction;

@RunWith(JUnit4.class)
public class FieldGadgetsTest {

  private final ConstraintSystem cs = new ConstraintSystem();
  private final LinearCombination a = input("a");
  private final LinearCombination b = input("b");

  private LinearCombination input(String name) {
    return LinearCombination.of(
        cs.allocate(name, Wire.Visibility.PRIVATE, WitnessInstruction.input(name)));
  }

  private Witness run(BigInteger aValue, BigInteger bValue) {
    return cs.generateWitness(ImmutableMap.of("a", aValue, "b", bValue));
  }

  private Witness run(long aValue, long bValue) {
    return run(BigInteger.valueOf(aValue), BigInteger.valueOf(bValue));
  }

  @Test
  public void isZero() {
    Bit zero = FieldGadgets.isZero(cs, a);
    Witness witness = run(0, 0);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.value(zero.lc())).isEqualTo(BigInteger.ONE);
    witness = run(17, 0);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.value(zero.lc())).isEqualTo(BigInteger.ZERO);
  }

  @Test
  public void isEqualOnConstants() {
    Bit equal =
        FieldGadgets.isEqual(cs, LinearCombination.constant(3), LinearCombination.constant(3));
    assertThat(equal.isConstant()).isTrue();
    assertThat(equal.constantValue()).isTrue();
    assertThat(cs.numConstraints()).isEqualTo(0);
  }

  @Test
  public void toBits() {
    ImmutableList<Bit> bits = FieldGadgets.toBits(cs, "a", a, 4);
    assertThat(bits).hasSize(4);
    Witness witness = run(0b1010, 0);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.value(bits.get(0).lc())).isEqualTo(BigInteger.ZERO);
    assertThat(witness.value(bits.get(1).lc())).isEqualTo(BigInteger.ONE);
    assertThat(witness.value(FieldGadgets.fromBits(bits))).isEqualTo(BigInteger.valueOf(10));
    // 16 does not fit in four bits.
    assertThat(run(16, 0).isSatisfied()).isFalse();
  }

  @Test
  public void inverse() {
    LinearCombination inv = FieldGadgets.inverse(cs, a);
    Witness witness = run(5, 0);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(Fr.multiply(witness.value(inv), BigInteger.valueOf(5))).isEqualTo(BigInteger.ONE);
    assertThat(run(0, 0).isSatisfied()).isFalse();
  }

  @Test
  public void lessThanComparesCanonicalValues() {
    Bit less = FieldGadgets.lessThan(cs, a, b);
    Witness witness = run(BigInteger.valueOf(5), Fr.negate(BigInteger.ONE));
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.value(less.lc())).isEqualTo(BigInteger.ONE);
    witness = run(Fr.negate(BigInteger.ONE), BigInteger.valueOf(5));
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.value(less.lc())).isEqualTo(BigInteger.ZERO);
  }

  @Test
  public void bitLogic() {
    Bit x = Bit.enforceBoolean(cs, "x", a);
    Bit y = Bit.enforceBoolean(cs, "y", b);
    Bit and = x.and(cs, y);
    Bit or = x.or(cs, y);
    Bit xor = x.xor(cs, y);
    Witness witness = run(1, 0);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.value(and.lc())).isEqualTo(BigInteger.ZERO);
    assertThat(witness.value(or.lc())).isEqualTo(BigInteger.ONE);
    assertThat(witness.value(xor.lc())).isEqualTo(BigInteger.ONE);
    assertThat(run(2, 0).isSatisfied()).isFalse();
  }
}
