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

import com.google.common.collect.ImmutableMap;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.leolang.asg.IntegerType;
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.Fr;
import org.leolang.r1cs.LinearCombination;
import org.leolang.r1cs.Wire;
import org.leolang.r1cs.Witness;
import org.leolang.r1cs.WitnessInstruction;

@RunWith(TestParameterInjector.class)
public class IntegerGadgetsTest {

  private final ConstraintSystem cs = new ConstraintSystem();
  private final LinearCombination a = input("a");
  private final LinearCombination b = input("b");

  private LinearCombination input(String name) {
    return LinearCombination.of(
        cs.allocate(name, Wire.Visibility.PRIVATE, WitnessInstruction.input(name)));
  }

  private Witness run(BigInteger aValue, BigInteger bValue) {
    return cs.generateWitness(ImmutableMap.of("a", Fr.reduce(aValue), "b", Fr.reduce(bValue)));
  }

  private Witness run(long aValue, long bValue) {
    return run(BigInteger.valueOf(aValue), BigInteger.valueOf(bValue));
  }

  private static BigInteger decode(Witness witness, LinearCombination x, IntegerType type) {
    return IntegerGadgets.decode(witness.value(x), type);
  }

  @Test
  public void rangeCheck(@TestParameter IntegerType type) {
    IntegerGadgets.rangeCheck(cs, "x", a, type);
    assertThat(cs.numConstraints()).isGreaterThan(type.bits);
    assertThat(run(type.max(), BigInteger.ZERO).isSatisfied()).isTrue();
    assertThat(run(type.min(), BigInteger.ZERO).isSatisfied()).isTrue();
    assertThat(run(type.max().add(BigInteger.ONE), BigInteger.ZERO).isSatisfied()).isFalse();
    assertThat(run(type.min().subtract(BigInteger.ONE), BigInteger.ZERO).isSatisfied()).isFalse();
  }

  @Test
  public void rangeCheckRejectsOutOfRange() {
    IntegerGadgets.rangeCheck(cs, "x", a, IntegerType.I8);
    assertThat(run(127, 0).isSatisfied()).isTrue();
    assertThat(run(-128, 0).isSatisfied()).isTrue();
    assertThat(run(128, 0).isSatisfied()).isFalse();
    assertThat(run(-129, 0).isSatisfied()).isFalse();
  }

  @Test
  public void addOverflow() {
    LinearCombination sum = IntegerGadgets.add(cs, IntegerType.U8, a, b);
    Witness ok = run(200, 55);
    assertThat(ok.isSatisfied()).isTrue();
    assertThat(decode(ok, sum, IntegerType.U8)).isEqualTo(BigInteger.valueOf(255));
    assertThat(run(200, 56).isSatisfied()).isFalse();
  }

  @Test
  public void constantsAreFolded() {
    LinearCombination sum =
        IntegerGadgets.add(
            cs, IntegerType.I8, LinearCombination.constant(100), LinearCombination.constant(27));
    assertThat(sum.isConstant()).isTrue();
    assertThat(IntegerGadgets.constantValue(sum, IntegerType.I8))
        .isEqualTo(BigInteger.valueOf(127));
    GadgetException e =
        assertThrows(
            GadgetException.class,
            () ->
                IntegerGadgets.add(
                    cs,
                    IntegerType.I8,
                    LinearCombination.constant(100),
                    LinearCombination.constant(28)));
    assertThat(e.reason).isEqualTo(GadgetException.Reason.OVERFLOW);
    assertThat(cs.numConstraints()).isEqualTo(0);
  }

  @Test
  public void signedSubtraction() {
    LinearCombination difference = IntegerGadgets.subtract(cs, IntegerType.I16, a, b);
    Witness witness = run(-300, 200);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(decode(witness, difference, IntegerType.I16)).isEqualTo(BigInteger.valueOf(-500));
  }

  enum DivisionCase {
    POSITIVE(7, 2, 3),
    NEGATIVE_DIVIDEND(-7, 2, -3),
    NEGATIVE_DIVISOR(7, -2, -3),
    BOTH_NEGATIVE(-7, -2, 3),
    EXACT(-8, 4, -2),
    SMALLER(3, 5, 0);

    final long dividend;
    final long divisor;
    final long quotient;

    DivisionCase(long dividend, long divisor, long quotient) {
      this.dividend = dividend;
      this.divisor = divisor;
      this.quotient = quotient;
    }
  }

  @Test
  public void signedDivisionRoundsTowardsZero(@TestParameter DivisionCase c) {
    LinearCombination quotient = IntegerGadgets.divide(cs, IntegerType.I32, a, b);
    Witness witness = run(c.dividend, c.divisor);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(decode(witness, quotient, IntegerType.I32))
        .isEqualTo(BigInteger.valueOf(c.quotient));
  }

  @Test
  public void divisionByZero() {
    IntegerGadgets.divide(cs, IntegerType.U32, a, b);
    assertThat(run(10, 0).isSatisfied()).isFalse();
    GadgetException e =
        assertThrows(
            GadgetException.class,
            () -> IntegerGadgets.divide(cs, IntegerType.U32, a, LinearCombination.ZERO));
    assertThat(e.reason).isEqualTo(GadgetException.Reason.DIVISION_BY_ZERO);
  }

  @Test
  public void minimumDividedByMinusOne() {
    IntegerGadgets.divide(cs, IntegerType.I8, a, b);
    assertThat(run(-128, -1).isSatisfied()).isFalse();
    assertThat(run(-127, -1).isSatisfied()).isTrue();
  }

  @Test
  public void wideMultiplication() {
    LinearCombination product = IntegerGadgets.multiply(cs, IntegerType.I128, a, b);
    Witness witness = run(-4_000_000_000_000L, 3_000_000_000_000L);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(decode(witness, product, IntegerType.I128))
        .isEqualTo(new BigInteger("-12000000000000000000000000"));
  }

  @Test
  public void narrowMultiplicationOverflow() {
    IntegerGadgets.multiply(cs, IntegerType.U16, a, b);
    assertThat(run(255, 257).isSatisfied()).isTrue();
    assertThat(run(256, 256).isSatisfied()).isFalse();
  }

  @Test
  public void pow() {
    LinearCombination result =
        IntegerGadgets.pow(cs, IntegerType.U32, a, LinearCombination.constant(5));
    Witness witness = run(3, 0);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(decode(witness, result, IntegerType.U32)).isEqualTo(BigInteger.valueOf(243));
    GadgetException e =
        assertThrows(GadgetException.class, () -> IntegerGadgets.pow(cs, IntegerType.U32, a, b));
    assertThat(e.reason).isEqualTo(GadgetException.Reason.NON_CONSTANT_EXPONENT);
  }

  @Test
  public void narrowingCast() {
    IntegerGadgets.cast(cs, IntegerType.I16, IntegerType.U8, a);
    assertThat(run(255, 0).isSatisfied()).isTrue();
    assertThat(run(-1, 0).isSatisfied()).isFalse();
    assertThat(run(256, 0).isSatisfied()).isFalse();
  }

  @Test
  public void wideningCastIsFree() {
    LinearCombination result = IntegerGadgets.cast(cs, IntegerType.U8, IntegerType.I32, a);
    assertThat(result).isSameInstanceAs(a);
    assertThat(cs.numConstraints()).isEqualTo(0);
  }

  @Test
  public void signedLessThan() {
    Bit less = IntegerGadgets.lessThan(cs, IntegerType.I64, a, b);
    Witness witness = run(-5, 3);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.value(less.lc())).isEqualTo(BigInteger.ONE);
    witness = run(3, -5);
    assertThat(witness.value(less.lc())).isEqualTo(BigInteger.ZERO);
    witness = run(3, 3);
    assertThat(witness.value(less.lc())).isEqualTo(BigInteger.ZERO);
  }
}
