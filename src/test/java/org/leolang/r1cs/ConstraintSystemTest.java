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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConstraintSystemTest {

  private final ConstraintSystem cs = new ConstraintSystem();

  private LinearCombination input(String name, Wire.Visibility visibility) {
    return LinearCombination.of(cs.allocate(name, visibility, WitnessInstruction.input(name)));
  }

  @Test
  public void productWitness() {
    LinearCombination x = input("x", Wire.Visibility.PUBLIC);
    LinearCombination y = input("y", Wire.Visibility.PRIVATE);
    LinearCombination product = cs.multiply("xy", x, y);
    assertThat(cs.numConstraints()).isEqualTo(1);
    assertThat(cs.numWires()).isEqualTo(3);
    Witness witness =
        cs.generateWitness(ImmutableMap.of("x", BigInteger.valueOf(6), "y", BigInteger.valueOf(7)));
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.value(product)).isEqualTo(BigInteger.valueOf(42));
    assertThat(witness.publicValues()).containsExactly(BigInteger.valueOf(6));
  }

  @Test
  public void constantProductsAreFolded() {
    LinearCombination x = input("x", Wire.Visibility.PRIVATE);
    LinearCombination scaled = cs.multiply("scale", LinearCombination.constant(3), x);
    assertThat(scaled).isEqualTo(x.scale(3));
    assertThat(cs.numConstraints()).isEqualTo(0);
  }

  @Test
  public void trivialConstraintsAreDropped() {
    cs.enforceEqual("true", LinearCombination.ONE, LinearCombination.ONE);
    assertThat(cs.numConstraints()).isEqualTo(0);
    cs.enforceEqual("false", LinearCombination.ONE, LinearCombination.ZERO);
    assertThat(cs.numConstraints()).isEqualTo(1);
    assertThat(cs.generateWitness(ImmutableMap.of()).isSatisfied()).isFalse();
  }

  @Test
  public void unsatisfiedConstraint() {
    LinearCombination x = input("x", Wire.Visibility.PRIVATE);
    cs.enforceEqual("isFive", x, LinearCombination.constant(5));
    Witness witness = cs.generateWitness(ImmutableMap.of("x", BigInteger.valueOf(4)));
    assertThat(witness.isSatisfied()).isFalse();
    assertThat(witness.firstUnsatisfied().name).isEqualTo("isFive");
  }

  @Test
  public void namespaces() {
    LinearCombination x = input("x", Wire.Visibility.PRIVATE);
    cs.inNamespace("f", () -> cs.inNamespace("g", () -> cs.multiply("sq", x, x)));
    assertThat(cs.wires().get(1).name).isEqualTo("f/g/sq");
    assertThat(cs.constraints().get(0).name).isEqualTo("f/g/sq");
  }

  @Test
  public void diagnosticWiresAreNotConstrained() {
    LinearCombination x = input("x", Wire.Visibility.PRIVATE);
    LinearCombination square = cs.diagnostic(() -> cs.multiply("sq", x, x));
    assertThat(cs.numConstraints()).isEqualTo(0);
    assertThat(cs.wires()).hasSize(1);
    Witness witness = cs.generateWitness(ImmutableMap.of("x", BigInteger.valueOf(9)));
    assertThat(witness.value(square)).isEqualTo(BigInteger.valueOf(81));
    assertThrows(
        IllegalArgumentException.class,
        () -> cs.enforceEqual("bad", square, LinearCombination.ONE));
  }

  @Test
  public void deterministicDescription() {
    LinearCombination x = input("x", Wire.Visibility.PUBLIC);
    cs.multiply("sq", x, x);
    assertThat(cs.describe())
        .isEqualTo("w0(x) PUBLIC\nw1(sq) AUXILIARY\nsq: (w0(x)) * (w0(x)) = (w1(sq))\n");
  }
}
