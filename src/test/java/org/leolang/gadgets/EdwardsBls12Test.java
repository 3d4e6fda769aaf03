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
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.leolang.asg.GroupLiteral;
import org.leolang.asg.GroupLiteral.Coordinate;
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.Fr;
import org.leolang.r1cs.LinearCombination;
import org.leolang.r1cs.Wire;
import org.leolang.r1cs.Witness;
import org.leolang.r1cs.WitnessInstruction;

@RunWith(JUnit4.class)
public class EdwardsBls12Test {

  private static final EdwardsBls12.AffinePoint G = EdwardsBls12.GENERATOR;

  private static final EdwardsBls12.AffinePoint TWO_G =
      new EdwardsBls12.AffinePoint(
          new BigInteger(
              "7671246526200950761769666614018517695911487176117270528693021891980979118135"),
          new BigInteger(
              "6783221422172629105438050778057806742915153182459831994944409593185417235674"));

  private static Coordinate number(BigInteger value) {
    return Coordinate.number(value);
  }

  @Test
  public void generator() {
    assertThat(G.isOnCurve()).isTrue();
    assertThat(G.isInSubgroup()).isTrue();
    assertThat(G.multiply(EdwardsBls12.SUBGROUP_ORDER)).isEqualTo(EdwardsBls12.IDENTITY);
    assertThat(G.add(G)).isEqualTo(TWO_G);
    assertThat(G.multiply(BigInteger.TWO)).isEqualTo(TWO_G);
    assertThat(G.multiply(BigInteger.valueOf(-1))).isEqualTo(G.negate());
    assertThat(G.add(G.negate())).isEqualTo(EdwardsBls12.IDENTITY);
  }

  @Test
  public void productLiteral() {
    assertThat(EdwardsBls12.fromLiteral(GroupLiteral.product(BigInteger.ONE))).isEqualTo(G);
    assertThat(EdwardsBls12.fromLiteral(GroupLiteral.product(BigInteger.ZERO)))
        .isEqualTo(EdwardsBls12.IDENTITY);
  }

  @Test
  public void affineLiterals() {
    Coordinate x = number(G.x);
    Coordinate y = number(G.y);
    assertThat(EdwardsBls12.fromLiteral(GroupLiteral.affine(x, y))).isEqualTo(G);
    // G.y is the low root for G.x, and G.x is the high root for G.y.
    assertThat(EdwardsBls12.fromLiteral(GroupLiteral.affine(x, Coordinate.SIGN_LOW))).isEqualTo(G);
    assertThat(EdwardsBls12.fromLiteral(GroupLiteral.affine(x, Coordinate.INFERRED))).isEqualTo(G);
    assertThat(EdwardsBls12.fromLiteral(GroupLiteral.affine(Coordinate.SIGN_HIGH, y)))
        .isEqualTo(G);
    // Both roots for G.y are in the subgroup, so the low one is chosen.
    assertThat(EdwardsBls12.fromLiteral(GroupLiteral.affine(Coordinate.INFERRED, y)))
        .isEqualTo(G.negate());
  }

  @Test
  public void invalidLiterals() {
    // (G.x, -G.y) is on the curve but not in the subgroup.
    GadgetException e =
        assertThrows(
            GadgetException.class,
            () ->
                EdwardsBls12.fromLiteral(GroupLiteral.affine(number(G.x), Coordinate.SIGN_HIGH)));
    assertThat(e.reason).isEqualTo(GadgetException.Reason.INVALID_GROUP);
    assertThrows(
        GadgetException.class,
        () ->
            EdwardsBls12.fromLiteral(
                GroupLiteral.affine(number(BigInteger.ONE), number(BigInteger.ONE))));
    assertThrows(
        GadgetException.class,
        () ->
            EdwardsBls12.fromLiteral(
                GroupLiteral.affine(Coordinate.SIGN_LOW, Coordinate.SIGN_HIGH)));
  }

  @Test
  public void recovery() {
    BigInteger y = EdwardsBls12.recoverY(G.x);
    assertThat(y).isAnyOf(G.y, Fr.negate(G.y));
    BigInteger x = EdwardsBls12.recoverX(G.y);
    assertThat(x).isAnyOf(G.x, Fr.negate(G.x));
  }

  @Test
  public void circuitAddition() {
    ConstraintSystem cs = new ConstraintSystem();
    GroupElement p = allocate(cs, "p");
    GroupElement q = allocate(cs, "q");
    GroupElement sum = GroupGadgets.add(cs, p, q);
    GroupGadgets.enforceOnCurve(cs, p);
    Witness witness =
        cs.generateWitness(
            ImmutableMap.of("p.x", G.x, "p.y", G.y, "q.x", TWO_G.x, "q.y", TWO_G.y));
    assertThat(witness.isSatisfied()).isTrue();
    EdwardsBls12.AffinePoint threeG = G.multiply(BigInteger.valueOf(3));
    assertThat(witness.value(sum.x)).isEqualTo(threeG.x);
    assertThat(witness.value(sum.y)).isEqualTo(threeG.y);
  }

  @Test
  public void circuitScalarMultiplication() {
    ConstraintSystem cs = new ConstraintSystem();
    GroupElement p = allocate(cs, "p");
    LinearCombination k = input(cs, "k");
    GroupElement product = GroupGadgets.multiply(cs, p, FieldGadgets.toBits(cs, "k", k, 8));
    Witness witness =
        cs.generateWitness(ImmutableMap.of("p.x", G.x, "p.y", G.y, "k", BigInteger.valueOf(200)));
    assertThat(witness.isSatisfied()).isTrue();
    EdwardsBls12.AffinePoint expected = G.multiply(BigInteger.valueOf(200));
    assertThat(witness.value(product.x)).isEqualTo(expected.x);
    assertThat(witness.value(product.y)).isEqualTo(expected.y);
  }

  @Test
  public void constantPointsAreFolded() {
    ConstraintSystem cs = new ConstraintSystem();
    GroupElement sum = GroupGadgets.add(cs, GroupElement.constant(G), GroupElement.constant(G));
    assertThat(sum.isConstant()).isTrue();
    assertThat(sum.constantValue()).isEqualTo(TWO_G);
    assertThat(cs.numConstraints()).isEqualTo(0);
  }

  private static LinearCombination input(ConstraintSystem cs, String name) {
    return LinearCombination.of(
        cs.allocate(name, Wire.Visibility.PRIVATE, WitnessInstruction.input(name)));
  }

  private static GroupElement allocate(ConstraintSystem cs, String name) {
    return new GroupElement(input(cs, name + ".x"), input(cs, name + ".y"));
  }
}
