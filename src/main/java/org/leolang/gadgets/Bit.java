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
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.LinearCombination;
import org.leolang.r1cs.Wire;
import org.leolang.r1cs.WitnessInstruction;

/**
 * A linear combination that is known to evaluate to zero or one, either because it is a constant
 * or because a booleanity constraint has been enforced on it.
 *
 * <p>The boolean operations fold constants, so that e.g. {@code x.and(cs, Bit.TRUE)} returns
 * {@code x} without adding a constraint.
 */
public final class Bit {
  public static final Bit FALSE = new Bit(LinearCombination.ZERO);
  public static final Bit TRUE = new Bit(LinearCombination.ONE);

  private final LinearCombination lc;

  private Bit(LinearCombination lc) {
    this.lc = lc;
  }

  public static Bit constant(boolean value) {
    return value ? TRUE : FALSE;
  }

  /** Wraps a linear combination that the caller has already constrained to be boolean. */
  static Bit trusted(LinearCombination lc) {
    return new Bit(lc);
  }

  /** Allocates a new wire and constrains it to be zero or one. */
  public static Bit allocate(
      ConstraintSystem cs, String name, Wire.Visibility visibility, WitnessInstruction value) {
    LinearCombination wire = LinearCombination.of(cs.allocate(name, visibility, value));
    return enforceBoolean(cs, name, wire);
  }

  /** Adds the constraint {@code x * (x - 1) = 0} and returns {@code x} as a Bit. */
  public static Bit enforceBoolean(ConstraintSystem cs, String name, LinearCombination x) {
    cs.enforce(name + ".boolean", x, x.subtract(LinearCombination.ONE), LinearCombination.ZERO);
    return new Bit(x);
  }

  public LinearCombination lc() {
    return lc;
  }

  public boolean isConstant() {
    return lc.isConstant();
  }

  public boolean constantValue() {
    return lc.constantValue().signum() != 0;
  }

  public Bit not() {
    return new Bit(LinearCombination.ONE.subtract(lc));
  }

  public Bit and(ConstraintSystem cs, Bit other) {
    if (isConstant()) {
      return constantValue() ? other : FALSE;
    } else if (other.isConstant()) {
      return other.constantValue() ? this : FALSE;
    }
    return new Bit(cs.multiply("and", lc, other.lc));
  }

  public Bit or(ConstraintSystem cs, Bit other) {
    return not().and(cs, other.not()).not();
  }

  public Bit xor(ConstraintSystem cs, Bit other) {
    if (isConstant()) {
      return constantValue() ? other.not() : other;
    } else if (other.isConstant()) {
      return other.constantValue() ? not() : this;
    }
    // a + b - 2ab
    LinearCombination product = cs.multiply("xor", lc, other.lc);
    return new Bit(lc.add(other.lc).subtract(product.scale(2)));
  }

  /**
   * Returns a linear combination equal to {@code ifTrue} when {@code cond} is one and to {@code
   * ifFalse} when it is zero.
   */
  public static LinearCombination select(
      ConstraintSystem cs, Bit cond, LinearCombination ifTrue, LinearCombination ifFalse) {
    if (cond.isConstant()) {
      return cond.constantValue() ? ifTrue : ifFalse;
    } else if (ifTrue.equals(ifFalse)) {
      return ifTrue;
    }
    // ifFalse + cond * (ifTrue - ifFalse)
    return cs.multiply("select", cond.lc, ifTrue.subtract(ifFalse)).add(ifFalse);
  }

  /** Returns {@code cond ? ifTrue : ifFalse}. */
  public static Bit select(ConstraintSystem cs, Bit cond, Bit ifTrue, Bit ifFalse) {
    return new Bit(select(cs, cond, ifTrue.lc, ifFalse.lc));
  }

  /** Returns the field element for a boolean. */
  public static BigInteger toField(boolean value) {
    return value ? BigInteger.ONE : BigInteger.ZERO;
  }

  @Override
  public String toString() {
    return isConstant() ? String.valueOf(constantValue()) : lc.toString();
  }
}
