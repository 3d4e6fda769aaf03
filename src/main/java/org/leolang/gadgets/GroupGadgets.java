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

import java.util.List;
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.LinearCombination;
import org.leolang.r1cs.WitnessEvaluator;

/** In-circuit arithmetic on {@link EdwardsBls12} points. */
public final class GroupGadgets {

  private static final GroupElement IDENTITY = GroupElement.constant(EdwardsBls12.IDENTITY);

  // Statics only
  private GroupGadgets() {}

  private static EdwardsBls12.AffinePoint value(WitnessEvaluator ev, GroupElement p) {
    return new EdwardsBls12.AffinePoint(ev.value(p.x), ev.value(p.y));
  }

  /**
   * Returns {@code p + q}. With {@code A = x1 x2}, {@code B = y1 y2}, {@code P = (x1 + y1)(x2 +
   * y2)} and {@code T = A B}, the sum is constrained by {@code x3 (1 + d T) = P - A - B} and {@code
   * y3 (1 - d T) = A + B}.
   */
  public static GroupElement add(ConstraintSystem cs, GroupElement p, GroupElement q) {
    if (p.isConstant() && q.isConstant()) {
      return GroupElement.constant(p.constantValue().add(q.constantValue()));
    } else if (p.isIdentity()) {
      return q;
    } else if (q.isIdentity()) {
      return p;
    }
    LinearCombination a = cs.multiply("group.add.a", p.x, q.x);
    LinearCombination b = cs.multiply("group.add.b", p.y, q.y);
    LinearCombination sum = cs.multiply("group.add.p", p.x.add(p.y), q.x.add(q.y));
    LinearCombination dt = cs.multiply("group.add.t", a, b).scale(EdwardsBls12.D);
    LinearCombination x3 =
        cs.auxiliary("group.add.x", ev -> value(ev, p).add(value(ev, q)).x);
    LinearCombination y3 =
        cs.auxiliary("group.add.y", ev -> value(ev, p).add(value(ev, q)).y);
    cs.enforce("group.add.x", x3, LinearCombination.ONE.add(dt), sum.subtract(a).subtract(b));
    cs.enforce("group.add.y", y3, LinearCombination.ONE.subtract(dt), a.add(b));
    return new GroupElement(x3, y3);
  }

  public static GroupElement negate(GroupElement p) {
    return new GroupElement(p.x.negate(), p.y);
  }

  public static GroupElement subtract(ConstraintSystem cs, GroupElement p, GroupElement q) {
    return add(cs, p, negate(q));
  }

  public static GroupElement select(
      ConstraintSystem cs, Bit cond, GroupElement ifTrue, GroupElement ifFalse) {
    return new GroupElement(
        Bit.select(cs, cond, ifTrue.x, ifFalse.x), Bit.select(cs, cond, ifTrue.y, ifFalse.y));
  }

  public static Bit isEqual(ConstraintSystem cs, GroupElement p, GroupElement q) {
    Bit xEqual = FieldGadgets.isEqual(cs, p.x, q.x);
    return xEqual.and(cs, FieldGadgets.isEqual(cs, p.y, q.y));
  }

  /**
   * Returns the sum of {@code 2^i p} over the little-endian {@code bits} that are set. When
   * {@code p} is a constant the multiples are too, and each step costs only the addition.
   */
  public static GroupElement multiply(ConstraintSystem cs, GroupElement p, List<Bit> bits) {
    GroupElement result = IDENTITY;
    GroupElement current = p;
    for (int i = 0; i < bits.size(); i++) {
      result = add(cs, result, select(cs, bits.get(i), current, IDENTITY));
      if (i < bits.size() - 1) {
        current = add(cs, current, current);
      }
    }
    return result;
  }

  /** Constrains {@code p} to satisfy the curve equation. */
  public static void enforceOnCurve(ConstraintSystem cs, GroupElement p) {
    if (p.isConstant()) {
      if (!p.constantValue().isOnCurve()) {
        throw new GadgetException(
            GadgetException.Reason.INVALID_GROUP, "%s is not on the curve", p);
      }
      return;
    }
    LinearCombination xx = cs.multiply("curve.xx", p.x, p.x);
    LinearCombination yy = cs.multiply("curve.yy", p.y, p.y);
    // d x^2 y^2 = y^2 - x^2 - 1
    cs.enforce(
        "curve",
        xx.scale(EdwardsBls12.D),
        yy,
        yy.subtract(xx).subtract(LinearCombination.ONE));
  }
}
