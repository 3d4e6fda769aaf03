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

package org.leolang.synth;

import com.google.common.collect.ImmutableList;
import org.leolang.gadgets.Bit;
import org.leolang.gadgets.FieldGadgets;
import org.leolang.gadgets.GroupGadgets;
import org.leolang.r1cs.ConstraintSystem;

/** Selection and equality over whole value trees. */
final class Values {

  // Statics only
  private Values() {}

  /** Returns {@code cond ? ifTrue : ifFalse}, selecting leaf by leaf. */
  static Value select(ConstraintSystem cs, Bit cond, Value ifTrue, Value ifFalse) {
    if (cond.isConstant()) {
      return cond.constantValue() ? ifTrue : ifFalse;
    } else if (ifTrue == ifFalse) {
      return ifTrue;
    }
    if (ifTrue instanceof Value.Bool) {
      return Value.bool(
          Bit.select(cs, cond, ((Value.Bool) ifTrue).bit, ((Value.Bool) ifFalse).bit));
    } else if (ifTrue instanceof Value.Int) {
      Value.Int a = (Value.Int) ifTrue;
      return Value.integer(a.integerType, Bit.select(cs, cond, a.lc, ((Value.Int) ifFalse).lc));
    } else if (ifTrue instanceof Value.Field) {
      return Value.field(
          Bit.select(cs, cond, ((Value.Field) ifTrue).lc, ((Value.Field) ifFalse).lc));
    } else if (ifTrue instanceof Value.Group) {
      return Value.group(
          GroupGadgets.select(
              cs, cond, ((Value.Group) ifTrue).point, ((Value.Group) ifFalse).point));
    } else if (ifTrue instanceof Value.Address) {
      Value.Address a = (Value.Address) ifTrue;
      Value.Address b = (Value.Address) ifFalse;
      return new Value.Address(
          Bit.select(cs, cond, a.high, b.high), Bit.select(cs, cond, a.low, b.low));
    }
    Value.Aggregate a = (Value.Aggregate) ifTrue;
    Value.Aggregate b = (Value.Aggregate) ifFalse;
    ImmutableList.Builder<Value> elements = ImmutableList.builder();
    for (int i = 0; i < a.elements.size(); i++) {
      elements.add(select(cs, cond, a.elements.get(i), b.elements.get(i)));
    }
    return a.withElements(elements.build());
  }

  /** Returns a bit that is one iff the two values are equal, comparing leaf by leaf. */
  static Bit isEqual(ConstraintSystem cs, Value left, Value right) {
    if (left instanceof Value.Bool) {
      return ((Value.Bool) left).bit.xor(cs, ((Value.Bool) right).bit).not();
    } else if (left instanceof Value.Int) {
      return FieldGadgets.isEqual(cs, ((Value.Int) left).lc, ((Value.Int) right).lc);
    } else if (left instanceof Value.Field) {
      return FieldGadgets.isEqual(cs, ((Value.Field) left).lc, ((Value.Field) right).lc);
    } else if (left instanceof Value.Group) {
      return GroupGadgets.isEqual(cs, ((Value.Group) left).point, ((Value.Group) right).point);
    } else if (left instanceof Value.Address) {
      Value.Address a = (Value.Address) left;
      Value.Address b = (Value.Address) right;
      return FieldGadgets.isEqual(cs, a.high, b.high)
          .and(cs, FieldGadgets.isEqual(cs, a.low, b.low));
    }
    Value.Aggregate a = (Value.Aggregate) left;
    Value.Aggregate b = (Value.Aggregate) right;
    Bit result = Bit.TRUE;
    for (int i = 0; i < a.elements.size(); i++) {
      result = result.and(cs, isEqual(cs, a.elements.get(i), b.elements.get(i)));
    }
    return result;
  }
}
