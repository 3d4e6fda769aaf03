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

import com.google.common.base.Preconditions;
import org.leolang.r1cs.LinearCombination;

/** A point of {@link EdwardsBls12} whose coordinates are linear combinations. */
public final class GroupElement {
  public final LinearCombination x;
  public final LinearCombination y;

  public GroupElement(LinearCombination x, LinearCombination y) {
    this.x = x;
    this.y = y;
  }

  public static GroupElement constant(EdwardsBls12.AffinePoint point) {
    return new GroupElement(
        LinearCombination.constant(point.x), LinearCombination.constant(point.y));
  }

  public boolean isConstant() {
    return x.isConstant() && y.isConstant();
  }

  public EdwardsBls12.AffinePoint constantValue() {
    Preconditions.checkState(isConstant());
    return new EdwardsBls12.AffinePoint(x.constantValue(), y.constantValue());
  }

  boolean isIdentity() {
    return isConstant() && constantValue().equals(EdwardsBls12.IDENTITY);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
