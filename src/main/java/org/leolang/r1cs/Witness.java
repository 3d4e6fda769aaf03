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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/** An assignment of values to the wires of a constraint system. */
public final class Witness {
  private final ConstraintSystem system;
  private final ImmutableMap<Wire, BigInteger> values;

  Witness(ConstraintSystem system, ImmutableMap<Wire, BigInteger> values) {
    this.system = system;
    this.values = values;
  }

  public BigInteger value(Wire wire) {
    BigInteger result = values.get(wire);
    if (result == null) {
      throw new IllegalArgumentException("No value for " + wire);
    }
    return result;
  }

  public BigInteger value(LinearCombination lc) {
    return lc.evaluate(this::value);
  }

  /** Returns the first constraint not satisfied by this witness, or null if they all are. */
  public @Nullable Constraint firstUnsatisfied() {
    for (Constraint constraint : system.constraints()) {
      if (!constraint.isSatisfied(this::value)) {
        return constraint;
      }
    }
    return null;
  }

  public boolean isSatisfied() {
    return firstUnsatisfied() == null;
  }

  /** The values of the public wires, in allocation order. */
  public ImmutableList<BigInteger> publicValues() {
    return system.wiresWith(Wire.Visibility.PUBLIC).stream()
        .map(this::value)
        .collect(ImmutableList.toImmutableList());
  }
}
