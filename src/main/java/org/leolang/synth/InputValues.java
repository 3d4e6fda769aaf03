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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.leolang.gadgets.Bech32;
import org.leolang.r1cs.LinearCombination;

/**
 * Values for the input leaves of a compiled circuit, keyed by leaf path: the parameter name, then
 * {@code .i} for a tuple element, {@code [i]} for an array element, {@code .name} for a circuit
 * member, {@code .x}/{@code .y} for a group coordinate and {@code .high}/{@code .low} for an
 * address limb.
 *
 * <p>Integers are given by their value; negative values are stored as their field encoding by the
 * witness generator.
 */
public final class InputValues {
  public static final InputValues EMPTY = builder().build();

  private final ImmutableMap<String, BigInteger> leaves;

  private InputValues(ImmutableMap<String, BigInteger> leaves) {
    this.leaves = leaves;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableMap<String, BigInteger> leaves() {
    return leaves;
  }

  @Override
  public String toString() {
    return leaves.toString();
  }

  public static final class Builder {
    private final Map<String, BigInteger> leaves = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder set(String path, BigInteger value) {
      leaves.put(path, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder set(String path, long value) {
      return set(path, BigInteger.valueOf(value));
    }

    @CanIgnoreReturnValue
    public Builder setBoolean(String path, boolean value) {
      return set(path, value ? BigInteger.ONE : BigInteger.ZERO);
    }

    /** Sets both limbs of an address from its bech32 text. */
    @CanIgnoreReturnValue
    public Builder setAddress(String path, String address) {
      ImmutableList<BigInteger> limbs = Bech32.addressLimbs(address);
      set(path + ".high", limbs.get(0));
      return set(path + ".low", limbs.get(1));
    }

    /** Sets all the leaves of a constant value. */
    @CanIgnoreReturnValue
    Builder addValue(String path, Value value) {
      Preconditions.checkArgument(value.isConstant(), "%s is not constant", path);
      Map<String, LinearCombination> lcs = new LinkedHashMap<>();
      value.addLeaves(path, lcs);
      lcs.forEach((leaf, lc) -> set(leaf, lc.constantValue()));
      return this;
    }

    public InputValues build() {
      return new InputValues(ImmutableMap.copyOf(leaves));
    }
  }
}
