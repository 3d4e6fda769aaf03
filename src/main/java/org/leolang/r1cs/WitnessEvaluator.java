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

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/** Holds the wire values computed so far while generating a witness. */
public final class WitnessEvaluator {
  private final Map<String, BigInteger> inputs;
  private final Map<Wire, BigInteger> values = new HashMap<>();

  WitnessEvaluator(Map<String, BigInteger> inputs) {
    this.inputs = inputs;
  }

  /** Returns the value of an already-computed wire. */
  public BigInteger value(Wire wire) {
    BigInteger result = values.get(wire);
    Preconditions.checkState(result != null, "%s has not been computed", wire);
    return result;
  }

  public BigInteger value(LinearCombination lc) {
    return lc.evaluate(this::value);
  }

  /** Returns the named input leaf, as a field element. */
  public BigInteger input(String key) {
    BigInteger result = inputs.get(key);
    Preconditions.checkState(result != null, "No value for input '%s'", key);
    return Fr.reduce(result);
  }

  void set(Wire wire, BigInteger value) {
    values.put(wire, Fr.reduce(value));
  }

  Map<Wire, BigInteger> values() {
    return values;
  }
}
