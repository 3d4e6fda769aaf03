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

import java.math.BigInteger;

/**
 * Computes the value of one wire during witness generation, from the circuit inputs and the values
 * of previously allocated wires.
 */
@FunctionalInterface
public interface WitnessInstruction {
  BigInteger compute(WitnessEvaluator evaluator);

  /** Returns an instruction that reads the named input leaf. */
  static WitnessInstruction input(String key) {
    return evaluator -> evaluator.input(key);
  }
}
