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
import java.util.function.Function;

/** A rank-1 constraint {@code a * b = c}. */
public final class Constraint {
  public final String name;
  public final LinearCombination a;
  public final LinearCombination b;
  public final LinearCombination c;

  Constraint(String name, LinearCombination a, LinearCombination b, LinearCombination c) {
    this.name = name;
    this.a = a;
    this.b = b;
    this.c = c;
  }

  public boolean isSatisfied(Function<Wire, BigInteger> wireValues) {
    BigInteger left = Fr.multiply(a.evaluate(wireValues), b.evaluate(wireValues));
    return left.equals(c.evaluate(wireValues));
  }

  @Override
  public String toString() {
    return String.format("%s: (%s) * (%s) = (%s)", name, a, b, c);
  }
}
