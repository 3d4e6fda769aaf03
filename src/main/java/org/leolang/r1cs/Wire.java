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

/**
 * A variable of the constraint system. Wires are created by {@link ConstraintSystem#allocate} and
 * ordered by allocation.
 */
public final class Wire implements Comparable<Wire> {

  public enum Visibility {
    /** Known to the verifier. */
    PUBLIC,
    /** A circuit input known only to the prover. */
    PRIVATE,
    /** An intermediate value computed from the inputs. */
    AUXILIARY
  }

  /** Position in allocation order, across all wires of the system. */
  public final int id;

  public final String name;
  public final Visibility visibility;

  /** True for wires allocated while evaluating console output; these are never constrained. */
  public final boolean diagnostic;

  Wire(int id, String name, Visibility visibility, boolean diagnostic) {
    this.id = id;
    this.name = name;
    this.visibility = visibility;
    this.diagnostic = diagnostic;
  }

  @Override
  public int compareTo(Wire other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public String toString() {
    return "w" + id + "(" + name + ")";
  }
}
