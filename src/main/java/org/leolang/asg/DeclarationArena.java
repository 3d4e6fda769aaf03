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

package org.leolang.asg;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns the circuit declarations of a program. Types refer to circuits by index into the arena
 * ({@link Type.CircuitRef}) rather than holding them directly, so that a circuit can mention its
 * own type before its declaration is complete.
 */
public final class DeclarationArena {
  private final List<Circuit> circuits = new ArrayList<>();

  /** Adds a new, empty circuit declaration and returns it. */
  public Circuit newCircuit(String name, Span span) {
    Circuit circuit = new Circuit(name, span, this, circuits.size());
    circuits.add(circuit);
    return circuit;
  }

  public Circuit circuit(int index) {
    return circuits.get(index);
  }

  public int size() {
    return circuits.size();
  }
}
