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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * An ordered rank-1 constraint system under construction, together with the instructions that
 * compute each wire's value during witness generation.
 *
 * <p>While {@link #diagnostic} is running, allocated wires are marked as diagnostic and
 * constraints are discarded: the values are computed for console output but never constrained,
 * and none of them appear in {@link #wires} or {@link #constraints}.
 */
public final class ConstraintSystem {
  private final List<Wire> allWires = new ArrayList<>();
  private final List<WitnessInstruction> instructions = new ArrayList<>();
  private final List<Wire> wires = new ArrayList<>();
  private final List<Constraint> constraints = new ArrayList<>();

  /** Prepended to the names of wires and constraints. */
  private String namespace = "";

  private int diagnosticDepth;

  /**
   * Allocates a new wire.
   *
   * @param name describes the wire's value, for debugging
   * @param instruction computes the wire's value during witness generation
   */
  public Wire allocate(String name, Wire.Visibility visibility, WitnessInstruction instruction) {
    boolean diagnostic = diagnosticDepth > 0;
    Preconditions.checkState(!diagnostic || visibility == Wire.Visibility.AUXILIARY);
    Wire wire = new Wire(allWires.size(), namespace + name, visibility, diagnostic);
    allWires.add(wire);
    instructions.add(instruction);
    if (!diagnostic) {
      wires.add(wire);
    }
    return wire;
  }

  /** Allocates an auxiliary wire and returns it as a linear combination. */
  public LinearCombination auxiliary(String name, WitnessInstruction instruction) {
    return LinearCombination.of(allocate(name, Wire.Visibility.AUXILIARY, instruction));
  }

  /**
   * Adds the constraint {@code a * b = c}. Constraints between constants that are trivially
   * satisfied are dropped; unsatisfiable ones are kept, so that the system has no valid witness.
   */
  public void enforce(String name, LinearCombination a, LinearCombination b, LinearCombination c) {
    if (diagnosticDepth > 0) {
      return;
    }
    Preconditions.checkArgument(!a.isDiagnostic() && !b.isDiagnostic() && !c.isDiagnostic());
    if (a.isConstant() && b.isConstant() && c.isConstant()) {
      if (Fr.multiply(a.constantValue(), b.constantValue()).equals(c.constantValue())) {
        return;
      }
    }
    constraints.add(new Constraint(namespace + name, a, b, c));
  }

  /** Adds the constraint {@code a = b}. */
  public void enforceEqual(String name, LinearCombination a, LinearCombination b) {
    enforce(name, a, LinearCombination.ONE, b);
  }

  /** Allocates a wire for {@code a * b} and constrains it; folds constants. */
  public LinearCombination multiply(String name, LinearCombination a, LinearCombination b) {
    if (a.isConstant()) {
      return b.scale(a.constantValue());
    } else if (b.isConstant()) {
      return a.scale(b.constantValue());
    }
    LinearCombination product =
        auxiliary(name, ev -> Fr.multiply(ev.value(a), ev.value(b)));
    enforce(name, a, b, product);
    return product;
  }

  /** Runs {@code body} with wire allocation in diagnostic mode, and returns its result. */
  @CanIgnoreReturnValue
  public <T> T diagnostic(Supplier<T> body) {
    diagnosticDepth++;
    try {
      return body.get();
    } finally {
      diagnosticDepth--;
    }
  }

  /**
   * Runs {@code body} with {@code prefix + "/"} added to the names of all wires and constraints it
   * creates.
   */
  @CanIgnoreReturnValue
  public <T> T inNamespace(String prefix, Supplier<T> body) {
    String saved = namespace;
    namespace = saved + prefix + "/";
    try {
      return body.get();
    } finally {
      namespace = saved;
    }
  }

  /** The non-diagnostic wires, in allocation order. */
  public ImmutableList<Wire> wires() {
    return ImmutableList.copyOf(wires);
  }

  public ImmutableList<Constraint> constraints() {
    return ImmutableList.copyOf(constraints);
  }

  public int numConstraints() {
    return constraints.size();
  }

  public int numWires() {
    return wires.size();
  }

  public ImmutableList<Wire> wiresWith(Wire.Visibility visibility) {
    return wires.stream()
        .filter(w -> w.visibility == visibility)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Computes the value of every wire (including diagnostic ones) in allocation order.
   *
   * @param inputs the input leaf values read by {@link WitnessInstruction#input}
   */
  public Witness generateWitness(Map<String, BigInteger> inputs) {
    WitnessEvaluator evaluator = new WitnessEvaluator(inputs);
    for (int i = 0; i < allWires.size(); i++) {
      evaluator.set(allWires.get(i), instructions.get(i).compute(evaluator));
    }
    return new Witness(this, ImmutableMap.copyOf(evaluator.values()));
  }

  /** Returns a listing of all wires and constraints; identical systems give identical text. */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    for (Wire wire : wires) {
      sb.append(wire).append(' ').append(wire.visibility).append('\n');
    }
    for (Constraint constraint : constraints) {
      sb.append(constraint).append('\n');
    }
    return sb.toString();
  }
}
