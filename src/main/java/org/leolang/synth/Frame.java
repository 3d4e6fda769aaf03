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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Span;
import org.leolang.asg.Variable;
import org.leolang.gadgets.Bit;
import org.leolang.r1cs.ConstraintSystem;

/**
 * The current value of each variable of one (inlined) function call. Mutation rebinds a variable
 * to a new value; nothing is updated in place.
 *
 * <p>Each branch of a conditional runs in a copy of the enclosing frame, which records the
 * variables it assigns; {@link #merge} then selects between the two versions of just those
 * variables.
 *
 * <p>A frame also tracks whether the function may already have returned, and the value it
 * returned if so.
 */
final class Frame {
  private final Map<Variable, Value> values;

  /** Variables of an enclosing frame that were assigned in this one. */
  private final Set<Variable> written = new LinkedHashSet<>();

  /** One if a return statement has been executed on the current path. */
  Bit returned = Bit.FALSE;

  /** The value returned, if {@link #returned} may be one. */
  @Nullable Value result;

  Frame() {
    this.values = new LinkedHashMap<>();
  }

  private Frame(Frame parent) {
    this.values = new LinkedHashMap<>(parent.values);
    this.returned = parent.returned;
    this.result = parent.result;
  }

  /** Returns a frame for one branch of a conditional. */
  Frame branch() {
    return new Frame(this);
  }

  /** True if nothing after this point can execute. */
  boolean hasReturned() {
    return returned.isConstant() && returned.constantValue();
  }

  Value get(Variable variable, Span span) {
    Value value = values.get(variable);
    if (value == null) {
      throw SynthesisError.create(
          ErrorKind.UNRESOLVED_VARIABLE, span, "No value for variable '%s'", variable.name);
    }
    return value;
  }

  /** Binds a newly declared variable. */
  void define(Variable variable, Value value) {
    values.put(variable, value);
  }

  /**
   * Rebinds a variable. If the function may already have returned, the new value only takes
   * effect on paths where it has not.
   */
  void assign(ConstraintSystem cs, Variable variable, Value value) {
    Value old = values.get(variable);
    if (old != null && !(returned.isConstant() && !returned.constantValue())) {
      value = Values.select(cs, returned, old, value);
    }
    values.put(variable, value);
    written.add(variable);
  }

  /** Records the value of a return statement. */
  void setResult(ConstraintSystem cs, Value value) {
    result = (result == null) ? value : Values.select(cs, returned, result, value);
    returned = Bit.TRUE;
  }

  /**
   * Updates this frame to reflect a conditional that ran {@code ifTrue} when {@code cond} is one
   * and {@code ifFalse} otherwise; both must have been created by {@link #branch} on this frame.
   */
  void merge(ConstraintSystem cs, Bit cond, Frame ifTrue, Frame ifFalse) {
    Set<Variable> changed = new LinkedHashSet<>(ifTrue.written);
    changed.addAll(ifFalse.written);
    for (Variable variable : changed) {
      if (values.containsKey(variable)) {
        Value merged =
            Values.select(cs, cond, ifTrue.values.get(variable), ifFalse.values.get(variable));
        values.put(variable, merged);
        written.add(variable);
      }
    }
    if (ifTrue.result == null) {
      result = ifFalse.result;
    } else if (ifFalse.result == null) {
      result = ifTrue.result;
    } else {
      result = Values.select(cs, cond, ifTrue.result, ifFalse.result);
    }
    returned = Bit.select(cs, cond, ifTrue.returned, ifFalse.returned);
  }
}
