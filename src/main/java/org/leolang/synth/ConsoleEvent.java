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

import com.google.common.collect.ImmutableList;
import org.leolang.asg.Span;
import org.leolang.asg.Statement.ConsoleKind;
import org.leolang.gadgets.Bit;
import org.leolang.r1cs.Witness;

/**
 * A {@code console.log}, {@code console.debug} or {@code console.error} statement reached during
 * synthesis. Its arguments and the condition under which it executes are computed from diagnostic
 * wires, so they add nothing to the constraint system; they are only evaluated by the witness.
 */
public final class ConsoleEvent {
  public final ConsoleKind kind;
  public final Span span;
  private final ImmutableList<String> fragments;
  private final ImmutableList<Value> args;
  private final Bit indicator;

  ConsoleEvent(
      ConsoleKind kind,
      Span span,
      ImmutableList<String> fragments,
      ImmutableList<Value> args,
      Bit indicator) {
    this.kind = kind;
    this.span = span;
    this.fragments = fragments;
    this.args = args;
    this.indicator = indicator;
  }

  /** True if the statement is on the path taken by the given witness. */
  public boolean isActive(Witness witness) {
    return witness.value(indicator.lc()).signum() != 0;
  }

  /** Returns the message, with each {@code {}} replaced by the corresponding argument. */
  public String format(Witness witness) {
    StringBuilder sb = new StringBuilder(fragments.get(0));
    for (int i = 0; i < args.size(); i++) {
      sb.append(args.get(i).format(witness::value)).append(fragments.get(i + 1));
    }
    return sb.toString();
  }
}
