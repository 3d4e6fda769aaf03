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

/** A named binding: a local, a parameter, a loop variable, or a function's receiver. */
public final class Variable {

  public enum Kind {
    /** Declared with {@code let} or {@code let mut}. */
    LET,
    /** Declared with {@code const}. */
    CONST,
    PARAMETER,
    CONST_PARAMETER,
    LOOP,
    SELF
  }

  public final String name;
  public final Type type;
  public final Kind kind;
  public final boolean mutable;

  /** True if the value of this variable is known when the circuit is synthesized. */
  public final boolean constant;

  public final Span span;

  public Variable(String name, Type type, Kind kind, boolean mutable, boolean constant, Span span) {
    this.name = name;
    this.type = type;
    this.kind = kind;
    this.mutable = mutable;
    this.constant = constant;
    this.span = span;
  }

  @Override
  public String toString() {
    return name;
  }
}
