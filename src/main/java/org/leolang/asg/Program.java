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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The resolved semantic graph of one source file: its own circuits and functions, plus whatever
 * declarations it imported from other programs.
 */
public final class Program {
  public final String path;
  public final DeclarationArena arena;
  public final ImmutableMap<String, Circuit> circuits;
  public final ImmutableMap<String, Function> functions;

  /** Declarations made visible by {@code import}, keyed by the name they are visible as. */
  public final ImmutableMap<String, Object> imports;

  public Program(
      String path,
      DeclarationArena arena,
      ImmutableMap<String, Circuit> circuits,
      ImmutableMap<String, Function> functions,
      ImmutableMap<String, Object> imports) {
    this.path = path;
    this.arena = arena;
    this.circuits = circuits;
    this.functions = functions;
    this.imports = imports;
  }

  /** Returns the named top-level function, including imported ones, or null. */
  public @Nullable Function function(String name) {
    Function fn = functions.get(name);
    if (fn == null && imports.get(name) instanceof Function) {
      fn = (Function) imports.get(name);
    }
    return fn;
  }

  /** Returns the named circuit, including imported ones, or null. */
  public @Nullable Circuit circuit(String name) {
    Circuit circuit = circuits.get(name);
    if (circuit == null && imports.get(name) instanceof Circuit) {
      circuit = (Circuit) imports.get(name);
    }
    return circuit;
  }
}
