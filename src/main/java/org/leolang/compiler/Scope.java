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

package org.leolang.compiler;

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Span;
import org.leolang.asg.Variable;

/**
 * Maps variable names to Variables for one block (or a function's parameter list). Lookups fall
 * back to the parent scope, so an inner block may shadow a name from an outer one; declaring the
 * same name twice in one scope is an error.
 */
final class Scope {
  final @Nullable Scope parent;
  private final Map<String, Variable> variables = new HashMap<>();

  Scope(@Nullable Scope parent) {
    this.parent = parent;
  }

  /** Returns the innermost Variable with the given name, or null if there is none. */
  @Nullable Variable lookup(String name) {
    for (Scope scope = this; scope != null; scope = scope.parent) {
      Variable v = scope.variables.get(name);
      if (v != null) {
        return v;
      }
    }
    return null;
  }

  void declare(Variable variable, Span span) {
    Variable prev = variables.putIfAbsent(variable.name, variable);
    if (prev != null) {
      throw Compiler.error(
          ErrorKind.DUPLICATE_DECLARATION, span, "Duplicate definition of '%s'", variable.name);
    }
  }
}
