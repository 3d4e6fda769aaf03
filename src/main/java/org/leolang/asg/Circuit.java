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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A circuit (record) declaration: ordered, named, typed members plus associated functions. */
public final class Circuit {
  public final String name;
  public final Span span;
  private final DeclarationArena arena;
  public final int index;

  /** Null until the member types have been resolved. */
  private ImmutableMap<String, Type> members;

  private final Map<String, Function> functions = new LinkedHashMap<>();

  Circuit(String name, Span span, DeclarationArena arena, int index) {
    this.name = name;
    this.span = span;
    this.arena = arena;
    this.index = index;
  }

  /** Returns the type of instances of this circuit. */
  public Type.CircuitRef type() {
    return new Type.CircuitRef(arena, index);
  }

  public void setMembers(Map<String, Type> members) {
    Preconditions.checkState(this.members == null);
    this.members = ImmutableMap.copyOf(members);
  }

  /** The members in declaration order. */
  public ImmutableMap<String, Type> members() {
    Preconditions.checkState(members != null, "Members of %s not yet resolved", name);
    return members;
  }

  public @Nullable Type memberType(String memberName) {
    return members().get(memberName);
  }

  /** Returns the position of the named member, or -1. */
  public int memberIndex(String memberName) {
    return members().keySet().asList().indexOf(memberName);
  }

  public void addFunction(Function fn) {
    functions.put(fn.name, fn);
  }

  public @Nullable Function function(String fnName) {
    return functions.get(fnName);
  }

  public Iterable<Function> functions() {
    return functions.values();
  }

  @Override
  public String toString() {
    return name;
  }
}
