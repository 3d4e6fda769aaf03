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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The target of an assignment: a mutable variable, optionally followed by member, tuple, index or
 * range accesses, e.g. {@code self.points[i].0}.
 */
public final class Assignee {
  public final Variable root;
  public final ImmutableList<Access> accesses;

  /** The type of the place being assigned. */
  public final Type type;

  public final Span span;

  public Assignee(Variable root, ImmutableList<Access> accesses, Type type, Span span) {
    this.root = root;
    this.accesses = accesses;
    this.type = type;
    this.span = span;
  }

  public enum AccessKind {
    MEMBER,
    TUPLE_INDEX,
    ARRAY_INDEX,
    ARRAY_RANGE
  }

  /** One step of the path from the root variable to the assigned place. */
  public static final class Access {
    public final AccessKind kind;

    /** The member or tuple position, or the start of a range. */
    public final int index;

    /** The end (exclusive) of a range. */
    public final int end;

    /** Non-null iff {@code kind} is {@link AccessKind#ARRAY_INDEX}. */
    public final @Nullable Expression arrayIndex;

    private Access(AccessKind kind, int index, int end, @Nullable Expression arrayIndex) {
      this.kind = kind;
      this.index = index;
      this.end = end;
      this.arrayIndex = arrayIndex;
    }

    public static Access member(int index) {
      return new Access(AccessKind.MEMBER, index, index + 1, null);
    }

    public static Access tupleIndex(int index) {
      return new Access(AccessKind.TUPLE_INDEX, index, index + 1, null);
    }

    public static Access arrayIndex(Expression index) {
      return new Access(AccessKind.ARRAY_INDEX, -1, -1, index);
    }

    public static Access arrayRange(int from, int to) {
      return new Access(AccessKind.ARRAY_RANGE, from, to, null);
    }
  }
}
