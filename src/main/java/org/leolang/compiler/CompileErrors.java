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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * Thrown when resolution finds one or more errors. Each top-level declaration stops at its first
 * error, but all declarations are checked; the errors are sorted by position.
 */
public class CompileErrors extends RuntimeException {
  public final ImmutableList<CompileError> errors;

  public CompileErrors(Collection<CompileError> errors) {
    Preconditions.checkArgument(!errors.isEmpty());
    this.errors =
        errors.stream()
            .sorted(Comparator.comparing((CompileError e) -> e.span))
            .collect(ImmutableList.toImmutableList());
  }

  /** Returns the first error, in source order. */
  public CompileError first() {
    return errors.get(0);
  }

  @Override
  public String getMessage() {
    return errors.stream().map(CompileError::getMessage).collect(Collectors.joining("\n"));
  }
}
