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

import org.leolang.asg.ErrorKind;
import org.leolang.asg.Span;

/** All Leo language errors detected while parsing or resolving a program throw a CompileError. */
public class CompileError extends RuntimeException {
  public final ErrorKind kind;
  public final String msg;
  public final Span span;

  public CompileError(ErrorKind kind, String msg, Span span) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.span = span;
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, span.lineStart, span.colStart);
  }
}
