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

import com.google.errorprone.annotations.FormatMethod;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Span;

/**
 * Thrown when a resolved program cannot be turned into a constraint system, e.g. because a loop
 * would unroll too far or a constant divisor is zero. No partial constraint system is returned.
 */
public class SynthesisError extends RuntimeException {
  public final ErrorKind kind;
  public final String msg;
  public final Span span;

  public SynthesisError(ErrorKind kind, String msg, Span span) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.span = span;
  }

  @FormatMethod
  static SynthesisError create(ErrorKind kind, Span span, String fmt, Object... fmtArgs) {
    return new SynthesisError(kind, String.format(fmt, fmtArgs), span);
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, span.lineStart, span.colStart);
  }
}
