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

package org.leolang.gadgets;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a gadget is applied to values that can be shown to be invalid while the constraint
 * system is being built, e.g. dividing by a constant zero.
 */
public class GadgetException extends RuntimeException {

  public enum Reason {
    OVERFLOW,
    DIVISION_BY_ZERO,
    INVALID_INDEX,
    INVALID_GROUP,
    NON_CONSTANT_EXPONENT
  }

  public final Reason reason;

  @FormatMethod
  public GadgetException(Reason reason, String fmt, Object... fmtArgs) {
    super(String.format(fmt, fmtArgs));
    this.reason = reason;
  }
}
