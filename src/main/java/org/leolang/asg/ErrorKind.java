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

/** The categories of error reported by the front end, the builder, and the synthesizer. */
public enum ErrorKind {
  // Reported by the parser
  SYNTAX,

  // Reported during resolution
  UNRESOLVED_IDENTIFIER,
  DUPLICATE_DECLARATION,
  WRONG_ARITY,
  TYPE_MISMATCH,
  IMMUTABLE_ASSIGNMENT,
  NON_CONSTANT_LOOP_BOUND,
  NON_CONSTANT_ARGUMENT,
  LITERAL_OUT_OF_RANGE,
  INVALID_TUPLE_ARITY,
  INDEX_OUT_OF_BOUNDS,
  UNTYPED_LITERAL,
  INVALID_CALL,
  INVALID_LITERAL,
  INVALID_FORMAT,
  MISSING_RETURN,
  RECURSION,

  // Reported during synthesis
  INTEGER_OVERFLOW,
  DIVISION_BY_ZERO,
  INVALID_ARRAY_INDEX,
  INVALID_GROUP,
  NON_CONSTANT_EXPONENT,
  UNRESOLVED_VARIABLE,
  UNROLL_LIMIT,
  MISSING_INPUT
}
