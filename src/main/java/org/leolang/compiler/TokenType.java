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

import com.google.common.collect.ImmutableMap;
import org.antlr.v4.runtime.Vocabulary;

/**
 * A statics-only class providing convenient access to ANTLR token types (which are just ints).
 *
 * <p>ANTLR's Vocabulary class doesn't provide a direct way to get the token type for a particular
 * token, so we build a map of them and look up each one we're interested in once.
 */
class TokenType {

  // Statics only
  private TokenType() {}

  /**
   * A Map from token name to token type. Token names are either literals enclosed in single quotes
   * (e.g. "{@code '+'}") or symbolic names (e.g. "{@code INTEGER}").
   */
  static final ImmutableMap<String, Integer> MAP;

  static {
    // Token types are densely allocated starting from 1.
    Vocabulary vocab = LeoLexer.VOCABULARY;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 1; i <= vocab.getMaxTokenType(); i++) {
      String s = vocab.getLiteralName(i);
      if (s == null) {
        s = vocab.getSymbolicName(i);
        if (s == null) {
          continue;
        }
      }
      builder.put(s, i);
    }
    MAP = builder.buildOrThrow();
  }

  /**
   * Returns the token type for the given name. Throws an exception if there is no such token name.
   */
  static int of(String name) {
    Integer result = MAP.get(name);
    if (result == null) {
      throw new IllegalArgumentException("No token named " + name);
    }
    return result;
  }

  static final int MINUS = of("'-'");
  static final int MUT = of("'mut'");
  static final int CONST = of("'const'");
  static final int SELF = of("'self'");
  static final int SELF_TYPE = of("'Self'");
  static final int TRUE = of("'true'");
  static final int LOG = of("'log'");
  static final int DEBUG = of("'debug'");
}
