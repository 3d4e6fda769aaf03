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

package org.leolang;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for a single compilation. Instances are immutable; use {@link #builder} or {@link
 * #fromSystemProperties}.
 */
public final class CompilerOptions {

  /** The name of the function whose parameters become the circuit's inputs, unless overridden. */
  public static final String DEFAULT_ENTRY = "main";

  /** The default limit on the total number of unrolled loop iterations. */
  public static final int DEFAULT_MAX_ITERATIONS = 1_000_000;

  public static final CompilerOptions DEFAULTS = builder().build();

  public final String entryFunction;

  /**
   * The maximum number of loop iterations that synthesis will unroll (summed over all loops) before
   * giving up.
   */
  public final int maxUnrolledIterations;

  /** If true, console print statements on the taken path are logged during witness generation. */
  public final boolean logConsole;

  /**
   * Values for the entry function's {@code const} parameters, as Leo literal text (e.g. {@code
   * "3u8"}), keyed by parameter name.
   */
  public final ImmutableMap<String, String> constants;

  private CompilerOptions(Builder builder) {
    this.entryFunction = builder.entryFunction;
    this.maxUnrolledIterations = builder.maxUnrolledIterations;
    this.logConsole = builder.logConsole;
    this.constants = ImmutableMap.copyOf(builder.constants);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options initialized from the {@code leolang.entry}, {@code leolang.maxIterations}, and
   * {@code leolang.logConsole} system properties, using the defaults for any that are not set.
   */
  public static CompilerOptions fromSystemProperties() {
    Builder builder = builder();
    String entry = System.getProperty("leolang.entry");
    if (entry != null) {
      builder.setEntryFunction(entry);
    }
    String maxIterations = System.getProperty("leolang.maxIterations");
    if (maxIterations != null) {
      builder.setMaxUnrolledIterations(Integer.parseInt(maxIterations));
    }
    String logConsole = System.getProperty("leolang.logConsole");
    if (logConsole != null) {
      builder.setLogConsole(Boolean.parseBoolean(logConsole));
    }
    return builder.build();
  }

  /** A mutable builder for {@link CompilerOptions}. */
  public static final class Builder {
    private String entryFunction = DEFAULT_ENTRY;
    private int maxUnrolledIterations = DEFAULT_MAX_ITERATIONS;
    private boolean logConsole = true;
    private final Map<String, String> constants = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setEntryFunction(String entryFunction) {
      this.entryFunction = Preconditions.checkNotNull(entryFunction);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxUnrolledIterations(int maxUnrolledIterations) {
      Preconditions.checkArgument(maxUnrolledIterations >= 0);
      this.maxUnrolledIterations = maxUnrolledIterations;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLogConsole(boolean logConsole) {
      this.logConsole = logConsole;
      return this;
    }

    /** Supplies the value of a {@code const} parameter of the entry function. */
    @CanIgnoreReturnValue
    public Builder setConstant(String paramName, String literal) {
      constants.put(paramName, literal);
      return this;
    }

    public CompilerOptions build() {
      return new CompilerOptions(this);
    }
  }
}
