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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.leolang.CompilerOptions;
import org.leolang.Logging;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Function;
import org.leolang.asg.Program;
import org.leolang.asg.Span;
import org.leolang.asg.Type;
import org.leolang.asg.Variable;
import org.leolang.compiler.Compiler;
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.LinearCombination;
import org.leolang.r1cs.Wire;
import org.leolang.r1cs.Witness;

/**
 * The result of synthesizing a program: a constraint system together with what is needed to
 * generate witnesses for it and to interpret them.
 */
public final class CompiledCircuit {

  private static final Logger consoleLogger = Logging.getConsoleLogger();

  /** The prefix of the output leaf paths. */
  public static final String OUTPUT = "output";

  public final Program program;
  public final Function entry;
  private final CompilerOptions options;
  private final ConstraintSystem cs;

  /** The input leaves, with the span of the parameter each belongs to. */
  private final ImmutableMap<String, Span> inputs;

  private final Value output;
  private final ImmutableList<ConsoleEvent> events;

  CompiledCircuit(
      Program program,
      Function entry,
      CompilerOptions options,
      ConstraintSystem cs,
      ImmutableMap<String, Span> inputs,
      Value output,
      ImmutableList<ConsoleEvent> events) {
    this.program = program;
    this.entry = entry;
    this.options = options;
    this.cs = cs;
    this.inputs = inputs;
    this.output = output;
    this.events = events;
  }

  public ConstraintSystem constraintSystem() {
    return cs;
  }

  public ImmutableList<Wire> publicInputs() {
    return cs.wiresWith(Wire.Visibility.PUBLIC);
  }

  public ImmutableList<Wire> privateInputs() {
    return cs.wiresWith(Wire.Visibility.PRIVATE);
  }

  /** The paths of the input leaves a witness needs values for, in allocation order. */
  public ImmutableList<String> inputNames() {
    return inputs.keySet().asList();
  }

  public Type outputType() {
    return output.type();
  }

  public ImmutableList<ConsoleEvent> consoleEvents() {
    return events;
  }

  /**
   * Parses the Leo literal text given for each non-const entry parameter.
   *
   * @throws SynthesisError if a parameter has no value
   * @throws org.leolang.compiler.CompileError if a value cannot be parsed as the parameter's type
   */
  public InputValues parseInputs(Map<String, String> literals) {
    InputValues.Builder builder = InputValues.builder();
    for (Variable param : entry.params) {
      if (param.kind == Variable.Kind.CONST_PARAMETER) {
        continue;
      }
      String text = literals.get(param.name);
      if (text == null) {
        throw SynthesisError.create(
            ErrorKind.MISSING_INPUT, param.span, "No value given for '%s'", param.name);
      }
      Value value =
          Synthesizer.evaluateConstant(
              program, Compiler.parseLiteral(text, param.type, program));
      builder.addValue(param.name, value);
    }
    return builder.build();
  }

  /**
   * Computes the value of every wire from the given inputs. The witness may not satisfy the
   * constraints (for example if an assertion fails); use {@link Witness#isSatisfied} to check.
   *
   * @throws SynthesisError if an input leaf has no value
   */
  public Witness generateWitness(InputValues values) {
    ImmutableMap<String, BigInteger> leaves = values.leaves();
    inputs.forEach(
        (key, span) -> {
          if (!leaves.containsKey(key)) {
            throw SynthesisError.create(
                ErrorKind.MISSING_INPUT, span, "No value given for input '%s'", key);
          }
        });
    Witness witness = cs.generateWitness(leaves);
    if (options.logConsole) {
      for (ConsoleEvent event : events) {
        if (event.isActive(witness)) {
          consoleLogger.log(level(event), event.format(witness));
        }
      }
    }
    return witness;
  }

  private static Level level(ConsoleEvent event) {
    switch (event.kind) {
      case DEBUG:
        return Level.DEBUG;
      case ERROR:
        return Level.ERROR;
      default:
        return Level.INFO;
    }
  }

  /** Returns the messages of the console statements on the path taken by a witness. */
  public ImmutableList<String> consoleOutput(Witness witness) {
    return events.stream()
        .filter(e -> e.isActive(witness))
        .map(e -> e.format(witness))
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the value of each output leaf, keyed by path below {@link #OUTPUT}. */
  public ImmutableMap<String, BigInteger> outputs(Witness witness) {
    Map<String, LinearCombination> lcs = new LinkedHashMap<>();
    output.addLeaves(OUTPUT, lcs);
    ImmutableMap.Builder<String, BigInteger> result = ImmutableMap.builder();
    lcs.forEach((path, lc) -> result.put(path, witness.value(lc)));
    return result.buildOrThrow();
  }

  /** Renders the output as Leo source text, e.g. {@code (1u8, true)}. */
  public String formatOutput(Witness witness) {
    return output.format(witness::value);
  }
}
