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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.base.Splitter;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.leolang.r1cs.Witness;
import org.leolang.synth.CompiledCircuit;
import org.leolang.synth.SynthesisError;
import org.leolang.testing.TestdataScanner;
import org.leolang.testing.TestdataScanner.TestProgram;

/**
 * Compiles Leo source code from each of the .leo files in the testdata directory, based on
 * comments in the files.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/leolang/compiler/testdata");

  /**
   * Each program in a .leo file is followed by a comment that begins "{@code /* RESOLVE}", "{@code
   * /* SYNTH}" or "{@code /* RUN}".
   *
   * <ul>
   *   <li>{@code RESOLVE}: the test passes if the program resolves; with an error message (e.g.
   *       "{@code RESOLVE: Unknown variable 'y'}") it passes if resolution fails with an error
   *       starting with that message.
   *   <li>{@code SYNTH: KIND}: the test passes if the program resolves but synthesis of {@code
   *       main} fails with the given ErrorKind.
   *   <li>{@code RUN (a = 1u8; b = [1u8, 2u8]): output}: the test passes if the program compiles,
   *       the witness for the given inputs satisfies the constraints and the output formats as
   *       given. If the output is {@code UNSATISFIED} the witness must instead violate a
   *       constraint.
   * </ul>
   *
   * <p>A single file may contain many programs, each followed by its own comment; each is compiled
   * independently.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* ((?:RESOLVE|SYNTH|RUN).*?)\\*/\\n*", Pattern.DOTALL);

  private static final Pattern RUN_PATTERN =
      Pattern.compile("RUN \\((.*?)\\): *(.*)", Pattern.DOTALL);

  private static final String UNSATISFIED = "UNSATISFIED";

  @Test
  public void compileTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    String comment = checkNotNull(testProgram.comment(), "No expectation comment found").trim();
    if (comment.startsWith("RESOLVE")) {
      checkResolve(testProgram, afterColon(comment));
    } else if (comment.startsWith("SYNTH")) {
      checkSynth(testProgram, afterColon(comment));
    } else {
      Matcher matcher = RUN_PATTERN.matcher(comment);
      assertWithMessage("Bad RUN comment").that(matcher.matches()).isTrue();
      checkRun(testProgram, parseInputs(matcher.group(1)), matcher.group(2).trim());
    }
  }

  private static void checkResolve(TestProgram testProgram, String errMsg) {
    try {
      Compiler.resolve(testProgram.code(), testProgram.name());
      assertWithMessage("Expected error, resolved OK").that(errMsg).isEmpty();
    } catch (CompileError | CompileErrors e) {
      assertWithMessage("Unexpected error %s", e).that(errMsg).isNotEmpty();
      assertWithMessage("Unexpected error %s", e).that(e.getMessage()).startsWith(errMsg);
    }
  }

  private static void checkSynth(TestProgram testProgram, String kind) {
    try {
      Compiler.compile(testProgram.code(), testProgram.name());
      assertWithMessage("Expected %s, compiled OK", kind).fail();
    } catch (SynthesisError e) {
      assertWithMessage("Unexpected error %s", e).that(e.kind.name()).isEqualTo(kind);
    }
  }

  private static void checkRun(TestProgram testProgram, Map<String, String> inputs, String output) {
    CompiledCircuit circuit = Compiler.compile(testProgram.code(), testProgram.name());
    Witness witness = circuit.generateWitness(circuit.parseInputs(inputs));
    System.out.format(
        "** %s: %s constraints, output %s\n",
        testProgram.name(),
        circuit.constraintSystem().numConstraints(),
        circuit.formatOutput(witness));
    if (output.equals(UNSATISFIED)) {
      assertWithMessage("Expected an unsatisfied constraint").that(witness.isSatisfied()).isFalse();
    } else {
      assertWithMessage("Unsatisfied: %s", witness.firstUnsatisfied())
          .that(witness.isSatisfied())
          .isTrue();
      assertWithMessage("Wrong output").that(circuit.formatOutput(witness)).isEqualTo(output);
    }
  }

  /** Returns the (trimmed) text after the first colon, or an empty string if there is none. */
  private static String afterColon(String comment) {
    int colon = comment.indexOf(':');
    return (colon < 0) ? "" : comment.substring(colon + 1).trim();
  }

  /** Parses {@code "a = 1u8; b = true"}. */
  private static Map<String, String> parseInputs(String text) {
    Map<String, String> result = new LinkedHashMap<>();
    for (String assignment : Splitter.on(';').trimResults().omitEmptyStrings().split(text)) {
      List<String> parts = Splitter.on('=').limit(2).trimResults().splitToList(assignment);
      assertWithMessage("Bad input '%s'", assignment).that(parts).hasSize(2);
      result.put(parts.get(0), parts.get(1));
    }
    return result;
  }

  /** Returns every program in our testdata directory. */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, COMMENT_PATTERN);
    }
  }
}
