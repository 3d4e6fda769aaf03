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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.leolang.CompilerOptions;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.IntegerType;
import org.leolang.asg.Type;
import org.leolang.compiler.Compiler;
import org.leolang.r1cs.Wire;
import org.leolang.r1cs.Witness;

@RunWith(JUnit4.class)
public class SynthesizerTest {

  private static CompiledCircuit compile(String source) {
    return Compiler.compile(source, "test.leo");
  }

  private static CompiledCircuit compile(String source, CompilerOptions options) {
    return Compiler.compile(source, "test.leo", options);
  }

  private static ImmutableList<String> names(List<Wire> wires) {
    return wires.stream().map(w -> w.name).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void compoundAssignment() {
    CompiledCircuit circuit =
        compile("function main(a: u32) -> u32 { let mut x = a; x += 20u32; return x; }");
    Witness witness = circuit.generateWitness(InputValues.builder().set("a", 10).build());
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(circuit.outputs(witness)).containsExactly("output", BigInteger.valueOf(30));
    assertThat(circuit.outputType()).isEqualTo(Type.integer(IntegerType.U32));
  }

  @Test
  public void inputVisibility() {
    CompiledCircuit circuit =
        compile("function main(input: u8, secret: (u8, bool)) -> u8 { return input; }");
    assertThat(names(circuit.publicInputs())).containsExactly("input");
    assertThat(names(circuit.privateInputs()))
        .containsExactly("secret.0", "secret.1")
        .inOrder();
    assertThat(circuit.inputNames()).containsExactly("input", "secret.0", "secret.1").inOrder();
    Witness witness =
        circuit.generateWitness(
            InputValues.builder()
                .set("input", 3)
                .set("secret.0", 4)
                .setBoolean("secret.1", true)
                .build());
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(witness.publicValues()).containsExactly(BigInteger.valueOf(3));
  }

  @Test
  public void invalidBooleanInput() {
    CompiledCircuit circuit = compile("function main(b: bool) -> bool { return b; }");
    Witness witness = circuit.generateWitness(InputValues.builder().set("b", 2).build());
    assertThat(witness.isSatisfied()).isFalse();
  }

  @Test
  public void missingInput() {
    CompiledCircuit circuit = compile("function main(a: u8, b: u8) -> u8 { return a + b; }");
    SynthesisError e =
        assertThrows(
            SynthesisError.class,
            () -> circuit.generateWitness(InputValues.builder().set("a", 1).build()));
    assertThat(e.kind).isEqualTo(ErrorKind.MISSING_INPUT);
    assertThat(e.msg).contains("'b'");
  }

  @Test
  public void negativeInputs() {
    CompiledCircuit circuit = compile("function main(a: i8, b: i8) -> i8 { return a - b; }");
    Witness witness =
        circuit.generateWitness(InputValues.builder().set("a", -100).set("b", 28).build());
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(circuit.formatOutput(witness)).isEqualTo("-128i8");
    witness = circuit.generateWitness(InputValues.builder().set("a", -100).set("b", 29).build());
    assertThat(witness.isSatisfied()).isFalse();
  }

  @Test
  public void deterministic() {
    String source =
        "circuit P { x: u8, y: u8 }\n"
            + "function main(p: P, c: bool) -> u8 {\n"
            + "  let mut r = p.x;\n"
            + "  if c { r = p.y * 2u8; }\n"
            + "  for i in 0u8..3u8 { r += i; }\n"
            + "  return r;\n"
            + "}\n";
    String first = compile(source).constraintSystem().describe();
    String second = compile(source).constraintSystem().describe();
    assertThat(second).isEqualTo(first);
  }

  /** A branch on a constant condition must give the same system as the taken branch alone. */
  @Test
  public void constantBranch() {
    String withBranch =
        "function main(a: u8) -> u8 {\n"
            + "  let mut x = a;\n"
            + "  if 1u8 < 2u8 { x *= 3u8; } else { x += 1u8; }\n"
            + "  return x;\n"
            + "}\n";
    String straight = "function main(a: u8) -> u8 { let mut x = a; x *= 3u8; return x; }";
    assertThat(compile(withBranch).constraintSystem().numConstraints())
        .isEqualTo(compile(straight).constraintSystem().numConstraints());
  }

  @Test
  public void branchesAgree() {
    // The same function written with a conditional and with a ternary.
    CompiledCircuit ifElse =
        compile(
            "function main(c: bool, a: u16) -> u16 {\n"
                + "  let mut r = 0u16;\n"
                + "  if c { r = a + 1u16; } else { r = a - 1u16; }\n"
                + "  return r;\n"
                + "}\n");
    CompiledCircuit ternary =
        compile("function main(c: bool, a: u16) -> u16 { return c ? a + 1u16 : a - 1u16; }");
    for (boolean c : new boolean[] {true, false}) {
      InputValues inputs = InputValues.builder().setBoolean("c", c).set("a", 500).build();
      Witness w1 = ifElse.generateWitness(inputs);
      Witness w2 = ternary.generateWitness(inputs);
      assertThat(w1.isSatisfied()).isTrue();
      assertThat(w2.isSatisfied()).isTrue();
      assertThat(ifElse.outputs(w1)).isEqualTo(ternary.outputs(w2));
    }
  }

  /** Both arms of a non-constant conditional are synthesized, including their range checks. */
  @Test
  public void untakenArmStillConstrains() {
    CompiledCircuit circuit =
        compile(
            "function main(a: u8) -> u8 {\n"
                + "  let mut r = a;\n"
                + "  if a > 0u8 { r = a - 1u8; }\n"
                + "  return r;\n"
                + "}\n");
    Witness witness = circuit.generateWitness(InputValues.builder().set("a", 0).build());
    assertThat(witness.isSatisfied()).isFalse();
  }

  @Test
  public void assertAfterEarlyReturn() {
    CompiledCircuit circuit =
        compile(
            "function main(a: u8) -> u8 {\n"
                + "  if a == 0u8 { return 0u8; }\n"
                + "  console.assert(a > 5u8);\n"
                + "  return a;\n"
                + "}\n");
    assertThat(circuit.generateWitness(InputValues.builder().set("a", 0).build()).isSatisfied())
        .isTrue();
    assertThat(circuit.generateWitness(InputValues.builder().set("a", 3).build()).isSatisfied())
        .isFalse();
    Witness witness = circuit.generateWitness(InputValues.builder().set("a", 9).build());
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(circuit.formatOutput(witness)).isEqualTo("9u8");
  }

  @Test
  public void assertFalseCompilesButIsNeverSatisfied() {
    CompiledCircuit circuit =
        compile("function main(a: u8) -> u8 {\n  console.assert(false);\n  return a;\n}\n");
    assertThat(circuit.constraintSystem().numConstraints()).isGreaterThan(0);
    for (int a : new int[] {0, 1, 255}) {
      Witness witness = circuit.generateWitness(InputValues.builder().set("a", a).build());
      assertThat(witness.isSatisfied()).isFalse();
    }
  }

  @Test
  public void consoleOutput() {
    CompiledCircuit circuit =
        compile(
            "function main(a: u8, c: bool) {\n"
                + "  console.log(\"a is {}\", a);\n"
                + "  if c { console.error(\"doubled {}\", a * 2u8); }\n"
                + "}\n",
            CompilerOptions.builder().setLogConsole(false).build());
    int constraints = circuit.constraintSystem().numConstraints();
    assertThat(circuit.consoleEvents()).hasSize(2);
    Witness witness =
        circuit.generateWitness(InputValues.builder().set("a", 4).setBoolean("c", false).build());
    assertThat(circuit.consoleOutput(witness)).containsExactly("a is 4u8");
    witness =
        circuit.generateWitness(InputValues.builder().set("a", 4).setBoolean("c", true).build());
    assertThat(circuit.consoleOutput(witness)).containsExactly("a is 4u8", "doubled 8u8").inOrder();
    // Console arguments add no constraints.
    CompiledCircuit silent = compile("function main(a: u8, c: bool) {}");
    assertThat(constraints).isEqualTo(silent.constraintSystem().numConstraints());
  }

  @Test
  public void unrollLimit() {
    String source =
        "function main() -> u32 {\n"
            + "  let mut s = 0u32;\n"
            + "  for i in 0..10 { for j in 0..10 { s += 1u32; } }\n"
            + "  return s;\n"
            + "}\n";
    CompiledCircuit circuit =
        compile(source, CompilerOptions.builder().setMaxUnrolledIterations(110).build());
    assertThat(circuit.formatOutput(circuit.generateWitness(InputValues.EMPTY)))
        .isEqualTo("100u32");
    SynthesisError e =
        assertThrows(
            SynthesisError.class,
            () -> compile(source, CompilerOptions.builder().setMaxUnrolledIterations(100).build()));
    assertThat(e.kind).isEqualTo(ErrorKind.UNROLL_LIMIT);
  }

  @Test
  public void constParameters() {
    String source =
        "function main(const n: u8, a: [u8; 4]) -> u8 {\n"
            + "  let mut s = 0u8;\n"
            + "  for i in 0u8..n { s += a[i]; }\n"
            + "  return s;\n"
            + "}\n";
    CompiledCircuit circuit =
        compile(source, CompilerOptions.builder().setConstant("n", "3u8").build());
    assertThat(circuit.inputNames()).containsExactly("a[0]", "a[1]", "a[2]", "a[3]").inOrder();
    InputValues inputs = circuit.parseInputs(ImmutableMap.of("a", "[1u8, 2u8, 3u8, 4u8]"));
    Witness witness = circuit.generateWitness(inputs);
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(circuit.formatOutput(witness)).isEqualTo("6u8");
  }

  @Test
  public void otherEntryFunction() {
    CompiledCircuit circuit =
        compile(
            "function main() {}\nfunction double(a: u8) -> u8 { return a * 2u8; }",
            CompilerOptions.builder().setEntryFunction("double").build());
    assertThat(circuit.entry.name).isEqualTo("double");
    Witness witness = circuit.generateWitness(InputValues.builder().set("a", 21).build());
    assertThat(circuit.formatOutput(witness)).isEqualTo("42u8");
  }

  @Test
  public void groupScalarMultiplication() {
    CompiledCircuit circuit = compile("function main(g: group, k: u8) -> group { return g * k; }");
    InputValues inputs = circuit.parseInputs(ImmutableMap.of("g", "1group", "k", "2u8"));
    Witness witness = circuit.generateWitness(inputs);
    assertThat(witness.isSatisfied()).isTrue();
    CompiledCircuit constant = compile("function main() -> group { return 2u8 * 1group; }");
    assertThat(circuit.outputs(witness))
        .isEqualTo(constant.outputs(constant.generateWitness(InputValues.EMPTY)));
  }

  @Test
  public void groupInputMustBeOnCurve() {
    CompiledCircuit circuit = compile("function main(g: group) -> group { return g; }");
    Witness witness =
        circuit.generateWitness(InputValues.builder().set("g.x", 1).set("g.y", 1).build());
    assertThat(witness.isSatisfied()).isFalse();
    witness = circuit.generateWitness(InputValues.builder().set("g.x", 0).set("g.y", 1).build());
    assertThat(witness.isSatisfied()).isTrue();
  }

  @Test
  public void addressInput() {
    String address = "aleo1qnr4dkkvkgfqph0vzc3y6z2eu975wnpz2925ntjccd5cfqxtyu8sta57j8";
    CompiledCircuit circuit =
        compile("function main(a: address, b: address) -> bool { return a == b; }");
    Witness witness =
        circuit.generateWitness(
            InputValues.builder().setAddress("a", address).setAddress("b", address).build());
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(circuit.formatOutput(witness)).isEqualTo("true");
    assertThat(circuit.inputNames()).containsExactly("a.high", "a.low", "b.high", "b.low");
  }

  @Test
  public void unknownEntry() {
    SynthesisError e =
        assertThrows(
            SynthesisError.class,
            () ->
                compile(
                    "function helper() {}",
                    CompilerOptions.builder().setEntryFunction("main").build()));
    assertThat(e.kind).isEqualTo(ErrorKind.UNRESOLVED_VARIABLE);
  }

  @Test
  public void publicWireNames() {
    CompiledCircuit circuit = compile("function main(input: [u8; 2]) {}");
    assertThat(names(circuit.publicInputs())).containsExactly("input[0]", "input[1]").inOrder();
    assertThat(circuit.privateInputs()).isEmpty();
    for (Wire wire : circuit.publicInputs()) {
      assertThat(wire.visibility).isEqualTo(Wire.Visibility.PUBLIC);
    }
  }
}
