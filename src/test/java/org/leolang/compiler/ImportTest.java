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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import org.antlr.v4.runtime.CharStreams;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.leolang.CompilerOptions;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Program;
import org.leolang.r1cs.Witness;
import org.leolang.synth.CompiledCircuit;
import org.leolang.synth.InputValues;

@RunWith(JUnit4.class)
public class ImportTest {
  private static final Program GEOMETRY =
      Compiler.resolve(
          "circuit Point { x: u8, y: u8 }\n"
              + "function sum(p: Point) -> u8 { return p.x + p.y; }\n",
          "geometry.leo");

  private static final ImmutableMap<String, Program> PACKAGES =
      ImmutableMap.of("shapes.geometry", GEOMETRY);

  private static CompiledCircuit compile(String source) {
    return Compiler.compile(
        CharStreams.fromString(source), "main.leo", PACKAGES, CompilerOptions.DEFAULTS);
  }

  @Test
  public void importAll() {
    CompiledCircuit circuit =
        compile(
            "import shapes.geometry.*;\n"
                + "function main(a: u8) -> u8 {\n"
                + "  let p = Point { x: a, y: 2u8 };\n"
                + "  return sum(p);\n"
                + "}\n");
    Witness witness = circuit.generateWitness(InputValues.builder().set("a", 5).build());
    assertThat(witness.isSatisfied()).isTrue();
    assertThat(circuit.outputs(witness)).containsExactly("output", BigInteger.valueOf(7));
    assertThat(circuit.program.imports.keySet()).containsExactly("Point", "sum").inOrder();
  }

  @Test
  public void importWithAlias() {
    CompiledCircuit circuit =
        compile(
            "import shapes.geometry.sum as total;\n"
                + "import shapes.geometry.Point;\n"
                + "function main() -> u8 { return total(Point { x: 1u8, y: 3u8 }); }\n");
    assertThat(circuit.formatOutput(circuit.generateWitness(InputValues.EMPTY)))
        .isEqualTo("4u8");
  }

  @Test
  public void unknownPackage() {
    CompileErrors e =
        assertThrows(
            CompileErrors.class, () -> compile("import shapes.solid.*;\nfunction main() {}\n"));
    assertThat(e.first().kind).isEqualTo(ErrorKind.UNRESOLVED_IDENTIFIER);
    assertThat(e.first().getMessage()).contains("Unknown package 'shapes.solid'");
  }

  @Test
  public void importClashesWithDeclaration() {
    CompileErrors e =
        assertThrows(
            CompileErrors.class,
            () ->
                compile(
                    "import shapes.geometry.sum;\n"
                        + "function sum(a: u8) -> u8 { return a; }\n"
                        + "function main() {}\n"));
    assertThat(e.first().kind).isEqualTo(ErrorKind.DUPLICATE_DECLARATION);
  }
}
