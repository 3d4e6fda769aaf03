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

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.leolang.asg.ErrorKind;

@RunWith(TestParameterInjector.class)
public class ResolutionErrorsTest {

  private static final String FOO =
      "circuit Foo {\n"
          + "  f: u8,\n"
          + "  function z(mut self) { self.f = 0u8; }\n"
          + "  function get(self) -> u8 { return self.f; }\n"
          + "  function make() -> Self { return Self { f: 1u8 }; }\n"
          + "}\n";

  private static CompileError firstError(String source) {
    try {
      Compiler.resolve(source, "bad.leo");
    } catch (CompileErrors e) {
      return e.first();
    } catch (CompileError e) {
      return e;
    }
    throw new AssertionError("Expected a resolution error");
  }

  enum Case {
    SYNTAX_ERROR("function main() { let x = ; }", ErrorKind.SYNTAX),
    WRONG_ARITY(
        "function f(a: u8) -> u8 { return a; }\nfunction main() -> u8 { return f(1u8, 2u8); }",
        ErrorKind.WRONG_ARITY),
    SINGLETON_TUPLE_VALUE("function main() { let t = (1u8,); }", ErrorKind.INVALID_TUPLE_ARITY),
    SINGLETON_TUPLE_TYPE("function main(t: (u8,)) {}", ErrorKind.INVALID_TUPLE_ARITY),
    NON_CONSTANT_CONST("function main(a: u8) { const b = a; }", ErrorKind.NON_CONSTANT_ARGUMENT),
    STATIC_CALL_ON_INSTANCE(
        FOO + "function main() { let x = Foo { f: 1u8 }; let y = x.make(); }",
        ErrorKind.INVALID_CALL),
    INSTANCE_CALL_ON_TYPE(
        FOO + "function main() -> u8 { return Foo::get(); }", ErrorKind.INVALID_CALL),
    MUT_SELF_ON_IMMUTABLE(
        FOO + "function main() { let x = Foo { f: 1u8 }; x.z(); }",
        ErrorKind.IMMUTABLE_ASSIGNMENT),
    ASSIGN_THROUGH_SELF(
        "circuit Foo { f: u8, function set(self) { self.f = 2u8; } }\nfunction main() {}",
        ErrorKind.IMMUTABLE_ASSIGNMENT),
    MEMBER_OF_IMMUTABLE(
        FOO + "function main() { let x = Foo { f: 1u8 }; x.f = 3u8; }",
        ErrorKind.IMMUTABLE_ASSIGNMENT),
    ELEMENT_OF_IMMUTABLE(
        "function main() { let a = [1u8; 3]; a[0] = 2u8; }", ErrorKind.IMMUTABLE_ASSIGNMENT),
    UNKNOWN_CIRCUIT("function main(p: Point) {}", ErrorKind.UNRESOLVED_IDENTIFIER),
    RETURN_TYPE("function main() -> u8 { return true; }", ErrorKind.TYPE_MISMATCH),
    BOOLEAN_CONDITION("function main(a: u8) { if a { } }", ErrorKind.TYPE_MISMATCH);

    final String source;
    final ErrorKind kind;

    Case(String source, ErrorKind kind) {
      this.source = source;
      this.kind = kind;
    }
  }

  @Test
  public void errorKind(@TestParameter Case c) {
    assertThat(firstError(c.source).kind).isEqualTo(c.kind);
  }

  @Test
  public void mutSelfErrorNamesTheBinding() {
    CompileError e = firstError(FOO + "function main() { let x = Foo { f: 1u8 }; x.z(); }");
    assertThat(e.msg).isEqualTo("Cannot assign to 'x': 'x' is not mutable");
  }

  @Test
  public void mutableBindingsAccepted() {
    Compiler.resolve(FOO + "function main() { let mut x = Foo { f: 1u8 }; x.z(); }", "ok.leo");
    Compiler.resolve(FOO + "function main() { let mut x = Foo { f: 1u8 }; x.f = 3u8; }", "ok.leo");
    Compiler.resolve("function main() { let mut a = [1u8; 3]; a[0] = 2u8; }", "ok.leo");
  }

  @Test
  public void errorsFromIndependentDeclarationsAreSortedBySpan() {
    CompileErrors e =
        assertThrows(
            CompileErrors.class,
            () ->
                Compiler.resolve(
                    "function b() -> u8 { return z; }\n"
                        + "function a() { let x = 1u8; x = 2u8; }\n"
                        + "function main() {}\n",
                    "two.leo"));
    assertThat(e.errors).hasSize(2);
    assertThat(e.errors.get(0).kind).isEqualTo(ErrorKind.UNRESOLVED_IDENTIFIER);
    assertThat(e.errors.get(0).span.lineStart).isEqualTo(1);
    assertThat(e.errors.get(1).kind).isEqualTo(ErrorKind.IMMUTABLE_ASSIGNMENT);
    assertThat(e.errors.get(1).span.lineStart).isEqualTo(2);
  }

  @Test
  public void everyCircuitOnAContainmentCycleIsReported() {
    CompileErrors e =
        assertThrows(
            CompileErrors.class,
            () ->
                Compiler.resolve(
                    "circuit A { b: B }\n"
                        + "circuit B { c: [C; 2] }\n"
                        + "circuit C { a: (A, u8) }\n"
                        + "circuit D { a: A }\n"
                        + "function main() {}\n",
                    "cycle.leo"));
    assertThat(e.errors).hasSize(3);
    for (int i = 0; i < 3; i++) {
      assertThat(e.errors.get(i).kind).isEqualTo(ErrorKind.TYPE_MISMATCH);
      assertThat(e.errors.get(i).span.lineStart).isEqualTo(i + 1);
    }
    assertThat(e.errors.get(2).msg).isEqualTo("Circuit 'C' cannot contain itself");
  }
}
