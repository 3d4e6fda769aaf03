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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Expression;
import org.leolang.asg.IntegerType;
import org.leolang.asg.Program;
import org.leolang.asg.Span;
import org.leolang.asg.Type;
import org.leolang.synth.SynthesisError;

/** Checks the structured form of parsed literals, as reported to tooling. */
@RunWith(JUnit4.class)
public class LiteralParseTest {
  private static final Program PROGRAM =
      Compiler.resolve("circuit Point { x: u8, y: u8 }\nfunction main() {}", "lit.leo");

  private static Expression parse(String text, Type expected) {
    return Compiler.parseLiteral(text, expected, PROGRAM);
  }

  private static String groupLiteral(String text) {
    Expression expr = parse(text, Type.GROUP);
    assertThat(expr).isInstanceOf(Expression.GroupLiteralExpression.class);
    return ((Expression.GroupLiteralExpression) expr).value.toString();
  }

  @Test
  public void signMarkers() {
    assertThat(groupLiteral("(+, _)group")).isEqualTo("(SignHigh, Inferred)");
    assertThat(groupLiteral("(-5, -)group")).isEqualTo("(-5, SignLow)");
    assertThat(parse("(+, _)group", Type.GROUP).span)
        .isEqualTo(new Span(1, 1, 1, 12, "lit.leo", "(+, _)group"));
  }

  @Test
  public void productGroup() {
    assertThat(groupLiteral("7group")).isEqualTo("7group");
  }

  @Test
  public void contextualTyping() {
    Expression expr = parse("[1, 2, 3]", Type.array(Type.integer(IntegerType.U16), 3));
    assertThat(expr.type.toString()).isEqualTo("[u16; 3]");
    assertThat(expr.isConstant()).isTrue();
    Expression point = parse("Point { x: 1, y: 2 }", PROGRAM.circuit("Point").type());
    assertThat(point.type.toString()).isEqualTo("Point");
  }

  @Test
  public void literalOutOfRange() {
    CompileError e =
        assertThrows(CompileError.class, () -> parse("300", Type.integer(IntegerType.U8)));
    assertThat(e.kind).isEqualTo(ErrorKind.LITERAL_OUT_OF_RANGE);
  }

  @Test
  public void bothCoordinatesMarkedIsNotAPoint() {
    SynthesisError e =
        assertThrows(
            SynthesisError.class,
            () -> Compiler.compile("function main() -> group { return (+, _)group; }", "g.leo"));
    assertThat(e.kind).isEqualTo(ErrorKind.INVALID_GROUP);
    assertThat(e.span.content).isEqualTo("(+, _)group");
  }
}
