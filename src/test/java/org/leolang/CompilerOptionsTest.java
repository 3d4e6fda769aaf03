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

import static com.google.common.truth.Truth.assertThat;

import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompilerOptionsTest {

  @After
  public void clearProperties() {
    System.clearProperty("leolang.entry");
    System.clearProperty("leolang.maxIterations");
    System.clearProperty("leolang.logConsole");
  }

  @Test
  public void defaults() {
    CompilerOptions options = CompilerOptions.fromSystemProperties();
    assertThat(options.entryFunction).isEqualTo("main");
    assertThat(options.maxUnrolledIterations).isEqualTo(CompilerOptions.DEFAULT_MAX_ITERATIONS);
    assertThat(options.logConsole).isTrue();
    assertThat(options.constants).isEmpty();
  }

  @Test
  public void systemProperties() {
    System.setProperty("leolang.entry", "verify");
    System.setProperty("leolang.maxIterations", "64");
    System.setProperty("leolang.logConsole", "false");
    CompilerOptions options = CompilerOptions.fromSystemProperties();
    assertThat(options.entryFunction).isEqualTo("verify");
    assertThat(options.maxUnrolledIterations).isEqualTo(64);
    assertThat(options.logConsole).isFalse();
  }

  @Test
  public void constantsKeepInsertionOrder() {
    CompilerOptions options =
        CompilerOptions.builder().setConstant("n", "3u32").setConstant("k", "true").build();
    assertThat(options.constants.keySet()).containsExactly("n", "k").inOrder();
  }
}
