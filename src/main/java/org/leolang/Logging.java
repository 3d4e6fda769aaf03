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

import org.apache.log4j.Logger;

/** Access to the loggers shared by the compiler passes. */
public final class Logging {

  private static final String LOGGER_NAME = "org.leolang";

  /** Console statements executed during witness generation are logged under this name. */
  private static final String CONSOLE_LOGGER_NAME = "org.leolang.console";

  // Statics only
  private Logging() {}

  /** Returns the logger used by the resolution and synthesis passes. */
  public static Logger getLogger() {
    return Logger.getLogger(LOGGER_NAME);
  }

  /** Returns the logger that receives {@code console.log/debug/error} output. */
  public static Logger getConsoleLogger() {
    return Logger.getLogger(CONSOLE_LOGGER_NAME);
  }
}
