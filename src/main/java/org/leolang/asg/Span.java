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

package org.leolang.asg;

import java.util.Comparator;
import java.util.Objects;

/**
 * A range of source text. Lines and columns are 1-based; {@code colStop} is the column just past
 * the last character. {@code content} is the text covered by the span.
 */
public final class Span implements Comparable<Span> {

  private static final Comparator<Span> ORDER =
      Comparator.<Span, String>comparing(s -> s.path)
          .thenComparingInt(s -> s.lineStart)
          .thenComparingInt(s -> s.colStart)
          .thenComparingInt(s -> s.lineStop)
          .thenComparingInt(s -> s.colStop);

  /** Used for values that did not come from source text, e.g. parsed inputs. */
  public static final Span NONE = new Span(0, 0, 0, 0, "", "");

  public final int lineStart;
  public final int lineStop;
  public final int colStart;
  public final int colStop;
  public final String path;
  public final String content;

  public Span(int lineStart, int lineStop, int colStart, int colStop, String path, String content) {
    this.lineStart = lineStart;
    this.lineStop = lineStop;
    this.colStart = colStart;
    this.colStop = colStop;
    this.path = path;
    this.content = content;
  }

  @Override
  public int compareTo(Span other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Span)) {
      return false;
    }
    Span other = (Span) obj;
    return lineStart == other.lineStart
        && lineStop == other.lineStop
        && colStart == other.colStart
        && colStop == other.colStop
        && path.equals(other.path)
        && content.equals(other.content);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lineStart, lineStop, colStart, colStop, path);
  }

  /** Returns e.g. {@code "main.leo:3:5-3:12"}. */
  @Override
  public String toString() {
    return String.format("%s:%s:%s-%s:%s", path, lineStart, colStart, lineStop, colStop);
  }
}
