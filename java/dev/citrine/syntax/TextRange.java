/*
 * Copyright 2026 The Citrine Authors. All Rights Reserved.
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

package dev.citrine.syntax;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A half-open span of source positions.
 *
 * @param start the index of the first char in the span
 * @param end the index one past the last char in the span
 */
public record TextRange(int start, int end) {

  public TextRange {
    checkArgument(0 <= start && start <= end, "invalid range %s..%s", start, end);
  }

  public static TextRange of(int start, int end) {
    return new TextRange(start, end);
  }

  public static TextRange at(int offset, int length) {
    return new TextRange(offset, offset + length);
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  /** Returns true if {@code offset} lies in {@code [start, end)}. */
  public boolean contains(int offset) {
    return start <= offset && offset < end;
  }

  public boolean contains(TextRange other) {
    return start <= other.start && other.end <= end;
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
