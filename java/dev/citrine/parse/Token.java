/*
 * Copyright 2016 Google Inc. All Rights Reserved.
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

package dev.citrine.parse;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import dev.citrine.syntax.SyntaxKind;
import dev.citrine.syntax.TextRange;

/**
 * A lexical token: its kind, its exact source text, and where that text came from.
 *
 * @param kind the token kind
 * @param text the source text of the token
 * @param range the span of {@code text} in the source
 */
public record Token(SyntaxKind kind, String text, TextRange range) {

  public Token {
    requireNonNull(kind, "kind");
    requireNonNull(text, "text");
    requireNonNull(range, "range");
    checkArgument(text.length() == range.length(), "%s does not span %s", text, range);
  }

  public int start() {
    return range.start();
  }

  public int end() {
    return range.end();
  }

  @Override
  public String toString() {
    return String.format("%s@%s \"%s\"", kind.name(), range, text);
  }
}
