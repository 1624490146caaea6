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

package dev.citrine.parse;

import dev.citrine.diag.SourceFile;

/** A Citrine lexer. */
public interface Lexer {
  /**
   * Returns the next token, including trivia. At the end of input returns an empty token of kind
   * {@link dev.citrine.syntax.SyntaxKind#EOF}, and keeps returning it.
   */
  Token next();

  /** Returns the position of the next character to be lexed. */
  int position();

  /** Returns the source file being lexed. */
  SourceFile source();
}
