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

package dev.citrine.tree;

import com.google.errorprone.annotations.Immutable;
import dev.citrine.syntax.SyntaxKind;

/**
 * An element of the green tree: a {@link GreenToken} or a {@link GreenNode}.
 *
 * <p>Green elements know their kind and their text length, but not their position or their parent,
 * so one element can be shared by any number of parents and trees.
 */
@Immutable
public abstract class GreenElement {

  GreenElement() {}

  public abstract SyntaxKind kind();

  /** The length of the source text covered by this element. */
  public abstract int textLength();

  public abstract boolean isNode();

  public GreenNode asNode() {
    throw new AssertionError(kind());
  }

  public GreenToken asToken() {
    throw new AssertionError(kind());
  }

  /** The source text covered by this element. */
  public String text() {
    StringBuilder sb = new StringBuilder(textLength());
    appendText(sb);
    return sb.toString();
  }

  abstract void appendText(StringBuilder sb);
}
