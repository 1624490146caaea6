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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/** A positioned view of a {@link GreenToken}. Every token has a parent node. */
public final class SyntaxToken extends SyntaxElement {

  private final GreenToken green;

  SyntaxToken(GreenToken green, SyntaxNode parent, int index, int offset) {
    super(requireNonNull(parent), index, offset);
    this.green = green;
  }

  @Override
  public GreenToken green() {
    return green;
  }

  @Override
  public String text() {
    return green.text();
  }

  public boolean isTrivia() {
    return green.kind().isTrivia();
  }

  @Override
  public boolean isNode() {
    return false;
  }

  @Override
  public SyntaxToken asToken() {
    return this;
  }

  /** The next token in document order, crossing node boundaries. */
  public @Nullable SyntaxToken nextToken() {
    for (SyntaxElement element = this; element != null; element = element.parent()) {
      for (SyntaxElement sibling = element.nextSiblingOrToken();
          sibling != null;
          sibling = sibling.nextSiblingOrToken()) {
        SyntaxToken first = sibling.isNode() ? sibling.asNode().firstToken() : sibling.asToken();
        if (first != null) {
          return first;
        }
      }
    }
    return null;
  }

  /** The previous token in document order, crossing node boundaries. */
  public @Nullable SyntaxToken prevToken() {
    for (SyntaxElement element = this; element != null; element = element.parent()) {
      for (SyntaxElement sibling = element.prevSiblingOrToken();
          sibling != null;
          sibling = sibling.prevSiblingOrToken()) {
        SyntaxToken last = sibling.isNode() ? sibling.asNode().lastToken() : sibling.asToken();
        if (last != null) {
          return last;
        }
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return super.toString() + " \"" + green.text() + "\"";
  }
}
