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

import com.google.common.collect.ImmutableList;
import dev.citrine.syntax.SyntaxKind;
import dev.citrine.syntax.TextRange;
import org.jspecify.annotations.Nullable;

/**
 * A positioned view of a {@link GreenElement}: a {@link SyntaxNode} or a {@link SyntaxToken}.
 *
 * <p>Views are created on demand while navigating and are never mutated. A view holds its green
 * element, its parent view and its absolute offset; the green tree itself has no parent links.
 * Views are cheap and are not meant to be shared between threads.
 */
public abstract class SyntaxElement {

  private final @Nullable SyntaxNode parent;
  private final int index;
  private final int offset;

  SyntaxElement(@Nullable SyntaxNode parent, int index, int offset) {
    this.parent = parent;
    this.index = index;
    this.offset = offset;
  }

  /** The green element this view wraps. */
  public abstract GreenElement green();

  public SyntaxKind kind() {
    return green().kind();
  }

  /** The absolute span of this element in the source. */
  public TextRange range() {
    return TextRange.at(offset, green().textLength());
  }

  /** The source text of this element. */
  public String text() {
    return green().text();
  }

  /** The enclosing node, or {@code null} for the root. */
  public @Nullable SyntaxNode parent() {
    return parent;
  }

  /** The position of this element among its parent's children. */
  public int indexInParent() {
    return index;
  }

  /** The enclosing nodes, innermost first. */
  public ImmutableList<SyntaxNode> ancestors() {
    ImmutableList.Builder<SyntaxNode> result = ImmutableList.builder();
    for (SyntaxNode node = parent; node != null; node = node.parent()) {
      result.add(node);
    }
    return result.build();
  }

  /** The following sibling, token or node. */
  public @Nullable SyntaxElement nextSiblingOrToken() {
    if (parent == null) {
      return null;
    }
    return parent.childAt(index + 1, offset + green().textLength());
  }

  /** The preceding sibling, token or node. */
  public @Nullable SyntaxElement prevSiblingOrToken() {
    if (parent == null || index == 0) {
      return null;
    }
    GreenElement previous = parent.green().children().get(index - 1);
    return parent.childAt(index - 1, offset - previous.textLength());
  }

  public abstract boolean isNode();

  public SyntaxNode asNode() {
    throw new AssertionError(kind());
  }

  public SyntaxToken asToken() {
    throw new AssertionError(kind());
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(green()) + offset;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    SyntaxElement that = (SyntaxElement) obj;
    return green() == that.green() && offset == that.offset;
  }

  @Override
  public String toString() {
    return kind().name() + "@" + range();
  }
}
