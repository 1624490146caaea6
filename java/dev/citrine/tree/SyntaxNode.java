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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.graph.Traverser;
import dev.citrine.syntax.SyntaxKind;
import org.jspecify.annotations.Nullable;

/** A positioned view of a {@link GreenNode}. */
public final class SyntaxNode extends SyntaxElement {

  private static final Traverser<SyntaxElement> TRAVERSER =
      Traverser.forTree(
          element ->
              element.isNode()
                  ? element.asNode().childrenWithTokens()
                  : ImmutableList.<SyntaxElement>of());

  /** Creates a view of {@code green} as the root of a tree starting at offset 0. */
  public static SyntaxNode root(GreenNode green) {
    return new SyntaxNode(green, null, 0, 0);
  }

  private final GreenNode green;

  private SyntaxNode(GreenNode green, @Nullable SyntaxNode parent, int index, int offset) {
    super(parent, index, offset);
    this.green = green;
  }

  @Override
  public GreenNode green() {
    return green;
  }

  public boolean isError() {
    return green.kind() == SyntaxKind.ERROR;
  }

  /** The view of the child at {@code index}, which starts at {@code offset}. */
  @Nullable SyntaxElement childAt(int index, int offset) {
    ImmutableList<GreenElement> children = green.children();
    if (index < 0 || index >= children.size()) {
      return null;
    }
    GreenElement child = children.get(index);
    if (child.isNode()) {
      return new SyntaxNode(child.asNode(), this, index, offset);
    }
    return new SyntaxToken(child.asToken(), this, index, offset);
  }

  /** The children of this node, tokens and nodes interleaved in source order. */
  public ImmutableList<SyntaxElement> childrenWithTokens() {
    ImmutableList.Builder<SyntaxElement> result = ImmutableList.builder();
    int offset = range().start();
    ImmutableList<GreenElement> children = green.children();
    for (int i = 0; i < children.size(); i++) {
      result.add(childAt(i, offset));
      offset += children.get(i).textLength();
    }
    return result.build();
  }

  /** The child nodes of this node, omitting tokens. */
  public ImmutableList<SyntaxNode> children() {
    return childrenWithTokens().stream()
        .filter(SyntaxElement::isNode)
        .map(SyntaxElement::asNode)
        .collect(toImmutableList());
  }

  public @Nullable SyntaxElement firstChildOrToken() {
    return childAt(0, range().start());
  }

  public @Nullable SyntaxElement lastChildOrToken() {
    ImmutableList<GreenElement> children = green.children();
    if (children.isEmpty()) {
      return null;
    }
    GreenElement last = Iterables.getLast(children);
    return childAt(children.size() - 1, range().end() - last.textLength());
  }

  public @Nullable SyntaxNode firstChild() {
    return Iterables.getFirst(children(), null);
  }

  public @Nullable SyntaxNode lastChild() {
    return Iterables.getLast(children(), null);
  }

  /** The following sibling node, skipping tokens. */
  public @Nullable SyntaxNode nextSibling() {
    for (SyntaxElement e = nextSiblingOrToken(); e != null; e = e.nextSiblingOrToken()) {
      if (e.isNode()) {
        return e.asNode();
      }
    }
    return null;
  }

  /** The preceding sibling node, skipping tokens. */
  public @Nullable SyntaxNode prevSibling() {
    for (SyntaxElement e = prevSiblingOrToken(); e != null; e = e.prevSiblingOrToken()) {
      if (e.isNode()) {
        return e.asNode();
      }
    }
    return null;
  }

  /** The first token in this subtree, or {@code null} if the subtree holds no tokens. */
  public @Nullable SyntaxToken firstToken() {
    for (SyntaxElement child : childrenWithTokens()) {
      SyntaxToken token = child.isNode() ? child.asNode().firstToken() : child.asToken();
      if (token != null) {
        return token;
      }
    }
    return null;
  }

  /** The last token in this subtree, or {@code null} if the subtree holds no tokens. */
  public @Nullable SyntaxToken lastToken() {
    for (SyntaxElement child : childrenWithTokens().reverse()) {
      SyntaxToken token = child.isNode() ? child.asNode().lastToken() : child.asToken();
      if (token != null) {
        return token;
      }
    }
    return null;
  }

  /** This node and all nodes below it, in pre-order. */
  public ImmutableList<SyntaxNode> descendants() {
    ImmutableList.Builder<SyntaxNode> result = ImmutableList.builder();
    for (SyntaxElement element : TRAVERSER.depthFirstPreOrder(this)) {
      if (element.isNode()) {
        result.add(element.asNode());
      }
    }
    return result.build();
  }

  /** This node and all nodes and tokens below it, in pre-order. */
  public Iterable<SyntaxElement> descendantsWithTokens() {
    return TRAVERSER.depthFirstPreOrder(this);
  }

  /** The tokens of this subtree, in document order. */
  public ImmutableList<SyntaxToken> tokens() {
    ImmutableList.Builder<SyntaxToken> result = ImmutableList.builder();
    for (SyntaxElement element : TRAVERSER.depthFirstPreOrder(this)) {
      if (!element.isNode()) {
        result.add(element.asToken());
      }
    }
    return result.build();
  }

  /**
   * Returns the token covering the given offset. An offset between two tokens belongs to the
   * second one; the end offset of the node belongs to its last token.
   */
  public @Nullable SyntaxToken tokenAt(int offset) {
    checkArgument(
        range().contains(offset) || offset == range().end(), "%s is outside %s", offset, range());
    SyntaxNode node = this;
    while (true) {
      SyntaxElement found = null;
      for (SyntaxElement child : node.childrenWithTokens()) {
        if (child.range().contains(offset)) {
          found = child;
          break;
        }
      }
      if (found == null) {
        return node.lastToken();
      }
      if (!found.isNode()) {
        return found.asToken();
      }
      node = found.asNode();
    }
  }

  @Override
  public boolean isNode() {
    return true;
  }

  @Override
  public SyntaxNode asNode() {
    return this;
  }
}
