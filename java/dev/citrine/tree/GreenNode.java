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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import dev.citrine.syntax.SyntaxKind;
import org.jspecify.annotations.Nullable;

/**
 * An interior node of the green tree.
 *
 * <p>Nodes are compared by value: two nodes are equal if they have the same kind and equal
 * children. The hash code is computed once, from the children's hash codes, so that nodes can be
 * interned by content (see {@link NodeCache}).
 */
@Immutable
public final class GreenNode extends GreenElement {

  private final SyntaxKind kind;
  private final ImmutableList<GreenElement> children;
  private final int textLength;
  private final int hash;

  public GreenNode(SyntaxKind kind, ImmutableList<GreenElement> children) {
    checkArgument(kind.isNode(), "%s is not a node kind", kind);
    this.kind = kind;
    this.children = children;
    int length = 0;
    int hash = kind.ordinal();
    for (GreenElement child : children) {
      length += child.textLength();
      hash = 31 * hash + child.hashCode();
    }
    this.textLength = length;
    this.hash = hash;
  }

  @Override
  public SyntaxKind kind() {
    return kind;
  }

  /** The children of this node, tokens and nodes interleaved in source order. */
  public ImmutableList<GreenElement> children() {
    return children;
  }

  @Override
  public int textLength() {
    return textLength;
  }

  @Override
  public boolean isNode() {
    return true;
  }

  @Override
  public GreenNode asNode() {
    return this;
  }

  @Override
  void appendText(StringBuilder sb) {
    for (GreenElement child : children) {
      child.appendText(sb);
    }
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GreenNode)) {
      return false;
    }
    GreenNode that = (GreenNode) obj;
    return kind == that.kind
        && hash == that.hash
        && textLength == that.textLength
        && children.equals(that.children);
  }

  @Override
  public String toString() {
    return kind.name() + "[" + children.size() + " children, " + textLength + " chars]";
  }
}
