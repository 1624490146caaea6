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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.citrine.syntax.SyntaxKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Builds a green tree bottom-up from a stream of start, token and finish events.
 *
 * <p>The builder keeps a stack of open nodes. Tokens are appended to the innermost open node;
 * finishing a node turns its children into an immutable {@link GreenNode} and appends that node to
 * the enclosing one, or makes it the root once the stack is empty.
 */
public class TreeBuilder {

  /** A node that has been started but not finished. */
  private static class Frame {
    final SyntaxKind kind;
    final List<GreenElement> children = new ArrayList<>();

    Frame(SyntaxKind kind) {
      this.kind = kind;
    }
  }

  private final @Nullable NodeCache cache;
  private final Deque<Frame> frames = new ArrayDeque<>();
  private @Nullable GreenNode root;

  /** Creates a builder that allocates a new green element for every event. */
  public TreeBuilder() {
    this(null);
  }

  /** Creates a builder that interns elements in the given cache, if it is non-null. */
  public TreeBuilder(@Nullable NodeCache cache) {
    this.cache = cache;
  }

  /** Opens a node of the given kind as a child of the current node. */
  public void startNode(SyntaxKind kind) {
    checkArgument(kind.isNode(), "%s is not a node kind", kind);
    checkState(root == null, "the root node is already finished");
    frames.push(new Frame(kind));
  }

  /** Appends a token to the current node. */
  public void token(SyntaxKind kind, String text) {
    Frame frame = frames.peek();
    checkState(frame != null, "no open node for %s", kind);
    frame.children.add(cache != null ? cache.token(kind, text) : new GreenToken(kind, text));
  }

  /** Closes the current node. */
  @CanIgnoreReturnValue
  public GreenNode finishNode() {
    Frame frame = frames.peek();
    checkState(frame != null, "no open node");
    return finishNode(frame.kind);
  }

  /**
   * Closes the current node, giving it the kind {@code kind} instead of the kind it was started
   * with. The parser uses this to turn a malformed form into an {@link SyntaxKind#ERROR} node once
   * it has seen all of it.
   */
  @CanIgnoreReturnValue
  public GreenNode finishNode(SyntaxKind kind) {
    checkArgument(kind.isNode(), "%s is not a node kind", kind);
    Frame frame = frames.poll();
    checkState(frame != null, "no open node");
    ImmutableList<GreenElement> children = ImmutableList.copyOf(frame.children);
    GreenNode node = cache != null ? cache.node(kind, children) : new GreenNode(kind, children);
    Frame parent = frames.peek();
    if (parent != null) {
      parent.children.add(node);
    } else {
      root = node;
    }
    return node;
  }

  /** The kind of the innermost open node. */
  public SyntaxKind currentKind() {
    Frame frame = frames.peek();
    checkState(frame != null, "no open node");
    return frame.kind;
  }

  /** The number of open nodes. */
  public int depth() {
    return frames.size();
  }

  /** Returns the finished root node. */
  public GreenNode finish() {
    checkState(frames.isEmpty(), "%s nodes are still open", frames.size());
    checkState(root != null, "no node was built");
    return root;
  }
}
