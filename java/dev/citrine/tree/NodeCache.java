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
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import dev.citrine.syntax.SyntaxKind;

/**
 * Deduplicates green tokens and nodes by content, so that identical subtrees are represented by a
 * single instance.
 *
 * <p>A cache may be shared by several {@link TreeBuilder}s, including builders running on
 * different threads.
 */
public class NodeCache {

  private final Interner<GreenToken> tokens = Interners.newStrongInterner();
  private final Interner<GreenNode> nodes = Interners.newStrongInterner();

  public GreenToken token(SyntaxKind kind, String text) {
    return tokens.intern(new GreenToken(kind, text));
  }

  public GreenNode node(SyntaxKind kind, ImmutableList<GreenElement> children) {
    return nodes.intern(new GreenNode(kind, children));
  }
}
