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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import dev.citrine.syntax.SyntaxKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TreeBuilderTest {

  @Test
  public void build() {
    TreeBuilder builder = new TreeBuilder();
    builder.startNode(SyntaxKind.ROOT);
    builder.startNode(SyntaxKind.LIST);
    builder.token(SyntaxKind.L_PAREN, "(");
    builder.token(SyntaxKind.SYMBOL, "f");
    assertThat(builder.depth()).isEqualTo(2);
    assertThat(builder.currentKind()).isEqualTo(SyntaxKind.LIST);
    builder.token(SyntaxKind.R_PAREN, ")");
    GreenNode list = builder.finishNode();
    builder.token(SyntaxKind.NEWLINE, "\n");
    builder.finishNode();
    GreenNode root = builder.finish();

    assertThat(root.kind()).isEqualTo(SyntaxKind.ROOT);
    assertThat(root.text()).isEqualTo("(f)\n");
    assertThat(root.textLength()).isEqualTo(4);
    assertThat(root.children()).hasSize(2);
    assertThat(root.children().get(0)).isSameInstanceAs(list);
    assertThat(list.kind()).isEqualTo(SyntaxKind.LIST);
    assertThat(list.children()).hasSize(3);
  }

  @Test
  public void finishAsError() {
    TreeBuilder builder = new TreeBuilder();
    builder.startNode(SyntaxKind.ROOT);
    builder.startNode(SyntaxKind.LIST);
    builder.token(SyntaxKind.L_PAREN, "(");
    GreenNode error = builder.finishNode(SyntaxKind.ERROR);
    builder.finishNode();
    assertThat(error.kind()).isEqualTo(SyntaxKind.ERROR);
    assertThat(builder.finish().children()).containsExactly(error);
  }

  @Test
  public void emptyRoot() {
    TreeBuilder builder = new TreeBuilder();
    builder.startNode(SyntaxKind.ROOT);
    builder.finishNode();
    GreenNode root = builder.finish();
    assertThat(root.children()).isEmpty();
    assertThat(root.text()).isEmpty();
  }

  @Test
  public void misuse() {
    TreeBuilder builder = new TreeBuilder();
    assertThrows(IllegalStateException.class, () -> builder.token(SyntaxKind.SYMBOL, "x"));
    assertThrows(IllegalStateException.class, () -> builder.finishNode());
    assertThrows(IllegalStateException.class, () -> builder.finish());
    assertThrows(IllegalArgumentException.class, () -> builder.startNode(SyntaxKind.SYMBOL));

    builder.startNode(SyntaxKind.ROOT);
    assertThrows(IllegalStateException.class, () -> builder.finish());
    assertThrows(IllegalArgumentException.class, () -> builder.token(SyntaxKind.LIST, "x"));
    assertThrows(IllegalArgumentException.class, () -> builder.finishNode(SyntaxKind.SYMBOL));
    builder.finishNode();
    assertThrows(IllegalStateException.class, () -> builder.startNode(SyntaxKind.LIST));
  }

  @Test
  public void interning() {
    TreeBuilder builder = new TreeBuilder(new NodeCache());
    builder.startNode(SyntaxKind.ROOT);
    for (int i = 0; i < 2; i++) {
      builder.startNode(SyntaxKind.VECTOR);
      builder.token(SyntaxKind.L_BRACKET, "[");
      builder.token(SyntaxKind.R_BRACKET, "]");
      builder.finishNode();
    }
    builder.finishNode();
    GreenNode root = builder.finish();
    assertThat(root.children().get(0)).isSameInstanceAs(root.children().get(1));
  }
}
