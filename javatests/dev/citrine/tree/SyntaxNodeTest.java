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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.testing.EqualsTester;
import dev.citrine.parse.Parser;
import dev.citrine.syntax.SyntaxKind;
import dev.citrine.syntax.TextRange;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SyntaxNodeTest {

  // (a [b c]) d
  // 0123456789A
  private final SyntaxNode root = Parser.parse("(a [b c]) d").root();
  private final SyntaxNode list = root.children().get(0);
  private final SyntaxNode vector = list.children().get(0);

  @Test
  public void structure() {
    assertThat(root.range()).isEqualTo(TextRange.of(0, 11));
    assertThat(root.parent()).isNull();
    assertThat(kinds(root.childrenWithTokens()))
        .containsExactly(SyntaxKind.LIST, SyntaxKind.WHITESPACE, SyntaxKind.SYMBOL)
        .inOrder();
    assertThat(list.kind()).isEqualTo(SyntaxKind.LIST);
    assertThat(list.range()).isEqualTo(TextRange.of(0, 9));
    assertThat(list.text()).isEqualTo("(a [b c])");
    assertThat(vector.kind()).isEqualTo(SyntaxKind.VECTOR);
    assertThat(vector.range()).isEqualTo(TextRange.of(3, 8));
    assertThat(vector.indexInParent()).isEqualTo(3);
  }

  @Test
  public void parents() {
    assertThat(vector.parent()).isEqualTo(list);
    assertThat(list.parent()).isEqualTo(root);
    assertThat(vector.ancestors()).containsExactly(list, root).inOrder();
    SyntaxToken b = vector.childrenWithTokens().get(1).asToken();
    assertThat(b.parent()).isEqualTo(vector);
    assertThat(b.ancestors()).containsExactly(vector, list, root).inOrder();
  }

  @Test
  public void firstAndLast() {
    assertThat(list.firstChildOrToken().kind()).isEqualTo(SyntaxKind.L_PAREN);
    assertThat(list.lastChildOrToken().kind()).isEqualTo(SyntaxKind.R_PAREN);
    assertThat(list.lastChildOrToken().range()).isEqualTo(TextRange.of(8, 9));
    assertThat(list.firstChild()).isEqualTo(vector);
    assertThat(list.lastChild()).isEqualTo(vector);
    assertThat(vector.firstChild()).isNull();
    assertThat(vector.firstToken().text()).isEqualTo("[");
    assertThat(vector.lastToken().range()).isEqualTo(TextRange.of(7, 8));
    assertThat(root.lastToken().text()).isEqualTo("d");
  }

  @Test
  public void siblings() {
    SyntaxElement a = list.childrenWithTokens().get(1);
    assertThat(a.text()).isEqualTo("a");
    assertThat(a.prevSiblingOrToken().kind()).isEqualTo(SyntaxKind.L_PAREN);
    SyntaxElement space = a.nextSiblingOrToken();
    assertThat(space.kind()).isEqualTo(SyntaxKind.WHITESPACE);
    assertThat(space.range()).isEqualTo(TextRange.of(2, 3));
    assertThat(space.nextSiblingOrToken()).isEqualTo(vector);
    assertThat(vector.prevSiblingOrToken()).isEqualTo(space);
    assertThat(list.firstChildOrToken().prevSiblingOrToken()).isNull();
    assertThat(list.lastChildOrToken().nextSiblingOrToken()).isNull();
    assertThat(root.nextSiblingOrToken()).isNull();
  }

  @Test
  public void nodeSiblings() {
    SyntaxNode forms = Parser.parse("(a) 'b [c]").root();
    ImmutableList<SyntaxNode> children = forms.children();
    assertThat(children).hasSize(3);
    assertThat(children.get(0).nextSibling()).isEqualTo(children.get(1));
    assertThat(children.get(2).prevSibling()).isEqualTo(children.get(1));
    assertThat(children.get(0).prevSibling()).isNull();
    assertThat(children.get(2).nextSibling()).isNull();
  }

  @Test
  public void tokenNavigation() {
    SyntaxToken close = vector.lastToken();
    SyntaxToken next = close.nextToken();
    assertThat(next.kind()).isEqualTo(SyntaxKind.R_PAREN);
    assertThat(next.nextToken().kind()).isEqualTo(SyntaxKind.WHITESPACE);
    assertThat(root.lastToken().nextToken()).isNull();
    assertThat(root.firstToken().prevToken()).isNull();
    SyntaxToken b = vector.childrenWithTokens().get(1).asToken();
    assertThat(b.prevToken().text()).isEqualTo("[");
    assertThat(vector.firstToken().prevToken().range()).isEqualTo(TextRange.of(2, 3));
  }

  @Test
  public void tokenAt() {
    assertThat(root.tokenAt(0).kind()).isEqualTo(SyntaxKind.L_PAREN);
    assertThat(root.tokenAt(2).kind()).isEqualTo(SyntaxKind.WHITESPACE);
    assertThat(root.tokenAt(4).text()).isEqualTo("b");
    assertThat(root.tokenAt(4).parent()).isEqualTo(vector);
    assertThat(root.tokenAt(11).text()).isEqualTo("d");
    assertThat(vector.tokenAt(3).text()).isEqualTo("[");
    assertThrows(IllegalArgumentException.class, () -> vector.tokenAt(9));
    assertThat(Parser.parse("").root().tokenAt(0)).isNull();
  }

  @Test
  public void traversal() {
    assertThat(root.descendants().stream().map(SyntaxNode::kind).collect(toImmutableList()))
        .containsExactly(SyntaxKind.ROOT, SyntaxKind.LIST, SyntaxKind.VECTOR)
        .inOrder();
    assertThat(Iterables.size(root.descendantsWithTokens())).isEqualTo(14);
    assertThat(root.tokens().stream().map(SyntaxToken::text).collect(toImmutableList()))
        .containsExactly("(", "a", " ", "[", "b", " ", "c", "]", ")", " ", "d")
        .inOrder();
  }

  @Test
  public void errorNodes() {
    SyntaxNode error = Parser.parse("(a").root().children().get(0);
    assertThat(error.isError()).isTrue();
    assertThat(list.isError()).isFalse();
  }

  @Test
  public void equalsTest() {
    new EqualsTester()
        .addEqualityGroup(
            list, root.children().get(0), SyntaxNode.root(root.green()).children().get(0))
        .addEqualityGroup(vector, list.children().get(0))
        .addEqualityGroup(root)
        .addEqualityGroup(list.firstToken(), root.firstToken())
        .testEquals();
  }

  @Test
  public void toStringTest() {
    assertThat(vector.toString()).isEqualTo("VECTOR@3..8");
    assertThat(vector.firstToken().toString()).isEqualTo("L_BRACKET@3..4 \"[\"");
  }

  private static ImmutableList<SyntaxKind> kinds(ImmutableList<SyntaxElement> elements) {
    return elements.stream().map(SyntaxElement::kind).collect(toImmutableList());
  }
}
