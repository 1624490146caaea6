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
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.Immutable;
import dev.citrine.syntax.SyntaxKind;
import org.jspecify.annotations.Nullable;

/** A leaf of the green tree. */
@Immutable
public final class GreenToken extends GreenElement {

  private final SyntaxKind kind;
  private final String text;

  public GreenToken(SyntaxKind kind, String text) {
    checkArgument(kind.isToken(), "%s is not a token kind", kind);
    this.kind = kind;
    this.text = requireNonNull(text);
  }

  @Override
  public SyntaxKind kind() {
    return kind;
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public int textLength() {
    return text.length();
  }

  @Override
  public boolean isNode() {
    return false;
  }

  @Override
  public GreenToken asToken() {
    return this;
  }

  @Override
  void appendText(StringBuilder sb) {
    sb.append(text);
  }

  @Override
  public int hashCode() {
    return 31 * kind.ordinal() + text.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GreenToken)) {
      return false;
    }
    GreenToken that = (GreenToken) obj;
    return kind == that.kind && text.equals(that.text);
  }

  @Override
  public String toString() {
    return kind.name() + " \"" + text + "\"";
  }
}
