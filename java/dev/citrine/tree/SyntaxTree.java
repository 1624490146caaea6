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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import dev.citrine.diag.CitrineDiagnostic;
import dev.citrine.diag.CitrineError;
import dev.citrine.diag.SourceFile;
import dev.citrine.syntax.SyntaxKind;

/**
 * The result of parsing a source file: the green tree, a view of its root, and the diagnostics
 * reported for malformed input.
 */
public class SyntaxTree {

  private final SourceFile source;
  private final GreenNode green;
  private final ImmutableList<CitrineDiagnostic> diagnostics;
  private final Supplier<SyntaxNode> root;

  public SyntaxTree(
      SourceFile source, GreenNode green, ImmutableList<CitrineDiagnostic> diagnostics) {
    checkArgument(green.kind() == SyntaxKind.ROOT, "expected a root node, got %s", green.kind());
    checkArgument(
        green.textLength() == source.source().length(),
        "tree covers %s chars of %s",
        green.textLength(),
        source.source().length());
    this.source = source;
    this.green = green;
    this.diagnostics = diagnostics;
    this.root = Suppliers.memoize(() -> SyntaxNode.root(green));
  }

  public SyntaxNode root() {
    return root.get();
  }

  public GreenNode green() {
    return green;
  }

  public SourceFile source() {
    return source;
  }

  /** The text of the tree, rebuilt from its tokens. */
  public String text() {
    return green.text();
  }

  public ImmutableList<CitrineDiagnostic> diagnostics() {
    return diagnostics;
  }

  public boolean hasErrors() {
    return !diagnostics.isEmpty();
  }

  /** Throws a {@link CitrineError} with every diagnostic if the input was malformed. */
  public void checkNoErrors() {
    if (hasErrors()) {
      throw new CitrineError(diagnostics);
    }
  }

  @Override
  public String toString() {
    return Pretty.dump(root());
  }
}
