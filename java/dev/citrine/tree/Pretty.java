/*
 * Copyright 2016 Google Inc. All Rights Reserved.
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

import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * A debug printer for syntax trees. Each element is printed on its own line, indented by its
 * depth, as its kind and range; tokens are followed by their quoted text.
 *
 * <pre>
 * LIST@0..3
 *   L_PAREN@0..1 "("
 *   SYMBOL@1..2 "a"
 *   R_PAREN@2..3 ")"
 * </pre>
 */
public class Pretty {

  private static final Escaper ESCAPER =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  public static String dump(SyntaxNode node) {
    Pretty pretty = new Pretty();
    pretty.print(node);
    return pretty.sb.toString();
  }

  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;

  private void print(SyntaxElement element) {
    sb.append(Strings.repeat(" ", indent * 2)).append(element.kind().name());
    sb.append('@').append(element.range());
    if (!element.isNode()) {
      sb.append(" \"").append(ESCAPER.escape(element.text())).append('"').append('\n');
      return;
    }
    sb.append('\n');
    indent++;
    for (SyntaxElement child : element.asNode().childrenWithTokens()) {
      print(child);
    }
    indent--;
  }
}
