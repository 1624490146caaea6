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

package dev.citrine.syntax;

import org.jspecify.annotations.Nullable;

/**
 * The kinds of every token and tree node produced by the lexer and parser.
 *
 * <p>Kinds, not Java types, drive dispatch in the parser, the tree and its consumers.
 */
public enum SyntaxKind {
  // Delimiters.
  L_PAREN(Category.TOKEN, "("),
  R_PAREN(Category.TOKEN, ")"),
  L_BRACKET(Category.TOKEN, "["),
  R_BRACKET(Category.TOKEN, "]"),
  L_BRACE(Category.TOKEN, "{"),
  R_BRACE(Category.TOKEN, "}"),
  HASH_L_BRACE(Category.TOKEN, "#{"),

  // Literals.
  STRING(Category.LITERAL),
  LONG(Category.NUMBER),
  DOUBLE(Category.NUMBER),
  HEX(Category.NUMBER),
  BINARY(Category.NUMBER),
  BIGNUM(Category.NUMBER),
  RATIO(Category.NUMBER),
  CHARACTER(Category.LITERAL),
  KEYWORD(Category.LITERAL),
  SYMBOL(Category.LITERAL),

  // Reader macro markers.
  QUOTE_MARKER(Category.TOKEN, "'"),
  BACKTICK_MARKER(Category.TOKEN, "`"),
  COMMA_MARKER(Category.TOKEN, ","),
  COMMA_AT_MARKER(Category.TOKEN, ",@"),
  CARET_MARKER(Category.TOKEN, "^"),
  DISCARD_MARKER(Category.TOKEN, "#_"),

  // Trivia.
  COMMENT(Category.TRIVIA),
  WHITESPACE(Category.TRIVIA),
  NEWLINE(Category.TRIVIA),

  /** Input the lexer could not classify. */
  ERROR_TOKEN(Category.TOKEN),

  // Nodes.
  ROOT(Category.NODE),
  LIST(Category.NODE),
  VECTOR(Category.NODE),
  MAP(Category.NODE),
  SET(Category.NODE),
  QUOTE(Category.NODE),
  BACKTICK(Category.NODE),
  COMMA(Category.NODE),
  COMMA_AT(Category.NODE),
  TAG(Category.NODE),
  DISCARD(Category.NODE),

  /** A malformed region; may hold arbitrary tokens and nodes. */
  ERROR(Category.NODE),

  /** The end of input. Returned by the lexer, never stored in a tree. */
  EOF(Category.SENTINEL);

  private enum Category {
    TOKEN,
    LITERAL,
    NUMBER,
    TRIVIA,
    NODE,
    SENTINEL
  }

  private final Category category;
  private final @Nullable String value;

  SyntaxKind(Category category) {
    this(category, null);
  }

  SyntaxKind(Category category, @Nullable String value) {
    this.category = category;
    this.value = value;
  }

  /** The fixed spelling of this token kind, or {@code null} if it varies. */
  public @Nullable String spelling() {
    return value;
  }

  public boolean isToken() {
    return category != Category.NODE && category != Category.SENTINEL;
  }

  public boolean isNode() {
    return category == Category.NODE;
  }

  /** Whitespace, line breaks and comments. */
  public boolean isTrivia() {
    return category == Category.TRIVIA;
  }

  /** Tokens that form a complete form on their own. */
  public boolean isLiteral() {
    return category == Category.LITERAL || category == Category.NUMBER;
  }

  public boolean isNumber() {
    return category == Category.NUMBER;
  }

  public boolean isClosingDelimiter() {
    return this == R_PAREN || this == R_BRACKET || this == R_BRACE;
  }

  /** Returns the closing delimiter that ends a collection opened by this kind. */
  public SyntaxKind closingDelimiter() {
    return switch (this) {
      case L_PAREN -> R_PAREN;
      case L_BRACKET -> R_BRACKET;
      case L_BRACE, HASH_L_BRACE -> R_BRACE;
      default -> throw new AssertionError(this);
    };
  }

  @Override
  public String toString() {
    if (value != null) {
      return String.format("%s(%s)", name(), value);
    }
    return name();
  }
}
