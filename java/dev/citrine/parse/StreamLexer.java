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

package dev.citrine.parse;

import static com.google.common.base.Verify.verify;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import dev.citrine.diag.SourceFile;
import dev.citrine.syntax.SyntaxKind;
import dev.citrine.syntax.TextRange;
import org.jspecify.annotations.Nullable;

/**
 * A {@link Lexer} that scans a {@link SourceFile} left to right.
 *
 * <p>Lexing never fails: input that matches no rule becomes an {@link SyntaxKind#ERROR_TOKEN}
 * spanning a single code point, and every token other than {@link SyntaxKind#EOF} consumes at least
 * one character.
 */
public class StreamLexer implements Lexer {

  /** The value of {@link #ch} at the end of input. */
  private static final int EOI = -1;

  /** Named character literals, in the order they are tried. */
  private static final ImmutableList<String> CHARACTER_NAMES =
      ImmutableList.of("newline", "return", "space", "tab", "formfeed", "backspace");

  /** Spellings of non-finite doubles. */
  private static final ImmutableList<String> DOUBLE_SPELLINGS =
      ImmutableList.of("Infinity", "NaN");

  private static final CharMatcher SYMBOL_PUNCTUATION = CharMatcher.anyOf("!?-+<>=$*%_/");
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
  private static final CharMatcher HEX_DIGIT =
      DIGIT.or(CharMatcher.inRange('a', 'f')).or(CharMatcher.inRange('A', 'F'));
  private static final CharMatcher BINARY_DIGIT = CharMatcher.anyOf("01");

  /** Tokenizes the given text, omitting the final {@link SyntaxKind#EOF}. */
  public static ImmutableList<Token> tokenize(String input) {
    return tokenize(new SourceFile(null, input));
  }

  /** Tokenizes the given source, omitting the final {@link SyntaxKind#EOF}. */
  public static ImmutableList<Token> tokenize(SourceFile source) {
    StreamLexer lexer = new StreamLexer(source);
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (Token token = lexer.next(); token.kind() != SyntaxKind.EOF; token = lexer.next()) {
      tokens.add(token);
    }
    return tokens.build();
  }

  private final SourceFile source;
  private final String input;

  /** The current input character. */
  private int ch;

  /** The position of the current input character. */
  private int position;

  /** The start position of the current token. */
  private int start;

  public StreamLexer(SourceFile source) {
    this.source = source;
    this.input = source.source();
    this.position = 0;
    this.ch = charAt(0);
  }

  @Override
  public int position() {
    return position;
  }

  @Override
  public SourceFile source() {
    return source;
  }

  /** Consumes an input character. */
  private void eat() {
    verify(ch != EOI);
    position++;
    ch = charAt(position);
  }

  /** Consumes the input up to {@code end}. */
  private void eatTo(int end) {
    verify(position <= end && end <= input.length(), "%s..%s", position, end);
    position = end;
    ch = charAt(position);
  }

  /** Consumes the code point at the current position. */
  private void eatCodePoint() {
    eatTo(position + Character.charCount(input.codePointAt(position)));
  }

  private int charAt(int idx) {
    return idx < input.length() ? input.charAt(idx) : EOI;
  }

  private int codePointAt(int idx) {
    return idx < input.length() ? input.codePointAt(idx) : EOI;
  }

  private Token token(SyntaxKind kind) {
    return new Token(kind, input.substring(start, position), TextRange.of(start, position));
  }

  @Override
  public Token next() {
    start = position;
    switch (ch) {
      case EOI -> {
        return token(SyntaxKind.EOF);
      }
      case '\n' -> {
        eat();
        return token(SyntaxKind.NEWLINE);
      }
      case '\r' -> {
        eat();
        if (ch == '\n') {
          eat();
        }
        return token(SyntaxKind.NEWLINE);
      }
      case ';' -> {
        eat();
        while (ch != '\n' && ch != '\r' && ch != EOI) {
          eat();
        }
        return token(SyntaxKind.COMMENT);
      }
      case '(' -> {
        eat();
        return token(SyntaxKind.L_PAREN);
      }
      case ')' -> {
        eat();
        return token(SyntaxKind.R_PAREN);
      }
      case '[' -> {
        eat();
        return token(SyntaxKind.L_BRACKET);
      }
      case ']' -> {
        eat();
        return token(SyntaxKind.R_BRACKET);
      }
      case '{' -> {
        eat();
        return token(SyntaxKind.L_BRACE);
      }
      case '}' -> {
        eat();
        return token(SyntaxKind.R_BRACE);
      }
      case '#' -> {
        eat();
        switch (ch) {
          case '{' -> {
            eat();
            return token(SyntaxKind.HASH_L_BRACE);
          }
          case '_' -> {
            eat();
            return token(SyntaxKind.DISCARD_MARKER);
          }
          default -> {
            return token(SyntaxKind.ERROR_TOKEN);
          }
        }
      }
      case '\'' -> {
        eat();
        return token(SyntaxKind.QUOTE_MARKER);
      }
      case '`' -> {
        eat();
        return token(SyntaxKind.BACKTICK_MARKER);
      }
      case '^' -> {
        eat();
        return token(SyntaxKind.CARET_MARKER);
      }
      case ',' -> {
        eat();
        if (ch == '@') {
          eat();
          return token(SyntaxKind.COMMA_AT_MARKER);
        }
        return token(SyntaxKind.COMMA_MARKER);
      }
      case '"' -> {
        return stringLiteral();
      }
      case '\\' -> {
        return characterLiteral();
      }
      case ':' -> {
        eat();
        while (isIdentifierPart(codePointAt(position))) {
          eatCodePoint();
        }
        return token(SyntaxKind.KEYWORD);
      }
      default -> {
        SyntaxKind number = numberLiteral();
        if (number != null) {
          return token(number);
        }
        int codePoint = codePointAt(position);
        if (isSymbolStart(codePoint)) {
          eatCodePoint();
          while (isIdentifierPart(codePointAt(position))) {
            eatCodePoint();
          }
          return token(SyntaxKind.SYMBOL);
        }
        if (isWhitespace(codePoint)) {
          while (isWhitespace(ch)) {
            eat();
          }
          return token(SyntaxKind.WHITESPACE);
        }
        eatCodePoint();
        return token(SyntaxKind.ERROR_TOKEN);
      }
    }
  }

  private Token stringLiteral() {
    eat();
    while (true) {
      switch (ch) {
        case EOI -> {
          return token(SyntaxKind.ERROR_TOKEN);
        }
        case '\\' -> {
          // the escaped character never terminates the string
          eat();
          if (ch != EOI) {
            eat();
          }
        }
        case '"' -> {
          eat();
          return token(SyntaxKind.STRING);
        }
        default -> eat();
      }
    }
  }

  private Token characterLiteral() {
    eat();
    for (String name : CHARACTER_NAMES) {
      if (input.startsWith(name, position)) {
        eatTo(position + name.length());
        return token(SyntaxKind.CHARACTER);
      }
    }
    if (ch == 'u' && matchRun(HEX_DIGIT, position + 1) >= position + 5) {
      eatTo(position + 5);
      return token(SyntaxKind.CHARACTER);
    }
    if (ch == EOI) {
      return token(SyntaxKind.ERROR_TOKEN);
    }
    eatCodePoint();
    return token(SyntaxKind.CHARACTER);
  }

  /**
   * Consumes a numeric literal starting at the current position, if there is one.
   *
   * <p>The forms are tried from most to least specific, and the first match wins. The result
   * depends only on the characters of the literal, never on what precedes it.
   */
  private @Nullable SyntaxKind numberLiteral() {
    int end;
    if ((end = matchRatio(position)) != -1) {
      eatTo(end);
      return SyntaxKind.RATIO;
    }
    if ((end = matchRadix(position, "xX", HEX_DIGIT)) != -1) {
      eatTo(end);
      return SyntaxKind.HEX;
    }
    if ((end = matchRadix(position, "bB", BINARY_DIGIT)) != -1) {
      eatTo(end);
      return SyntaxKind.BINARY;
    }
    if ((end = matchIntegerWithSuffix(position, "nN")) != -1) {
      eatTo(end);
      return SyntaxKind.BIGNUM;
    }
    if ((end = matchDouble(position)) != -1) {
      eatTo(end);
      return SyntaxKind.DOUBLE;
    }
    if ((end = matchLong(position)) != -1) {
      eatTo(end);
      return SyntaxKind.LONG;
    }
    return null;
  }

  /** {@code -?digits/-?digits} */
  private int matchRatio(int idx) {
    int numerator = matchSignedDigits(idx);
    if (numerator == -1 || charAt(numerator) != '/') {
      return -1;
    }
    return matchSignedDigits(numerator + 1);
  }

  /** {@code 0[prefix]digit+} */
  private int matchRadix(int idx, String prefix, CharMatcher digits) {
    if (charAt(idx) != '0' || prefix.indexOf(charAt(idx + 1)) == -1) {
      return -1;
    }
    int end = matchRun(digits, idx + 2);
    return end > idx + 2 ? end : -1;
  }

  /** {@code -?digits[suffix]} */
  private int matchIntegerWithSuffix(int idx, String suffix) {
    int end = matchSignedDigits(idx);
    if (end == -1 || suffix.indexOf(charAt(end)) == -1) {
      return -1;
    }
    return end + 1;
  }

  /**
   * {@code -?digits*.digits(exponent)?}, {@code -?digits exponent}, and the spellings {@code
   * Infinity} and {@code NaN} with an optional leading minus.
   */
  private int matchDouble(int idx) {
    int i = charAt(idx) == '-' ? idx + 1 : idx;
    for (String special : DOUBLE_SPELLINGS) {
      if (input.startsWith(special, i)) {
        int end = i + special.length();
        return isIdentifierPart(codePointAt(end)) ? -1 : end;
      }
    }
    int integer = matchRun(DIGIT, i);
    if (charAt(integer) == '.') {
      int fraction = matchRun(DIGIT, integer + 1);
      if (fraction > integer + 1) {
        int exponent = matchExponent(fraction);
        return exponent != -1 ? exponent : fraction;
      }
    }
    if (integer > i) {
      return matchExponent(integer);
    }
    return -1;
  }

  /** {@code [eE][+-]?digits} */
  private int matchExponent(int idx) {
    if (charAt(idx) != 'e' && charAt(idx) != 'E') {
      return -1;
    }
    int i = idx + 1;
    if (charAt(i) == '+' || charAt(i) == '-') {
      i++;
    }
    int end = matchRun(DIGIT, i);
    return end > i ? end : -1;
  }

  /** {@code -?digits[lL]?} */
  private int matchLong(int idx) {
    int end = matchSignedDigits(idx);
    if (end == -1) {
      return -1;
    }
    return charAt(end) == 'l' || charAt(end) == 'L' ? end + 1 : end;
  }

  /** {@code -?digits}, requiring at least one digit. */
  private int matchSignedDigits(int idx) {
    int i = charAt(idx) == '-' ? idx + 1 : idx;
    int end = matchRun(DIGIT, i);
    return end > i ? end : -1;
  }

  /** Returns the end of the run of characters matching {@code matcher} that starts at idx. */
  private int matchRun(CharMatcher matcher, int idx) {
    int i = idx;
    while (i < input.length() && matcher.matches(input.charAt(i))) {
      i++;
    }
    return i;
  }

  private static boolean isSymbolStart(int codePoint) {
    if (codePoint == EOI) {
      return false;
    }
    if (codePoint < Character.MIN_SUPPLEMENTARY_CODE_POINT
        && SYMBOL_PUNCTUATION.matches((char) codePoint)) {
      return true;
    }
    return Character.isLetter(codePoint);
  }

  private static boolean isIdentifierPart(int codePoint) {
    return isSymbolStart(codePoint) || (codePoint >= '0' && codePoint <= '9');
  }

  /** Whitespace other than line breaks. */
  private static boolean isWhitespace(int codePoint) {
    return codePoint != EOI
        && codePoint != '\n'
        && codePoint != '\r'
        && Character.isWhitespace(codePoint);
  }
}
