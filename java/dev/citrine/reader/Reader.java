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

package dev.citrine.reader;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.citrine.diag.CitrineError;
import dev.citrine.diag.CitrineError.ErrorKind;
import dev.citrine.diag.SourceFile;
import dev.citrine.parse.Parser;
import dev.citrine.reader.Datum.BigIntValue;
import dev.citrine.reader.Datum.Bool;
import dev.citrine.reader.Datum.Char;
import dev.citrine.reader.Datum.DoubleValue;
import dev.citrine.reader.Datum.Keyword;
import dev.citrine.reader.Datum.ListValue;
import dev.citrine.reader.Datum.LongValue;
import dev.citrine.reader.Datum.MapValue;
import dev.citrine.reader.Datum.Ratio;
import dev.citrine.reader.Datum.SetValue;
import dev.citrine.reader.Datum.Str;
import dev.citrine.reader.Datum.VectorValue;
import dev.citrine.syntax.SyntaxKind;
import dev.citrine.tree.SyntaxElement;
import dev.citrine.tree.SyntaxNode;
import dev.citrine.tree.SyntaxTree;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads the forms of a well-formed syntax tree as {@link Datum} values.
 *
 * <p>Reader macros are expanded into lists headed by a symbol: {@code 'x} reads as {@code (quote
 * x)}, {@code `x} as {@code (quasiquote x)}, {@code ,x} as {@code (unquote x)}, {@code ,@x} as
 * {@code (unquote-splicing x)} and {@code ^m x} as {@code (with-meta x m)}. Forms preceded by
 * {@code #_} are skipped.
 */
public class Reader {

  private static final CharMatcher HEX_DIGIT =
      CharMatcher.inRange('0', '9')
          .or(CharMatcher.inRange('a', 'f'))
          .or(CharMatcher.inRange('A', 'F'));

  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  /** Parses and reads every top-level form of the given text. */
  public static ImmutableList<Datum> read(String input) {
    return read(Parser.parse(input));
  }

  /**
   * Reads every top-level form of the given tree.
   *
   * @throws CitrineError if the tree has syntax errors, or holds a literal or collection that
   *     does not denote a value
   */
  public static ImmutableList<Datum> read(SyntaxTree tree) {
    tree.checkNoErrors();
    Reader reader = new Reader(tree.source());
    return forms(tree.root()).stream().map(reader::read).collect(toImmutableList());
  }

  private final SourceFile source;

  private Reader(SourceFile source) {
    this.source = source;
  }

  /** The forms directly inside a node, skipping delimiters, markers, trivia and discarded forms. */
  private static ImmutableList<SyntaxElement> forms(SyntaxNode node) {
    ImmutableList.Builder<SyntaxElement> result = ImmutableList.builder();
    for (SyntaxElement child : node.childrenWithTokens()) {
      SyntaxKind kind = child.kind();
      if (kind == SyntaxKind.DISCARD) {
        continue;
      }
      if (kind.isNode() || kind.isLiteral()) {
        result.add(child);
      }
    }
    return result.build();
  }

  private Datum read(SyntaxElement element) {
    if (!element.isNode()) {
      return literal(element);
    }
    SyntaxNode node = element.asNode();
    ImmutableList<Datum> forms =
        forms(node).stream().map(this::read).collect(toImmutableList());
    return switch (node.kind()) {
      case LIST -> new ListValue(forms);
      case VECTOR -> new VectorValue(forms);
      case MAP -> map(node, forms);
      case SET -> set(node, forms);
      case QUOTE -> expand(node, "quote", forms);
      case BACKTICK -> expand(node, "quasiquote", forms);
      case COMMA -> expand(node, "unquote", forms);
      case COMMA_AT -> expand(node, "unquote-splicing", forms);
      case TAG -> tag(node, forms);
      default -> throw error(node.range().start(), ErrorKind.SYNTAX_ERROR);
    };
  }

  /** Reads a reader macro as a list of its name and operand. */
  private Datum expand(SyntaxNode node, String name, ImmutableList<Datum> forms) {
    // the operand was a discarded form
    if (forms.size() != 1) {
      throw error(node.range().start(), ErrorKind.SYNTAX_ERROR);
    }
    return Datum.list(Datum.symbol(name), forms.get(0));
  }

  private Datum tag(SyntaxNode node, ImmutableList<Datum> forms) {
    if (forms.size() != 2) {
      throw error(node.range().start(), ErrorKind.SYNTAX_ERROR);
    }
    return Datum.list(Datum.symbol("with-meta"), forms.get(1), forms.get(0));
  }

  private Datum map(SyntaxNode node, ImmutableList<Datum> forms) {
    if (forms.size() % 2 != 0) {
      throw error(node.range().start(), ErrorKind.ODD_MAP_ARITY);
    }
    ImmutableList<SyntaxElement> elements = forms(node);
    Map<Datum, Datum> entries = new LinkedHashMap<>();
    for (int i = 0; i < forms.size(); i += 2) {
      Datum key = forms.get(i);
      if (entries.containsKey(key)) {
        throw error(elements.get(i).range().start(), ErrorKind.DUPLICATE_KEY, key);
      }
      entries.put(key, forms.get(i + 1));
    }
    return new MapValue(ImmutableMap.copyOf(entries));
  }

  private Datum set(SyntaxNode node, ImmutableList<Datum> forms) {
    ImmutableList<SyntaxElement> elements = forms(node);
    Set<Datum> seen = new LinkedHashSet<>();
    for (int i = 0; i < forms.size(); i++) {
      if (!seen.add(forms.get(i))) {
        throw error(elements.get(i).range().start(), ErrorKind.DUPLICATE_KEY, forms.get(i));
      }
    }
    return new SetValue(ImmutableSet.copyOf(seen));
  }

  private Datum literal(SyntaxElement token) {
    String text = token.text();
    int position = token.range().start();
    return switch (token.kind()) {
      case LONG -> integer(new BigInteger(stripSuffix(text, "lL")));
      case HEX -> integer(new BigInteger(text.substring(2), 16));
      case BINARY -> integer(new BigInteger(text.substring(2), 2));
      case BIGNUM -> new BigIntValue(new BigInteger(stripSuffix(text, "nN")));
      case DOUBLE -> new DoubleValue(Double.parseDouble(text));
      case RATIO -> ratio(text, position);
      case STRING -> new Str(unescape(text.substring(1, text.length() - 1), position + 1));
      case CHARACTER -> new Char(character(text.substring(1)));
      case KEYWORD -> new Keyword(text.substring(1));
      case SYMBOL -> symbol(text);
      default -> throw error(position, ErrorKind.INVALID_LITERAL, text);
    };
  }

  private static String stripSuffix(String text, String suffixes) {
    if (!text.isEmpty() && suffixes.indexOf(text.charAt(text.length() - 1)) != -1) {
      return text.substring(0, text.length() - 1);
    }
    return text;
  }

  /** Returns a long if the value fits in one, and a big integer otherwise. */
  private static Datum integer(BigInteger value) {
    if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
      return new LongValue(value.longValueExact());
    }
    return new BigIntValue(value);
  }

  private Datum ratio(String text, int position) {
    int slash = text.indexOf('/');
    BigInteger numerator = new BigInteger(text.substring(0, slash));
    BigInteger denominator = new BigInteger(text.substring(slash + 1));
    if (denominator.signum() == 0) {
      throw error(position, ErrorKind.INVALID_LITERAL, text);
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    BigInteger gcd = numerator.gcd(denominator);
    numerator = numerator.divide(gcd);
    denominator = denominator.divide(gcd);
    if (denominator.equals(BigInteger.ONE)) {
      return integer(numerator);
    }
    return new Ratio(numerator, denominator);
  }

  private static Datum symbol(String text) {
    return switch (text) {
      case "nil" -> Datum.NIL;
      case "true" -> new Bool(true);
      case "false" -> new Bool(false);
      default -> Datum.symbol(text);
    };
  }

  /** Returns the code point of a character literal, given the text after the backslash. */
  private static int character(String text) {
    switch (text) {
      case "newline":
        return '\n';
      case "return":
        return '\r';
      case "space":
        return ' ';
      case "tab":
        return '\t';
      case "formfeed":
        return '\f';
      case "backspace":
        return '\b';
      default:
        break;
    }
    if (text.length() == 5 && text.charAt(0) == 'u') {
      return Integer.parseInt(text.substring(1), 16);
    }
    return text.codePointAt(0);
  }

  /**
   * Replaces the escape sequences in the body of a string literal.
   *
   * @param body the literal without its quotes
   * @param position the source position of the first character of {@code body}
   */
  private String unescape(String body, int position) {
    StringBuilder sb = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      // the lexer never ends a string on a lone backslash
      char next = body.charAt(++i);
      switch (next) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case '"' -> sb.append('"');
        case '\\' -> sb.append('\\');
        case 'u' -> {
          if (i + 4 >= body.length() || !HEX_DIGIT.matchesAllOf(body.substring(i + 1, i + 5))) {
            throw error(position + i - 1, ErrorKind.INVALID_ESCAPE, body.substring(i - 1, i + 1));
          }
          sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
          i += 4;
        }
        default ->
            throw error(
                position + i - 1,
                ErrorKind.INVALID_ESCAPE,
                body.substring(i - 1, i + Character.charCount(body.codePointAt(i))));
      }
    }
    return sb.toString();
  }

  private CitrineError error(int position, ErrorKind kind, Object... args) {
    return CitrineError.format(source, position, kind, args);
  }
}
