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
import static dev.citrine.syntax.SyntaxKind.BACKTICK;
import static dev.citrine.syntax.SyntaxKind.COMMA;
import static dev.citrine.syntax.SyntaxKind.COMMA_AT;
import static dev.citrine.syntax.SyntaxKind.DISCARD;
import static dev.citrine.syntax.SyntaxKind.EOF;
import static dev.citrine.syntax.SyntaxKind.ERROR;
import static dev.citrine.syntax.SyntaxKind.LIST;
import static dev.citrine.syntax.SyntaxKind.MAP;
import static dev.citrine.syntax.SyntaxKind.QUOTE;
import static dev.citrine.syntax.SyntaxKind.ROOT;
import static dev.citrine.syntax.SyntaxKind.SET;
import static dev.citrine.syntax.SyntaxKind.TAG;
import static dev.citrine.syntax.SyntaxKind.VECTOR;

import com.google.common.base.Ascii;
import com.google.common.collect.EnumMultiset;
import dev.citrine.diag.CitrineError.ErrorKind;
import dev.citrine.diag.CitrineLog;
import dev.citrine.diag.SourceFile;
import dev.citrine.syntax.SyntaxKind;
import dev.citrine.tree.NodeCache;
import dev.citrine.tree.SyntaxTree;
import dev.citrine.tree.TreeBuilder;

/**
 * A recursive descent parser that builds a lossless syntax tree.
 *
 * <p>The parser never fails. Malformed input is wrapped in {@link SyntaxKind#ERROR} nodes and
 * reported to a {@link CitrineLog}, and parsing resumes at the next token. Trivia does not take
 * part in grammar decisions: it is appended to the innermost open node whenever the parser looks
 * at the next significant token.
 */
public class Parser {

  /** Parses the given text with the default options. */
  public static SyntaxTree parse(String input) {
    return parse(input, ParseOptions.defaults());
  }

  public static SyntaxTree parse(String input, ParseOptions options) {
    SourceFile source = new SourceFile(options.path().orElse(null), input);
    return new Parser(new StreamLexer(source), options).root();
  }

  private final Lexer lexer;
  private final TreeBuilder builder;
  private final CitrineLog log;
  private final int maxNestingDepth;

  /** The closing delimiters of the collections that are currently open. */
  private final EnumMultiset<SyntaxKind> openDelimiters = EnumMultiset.create(SyntaxKind.class);

  private Token token;
  private int depth;
  private boolean reportedNesting;

  public Parser(Lexer lexer, ParseOptions options) {
    this.lexer = lexer;
    this.builder = new TreeBuilder(options.internNodes() ? new NodeCache() : null);
    this.log = new CitrineLog(lexer.source());
    this.maxNestingDepth = options.maxNestingDepth();
    this.token = lexer.next();
  }

  /** Parses the whole input. */
  public SyntaxTree root() {
    builder.startNode(ROOT);
    parseForms();
    peek();
    builder.finishNode();
    return new SyntaxTree(log.source(), builder.finish(), log.diagnostics());
  }

  /** Appends pending trivia to the current node and returns the kind of the next token. */
  private SyntaxKind peek() {
    while (token.kind().isTrivia()) {
      builder.token(token.kind(), token.text());
      token = lexer.next();
    }
    return token.kind();
  }

  /** Appends the current token to the current node. */
  private void bump() {
    verify(token.kind() != EOF);
    builder.token(token.kind(), token.text());
    token = lexer.next();
  }

  /** Returns true if a form can start at the next significant token. */
  private boolean hasOperand() {
    SyntaxKind next = peek();
    return next != EOF && !next.isClosingDelimiter();
  }

  private void parseForms() {
    while (true) {
      SyntaxKind next = peek();
      if (next == EOF || (next.isClosingDelimiter() && openDelimiters.contains(next))) {
        return;
      }
      parseForm();
    }
  }

  /** Parses a single form and returns the kind of the token or node it produced. */
  private SyntaxKind parseForm() {
    SyntaxKind kind = peek();
    if (kind.isLiteral()) {
      bump();
      return kind;
    }
    if (kind.isClosingDelimiter() || kind == SyntaxKind.ERROR_TOKEN) {
      return unexpected();
    }
    if (depth >= maxNestingDepth) {
      return tooDeep();
    }
    return switch (kind) {
      case L_PAREN -> collection(LIST);
      case L_BRACKET -> collection(VECTOR);
      case L_BRACE -> collection(MAP);
      case HASH_L_BRACE -> collection(SET);
      case QUOTE_MARKER -> prefixed(QUOTE);
      case BACKTICK_MARKER -> prefixed(BACKTICK);
      case COMMA_MARKER -> prefixed(COMMA);
      case DISCARD_MARKER -> prefixed(DISCARD);
      case COMMA_AT_MARKER -> unquoteSplicing();
      case CARET_MARKER -> tag();
      default -> unexpected();
    };
  }

  private SyntaxKind collection(SyntaxKind kind) {
    Token open = token;
    SyntaxKind close = open.kind().closingDelimiter();
    builder.startNode(kind);
    bump();
    depth++;
    openDelimiters.add(close);
    parseForms();
    openDelimiters.remove(close);
    depth--;
    if (peek() == close) {
      bump();
      builder.finishNode();
      return kind;
    }
    log.error(open.start(), ErrorKind.MISSING_DELIMITER, close.spelling(), open.text());
    builder.finishNode(ERROR);
    return ERROR;
  }

  /** A reader macro that applies to exactly one following form. */
  private SyntaxKind prefixed(SyntaxKind kind) {
    Token marker = token;
    builder.startNode(kind);
    bump();
    if (!hasOperand()) {
      return missingOperand(marker);
    }
    depth++;
    parseForm();
    depth--;
    builder.finishNode();
    return kind;
  }

  /** {@code ,@} takes a list; any other operand is kept, but the node becomes an error. */
  private SyntaxKind unquoteSplicing() {
    Token marker = token;
    builder.startNode(COMMA_AT);
    bump();
    if (!hasOperand()) {
      return missingOperand(marker);
    }
    int operandStart = token.start();
    depth++;
    SyntaxKind operand = parseForm();
    depth--;
    // an ERROR operand has already been reported
    if (operand == LIST || operand == ERROR) {
      builder.finishNode();
      return COMMA_AT;
    }
    log.error(
        operandStart,
        ErrorKind.EXPECTED_LIST,
        marker.text(),
        Ascii.toLowerCase(operand.name()).replace('_', ' '));
    builder.finishNode(ERROR);
    return ERROR;
  }

  /** {@code ^tag value} */
  private SyntaxKind tag() {
    Token marker = token;
    builder.startNode(TAG);
    bump();
    depth++;
    boolean complete = hasOperand();
    if (complete) {
      parseForm();
      complete = hasOperand();
      if (complete) {
        parseForm();
      }
    }
    depth--;
    if (!complete) {
      return missingOperand(marker);
    }
    builder.finishNode();
    return TAG;
  }

  private SyntaxKind missingOperand(Token marker) {
    log.error(marker.start(), ErrorKind.MISSING_OPERAND, marker.text());
    builder.finishNode(ERROR);
    return ERROR;
  }

  /** Wraps a token that cannot start a form in an error node. */
  private SyntaxKind unexpected() {
    if (token.kind().isClosingDelimiter()) {
      log.error(token.start(), ErrorKind.UNEXPECTED_DELIMITER, token.text());
    } else if (token.text().startsWith("\"")) {
      log.error(token.start(), ErrorKind.UNTERMINATED_STRING);
    } else {
      log.error(token.start(), ErrorKind.UNEXPECTED_INPUT, token.text());
    }
    return errorToken();
  }

  /** Wraps an opening token in an error node instead of descending any further. */
  private SyntaxKind tooDeep() {
    if (!reportedNesting) {
      log.error(token.start(), ErrorKind.NESTING_TOO_DEEP, maxNestingDepth);
      reportedNesting = true;
    }
    return errorToken();
  }

  private SyntaxKind errorToken() {
    builder.startNode(ERROR);
    bump();
    builder.finishNode();
    return ERROR;
  }
}
