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

package dev.citrine.diag;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;

/** An error thrown by callers that require well-formed input. */
public class CitrineError extends Error {

  /** A diagnostic kind. */
  public enum ErrorKind {
    UNEXPECTED_INPUT("unexpected input: %s"),
    UNTERMINATED_STRING("unterminated string literal"),
    UNEXPECTED_DELIMITER("unexpected closing delimiter '%s'"),
    MISSING_DELIMITER("expected '%s' to close '%s'"),
    MISSING_OPERAND("expected a form after '%s'"),
    EXPECTED_LIST("'%s' must be followed by a list, found %s"),
    NESTING_TOO_DEEP("forms nested deeper than %s levels"),
    SYNTAX_ERROR("cannot read malformed form"),
    INVALID_LITERAL("invalid literal: %s"),
    INVALID_ESCAPE("invalid escape sequence: %s"),
    ODD_MAP_ARITY("map literal must contain an even number of forms"),
    DUPLICATE_KEY("duplicate key: %s");

    private final String message;

    ErrorKind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  /**
   * Formats a diagnostic.
   *
   * @param source the current source file
   * @param position the diagnostic position
   * @param kind the error kind
   * @param args format args
   */
  public static CitrineError format(
      SourceFile source, int position, ErrorKind kind, Object... args) {
    return new CitrineError(
        ImmutableList.of(CitrineDiagnostic.format(source, position, kind, args)));
  }

  private final ImmutableList<CitrineDiagnostic> diagnostics;

  public CitrineError(ImmutableList<CitrineDiagnostic> diagnostics) {
    checkArgument(!diagnostics.isEmpty());
    this.diagnostics = diagnostics;
  }

  /** Every diagnostic, rendered with its source excerpt. */
  @Override
  public String getMessage() {
    return diagnostics.stream()
        .map(CitrineDiagnostic::diagnostic)
        .collect(Collectors.joining(System.lineSeparator()));
  }

  /** The kind of the first diagnostic. */
  public ErrorKind kind() {
    return diagnostics.get(0).kind();
  }

  /** The diagnostic arguments of the first diagnostic. */
  public ImmutableList<Object> args() {
    return diagnostics.get(0).args();
  }

  /** The diagnostics. */
  public ImmutableList<CitrineDiagnostic> diagnostics() {
    return diagnostics;
  }

  /** The kinds of all diagnostics, in order. */
  public ImmutableList<ErrorKind> kinds() {
    return diagnostics.stream().map(CitrineDiagnostic::kind).collect(toImmutableList());
  }
}
