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

import static com.google.common.base.MoreObjects.firstNonNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import dev.citrine.diag.CitrineError.ErrorKind;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A positioned diagnostic, rendered with its source line and a caret under the column.
 *
 * <p>The rendering is built on first use.
 */
public class CitrineDiagnostic {

  private final SourceFile source;
  private final ErrorKind kind;
  private final ImmutableList<Object> args;
  private final int position;
  private final Supplier<String> diagnostic;

  private CitrineDiagnostic(
      SourceFile source, ErrorKind kind, ImmutableList<Object> args, int position) {
    this.source = requireNonNull(source);
    this.kind = requireNonNull(kind);
    this.args = requireNonNull(args);
    this.position = position;
    this.diagnostic = Suppliers.memoize(this::render);
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The diagnostic message. */
  public String diagnostic() {
    return diagnostic.get();
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }

  /** The source position the diagnostic points at. */
  public int position() {
    return position;
  }

  /** The message, without the location prefix and source excerpt. */
  public String message() {
    return kind.format(args.toArray()).trim();
  }

  /**
   * Formats a diagnostic.
   *
   * @param source the current source file
   * @param position the diagnostic position
   * @param kind the error kind
   * @param args format args
   */
  public static CitrineDiagnostic format(
      SourceFile source, int position, ErrorKind kind, Object... args) {
    LineMap lineMap = source.lineMap();
    // checks the position
    lineMap.lineNumber(position);
    return new CitrineDiagnostic(source, kind, ImmutableList.copyOf(args), position);
  }

  private String render() {
    String path = firstNonNull(source.path(), "<>");
    LineMap lineMap = source.lineMap();
    StringBuilder sb = new StringBuilder(path).append(":");
    sb.append(lineMap.lineNumber(position)).append(": error: ");
    sb.append(message()).append(System.lineSeparator());
    sb.append(CharMatcher.breakingWhitespace().trimTrailingFrom(lineMap.line(position)))
        .append(System.lineSeparator());
    sb.append(Strings.repeat(" ", lineMap.column(position))).append('^');
    return sb.toString();
  }

  @Override
  public int hashCode() {
    return Objects.hash(source.path(), kind, args, position);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof CitrineDiagnostic)) {
      return false;
    }
    CitrineDiagnostic that = (CitrineDiagnostic) obj;
    return Objects.equals(source.path(), that.source.path())
        && kind.equals(that.kind)
        && args.equals(that.args)
        && position == that.position;
  }

  @Override
  public String toString() {
    return diagnostic();
  }
}
