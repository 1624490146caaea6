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

package dev.citrine.reader;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.math.BigInteger;
import java.util.Map;

/**
 * An immutable value read from Citrine source: an atom, or a collection of other values.
 *
 * <p>Values are compared structurally, and {@link #toString} prints them in a form that reads back
 * to an equal value.
 */
public interface Datum {

  /** The kind of a value. */
  enum Kind {
    NIL,
    BOOLEAN,
    LONG,
    BIG_INTEGER,
    DOUBLE,
    RATIO,
    STRING,
    CHARACTER,
    KEYWORD,
    SYMBOL,
    LIST,
    VECTOR,
    MAP,
    SET
  }

  Kind kind();

  Nil NIL = new Nil();

  static Symbol symbol(String name) {
    return new Symbol(name);
  }

  static ListValue list(Datum... elements) {
    return new ListValue(ImmutableList.copyOf(elements));
  }

  /** The {@code nil} value. */
  record Nil() implements Datum {
    @Override
    public Kind kind() {
      return Kind.NIL;
    }

    @Override
    public String toString() {
      return "nil";
    }
  }

  /** {@code true} or {@code false}. */
  record Bool(boolean value) implements Datum {
    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** An integer that fits in a {@code long}. */
  record LongValue(long value) implements Datum {
    @Override
    public Kind kind() {
      return Kind.LONG;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** An arbitrary precision integer, written with an {@code N} suffix. */
  record BigIntValue(BigInteger value) implements Datum {
    public BigIntValue {
      requireNonNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.BIG_INTEGER;
    }

    @Override
    public String toString() {
      return value + "N";
    }
  }

  record DoubleValue(double value) implements Datum {
    @Override
    public Kind kind() {
      return Kind.DOUBLE;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /**
   * A fraction in lowest terms. The denominator is greater than one; the sign is carried by the
   * numerator.
   */
  record Ratio(BigInteger numerator, BigInteger denominator) implements Datum {
    public Ratio {
      requireNonNull(numerator);
      requireNonNull(denominator);
      if (denominator.compareTo(BigInteger.ONE) <= 0
          || !numerator.gcd(denominator).equals(BigInteger.ONE)) {
        throw new IllegalArgumentException(numerator + "/" + denominator + " is not reduced");
      }
    }

    @Override
    public Kind kind() {
      return Kind.RATIO;
    }

    @Override
    public String toString() {
      return numerator + "/" + denominator;
    }
  }

  record Str(String value) implements Datum {

    private static final Escaper ESCAPER =
        Escapers.builder()
            .addEscape('"', "\\\"")
            .addEscape('\\', "\\\\")
            .addEscape('\n', "\\n")
            .addEscape('\t', "\\t")
            .addEscape('\r', "\\r")
            .addEscape('\b', "\\b")
            .addEscape('\f', "\\f")
            .build();

    public Str {
      requireNonNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }

    @Override
    public String toString() {
      return '"' + ESCAPER.escape(value) + '"';
    }
  }

  /** A single Unicode code point. */
  record Char(int codePoint) implements Datum {

    private static final ImmutableMap<Integer, String> NAMES =
        ImmutableMap.<Integer, String>builder()
            .put((int) '\n', "newline")
            .put((int) '\r', "return")
            .put((int) ' ', "space")
            .put((int) '\t', "tab")
            .put((int) '\f', "formfeed")
            .put((int) '\b', "backspace")
            .buildOrThrow();

    public Char {
      if (!Character.isValidCodePoint(codePoint)) {
        throw new IllegalArgumentException(Integer.toHexString(codePoint));
      }
    }

    @Override
    public Kind kind() {
      return Kind.CHARACTER;
    }

    @Override
    public String toString() {
      String name = NAMES.get(codePoint);
      if (name != null) {
        return "\\" + name;
      }
      if (Character.isISOControl(codePoint)) {
        return String.format("\\u%04X", codePoint);
      }
      return "\\" + new String(Character.toChars(codePoint));
    }
  }

  /** A keyword; the name excludes the leading colon. */
  record Keyword(String name) implements Datum {
    public Keyword {
      requireNonNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.KEYWORD;
    }

    @Override
    public String toString() {
      return ":" + name;
    }
  }

  record Symbol(String name) implements Datum {
    public Symbol {
      requireNonNull(name);
    }

    @Override
    public Kind kind() {
      return Kind.SYMBOL;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  record ListValue(ImmutableList<Datum> elements) implements Datum {
    public ListValue {
      requireNonNull(elements);
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    @Override
    public String toString() {
      return "(" + Joiner.on(' ').join(elements) + ")";
    }
  }

  record VectorValue(ImmutableList<Datum> elements) implements Datum {
    public VectorValue {
      requireNonNull(elements);
    }

    @Override
    public Kind kind() {
      return Kind.VECTOR;
    }

    @Override
    public String toString() {
      return "[" + Joiner.on(' ').join(elements) + "]";
    }
  }

  /** A map, iterated in the order its keys were written. */
  record MapValue(ImmutableMap<Datum, Datum> entries) implements Datum {
    public MapValue {
      requireNonNull(entries);
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("{");
      boolean first = true;
      for (Map.Entry<Datum, Datum> entry : entries.entrySet()) {
        if (!first) {
          sb.append(' ');
        }
        first = false;
        sb.append(entry.getKey()).append(' ').append(entry.getValue());
      }
      return sb.append('}').toString();
    }
  }

  /** A set, iterated in the order its elements were written. */
  record SetValue(ImmutableSet<Datum> elements) implements Datum {
    public SetValue {
      requireNonNull(elements);
    }

    @Override
    public Kind kind() {
      return Kind.SET;
    }

    @Override
    public String toString() {
      return "#{" + Joiner.on(' ').join(elements) + "}";
    }
  }
}
