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

import static com.google.common.truth.Truth.assertThat;
import static dev.citrine.reader.Datum.list;
import static dev.citrine.reader.Datum.symbol;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.citrine.diag.CitrineError;
import dev.citrine.diag.CitrineError.ErrorKind;
import dev.citrine.reader.Datum.BigIntValue;
import dev.citrine.reader.Datum.Bool;
import dev.citrine.reader.Datum.Char;
import dev.citrine.reader.Datum.DoubleValue;
import dev.citrine.reader.Datum.Keyword;
import dev.citrine.reader.Datum.LongValue;
import dev.citrine.reader.Datum.MapValue;
import dev.citrine.reader.Datum.Ratio;
import dev.citrine.reader.Datum.SetValue;
import dev.citrine.reader.Datum.Str;
import dev.citrine.reader.Datum.VectorValue;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReaderTest {

  @Test
  public void atoms() {
    assertThat(Reader.read("nil true false :k sym"))
        .containsExactly(
            Datum.NIL, new Bool(true), new Bool(false), new Keyword("k"), symbol("sym"))
        .inOrder();
  }

  @Test
  public void numbers() {
    assertThat(Reader.read("42 -7 42L 0x1F 0b101 10N 1.5 1e3 .5 -Infinity"))
        .containsExactly(
            new LongValue(42),
            new LongValue(-7),
            new LongValue(42),
            new LongValue(31),
            new LongValue(5),
            new BigIntValue(BigInteger.TEN),
            new DoubleValue(1.5),
            new DoubleValue(1000.0),
            new DoubleValue(0.5),
            new DoubleValue(Double.NEGATIVE_INFINITY))
        .inOrder();
    assertThat(Reader.read("NaN")).containsExactly(new DoubleValue(Double.NaN));
  }

  @Test
  public void integerOverflow() {
    assertThat(Reader.read("9223372036854775807 -9223372036854775808 9223372036854775808"))
        .containsExactly(
            new LongValue(Long.MAX_VALUE),
            new LongValue(Long.MIN_VALUE),
            new BigIntValue(new BigInteger("9223372036854775808")))
        .inOrder();
    assertThat(Reader.read("0xFFFFFFFFFFFFFFFF"))
        .containsExactly(new BigIntValue(new BigInteger("FFFFFFFFFFFFFFFF", 16)));
  }

  @Test
  public void ratios() {
    assertThat(Reader.read("1/2 2/4 -2/4 3/-6 4/2 0/5"))
        .containsExactly(
            new Ratio(BigInteger.ONE, BigInteger.TWO),
            new Ratio(BigInteger.ONE, BigInteger.TWO),
            new Ratio(BigInteger.ONE.negate(), BigInteger.TWO),
            new Ratio(BigInteger.ONE.negate(), BigInteger.TWO),
            new LongValue(2),
            new LongValue(0))
        .inOrder();
  }

  @Test
  public void zeroDenominator() {
    CitrineError e = assertThrows(CitrineError.class, () -> Reader.read("(/ 1/0)"));
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_LITERAL);
    assertThat(e.args()).containsExactly("1/0");
  }

  @Test
  public void strings() {
    assertThat(Reader.read("\"plain\" \"a\\nb\" \"q\\\"q\" \"\\u0041\\\\\" \"\\t\\r\\b\\f\""))
        .containsExactly(
            new Str("plain"), new Str("a\nb"), new Str("q\"q"), new Str("A\\"), new Str("\t\r\b\f"))
        .inOrder();
  }

  @Test
  public void invalidEscape() {
    CitrineError e = assertThrows(CitrineError.class, () -> Reader.read("(f \"ab\\q\")"));
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_ESCAPE);
    assertThat(e.diagnostics().get(0).position()).isEqualTo(6);
    assertThat(e.diagnostics().get(0).message()).isEqualTo("invalid escape sequence: \\q");
  }

  @Test
  public void shortUnicodeEscape() {
    CitrineError e = assertThrows(CitrineError.class, () -> Reader.read("\"\\u12\""));
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_ESCAPE);
  }

  @Test
  public void unicodeEscapeRequiresAsciiHexDigits() {
    String arabicIndicDigits = "\u0660\u0660\u0664\u0661";
    CitrineError e =
        assertThrows(
            CitrineError.class, () -> Reader.read("\"\\u" + arabicIndicDigits + "\""));
    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_ESCAPE);
    assertThat(e.args()).containsExactly("\\u");
    assertThat(e.diagnostics().get(0).position()).isEqualTo(1);
  }

  @Test
  public void characters() {
    assertThat(Reader.read("\\a \\newline \\space \\u0041 \\( \\\\"))
        .containsExactly(
            new Char('a'),
            new Char('\n'),
            new Char(' '),
            new Char('A'),
            new Char('('),
            new Char('\\'))
        .inOrder();
  }

  @Test
  public void collections() {
    assertThat(Reader.read("(1 [2] {:a 1} #{3})"))
        .containsExactly(
            list(
                new LongValue(1),
                new VectorValue(ImmutableList.of(new LongValue(2))),
                new MapValue(ImmutableMap.of(new Keyword("a"), new LongValue(1))),
                new SetValue(ImmutableSet.of(new LongValue(3)))));
  }

  @Test
  public void mapOrder() {
    MapValue map = (MapValue) Reader.read("{:b 2 :a 1 [1 2] nil}").get(0);
    assertThat(map.entries().keySet())
        .containsExactly(
            new Keyword("b"),
            new Keyword("a"),
            new VectorValue(ImmutableList.of(new LongValue(1), new LongValue(2))))
        .inOrder();
  }

  @Test
  public void readerMacros() {
    assertThat(Reader.read("'x `(a ,b ,@(c)) ^:m v"))
        .containsExactly(
            list(symbol("quote"), symbol("x")),
            list(
                symbol("quasiquote"),
                list(
                    symbol("a"),
                    list(symbol("unquote"), symbol("b")),
                    list(symbol("unquote-splicing"), list(symbol("c"))))),
            list(symbol("with-meta"), symbol("v"), new Keyword("m")))
        .inOrder();
  }

  @Test
  public void discard() {
    assertThat(Reader.read("(1 #_2 3) #_4 5 {:a #_:b 1}"))
        .containsExactly(
            list(new LongValue(1), new LongValue(3)),
            new LongValue(5),
            new MapValue(ImmutableMap.of(new Keyword("a"), new LongValue(1))))
        .inOrder();
  }

  @Test
  public void quotedDiscard() {
    CitrineError e = assertThrows(CitrineError.class, () -> Reader.read("'#_x"));
    assertThat(e.kind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
  }

  @Test
  public void oddMap() {
    CitrineError e = assertThrows(CitrineError.class, () -> Reader.read("[{:a 1 :b}]"));
    assertThat(e.kind()).isEqualTo(ErrorKind.ODD_MAP_ARITY);
    assertThat(e.diagnostics().get(0).position()).isEqualTo(1);
  }

  @Test
  public void duplicateKey() {
    CitrineError e = assertThrows(CitrineError.class, () -> Reader.read("{:a 1 :a 2}"));
    assertThat(e.kind()).isEqualTo(ErrorKind.DUPLICATE_KEY);
    assertThat(e.diagnostics().get(0).position()).isEqualTo(6);
    assertThat(e.diagnostics().get(0).message()).isEqualTo("duplicate key: :a");
  }

  @Test
  public void duplicateSetElement() {
    CitrineError e = assertThrows(CitrineError.class, () -> Reader.read("#{[1] [1]}"));
    assertThat(e.kind()).isEqualTo(ErrorKind.DUPLICATE_KEY);
    assertThat(e.diagnostics().get(0).message()).isEqualTo("duplicate key: [1]");
  }

  @Test
  public void syntaxErrorsAreRejected() {
    CitrineError e = assertThrows(CitrineError.class, () -> Reader.read("(1 2"));
    assertThat(e.kind()).isEqualTo(ErrorKind.MISSING_DELIMITER);
  }

  @Test
  public void empty() {
    assertThat(Reader.read("")).isEmpty();
    assertThat(Reader.read(" ; only a comment\n")).isEmpty();
  }

  @Test
  public void printedFormReadsBack() {
    String input = "(a [1 -2.5 1.0E10] {:k \"s\\\"\\n\"} #{\\space \\x} 1/3 10N nil true)";
    Datum datum = Reader.read(input).get(0);
    assertThat(datum.toString()).isEqualTo(input);
    assertThat(Reader.read(datum.toString())).containsExactly(datum);
  }
}
