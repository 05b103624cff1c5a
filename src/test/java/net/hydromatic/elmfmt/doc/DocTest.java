/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.elmfmt.doc;

import static net.hydromatic.elmfmt.doc.Doc.empty;
import static net.hydromatic.elmfmt.doc.Doc.hang;
import static net.hydromatic.elmfmt.doc.Doc.indent;
import static net.hydromatic.elmfmt.doc.Doc.line;
import static net.hydromatic.elmfmt.doc.Doc.lines;
import static net.hydromatic.elmfmt.doc.Doc.separators;
import static net.hydromatic.elmfmt.doc.Doc.text;
import static net.hydromatic.elmfmt.doc.Doc.tightline;
import static net.hydromatic.elmfmt.doc.Doc.words;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests for {@link Doc}. */
public class DocTest {
  @Test
  void testGroup() {
    final Doc doc = text("a").append(line()).append("b").group();
    assertThat(doc.render(10), is("a b"));
    assertThat(doc.render(2), is("a\nb"));

    // Outside a group, a line always breaks.
    final Doc doc2 = text("a").append(line()).append("b");
    assertThat(doc2.render(80), is("a\nb"));
  }

  @Test
  void testAlign() {
    final Doc doc = text("ab ").append(lines(text("c"), text("d")).align());
    assertThat(doc.render(80), is("ab c\n   d"));
  }

  @Test
  void testNest() {
    final Doc doc =
        text("f").append(line().append("x").append(line()).append("y")
            .nest(4));
    assertThat(doc.render(80), is("f\n    x\n    y"));

    final Doc doc2 = indent(2, text("a").append(line()).append("b"));
    assertThat(doc2.render(80), is("  a\n  b"));
  }

  /** Lines after the first hang at the first line's column plus the
   * indent. */
  @Test
  void testHang() {
    final Doc doc =
        text("x = ").append(hang(2, lines(text("f"), text("a"), text("b"))));
    assertThat(doc.render(80), is("x = f\n      a\n      b"));
    assertThat(doc.group().render(80), is("x = f a b"));
  }

  /** A blank line carries no indentation, and trailing spaces are
   * trimmed. */
  @Test
  void testBlankLine() {
    final Doc doc =
        text("a").append(line().append(tightline()).append("b").nest(4));
    assertThat(doc.render(80), is("a\n\n    b"));

    final Doc doc2 = text("a ").append(line()).append("b");
    assertThat(doc2.render(80), is("a\nb"));
  }

  /** A group fits only if the text that follows it, up to the next line
   * break, fits too. */
  @Test
  void testFitsRest() {
    final Doc doc =
        text("aaa")
            .append(text("b").append(line()).append("c").group())
            .append("dddd");
    assertThat(doc.render(10), is("aaab cdddd"));
    assertThat(doc.render(9), is("aaab\ncdddd"));
    assertThat(doc.render(8), is("aaab\ncdddd"));
  }

  @Test
  void testSeparators() {
    final ImmutableList<Doc> docs =
        ImmutableList.of(text("a"), text("b"), text("c"));
    final Doc doc = text("[ ").append(separators(", ", docs))
        .append(line()).append("]").align().group();
    assertThat(doc.render(80), is("[ a, b, c ]"));
    assertThat(doc.render(5), is("[ a\n, b\n, c\n]"));
  }

  @Test
  void testJoinSkipsEmpty() {
    assertThat(words(text("a"), empty(), text("b")).render(80), is("a b"));
    assertThat(lines(empty(), empty()).isEmpty(), is(true));
    assertThat(text("").isEmpty(), is(true));
    assertThat(empty().append(text("x")).render(80), is("x"));
    final Doc x = text("x");
    assertThat(x.append(empty()), sameInstance(x));
    assertThat(x.group().group().render(80), is("x"));
  }

  /** Text that contains newlines is emitted verbatim; its continuation
   * lines are not indented. */
  @Test
  void testBlock() {
    final Doc doc = lines(text("{-| a\n  b\n-}"), text("f")).nest(4);
    assertThat(doc.render(80), is("{-| a\n  b\n-}\n    f"));

    // Only the first line of a block counts towards the width.
    final Doc doc2 =
        text("x").append(line()).append("ab\ncdefghijk").group();
    assertThat(doc2.render(5), is("x ab\ncdefghijk"));
  }

  /** Renders a document too deep for a recursive renderer. */
  @Test
  void testDeep() {
    Doc doc = empty();
    Doc doc2 = empty();
    for (int i = 0; i < 100_000; i++) {
      doc = text("x").append(doc);
      doc2 = doc2.append("y");
    }
    assertThat(doc.render(80).length(), is(100_000));
    assertThat(doc2.render(80).length(), is(100_000));
  }
}

// End DocTest.java
