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
package net.hydromatic.elmfmt;

import static net.hydromatic.elmfmt.Elm.conPat;
import static net.hydromatic.elmfmt.Elm.elm;
import static net.hydromatic.elmfmt.Elm.field;
import static net.hydromatic.elmfmt.Elm.i;
import static net.hydromatic.elmfmt.Elm.id;
import static net.hydromatic.elmfmt.Elm.idPat;
import static net.hydromatic.elmfmt.Elm.op;
import static net.hydromatic.elmfmt.Elm.tyVar;
import static net.hydromatic.elmfmt.Elm.type;
import static net.hydromatic.elmfmt.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.Pos;
import net.hydromatic.elmfmt.print.DocCommentFormatters;
import org.junit.jupiter.api.Test;

/** Tests for {@link ElmFormatter}. */
public class ElmFormatterTest {
  @Test
  void testDefaults() {
    final ElmFormatter formatter = ElmFormatter.DEFAULT;
    assertThat(formatter.lineWidth(), is(80));
    assertThat(formatter.get(Prop.LINE_WIDTH), is((Object) 80));
    assertThat(formatter.get(Prop.DOC_COMMENT_FORMAT),
        is((Object) DocCommentFormatters.STANDARD));
    assertThat(formatter.get(Prop.RECOVER_DOC_COMMENTS), is((Object) true));

    final ElmFormatter formatter2 =
        ElmFormatter.create(ImmutableMap.<Prop, Object>of(Prop.LINE_WIDTH, 40));
    assertThat(formatter2.lineWidth(), is(40));
    assertThat(formatter2.get(Prop.RECOVER_DOC_COMMENTS), is((Object) true));

    assertThrows(IllegalArgumentException.class,
        () -> ElmFormatter.create(
            ImmutableMap.<Prop, Object>of(Prop.LINE_WIDTH, 0)));
    assertThrows(IllegalArgumentException.class,
        () -> ElmFormatter.create(
            ImmutableMap.<Prop, Object>of(Prop.LINE_WIDTH, "80")));
  }

  /** Every node prints itself using the default formatter. */
  @Test
  void testToString() {
    assertThat(op("+", id("a"), i(1)), hasToString("a + 1"));
    assertThat(conPat("Just", idPat("x")), hasToString("Just x"));
    assertThat(type("Maybe", tyVar("a")), hasToString("Maybe a"));
    assertThat(ast.exposingAll(Pos.ZERO), hasToString("exposing (..)"));
  }

  /** Parts of expressions, declarations and modules can be formatted on
   * their own. */
  @Test
  void testParts() {
    elm(field("a", i(1))).assertFormat("a = 1");
    elm(ast.match(Pos.ZERO, conPat("Just", idPat("x")), id("x")))
        .assertFormat("Just x ->\n    x");
    elm(ast.letDestructuring(Pos.ZERO, idPat("y"), i(2)))
        .assertFormat("y =\n    2");
    elm(ast.fieldType(Pos.ZERO, "name", type("String")))
        .assertFormat("name : String");
    elm(ast.signature(Pos.ZERO, "main", type("Program", tyVar("flags"))))
        .assertFormat("main : Program flags");
    elm(ast.tyCon(Pos.ZERO, "Just", tyVar("a"))).assertFormat("Just a");
    elm(ast.docComment(Pos.ZERO, "Hello")).assertFormat("{-| Hello\n-}");
    elm(ast.comment(Pos.ZERO, "-- note")).assertFormat("-- note");
    elm(ast.functionExpose(Pos.ZERO, "main")).assertFormat("main");
    elm(ast.typeExpose(Pos.ZERO, "Maybe", true)).assertFormat("Maybe(..)");
    elm(ast.infixExpose(Pos.ZERO, "|>")).assertFormat("(|>)");
    elm(ast.function(Pos.ZERO, null, null,
        ast.funMatch(Pos.ZERO, "one", ImmutableList.of(), i(1))))
        .assertFormat("one =\n    1");
  }

  @Test
  void testDocCommentFormatter() {
    final Ast.FunDecl decl =
        ast.funDecl(Pos.ZERO,
            ast.function(Pos.ZERO, ast.docComment(Pos.ZERO, " shout "), null,
                ast.funMatch(Pos.ZERO, "x", ImmutableList.of(), i(1))));
    final ElmFormatter formatter =
        ElmFormatter.DEFAULT.withDocCommentFormatter((body, width) ->
            "{-|" + body.toUpperCase(Locale.ROOT) + width + " -}");
    assertThat(formatter.format(decl), is("{-| SHOUT 80 -}\nx =\n    1"));
    assertThat(formatter.lineWidth(), is(80));

    assertThat(DocCommentFormatters.body("{-| a -}"), is(" a "));
    assertThat(DocCommentFormatters.body("plain"), is("plain"));
  }

  /** Formats an expression nested too deeply for a recursive printer. */
  @Test
  void testLongChain() {
    Ast.Exp exp = id("x0");
    for (int i = 1; i < 2_000; i++) {
      exp = op("+", exp, id("x" + i));
    }
    final String s = ElmFormatter.DEFAULT.format(exp);
    assertThat(s.startsWith("x0\n    + x1\n    + x2\n"), is(true));
    assertThat(s.split("\n").length, is(2_000));
  }
}

// End ElmFormatterTest.java
