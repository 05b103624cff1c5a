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
package net.hydromatic.elmfmt.print;

import static net.hydromatic.elmfmt.Elm.conPat;
import static net.hydromatic.elmfmt.Elm.elm;
import static net.hydromatic.elmfmt.Elm.idPat;
import static net.hydromatic.elmfmt.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.Op;
import net.hydromatic.elmfmt.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link PatPrinter}. */
public class PatPrinterTest {
  @Test
  void testAtoms() {
    elm(ast.wildcardPat(Pos.ZERO)).assertFormat("_");
    elm(ast.unitPat(Pos.ZERO)).assertFormat("()");
    elm(idPat("x")).assertFormat("x");
    elm(ast.intLiteralPat(Pos.ZERO, -3)).assertFormat("-3");
    elm(ast.stringLiteralPat(Pos.ZERO, "a")).assertFormat("\"a\"");
    elm(ast.charLiteralPat(Pos.ZERO, 'c')).assertFormat("'c'");
    elm(conPat("Nothing")).assertFormat("Nothing");
  }

  @Test
  void testContainers() {
    elm(ast.tuplePat(Pos.ZERO, idPat("a"), idPat("b")))
        .assertFormat("( a, b )");
    elm(ast.recordPat(Pos.ZERO, ImmutableList.of("x", "y")))
        .assertFormat("{ x, y }");
    elm(ast.recordPat(Pos.ZERO, ImmutableList.of())).assertFormat("{}");
    elm(ast.listPat(Pos.ZERO)).assertFormat("[]");
    elm(ast.listPat(Pos.ZERO, idPat("x"), conPat("Just", idPat("y"))))
        .assertFormat("[ x, Just y ]");
  }

  /** Patterns stay on one line even if they are wider than the page. */
  @Test
  void testContainersNarrow() {
    final Ast.Pat tuple =
        ast.tuplePat(Pos.ZERO, idPat("aaaaaaaa"), idPat("bbbbbbbb"),
            idPat("cccccccc"));
    elm(tuple).withWidth(10)
        .assertFormat("( aaaaaaaa, bbbbbbbb, cccccccc )");
    elm(ast.listPat(Pos.ZERO, idPat("aaaaaaaa"), idPat("bbbbbbbb")))
        .withWidth(10)
        .assertFormat("[ aaaaaaaa, bbbbbbbb ]");
    elm(ast.recordPat(Pos.ZERO, ImmutableList.of("aaaaaaaa", "bbbbbbbb")))
        .withWidth(10)
        .assertFormat("{ aaaaaaaa, bbbbbbbb }");
  }

  /** Constructor arguments are parenthesized only if they are compound. */
  @Test
  void testConstructor() {
    elm(conPat("Just", conPat("Just", idPat("x"))))
        .assertFormat("Just (Just x)");
    elm(conPat("Just", conPat("Nothing"))).assertFormat("Just Nothing");
    elm(conPat("Pair", idPat("a"), ast.tuplePat(Pos.ZERO, idPat("b"),
        idPat("c"))))
        .assertFormat("Pair a ( b, c )");
    elm(ast.conPat(Pos.ZERO, ast.moduleName("Maybe"), "Just",
        ImmutableList.of(ast.wildcardPat(Pos.ZERO))))
        .assertFormat("Maybe.Just _");
  }

  @Test
  void testAs() {
    final Ast.AsPat asPat =
        ast.asPat(Pos.ZERO, ast.tuplePat(Pos.ZERO, idPat("a"), idPat("b")),
            "p");
    elm(asPat).assertFormat("( a, b ) as p");
    elm(conPat("Just", asPat)).assertFormat("Just (( a, b ) as p)");
    elm(ast.asPat(Pos.ZERO, conPat("Just", idPat("x")), "m"))
        .assertFormat("(Just x) as m");
  }

  @Test
  void testCons() {
    elm(ast.consPat(Pos.ZERO, idPat("x"),
        ast.consPat(Pos.ZERO, idPat("y"), idPat("xs"))))
        .assertFormat("x :: y :: xs");
    // Parentheses on the right spine are redundant.
    elm(ast.consPat(Pos.ZERO, idPat("x"),
        ast.parensPat(Pos.ZERO,
            ast.consPat(Pos.ZERO, idPat("y"), idPat("xs")))))
        .assertFormat("x :: y :: xs");
    elm(ast.consPat(Pos.ZERO,
        ast.consPat(Pos.ZERO, idPat("x"), idPat("y")), idPat("z")))
        .assertFormat("(x :: y) :: z");
  }

  /** Redundant parentheses are removed, and nested parentheses collapse to
   * one level. */
  @Test
  void testParens() {
    final Ast.Pat just = conPat("Just", idPat("x"));
    final Ast.Pat pat =
        ast.parensPat(Pos.ZERO, ast.parensPat(Pos.ZERO, just));
    elm(pat).assertFormat("Just x");
    elm(conPat("Just", pat)).assertFormat("Just (Just x)");
    elm(conPat("Just", ast.parensPat(Pos.ZERO, idPat("x"))))
        .assertFormat("Just x");

    final Ast.Pat top = PatPrinter.adjust(pat, true);
    assertThat(top, sameInstance(just));
    assertThat(PatPrinter.adjust(top, true), sameInstance(top));

    final Ast.Pat nested = PatPrinter.adjust(pat, false);
    assertThat(nested.op, is(Op.PARENS_PAT));
    assertThat(((Ast.ParensPat) nested).pat, sameInstance(just));
    assertThat(PatPrinter.adjust(nested, false), sameInstance(nested));
  }
}

// End PatPrinterTest.java
