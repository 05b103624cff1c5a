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
package net.hydromatic.elmfmt.ast;

import static net.hydromatic.elmfmt.Elm.i;
import static net.hydromatic.elmfmt.Elm.id;
import static net.hydromatic.elmfmt.Elm.idPat;
import static net.hydromatic.elmfmt.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests for {@link AstBuilder}, {@link Pos} and {@link InfixOp}. */
public class AstBuilderTest {
  @Test
  void testModuleName() {
    assertThat(ast.moduleName("Html.Attributes"),
        is(ImmutableList.of("Html", "Attributes")));
    assertThat(ast.id(Pos.ZERO, ast.moduleName("List"), "map")
        .qualifiedName(), is("List.map"));
    assertThrows(IllegalArgumentException.class, () -> ast.moduleName(""));
  }

  /** Trees that cannot be printed as valid Elm are rejected when they are
   * built. */
  @Test
  void testInvalidTrees() {
    assertThrows(IllegalArgumentException.class,
        () -> ast.tuple(Pos.ZERO, id("a")));
    assertThrows(IllegalArgumentException.class,
        () -> ast.tuplePat(Pos.ZERO, idPat("a")));
    assertThrows(IllegalArgumentException.class,
        () -> ast.floatLiteral(Pos.ZERO, Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> ast.floatLiteral(Pos.ZERO, Double.POSITIVE_INFINITY));
    assertThrows(IllegalArgumentException.class,
        () -> ast.charLiteral(Pos.ZERO, -1));
    assertThrows(IllegalArgumentException.class,
        () -> ast.recordSelector(Pos.ZERO, ".name"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.apply(Pos.ZERO, id("f"), ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () -> ast.fn(Pos.ZERO, ImmutableList.of(), i(1)));
    assertThrows(IllegalArgumentException.class,
        () -> ast.caseOf(Pos.ZERO, id("x"), ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () -> ast.let(Pos.ZERO, ImmutableList.of(), i(1)));
    assertThrows(IllegalArgumentException.class,
        () -> ast.recordUpdate(Pos.ZERO, "r", ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () -> ast.infixCall(Pos.ZERO, "", id("a"), id("b")));
  }

  @Test
  void testLiterals() {
    final Ast.Literal negative = i(-1);
    assertThat(negative.isNegative(), is(true));
    assertThat(i(0).isNegative(), is(false));
    assertThat(ast.floatLiteral(Pos.ZERO, -0.5).isNegative(), is(true));
    assertThat(ast.stringLiteral(Pos.ZERO, "-1").isNegative(), is(false));
  }

  @Test
  void testInfixOp() {
    assertThat(InfixOp.precedence("*"), is(7));
    assertThat(InfixOp.direction("++"), is(InfixDirection.RIGHT));
    assertThat(InfixOp.direction("=="), is(InfixDirection.NON));
    // Unknown operators bind loosest, and associate to the left.
    assertThat(InfixOp.precedence("<+>"), is(0));
    assertThat(InfixOp.direction("<+>"), is(InfixDirection.LEFT));
    final Ast.InfixCall call = ast.infixCall(Pos.ZERO, "|>", id("a"), id("b"));
    assertThat(call.direction, is(InfixDirection.LEFT));
    assertThat(call.precedence(), is(0));
    assertThat(InfixDirection.NON.keyword(), is("non"));
  }

  @Test
  void testPos() {
    final Pos pos = Pos.lines(3, 5);
    assertThat(pos, hasToString("3.1-5.1"));
    assertThat(new Pos("Main.elm", 2, 4, 2, 5), hasToString("Main.elm:2.4"));
    assertThat(Pos.ZERO.isZero(), is(true));
    assertThat(pos.isZero(), is(false));
    assertThat(pos.plus(Pos.ZERO), is(pos));
    assertThat(Pos.ZERO.plus(pos), is(pos));
    final Pos sum = Pos.lines(7, 8).plus(pos);
    assertThat(sum.startLine, is(3));
    assertThat(sum.endLine, is(8));
  }
}

// End AstBuilderTest.java
