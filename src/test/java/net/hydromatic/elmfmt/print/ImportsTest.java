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

import static net.hydromatic.elmfmt.Elm.elm;
import static net.hydromatic.elmfmt.Elm.exposing;
import static net.hydromatic.elmfmt.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Imports}. */
public class ImportsTest {
  private static Ast.Import importOf(String moduleName,
      @Nullable String alias, Ast.@Nullable Exposing exposing) {
    return importOf(Pos.ZERO, moduleName, alias, exposing);
  }

  private static Ast.Import importOf(Pos pos, String moduleName,
      @Nullable String alias, Ast.@Nullable Exposing exposing) {
    return ast.importOf(pos, ast.moduleName(moduleName),
        alias == null ? null : ast.moduleName(alias), exposing);
  }

  private static String print(List<Ast.Import> imports) {
    final List<String> lines = new ArrayList<>();
    for (Ast.Import anImport : imports) {
      lines.add(ModulePrinter.printImport(anImport).render(80));
    }
    return String.join("\n", lines);
  }

  @Test
  void testModuleNameOrdering() {
    assertThat(
        Imports.MODULE_NAME_ORDERING.compare(ast.moduleName("A.B"),
            ast.moduleName("AB")) < 0,
        is(true));
    assertThat(
        Imports.MODULE_NAME_ORDERING.compare(ast.moduleName("Html"),
            ast.moduleName("Html.Attributes")) < 0,
        is(true));
    assertThat(
        Imports.MODULE_NAME_ORDERING.compare(ast.moduleName("Html.Events"),
            ast.moduleName("Html.Attributes")) > 0,
        is(true));
  }

  /** Imports are sorted by module name, and imports of the same module are
   * merged. */
  @Test
  void testNormalize() {
    final List<Ast.Import> imports =
        ImmutableList.of(importOf("Html", null, null),
            importOf("B", null, exposing("z")),
            importOf("Array", null, null),
            importOf("Html.Attributes", "A", ast.exposingAll(Pos.ZERO)),
            importOf("A", null, exposing("Y")),
            importOf("Array", null, exposing("map")),
            importOf("A", null, exposing("X", "Y")));
    assertThat(print(Imports.normalize(imports)),
        is("import A exposing (X, Y)\n"
            + "import Array exposing (map)\n"
            + "import B exposing (z)\n"
            + "import Html\n"
            + "import Html.Attributes as A exposing (..)"));
    assertThat(Imports.normalize(ImmutableList.of()).isEmpty(), is(true));
  }

  @Test
  void testMerge() {
    // An alias on either import is kept.
    final Ast.Import merged =
        Imports.merge(importOf("Json.Decode", null, null),
            importOf("Json.Decode", "D", exposing("int")));
    assertThat(print(ImmutableList.of(merged)),
        is("import Json.Decode as D exposing (int)"));

    // "exposing (..)" wins over a list.
    final Ast.Import merged2 =
        Imports.merge(importOf("Dict", null, exposing("Dict")),
            importOf("Dict", null, ast.exposingAll(Pos.ZERO)));
    assertThat(print(ImmutableList.of(merged2)),
        is("import Dict exposing (..)"));

    // The merged import spans both positions.
    final Ast.Import merged3 =
        Imports.merge(importOf(Pos.lines(3, 3), "Set", null, null),
            importOf(Pos.lines(7, 7), "Set", null, null));
    assertThat(merged3.pos.startLine, is(3));
    assertThat(merged3.pos.endLine, is(7));
  }

  @Test
  void testConflictingAliases() {
    final List<Ast.Import> imports =
        ImmutableList.of(importOf("Json.Decode", "D", null),
            importOf(Pos.lines(4, 4), "Json.Decode", "Decode", null));
    final FormatException e =
        assertThrows(FormatException.class,
            () -> Imports.normalize(imports));
    assertThat(e.getMessage(),
        is("module Json.Decode is imported with different aliases, "
            + "D and Decode"));
    assertThat(e.pos(), is(Pos.lines(4, 4)));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("4.1-4.1 Error: module Json.Decode is imported with different "
            + "aliases, D and Decode"));
  }

  /** Exposed items are sorted, operators first, and duplicates are
   * removed; a type exposed with its constructors absorbs the same type
   * exposed without them. */
  @Test
  void testNormalizeExposing() {
    final Ast.ExposingList exposing =
        ast.exposingList(Pos.ZERO,
            ast.functionExpose(Pos.ZERO, "view"),
            ast.functionExpose(Pos.ZERO, "main"),
            ast.typeExpose(Pos.ZERO, "Model", false),
            ast.typeExpose(Pos.ZERO, "Model", true),
            ast.infixExpose(Pos.ZERO, "+"),
            ast.functionExpose(Pos.ZERO, "main"),
            ast.typeExpose(Pos.ZERO, "Msg", false));
    elm(Imports.normalize(exposing))
        .assertFormat("exposing ((+), Model(..), Msg, main, view)");

    final Ast.Exposing normalized = Imports.normalize(exposing);
    assertThat(Imports.normalize(normalized), sameInstance(normalized));
    final Ast.Exposing all = ast.exposingAll(Pos.ZERO);
    assertThat(Imports.normalize(all), sameInstance(all));

    assertThrows(IllegalArgumentException.class,
        () -> ast.infixExpose(Pos.ZERO, "(+)"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.exposingList(Pos.ZERO, ImmutableList.of()));
  }
}

// End ImportsTest.java
