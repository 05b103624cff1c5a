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

import static net.hydromatic.elmfmt.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.AstNode;
import net.hydromatic.elmfmt.ast.Pos;
import net.hydromatic.elmfmt.print.Context;
import net.hydromatic.elmfmt.print.ExpPrinter;
import org.hamcrest.Matcher;

/**
 * Fluent test helper.
 *
 * <p>Also contains shorthands for building trees; every node has position
 * {@link Pos#ZERO}.
 */
public class Elm {
  private final AstNode node;
  private final Map<Prop, Object> propMap;

  private Elm(AstNode node, Map<Prop, Object> propMap) {
    this.node = node;
    this.propMap = ImmutableMap.copyOf(propMap);
  }

  /** Creates an {@code Elm}. */
  public static Elm elm(AstNode node) {
    return new Elm(node, ImmutableMap.of());
  }

  /** Returns a copy of this fixture with a property set. */
  public Elm withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    map.putAll(propMap);
    prop.set(map, value);
    return new Elm(node, map);
  }

  /** Returns a copy of this fixture with a given line width. */
  public Elm withWidth(int width) {
    return withProp(Prop.LINE_WIDTH, width);
  }

  public ElmFormatter formatter() {
    return ElmFormatter.create(propMap);
  }

  public Elm assertFormat(String expected) {
    return assertFormat(is(expected));
  }

  public Elm assertFormat(Matcher<String> matcher) {
    final String s = formatter().format(node);
    assertThat(s, matcher);
    return this;
  }

  /** Asserts that normalizing parentheses twice in a given context yields
   * the same tree as normalizing once. */
  public Elm assertAdjustIdempotent(Context context) {
    final Ast.Exp exp = (Ast.Exp) node;
    final Ast.Exp exp2 = ExpPrinter.adjust(context, exp);
    final Ast.Exp exp3 = ExpPrinter.adjust(context, exp2);
    assertThat(exp3, sameInstance(exp2));
    return this;
  }

  //~ Shorthands for building trees -------------------------------------------

  /** Creates a reference; "List.map" becomes a qualified reference. */
  public static Ast.Id id(String name) {
    final int i = name.lastIndexOf('.');
    if (i < 0) {
      return ast.id(Pos.ZERO, name);
    }
    return ast.id(Pos.ZERO, ast.moduleName(name.substring(0, i)),
        name.substring(i + 1));
  }

  public static Ast.Literal i(long value) {
    return ast.intLiteral(Pos.ZERO, value);
  }

  public static Ast.Literal s(String value) {
    return ast.stringLiteral(Pos.ZERO, value);
  }

  public static Ast.Apply apply(Ast.Exp fn, Ast.Exp... args) {
    return ast.apply(Pos.ZERO, fn, args);
  }

  public static Ast.InfixCall op(String symbol, Ast.Exp left, Ast.Exp right) {
    return ast.infixCall(Pos.ZERO, symbol, left, right);
  }

  public static Ast.Parens parens(Ast.Exp exp) {
    return ast.parens(Pos.ZERO, exp);
  }

  public static Ast.If ifThenElse(Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return ast.ifThenElse(Pos.ZERO, condition, ifTrue, ifFalse);
  }

  public static Ast.Fn fn(Ast.Pat pat, Ast.Exp exp) {
    return ast.fn(Pos.ZERO, ImmutableList.of(pat), exp);
  }

  public static Ast.Field field(String name, Ast.Exp exp) {
    return ast.field(Pos.ZERO, name, exp);
  }

  public static Ast.IdPat idPat(String name) {
    return ast.idPat(Pos.ZERO, name);
  }

  public static Ast.ConPat conPat(String name, Ast.Pat... args) {
    return ast.conPat(Pos.ZERO, name, args);
  }

  public static Ast.NamedType type(String name, Ast.Type... args) {
    return ast.namedType(Pos.ZERO, name, args);
  }

  public static Ast.TyVar tyVar(String name) {
    return ast.tyVar(Pos.ZERO, name);
  }

  /** Creates a function declaration with no documentation or signature. */
  public static Ast.FunDecl funDecl(String name, Ast.Exp exp) {
    return ast.funDecl(Pos.ZERO,
        ast.function(Pos.ZERO, null, null,
            ast.funMatch(Pos.ZERO, name, ImmutableList.of(), exp)));
  }

  /** Creates an exposing list of values, e.g. {@code exposing("main")}. */
  public static Ast.ExposingList exposing(String... names) {
    final ImmutableList.Builder<Ast.Expose> b = ImmutableList.builder();
    for (String name : names) {
      b.add(ast.functionExpose(Pos.ZERO, name));
    }
    return ast.exposingList(Pos.ZERO, b.build());
  }
}

// End Elm.java
