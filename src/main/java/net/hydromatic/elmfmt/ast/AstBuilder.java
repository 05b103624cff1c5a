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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Splits a dotted module name, e.g. "Html.Attributes", into segments. */
  public ImmutableList<String> moduleName(String dotted) {
    checkArgument(!dotted.isEmpty(), "module name must not be empty");
    return ImmutableList.copyOf(dotted.split("\\."));
  }

  //~ Expressions -------------------------------------------------------------

  /** Creates the unit value, "()". */
  public Ast.Unit unit(Pos pos) {
    return new Ast.Unit(pos);
  }

  /** Creates an unqualified reference to a value. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, ImmutableList.of(), name);
  }

  /** Creates a reference to a value, qualified by a module name. */
  public Ast.Id id(Pos pos, List<String> moduleName, String name) {
    return new Ast.Id(pos, ImmutableList.copyOf(moduleName), name);
  }

  public Ast.PrefixOperator prefixOperator(Pos pos, String symbol) {
    return new Ast.PrefixOperator(pos, symbol);
  }

  public Ast.Operator operator(Pos pos, String symbol) {
    return new Ast.Operator(pos, symbol);
  }

  /** Creates an {@code Int} literal. */
  public Ast.Literal intLiteral(Pos pos, long value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  /** Creates an {@code Int} literal written in hexadecimal. */
  public Ast.Literal hexLiteral(Pos pos, long value) {
    return new Ast.Literal(pos, Op.HEX_LITERAL, value);
  }

  /** Creates a {@code Float} literal. */
  public Ast.Literal floatLiteral(Pos pos, double value) {
    checkArgument(!Double.isNaN(value) && !Double.isInfinite(value),
        "float literal must be finite");
    return new Ast.Literal(pos, Op.FLOAT_LITERAL, value);
  }

  /** Creates a {@code String} literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a {@code Char} literal from a code point. */
  public Ast.Literal charLiteral(Pos pos, int codePoint) {
    checkArgument(Character.isValidCodePoint(codePoint),
        "invalid code point %s", codePoint);
    return new Ast.Literal(pos, Op.CHAR_LITERAL, codePoint);
  }

  public Ast.Glsl glsl(Pos pos, String source) {
    return new Ast.Glsl(pos, source);
  }

  /** Creates a function application. */
  public Ast.Apply apply(Pos pos, Ast.Exp fn, List<? extends Ast.Exp> args) {
    return new Ast.Apply(pos, fn, ImmutableList.copyOf(args));
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn, Ast.Exp... args) {
    return apply(pos, fn, ImmutableList.copyOf(args));
  }

  /**
   * Creates a call to an infix operator, taking its associativity from the
   * table of known operators.
   */
  public Ast.InfixCall infixCall(Pos pos, String symbol, Ast.Exp left,
      Ast.Exp right) {
    return infixCall(pos, symbol, InfixOp.direction(symbol), left, right);
  }

  /** Creates a call to an infix operator with a given associativity. */
  public Ast.InfixCall infixCall(Pos pos, String symbol,
      InfixDirection direction, Ast.Exp left, Ast.Exp right) {
    checkArgument(!symbol.isEmpty(), "operator must not be empty");
    return new Ast.InfixCall(pos, symbol, direction, left, right);
  }

  public Ast.Negate negate(Pos pos, Ast.Exp exp) {
    return new Ast.Negate(pos, exp);
  }

  public Ast.If ifThenElse(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  /** Creates a tuple. A tuple of zero elements is printed as unit. */
  public Ast.Tuple tuple(Pos pos, List<? extends Ast.Exp> args) {
    checkArgument(args.size() != 1, "tuple must not have one element");
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.Tuple tuple(Pos pos, Ast.Exp... args) {
    return tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.ListExp list(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args));
  }

  public Ast.ListExp list(Pos pos, Ast.Exp... args) {
    return list(pos, ImmutableList.copyOf(args));
  }

  public Ast.Parens parens(Pos pos, Ast.Exp exp) {
    return new Ast.Parens(pos, exp);
  }

  /** Wraps an expression in parentheses, using the expression's position. */
  public Ast.Parens parens(Ast.Exp exp) {
    return new Ast.Parens(exp.pos, exp);
  }

  public Ast.Field field(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Field(pos, name, exp);
  }

  public Ast.Record record(Pos pos, List<Ast.Field> fields) {
    return new Ast.Record(pos, ImmutableList.copyOf(fields));
  }

  public Ast.Record record(Pos pos, Ast.Field... fields) {
    return record(pos, ImmutableList.copyOf(fields));
  }

  public Ast.RecordUpdate recordUpdate(Pos pos, String record,
      List<Ast.Field> fields) {
    return new Ast.RecordUpdate(pos, record, ImmutableList.copyOf(fields));
  }

  public Ast.RecordUpdate recordUpdate(Pos pos, String record,
      Ast.Field... fields) {
    return recordUpdate(pos, record, ImmutableList.copyOf(fields));
  }

  public Ast.RecordAccess recordAccess(Pos pos, Ast.Exp exp, String field) {
    return new Ast.RecordAccess(pos, exp, field);
  }

  public Ast.RecordSelector recordSelector(Pos pos, String name) {
    return new Ast.RecordSelector(pos, name);
  }

  /** Creates a lambda, e.g. "\x -> x + 1". */
  public Ast.Fn fn(Pos pos, List<? extends Ast.Pat> args, Ast.Exp exp) {
    return new Ast.Fn(pos, ImmutableList.copyOf(args), exp);
  }

  public Ast.Match match(Pos pos, Ast.Pat pat, Ast.Exp exp) {
    return new Ast.Match(pos, pat, exp);
  }

  public Ast.Case caseOf(Pos pos, Ast.Exp exp, List<Ast.Match> matchList) {
    return new Ast.Case(pos, exp, ImmutableList.copyOf(matchList));
  }

  public Ast.Case caseOf(Pos pos, Ast.Exp exp, Ast.Match... matches) {
    return caseOf(pos, exp, ImmutableList.copyOf(matches));
  }

  public Ast.LetFunction letFunction(Pos pos, Ast.Function function) {
    return new Ast.LetFunction(pos, function);
  }

  public Ast.LetDestructuring letDestructuring(Pos pos, Ast.Pat pat,
      Ast.Exp exp) {
    return new Ast.LetDestructuring(pos, pat, exp);
  }

  public Ast.Let let(Pos pos, List<? extends Ast.LetBinding> bindings,
      Ast.Exp exp) {
    return new Ast.Let(pos, ImmutableList.copyOf(bindings), exp);
  }

  //~ Patterns ----------------------------------------------------------------

  public Ast.WildcardPat wildcardPat(Pos pos) {
    return new Ast.WildcardPat(pos);
  }

  public Ast.UnitPat unitPat(Pos pos) {
    return new Ast.UnitPat(pos);
  }

  public Ast.LiteralPat intLiteralPat(Pos pos, long value) {
    return new Ast.LiteralPat(pos, Op.INT_LITERAL_PAT, value);
  }

  public Ast.LiteralPat hexLiteralPat(Pos pos, long value) {
    return new Ast.LiteralPat(pos, Op.HEX_LITERAL_PAT, value);
  }

  public Ast.LiteralPat floatLiteralPat(Pos pos, double value) {
    return new Ast.LiteralPat(pos, Op.FLOAT_LITERAL_PAT, value);
  }

  public Ast.LiteralPat stringLiteralPat(Pos pos, String value) {
    return new Ast.LiteralPat(pos, Op.STRING_LITERAL_PAT, value);
  }

  public Ast.LiteralPat charLiteralPat(Pos pos, int codePoint) {
    checkArgument(Character.isValidCodePoint(codePoint),
        "invalid code point %s", codePoint);
    return new Ast.LiteralPat(pos, Op.CHAR_LITERAL_PAT, codePoint);
  }

  public Ast.IdPat idPat(Pos pos, String name) {
    return new Ast.IdPat(pos, name);
  }

  public Ast.TuplePat tuplePat(Pos pos, List<? extends Ast.Pat> args) {
    checkArgument(args.size() != 1, "tuple must not have one element");
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  public Ast.TuplePat tuplePat(Pos pos, Ast.Pat... args) {
    return tuplePat(pos, ImmutableList.copyOf(args));
  }

  public Ast.RecordPat recordPat(Pos pos, List<String> fields) {
    return new Ast.RecordPat(pos, ImmutableList.copyOf(fields));
  }

  public Ast.ListPat listPat(Pos pos, List<? extends Ast.Pat> args) {
    return new Ast.ListPat(pos, ImmutableList.copyOf(args));
  }

  public Ast.ListPat listPat(Pos pos, Ast.Pat... args) {
    return listPat(pos, ImmutableList.copyOf(args));
  }

  public Ast.ConsPat consPat(Pos pos, Ast.Pat head, Ast.Pat tail) {
    return new Ast.ConsPat(pos, head, tail);
  }

  /** Creates an unqualified constructor pattern, e.g. "Just x". */
  public Ast.ConPat conPat(Pos pos, String name, Ast.Pat... args) {
    return conPat(pos, ImmutableList.of(), name, ImmutableList.copyOf(args));
  }

  public Ast.ConPat conPat(Pos pos, List<String> moduleName, String name,
      List<? extends Ast.Pat> args) {
    return new Ast.ConPat(pos, ImmutableList.copyOf(moduleName), name,
        ImmutableList.copyOf(args));
  }

  public Ast.AsPat asPat(Pos pos, Ast.Pat pat, String name) {
    return new Ast.AsPat(pos, pat, name);
  }

  public Ast.ParensPat parensPat(Pos pos, Ast.Pat pat) {
    return new Ast.ParensPat(pos, pat);
  }

  //~ Types -------------------------------------------------------------------

  public Ast.TyVar tyVar(Pos pos, String name) {
    return new Ast.TyVar(pos, name);
  }

  /** Creates an unqualified named type, e.g. "Maybe a". */
  public Ast.NamedType namedType(Pos pos, String name, Ast.Type... args) {
    return namedType(pos, ImmutableList.of(), name,
        ImmutableList.copyOf(args));
  }

  public Ast.NamedType namedType(Pos pos, List<String> moduleName,
      String name, List<? extends Ast.Type> args) {
    return new Ast.NamedType(pos, ImmutableList.copyOf(moduleName), name,
        ImmutableList.copyOf(args));
  }

  public Ast.UnitType unitType(Pos pos) {
    return new Ast.UnitType(pos);
  }

  public Ast.TupleType tupleType(Pos pos, List<? extends Ast.Type> types) {
    checkArgument(types.size() >= 2, "tuple type must have 2 or more types");
    return new Ast.TupleType(pos, ImmutableList.copyOf(types));
  }

  public Ast.TupleType tupleType(Pos pos, Ast.Type... types) {
    return tupleType(pos, ImmutableList.copyOf(types));
  }

  public Ast.FieldType fieldType(Pos pos, String name, Ast.Type type) {
    return new Ast.FieldType(pos, name, type);
  }

  public Ast.RecordType recordType(Pos pos, List<Ast.FieldType> fields) {
    return new Ast.RecordType(pos, ImmutableList.copyOf(fields));
  }

  public Ast.RecordType recordType(Pos pos, Ast.FieldType... fields) {
    return recordType(pos, ImmutableList.copyOf(fields));
  }

  public Ast.ExtensibleRecordType extensibleRecordType(Pos pos, String tyVar,
      List<Ast.FieldType> fields) {
    return new Ast.ExtensibleRecordType(pos, tyVar,
        ImmutableList.copyOf(fields));
  }

  public Ast.FunctionType functionType(Pos pos, Ast.Type paramType,
      Ast.Type resultType) {
    return new Ast.FunctionType(pos, paramType, resultType);
  }

  /**
   * Creates a function type from a list of two or more types, associating to
   * the right; for example, {@code [a, b, c]} becomes "a -> b -> c".
   */
  public Ast.FunctionType functionType(Pos pos,
      List<? extends Ast.Type> types) {
    checkArgument(types.size() >= 2, "function type must have 2 or more types");
    Ast.Type type = types.get(types.size() - 1);
    for (int i = types.size() - 2; i >= 0; i--) {
      type = functionType(pos, types.get(i), type);
    }
    return (Ast.FunctionType) type;
  }

  //~ Declarations ------------------------------------------------------------

  public Ast.DocComment docComment(Pos pos, String text) {
    return new Ast.DocComment(pos, text);
  }

  public Ast.Comment comment(Pos pos, String text) {
    return new Ast.Comment(pos, text);
  }

  public Ast.Signature signature(Pos pos, String name, Ast.Type type) {
    return new Ast.Signature(pos, name, type);
  }

  public Ast.FunMatch funMatch(Pos pos, String name,
      List<? extends Ast.Pat> patList, Ast.Exp exp) {
    return new Ast.FunMatch(pos, name, ImmutableList.copyOf(patList), exp);
  }

  /**
   * Creates a function. If there is a signature, its name must match the
   * implementation's.
   */
  public Ast.Function function(Pos pos,
      Ast.@Nullable DocComment documentation,
      Ast.@Nullable Signature signature, Ast.FunMatch funMatch) {
    checkArgument(signature == null || signature.name.equals(funMatch.name),
        "signature name %s does not match function name %s",
        signature == null ? null : signature.name, funMatch.name);
    return new Ast.Function(pos, documentation, signature, funMatch);
  }

  public Ast.FunDecl funDecl(Pos pos, Ast.Function function) {
    return new Ast.FunDecl(pos, function);
  }

  public Ast.TypeAliasDecl typeAliasDecl(Pos pos,
      Ast.@Nullable DocComment documentation, String name,
      List<String> tyVars, Ast.Type type) {
    return new Ast.TypeAliasDecl(pos, documentation, name,
        ImmutableList.copyOf(tyVars), type);
  }

  public Ast.TyCon tyCon(Pos pos, String name, List<? extends Ast.Type> args) {
    return new Ast.TyCon(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.TyCon tyCon(Pos pos, String name, Ast.Type... args) {
    return tyCon(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.CustomTypeDecl customTypeDecl(Pos pos,
      Ast.@Nullable DocComment documentation, String name,
      List<String> tyVars, List<Ast.TyCon> tyCons) {
    return new Ast.CustomTypeDecl(pos, documentation, name,
        ImmutableList.copyOf(tyVars), ImmutableList.copyOf(tyCons));
  }

  public Ast.PortDecl portDecl(Pos pos, Ast.Signature signature) {
    return new Ast.PortDecl(pos, signature);
  }

  public Ast.InfixDecl infixDecl(Pos pos, InfixDirection direction,
      int precedence, String operator, String function) {
    return new Ast.InfixDecl(pos, direction, precedence, operator, function);
  }

  public Ast.DestructuringDecl destructuringDecl(Pos pos, Ast.Pat pat,
      Ast.Exp exp) {
    return new Ast.DestructuringDecl(pos, pat, exp);
  }

  //~ Modules -----------------------------------------------------------------

  public Ast.InfixExpose infixExpose(Pos pos, String name) {
    checkArgument(!name.startsWith("("), "operator must not have parentheses");
    return new Ast.InfixExpose(pos, name);
  }

  public Ast.FunctionExpose functionExpose(Pos pos, String name) {
    return new Ast.FunctionExpose(pos, name);
  }

  public Ast.TypeExpose typeExpose(Pos pos, String name, boolean open) {
    return new Ast.TypeExpose(pos, name, open);
  }

  public Ast.ExposingAll exposingAll(Pos pos) {
    return new Ast.ExposingAll(pos);
  }

  public Ast.ExposingList exposingList(Pos pos,
      List<? extends Ast.Expose> exposes) {
    return new Ast.ExposingList(pos, ImmutableList.copyOf(exposes));
  }

  public Ast.ExposingList exposingList(Pos pos, Ast.Expose... exposes) {
    return exposingList(pos, ImmutableList.copyOf(exposes));
  }

  /** Creates a header, "module Name exposing (...)". */
  public Ast.ModuleHeader moduleHeader(Pos pos, List<String> moduleName,
      Ast.Exposing exposing) {
    return new Ast.ModuleHeader(pos, Op.MODULE,
        ImmutableList.copyOf(moduleName), exposing, null, null);
  }

  /** Creates a header, "port module Name exposing (...)". */
  public Ast.ModuleHeader portModuleHeader(Pos pos, List<String> moduleName,
      Ast.Exposing exposing) {
    return new Ast.ModuleHeader(pos, Op.PORT_MODULE,
        ImmutableList.copyOf(moduleName), exposing, null, null);
  }

  /**
   * Creates a header, "effect module Name where { command = MyCmd }
   * exposing (...)". Either or both of {@code command} and
   * {@code subscription} may be null.
   */
  public Ast.ModuleHeader effectModuleHeader(Pos pos, List<String> moduleName,
      @Nullable String command, @Nullable String subscription,
      Ast.Exposing exposing) {
    return new Ast.ModuleHeader(pos, Op.EFFECT_MODULE,
        ImmutableList.copyOf(moduleName), exposing, command, subscription);
  }

  public Ast.Import importOf(Pos pos, List<String> moduleName,
      @Nullable List<String> alias, Ast.@Nullable Exposing exposing) {
    return new Ast.Import(pos, ImmutableList.copyOf(moduleName),
        alias == null ? null : ImmutableList.copyOf(alias), exposing);
  }

  public Ast.ModuleFile moduleFile(Pos pos, Ast.ModuleHeader header,
      Ast.@Nullable DocComment documentation, List<Ast.Import> imports,
      List<? extends Ast.Decl> decls, List<Ast.Comment> comments) {
    return new Ast.ModuleFile(pos, header, documentation,
        ImmutableList.copyOf(imports), ImmutableList.copyOf(decls),
        ImmutableList.copyOf(comments));
  }

  /** Creates a file with no module documentation and no comments. */
  public Ast.ModuleFile moduleFile(Pos pos, Ast.ModuleHeader header,
      List<Ast.Import> imports, List<? extends Ast.Decl> decls) {
    requireNonNull(header, "header");
    return moduleFile(pos, header, null, imports, decls, ImmutableList.of());
  }
}

// End AstBuilder.java
