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
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Joins a module name and a name with dots, e.g. "List.map". */
  static String qualify(List<String> moduleName, String name) {
    if (moduleName.isEmpty()) {
      return name;
    }
    return String.join(".", moduleName) + "." + name;
  }

  //~ Expressions -------------------------------------------------------------

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** The unit value, "()". */
  public static class Unit extends Exp {
    Unit(Pos pos) {
      super(pos, Op.UNIT);
    }
  }

  /**
   * Parse tree node of a value or function reference, optionally qualified by
   * a module name.
   *
   * <p>For example, "x", "List.map", "Html.Attributes.class".
   */
  public static class Id extends Exp {
    public final List<String> moduleName;
    public final String name;

    Id(Pos pos, ImmutableList<String> moduleName, String name) {
      super(pos, Op.ID);
      this.moduleName = requireNonNull(moduleName);
      this.name = requireNonNull(name);
    }

    /** Returns the qualified name, e.g. "List.map". */
    public String qualifiedName() {
      return qualify(moduleName, name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(moduleName, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Id
              && moduleName.equals(((Id) o).moduleName)
              && name.equals(((Id) o).name);
    }
  }

  /** An operator used as a function, e.g. "(+)". */
  public static class PrefixOperator extends Exp {
    public final String symbol;

    PrefixOperator(Pos pos, String symbol) {
      super(pos, Op.PREFIX_OPERATOR);
      this.symbol = requireNonNull(symbol);
    }
  }

  /** A bare operator token, e.g. "+". */
  public static class Operator extends Exp {
    public final String symbol;

    Operator(Pos pos, String symbol) {
      super(pos, Op.OPERATOR);
      this.symbol = requireNonNull(symbol);
    }
  }

  /**
   * Parse tree node of a literal (constant).
   *
   * <p>The type of {@link #value} depends on {@link #op}: {@link Long} for
   * {@link Op#INT_LITERAL} and {@link Op#HEX_LITERAL}, {@link Double} for
   * {@link Op#FLOAT_LITERAL}, {@link String} for {@link Op#STRING_LITERAL},
   * and an {@link Integer} code point for {@link Op#CHAR_LITERAL}.
   */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && op == ((Literal) o).op
              && value.equals(((Literal) o).value);
    }

    /** Returns whether this is a numeric literal less than zero. */
    public boolean isNegative() {
      switch (op) {
        case INT_LITERAL:
        case HEX_LITERAL:
          return (Long) value < 0;
        case FLOAT_LITERAL:
          return (Double) value < 0;
        default:
          return false;
      }
    }
  }

  /** Application of a function to one or more arguments, e.g. "f x y". */
  public static class Apply extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Apply(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty(), "application must have an argument");
    }

    /** Returns the function followed by its arguments. */
    public List<Exp> exps() {
      return ImmutableList.<Exp>builder().add(fn).addAll(args).build();
    }
  }

  /** Call to an infix operator, e.g. "a + b". */
  public static class InfixCall extends Exp {
    public final String symbol;
    public final InfixDirection direction;
    public final Exp left;
    public final Exp right;

    InfixCall(Pos pos, String symbol, InfixDirection direction, Exp left,
        Exp right) {
      super(pos, Op.INFIX);
      this.symbol = requireNonNull(symbol);
      this.direction = requireNonNull(direction);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    /** Returns the precedence of this call's operator. */
    public int precedence() {
      return InfixOp.precedence(symbol);
    }
  }

  /** Unary negation, e.g. "-x". */
  public static class Negate extends Exp {
    public final Exp exp;

    Negate(Pos pos, Exp exp) {
      super(pos, Op.NEGATE);
      this.exp = requireNonNull(exp);
    }
  }

  /** "If ... then ... else ..." expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }
  }

  /** Tuple, e.g. "( a, b )". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }
  }

  /** List, e.g. "[ a, b ]". */
  public static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.LIST);
      this.args = requireNonNull(args);
    }
  }

  /** Expression in parentheses. */
  public static class Parens extends Exp {
    public final Exp exp;

    Parens(Pos pos, Exp exp) {
      super(pos, Op.PARENS);
      this.exp = requireNonNull(exp);
    }
  }

  /** Assignment of a value to a field, within a record or record update. */
  public static class Field extends AstNode {
    public final String name;
    public final Exp exp;

    Field(Pos pos, String name, Exp exp) {
      super(pos, Op.FIELD);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }
  }

  /** Record construction, e.g. "{ a = 1, b = 2 }". */
  public static class Record extends Exp {
    public final List<Field> fields;

    Record(Pos pos, ImmutableList<Field> fields) {
      super(pos, Op.RECORD);
      this.fields = requireNonNull(fields);
    }
  }

  /** Record update, e.g. "{ r | a = 1 }". */
  public static class RecordUpdate extends Exp {
    public final String record;
    public final List<Field> fields;

    RecordUpdate(Pos pos, String record, ImmutableList<Field> fields) {
      super(pos, Op.RECORD_UPDATE);
      this.record = requireNonNull(record);
      this.fields = requireNonNull(fields);
      checkArgument(!fields.isEmpty(), "record update must set a field");
    }
  }

  /** Access to a field of a record, e.g. "r.a". */
  public static class RecordAccess extends Exp {
    public final Exp exp;
    public final String field;

    RecordAccess(Pos pos, Exp exp, String field) {
      super(pos, Op.RECORD_ACCESS);
      this.exp = requireNonNull(exp);
      this.field = requireNonNull(field);
    }
  }

  /**
   * Function that accesses a field of a record, e.g. ".a".
   *
   * <p>{@link #name} does not include the leading dot.
   */
  public static class RecordSelector extends Exp {
    public final String name;

    RecordSelector(Pos pos, String name) {
      super(pos, Op.RECORD_SELECTOR);
      this.name = requireNonNull(name);
      checkArgument(!name.startsWith("."), "selector name must not have dot");
    }
  }

  /** Lambda, e.g. "\x y -> x + y". */
  public static class Fn extends Exp {
    public final List<Pat> args;
    public final Exp exp;

    Fn(Pos pos, ImmutableList<Pat> args, Exp exp) {
      super(pos, Op.FN);
      this.args = requireNonNull(args);
      this.exp = requireNonNull(exp);
      checkArgument(!args.isEmpty(), "lambda must have an argument");
    }
  }

  /** One arm of a "case" expression, "pat -> exp". */
  public static class Match extends AstNode {
    public final Pat pat;
    public final Exp exp;

    Match(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.MATCH);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }
  }

  /** "Case ... of" expression. */
  public static class Case extends Exp {
    public final Exp exp;
    public final List<Match> matchList;

    Case(Pos pos, Exp exp, ImmutableList<Match> matchList) {
      super(pos, Op.CASE);
      this.exp = requireNonNull(exp);
      this.matchList = requireNonNull(matchList);
      checkArgument(!matchList.isEmpty(), "case must have an arm");
    }
  }

  /** Binding within a "let" expression. */
  public abstract static class LetBinding extends AstNode {
    LetBinding(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Function (or value) defined in a "let" expression. */
  public static class LetFunction extends LetBinding {
    public final Function function;

    LetFunction(Pos pos, Function function) {
      super(pos, Op.LET_FUNCTION);
      this.function = requireNonNull(function);
    }
  }

  /** Destructuring in a "let" expression, e.g. "( a, b ) = pair". */
  public static class LetDestructuring extends LetBinding {
    public final Pat pat;
    public final Exp exp;

    LetDestructuring(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.LET_DESTRUCTURING);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }
  }

  /** "Let ... in ..." expression. */
  public static class Let extends Exp {
    public final List<LetBinding> bindings;
    public final Exp exp;

    Let(Pos pos, ImmutableList<LetBinding> bindings, Exp exp) {
      super(pos, Op.LET);
      this.bindings = requireNonNull(bindings);
      this.exp = requireNonNull(exp);
      checkArgument(!bindings.isEmpty(), "let must have a binding");
    }
  }

  /**
   * Embedded shader, "[glsl| ... |]".
   *
   * <p>The printer does not support shaders; it prints a placeholder, and
   * therefore formatting a file that contains one loses information.
   */
  public static class Glsl extends Exp {
    public final String source;

    Glsl(Pos pos, String source) {
      super(pos, Op.GLSL);
      this.source = requireNonNull(source);
    }
  }

  //~ Patterns ----------------------------------------------------------------

  /**
   * Base class for a pattern.
   *
   * <p>For example, "x" in "f x = 5" is an {@link IdPat}; "( x, y )" in
   * "\( x, y ) -> x" is a {@link TuplePat}.
   */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Wildcard pattern, "_". */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos) {
      super(pos, Op.WILDCARD_PAT);
    }
  }

  /** Unit pattern, "()". */
  public static class UnitPat extends Pat {
    UnitPat(Pos pos) {
      super(pos, Op.UNIT_PAT);
    }
  }

  /**
   * Literal pattern, the pattern analog of the {@link Literal} expression.
   * Values have the same types as in {@link Literal}.
   */
  @SuppressWarnings("rawtypes")
  public static class LiteralPat extends Pat {
    public final Comparable value;

    LiteralPat(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
    }
  }

  /** Named pattern, the pattern analog of the {@link Id} expression. */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(Pos pos, String name) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
    }
  }

  /** Tuple pattern, e.g. "( x, y )". */
  public static class TuplePat extends Pat {
    public final List<Pat> args;

    TuplePat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.TUPLE_PAT);
      this.args = requireNonNull(args);
    }
  }

  /** Record pattern, e.g. "{ x, y }". */
  public static class RecordPat extends Pat {
    public final List<String> fields;

    RecordPat(Pos pos, ImmutableList<String> fields) {
      super(pos, Op.RECORD_PAT);
      this.fields = requireNonNull(fields);
    }
  }

  /** List pattern, e.g. "[ x, y ]". */
  public static class ListPat extends Pat {
    public final List<Pat> args;

    ListPat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.LIST_PAT);
      this.args = requireNonNull(args);
    }
  }

  /** Cons pattern, e.g. "x :: xs". */
  public static class ConsPat extends Pat {
    public final Pat head;
    public final Pat tail;

    ConsPat(Pos pos, Pat head, Pat tail) {
      super(pos, Op.CONS_PAT);
      this.head = requireNonNull(head);
      this.tail = requireNonNull(tail);
    }
  }

  /**
   * Type constructor pattern, with zero or more arguments.
   *
   * <p>For example, in "case m of Just x -> x", "Just x" is a constructor
   * pattern whose {@link #args} has one element.
   */
  public static class ConPat extends Pat {
    public final List<String> moduleName;
    public final String name;
    public final List<Pat> args;

    ConPat(Pos pos, ImmutableList<String> moduleName, String name,
        ImmutableList<Pat> args) {
      super(pos, Op.CON_PAT);
      this.moduleName = requireNonNull(moduleName);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    /** Returns the qualified name, e.g. "Maybe.Just". */
    public String qualifiedName() {
      return qualify(moduleName, name);
    }
  }

  /**
   * Layered pattern.
   *
   * <p>For example, in "( a, b ) as pair", if the pattern matches, "pair" is
   * bound to the whole tuple.
   */
  public static class AsPat extends Pat {
    public final Pat pat;
    public final String name;

    AsPat(Pos pos, Pat pat, String name) {
      super(pos, Op.AS_PAT);
      this.pat = requireNonNull(pat);
      this.name = requireNonNull(name);
    }
  }

  /** Pattern in parentheses. */
  public static class ParensPat extends Pat {
    public final Pat pat;

    ParensPat(Pos pos, Pat pat) {
      super(pos, Op.PARENS_PAT);
      this.pat = requireNonNull(pat);
    }
  }

  //~ Types -------------------------------------------------------------------

  /** Base class for parse tree nodes that represent types. */
  public abstract static class Type extends AstNode {
    Type(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Parse tree node of a type variable, e.g. "a". */
  public static class TyVar extends Type {
    public final String name;

    TyVar(Pos pos, String name) {
      super(pos, Op.TY_VAR);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TyVar && this.name.equals(((TyVar) o).name);
    }
  }

  /** Parse tree for a named type, e.g. "Int" or "Dict.Dict String a". */
  public static class NamedType extends Type {
    public final List<String> moduleName;
    public final String name;
    public final List<Type> args;

    NamedType(Pos pos, ImmutableList<String> moduleName, String name,
        ImmutableList<Type> args) {
      super(pos, Op.NAMED_TYPE);
      this.moduleName = requireNonNull(moduleName);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    /** Returns the qualified name, e.g. "Dict.Dict". */
    public String qualifiedName() {
      return qualify(moduleName, name);
    }
  }

  /** The unit type, "()". */
  public static class UnitType extends Type {
    UnitType(Pos pos) {
      super(pos, Op.UNIT_TYPE);
    }
  }

  /** Tuple type, e.g. "( Int, String )". */
  public static class TupleType extends Type {
    public final List<Type> types;

    TupleType(Pos pos, ImmutableList<Type> types) {
      super(pos, Op.TUPLE_TYPE);
      this.types = requireNonNull(types);
    }
  }

  /** Field of a record type, "name : type". */
  public static class FieldType extends AstNode {
    public final String name;
    public final Type type;

    FieldType(Pos pos, String name, Type type) {
      super(pos, Op.FIELD_TYPE);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }
  }

  /** Record type, e.g. "{ x : Int, y : Int }". */
  public static class RecordType extends Type {
    public final List<FieldType> fields;

    RecordType(Pos pos, ImmutableList<FieldType> fields) {
      super(pos, Op.RECORD_TYPE);
      this.fields = requireNonNull(fields);
    }
  }

  /** Extensible record type, e.g. "{ a | x : Int }". */
  public static class ExtensibleRecordType extends Type {
    public final String tyVar;
    public final List<FieldType> fields;

    ExtensibleRecordType(Pos pos, String tyVar,
        ImmutableList<FieldType> fields) {
      super(pos, Op.EXTENSIBLE_RECORD_TYPE);
      this.tyVar = requireNonNull(tyVar);
      this.fields = requireNonNull(fields);
      checkArgument(!fields.isEmpty(), "extensible record must have a field");
    }
  }

  /** Function type, e.g. "Int -> String". */
  public static class FunctionType extends Type {
    public final Type paramType;
    public final Type resultType;

    FunctionType(Pos pos, Type paramType, Type resultType) {
      super(pos, Op.FUNCTION_TYPE);
      this.paramType = requireNonNull(paramType);
      this.resultType = requireNonNull(resultType);
    }
  }

  //~ Declarations ------------------------------------------------------------

  /**
   * Documentation comment, "{-| ... -}".
   *
   * <p>{@link #text} is the body of the comment, without the delimiters.
   */
  public static class DocComment extends AstNode {
    public final String text;

    DocComment(Pos pos, String text) {
      super(pos, Op.DOC_COMMENT);
      this.text = requireNonNull(text);
    }
  }

  /**
   * Comment as it appeared in the source, including its delimiters.
   *
   * <p>The printer does not print comments; it only looks in them for
   * documentation that the parser did not attach to a declaration.
   */
  public static class Comment extends AstNode {
    public final String text;

    Comment(Pos pos, String text) {
      super(pos, Op.COMMENT);
      this.text = requireNonNull(text);
    }

    /** Returns whether this is a documentation comment, "{-| ... -}". */
    public boolean isDocComment() {
      return text.startsWith("{-|") && text.endsWith("-}");
    }
  }

  /** Type signature, "name : type". */
  public static class Signature extends AstNode {
    public final String name;
    public final Type type;

    Signature(Pos pos, String name, Type type) {
      super(pos, Op.SIGNATURE);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }
  }

  /** Implementation of a function, "name pat... = exp". */
  public static class FunMatch extends AstNode {
    public final String name;
    public final List<Pat> patList;
    public final Exp exp;

    FunMatch(Pos pos, String name, ImmutableList<Pat> patList, Exp exp) {
      super(pos, Op.FUN_MATCH);
      this.name = requireNonNull(name);
      this.patList = requireNonNull(patList);
      this.exp = requireNonNull(exp);
    }
  }

  /**
   * Function with optional documentation and signature. Occurs at the top
   * level (within {@link FunDecl}) and in "let" expressions.
   */
  public static class Function extends AstNode {
    public final @Nullable DocComment documentation;
    public final @Nullable Signature signature;
    public final FunMatch funMatch;

    Function(Pos pos, @Nullable DocComment documentation,
        @Nullable Signature signature, FunMatch funMatch) {
      super(pos, Op.FUNCTION);
      this.documentation = documentation;
      this.signature = signature;
      this.funMatch = requireNonNull(funMatch);
    }

    /** Creates a copy of this {@code Function} with given documentation,
     * or {@code this} if the documentation is the same. */
    public Function copy(@Nullable DocComment documentation) {
      return this.documentation == documentation
          ? this
          : new Function(pos, documentation, signature, funMatch);
    }
  }

  /** Base class for declarations. */
  public abstract static class Decl extends AstNode {
    Decl(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns this declaration's documentation, or null. */
    public @Nullable DocComment documentation() {
      return null;
    }

    /** Creates a copy of this declaration with given documentation. Returns
     * {@code this} if this kind of declaration cannot be documented. */
    public Decl copy(@Nullable DocComment documentation) {
      return this;
    }
  }

  /** Top-level function declaration. */
  public static class FunDecl extends Decl {
    public final Function function;

    FunDecl(Pos pos, Function function) {
      super(pos, Op.FUN_DECL);
      this.function = requireNonNull(function);
    }

    @Override
    public @Nullable DocComment documentation() {
      return function.documentation;
    }

    @Override
    public FunDecl copy(@Nullable DocComment documentation) {
      final Function function = this.function.copy(documentation);
      return function == this.function ? this : new FunDecl(pos, function);
    }
  }

  /** Type alias declaration, e.g. "type alias Point = { x : Int }". */
  public static class TypeAliasDecl extends Decl {
    public final @Nullable DocComment documentation;
    public final String name;
    public final List<String> tyVars;
    public final Type type;

    TypeAliasDecl(Pos pos, @Nullable DocComment documentation, String name,
        ImmutableList<String> tyVars, Type type) {
      super(pos, Op.TYPE_ALIAS_DECL);
      this.documentation = documentation;
      this.name = requireNonNull(name);
      this.tyVars = requireNonNull(tyVars);
      this.type = requireNonNull(type);
    }

    @Override
    public @Nullable DocComment documentation() {
      return documentation;
    }

    @Override
    public TypeAliasDecl copy(@Nullable DocComment documentation) {
      return this.documentation == documentation
          ? this
          : new TypeAliasDecl(pos, documentation, name,
              ImmutableList.copyOf(tyVars), type);
    }
  }

  /**
   * Type constructor.
   *
   * <p>For example, in the {@link CustomTypeDecl custom type declaration}
   * "type Maybe a = Nothing | Just a", "Nothing" and "Just a" are both type
   * constructors.
   */
  public static class TyCon extends AstNode {
    public final String name;
    public final List<Type> args;

    TyCon(Pos pos, String name, ImmutableList<Type> args) {
      super(pos, Op.TY_CON);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }
  }

  /** Custom type declaration, e.g. "type Maybe a = Nothing | Just a". */
  public static class CustomTypeDecl extends Decl {
    public final @Nullable DocComment documentation;
    public final String name;
    public final List<String> tyVars;
    public final List<TyCon> tyCons;

    CustomTypeDecl(Pos pos, @Nullable DocComment documentation, String name,
        ImmutableList<String> tyVars, ImmutableList<TyCon> tyCons) {
      super(pos, Op.CUSTOM_TYPE_DECL);
      this.documentation = documentation;
      this.name = requireNonNull(name);
      this.tyVars = requireNonNull(tyVars);
      this.tyCons = requireNonNull(tyCons);
      checkArgument(!tyCons.isEmpty(), "custom type must have a constructor");
    }

    @Override
    public @Nullable DocComment documentation() {
      return documentation;
    }

    @Override
    public CustomTypeDecl copy(@Nullable DocComment documentation) {
      return this.documentation == documentation
          ? this
          : new CustomTypeDecl(pos, documentation, name,
              ImmutableList.copyOf(tyVars), ImmutableList.copyOf(tyCons));
    }
  }

  /** Port declaration, e.g. "port send : String -> Cmd msg". */
  public static class PortDecl extends Decl {
    public final Signature signature;

    PortDecl(Pos pos, Signature signature) {
      super(pos, Op.PORT_DECL);
      this.signature = requireNonNull(signature);
    }
  }

  /** Fixity declaration, e.g. "infix left 6 (+) = add". */
  public static class InfixDecl extends Decl {
    public final InfixDirection direction;
    public final int precedence;
    public final String operator;
    public final String function;

    InfixDecl(Pos pos, InfixDirection direction, int precedence,
        String operator, String function) {
      super(pos, Op.INFIX_DECL);
      this.direction = requireNonNull(direction);
      this.precedence = precedence;
      this.operator = requireNonNull(operator);
      this.function = requireNonNull(function);
      checkArgument(precedence >= 0 && precedence <= 9,
          "precedence must be between 0 and 9");
    }
  }

  /** Top-level destructuring, e.g. "( a, b ) = pair". */
  public static class DestructuringDecl extends Decl {
    public final Pat pat;
    public final Exp exp;

    DestructuringDecl(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.DESTRUCTURING_DECL);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }
  }

  //~ Modules -----------------------------------------------------------------

  /** Base class of the items in an exposing list. */
  public abstract static class Expose extends AstNode {
    public final String name;

    Expose(Pos pos, Op op, String name) {
      super(pos, op);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Expose
              && op == ((Expose) o).op
              && name.equals(((Expose) o).name);
    }
  }

  /** Exposed operator, e.g. "(+)". {@link #name} has no parentheses. */
  public static class InfixExpose extends Expose {
    InfixExpose(Pos pos, String name) {
      super(pos, Op.INFIX_EXPOSE, name);
    }
  }

  /** Exposed function or value, e.g. "map". */
  public static class FunctionExpose extends Expose {
    FunctionExpose(Pos pos, String name) {
      super(pos, Op.FUNCTION_EXPOSE, name);
    }
  }

  /**
   * Exposed type or type alias, e.g. "Maybe", or type with its constructors,
   * e.g. "Maybe(..)".
   */
  public static class TypeExpose extends Expose {
    public final boolean open;

    TypeExpose(Pos pos, String name, boolean open) {
      super(pos, Op.TYPE_EXPOSE, name);
      this.open = open;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, open);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TypeExpose
              && name.equals(((TypeExpose) o).name)
              && open == ((TypeExpose) o).open;
    }
  }

  /** Base class for "exposing (..)" and "exposing (a, b)". */
  public abstract static class Exposing extends AstNode {
    Exposing(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** "exposing (..)". */
  public static class ExposingAll extends Exposing {
    ExposingAll(Pos pos) {
      super(pos, Op.EXPOSING_ALL);
    }
  }

  /** Explicit exposing list, e.g. "exposing (Maybe(..), map)". */
  public static class ExposingList extends Exposing {
    public final List<Expose> exposes;

    ExposingList(Pos pos, ImmutableList<Expose> exposes) {
      super(pos, Op.EXPOSING_LIST);
      this.exposes = requireNonNull(exposes);
      checkArgument(!exposes.isEmpty(), "exposing list must not be empty");
    }
  }

  /**
   * Module header.
   *
   * <p>{@link #op} is {@link Op#MODULE}, {@link Op#PORT_MODULE} or
   * {@link Op#EFFECT_MODULE}. Only an effect module may have a
   * {@link #command} or {@link #subscription}.
   */
  public static class ModuleHeader extends AstNode {
    public final List<String> moduleName;
    public final Exposing exposing;
    public final @Nullable String command;
    public final @Nullable String subscription;

    ModuleHeader(Pos pos, Op op, ImmutableList<String> moduleName,
        Exposing exposing, @Nullable String command,
        @Nullable String subscription) {
      super(pos, op);
      this.moduleName = requireNonNull(moduleName);
      this.exposing = requireNonNull(exposing);
      this.command = command;
      this.subscription = subscription;
      checkArgument(op == Op.MODULE
          || op == Op.PORT_MODULE
          || op == Op.EFFECT_MODULE);
      checkArgument(!moduleName.isEmpty(), "module name must not be empty");
      checkArgument(op == Op.EFFECT_MODULE
              || command == null && subscription == null,
          "only an effect module may have a command or subscription");
    }
  }

  /** Import, e.g. "import Html.Attributes as Attr exposing (class)". */
  public static class Import extends AstNode {
    public final List<String> moduleName;
    public final @Nullable List<String> alias;
    public final @Nullable Exposing exposing;

    Import(Pos pos, ImmutableList<String> moduleName,
        @Nullable ImmutableList<String> alias, @Nullable Exposing exposing) {
      super(pos, Op.IMPORT);
      this.moduleName = requireNonNull(moduleName);
      this.alias = alias;
      this.exposing = exposing;
      checkArgument(!moduleName.isEmpty(), "module name must not be empty");
    }
  }

  /** Source file: module header, imports and declarations. */
  public static class ModuleFile extends AstNode {
    public final ModuleHeader header;
    public final @Nullable DocComment documentation;
    public final List<Import> imports;
    public final List<Decl> decls;
    public final List<Comment> comments;

    ModuleFile(Pos pos, ModuleHeader header,
        @Nullable DocComment documentation, ImmutableList<Import> imports,
        ImmutableList<Decl> decls, ImmutableList<Comment> comments) {
      super(pos, Op.FILE);
      this.header = requireNonNull(header);
      this.documentation = documentation;
      this.imports = requireNonNull(imports);
      this.decls = requireNonNull(decls);
      this.comments = requireNonNull(comments);
    }
  }
}

// End Ast.java
