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

import static net.hydromatic.elmfmt.ast.AstBuilder.ast;
import static net.hydromatic.elmfmt.doc.Doc.hang;
import static net.hydromatic.elmfmt.doc.Doc.indent;
import static net.hydromatic.elmfmt.doc.Doc.line;
import static net.hydromatic.elmfmt.doc.Doc.lines;
import static net.hydromatic.elmfmt.doc.Doc.separators;
import static net.hydromatic.elmfmt.doc.Doc.text;
import static net.hydromatic.elmfmt.doc.Doc.tightline;
import static net.hydromatic.elmfmt.doc.Doc.words;
import static net.hydromatic.elmfmt.print.Printed.anyBreak;
import static net.hydromatic.elmfmt.print.Printed.optionalGroup;
import static net.hydromatic.elmfmt.util.Static.skip;
import static net.hydromatic.elmfmt.util.Static.transformEager;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.InfixDirection;
import net.hydromatic.elmfmt.ast.InfixOp;
import net.hydromatic.elmfmt.ast.Op;
import net.hydromatic.elmfmt.doc.Doc;

/**
 * Prints expressions.
 *
 * <p>Before printing a sub-expression, the printer calls
 * {@link #adjust(Context, Ast.Exp)} to remove parentheses that are redundant
 * in the sub-expression's context and to add those that are required; so the
 * tree that is printed is not always the tree that was supplied.
 *
 * <p>Each method returns a {@link Printed}, whose
 * {@link Printed#alwaysBreak} flag is true if the expression contains an
 * "if", "let", "case" or lambda, and therefore must span several lines.
 */
public final class ExpPrinter {
  /** Default indentation. */
  public static final int INDENT = 4;

  private ExpPrinter() {}

  /** Prints an expression at the top of an expression. */
  public static Printed print(Ast.Exp exp) {
    return print(exp, Context.TOP, INDENT);
  }

  /**
   * Prints an expression in a given context.
   *
   * @param exp Expression
   * @param context Precedence context
   * @param indent Indentation of continuation lines
   * @return Document, and whether it must always break
   */
  public static Printed print(Ast.Exp exp, Context context, int indent) {
    final Ast.Exp e = adjust(context, exp);
    switch (e.op) {
      case UNIT:
        return Printed.of(text("()"));

      case ID:
        return Printed.of(text(((Ast.Id) e).qualifiedName()));

      case PREFIX_OPERATOR:
        return Printed.of(text("(" + ((Ast.PrefixOperator) e).symbol + ")"));

      case OPERATOR:
        return Printed.of(text(((Ast.Operator) e).symbol));

      case CHAR_LITERAL:
      case INT_LITERAL:
      case HEX_LITERAL:
      case FLOAT_LITERAL:
      case STRING_LITERAL:
        return Printed.of(text(Literals.toString((Ast.Literal) e)));

      case GLSL:
        // Shaders are not supported; the placeholder loses the source.
        return Printed.broken(text("glsl"));

      case RECORD_SELECTOR:
        return Printed.of(text("." + ((Ast.RecordSelector) e).name));

      case APPLY:
        return printApply((Ast.Apply) e, indent);

      case INFIX:
        final Ast.InfixCall call = (Ast.InfixCall) e;
        if (call.symbol.equals(InfixOp.PIPE_LEFT_SYMBOL)) {
          return printPipeLeft(call, indent);
        }
        return printInfix(call, indent);

      case NEGATE:
        return printNegate((Ast.Negate) e);

      case IF:
        return printIf((Ast.If) e, indent);

      case TUPLE:
        return printTuple(((Ast.Tuple) e).args, indent);

      case LIST:
        return printList(((Ast.ListExp) e).args, indent);

      case PARENS:
        return printParens((Ast.Parens) e, indent);

      case RECORD:
        return printRecord(((Ast.Record) e).fields, indent);

      case RECORD_UPDATE:
        return printRecordUpdate((Ast.RecordUpdate) e, indent);

      case RECORD_ACCESS:
        final Ast.RecordAccess access = (Ast.RecordAccess) e;
        final Printed target = print(access.exp, Context.ARGUMENT, indent);
        return target.withDoc(target.doc.append("." + access.field));

      case FN:
        return printFn((Ast.Fn) e, indent);

      case CASE:
        return printCase((Ast.Case) e, indent);

      case LET:
        return printLet((Ast.Let) e, indent);

      default:
        throw new AssertionError("unknown op " + e.op);
    }
  }

  //~ Parentheses -------------------------------------------------------------

  /** Removes all levels of parentheses from an expression. */
  static Ast.Exp strip(Ast.Exp exp) {
    while (exp.op == Op.PARENS) {
      exp = ((Ast.Parens) exp).exp;
    }
    return exp;
  }

  /**
   * Adds or removes parentheses so that an expression can be printed
   * correctly, and with no more parentheses than it needs, in a given
   * context.
   *
   * <p>Several levels of parentheses become one; parentheses are removed
   * from an atom, and from any expression at the top or at the tail of a
   * "<|" pipeline; parentheses are added to "if", "let", "case" and lambda
   * unless at the top or at the tail of a pipeline, to a function
   * application used as an argument, and to an operator application whose
   * precedence is lower than the context requires.
   *
   * <p>Parentheses around an operator application that does not need them
   * are kept; the author may have added them for clarity.
   *
   * <p>The operation is idempotent: if {@code e2 = adjust(c, e)} then
   * {@code adjust(c, e2)} returns {@code e2}.
   */
  public static Ast.Exp adjust(Context context, Ast.Exp exp) {
    if (exp.op == Op.PARENS) {
      final Ast.Exp inner = strip(exp);
      if (context.top
          || context.leftPipe && !needsParens(context, inner)
          || inner.op.atom
          || inner.op == Op.APPLY
              && context.precedence < InfixOp.APPLY_PRECEDENCE) {
        exp = inner;
      } else {
        return ((Ast.Parens) exp).exp == inner ? exp : ast.parens(inner);
      }
    }
    if (!context.top && needsParens(context, exp)) {
      return ast.parens(exp);
    }
    return exp;
  }

  /** Returns whether an expression that is not in parentheses needs them
   * in a context that is not at the top. */
  private static boolean needsParens(Context context, Ast.Exp exp) {
    switch (exp.op) {
      case IF:
      case LET:
      case CASE:
      case FN:
        return !context.leftPipe;
      case APPLY:
        return context.precedence >= InfixOp.APPLY_PRECEDENCE;
      case INFIX:
        final Ast.InfixCall call = (Ast.InfixCall) exp;
        return context.needsParens(call.precedence(), call.direction);
      default:
        return false;
    }
  }

  /**
   * Reduces an indentation by a number of spaces, wrapping around so that
   * the result is between 1 and 4.
   *
   * <p>Used where a prefix of {@code spaces} characters (such as an operator
   * and a space) precedes a sub-expression, so that the sub-expression's
   * continuation lines end up on a multiple of 4.
   */
  static int decrementIndent(int indent, int spaces) {
    final int modded = Math.floorMod(indent - spaces, 4);
    return modded == 0 ? 4 : modded;
  }

  //~ Applications and operators ----------------------------------------------

  private static Printed printApply(Ast.Apply apply, int indent) {
    final List<Printed> printeds =
        transformEager(apply.exps(),
            e -> print(e, Context.ARGUMENT, INDENT));
    final boolean alwaysBreak = anyBreak(printeds);
    final Doc doc = hang(indent, lines(transformEager(printeds, p -> p.doc)));
    return Printed.of(optionalGroup(alwaysBreak, doc), alwaysBreak);
  }

  /**
   * Prints a pipeline of "<|" operators, "f <| g <| x", with each function
   * ending a line and the argument on the last line.
   */
  private static Printed printPipeLeft(Ast.InfixCall call, int indent) {
    final Context leftContext = Context.operand(1);
    final Context rightContext = Context.pipeTail();
    final List<Printed> printeds = new ArrayList<>();
    Ast.InfixCall c = call;
    for (;;) {
      final Printed left = print(c.left, leftContext, indent);
      printeds.add(
          left.withDoc(words(left.doc, text(InfixOp.PIPE_LEFT_SYMBOL))));
      final Ast.Exp right = adjust(rightContext, c.right);
      if (right.op == Op.INFIX
          && ((Ast.InfixCall) right).symbol.equals(
              InfixOp.PIPE_LEFT_SYMBOL)) {
        c = (Ast.InfixCall) right;
        continue;
      }
      printeds.add(print(right, rightContext, indent));
      break;
    }
    final boolean alwaysBreak = anyBreak(printeds);
    final Doc doc =
        optionalGroup(alwaysBreak, lines(transformEager(printeds, p -> p.doc)))
            .nest(indent);
    return Printed.of(doc, alwaysBreak);
  }

  /**
   * Prints a chain of calls to the same operator, "a + b + c".
   *
   * <p>Operands that are calls to the same operator, on the side towards
   * which the operator associates, are unfolded into the chain; all other
   * operands are printed in their own context, which may add parentheses.
   * The unfolding is iterative, so long chains do not exhaust the stack.
   */
  private static Printed printInfix(Ast.InfixCall call, int indent) {
    final String symbol = call.symbol;
    final int precedence = call.precedence();
    final Context spineContext = Context.operand(precedence, call.direction);
    final Context otherContext =
        Context.operand(
            Math.min(precedence + 1, InfixOp.APPLY_PRECEDENCE));

    // Collect operands, and the context in which each is printed.
    final Deque<Ast.Exp> operands = new ArrayDeque<>();
    final Deque<Context> contexts = new ArrayDeque<>();
    switch (call.direction) {
      case LEFT:
        Ast.InfixCall c = call;
        for (;;) {
          operands.addFirst(c.right);
          contexts.addFirst(otherContext);
          final Ast.Exp left = adjust(spineContext, c.left);
          if (isSameOperator(left, symbol, InfixDirection.LEFT)) {
            c = (Ast.InfixCall) left;
            continue;
          }
          operands.addFirst(left);
          contexts.addFirst(spineContext);
          break;
        }
        break;

      case RIGHT:
        Ast.InfixCall c2 = call;
        for (;;) {
          operands.addLast(c2.left);
          contexts.addLast(otherContext);
          final Ast.Exp right = adjust(spineContext, c2.right);
          if (isSameOperator(right, symbol, InfixDirection.RIGHT)) {
            c2 = (Ast.InfixCall) right;
            continue;
          }
          operands.addLast(right);
          contexts.addLast(spineContext);
          break;
        }
        break;

      case NON:
        operands.add(call.left);
        contexts.add(otherContext);
        operands.add(call.right);
        contexts.add(otherContext);
        break;

      default:
        throw new AssertionError("unknown direction " + call.direction);
    }

    final int innerIndent = decrementIndent(indent, symbol.length() + 1);
    final List<Doc> docs = new ArrayList<>();
    boolean alwaysBreak = false;
    while (!operands.isEmpty()) {
      final Ast.Exp operand = operands.removeFirst();
      final Context context = contexts.removeFirst();
      if (docs.isEmpty()) {
        final Printed printed = print(operand, context, indent);
        alwaysBreak |= printed.alwaysBreak;
        docs.add(printed.doc);
      } else {
        final Printed printed = print(operand, context, innerIndent);
        alwaysBreak |= printed.alwaysBreak;
        docs.add(text(symbol + " ").append(printed.doc));
      }
    }
    final Doc doc = Doc.join(line().nest(indent), docs).align();
    return Printed.of(optionalGroup(alwaysBreak, doc), alwaysBreak);
  }

  private static boolean isSameOperator(Ast.Exp exp, String symbol,
      InfixDirection direction) {
    return exp.op == Op.INFIX
        && ((Ast.InfixCall) exp).symbol.equals(symbol)
        && ((Ast.InfixCall) exp).direction == direction;
  }

  /** Prints a negation, "-x". Double negation is parenthesized, "-(-x)". */
  private static Printed printNegate(Ast.Negate negate) {
    final Ast.Exp inner = adjust(Context.ARGUMENT, negate.exp);
    final Printed printed = print(inner, Context.ARGUMENT, INDENT);
    final boolean negative = inner.op == Op.NEGATE
        || inner instanceof Ast.Literal && ((Ast.Literal) inner).isNegative();
    final Doc doc = negative ? Doc.parens(printed.doc) : printed.doc;
    return printed.withDoc(text("-").append(doc));
  }

  //~ Blocks ------------------------------------------------------------------

  /**
   * Prints an "if" expression. An "if" in the "else" branch continues the
   * same ladder, "else if", rather than being indented.
   */
  private static Printed printIf(Ast.If ifExp, int indent) {
    final List<Doc> docs = new ArrayList<>();
    Ast.If i = ifExp;
    Doc prefix = Doc.empty();
    for (;;) {
      final Doc ifPart = keywordPart("if", i.condition, "then", indent);
      docs.add(prefix.isEmpty() ? ifPart : words(prefix, ifPart));
      final Printed ifTrue = print(i.ifTrue, Context.TOP, indent);
      docs.add(indent(indent, ifTrue.doc));
      final Doc elsePart = line().append("else");
      final Ast.Exp ifFalse = adjust(Context.TOP, i.ifFalse);
      if (ifFalse.op == Op.IF) {
        prefix = elsePart;
        i = (Ast.If) ifFalse;
        continue;
      }
      final Printed printed = print(ifFalse, Context.TOP, indent);
      docs.add(elsePart);
      docs.add(indent(indent, printed.doc));
      break;
    }
    return Printed.broken(lines(docs).align());
  }

  /**
   * Prints the head of an "if" or "case", "if condition then" or
   * "case exp of"; if the expression must break, the keywords are on lines
   * of their own.
   */
  private static Doc keywordPart(String keyword, Ast.Exp exp,
      String keyword2, int indent) {
    final Printed printed = print(exp, Context.TOP, indent);
    final boolean alwaysBreak = printed.alwaysBreak;
    return optionalGroup(alwaysBreak,
        lines(
            optionalGroup(alwaysBreak,
                lines(text(keyword), printed.doc).nest(indent)),
            text(keyword2)));
  }

  /** Prints a "case" expression. Arms are separated by blank lines. */
  private static Printed printCase(Ast.Case caseExp, int indent) {
    final Doc casePart = keywordPart("case", caseExp.exp, "of", indent);
    final List<Doc> arms = new ArrayList<>();
    for (Ast.Match match : caseExp.matchList) {
      arms.add(indent(indent, printMatch(match)));
    }
    return Printed.broken(lines(casePart, doubleLines(arms)).align());
  }

  /** Prints an arm of a "case" expression, "pat ->" followed by the
   * expression, indented, on the next line. */
  public static Doc printMatch(Ast.Match match) {
    final Printed printed = print(match.exp, Context.TOP, INDENT);
    return PatPrinter.print(match.pat, true)
        .append(" ->")
        .append(line())
        .append(indent(INDENT, printed.doc));
  }

  /** Prints a "let" expression. Bindings are separated by blank lines. */
  private static Printed printLet(Ast.Let let, int indent) {
    final List<Doc> bindings = new ArrayList<>();
    for (Ast.LetBinding binding : let.bindings) {
      bindings.add(printLetBinding(binding, indent));
    }
    final Printed body = print(let.exp, Context.TOP, indent);
    return Printed.broken(
        lines(text("let"), indent(indent, doubleLines(bindings)), text("in"),
            body.doc).align());
  }

  /** Prints a binding in a "let" expression. */
  public static Doc printLetBinding(Ast.LetBinding binding, int indent) {
    switch (binding.op) {
      case LET_FUNCTION:
        final Ast.Function function = ((Ast.LetFunction) binding).function;
        return DeclPrinter.printFunction(function);

      case LET_DESTRUCTURING:
        final Ast.LetDestructuring destructuring =
            (Ast.LetDestructuring) binding;
        final Printed printed = print(destructuring.exp, Context.TOP, indent);
        return words(PatPrinter.print(destructuring.pat, false), text("="))
            .append(line())
            .append(indent(indent, printed.doc));

      default:
        throw new AssertionError("unknown op " + binding.op);
    }
  }

  /** Prints a lambda, "\x y ->", with the body on the next line. */
  private static Printed printFn(Ast.Fn fn, int indent) {
    final Printed body = print(fn.exp, Context.TOP, indent);
    final Doc args =
        words(transformEager(fn.args, pat -> PatPrinter.print(pat, false)));
    return Printed.broken(
        lines(text("\\").append(args).append(" ->"), body.doc)
            .nest(indent)
            .align());
  }

  /** Joins documents with blank lines between them. */
  static Doc doubleLines(List<Doc> docs) {
    return Doc.join(line().append(tightline()), docs);
  }

  //~ Containers --------------------------------------------------------------

  private static Printed printParens(Ast.Parens parens, int indent) {
    final Printed printed =
        print(parens.exp, Context.TOP, decrementIndent(indent, 1));
    final Doc doc = text("(")
        .append(printed.doc.nest(1))
        .append(tightline())
        .append(")")
        .align();
    return printed.withDoc(optionalGroup(printed.alwaysBreak, doc));
  }

  private static Printed printTuple(List<Ast.Exp> args, int indent) {
    if (args.isEmpty()) {
      return Printed.of(text("()"));
    }
    return printContainer("(", elements(args, indent), ")");
  }

  private static Printed printList(List<Ast.Exp> args, int indent) {
    if (args.isEmpty()) {
      return Printed.of(text("[]"));
    }
    return printContainer("[", elements(args, indent), "]");
  }

  private static Printed printRecord(List<Ast.Field> fields, int indent) {
    if (fields.isEmpty()) {
      return Printed.of(text("{}"));
    }
    return printContainer("{",
        transformEager(fields, f -> printField(f, indent)), "}");
  }

  private static List<Printed> elements(List<Ast.Exp> exps, int indent) {
    final int innerIndent = decrementIndent(indent, 2);
    return transformEager(exps, e -> print(e, Context.TOP, innerIndent));
  }

  /**
   * Prints the elements of a tuple, list or record, separated by commas; on
   * one line if they fit, otherwise one per line with a leading comma and
   * the closing bracket on a line of its own.
   */
  private static Printed printContainer(String open, List<Printed> printeds,
      String close) {
    final boolean alwaysBreak = anyBreak(printeds);
    final Doc doc = text(open + " ")
        .append(separators(", ", transformEager(printeds, p -> p.doc)))
        .append(line())
        .append(close)
        .align();
    return Printed.of(optionalGroup(alwaysBreak, doc), alwaysBreak);
  }

  /** Prints a field assignment, "name = exp". */
  public static Printed printField(Ast.Field field, int indent) {
    final Printed printed =
        print(field.exp, Context.TOP, decrementIndent(indent, 2));
    final Doc doc =
        optionalGroup(printed.alwaysBreak,
            lines(words(text(field.name), text("=")), printed.doc))
            .nest(INDENT);
    return printed.withDoc(doc);
  }

  /** Prints a record update, "{ r | a = 1, b = 2 }". */
  private static Printed printRecordUpdate(Ast.RecordUpdate update,
      int indent) {
    final List<Printed> printeds =
        transformEager(update.fields, f -> printField(f, indent));
    final boolean alwaysBreak = anyBreak(printeds);
    Doc fields = line().append("| ").append(printeds.get(0).doc);
    for (Printed printed : skip(printeds)) {
      fields = fields.append(tightline()).append(", ").append(printed.doc);
    }
    final Doc doc = text("{ " + update.record)
        .append(fields.nest(INDENT))
        .append(line())
        .append("}")
        .align();
    return Printed.of(optionalGroup(alwaysBreak, doc), alwaysBreak);
  }
}

// End ExpPrinter.java
