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
import static net.hydromatic.elmfmt.doc.Doc.text;
import static net.hydromatic.elmfmt.doc.Doc.words;
import static net.hydromatic.elmfmt.util.Static.transformEager;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.Op;
import net.hydromatic.elmfmt.doc.Doc;

/**
 * Prints patterns.
 *
 * <p>Patterns have no precedence levels, only a distinction between a
 * pattern at the top (the whole of a "case" arm, an element of a tuple) and
 * a nested pattern (an argument of a function or constructor).
 */
public final class PatPrinter {
  private PatPrinter() {}

  /** Returns whether a pattern needs parentheses in a given position. */
  static boolean needsParens(Ast.Pat pat, boolean top) {
    if (top) {
      return false;
    }
    switch (pat.op) {
      case CON_PAT:
        return !((Ast.ConPat) pat).args.isEmpty();
      case AS_PAT:
      case CONS_PAT:
        return true;
      default:
        return false;
    }
  }

  /** Removes all levels of parentheses from a pattern. */
  static Ast.Pat strip(Ast.Pat pat) {
    while (pat.op == Op.PARENS_PAT) {
      pat = ((Ast.ParensPat) pat).pat;
    }
    return pat;
  }

  /**
   * Adds or removes parentheses so that a pattern has exactly as many as it
   * needs in a given position: one level if it needs them, otherwise none.
   */
  public static Ast.Pat adjust(Ast.Pat pat, boolean top) {
    final Ast.Pat inner = strip(pat);
    if (!needsParens(inner, top)) {
      return inner;
    }
    if (pat.op == Op.PARENS_PAT && ((Ast.ParensPat) pat).pat == inner) {
      return pat;
    }
    return ast.parensPat(inner.pos, inner);
  }

  /** Prints a pattern. */
  public static Doc print(Ast.Pat pat, boolean top) {
    final Ast.Pat p = adjust(pat, top);
    switch (p.op) {
      case WILDCARD_PAT:
        return text("_");

      case UNIT_PAT:
        return text("()");

      case CHAR_LITERAL_PAT:
      case STRING_LITERAL_PAT:
      case INT_LITERAL_PAT:
      case HEX_LITERAL_PAT:
      case FLOAT_LITERAL_PAT:
        return text(Literals.toString((Ast.LiteralPat) p));

      case ID_PAT:
        return text(((Ast.IdPat) p).name);

      case TUPLE_PAT:
        final List<Ast.Pat> tupleArgs = ((Ast.TuplePat) p).args;
        if (tupleArgs.isEmpty()) {
          return text("()");
        }
        return container("( ", " )",
            transformEager(tupleArgs, a -> print(a, true)));

      case RECORD_PAT:
        final List<String> fields = ((Ast.RecordPat) p).fields;
        if (fields.isEmpty()) {
          return text("{}");
        }
        return container("{ ", " }", transformEager(fields, Doc::text));

      case LIST_PAT:
        final List<Ast.Pat> listArgs = ((Ast.ListPat) p).args;
        if (listArgs.isEmpty()) {
          return text("[]");
        }
        return container("[ ", " ]",
            transformEager(listArgs, a -> print(a, true)));

      case CONS_PAT:
        return printCons((Ast.ConsPat) p);

      case CON_PAT:
        final Ast.ConPat conPat = (Ast.ConPat) p;
        final List<Doc> docs = new ArrayList<>();
        docs.add(text(conPat.qualifiedName()));
        for (Ast.Pat arg : conPat.args) {
          docs.add(print(arg, false));
        }
        return words(docs);

      case AS_PAT:
        final Ast.AsPat asPat = (Ast.AsPat) p;
        return words(print(asPat.pat, false), text("as"), text(asPat.name));

      case PARENS_PAT:
        return text("(").append(print(((Ast.ParensPat) p).pat, true))
            .append(")");

      default:
        throw new AssertionError("unknown op " + p.op);
    }
  }

  /** Prints a container's elements, separated by commas, on one line.
   * Patterns never break, whatever the width. */
  private static Doc container(String open, String close, List<Doc> docs) {
    return text(open)
        .append(Doc.join(text(", "), docs))
        .append(close);
  }

  /**
   * Prints a chain of cons patterns, "a :: b :: rest", flattening the
   * right spine.
   */
  private static Doc printCons(Ast.ConsPat consPat) {
    final List<Doc> docs = new ArrayList<>();
    Ast.Pat tail = consPat;
    for (;;) {
      final Ast.ConsPat cons = (Ast.ConsPat) tail;
      docs.add(print(cons.head, false));
      tail = strip(cons.tail);
      if (tail.op != Op.CONS_PAT) {
        break;
      }
    }
    docs.add(print(tail, false));
    return Doc.join(text(" :: "), docs);
  }
}

// End PatPrinter.java
