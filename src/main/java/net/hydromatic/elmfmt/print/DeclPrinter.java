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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.elmfmt.doc.Doc.line;
import static net.hydromatic.elmfmt.doc.Doc.lines;
import static net.hydromatic.elmfmt.doc.Doc.text;
import static net.hydromatic.elmfmt.doc.Doc.words;
import static net.hydromatic.elmfmt.util.Static.skip;
import static net.hydromatic.elmfmt.util.Static.transformEager;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.doc.Doc;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Prints declarations.
 *
 * <p>Documentation comments are formatted by a {@link DocCommentFormatter}
 * and inserted verbatim above the declaration.
 */
public class DeclPrinter {
  private final DocCommentFormatter docCommentFormatter;
  private final int width;

  public DeclPrinter(DocCommentFormatter docCommentFormatter, int width) {
    this.docCommentFormatter = requireNonNull(docCommentFormatter);
    this.width = width;
  }

  /** Prints a top-level declaration. */
  public Doc print(Ast.Decl decl) {
    switch (decl.op) {
      case FUN_DECL:
        return print(((Ast.FunDecl) decl).function);

      case TYPE_ALIAS_DECL:
        final Ast.TypeAliasDecl alias = (Ast.TypeAliasDecl) decl;
        return lines(printDocComment(alias.documentation),
            printTypeAlias(alias));

      case CUSTOM_TYPE_DECL:
        final Ast.CustomTypeDecl customType = (Ast.CustomTypeDecl) decl;
        return lines(printDocComment(customType.documentation),
            printCustomType(customType));

      case PORT_DECL:
        return words(text("port"),
            printSignature(((Ast.PortDecl) decl).signature));

      case INFIX_DECL:
        final Ast.InfixDecl infix = (Ast.InfixDecl) decl;
        return words(text("infix"), text(infix.direction.keyword()),
            text(Integer.toString(infix.precedence)),
            text("(" + infix.operator + ")"), text("="),
            text(infix.function));

      case DESTRUCTURING_DECL:
        final Ast.DestructuringDecl destructuring =
            (Ast.DestructuringDecl) decl;
        final Printed printed = ExpPrinter.print(destructuring.exp);
        return lines(
            words(PatPrinter.print(destructuring.pat, false), text("=")),
            printed.doc)
            .nest(ExpPrinter.INDENT);

      default:
        throw new AssertionError("unknown op " + decl.op);
    }
  }

  /** Prints a function, with its documentation, signature and
   * implementation each starting on a new line. */
  public Doc print(Ast.Function function) {
    return lines(printDocComment(function.documentation),
        printFunction(function));
  }

  /**
   * Prints a documentation comment, or returns the empty document if there
   * is none.
   */
  public Doc printDocComment(Ast.@Nullable DocComment docComment) {
    if (docComment == null) {
      return Doc.empty();
    }
    return text(docCommentFormatter.format(docComment.text, width));
  }

  /**
   * Prints a function's signature (if present) and implementation, but not
   * its documentation.
   */
  public static Doc printFunction(Ast.Function function) {
    final Doc signature = function.signature == null
        ? Doc.empty()
        : printSignature(function.signature);
    return lines(signature, printFunMatch(function.funMatch));
  }

  /** Prints a type signature, "name : type". */
  public static Doc printSignature(Ast.Signature signature) {
    return lines(words(text(signature.name), text(":")),
        TypePrinter.print(signature.type))
        .nest(ExpPrinter.INDENT)
        .group();
  }

  /**
   * Prints a function implementation, "name args =", with the body on the
   * following line.
   */
  public static Doc printFunMatch(Ast.FunMatch funMatch) {
    final List<Doc> docs = new ArrayList<>();
    docs.add(text(funMatch.name));
    for (Ast.Pat pat : funMatch.patList) {
      docs.add(PatPrinter.print(pat, false));
    }
    docs.add(text("="));
    final Printed body = ExpPrinter.print(funMatch.exp);
    return words(docs)
        .append(line())
        .append(body.doc)
        .nest(ExpPrinter.INDENT);
  }

  /** Prints "type alias Name vars =" and the type on the next line. */
  static Doc printTypeAlias(Ast.TypeAliasDecl alias) {
    final List<Doc> docs = new ArrayList<>();
    docs.add(text("type alias"));
    docs.add(text(alias.name));
    for (String tyVar : alias.tyVars) {
      docs.add(text(tyVar));
    }
    docs.add(text("="));
    return words(docs)
        .append(line())
        .append(TypePrinter.print(alias.type))
        .nest(ExpPrinter.INDENT);
  }

  /**
   * Prints a custom type, with the first constructor after "=" and each
   * subsequent constructor after "|", each on its own line.
   */
  static Doc printCustomType(Ast.CustomTypeDecl customType) {
    final List<Doc> docs = new ArrayList<>();
    docs.add(text("type"));
    docs.add(text(customType.name));
    for (String tyVar : customType.tyVars) {
      docs.add(text(tyVar));
    }
    Doc constructors =
        line().append("= ").append(printTyCon(customType.tyCons.get(0)));
    for (Ast.TyCon tyCon : skip(customType.tyCons)) {
      constructors =
          constructors.append(line()).append("| ").append(printTyCon(tyCon));
    }
    return words(docs).append(constructors.nest(ExpPrinter.INDENT));
  }

  /** Prints a type constructor, "Name arg...". */
  public static Doc printTyCon(Ast.TyCon tyCon) {
    return lines(text(tyCon.name),
        lines(transformEager(tyCon.args, TypePrinter::printArg)))
        .group()
        .nest(ExpPrinter.INDENT);
  }
}

// End DeclPrinter.java
