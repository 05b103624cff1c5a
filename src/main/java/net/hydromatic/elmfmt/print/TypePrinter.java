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

import static net.hydromatic.elmfmt.doc.Doc.line;
import static net.hydromatic.elmfmt.doc.Doc.lines;
import static net.hydromatic.elmfmt.doc.Doc.parens;
import static net.hydromatic.elmfmt.doc.Doc.separators;
import static net.hydromatic.elmfmt.doc.Doc.text;
import static net.hydromatic.elmfmt.doc.Doc.tightline;
import static net.hydromatic.elmfmt.doc.Doc.words;
import static net.hydromatic.elmfmt.util.Static.transformEager;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.Op;
import net.hydromatic.elmfmt.doc.Doc;

/** Prints type annotations. */
public final class TypePrinter {
  private TypePrinter() {}

  /**
   * Returns whether a type consists of several space-separated tokens, and
   * therefore needs parentheses when it is an argument to another type.
   *
   * <p>"a -> b" and "Maybe a" are naked compounds; "a", "Int", "( a, b )"
   * and "{ x : Int }" are not.
   */
  public static boolean isNakedCompound(Ast.Type type) {
    switch (type.op) {
      case FUNCTION_TYPE:
        return true;
      case NAMED_TYPE:
        return !((Ast.NamedType) type).args.isEmpty();
      default:
        return false;
    }
  }

  /** Prints a type at the top of a type annotation. */
  public static Doc print(Ast.Type type) {
    switch (type.op) {
      case TY_VAR:
        return text(((Ast.TyVar) type).name);

      case UNIT_TYPE:
        return text("()");

      case NAMED_TYPE:
        final Ast.NamedType namedType = (Ast.NamedType) type;
        final List<Doc> docs = new ArrayList<>();
        docs.add(text(namedType.qualifiedName()));
        for (Ast.Type arg : namedType.args) {
          docs.add(printArg(arg));
        }
        return words(docs);

      case TUPLE_TYPE:
        final List<Ast.Type> types = ((Ast.TupleType) type).types;
        return bracket("(", transformEager(types, TypePrinter::print), ")");

      case RECORD_TYPE:
        final List<Ast.FieldType> fields = ((Ast.RecordType) type).fields;
        if (fields.isEmpty()) {
          return text("{}");
        }
        return bracket("{",
            transformEager(fields, TypePrinter::printField), "}");

      case EXTENSIBLE_RECORD_TYPE:
        return printExtensibleRecord((Ast.ExtensibleRecordType) type);

      case FUNCTION_TYPE:
        return printFunction((Ast.FunctionType) type);

      default:
        throw new AssertionError("unknown op " + type.op);
    }
  }

  /**
   * Prints a type that is an argument of a named type or a type constructor,
   * wrapping it in parentheses if it is a naked compound.
   */
  public static Doc printArg(Ast.Type type) {
    final Doc doc = print(type);
    return isNakedCompound(type) ? parens(doc) : doc;
  }

  /** Prints a field of a record type, "name : type". */
  public static Doc printField(Ast.FieldType field) {
    return lines(words(text(field.name), text(":")), print(field.type))
        .nest(4)
        .group();
  }

  /**
   * Prints elements separated by commas between brackets, e.g.
   * "( a, b )"; when broken, each element starts a line with its comma, and
   * the closing bracket is on a line of its own.
   */
  private static Doc bracket(String open, List<Doc> docs, String close) {
    return text(open + " ")
        .append(separators(", ", docs))
        .append(line())
        .append(close)
        .align()
        .group();
  }

  private static Doc printExtensibleRecord(Ast.ExtensibleRecordType type) {
    Doc fields = line().append("| ").append(printField(type.fields.get(0)));
    for (Ast.FieldType field : type.fields.subList(1, type.fields.size())) {
      fields =
          fields.append(tightline()).append(", ").append(printField(field));
    }
    return text("{ " + type.tyVar)
        .append(fields.nest(4))
        .append(line())
        .append("}")
        .align()
        .group();
  }

  /**
   * Prints a function type, "a -> b -> c". Descends the right spine of the
   * tree iteratively.
   */
  private static Doc printFunction(Ast.FunctionType functionType) {
    final List<Doc> docs = new ArrayList<>();
    Ast.Type type = functionType;
    while (type.op == Op.FUNCTION_TYPE) {
      final Ast.Type paramType = ((Ast.FunctionType) type).paramType;
      final Doc paramDoc = paramType.op == Op.FUNCTION_TYPE
          ? parens(print(paramType))
          : print(paramType);
      docs.add(docs.isEmpty() ? paramDoc : words(text("->"), paramDoc));
      type = ((Ast.FunctionType) type).resultType;
    }
    docs.add(words(text("->"), print(type)));
    return lines(docs).group();
  }
}

// End TypePrinter.java
