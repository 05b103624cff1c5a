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
import static net.hydromatic.elmfmt.ast.AstBuilder.ast;
import static net.hydromatic.elmfmt.doc.Doc.line;
import static net.hydromatic.elmfmt.doc.Doc.text;
import static net.hydromatic.elmfmt.doc.Doc.words;
import static net.hydromatic.elmfmt.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.doc.Doc;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a source file: the module header, documentation, imports and
 * declarations.
 *
 * <p>Imports and exposing lists are normalized (see {@link Imports}) before
 * they are printed.
 */
public class ModulePrinter {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ModulePrinter.class);

  private final DeclPrinter declPrinter;
  private final boolean recoverDocComments;

  public ModulePrinter(DeclPrinter declPrinter, boolean recoverDocComments) {
    this.declPrinter = requireNonNull(declPrinter);
    this.recoverDocComments = recoverDocComments;
  }

  /**
   * Prints a file.
   *
   * <p>The header, the module documentation, the imports and each
   * declaration are separated by a blank line. The document ends with a
   * line break.
   */
  public Doc print(Ast.ModuleFile file) {
    final List<Doc> parts = new ArrayList<>();
    parts.add(printHeader(file.header));
    if (file.documentation != null) {
      parts.add(declPrinter.printDocComment(file.documentation));
    }
    final List<Ast.Import> imports = Imports.normalize(file.imports);
    if (!imports.isEmpty()) {
      parts.add(
          Doc.join(line(),
              transformEager(imports, ModulePrinter::printImport)));
    }
    final List<Ast.Decl> decls =
        recoverDocComments ? recoverDocComments(file) : file.decls;
    for (Ast.Decl decl : decls) {
      parts.add(declPrinter.print(decl));
    }
    return ExpPrinter.doubleLines(parts).append(line());
  }

  /**
   * Returns a file's declarations, attaching documentation comments that the
   * parser left in the file's list of comments.
   *
   * <p>A documentation comment is attached to a function, type alias or
   * custom type that has no documentation, if the comment ends on the line
   * immediately before the declaration starts.
   */
  static List<Ast.Decl> recoverDocComments(Ast.ModuleFile file) {
    final List<Ast.Comment> docComments = new ArrayList<>();
    for (Ast.Comment comment : file.comments) {
      if (comment.isDocComment() && !comment.pos.isZero()) {
        docComments.add(comment);
      }
    }
    if (docComments.isEmpty()) {
      return file.decls;
    }
    final ImmutableList.Builder<Ast.Decl> b = ImmutableList.builder();
    for (Ast.Decl decl : file.decls) {
      b.add(recoverDocComment(decl, docComments));
    }
    return b.build();
  }

  private static Ast.Decl recoverDocComment(Ast.Decl decl,
      List<Ast.Comment> docComments) {
    if (decl.documentation() != null || decl.pos.isZero()) {
      return decl;
    }
    switch (decl.op) {
      case FUN_DECL:
      case TYPE_ALIAS_DECL:
      case CUSTOM_TYPE_DECL:
        break;
      default:
        return decl;
    }
    final Ast.@Nullable Comment comment =
        findPreceding(docComments, decl.pos.startLine);
    if (comment == null) {
      return decl;
    }
    LOGGER.debug("attaching documentation comment at {} to declaration at {}",
        comment.pos, decl.pos);
    return decl.copy(
        ast.docComment(comment.pos, DocCommentFormatters.body(comment.text)));
  }

  private static Ast.@Nullable Comment findPreceding(
      List<Ast.Comment> comments, int line) {
    for (Ast.Comment comment : comments) {
      if (comment.pos.endLine + 1 == line) {
        return comment;
      }
    }
    return null;
  }

  /** Prints a module header, e.g. "module Main exposing (main)". */
  public static Doc printHeader(Ast.ModuleHeader header) {
    final List<Doc> docs = new ArrayList<>();
    switch (header.op) {
      case MODULE:
        docs.add(text("module"));
        break;
      case PORT_MODULE:
        docs.add(text("port module"));
        break;
      case EFFECT_MODULE:
        docs.add(text("effect module"));
        break;
      default:
        throw new AssertionError("unknown op " + header.op);
    }
    docs.add(text(String.join(".", header.moduleName)));
    if (header.command != null || header.subscription != null) {
      final List<String> clauses = new ArrayList<>();
      if (header.command != null) {
        clauses.add("command = " + header.command);
      }
      if (header.subscription != null) {
        clauses.add("subscription = " + header.subscription);
      }
      docs.add(text("where { " + String.join(", ", clauses) + " }"));
    }
    docs.add(printExposing(Imports.normalize(header.exposing)));
    return words(docs);
  }

  /** Prints an exposing clause, e.g. "exposing (Maybe(..), map)". */
  public static Doc printExposing(Ast.Exposing exposing) {
    switch (exposing.op) {
      case EXPOSING_ALL:
        return text("exposing (..)");
      case EXPOSING_LIST:
        final List<Ast.Expose> exposes = ((Ast.ExposingList) exposing).exposes;
        return text("exposing (")
            .append(
                Doc.join(text(", "),
                    transformEager(exposes, ModulePrinter::printExpose)))
            .append(")");
      default:
        throw new AssertionError("unknown op " + exposing.op);
    }
  }

  /** Prints an exposed item, e.g. "(+)", "map", "Maybe(..)". */
  public static Doc printExpose(Ast.Expose expose) {
    switch (expose.op) {
      case INFIX_EXPOSE:
        return text("(" + expose.name + ")");
      case FUNCTION_EXPOSE:
        return text(expose.name);
      case TYPE_EXPOSE:
        return text(((Ast.TypeExpose) expose).open
            ? expose.name + "(..)"
            : expose.name);
      default:
        throw new AssertionError("unknown op " + expose.op);
    }
  }

  /** Prints an import, e.g. "import Html.Attributes as A exposing (..)". */
  public static Doc printImport(Ast.Import anImport) {
    final List<Doc> docs = new ArrayList<>();
    docs.add(text("import"));
    docs.add(text(String.join(".", anImport.moduleName)));
    if (anImport.alias != null) {
      docs.add(text("as"));
      docs.add(text(String.join(".", anImport.alias)));
    }
    if (anImport.exposing != null) {
      docs.add(printExposing(anImport.exposing));
    }
    return words(docs);
  }
}

// End ModulePrinter.java
