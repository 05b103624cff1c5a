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

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.AstNode;
import net.hydromatic.elmfmt.doc.Doc;
import net.hydromatic.elmfmt.print.DeclPrinter;
import net.hydromatic.elmfmt.print.DocCommentFormatter;
import net.hydromatic.elmfmt.print.DocCommentFormatters;
import net.hydromatic.elmfmt.print.ExpPrinter;
import net.hydromatic.elmfmt.print.ModulePrinter;
import net.hydromatic.elmfmt.print.PatPrinter;
import net.hydromatic.elmfmt.print.TypePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats Elm syntax trees as source code.
 *
 * <p>A formatter is immutable, and may be used from several threads.
 *
 * <p>For example,
 *
 * <pre>{@code
 * ElmFormatter formatter =
 *     ElmFormatter.create(ImmutableMap.of(Prop.LINE_WIDTH, 100));
 * String source = formatter.format(moduleFile);
 * }</pre>
 */
public class ElmFormatter {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ElmFormatter.class);

  /** Formatter with default values of all properties. */
  public static final ElmFormatter DEFAULT = create(ImmutableMap.of());

  private final ImmutableMap<Prop, Object> propMap;
  private final int lineWidth;
  private final DeclPrinter declPrinter;
  private final ModulePrinter modulePrinter;

  private ElmFormatter(ImmutableMap<Prop, Object> propMap,
      DocCommentFormatter docCommentFormatter) {
    this.propMap = propMap;
    this.lineWidth = Prop.LINE_WIDTH.intValue(propMap);
    this.declPrinter = new DeclPrinter(docCommentFormatter, lineWidth);
    this.modulePrinter =
        new ModulePrinter(declPrinter,
            Prop.RECOVER_DOC_COMMENTS.booleanValue(propMap));
  }

  /** Creates a formatter with given property values. Properties not in the
   * map have their default values. */
  public static ElmFormatter create(Map<Prop, Object> map) {
    final Map<Prop, Object> validated = new EnumMap<>(Prop.class);
    map.forEach((prop, value) -> prop.set(validated, value));
    final DocCommentFormatter docCommentFormatter =
        Prop.DOC_COMMENT_FORMAT.enumValue(validated,
            DocCommentFormatters.class);
    return new ElmFormatter(ImmutableMap.copyOf(validated),
        docCommentFormatter);
  }

  /** Returns a formatter that is the same as this but uses a different
   * formatter for documentation comments. */
  public ElmFormatter withDocCommentFormatter(
      DocCommentFormatter docCommentFormatter) {
    return new ElmFormatter(propMap, docCommentFormatter);
  }

  /** Returns the value of a property. */
  public Object get(Prop prop) {
    return prop.get(propMap);
  }

  /** Returns the width that this formatter tries not to exceed. */
  public int lineWidth() {
    return lineWidth;
  }

  /** Formats a source file. The result ends with a newline. */
  public String format(Ast.ModuleFile file) {
    LOGGER.debug("formatting module {} at width {}; {} imports, {} decls",
        String.join(".", file.header.moduleName), lineWidth,
        file.imports.size(), file.decls.size());
    return modulePrinter.print(file).render(lineWidth);
  }

  /**
   * Formats any node: an expression, pattern, type, declaration, or part of
   * one. The result does not end with a newline, unless the node is a file.
   */
  public String format(AstNode node) {
    if (node instanceof Ast.ModuleFile) {
      return format((Ast.ModuleFile) node);
    }
    return toDoc(node).render(lineWidth);
  }

  /** Converts a node to a document. */
  public Doc toDoc(AstNode node) {
    if (node instanceof Ast.Exp) {
      return ExpPrinter.print((Ast.Exp) node).doc;
    }
    if (node instanceof Ast.Pat) {
      return PatPrinter.print((Ast.Pat) node, true);
    }
    if (node instanceof Ast.Type) {
      return TypePrinter.print((Ast.Type) node);
    }
    if (node instanceof Ast.Decl) {
      return declPrinter.print((Ast.Decl) node);
    }
    if (node instanceof Ast.Expose) {
      return ModulePrinter.printExpose((Ast.Expose) node);
    }
    if (node instanceof Ast.Exposing) {
      return ModulePrinter.printExposing((Ast.Exposing) node);
    }
    switch (node.op) {
      case FIELD:
        return ExpPrinter.printField((Ast.Field) node, ExpPrinter.INDENT).doc;
      case MATCH:
        return ExpPrinter.printMatch((Ast.Match) node);
      case LET_FUNCTION:
      case LET_DESTRUCTURING:
        return ExpPrinter.printLetBinding((Ast.LetBinding) node,
            ExpPrinter.INDENT);
      case FIELD_TYPE:
        return TypePrinter.printField((Ast.FieldType) node);
      case FUNCTION:
        return declPrinter.print((Ast.Function) node);
      case FUN_MATCH:
        return DeclPrinter.printFunMatch((Ast.FunMatch) node);
      case SIGNATURE:
        return DeclPrinter.printSignature((Ast.Signature) node);
      case TY_CON:
        return DeclPrinter.printTyCon((Ast.TyCon) node);
      case DOC_COMMENT:
        return declPrinter.printDocComment((Ast.DocComment) node);
      case COMMENT:
        return Doc.text(((Ast.Comment) node).text);
      case MODULE:
      case PORT_MODULE:
      case EFFECT_MODULE:
        return ModulePrinter.printHeader((Ast.ModuleHeader) node);
      case IMPORT:
        return ModulePrinter.printImport((Ast.Import) node);
      case FILE:
        return modulePrinter.print((Ast.ModuleFile) node);
      default:
        throw new AssertionError("unknown op " + node.op);
    }
  }
}

// End ElmFormatter.java
