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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),
  RECORD_SELECTOR(true),
  PREFIX_OPERATOR(true),
  OPERATOR,

  // literals
  UNIT(true),
  CHAR_LITERAL(true),
  INT_LITERAL(true),
  HEX_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),
  /** Embedded shader source. Printed as a placeholder; lossy. */
  GLSL(true),

  // compound expressions
  APPLY,
  INFIX,
  NEGATE(true),
  TUPLE(true),
  LIST(true),
  RECORD(true),
  RECORD_ACCESS(true),
  RECORD_UPDATE(true),
  PARENS(true),

  // block expressions; they extend as far to the right as possible, so they
  // need parentheses everywhere except at the top of an expression
  IF,
  LET,
  CASE,
  FN,

  // parts of expressions
  FIELD,
  MATCH,
  LET_FUNCTION,
  LET_DESTRUCTURING,

  // patterns
  WILDCARD_PAT(true),
  UNIT_PAT(true),
  CHAR_LITERAL_PAT(true),
  STRING_LITERAL_PAT(true),
  INT_LITERAL_PAT(true),
  HEX_LITERAL_PAT(true),
  FLOAT_LITERAL_PAT(true),
  ID_PAT(true),
  TUPLE_PAT(true),
  RECORD_PAT(true),
  LIST_PAT(true),
  CONS_PAT,
  CON_PAT,
  AS_PAT,
  PARENS_PAT(true),

  // types
  TY_VAR(true),
  NAMED_TYPE,
  UNIT_TYPE(true),
  TUPLE_TYPE(true),
  RECORD_TYPE(true),
  EXTENSIBLE_RECORD_TYPE(true),
  FUNCTION_TYPE,
  FIELD_TYPE,

  // declarations
  FUN_DECL,
  TYPE_ALIAS_DECL,
  CUSTOM_TYPE_DECL,
  PORT_DECL,
  INFIX_DECL,
  DESTRUCTURING_DECL,

  // parts of declarations
  FUNCTION,
  FUN_MATCH,
  SIGNATURE,
  TY_CON,
  DOC_COMMENT,
  COMMENT,

  // modules
  MODULE,
  PORT_MODULE,
  EFFECT_MODULE,
  IMPORT,
  EXPOSING_ALL,
  EXPOSING_LIST,
  INFIX_EXPOSE,
  FUNCTION_EXPOSE,
  TYPE_EXPOSE,
  FILE;

  /**
   * Whether a node of this kind is self-delimiting: it never needs
   * parentheses, whatever context it appears in.
   */
  public final boolean atom;

  Op() {
    this(false);
  }

  Op(boolean atom) {
    this.atom = atom;
  }

  /**
   * Returns whether this is a block expression ("if", "let", "case" or a
   * lambda).
   */
  public boolean isBlock() {
    switch (this) {
      case IF:
      case LET:
      case CASE:
      case FN:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
