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

import com.google.common.collect.ImmutableMap;

/**
 * Infix operators whose precedence is known to the printer.
 *
 * <p>Precedence runs from 0 (pipes, binds loosest) to 9 (function
 * composition, binds tightest). Function application binds tighter than any
 * infix operator; see {@link #APPLY_PRECEDENCE}.
 */
public enum InfixOp {
  COMPOSE_LEFT("<<", 9, InfixDirection.LEFT),
  COMPOSE_RIGHT(">>", 9, InfixDirection.RIGHT),
  POWER("^", 8, InfixDirection.RIGHT),
  QUERY("<?>", 8, InfixDirection.LEFT),
  TIMES("*", 7, InfixDirection.LEFT),
  DIVIDE("/", 7, InfixDirection.LEFT),
  INT_DIVIDE("//", 7, InfixDirection.LEFT),
  SLASH("</>", 7, InfixDirection.RIGHT),
  PLUS("+", 6, InfixDirection.LEFT),
  MINUS("-", 6, InfixDirection.LEFT),
  IGNORE("|.", 6, InfixDirection.LEFT),
  APPEND("++", 5, InfixDirection.RIGHT),
  CONS("::", 5, InfixDirection.RIGHT),
  KEEP("|=", 5, InfixDirection.LEFT),
  EQ("==", 4, InfixDirection.NON),
  NE("/=", 4, InfixDirection.NON),
  LT("<", 4, InfixDirection.NON),
  GT(">", 4, InfixDirection.NON),
  LE("<=", 4, InfixDirection.NON),
  GE(">=", 4, InfixDirection.NON),
  AND("&&", 3, InfixDirection.RIGHT),
  OR("||", 2, InfixDirection.RIGHT),
  PIPE_RIGHT("|>", 0, InfixDirection.LEFT),
  PIPE_LEFT("<|", 0, InfixDirection.RIGHT);

  /** Precedence of function application. */
  public static final int APPLY_PRECEDENCE = 11;

  /** Symbol of the operator that the printer lays out as a hanging pipe. */
  public static final String PIPE_LEFT_SYMBOL = "<|";

  public final String symbol;
  public final int precedence;
  public final InfixDirection direction;

  public static final ImmutableMap<String, InfixOp> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, InfixOp> b = ImmutableMap.builder();
    for (InfixOp op : values()) {
      b.put(op.symbol, op);
    }
    BY_SYMBOL = b.build();
  }

  InfixOp(String symbol, int precedence, InfixDirection direction) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.direction = direction;
  }

  /** Returns the precedence of an operator; 0 if the operator is unknown. */
  public static int precedence(String symbol) {
    final InfixOp op = BY_SYMBOL.get(symbol);
    return op == null ? 0 : op.precedence;
  }

  /**
   * Returns the associativity of an operator; {@link InfixDirection#LEFT} if
   * the operator is unknown.
   */
  public static InfixDirection direction(String symbol) {
    final InfixOp op = BY_SYMBOL.get(symbol);
    return op == null ? InfixDirection.LEFT : op.direction;
  }
}

// End InfixOp.java
