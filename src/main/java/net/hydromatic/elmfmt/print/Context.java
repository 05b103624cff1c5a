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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import net.hydromatic.elmfmt.ast.InfixDirection;
import net.hydromatic.elmfmt.ast.InfixOp;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Precedence context in which an expression is printed.
 *
 * <p>Contexts are created afresh at each level of the descent through the
 * tree; a printer never modifies its caller's context.
 */
public final class Context {
  /** Context at the top of an expression: the body of a declaration, a
   * branch of "if" or "case", an element of a container. */
  public static final Context TOP =
      new Context(InfixOp.APPLY_PRECEDENCE, true, false, null);

  /** Context of a function argument, and of the operand of negation or
   * field access; only atoms may appear without parentheses. */
  public static final Context ARGUMENT =
      new Context(InfixOp.APPLY_PRECEDENCE, false, false, null);

  /** Minimum precedence that an operator must have to be printed without
   * parentheses; {@link InfixOp#APPLY_PRECEDENCE} for atoms only. */
  public final int precedence;

  /** Whether the expression is at the top of an expression. */
  public final boolean top;

  /** Whether the expression is the last operand of a "<|" pipeline. */
  public final boolean leftPipe;

  /** Associativity of the enclosing operator, if the expression is its
   * operand on the side towards which it associates; otherwise null.
   *
   * <p>An operator of the same precedence may appear there without
   * parentheses only if it associates the same way. */
  public final @Nullable InfixDirection direction;

  private Context(int precedence, boolean top, boolean leftPipe,
      @Nullable InfixDirection direction) {
    checkArgument(precedence >= 0
        && precedence <= InfixOp.APPLY_PRECEDENCE);
    this.precedence = precedence;
    this.top = top;
    this.leftPipe = leftPipe;
    this.direction = direction;
  }

  /** Returns the context for an operand of an operator that binds tighter
   * than the operator. */
  public static Context operand(int precedence) {
    return new Context(precedence, false, false, null);
  }

  /** Returns the context for the operand of an operator on the side towards
   * which it associates. */
  public static Context operand(int precedence, InfixDirection direction) {
    return new Context(precedence, false, false, direction);
  }

  /** Returns the context for the final operand of a "<|" pipeline. */
  public static Context pipeTail() {
    return new Context(0, false, true, InfixDirection.RIGHT);
  }

  /** Returns whether a call to an operator needs parentheses in this
   * context. */
  boolean needsParens(int precedence, InfixDirection direction) {
    if (precedence != this.precedence) {
      return precedence < this.precedence;
    }
    return this.direction != null
        && (direction != this.direction || direction == InfixDirection.NON);
  }

  @Override
  public int hashCode() {
    return Objects.hash(precedence, top, leftPipe, direction);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Context
            && precedence == ((Context) o).precedence
            && top == ((Context) o).top
            && leftPipe == ((Context) o).leftPipe
            && direction == ((Context) o).direction;
  }

  @Override
  public String toString() {
    return "{precedence: " + precedence + ", top: " + top
        + ", leftPipe: " + leftPipe + ", direction: " + direction + "}";
  }
}

// End Context.java
