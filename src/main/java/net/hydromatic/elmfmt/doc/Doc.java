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
package net.hydromatic.elmfmt.doc;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Document that can be laid out at various widths.
 *
 * <p>A document is an immutable tree of text fragments and line breaks.
 * {@link #group() Groups} mark the places where the renderer may choose
 * between laying out a sub-document on one line ("flat") or breaking all of
 * its lines. {@link #nest(int) Nesting} and {@link #align() alignment}
 * control the indentation of broken lines.
 *
 * <p>The algorithm is Wadler's "prettier printer", with Leijen's alignment
 * extension, evaluated iteratively so that deep documents do not exhaust
 * the stack.
 */
public abstract class Doc {
  private static final Doc EMPTY = new Empty();
  private static final Doc LINE = new Line(" ");
  private static final Doc TIGHTLINE = new Line("");
  private static final Doc SPACE = new Text(" ");

  final Kind kind;

  private Doc(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** The empty document. */
  public static Doc empty() {
    return EMPTY;
  }

  /**
   * Creates a document consisting of a piece of text.
   *
   * <p>The text should not contain newlines, except for blocks of
   * pre-formatted text such as documentation comments; the renderer emits
   * such text verbatim and does not indent its continuation lines.
   */
  public static Doc text(String text) {
    if (text.isEmpty()) {
      return EMPTY;
    }
    if (text.equals(" ")) {
      return SPACE;
    }
    return new Text(text);
  }

  /** A line break that is a space when laid out flat. */
  public static Doc line() {
    return LINE;
  }

  /** A line break that is nothing when laid out flat. */
  public static Doc tightline() {
    return TIGHTLINE;
  }

  /** Returns whether this is the empty document. */
  public boolean isEmpty() {
    return kind == Kind.EMPTY;
  }

  /** Returns a document that is this document followed by another. */
  public Doc append(Doc doc) {
    if (doc.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return doc;
    }
    return new Concat(this, doc);
  }

  /** Returns a document that is this document followed by some text. */
  public Doc append(String text) {
    return append(text(text));
  }

  /**
   * Returns a document whose broken lines are indented {@code indent} more
   * spaces than the enclosing document.
   */
  public Doc nest(int indent) {
    if (indent == 0 || isEmpty()) {
      return this;
    }
    return new Nest(indent, this);
  }

  /**
   * Returns a document whose broken lines are indented to the column at
   * which the document starts.
   */
  public Doc align() {
    if (isEmpty() || kind == Kind.ALIGN) {
      return this;
    }
    return new Align(this);
  }

  /**
   * Returns a document that is laid out flat if it fits in the remaining
   * width, otherwise with all of its own lines broken.
   */
  public Doc group() {
    if (isEmpty() || kind == Kind.GROUP) {
      return this;
    }
    return new Group(this);
  }

  //~ Combinators -------------------------------------------------------------

  /** Joins documents with a separator; empty documents are skipped. */
  public static Doc join(Doc separator, Iterable<Doc> docs) {
    Doc result = EMPTY;
    boolean first = true;
    for (Doc doc : docs) {
      if (doc.isEmpty()) {
        continue;
      }
      if (!first) {
        result = result.append(separator);
      }
      result = result.append(doc);
      first = false;
    }
    return result;
  }

  /** Joins documents with {@link #line()}. */
  public static Doc lines(Iterable<Doc> docs) {
    return join(LINE, docs);
  }

  /** Joins documents with {@link #line()}. */
  public static Doc lines(Doc... docs) {
    return lines(ImmutableList.copyOf(docs));
  }

  /** Joins documents with a single space. */
  public static Doc words(Iterable<Doc> docs) {
    return join(SPACE, docs);
  }

  /** Joins documents with a single space. */
  public static Doc words(Doc... docs) {
    return words(ImmutableList.copyOf(docs));
  }

  /**
   * Joins documents with a separator that, when the line is broken, starts
   * the next line; for example {@code separators(", ", [a, b, c])} is
   * "a, b, c" when flat, and when broken is
   *
   * <pre>{@code
   * a
   * , b
   * , c
   * }</pre>
   */
  public static Doc separators(String separator, Iterable<Doc> docs) {
    return join(TIGHTLINE.append(text(separator)), docs);
  }

  /** Surrounds a document with a prefix and a suffix. */
  public static Doc surround(Doc left, Doc right, Doc doc) {
    return left.append(doc).append(right);
  }

  /** Surrounds a document with parentheses. */
  public static Doc parens(Doc doc) {
    return surround(text("("), text(")"), doc);
  }

  /**
   * Indents a document by {@code indent} spaces, including its first line,
   * relative to the current column.
   */
  public static Doc indent(int indent, Doc doc) {
    checkArgument(indent >= 0, "negative indent");
    return text(Strings.repeat(" ", indent)).append(doc).nest(indent).align();
  }

  /**
   * Aligns a document at the current column, and indents its broken lines
   * after the first by {@code indent} more spaces.
   */
  public static Doc hang(int indent, Doc doc) {
    return doc.nest(indent).align();
  }

  //~ Rendering ---------------------------------------------------------------

  /** Renders this document, trying not to exceed a given line width. */
  public String render(int width) {
    final StringBuilder buf = new StringBuilder();
    final Deque<Cmd> stack = new ArrayDeque<>();
    stack.push(new Cmd(0, false, this));
    int column = 0;
    boolean pendingIndent = false;
    while (!stack.isEmpty()) {
      final Cmd cmd = stack.pop();
      switch (cmd.doc.kind) {
        case EMPTY:
          break;

        case TEXT:
        case LINE:
          final String text;
          if (cmd.doc.kind == Kind.TEXT) {
            text = ((Text) cmd.doc).text;
          } else if (cmd.flat) {
            text = ((Line) cmd.doc).flat;
          } else {
            trimTrailingSpaces(buf);
            buf.append('\n');
            column = cmd.indent;
            pendingIndent = true;
            break;
          }
          if (text.isEmpty()) {
            break;
          }
          if (pendingIndent) {
            buf.append(Strings.repeat(" ", column));
            pendingIndent = false;
          }
          final int newline = text.lastIndexOf('\n');
          if (newline < 0) {
            buf.append(text);
            column += text.length();
          } else {
            appendBlock(buf, text);
            column = text.length() - newline - 1;
          }
          break;

        case CONCAT:
          final Concat concat = (Concat) cmd.doc;
          stack.push(new Cmd(cmd.indent, cmd.flat, concat.right));
          stack.push(new Cmd(cmd.indent, cmd.flat, concat.left));
          break;

        case NEST:
          final Nest nest = (Nest) cmd.doc;
          stack.push(new Cmd(cmd.indent + nest.indent, cmd.flat, nest.doc));
          break;

        case ALIGN:
          stack.push(new Cmd(column, cmd.flat, ((Align) cmd.doc).doc));
          break;

        case GROUP:
          final Doc doc = ((Group) cmd.doc).doc;
          if (cmd.flat) {
            stack.push(new Cmd(cmd.indent, true, doc));
          } else {
            final Cmd flatCmd = new Cmd(cmd.indent, true, doc);
            if (fits(width - column, flatCmd, stack)) {
              stack.push(flatCmd);
            } else {
              stack.push(new Cmd(cmd.indent, false, doc));
            }
          }
          break;

        default:
          throw new AssertionError("unknown kind " + cmd.doc.kind);
      }
    }
    trimTrailingSpaces(buf);
    return buf.toString();
  }

  /** Appends a block of text that contains newlines, trimming each line. */
  private static void appendBlock(StringBuilder buf, String text) {
    int start = 0;
    for (;;) {
      final int newline = text.indexOf('\n', start);
      if (newline < 0) {
        buf.append(text, start, text.length());
        return;
      }
      buf.append(text, start, newline);
      trimTrailingSpaces(buf);
      buf.append('\n');
      start = newline + 1;
    }
  }

  /** Removes spaces at the end of the buffer, back to the last newline. */
  private static void trimTrailingSpaces(StringBuilder buf) {
    int n = buf.length();
    while (n > 0 && buf.charAt(n - 1) == ' ') {
      --n;
    }
    buf.setLength(n);
  }

  /**
   * Returns whether a command, laid out flat, followed by the remaining
   * commands up to the next line break, fits in {@code remaining} columns.
   */
  private static boolean fits(int remaining, Cmd first, Deque<Cmd> rest) {
    final Deque<Cmd> local = new ArrayDeque<>();
    local.push(first);
    final Iterator<Cmd> restIterator = rest.iterator();
    for (;;) {
      if (remaining < 0) {
        return false;
      }
      final Cmd cmd;
      if (!local.isEmpty()) {
        cmd = local.pop();
      } else if (restIterator.hasNext()) {
        cmd = restIterator.next();
      } else {
        return true;
      }
      switch (cmd.doc.kind) {
        case EMPTY:
          break;

        case TEXT:
          final String text = ((Text) cmd.doc).text;
          final int newline = text.indexOf('\n');
          if (newline >= 0) {
            return remaining - newline >= 0;
          }
          remaining -= text.length();
          break;

        case LINE:
          if (!cmd.flat) {
            return true;
          }
          remaining -= ((Line) cmd.doc).flat.length();
          break;

        case CONCAT:
          final Concat concat = (Concat) cmd.doc;
          local.push(new Cmd(cmd.indent, cmd.flat, concat.right));
          local.push(new Cmd(cmd.indent, cmd.flat, concat.left));
          break;

        case NEST:
          local.push(new Cmd(cmd.indent, cmd.flat, ((Nest) cmd.doc).doc));
          break;

        case ALIGN:
          local.push(new Cmd(cmd.indent, cmd.flat, ((Align) cmd.doc).doc));
          break;

        case GROUP:
          local.push(new Cmd(cmd.indent, cmd.flat, ((Group) cmd.doc).doc));
          break;

        default:
          throw new AssertionError("unknown kind " + cmd.doc.kind);
      }
    }
  }

  /** Kind of document. */
  enum Kind {
    EMPTY, TEXT, LINE, CONCAT, NEST, ALIGN, GROUP
  }

  /** Instruction to lay out a document at a given indent, flat or broken. */
  private static class Cmd {
    final int indent;
    final boolean flat;
    final Doc doc;

    Cmd(int indent, boolean flat, Doc doc) {
      this.indent = indent;
      this.flat = flat;
      this.doc = doc;
    }
  }

  /** The empty document. */
  private static class Empty extends Doc {
    Empty() {
      super(Kind.EMPTY);
    }
  }

  /** Text. */
  private static class Text extends Doc {
    final String text;

    Text(String text) {
      super(Kind.TEXT);
      this.text = requireNonNull(text);
    }
  }

  /** Line break; {@link #flat} is what it becomes when laid out flat. */
  private static class Line extends Doc {
    final String flat;

    Line(String flat) {
      super(Kind.LINE);
      this.flat = requireNonNull(flat);
    }
  }

  /** Concatenation of two documents. */
  private static class Concat extends Doc {
    final Doc left;
    final Doc right;

    Concat(Doc left, Doc right) {
      super(Kind.CONCAT);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }
  }

  /** Increases the indentation of broken lines. */
  private static class Nest extends Doc {
    final int indent;
    final Doc doc;

    Nest(int indent, Doc doc) {
      super(Kind.NEST);
      this.indent = indent;
      this.doc = requireNonNull(doc);
    }
  }

  /** Sets the indentation of broken lines to the current column. */
  private static class Align extends Doc {
    final Doc doc;

    Align(Doc doc) {
      super(Kind.ALIGN);
      this.doc = requireNonNull(doc);
    }
  }

  /** Chooses between flat and broken layout. */
  private static class Group extends Doc {
    final Doc doc;

    Group(Doc doc) {
      super(Kind.GROUP);
      this.doc = requireNonNull(doc);
    }
  }
}

// End Doc.java
