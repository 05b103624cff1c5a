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

import com.google.common.base.Strings;
import java.util.Locale;
import net.hydromatic.elmfmt.ast.Ast;

/** Converts literal values to Elm source text. */
public final class Literals {
  private Literals() {}

  /** Converts an integer to decimal, e.g. "-42". */
  public static String intToString(long value) {
    return Long.toString(value);
  }

  /**
   * Converts an integer to hexadecimal, padding with zeros to 2, 4, 8 or 16
   * digits, whichever is the smallest that fits.
   *
   * <p>For example, 255 becomes "0xFF", 256 becomes "0x0100", and 4096
   * becomes "0x1000".
   */
  public static String hexToString(long value) {
    // Negating Long.MIN_VALUE yields Long.MIN_VALUE, whose unsigned digits
    // are those of its magnitude.
    final String digits =
        Long.toHexString(value < 0 ? -value : value).toUpperCase(Locale.ROOT);
    final int width;
    if (digits.length() <= 2) {
      width = 2;
    } else if (digits.length() <= 4) {
      width = 4;
    } else if (digits.length() <= 8) {
      width = 8;
    } else {
      width = 16;
    }
    return (value < 0 ? "-0x" : "0x") + Strings.padStart(digits, width, '0');
  }

  /**
   * Converts a floating-point number to a string that contains a decimal
   * point or an exponent, so that it reads back as a float; for example
   * "1.0", "0.5", "1.0e-7".
   */
  public static String floatToString(double value) {
    final String s = Double.toString(value);
    return s.replace('E', 'e');
  }

  /** Converts a string to a double-quoted literal, e.g. {@code "a\"b"}. */
  public static String stringToString(String s) {
    final StringBuilder b = new StringBuilder("\"");
    for (int i = 0; i < s.length(); ) {
      final int c = s.codePointAt(i);
      appendCodePoint(b, c, '"');
      i += Character.charCount(c);
    }
    return b.append('"').toString();
  }

  /** Converts a code point to a single-quoted literal, e.g. {@code 'a'}. */
  public static String charToString(int codePoint) {
    final StringBuilder b = new StringBuilder("'");
    appendCodePoint(b, codePoint, '\'');
    return b.append('\'').toString();
  }

  /**
   * Appends a code point as it appears inside a literal delimited by
   * {@code quote}.
   */
  private static void appendCodePoint(StringBuilder b, int c, char quote) {
    switch (c) {
      case '\\':
        b.append("\\\\");
        return;
      case '\n':
        b.append("\\n");
        return;
      case '\t':
        b.append("\\t");
        return;
      case '\r':
        b.append("\\r");
        return;
      default:
        if (c == quote) {
          b.append('\\').append(quote);
        } else if (Character.isISOControl(c)) {
          final String hex = Integer.toHexString(c).toUpperCase(Locale.ROOT);
          b.append("\\u{").append(Strings.padStart(hex, 4, '0')).append('}');
        } else {
          b.appendCodePoint(c);
        }
    }
  }

  /** Converts a literal expression to Elm source text. */
  public static String toString(Ast.Literal literal) {
    switch (literal.op) {
      case INT_LITERAL:
        return intToString((Long) literal.value);
      case HEX_LITERAL:
        return hexToString((Long) literal.value);
      case FLOAT_LITERAL:
        return floatToString((Double) literal.value);
      case STRING_LITERAL:
        return stringToString((String) literal.value);
      case CHAR_LITERAL:
        return charToString((Integer) literal.value);
      default:
        throw new AssertionError("unknown op " + literal.op);
    }
  }

  /** Converts a literal pattern to Elm source text. */
  public static String toString(Ast.LiteralPat literal) {
    switch (literal.op) {
      case INT_LITERAL_PAT:
        return intToString((Long) literal.value);
      case HEX_LITERAL_PAT:
        return hexToString((Long) literal.value);
      case FLOAT_LITERAL_PAT:
        return floatToString((Double) literal.value);
      case STRING_LITERAL_PAT:
        return stringToString((String) literal.value);
      case CHAR_LITERAL_PAT:
        return charToString((Integer) literal.value);
      default:
        throw new AssertionError("unknown op " + literal.op);
    }
  }
}

// End Literals.java
