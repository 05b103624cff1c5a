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

import com.google.common.base.CharMatcher;

/** Implementations of {@link DocCommentFormatter}. */
public enum DocCommentFormatters implements DocCommentFormatter {
  /**
   * Trims the body, starts it on the line of the opening "{-|", and puts
   * the closing "-}" on a line of its own.
   *
   * <p>For example, the body " Adds one. " becomes "{-| Adds one.\n-}".
   */
  STANDARD {
    @Override
    public String format(String body, int width) {
      final String trimmed = CharMatcher.whitespace().trimFrom(body);
      if (trimmed.isEmpty()) {
        return "{-|\n-}";
      }
      return "{-| " + trimmed + "\n-}";
    }
  },

  /** Returns the body between delimiters, exactly as given. */
  VERBATIM {
    @Override
    public String format(String body, int width) {
      return "{-|" + body + "-}";
    }
  };

  /** Extracts the body of a documentation comment; the inverse of
   * {@link #VERBATIM}. */
  public static String body(String comment) {
    String s = comment;
    if (s.startsWith("{-|")) {
      s = s.substring("{-|".length());
    }
    if (s.endsWith("-}")) {
      s = s.substring(0, s.length() - "-}".length());
    }
    return s;
  }
}

// End DocCommentFormatters.java
