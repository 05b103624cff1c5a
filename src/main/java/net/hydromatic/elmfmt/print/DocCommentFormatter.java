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

/**
 * Formats the body of a documentation comment.
 *
 * @see DocCommentFormatters
 */
public interface DocCommentFormatter {
  /**
   * Converts the body of a documentation comment into the text of the
   * comment, including the "{-|" and "-}" delimiters. The printer inserts
   * the result verbatim.
   *
   * @param body Body of the comment, without delimiters
   * @param width Target line width
   * @return Text of the comment
   */
  String format(String body, int width);
}

// End DocCommentFormatter.java
