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

import net.hydromatic.elmfmt.doc.Doc;

/**
 * Document printed for a sub-tree, and whether it must be broken over
 * several lines.
 *
 * <p>{@link #alwaysBreak} propagates upwards: a printer that contains a
 * sub-tree that always breaks must itself always break, and so must not
 * {@link Doc#group() group} its layout.
 */
public final class Printed {
  public final Doc doc;
  public final boolean alwaysBreak;

  private Printed(Doc doc, boolean alwaysBreak) {
    this.doc = requireNonNull(doc);
    this.alwaysBreak = alwaysBreak;
  }

  /** Creates a document that may be laid out on one line. */
  public static Printed of(Doc doc) {
    return new Printed(doc, false);
  }

  public static Printed of(Doc doc, boolean alwaysBreak) {
    return new Printed(doc, alwaysBreak);
  }

  /** Creates a document that must be laid out on several lines. */
  public static Printed broken(Doc doc) {
    return new Printed(doc, true);
  }

  /** Returns a document with the same break flag and a different layout. */
  public Printed withDoc(Doc doc) {
    return doc == this.doc ? this : new Printed(doc, alwaysBreak);
  }

  /**
   * Groups a document, unless it must always break, in which case its lines
   * are always broken.
   */
  static Doc optionalGroup(boolean alwaysBreak, Doc doc) {
    return alwaysBreak ? doc : doc.group();
  }

  /** Returns whether any of a list of printed documents always breaks. */
  static boolean anyBreak(Iterable<Printed> printeds) {
    for (Printed printed : printeds) {
      if (printed.alwaysBreak) {
        return true;
      }
    }
    return false;
  }
}

// End Printed.java
