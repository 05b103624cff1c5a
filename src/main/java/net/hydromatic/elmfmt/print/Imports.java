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

import static java.lang.String.format;
import static net.hydromatic.elmfmt.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.elmfmt.ast.Ast;
import net.hydromatic.elmfmt.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes imports and exposing lists.
 *
 * <p>Imports are sorted by module name, and imports of the same module are
 * merged into one. Exposing lists are sorted and duplicates removed.
 */
public final class Imports {
  private static final Logger LOGGER = LoggerFactory.getLogger(Imports.class);

  /** Orders module names segment by segment, so that "A.B" precedes
   * "A.B.C", which precedes "AB". */
  public static final Comparator<Iterable<String>> MODULE_NAME_ORDERING =
      Ordering.<String>natural().lexicographical();

  /** Orders exposed items: operators first, then by name. A type without
   * constructors precedes the same type with constructors. */
  public static final Comparator<Ast.Expose> EXPOSE_ORDERING =
      Comparator.<Ast.Expose>comparingInt(e -> e.op == Op.INFIX_EXPOSE ? 0 : 1)
          .thenComparing(e -> e.name)
          .thenComparingInt(e -> e.op.ordinal())
          .thenComparing(e -> e instanceof Ast.TypeExpose
              && ((Ast.TypeExpose) e).open);

  private Imports() {}

  /**
   * Sorts a list of imports by module name, merging imports of the same
   * module.
   *
   * @throws FormatException if two imports of the same module have
   *     different aliases
   */
  public static List<Ast.Import> normalize(List<Ast.Import> imports) {
    final Map<List<String>, Ast.Import> map =
        new TreeMap<>(MODULE_NAME_ORDERING);
    for (Ast.Import anImport : imports) {
      final Ast.Import previous = map.get(anImport.moduleName);
      if (previous == null) {
        map.put(anImport.moduleName, anImport);
      } else {
        LOGGER.debug("merging imports of module {} at {} and {}",
            String.join(".", anImport.moduleName), previous.pos,
            anImport.pos);
        map.put(anImport.moduleName, merge(previous, anImport));
      }
    }
    final ImmutableList.Builder<Ast.Import> b = ImmutableList.builder();
    for (Ast.Import anImport : map.values()) {
      b.add(normalize(anImport));
    }
    return b.build();
  }

  /** Normalizes the exposing list of an import. Returns the import if it is
   * already normalized. */
  static Ast.Import normalize(Ast.Import anImport) {
    if (anImport.exposing == null) {
      return anImport;
    }
    final Ast.Exposing exposing = normalize(anImport.exposing);
    if (exposing == anImport.exposing) {
      return anImport;
    }
    return ast.importOf(anImport.pos, anImport.moduleName, anImport.alias,
        exposing);
  }

  /** Merges two imports of the same module. */
  static Ast.Import merge(Ast.Import import0, Ast.Import import1) {
    final @Nullable List<String> alias;
    if (import0.alias == null) {
      alias = import1.alias;
    } else if (import1.alias == null
        || import1.alias.equals(import0.alias)) {
      alias = import0.alias;
    } else {
      throw new FormatException(
          format("module %s is imported with different aliases, %s and %s",
              String.join(".", import0.moduleName),
              String.join(".", import0.alias),
              String.join(".", import1.alias)),
          import1.pos);
    }
    return ast.importOf(import0.pos.plus(import1.pos), import0.moduleName,
        alias, merge(import0.exposing, import1.exposing));
  }

  /** Merges two exposing clauses. "exposing (..)" wins over a list. */
  static Ast.@Nullable Exposing merge(Ast.@Nullable Exposing exposing0,
      Ast.@Nullable Exposing exposing1) {
    if (exposing0 == null) {
      return exposing1;
    }
    if (exposing1 == null) {
      return exposing0;
    }
    if (exposing0.op == Op.EXPOSING_ALL) {
      return exposing0;
    }
    if (exposing1.op == Op.EXPOSING_ALL) {
      return exposing1;
    }
    final List<Ast.Expose> exposes =
        new ArrayList<>(((Ast.ExposingList) exposing0).exposes);
    exposes.addAll(((Ast.ExposingList) exposing1).exposes);
    return ast.exposingList(exposing0.pos.plus(exposing1.pos), exposes);
  }

  /**
   * Sorts an exposing list and removes duplicates. Returns the argument if
   * it is already normalized.
   */
  public static Ast.Exposing normalize(Ast.Exposing exposing) {
    if (exposing.op == Op.EXPOSING_ALL) {
      return exposing;
    }
    final List<Ast.Expose> exposes = ((Ast.ExposingList) exposing).exposes;
    final List<Ast.Expose> normalized = normalizeExposes(exposes);
    if (normalized.equals(exposes)) {
      return exposing;
    }
    return ast.exposingList(exposing.pos, normalized);
  }

  /**
   * Sorts a list of exposed items and removes duplicates. If a type is
   * exposed both with and without its constructors, keeps the one with
   * constructors.
   */
  public static List<Ast.Expose> normalizeExposes(List<Ast.Expose> exposes) {
    final Map<String, Ast.Expose> map = new LinkedHashMap<>();
    for (Ast.Expose expose : exposes) {
      final String key = expose.op + ":" + expose.name;
      final Ast.Expose previous = map.get(key);
      if (previous == null || isOpenType(expose) && !isOpenType(previous)) {
        map.put(key, expose);
      }
    }
    final List<Ast.Expose> list = new ArrayList<>(map.values());
    list.sort(EXPOSE_ORDERING);
    return ImmutableList.copyOf(list);
  }

  private static boolean isOpenType(Ast.Expose expose) {
    return expose instanceof Ast.TypeExpose && ((Ast.TypeExpose) expose).open;
  }
}

// End Imports.java
