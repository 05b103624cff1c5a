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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.elmfmt.print.DocCommentFormatters;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls formatting.
 *
 * @see ElmFormatter#create(Map)
 */
public enum Prop {
  /**
   * Enum property "docCommentFormat" controls how the bodies of
   * documentation comments are laid out. Default is
   * {@link DocCommentFormatters#STANDARD STANDARD}.
   */
  DOC_COMMENT_FORMAT("docCommentFormat", DocCommentFormatters.class, true,
      DocCommentFormatters.STANDARD),

  /**
   * Integer property "lineWidth" is the width that the formatter tries not
   * to exceed. Default is 80.
   *
   * <p>Some constructs, such as long string literals, may exceed the width.
   */
  LINE_WIDTH("lineWidth", Integer.class, true, 80),

  /**
   * Boolean property "recoverDocComments" controls whether a documentation
   * comment that the parser did not attach to a declaration, but that ends
   * on the line immediately before the declaration, becomes the
   * declaration's documentation. Default is true.
   */
  RECOVER_DOC_COMMENTS("recoverDocComments", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    checkArgument(prop != null, "property %s not found", propName);
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    return type.cast(get(map));
  }

  /**
   * Sets the value of a property, converting strings to the property's type.
   * Allows values read from a properties file or command line, such as
   * "120", "false" or "verbatim".
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type.isEnum()) {
        final Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          final String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException(
              "value must be one of: " + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s.trim()));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be an integer", e);
        }
        return;
      }
      if (type == Boolean.class) {
        final String lower = s.trim().toLowerCase(Locale.ROOT);
        checkArgument(lower.equals("true") || lower.equals("false"),
            "value for property %s must be true or false", camelName);
        set(map, Boolean.valueOf(lower));
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      checkArgument(!required, "property %s is required", camelName);
      map.remove(this);
    } else {
      checkArgument(type.isInstance(value),
          "value for property %s must have type %s", camelName, type);
      if (this == LINE_WIDTH) {
        checkArgument((Integer) value > 0, "line width must be positive");
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
