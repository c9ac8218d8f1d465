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
package net.hydromatic.proplogic.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.proplogic.ast.Ast.isVariable;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>A configuration is a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 */
public enum Prop {
  /**
   * String property "constantVariable" is the variable that operator rewrites
   * use to build a tautology or contradiction when they eliminate the
   * constants "T" and "F". Must be a valid variable name. Default is "p".
   */
  CONSTANT_VARIABLE("constantVariable", String.class, true, "p"),

  /**
   * Integer property "cellPadding" is the number of spaces on each side of a
   * cell when printing a truth table. Default is 1.
   */
  CELL_PADDING("cellPadding", Integer.class, true, 1);

  /** Prefix of the system properties read by {@link #fromSystemProperties}. */
  public static final String SYSTEM_PREFIX = "proplogic.";

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
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

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException(
          "property " + propName + " not found");
    }
    return prop;
  }

  /**
   * Creates a configuration from the system properties whose names are
   * {@link #SYSTEM_PREFIX} followed by a property's camel name; for example,
   * "-Dproplogic.cellPadding=2".
   */
  public static Map<Prop, Object> fromSystemProperties() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    for (Prop prop : BY_CAMEL_NAME) {
      final String value = System.getProperty(SYSTEM_PREFIX + prop.camelName);
      if (value != null) {
        prop.setLenient(map, value);
      }
    }
    return map;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, allowing a string for an integer
   * property.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == Integer.class && value instanceof String) {
      final int i;
      try {
        i = Integer.parseInt(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must be an integer: "
                + value,
            e);
      }
      set(map, i);
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type and value are
   * valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException(
            "property " + camelName + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must have type " + type);
      }
      checkArgument(
          isValid(value),
          "invalid value '%s' for property %s",
          value,
          camelName);
      map.put(this, value);
    }
  }

  private boolean isValid(Object value) {
    switch (this) {
      case CONSTANT_VARIABLE:
        return isVariable((String) value);
      case CELL_PADDING:
        return (Integer) value >= 0;
      default:
        return true;
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
