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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;

/**
 * Assignment of truth values to variables.
 *
 * <p>Every key is a valid variable name. A model may assign more variables
 * than a formula uses; it may not assign fewer.
 */
public class Model {
  public static final Model EMPTY = new Model(ImmutableMap.of());

  private final ImmutableMap<String, Boolean> map;

  private Model(ImmutableMap<String, Boolean> map) {
    this.map = map;
  }

  /** Creates a model from a map. Throws if any key is not a variable name. */
  public static Model of(Map<String, Boolean> map) {
    map.keySet()
        .forEach(
            name ->
                checkArgument(isVariable(name), "not a variable: %s", name));
    return new Model(ImmutableMap.copyOf(map));
  }

  /** Creates a model with one variable. */
  public static Model of(String name, boolean value) {
    return of(ImmutableMap.of(name, value));
  }

  /** Creates a model with two variables. */
  public static Model of(String name0, boolean value0, String name1,
      boolean value1) {
    return of(ImmutableMap.of(name0, value0, name1, value1));
  }

  /**
   * Creates a model from a list of variables and a list of values of the
   * same length.
   */
  public static Model zip(List<String> names, List<Boolean> values) {
    checkArgument(
        names.size() == values.size(),
        "%s variables but %s values",
        names.size(),
        values.size());
    final ImmutableMap.Builder<String, Boolean> b =
        ImmutableMap.builderWithExpectedSize(names.size());
    for (int i = 0; i < names.size(); i++) {
      b.put(names.get(i), values.get(i));
    }
    return of(b.build());
  }

  /** Returns whether every key of a map is a variable name. */
  public static boolean isModel(Map<String, Boolean> map) {
    return map.keySet().stream().allMatch(name -> isVariable(name));
  }

  /** Returns the variables assigned by this model. */
  public ImmutableSet<String> variables() {
    return map.keySet();
  }

  /** Returns whether this model assigns every one of the given variables. */
  public boolean covers(Iterable<String> names) {
    for (String name : names) {
      if (!map.containsKey(name)) {
        return false;
      }
    }
    return true;
  }

  /** Returns the value of a variable. Throws if the variable is unassigned. */
  public boolean get(String name) {
    final Boolean value = map.get(name);
    checkArgument(value != null, "variable %s is not in model %s", name, this);
    return value;
  }

  /**
   * Returns a model that is the same as this but with one more variable.
   * Throws if the variable is already assigned.
   */
  public Model plus(String name, boolean value) {
    checkArgument(
        !map.containsKey(name), "variable %s is already in model", name);
    return of(
        ImmutableMap.<String, Boolean>builder()
            .putAll(map)
            .put(name, value)
            .build());
  }

  /** Returns the contents of this model as a map. */
  public ImmutableMap<String, Boolean> asMap() {
    return map;
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Model && map.equals(((Model) o).map);
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End Model.java
