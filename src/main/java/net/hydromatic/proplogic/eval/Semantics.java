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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import java.util.Collections;
import java.util.List;
import net.hydromatic.proplogic.ast.Ast;
import net.hydromatic.proplogic.ast.Formula;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Evaluation of formulas, and enumeration of models. */
public class Semantics {
  private Semantics() {}

  /** Maximum number of variables whose models can be enumerated; the
   * number of models must fit in an {@code int}. */
  public static final int MAX_VARIABLES = 30;

  private static final ImmutableList<Boolean> FALSE_TRUE =
      ImmutableList.of(false, true);

  /**
   * Returns the value of a formula in a model.
   *
   * @throws IllegalArgumentException if the model does not assign a value to
   *     every variable of the formula
   */
  public static boolean evaluate(Formula formula, Model model) {
    checkArgument(
        model.covers(formula.variables()),
        "model %s does not cover the variables %s of formula %s",
        model,
        formula.variables(),
        formula);
    return evaluate_(formula, model);
  }

  private static boolean evaluate_(Formula formula, Model model) {
    switch (formula.op) {
      case VARIABLE:
        return model.get(((Ast.Variable) formula).name);
      case TRUE:
        return true;
      case FALSE:
        return false;
      case NOT:
        return !evaluate_(((Ast.Unary) formula).operand, model);
      default:
        break;
    }
    final Ast.Binary binary = (Ast.Binary) formula;
    final boolean left = evaluate_(binary.left, model);
    final boolean right = evaluate_(binary.right, model);
    switch (formula.op) {
      case AND:
        return left && right;
      case OR:
        return left || right;
      case IMPLIES:
        return !left || right;
      case XOR:
        return left != right;
      case IFF:
        return left == right;
      case NAND:
        return !(left && right);
      case NOR:
        return !(left || right);
      default:
        throw new AssertionError("unknown operator " + formula.op);
    }
  }

  /**
   * Returns all models over a list of variables.
   *
   * <p>The models are generated in the order of counting in binary, where
   * false is 0, true is 1, and the first variable is the most significant
   * bit. Thus for {@code [p, q]} the models are
   * {@code {p=false, q=false}}, {@code {p=false, q=true}},
   * {@code {p=true, q=false}}, {@code {p=true, q=true}}.
   *
   * <p>An empty list of variables yields one model, the empty model.
   *
   * <p>The models are computed lazily, as the result is iterated.
   *
   * @throws IllegalArgumentException if there are more than
   *     {@link #MAX_VARIABLES} variables
   */
  public static Iterable<Model> allModels(List<String> variables) {
    variables.forEach(
        name -> checkArgument(isVariable(name), "not a variable: %s", name));
    final ImmutableList<String> names = ImmutableList.copyOf(variables);
    checkArgument(
        ImmutableSet.copyOf(names).size() == names.size(),
        "duplicate variable in %s",
        names);
    checkArgument(
        names.size() <= MAX_VARIABLES,
        "cannot enumerate models of %s variables; at most %s are allowed",
        names.size(),
        MAX_VARIABLES);
    final List<List<Boolean>> valueLists =
        Collections.nCopies(names.size(), FALSE_TRUE);
    return Iterables.transform(
        Lists.cartesianProduct(valueLists), values -> Model.zip(names, values));
  }

  /** Returns the values of a formula in each of a sequence of models.
   * Computed lazily. */
  public static Iterable<Boolean> truthValues(
      Formula formula, Iterable<Model> models) {
    return Iterables.transform(models, model -> evaluate(formula, model));
  }

  /** Returns the models over the variables of a formula, sorted by name. */
  static Iterable<Model> allModels(Formula formula) {
    return allModels(formula.variables().asList());
  }

  /** Returns whether a formula is true in every model. */
  public static boolean isTautology(Formula formula) {
    for (Model model : allModels(formula)) {
      if (!evaluate(formula, model)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether a formula is false in every model. */
  public static boolean isContradiction(Formula formula) {
    return satisfyingModel(formula) == null;
  }

  /** Returns whether a formula is true in at least one model. */
  public static boolean isSatisfiable(Formula formula) {
    return satisfyingModel(formula) != null;
  }

  /**
   * Returns the first model, in the order of {@link #allModels(List)} over
   * the sorted variables, in which a formula is true, or null if there is no
   * such model.
   */
  public static @Nullable Model satisfyingModel(Formula formula) {
    for (Model model : allModels(formula)) {
      if (evaluate(formula, model)) {
        return model;
      }
    }
    return null;
  }
}

// End Semantics.java
