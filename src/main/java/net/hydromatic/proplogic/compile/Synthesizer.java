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
package net.hydromatic.proplogic.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.proplogic.ast.FormulaBuilder.ast;
import static net.hydromatic.proplogic.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.eval.Model;
import net.hydromatic.proplogic.eval.Semantics;

/**
 * Synthesizes formulas that have a given truth table.
 *
 * <p>The truth table is a list of values, one for each model generated by
 * {@link Semantics#allModels(List)} for the variables, in that order.
 */
public class Synthesizer {
  private Synthesizer() {}

  /**
   * Returns a formula in disjunctive normal form (an OR of ANDs of literals)
   * that has the given truth table.
   *
   * <p>For example, over variables [p, q] the values [T, T, T, F] give
   * {@code (((~p&~q)|(~p&q))|(p&~q))}.
   *
   * <p>If no value is true, returns a contradiction built from the first
   * variable, such as {@code (~p&p)}.
   */
  public static Formula synthesizeDnf(
      List<String> variables, List<Boolean> values) {
    final List<Formula> clauses = new ArrayList<>();
    forEachRow(variables, values, (model, value) -> {
      if (value) {
        clauses.add(clause(model, Op.AND, true));
      }
    });
    if (clauses.isEmpty()) {
      final Formula v = ast.variable(variables.get(0));
      return ast.and(ast.not(v), v);
    }
    return ast.foldLeft(Op.OR, clauses);
  }

  /**
   * Returns a formula in conjunctive normal form (an AND of ORs of literals)
   * that has the given truth table.
   *
   * <p>Each false row contributes a clause that is false in that row's
   * model and true in every other model.
   *
   * <p>If no value is false, returns a tautology built from the first
   * variable, such as {@code (p|~p)}.
   */
  public static Formula synthesizeCnf(
      List<String> variables, List<Boolean> values) {
    final List<Formula> clauses = new ArrayList<>();
    forEachRow(variables, values, (model, value) -> {
      if (!value) {
        clauses.add(clause(model, Op.OR, false));
      }
    });
    if (clauses.isEmpty()) {
      final Formula v = ast.variable(variables.get(0));
      return ast.or(v, ast.not(v));
    }
    return ast.foldLeft(Op.AND, clauses);
  }

  /** Calls an action for each model over the variables and its value. */
  private static void forEachRow(List<String> variables, List<Boolean> values,
      RowConsumer consumer) {
    checkArgument(!variables.isEmpty(), "at least one variable is required");
    checkArgument(
        variables.size() < Integer.SIZE - 1
            && values.size() == 1 << variables.size(),
        "expected 2^%s values for %s, got %s",
        variables.size(),
        variables,
        values.size());
    final Iterator<Boolean> valueIterator = values.iterator();
    for (Model model : Semantics.allModels(variables)) {
      consumer.accept(model, valueIterator.next());
    }
  }

  /**
   * Creates a clause from the literals of a model, in ascending order of
   * variable name. If {@code positive}, a variable that is true in the model
   * becomes a positive literal; otherwise it becomes a negated literal.
   */
  private static Formula clause(Model model, Op op, boolean positive) {
    final List<String> names =
        ImmutableSortedSet.copyOf(model.variables()).asList();
    final ImmutableList<Formula> literals =
        transformEager(names, name -> {
          final Formula v = ast.variable(name);
          return model.get(name) == positive ? v : ast.not(v);
        });
    return ast.foldLeft(op, literals);
  }

  /** Action on one row of a truth table. */
  @FunctionalInterface
  private interface RowConsumer {
    void accept(Model model, boolean value);
  }
}

// End Synthesizer.java
