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
package net.hydromatic.proplogic.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.proplogic.ast.Ast.isVariable;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.Map;

/**
 * Propositional formula.
 *
 * <p>A formula is an immutable tree. Its sub-classes, in {@link Ast}, are a
 * closed set: {@link Ast.Variable}, {@link Ast.Constant}, {@link Ast.Unary}
 * and {@link Ast.Binary}. Use {@link FormulaBuilder#ast} to create them.
 *
 * <p>Two formulas are equal if and only if their canonical text is equal.
 * The canonical text, the set of free variables and the set of operators are
 * computed when the node is created.
 */
public abstract class Formula {
  public final Op op;
  private final String text;
  private final ImmutableSortedSet<String> variables;
  private final ImmutableSet<Op> operators;

  Formula(
      Op op,
      String text,
      ImmutableSortedSet<String> variables,
      ImmutableSet<Op> operators) {
    this.op = requireNonNull(op);
    this.text = requireNonNull(text);
    this.variables = requireNonNull(variables);
    this.operators = requireNonNull(operators);
  }

  /**
   * Returns the canonical text of this formula.
   *
   * <p>Binary operators are always fully parenthesized, so parsing the result
   * yields an equal formula.
   */
  @Override
  public final String toString() {
    return text;
  }

  @Override
  public final int hashCode() {
    return text.hashCode();
  }

  @Override
  public final boolean equals(Object o) {
    return o == this
        || o instanceof Formula && text.equals(((Formula) o).text);
  }

  /** Returns the names of the variables in this formula, sorted. */
  public final ImmutableSortedSet<String> variables() {
    return variables;
  }

  /**
   * Returns the operators used in this formula. Constants count as operators;
   * variables do not.
   */
  public final ImmutableSet<Op> operators() {
    return operators;
  }

  /** Returns the operands of this formula; empty for atoms. */
  public abstract List<Formula> args();

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the type of this node, and returning the result.
   */
  public abstract Formula accept(Shuttle shuttle);

  /**
   * Replaces variables by formulas.
   *
   * <p>Every occurrence of a variable that is a key in the map is replaced by
   * the corresponding formula. Replacement is simultaneous: a formula that
   * has been substituted in is not itself substituted into.
   */
  public Formula substituteVariables(Map<String, Formula> substitutions) {
    final ImmutableMap<String, Formula> map =
        ImmutableMap.copyOf(substitutions);
    map.keySet()
        .forEach(
            name ->
                checkArgument(isVariable(name), "not a variable: %s", name));
    if (map.isEmpty()) {
      return this;
    }
    return accept(
        new Shuttle() {
          @Override
          protected Formula visit(Ast.Variable variable) {
            final Formula formula = map.get(variable.name);
            return formula != null ? formula : variable;
          }
        });
  }

  /**
   * Replaces operators by templates.
   *
   * <p>Each key is a constant, unary or binary operator. Each template may
   * only use the variables "p" and "q". Working from the leaves up, each node
   * whose operator is in the map is replaced by the template, with "p" bound
   * to the first operand (after substitution) and "q" bound to the second
   * operand.
   *
   * <p>For example, substituting {@code &} with {@code ~(~p|~q)} converts
   * {@code ((x&y)|z)} into {@code (~(~x|~y)|z)}.
   */
  public Formula substituteOperators(Map<Op, Formula> templates) {
    final ImmutableMap<Op, Formula> map = ImmutableMap.copyOf(templates);
    map.forEach(
        (op, template) -> {
          checkArgument(op != Op.VARIABLE, "not an operator: %s", op);
          checkArgument(
              ImmutableSet.of("p", "q").containsAll(template.variables()),
              "template for %s may only use variables p and q: %s",
              op,
              template);
        });
    if (map.isEmpty()) {
      return this;
    }
    return accept(
        new Shuttle() {
          @Override
          protected Formula visit(Ast.Constant constant) {
            return replace(constant);
          }

          @Override
          protected Formula visit(Ast.Unary unary) {
            return replace(super.visit(unary));
          }

          @Override
          protected Formula visit(Ast.Binary binary) {
            return replace(super.visit(binary));
          }

          private Formula replace(Formula formula) {
            final Formula template = map.get(formula.op);
            if (template == null) {
              return formula;
            }
            final List<Formula> args = formula.args();
            final ImmutableMap.Builder<String, Formula> b =
                ImmutableMap.builder();
            if (!args.isEmpty()) {
              b.put("p", args.get(0));
            }
            if (args.size() > 1) {
              b.put("q", args.get(1));
            }
            return template.substituteVariables(b.build());
          }
        });
  }
}

// End Formula.java
