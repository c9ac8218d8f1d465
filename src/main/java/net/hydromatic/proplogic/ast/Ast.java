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
import static net.hydromatic.proplogic.ast.FormulaBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.regex.Pattern;

/** Various sub-classes of formula nodes. */
public class Ast {
  private Ast() {}

  private static final Pattern VARIABLE_PATTERN =
      Pattern.compile("[p-z][0-9]*");

  /**
   * Returns whether a string is a variable name: a letter between 'p' and 'z'
   * optionally followed by decimal digits.
   */
  public static boolean isVariable(String s) {
    return VARIABLE_PATTERN.matcher(s).matches();
  }

  /** Returns whether a string is a constant, "T" or "F". */
  public static boolean isConstant(String s) {
    final Op op = Op.lookupOpt(s);
    return op != null && op.isConstant();
  }

  /** Returns whether a string is the unary operator, "~". */
  public static boolean isUnary(String s) {
    final Op op = Op.lookupOpt(s);
    return op != null && op.isUnary();
  }

  /** Returns whether a string is a binary operator, such as "->". */
  public static boolean isBinary(String s) {
    final Op op = Op.lookupOpt(s);
    return op != null && op.isBinary();
  }

  /** Checks that an operator has a given number of operands. */
  static Op checkArity(Op op, int arity) {
    checkArgument(
        op.arity == arity,
        "operator %s requires %s operand(s), but was given %s",
        op,
        op.arity,
        arity);
    return op;
  }

  /** Propositional variable.
   *
   * <p>For example, "q76" in "~(p&q76)". */
  public static class Variable extends Formula {
    public final String name;

    Variable(String name) {
      super(
          Op.VARIABLE,
          checkName(name),
          ImmutableSortedSet.of(name),
          ImmutableSet.of());
      this.name = name;
    }

    private static String checkName(String name) {
      checkArgument(isVariable(name), "not a variable name: '%s'", name);
      return name;
    }

    @Override
    public List<Formula> args() {
      return ImmutableList.of();
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Constant, "T" (true) or "F" (false). */
  public static class Constant extends Formula {
    public final boolean value;

    Constant(boolean value) {
      super(
          value ? Op.TRUE : Op.FALSE,
          value ? Op.TRUE.symbol : Op.FALSE.symbol,
          ImmutableSortedSet.of(),
          Sets.immutableEnumSet(value ? Op.TRUE : Op.FALSE));
      this.value = value;
    }

    @Override
    public List<Formula> args() {
      return ImmutableList.of();
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Call to a unary operator. The only unary operator is negation, "~".
   *
   * <p>The canonical text is the operator immediately followed by the
   * operand, for example "~p". */
  public static class Unary extends Formula {
    public final Formula operand;

    Unary(Op op, Formula operand) {
      super(
          checkArity(op, 1),
          op.symbol + operand,
          operand.variables(),
          Sets.immutableEnumSet(op, operand.operators().toArray(new Op[0])));
      this.operand = requireNonNull(operand);
    }

    @Override
    public List<Formula> args() {
      return ImmutableList.of(operand);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code Unary} with a given operand,
     * or {@code this} if the operand is the same. */
    public Formula copy(Formula operand) {
      return this.operand == operand
          ? this
          : ast.unary(op, operand);
    }
  }

  /** Call to a binary operator.
   *
   * <p>The canonical text is always parenthesized, for example "(p->q)". */
  public static class Binary extends Formula {
    public final Formula left;
    public final Formula right;

    Binary(Op op, Formula left, Formula right) {
      super(
          checkArity(op, 2),
          "(" + left + op.symbol + right + ")",
          ImmutableSortedSet.<String>naturalOrder()
              .addAll(left.variables())
              .addAll(right.variables())
              .build(),
          Sets.immutableEnumSet(
              ImmutableSet.<Op>builder()
                  .add(op)
                  .addAll(left.operators())
                  .addAll(right.operators())
                  .build()));
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public List<Formula> args() {
      return ImmutableList.of(left, right);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    /** Creates a copy of this {@code Binary} with given operands and the same
     * operator, or {@code this} if the operands are the same. */
    public Formula copy(Formula left, Formula right) {
      return this.left == left && this.right == right
          ? this
          : ast.binary(op, left, right);
    }
  }
}

// End Ast.java
