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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds formula nodes. */
public enum FormulaBuilder {
  /**
   * The singleton instance of the formula builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static final Ast.Constant TRUE = new Ast.Constant(true);
  private static final Ast.Constant FALSE = new Ast.Constant(false);

  /** Creates a variable. Throws if the name is not a valid variable name. */
  public Ast.Variable variable(String name) {
    return new Ast.Variable(name);
  }

  /** Returns the constant "T" or "F". */
  public Ast.Constant constant(boolean value) {
    return value ? TRUE : FALSE;
  }

  public Ast.Constant trueConstant() {
    return TRUE;
  }

  public Ast.Constant falseConstant() {
    return FALSE;
  }

  public Ast.Unary unary(Op op, Formula operand) {
    return new Ast.Unary(op, operand);
  }

  public Ast.Binary binary(Op op, Formula left, Formula right) {
    return new Ast.Binary(op, left, right);
  }

  public Ast.Unary not(Formula operand) {
    return unary(Op.NOT, operand);
  }

  public Ast.Binary and(Formula left, Formula right) {
    return binary(Op.AND, left, right);
  }

  public Ast.Binary or(Formula left, Formula right) {
    return binary(Op.OR, left, right);
  }

  public Ast.Binary implies(Formula left, Formula right) {
    return binary(Op.IMPLIES, left, right);
  }

  public Ast.Binary xor(Formula left, Formula right) {
    return binary(Op.XOR, left, right);
  }

  public Ast.Binary iff(Formula left, Formula right) {
    return binary(Op.IFF, left, right);
  }

  public Ast.Binary nand(Formula left, Formula right) {
    return binary(Op.NAND, left, right);
  }

  public Ast.Binary nor(Formula left, Formula right) {
    return binary(Op.NOR, left, right);
  }

  /**
   * Creates a node from a root token and a list of operands.
   *
   * <p>The root is either a variable name, a constant, or an operator token.
   * The number of operands must match: none for a variable or constant, one
   * for "~", two for a binary operator. Throws if the root is not recognized
   * or the number of operands is wrong.
   */
  public Formula apply(String root, List<? extends Formula> operands) {
    if (Ast.isVariable(root)) {
      checkArgument(
          operands.isEmpty(),
          "variable %s must not have operands, but was given %s",
          root,
          operands.size());
      return variable(root);
    }
    final Op op = Op.lookup(root);
    return apply(op, operands);
  }

  /** As {@link #apply(String, List)}, with operands given as an array. */
  public Formula apply(String root, Formula... operands) {
    return apply(root, ImmutableList.copyOf(operands));
  }

  /**
   * Creates a node from an operator and a list of operands. Throws if the
   * number of operands does not match the operator's arity.
   */
  public Formula apply(Op op, List<? extends Formula> operands) {
    checkArgument(
        op != Op.VARIABLE, "use variable(String) to create a variable");
    Ast.checkArity(op, operands.size());
    switch (op.arity) {
      case 0:
        return constant(op == Op.TRUE);
      case 1:
        return unary(op, operands.get(0));
      default:
        return binary(op, operands.get(0), operands.get(1));
    }
  }

  /**
   * Folds a non-empty list of formulas using a binary operator, from the
   * left. For example, {@code foldLeft(AND, [a, b, c])} returns
   * {@code ((a&b)&c)}, and a singleton list returns its only element.
   */
  public Formula foldLeft(Op op, List<? extends Formula> formulas) {
    checkArgument(op.isBinary(), "not a binary operator: %s", op);
    checkArgument(!formulas.isEmpty(), "cannot fold an empty list");
    Formula result = formulas.get(0);
    for (Formula formula : formulas.subList(1, formulas.size())) {
      result = binary(op, result, formula);
    }
    return result;
  }
}

// End FormulaBuilder.java
