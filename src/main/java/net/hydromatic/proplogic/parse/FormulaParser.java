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
package net.hydromatic.proplogic.parse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.proplogic.ast.FormulaBuilder.ast;

import com.google.common.base.CharMatcher;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.ast.Pos;

/**
 * Recursive-descent parser for formulas.
 *
 * <p>The grammar is as follows:
 *
 * <pre>{@code
 * formula  := variable | constant | "~" formula
 *           | "(" formula binop formula ")"
 * variable := [p-z] [0-9]*
 * constant := "T" | "F"
 * binop    := "<->" | "->" | "-&" | "-|" | "+" | "&" | "|"
 * }</pre>
 *
 * <p>There is no white space, and binary operators are always enclosed in
 * parentheses. This is the syntax produced by {@link Formula#toString()}.
 */
public final class FormulaParser {
  private static final Logger LOGGER =
      Logger.getLogger(FormulaParser.class.getName());

  private static final CharMatcher VARIABLE_START =
      CharMatcher.inRange('p', 'z');
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');

  private final String s;
  private int i;

  private FormulaParser(String s) {
    this.s = requireNonNull(s);
  }

  /**
   * Parses a formula. The whole string must be consumed.
   *
   * @throws FormulaParseException if the string is not a formula
   */
  public static Formula parse(String s) {
    final FormulaParser parser = new FormulaParser(s);
    final Formula formula = parser.top();
    if (parser.i < s.length()) {
      throw new FormulaParseException(
          "unexpected text after formula " + formula + ": '"
              + s.substring(parser.i) + "'",
          Pos.of(parser.i, s.length()));
    }
    return formula;
  }

  /** Returns whether a string is a formula. */
  public static boolean isFormula(String s) {
    try {
      parse(s);
      return true;
    } catch (FormulaParseException e) {
      LOGGER.log(Level.FINER, "not a formula: " + s, e);
      return false;
    }
  }

  /**
   * Parses the longest prefix of a string that is a formula, and returns the
   * formula and the remainder of the string.
   *
   * <p>For example, {@code parsePrefix("(p&q)|r")} returns formula "(p&q)"
   * and remainder "|r".
   *
   * @throws FormulaParseException if no prefix of the string is a formula
   */
  public static Prefix parsePrefix(String s) {
    final FormulaParser parser = new FormulaParser(s);
    final Formula formula = parser.top();
    return new Prefix(formula, s.substring(parser.i));
  }

  /** Parses a formula at the start of the string. Parentheses nested too
   * deeply for the stack become a parse error. */
  private Formula top() {
    try {
      return formula();
    } catch (StackOverflowError e) {
      throw new FormulaParseException("formula is nested too deeply",
          Pos.of(0, Math.min(i, s.length())));
    }
  }

  private Formula formula() {
    // Negations are counted, not recursed into
    int negations = 0;
    while (i < s.length() && s.charAt(i) == '~') {
      ++negations;
      ++i;
    }
    Formula formula = atom();
    for (int j = 0; j < negations; j++) {
      formula = ast.not(formula);
    }
    return formula;
  }

  private Formula atom() {
    if (i >= s.length()) {
      throw error("formula");
    }
    final char c = s.charAt(i);
    if (VARIABLE_START.matches(c)) {
      final int start = i++;
      while (i < s.length() && DIGIT.matches(s.charAt(i))) {
        ++i;
      }
      return ast.variable(s.substring(start, i));
    }
    switch (c) {
      case 'T':
      case 'F':
        ++i;
        return ast.constant(c == 'T');
      case '(':
        ++i;
        final Formula left = formula();
        final Op op = binaryOp();
        final Formula right = formula();
        if (i >= s.length() || s.charAt(i) != ')') {
          throw error("')'");
        }
        ++i;
        return ast.binary(op, left, right);
      default:
        throw error("formula");
    }
  }

  /** Reads a binary operator token, trying longer tokens first. */
  private Op binaryOp() {
    for (Op op : Op.BINARY_TOKEN_ORDER) {
      if (s.startsWith(op.symbol, i)) {
        i += op.symbol.length();
        return op;
      }
    }
    throw error("binary operator");
  }

  /** Creates an exception saying that we expected something at the current
   * position but found something else. */
  private FormulaParseException error(String expected) {
    final String found;
    final Pos pos;
    if (i >= s.length()) {
      found = "end of input";
      pos = Pos.of(s.length(), s.length());
    } else {
      final int end = Math.min(i + 3, s.length());
      found = "'" + s.substring(i, end) + "'";
      pos = Pos.at(i);
    }
    return new FormulaParseException(
        "expected " + expected + " at " + pos + ", found " + found, pos);
  }

  /** Formula that was parsed from the start of a string, and the text that
   * follows it. */
  public static class Prefix {
    public final Formula formula;
    public final String remaining;

    Prefix(Formula formula, String remaining) {
      this.formula = requireNonNull(formula);
      this.remaining = requireNonNull(remaining);
    }

    @Override
    public String toString() {
      return "[" + formula + ", '" + remaining + "']";
    }
  }
}

// End FormulaParser.java
