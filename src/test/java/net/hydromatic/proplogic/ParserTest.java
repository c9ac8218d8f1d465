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
package net.hydromatic.proplogic;

import static net.hydromatic.proplogic.ast.FormulaBuilder.ast;
import static net.hydromatic.proplogic.parse.FormulaParser.isFormula;
import static net.hydromatic.proplogic.parse.FormulaParser.parse;
import static net.hydromatic.proplogic.parse.FormulaParser.parsePrefix;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.Strings;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.proplogic.ast.Ast;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.ast.Pos;
import net.hydromatic.proplogic.parse.FormulaParseException;
import net.hydromatic.proplogic.parse.FormulaParser;
import org.junit.jupiter.api.Test;

/** Tests the parser. */
public class ParserTest {
  @Test
  void testParseAtoms() {
    final Formula p = parse("p");
    assertThat(p, instanceOf(Ast.Variable.class));
    assertThat(((Ast.Variable) p).name, is("p"));

    assertThat(parse("q76"), is(ast.variable("q76")));
    assertThat(parse("z"), is(ast.variable("z")));
    assertThat(parse("T"), is(ast.trueConstant()));
    assertThat(parse("F"), is(ast.falseConstant()));
    assertThat(parse("F").op, is(Op.FALSE));
  }

  @Test
  void testParseOperators() {
    final Formula p = ast.variable("p");
    final Formula q = ast.variable("q");
    assertThat(parse("~p"), is(ast.not(p)));
    assertThat(parse("(p&q)").op, is(Op.AND));
    assertThat(parse("(p|q)").op, is(Op.OR));
    assertThat(parse("(p->q)").op, is(Op.IMPLIES));
    assertThat(parse("(p+q)").op, is(Op.XOR));
    assertThat(parse("(p<->q)").op, is(Op.IFF));
    assertThat(parse("(p-&q)").op, is(Op.NAND));
    assertThat(parse("(p-|q)").op, is(Op.NOR));

    final Ast.Binary iff = (Ast.Binary) parse("(p<->q)");
    assertThat(iff.left, is(p));
    assertThat(iff.right, is(q));
  }

  @Test
  void testParseNested() {
    final Formula f = parse("~((p1->~~q)|(T-&r))");
    assertThat(f.op, is(Op.NOT));
    final Ast.Binary or = (Ast.Binary) ((Ast.Unary) f).operand;
    assertThat(or.op, is(Op.OR));
    assertThat(or.left, hasToString("(p1->~~q)"));
    assertThat(or.right.op, is(Op.NAND));
    assertThat(f, hasToString("~((p1->~~q)|(T-&r))"));
  }

  /** Parsing the canonical text of a formula gives an equal formula. */
  @Test
  void testRoundTrip() {
    final List<String> list =
        Arrays.asList(
            "p",
            "T",
            "~~F",
            "(x12<->~y)",
            "((p+q)-|(r-&s))",
            "~(~(p&q)->(T|(z9<->F)))",
            "(((p|q)|r)|((s&t)&u))");
    for (String s : list) {
      final Formula f = parse(s);
      assertThat(f, hasToString(s));
      assertThat(parse(f.toString()), is(f));
    }

    final Formula built =
        ast.iff(
            ast.nor(ast.variable("w"), ast.falseConstant()),
            ast.not(ast.xor(ast.variable("w"), ast.variable("v3"))));
    assertThat(built, hasToString("((w-|F)<->~(w+v3))"));
    assertThat(parse(built.toString()), is(built));
  }

  @Test
  void testParsePrefix() {
    FormulaParser.Prefix prefix = parsePrefix("(p&q)|r");
    assertThat(prefix.formula, hasToString("(p&q)"));
    assertThat(prefix.remaining, is("|r"));

    // Digits are consumed greedily; other letters are not.
    prefix = parsePrefix("p12q");
    assertThat(prefix.formula, is(ast.variable("p12")));
    assertThat(prefix.remaining, is("q"));

    prefix = parsePrefix("~~p->q");
    assertThat(prefix.formula, hasToString("~~p"));
    assertThat(prefix.remaining, is("->q"));

    prefix = parsePrefix("x");
    assertThat(prefix.remaining, is(""));
    assertThat(prefix, hasToString("[x, '']"));
  }

  @Test
  void testIsFormula() {
    assertThat(isFormula("p"), is(true));
    assertThat(isFormula("~~p"), is(true));
    assertThat(isFormula("(p<->q)"), is(true));
    assertThat(isFormula("(p-|(q+T))"), is(true));

    assertThat(isFormula(""), is(false));
    assertThat(isFormula("a"), is(false));
    assertThat(isFormula("P"), is(false));
    assertThat(isFormula("p&q"), is(false));
    assertThat(isFormula("(p&q"), is(false));
    assertThat(isFormula("(p&q))"), is(false));
    assertThat(isFormula("(p)"), is(false));
    assertThat(isFormula("(p-q)"), is(false));
    assertThat(isFormula("(p & q)"), is(false));
    assertThat(isFormula("~"), is(false));
    assertThat(isFormula("pq"), is(false));
    assertThat(isFormula("TT"), is(false));
  }

  @Test
  void testParseErrors() {
    assertParseError("", "expected formula at column 1, found end of input");
    assertParseError("a", "expected formula at column 1, found 'a'");
    assertParseError("~", "expected formula at column 2, found end of input");
    assertParseError("(p&q",
        "expected ')' at column 5, found end of input");
    assertParseError("(p?q)",
        "expected binary operator at column 3, found '?q)'");
    assertParseError("(p-q)",
        "expected binary operator at column 3, found '-q)'");
    assertParseError("(p&q)r", "unexpected text after formula (p&q): 'r'");
    assertParseError("p q", "unexpected text after formula p: ' q'");
  }

  @Test
  void testParseErrorPosition() {
    final FormulaParseException e =
        assertThrows(FormulaParseException.class, () -> parse("(p&q)xyz"));
    assertThat(e.pos(), is(new Pos(6, 9)));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("column 6-8 Error: unexpected text after formula (p&q): "
            + "'xyz'"));

    final FormulaParseException e2 =
        assertThrows(FormulaParseException.class, () -> parse("(p?q)"));
    assertThat(e2.pos(), is(Pos.at(2)));
    assertThat(e2.pos(), hasToString("column 3"));
  }

  /** A long run of negations is read without deep recursion. */
  @Test
  void testManyNegations() {
    final String s = Strings.repeat("~", 10_000) + "p";
    assertThat(isFormula(s), is(true));
    final Formula f = parse(s);
    assertThat(f.op, is(Op.NOT));
    assertThat(f.toString().length(), is(10_001));
    assertThat(parse("~~(~p&~~q)"), hasToString("~~(~p&~~q)"));
  }

  /** Parentheses nested too deeply for the stack give a parse error, not a
   * {@link StackOverflowError}. */
  @Test
  void testNestedTooDeeply() {
    final String s = Strings.repeat("(", 1_000_000) + "p";
    assertThat(isFormula(s), is(false));
    final FormulaParseException e =
        assertThrows(FormulaParseException.class, () -> parse(s));
    assertThat(e.getMessage(), is("formula is nested too deeply"));
    assertThrows(FormulaParseException.class, () -> parsePrefix(s));
  }

  private static void assertParseError(String s, String expected) {
    final FormulaParseException e =
        assertThrows(FormulaParseException.class, () -> parse(s));
    assertThat(e.getMessage(), is(expected));
  }
}

// End ParserTest.java
