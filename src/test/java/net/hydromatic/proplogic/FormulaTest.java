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

import static net.hydromatic.proplogic.Matchers.isEquivalentTo;
import static net.hydromatic.proplogic.ast.FormulaBuilder.ast;
import static net.hydromatic.proplogic.parse.FormulaParser.parse;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.proplogic.ast.Ast;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests construction and manipulation of {@link Formula}. */
public class FormulaTest {
  @Test
  void testClassifiers() {
    assertThat(Ast.isVariable("p"), is(true));
    assertThat(Ast.isVariable("z"), is(true));
    assertThat(Ast.isVariable("q76"), is(true));
    assertThat(Ast.isVariable("o"), is(false));
    assertThat(Ast.isVariable("P"), is(false));
    assertThat(Ast.isVariable("p1a"), is(false));
    assertThat(Ast.isVariable("pq"), is(false));
    assertThat(Ast.isVariable(""), is(false));

    assertThat(Ast.isConstant("T"), is(true));
    assertThat(Ast.isConstant("F"), is(true));
    assertThat(Ast.isConstant("TF"), is(false));
    assertThat(Ast.isConstant("p"), is(false));

    assertThat(Ast.isUnary("~"), is(true));
    assertThat(Ast.isUnary("-&"), is(false));

    for (String s : ImmutableList.of("&", "|", "->", "+", "<->", "-&", "-|")) {
      assertThat(s, Ast.isBinary(s), is(true));
    }
    assertThat(Ast.isBinary("~"), is(false));
    assertThat(Ast.isBinary("T"), is(false));
    assertThat(Ast.isBinary("=>"), is(false));
  }

  @Test
  void testBuild() {
    final Formula p = ast.variable("p");
    final Formula q76 = ast.variable("q76");
    final Formula f = ast.not(ast.and(p, q76));
    assertThat(f, hasToString("~(p&q76)"));
    assertThat(f.op, is(Op.NOT));
    assertThat(f.args(), hasSize(1));
    assertThat(p.args(), empty());
    assertThat(ast.implies(p, ast.trueConstant()), hasToString("(p->T)"));
    assertThat(ast.constant(false), sameInstance(ast.falseConstant()));
  }

  @Test
  void testApply() {
    final Formula p = ast.variable("p");
    final Formula q = ast.variable("q");
    assertThat(ast.apply("p"), is(p));
    assertThat(ast.apply("T"), is(ast.trueConstant()));
    assertThat(ast.apply("~", p), hasToString("~p"));
    assertThat(ast.apply("<->", p, q), hasToString("(p<->q)"));
    assertThat(ast.apply(Op.NOR, ImmutableList.of(q, p)),
        hasToString("(q-|p)"));
  }

  @Test
  void testApplyWrongArity() {
    final Formula p = ast.variable("p");
    final Formula q = ast.variable("q");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> ast.apply("&", p));
    assertThat(e.getMessage(),
        is("operator AND requires 2 operand(s), but was given 1"));

    e = assertThrows(IllegalArgumentException.class,
        () -> ast.apply("~", p, q));
    assertThat(e.getMessage(),
        is("operator NOT requires 1 operand(s), but was given 2"));

    e = assertThrows(IllegalArgumentException.class,
        () -> ast.apply("F", p));
    assertThat(e.getMessage(),
        is("operator FALSE requires 0 operand(s), but was given 1"));

    e = assertThrows(IllegalArgumentException.class,
        () -> ast.apply("p", q));
    assertThat(e.getMessage(),
        is("variable p must not have operands, but was given 1"));

    e = assertThrows(IllegalArgumentException.class,
        () -> ast.apply("=>", p, q));
    assertThat(e.getMessage(), is("unknown operator '=>'"));

    assertThrows(IllegalArgumentException.class,
        () -> ast.unary(Op.AND, p));
    assertThrows(IllegalArgumentException.class,
        () -> ast.binary(Op.NOT, p, q));
  }

  @Test
  void testInvalidVariable() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> ast.variable("a"));
    assertThat(e.getMessage(), is("not a variable name: 'a'"));
    assertThrows(IllegalArgumentException.class, () -> ast.variable("T"));
    assertThrows(IllegalArgumentException.class, () -> ast.variable("x_1"));
    assertThrows(NullPointerException.class,
        () -> ast.not(null));
  }

  @Test
  void testFoldLeft() {
    final ImmutableList<Formula> list =
        ImmutableList.of(ast.variable("p"), ast.variable("q"),
            ast.variable("r"));
    assertThat(ast.foldLeft(Op.OR, list), hasToString("((p|q)|r)"));
    assertThat(ast.foldLeft(Op.AND, list.subList(0, 1)), hasToString("p"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.foldLeft(Op.AND, ImmutableList.of()));
  }

  /** Two formulas are equal if and only if their texts are equal. */
  @Test
  void testEquals() {
    final Formula f0 = ast.and(ast.variable("p"), ast.variable("q"));
    final Formula f1 = parse("(p&q)");
    assertThat(f0, is(f1));
    assertThat(f0.hashCode(), is(f1.hashCode()));
    assertThat(f0, not(is(parse("(q&p)"))));
    assertThat(parse("~~p"), not(is(parse("p"))));
  }

  @Test
  void testVariablesAndOperators() {
    final Formula f = parse("((q1|~p)&(T->q1))");
    assertThat(f.variables(), hasToString("[p, q1]"));
    assertThat(f.operators(),
        is(ImmutableSet.of(Op.AND, Op.OR, Op.NOT, Op.IMPLIES, Op.TRUE)));

    assertThat(parse("F").variables(), empty());
    assertThat(parse("F").operators(), is(ImmutableSet.of(Op.FALSE)));
    assertThat(parse("x").operators(), empty());
  }

  @Test
  void testSubstituteVariables() {
    final Formula f = parse("((p->p)|z)");
    final Formula f2 =
        f.substituteVariables(
            ImmutableMap.of("p", parse("(q&r)"), "r", parse("s")));
    assertThat(f2, hasToString("(((q&r)->(q&r))|z)"));

    // Substitution is simultaneous
    final Formula swapped =
        parse("(p&q)")
            .substituteVariables(
                ImmutableMap.of("p", parse("q"), "q", parse("p")));
    assertThat(swapped, hasToString("(q&p)"));

    assertThat(f.substituteVariables(ImmutableMap.of()), sameInstance(f));
    assertThrows(IllegalArgumentException.class,
        () -> f.substituteVariables(ImmutableMap.of("A", parse("p"))));
  }

  @Test
  void testSubstituteOperators() {
    final ImmutableMap<Op, Formula> deMorgan =
        ImmutableMap.of(Op.AND, parse("~(~p|~q)"));
    assertThat(parse("((x&y)|z)").substituteOperators(deMorgan),
        hasToString("(~(~x|~y)|z)"));
    assertThat(parse("((x&y)&z)").substituteOperators(deMorgan),
        hasToString("~(~~(~x|~y)|~z)"));

    final ImmutableMap<Op, Formula> constants =
        ImmutableMap.of(Op.TRUE, parse("(p|~p)"), Op.NOT, parse("(p-&p)"));
    assertThat(parse("(T&~x)").substituteOperators(constants),
        hasToString("((p|~p)&(x-&x))"));

    // Substituting an equivalent template gives an equivalent formula
    final Formula f = parse("((x->y)&(y->x))");
    final Formula f2 =
        f.substituteOperators(ImmutableMap.of(Op.IMPLIES, parse("(~p|q)")));
    assertThat(f2, hasToString("((~x|y)&(~y|x))"));
    assertThat(f2, isEquivalentTo(f));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> f.substituteOperators(
                ImmutableMap.of(Op.OR, parse("(p&r)"))));
    assertThat(e.getMessage(),
        is("template for OR may only use variables p and q: (p&r)"));
  }
}

// End FormulaTest.java
