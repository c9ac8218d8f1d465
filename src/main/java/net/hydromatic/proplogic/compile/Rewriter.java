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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.proplogic.ast.FormulaBuilder.ast;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.logging.Logger;
import net.hydromatic.proplogic.ast.Ast;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.ast.Shuttle;
import net.hydromatic.proplogic.eval.Prop;

/**
 * Rewrites formulas so that they use only the operators of a given
 * {@link Basis}.
 *
 * <p>Every rewrite preserves the value of the formula in every model. Each
 * rewrite works from the leaves up, applying a fixed identity to each node:
 *
 * <ul>
 * <li>{@link Basis#NOT_AND_OR}: {@code a->b} becomes {@code (~a|b)};
 *   {@code a+b} becomes {@code ((a|b)&~(a&b))};
 *   {@code a<->b} becomes {@code ((a&b)|(~a&~b))};
 *   {@code a-&b} becomes {@code ~(a&b)};
 *   {@code a-|b} becomes {@code ~(a|b)}.
 * <li>{@link Basis#NOT_AND}: as above, then {@code a|b} becomes
 *   {@code ~(~a&~b)}.
 * <li>{@link Basis#NAND}: as {@code NOT_AND}, then {@code ~a} becomes
 *   {@code (a-&a)} and {@code a&b} becomes {@code ((a-&b)-&(a-&b))}.
 * <li>{@link Basis#IMPLIES_NOT}: as {@code NOT_AND_OR}, then {@code a&b}
 *   becomes {@code ~(a->~b)} and {@code a|b} becomes {@code (~a->b)}.
 * <li>{@link Basis#IMPLIES_FALSE}: as {@code NOT_AND_OR}, then {@code ~a}
 *   becomes {@code (a->F)}, {@code a&b} becomes {@code ((a->(b->F))->F)}
 *   and {@code a|b} becomes {@code ((a->F)->b)}.
 * </ul>
 *
 * <p>Before any of these, a separate pass replaces "T" with {@code (p|~p)}
 * and "F" with {@code (p&~p)}, where "p" is the value of
 * {@link Prop#CONSTANT_VARIABLE}. If the formula already uses that variable,
 * the result is still equivalent.
 */
public class Rewriter {
  private static final Logger LOGGER =
      Logger.getLogger(Rewriter.class.getName());

  private final Ast.Variable constantVariable;
  private final Tracer tracer;

  private Rewriter(Ast.Variable constantVariable, Tracer tracer) {
    this.constantVariable = requireNonNull(constantVariable);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Rewriter with the default configuration and no tracing. */
  public static Rewriter create() {
    return create(ImmutableMap.of(), Tracers.nullTracer());
  }

  /** Creates a Rewriter. */
  public static Rewriter create(Map<Prop, Object> config, Tracer tracer) {
    final String name = Prop.CONSTANT_VARIABLE.stringValue(config);
    return new Rewriter(ast.variable(name), tracer);
  }

  /**
   * Rewrites a formula to use only the operators of a basis.
   *
   * <p>A formula that already uses only those operators is returned
   * unchanged.
   */
  public Formula rewrite(Formula formula, Basis basis) {
    if (basis.contains(formula)) {
      return formula;
    }
    LOGGER.fine(() -> "rewrite " + formula + " to " + basis);
    final Formula result;
    switch (basis) {
      case NOT_AND_OR:
        result = eliminateConstants(formula).accept(new NotAndOrShuttle());
        break;
      case NOT_AND:
        result = toNotAndOr(formula).accept(new NotAndShuttle());
        break;
      case NAND:
        result = toNotAnd(formula).accept(new NandShuttle());
        break;
      case IMPLIES_NOT:
        result = toNotAndOr(formula).accept(new ImpliesNotShuttle());
        break;
      case IMPLIES_FALSE:
        result = toNotAndOr(formula).accept(new ImpliesFalseShuttle());
        break;
      default:
        throw new AssertionError("unknown basis " + basis);
    }
    tracer.onRewrite(basis, formula, result);
    return result;
  }

  /** Rewrites a formula to use only "~", "&" and "|". */
  public Formula toNotAndOr(Formula formula) {
    return rewrite(formula, Basis.NOT_AND_OR);
  }

  /** Rewrites a formula to use only "~" and "&". */
  public Formula toNotAnd(Formula formula) {
    return rewrite(formula, Basis.NOT_AND);
  }

  /** Rewrites a formula to use only "-&". */
  public Formula toNand(Formula formula) {
    return rewrite(formula, Basis.NAND);
  }

  /** Rewrites a formula to use only "->" and "~". */
  public Formula toImpliesNot(Formula formula) {
    return rewrite(formula, Basis.IMPLIES_NOT);
  }

  /** Rewrites a formula to use only "->" and "F". */
  public Formula toImpliesFalse(Formula formula) {
    return rewrite(formula, Basis.IMPLIES_FALSE);
  }

  /**
   * Replaces the constants "T" and "F" with a tautology and a contradiction
   * over the constant variable. Returns the formula unchanged if it contains
   * no constants.
   */
  public Formula eliminateConstants(Formula formula) {
    if (!formula.operators().contains(Op.TRUE)
        && !formula.operators().contains(Op.FALSE)) {
      return formula;
    }
    final Ast.Variable v = constantVariable;
    final Formula result =
        formula.accept(
            new Shuttle() {
              @Override
              protected Formula visit(Ast.Constant constant) {
                return constant.value
                    ? ast.or(v, ast.not(v))
                    : ast.and(v, ast.not(v));
              }
            });
    tracer.onEliminateConstants(formula, result);
    return result;
  }

  /** Callback that is informed of each step of a rewrite. */
  public interface Tracer {
    /** Called when constants have been eliminated from a formula. */
    void onEliminateConstants(Formula formula, Formula result);

    /** Called when a formula has been rewritten to a basis. */
    void onRewrite(Basis basis, Formula formula, Formula result);
  }

  /**
   * Shuttle that rewrites binary operators into a basis. The formula must
   * not contain constants; operators that cannot occur at this stage cause
   * an {@link AssertionError}.
   */
  private abstract static class BasisShuttle extends Shuttle {
    @Override
    protected Formula visit(Ast.Constant constant) {
      throw new AssertionError("constant " + constant + " not eliminated");
    }

    @Override
    protected Formula visit(Ast.Binary binary) {
      return rewrite(
          binary, binary.left.accept(this), binary.right.accept(this));
    }

    /** Rewrites a binary node, given its operands (already rewritten). */
    abstract Formula rewrite(Ast.Binary binary, Formula a, Formula b);

    static AssertionError unexpected(Op op) {
      return new AssertionError("unexpected operator " + op);
    }
  }

  /** Eliminates all binary operators except "&" and "|". */
  private static class NotAndOrShuttle extends BasisShuttle {
    @Override
    Formula rewrite(Ast.Binary binary, Formula a, Formula b) {
      switch (binary.op) {
        case AND:
        case OR:
          return binary.copy(a, b);
        case IMPLIES:
          return ast.or(ast.not(a), b);
        case XOR:
          return ast.and(ast.or(a, b), ast.not(ast.and(a, b)));
        case IFF:
          return ast.or(ast.and(a, b), ast.and(ast.not(a), ast.not(b)));
        case NAND:
          return ast.not(ast.and(a, b));
        case NOR:
          return ast.not(ast.or(a, b));
        default:
          throw unexpected(binary.op);
      }
    }
  }

  /** Eliminates "|" by De Morgan's law. */
  private static class NotAndShuttle extends BasisShuttle {
    @Override
    Formula rewrite(Ast.Binary binary, Formula a, Formula b) {
      switch (binary.op) {
        case AND:
          return binary.copy(a, b);
        case OR:
          return ast.not(ast.and(ast.not(a), ast.not(b)));
        default:
          throw unexpected(binary.op);
      }
    }
  }

  /** Converts "~" and "&" to "-&". */
  private static class NandShuttle extends BasisShuttle {
    @Override
    protected Formula visit(Ast.Unary unary) {
      final Formula a = unary.operand.accept(this);
      return ast.nand(a, a);
    }

    @Override
    Formula rewrite(Ast.Binary binary, Formula a, Formula b) {
      if (binary.op != Op.AND) {
        throw unexpected(binary.op);
      }
      final Formula nand = ast.nand(a, b);
      return ast.nand(nand, nand);
    }
  }

  /** Converts "&" and "|" to "->" and "~". */
  private static class ImpliesNotShuttle extends BasisShuttle {
    @Override
    Formula rewrite(Ast.Binary binary, Formula a, Formula b) {
      switch (binary.op) {
        case AND:
          return ast.not(ast.implies(a, ast.not(b)));
        case OR:
          return ast.implies(ast.not(a), b);
        default:
          throw unexpected(binary.op);
      }
    }
  }

  /** Converts "~", "&" and "|" to "->" and "F". */
  private static class ImpliesFalseShuttle extends BasisShuttle {
    private static final Formula F = ast.falseConstant();

    @Override
    protected Formula visit(Ast.Unary unary) {
      return ast.implies(unary.operand.accept(this), F);
    }

    @Override
    Formula rewrite(Ast.Binary binary, Formula a, Formula b) {
      switch (binary.op) {
        case AND:
          return ast.implies(ast.implies(a, ast.implies(b, F)), F);
        case OR:
          return ast.implies(ast.implies(a, F), b);
        default:
          throw unexpected(binary.op);
      }
    }
  }
}

// End Rewriter.java
