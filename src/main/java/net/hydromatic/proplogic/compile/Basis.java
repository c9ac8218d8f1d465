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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;

/**
 * Set of operators that a formula may be rewritten to use.
 *
 * @see Rewriter#rewrite(Formula, Basis)
 */
public enum Basis {
  /** Negation, conjunction and disjunction. */
  NOT_AND_OR(Op.NOT, Op.AND, Op.OR),

  /** Negation and conjunction. */
  NOT_AND(Op.NOT, Op.AND),

  /** Only "not and". */
  NAND(Op.NAND),

  /** Implication and negation. */
  IMPLIES_NOT(Op.IMPLIES, Op.NOT),

  /** Implication and the constant "F". */
  IMPLIES_FALSE(Op.IMPLIES, Op.FALSE);

  /** Operators in this basis. */
  public final ImmutableSet<Op> ops;

  Basis(Op op, Op... ops) {
    this.ops = Sets.immutableEnumSet(op, ops);
  }

  /** Returns whether a formula uses only the operators of this basis. */
  public boolean contains(Formula formula) {
    return ops.containsAll(formula.operators());
  }
}

// End Basis.java
