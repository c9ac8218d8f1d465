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
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of formula node; for operators, also its textual token. */
public enum Op {
  // atoms
  VARIABLE(0, ""),
  TRUE(0, "T"),
  FALSE(0, "F"),

  // unary
  NOT(1, "~"),

  // binary
  AND(2, "&"),
  OR(2, "|"),
  IMPLIES(2, "->"),
  XOR(2, "+"),
  IFF(2, "<->"),
  NAND(2, "-&"),
  NOR(2, "-|");

  /** Number of operands. */
  public final int arity;

  /** Token, e.g. "->"; empty for {@link #VARIABLE}. */
  public final String symbol;

  /**
   * Binary operators in the order that the parser tries their tokens. A token
   * is never tried before a longer token that starts with the same
   * characters.
   */
  public static final ImmutableList<Op> BINARY_TOKEN_ORDER =
      ImmutableList.of(IFF, IMPLIES, NAND, NOR, XOR, AND, OR);

  /** Map from token to operator; contains every operator but VARIABLE. */
  public static final ImmutableMap<String, Op> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op != VARIABLE) {
        b.put(op.symbol, op);
      }
    }
    BY_SYMBOL = b.build();
  }

  Op(int arity, String symbol) {
    this.arity = arity;
    this.symbol = symbol;
  }

  /** Returns the operator with a given token, or null. */
  public static @Nullable Op lookupOpt(String symbol) {
    return BY_SYMBOL.get(symbol);
  }

  /**
   * Returns the operator with a given token. Throws if the token is not an
   * operator; never returns null.
   */
  public static Op lookup(String symbol) {
    final Op op = lookupOpt(symbol);
    checkArgument(op != null, "unknown operator '%s'", symbol);
    return op;
  }

  /** Returns whether this is {@link #TRUE} or {@link #FALSE}. */
  public boolean isConstant() {
    return this == TRUE || this == FALSE;
  }

  public boolean isUnary() {
    return arity == 1;
  }

  public boolean isBinary() {
    return arity == 2;
  }
}

// End Op.java
