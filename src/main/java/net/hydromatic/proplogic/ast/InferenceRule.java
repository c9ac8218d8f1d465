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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.Objects;

/**
 * Inference rule: a list of assumptions and a conclusion.
 *
 * <p>Assumptions may repeat. Their order affects how the rule is printed but
 * not whether it is sound.
 */
public class InferenceRule {
  public final ImmutableList<Formula> assumptions;
  public final Formula conclusion;

  /** Creates an InferenceRule. */
  public InferenceRule(
      List<? extends Formula> assumptions, Formula conclusion) {
    this.assumptions = ImmutableList.copyOf(assumptions);
    this.conclusion = requireNonNull(conclusion, "conclusion");
  }

  /** Creates an InferenceRule. */
  public static InferenceRule of(Formula conclusion, Formula... assumptions) {
    return new InferenceRule(ImmutableList.copyOf(assumptions), conclusion);
  }

  /**
   * Returns the names of all variables used in the assumptions and
   * conclusion, sorted.
   */
  public ImmutableSortedSet<String> variables() {
    final ImmutableSortedSet.Builder<String> b =
        ImmutableSortedSet.naturalOrder();
    assumptions.forEach(assumption -> b.addAll(assumption.variables()));
    b.addAll(conclusion.variables());
    return b.build();
  }

  @Override
  public int hashCode() {
    return Objects.hash(assumptions, conclusion);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof InferenceRule
            && assumptions.equals(((InferenceRule) o).assumptions)
            && conclusion.equals(((InferenceRule) o).conclusion);
  }

  /** Returns a string such as "[p, (p->q)] ==> q". */
  @Override
  public String toString() {
    return assumptions + " ==> " + conclusion;
  }
}

// End InferenceRule.java
