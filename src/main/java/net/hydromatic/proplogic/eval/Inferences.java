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
package net.hydromatic.proplogic.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.proplogic.eval.Semantics.evaluate;

import java.util.logging.Logger;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.InferenceRule;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Semantic soundness of inference rules. */
public class Inferences {
  private static final Logger LOGGER =
      Logger.getLogger(Inferences.class.getName());

  private Inferences() {}

  /**
   * Returns whether an inference rule holds in a model: that is, whether
   * either some assumption is false or the conclusion is true.
   *
   * @throws IllegalArgumentException if the model does not assign a value to
   *     every variable of the rule
   */
  public static boolean evaluateInference(InferenceRule rule, Model model) {
    checkArgument(
        model.covers(rule.variables()),
        "model %s does not cover the variables %s of rule %s",
        model,
        rule.variables(),
        rule);
    for (Formula assumption : rule.assumptions) {
      if (!evaluate(assumption, model)) {
        return true;
      }
    }
    return evaluate(rule.conclusion, model);
  }

  /**
   * Returns whether an inference rule is sound: whether its conclusion is
   * true in every model in which all of its assumptions are true.
   *
   * <p>Checks every model over the variables of the rule, so the cost is
   * exponential in the number of variables.
   */
  public static boolean isSound(InferenceRule rule) {
    return counterModel(rule) == null;
  }

  /**
   * Returns the first model in which all assumptions of an inference rule are
   * true and its conclusion is false, or null if the rule is sound.
   */
  public static @Nullable Model counterModel(InferenceRule rule) {
    for (Model model : Semantics.allModels(rule.variables().asList())) {
      if (!evaluateInference(rule, model)) {
        LOGGER.fine(() -> "rule " + rule + " is not sound; counter-model "
            + model);
        return model;
      }
    }
    return null;
  }
}

// End Inferences.java
