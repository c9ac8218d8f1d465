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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.proplogic.util.Static.str;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import net.hydromatic.proplogic.ast.Formula;

/**
 * Truth table of a formula.
 *
 * <p>The columns are the formula's variables, in ascending order, followed
 * by the formula itself. There is one row for each model over those
 * variables, in the order generated by {@link Semantics#allModels(List)}.
 *
 * <p>For example, the table for "(p->q)" prints as follows:
 *
 * <pre>{@code
 * | p | q | (p->q) |
 * |---|---|--------|
 * | F | F |   T    |
 * | F | T |   T    |
 * | T | F |   F    |
 * | T | T |   T    |
 * }</pre>
 */
public class TruthTable {
  public final Formula formula;
  /** Column headers: the variables, then the formula. */
  public final ImmutableList<String> columns;
  /** Rows; each row has one value per column. */
  public final ImmutableList<ImmutableList<Boolean>> rows;

  private TruthTable(
      Formula formula,
      ImmutableList<String> columns,
      ImmutableList<ImmutableList<Boolean>> rows) {
    this.formula = requireNonNull(formula);
    this.columns = requireNonNull(columns);
    this.rows = requireNonNull(rows);
  }

  /** Computes the truth table of a formula. */
  public static TruthTable of(Formula formula) {
    final List<String> variables = formula.variables().asList();
    final ImmutableList.Builder<String> columns = ImmutableList.builder();
    columns.addAll(variables).add(formula.toString());
    final ImmutableList.Builder<ImmutableList<Boolean>> rows =
        ImmutableList.builder();
    for (Model model : Semantics.allModels(variables)) {
      final ImmutableList.Builder<Boolean> row = ImmutableList.builder();
      variables.forEach(variable -> row.add(model.get(variable)));
      row.add(Semantics.evaluate(formula, model));
      rows.add(row.build());
    }
    return new TruthTable(formula, columns.build(), rows.build());
  }

  /** Returns the values of the formula, one per row. */
  public List<Boolean> values() {
    final int last = columns.size() - 1;
    return ImmutableList.copyOf(
        rows.stream().map(row -> row.get(last)).iterator());
  }

  /** Prints this table using the default configuration. */
  public void print(PrintWriter w) {
    print(w, ImmutableMap.of());
  }

  /** Prints this table; {@link Prop#CELL_PADDING} controls the spacing. */
  public void print(PrintWriter w, Map<Prop, Object> config) {
    final int padding = Prop.CELL_PADDING.intValue(config);
    final StringBuilder b = new StringBuilder();
    line(b, padding, columns);
    w.println(str(b));
    b.append('|');
    for (String column : columns) {
      b.append(Strings.repeat("-", width(column) + 2 * padding)).append('|');
    }
    w.println(str(b));
    for (List<Boolean> row : rows) {
      final ImmutableList.Builder<String> cells = ImmutableList.builder();
      row.forEach(value -> cells.add(value ? "T" : "F"));
      line(b, padding, cells.build());
      w.println(str(b));
    }
    w.flush();
  }

  /** Appends a line of cells, each centered in its column. */
  private void line(StringBuilder b, int padding, List<String> cells) {
    final String pad = Strings.repeat(" ", padding);
    b.append('|');
    for (int i = 0; i < cells.size(); i++) {
      b.append(pad)
          .append(center(cells.get(i), width(columns.get(i))))
          .append(pad)
          .append('|');
    }
  }

  private static int width(String column) {
    return Math.max(column.length(), 1);
  }

  /** Centers a string; if the padding is odd, the extra space goes on the
   * right. */
  private static String center(String s, int width) {
    final int pad = width - s.length();
    final int left = pad / 2;
    return Strings.repeat(" ", left) + s + Strings.repeat(" ", pad - left);
  }

  @Override
  public String toString() {
    final StringWriter sw = new StringWriter();
    print(new PrintWriter(sw));
    return sw.toString();
  }
}

// End TruthTable.java
