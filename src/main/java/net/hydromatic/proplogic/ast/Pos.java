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

import java.util.Objects;

/**
 * Position of a range of characters in the text of a formula.
 *
 * <p>Formulas occupy a single line, so a position is a pair of 1-based
 * columns. The end column is exclusive.
 */
public class Pos {
  public final int startColumn;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(int startColumn, int endColumn) {
    checkArgument(
        startColumn <= endColumn,
        "start column %s is after end column %s",
        startColumn,
        endColumn);
    this.startColumn = startColumn;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two 0-based offsets. */
  public static Pos of(int startOffset, int endOffset) {
    return new Pos(startOffset + 1, endOffset + 1);
  }

  /** Creates a Pos that covers the single character at a 0-based offset. */
  public static Pos at(int offset) {
    return of(offset, offset + 1);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startColumn, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.startColumn == ((Pos) o).startColumn
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("column ").append(startColumn);
    if (endColumn > startColumn + 1) {
      buf.append('-').append(endColumn - 1);
    }
    return buf;
  }
}

// End Pos.java
