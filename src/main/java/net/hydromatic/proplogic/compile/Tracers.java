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
import static net.hydromatic.proplogic.util.Static.str;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import net.hydromatic.proplogic.ast.Formula;

/** Implementations of {@link Rewriter.Tracer}. */
public class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Rewriter.Tracer nullTracer() {
    return NullTracer.INSTANCE;
  }

  /** Returns a tracer that writes one line per rewrite step to a writer. */
  public static Rewriter.Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Returns a tracer that writes one line per rewrite step to a stream. */
  public static Rewriter.Tracer printTracer(OutputStream stream) {
    return printTracer(
        new PrintWriter(
            new OutputStreamWriter(stream, StandardCharsets.UTF_8)));
  }

  /** Implementation of {@link Rewriter.Tracer} that does nothing. */
  private enum NullTracer implements Rewriter.Tracer {
    INSTANCE;

    public void onEliminateConstants(Formula formula, Formula result) {}

    public void onRewrite(Basis basis, Formula formula, Formula result) {}
  }

  /**
   * Implementation of {@link Rewriter.Tracer} that writes to a given {@link
   * PrintWriter}.
   */
  private static class PrintTracer implements Rewriter.Tracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush() {
      w.println(str(b));
      w.flush();
    }

    public void onEliminateConstants(Formula formula, Formula result) {
      b.append("constants ").append(formula).append(" -> ").append(result);
      flush();
    }

    public void onRewrite(Basis basis, Formula formula, Formula result) {
      b.append(basis)
          .append(' ')
          .append(formula)
          .append(" -> ")
          .append(result);
      flush();
    }
  }
}

// End Tracers.java
