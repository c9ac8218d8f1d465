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

/**
 * Visits and transforms formula trees.
 *
 * <p>The default methods transform the operands of a node first, then
 * rebuild the node if any operand changed. A sub-class that overrides a
 * method and calls {@code super} therefore sees the node with its operands
 * already transformed.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected Formula visit(Ast.Variable variable) {
    return variable; // leaf
  }

  protected Formula visit(Ast.Constant constant) {
    return constant; // leaf
  }

  protected Formula visit(Ast.Unary unary) {
    return unary.copy(unary.operand.accept(this));
  }

  protected Formula visit(Ast.Binary binary) {
    return binary.copy(binary.left.accept(this), binary.right.accept(this));
  }
}

// End Shuttle.java
