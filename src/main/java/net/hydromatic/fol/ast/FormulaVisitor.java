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
package net.hydromatic.fol.ast;

/**
 * Visitor over {@link Formula} objects.
 *
 * <p>The default implementations visit sub-formulas but not terms.
 *
 * @param <R> return type from {@code visit} methods
 * @see Formula#accept(FormulaVisitor)
 */
public class FormulaVisitor<R> {
  /** Visits a {@link Formula.Falsum}. */
  public R visit(Formula.Falsum falsum) {
    return null;
  }

  /** Visits a {@link Formula.Equal}. */
  public R visit(Formula.Equal equal) {
    return null;
  }

  /** Visits a {@link Formula.Rel}. */
  public R visit(Formula.Rel rel) {
    return null;
  }

  /** Visits a {@link Formula.AppRel}. */
  public R visit(Formula.AppRel appRel) {
    return appRel.rel.accept(this);
  }

  /** Visits a {@link Formula.Imp}. */
  public R visit(Formula.Imp imp) {
    imp.antecedent.accept(this);
    return imp.consequent.accept(this);
  }

  /** Visits a {@link Formula.All}. */
  public R visit(Formula.All all) {
    return all.body.accept(this);
  }
}

// End FormulaVisitor.java
