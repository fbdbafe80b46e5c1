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
package net.hydromatic.fol.kernel;

/**
 * Visitor over {@link Derivation} objects.
 *
 * <p>The default implementations visit each input and return null.
 *
 * @param <R> return type from {@code visit} methods
 * @see Derivation#accept(DerivationVisitor)
 */
public class DerivationVisitor<R> {
  /** Visits each input of a derivation. */
  protected R visitInputs(Derivation derivation) {
    for (Derivation input : derivation.inputs()) {
      input.accept(this);
    }
    return null;
  }

  /** Visits a {@link Derivation.Axm}. */
  public R visit(Derivation.Axm axm) {
    return visitInputs(axm);
  }

  /** Visits a {@link Derivation.ImpI}. */
  public R visit(Derivation.ImpI impI) {
    return visitInputs(impI);
  }

  /** Visits a {@link Derivation.ImpE}. */
  public R visit(Derivation.ImpE impE) {
    return visitInputs(impE);
  }

  /** Visits a {@link Derivation.FalsumE}. */
  public R visit(Derivation.FalsumE falsumE) {
    return visitInputs(falsumE);
  }

  /** Visits a {@link Derivation.AllI}. */
  public R visit(Derivation.AllI allI) {
    return visitInputs(allI);
  }

  /** Visits a {@link Derivation.AllE}. */
  public R visit(Derivation.AllE allE) {
    return visitInputs(allE);
  }

  /** Visits a {@link Derivation.Ref}. */
  public R visit(Derivation.Ref ref) {
    return visitInputs(ref);
  }

  /** Visits a {@link Derivation.Subst}. */
  public R visit(Derivation.Subst subst) {
    return visitInputs(subst);
  }
}

// End DerivationVisitor.java
