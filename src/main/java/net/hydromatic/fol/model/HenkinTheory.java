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
package net.hydromatic.fol.model;

import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Signature;
import net.hydromatic.fol.ast.Symbol;

/**
 * A complete, consistent theory with enough constants.
 *
 * <ul>
 * <li>Complete: for every sentence {@code A} over the signature, the theory
 * contains exactly one of {@code A} and {@code ¬A}.
 * <li>Enough constants: for every formula {@code A} in one variable there
 * is a constant {@code c}, the {@link #witness}, such that the theory
 * contains {@code ∃A ⟹ A[c // 0]}; and for
 * every closed term {@code t} there is a constant {@code c} such that it
 * contains {@code t ≃ c}.
 * <li>Deductively closed: if a derivation from the theory concludes
 * {@code A}, the theory contains {@code A}.
 * </ul>
 *
 * <p>These are obligations on the implementor. {@link TermModel} relies on
 * them, and reports {@link IllegalStateException} where it finds one
 * broken.
 *
 * @see Theories#ofStructure
 */
public abstract class HenkinTheory extends Theory {
  protected HenkinTheory(Signature signature) {
    super(signature);
  }

  /** Given a formula {@code A} whose only free variable is 0, returns a
   * constant {@code c} such that the Henkin axiom
   * {@code ∃A ⟹ A[c // 0]} is in this theory.
   *
   * <p>If {@code ∃A} is in the theory, so is {@code A[c // 0]}. If not,
   * the axiom holds whatever {@code c} is. */
  public abstract Symbol.Fn witness(Formula body);
}

// End HenkinTheory.java
