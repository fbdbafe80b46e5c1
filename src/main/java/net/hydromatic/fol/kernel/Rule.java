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

/** The primitive rules of natural deduction. */
public enum Rule {
  /** Assumption: if {@code A ∈ Γ}, then {@code Γ ⊢ A}. */
  AXM("axm"),
  /** Implication introduction: from {@code Γ ∪ {A} ⊢ B} derive
   * {@code Γ ⊢ A ⟹ B}. */
  IMP_I("impI"),
  /** Implication elimination (modus ponens). */
  IMP_E("impE"),
  /** Proof by contradiction: from {@code Γ ∪ {¬A} ⊢ ⊥} derive
   * {@code Γ ⊢ A}. */
  FALSUM_E("falsumE"),
  /** Universal introduction: from {@code lift1(Γ) ⊢ A} derive
   * {@code Γ ⊢ ∀A}. */
  ALL_I("allI"),
  /** Universal elimination: from {@code Γ ⊢ ∀A} derive
   * {@code Γ ⊢ A[t // 0]}. */
  ALL_E("allE"),
  /** Reflexivity of equality. */
  REF("ref"),
  /** Substitution of equals: from {@code Γ ⊢ s ≃ t} and
   * {@code Γ ⊢ F[s // 0]} derive {@code Γ ⊢ F[t // 0]}. */
  SUBST("subst");

  public final String camelName;

  Rule(String camelName) {
    this.camelName = camelName;
  }
}

// End Rule.java
