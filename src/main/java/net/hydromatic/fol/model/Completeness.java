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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.fol.ast.FolBuilder.fol;

import com.google.common.collect.ImmutableSet;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Formulas;
import net.hydromatic.fol.ast.Term;
import net.hydromatic.fol.derive.Rules;
import net.hydromatic.fol.kernel.Derivation;
import net.hydromatic.fol.kernel.Kernel;

/**
 * Completeness for Henkin theories: every sentence, or its negation, is
 * derivable from the theory, and which one is decided by the term model.
 *
 * <p>{@link #derive} follows the cases of the truth lemma. Atomic sentences
 * and Henkin axioms are taken from the theory; everything else is built by
 * the kernel, so the premises of the result are a finite subset of the
 * theory.
 */
public class Completeness {
  private final Kernel kernel;
  private final Rules rules;
  private final TermModel model;
  private final TruthLemma truthLemma;

  private Completeness(Kernel kernel, TermModel model) {
    this.kernel = kernel;
    this.rules = Rules.of(kernel);
    this.model = model;
    this.truthLemma = TruthLemma.of(model);
  }

  public static Completeness of(Kernel kernel, TermModel model) {
    return new Completeness(kernel, model);
  }

  public static Completeness of(Kernel kernel, HenkinTheory theory) {
    return of(kernel, TermModel.of(theory));
  }

  /**
   * Returns a derivation from the theory of {@code sentence} if it is true
   * in the term model, otherwise of its negation.
   *
   * <p>Throws {@link IllegalStateException} if the theory breaks the
   * contract of {@link HenkinTheory}, for instance if it contains neither
   * an atomic sentence nor its negation.
   */
  public Derivation derive(Formula sentence) {
    checkArgument(sentence.isSentence(), "not a sentence: %s", sentence);
    checkArgument(Formulas.isOver(sentence, model.theory.signature),
        "%s is not over %s", sentence, model.theory.signature);
    truthLemma.verify(sentence);
    return decide(sentence);
  }

  /** Returns whether a sentence is derivable from the theory. */
  public boolean entails(Formula sentence) {
    return derive(sentence).conclusion.equals(sentence);
  }

  /** Derives {@code A} or {@code ¬A}, whichever is true. */
  private Derivation decide(Formula a) {
    switch (a.op) {
    case FALSUM:
      // ¬⊥ is ⊥ ⟹ ⊥
      return rules.impSelf(ImmutableSet.of(), a);
    case EQUAL:
    case REL:
    case APP_REL:
      return member(truthLemma.evaluate(a) ? a : fol.not(a));
    case IMP:
      return decideImp((Formula.Imp) a);
    case ALL:
      return decideAll((Formula.All) a);
    default:
      throw new AssertionError(a.op);
    }
  }

  private Derivation decideImp(Formula.Imp imp) {
    final Formula a = imp.antecedent;
    final Formula b = imp.consequent;
    final Derivation dB = decide(b);
    if (dB.conclusion.equals(b)) {
      // from Γ ⊢ B
      final ImmutableSet<Formula> g = Formulas.plus(dB.premises, a);
      return kernel.impI(dB.premises, a, rules.weaken(g, dB));
    }
    final Derivation dA = decide(a);
    if (!dA.conclusion.equals(a)) {
      // from Γ ⊢ ¬A
      final ImmutableSet<Formula> g = Formulas.plus(dA.premises, a);
      return kernel.impI(dA.premises, a,
          rules.exfalso(b,
              kernel.impE(rules.weaken(g, dA), kernel.axm(g, a))));
    }
    // from Γ ⊢ A and Γ ⊢ ¬B, derive ¬(A ⟹ B)
    final ImmutableSet<Formula> gamma =
        Formulas.union(dA.premises, dB.premises);
    final ImmutableSet<Formula> g = Formulas.plus(gamma, imp);
    final Derivation dBottom =
        kernel.impE(rules.weaken(g, dB),
            kernel.impE(kernel.axm(g, imp), rules.weaken(g, dA)));
    return kernel.impI(gamma, imp, dBottom);
  }

  private Derivation decideAll(Formula.All all) {
    final Term c = fol.constant(model.theory.witness(fol.not(all.body)));
    final Formula instance = all.body.subst(c, 0);
    final Derivation dInstance = decide(instance);
    if (!dInstance.conclusion.equals(instance)) {
      // the counterexample refutes ∀A
      final ImmutableSet<Formula> gamma = dInstance.premises;
      final ImmutableSet<Formula> g = Formulas.plus(gamma, all);
      final Derivation dBottom =
          kernel.impE(rules.weaken(g, dInstance),
              kernel.allE(c, kernel.axm(g, all)));
      return kernel.impI(gamma, all, dBottom);
    }

    // The Henkin axiom ∃¬A ⟹ ¬A[c // 0] and A[c // 0] give ∀A. Suppose
    // ¬∀A. If ∀¬¬A then ∀A, a contradiction; so ∃¬A, so ¬A[c // 0].
    final Formula notA = fol.not(all.body);
    final Formula henkin = fol.imp(fol.ex(notA), fol.not(instance));
    final Derivation dHenkin = member(henkin);
    final ImmutableSet<Formula> gamma =
        Formulas.union(dInstance.premises, dHenkin.premises);
    final Formula notAll = fol.not(all);
    final Formula allNotNot = fol.all(fol.not(notA));
    final ImmutableSet<Formula> g1 = Formulas.plus(gamma, notAll);
    final ImmutableSet<Formula> g2 = Formulas.plus(g1, allNotNot);
    // g2 holds only sentences, so lift1(g2) = g2
    final Derivation dBody =
        rules.notNotE(
            kernel.allE(fol.var(0), kernel.axm(g2, allNotNot)));
    final Derivation dExNotA =
        kernel.impI(g1, allNotNot,
            kernel.impE(kernel.axm(g2, notAll), kernel.allI(g2, dBody)));
    final Derivation dNotInstance =
        kernel.impE(rules.weaken(g1, dHenkin), dExNotA);
    final Derivation dBottom =
        kernel.impE(dNotInstance, rules.weaken(g1, dInstance));
    return kernel.falsumE(gamma, all, dBottom);
  }

  /** Derives {@code {A} ⊢ A}, if the theory contains {@code A}. */
  private Derivation member(Formula a) {
    if (!model.theory.contains(a)) {
      throw new IllegalStateException("theory " + model.theory
          + " does not contain " + a);
    }
    return kernel.axm(ImmutableSet.of(a), a);
  }
}

// End Completeness.java
