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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.fol.ast.FolBuilder.fol;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Formulas;
import net.hydromatic.fol.ast.Term;

/**
 * The trusted kernel of natural deduction.
 *
 * <p>Each public method applies one of the eight primitive rules
 * ({@link Rule}). If the arguments have the shape that the rule requires, the
 * method returns a new {@link Derivation}; otherwise it throws
 * {@link KernelException}. There is no other way to create a derivation.
 *
 * <p>A kernel has no state other than its {@link Tracer}; all kernels accept
 * and produce the same derivations.
 */
public class Kernel {
  private static final Kernel DEFAULT = new Kernel(Tracers.empty());

  private final Tracer tracer;

  private Kernel(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /** Returns a kernel that does not trace. */
  public static Kernel create() {
    return DEFAULT;
  }

  /** Returns a kernel that reports to the given tracer. */
  public static Kernel create(Tracer tracer) {
    return new Kernel(tracer);
  }

  private <D extends Derivation> D accept(D derivation) {
    tracer.onRule(derivation);
    return derivation;
  }

  private KernelException reject(Rule rule, String format, Object... args) {
    final KernelException e =
        new KernelException(rule, String.format(format, args));
    tracer.onRejected(e);
    return e;
  }

  private void checkFormula(Rule rule, Formula formula) {
    if (formula.arity != 0) {
      throw reject(rule, "formula %s is not fully applied", formula);
    }
  }

  private void checkTerm(Rule rule, Term term) {
    if (term.arity != 0) {
      throw reject(rule, "term %s is not fully applied", term);
    }
  }

  private ImmutableSet<Formula> checkPremises(Rule rule, Set<Formula> gamma) {
    for (Formula formula : gamma) {
      checkFormula(rule, formula);
    }
    return ImmutableSet.copyOf(gamma);
  }

  private void checkSamePremises(Rule rule, Derivation d0, Derivation d1) {
    if (!d0.premises.equals(d1.premises)) {
      throw reject(rule, "premises differ: %s, %s", d0.premises, d1.premises);
    }
  }

  /** Assumption: {@code Γ ⊢ A} if {@code A ∈ Γ}. */
  public Derivation axm(Set<Formula> gamma, Formula a) {
    final ImmutableSet<Formula> premises = checkPremises(Rule.AXM, gamma);
    if (!premises.contains(a)) {
      throw reject(Rule.AXM, "%s is not a premise in %s", a, premises);
    }
    return accept(new Derivation.Axm(premises, a));
  }

  /** Implication introduction: from {@code Γ ∪ {A} ⊢ B} derives
   * {@code Γ ⊢ A ⟹ B}. */
  public Derivation impI(Set<Formula> gamma, Formula a, Derivation d) {
    final ImmutableSet<Formula> premises = checkPremises(Rule.IMP_I, gamma);
    checkFormula(Rule.IMP_I, a);
    if (!d.premises.equals(Formulas.plus(premises, a))) {
      throw reject(Rule.IMP_I, "premises %s are not %s plus %s", d.premises,
          premises, a);
    }
    return accept(new Derivation.ImpI(premises, a, d));
  }

  /** Implication introduction, discharging {@code A} from the premises of
   * {@code d}. */
  public Derivation impI(Formula a, Derivation d) {
    final ImmutableSet.Builder<Formula> gamma = ImmutableSet.builder();
    d.premises.forEach(f -> {
      if (!f.equals(a)) {
        gamma.add(f);
      }
    });
    return impI(gamma.build(), a, d);
  }

  /** Implication elimination: from {@code Γ ⊢ A ⟹ B} and {@code Γ ⊢ A}
   * derives {@code Γ ⊢ B}. */
  public Derivation impE(Derivation major, Derivation minor) {
    if (!(major.conclusion instanceof Formula.Imp)) {
      throw reject(Rule.IMP_E, "%s is not an implication", major.conclusion);
    }
    final Formula.Imp imp = (Formula.Imp) major.conclusion;
    if (!imp.antecedent.equals(minor.conclusion)) {
      throw reject(Rule.IMP_E, "antecedent of %s is not %s", imp,
          minor.conclusion);
    }
    checkSamePremises(Rule.IMP_E, major, minor);
    return accept(new Derivation.ImpE(major, minor));
  }

  /** Proof by contradiction: from {@code Γ ∪ {¬A} ⊢ ⊥} derives
   * {@code Γ ⊢ A}. */
  public Derivation falsumE(Set<Formula> gamma, Formula a, Derivation d) {
    final ImmutableSet<Formula> premises = checkPremises(Rule.FALSUM_E, gamma);
    checkFormula(Rule.FALSUM_E, a);
    if (!(d.conclusion instanceof Formula.Falsum)) {
      throw reject(Rule.FALSUM_E, "%s is not falsum", d.conclusion);
    }
    if (!d.premises.equals(Formulas.plus(premises, fol.not(a)))) {
      throw reject(Rule.FALSUM_E, "premises %s are not %s plus %s",
          d.premises, premises, fol.not(a));
    }
    return accept(new Derivation.FalsumE(premises, a, d));
  }

  /** Proof by contradiction, discharging {@code ¬A} from the premises of
   * {@code d}. */
  public Derivation falsumE(Formula a, Derivation d) {
    final Formula notA = fol.not(a);
    final ImmutableSet.Builder<Formula> gamma = ImmutableSet.builder();
    d.premises.forEach(f -> {
      if (!f.equals(notA)) {
        gamma.add(f);
      }
    });
    return falsumE(gamma.build(), a, d);
  }

  /** Universal introduction: from {@code lift1(Γ) ⊢ A} derives
   * {@code Γ ⊢ ∀A}.
   *
   * <p>Because every premise of {@code d} is lifted, variable 0 does not
   * occur free in them; no separate freshness check is needed. */
  public Derivation allI(Set<Formula> gamma, Derivation d) {
    final ImmutableSet<Formula> premises = checkPremises(Rule.ALL_I, gamma);
    final ImmutableSet<Formula> lifted = Formulas.lift1(premises);
    if (!d.premises.equals(lifted)) {
      throw reject(Rule.ALL_I, "premises %s are not %s", d.premises, lifted);
    }
    return accept(new Derivation.AllI(premises, d));
  }

  /** Universal elimination: from {@code Γ ⊢ ∀A} derives
   * {@code Γ ⊢ A[t // 0]}. */
  public Derivation allE(Term t, Derivation d) {
    checkTerm(Rule.ALL_E, t);
    if (!(d.conclusion instanceof Formula.All)) {
      throw reject(Rule.ALL_E, "%s is not universally quantified",
          d.conclusion);
    }
    final Formula body = ((Formula.All) d.conclusion).body;
    return accept(new Derivation.AllE(t, d, body.subst(t, 0)));
  }

  /** Reflexivity: {@code Γ ⊢ t ≃ t}. */
  public Derivation ref(Set<Formula> gamma, Term t) {
    final ImmutableSet<Formula> premises = checkPremises(Rule.REF, gamma);
    checkTerm(Rule.REF, t);
    return accept(new Derivation.Ref(premises, t));
  }

  /** Substitution of equals: from {@code Γ ⊢ s ≃ t} and
   * {@code Γ ⊢ F[s // 0]} derives {@code Γ ⊢ F[t // 0]}. */
  public Derivation subst(Formula template, Derivation equality,
      Derivation d) {
    checkFormula(Rule.SUBST, template);
    if (!(equality.conclusion instanceof Formula.Equal)) {
      throw reject(Rule.SUBST, "%s is not an equality", equality.conclusion);
    }
    final Formula.Equal equal = (Formula.Equal) equality.conclusion;
    final Formula expected = template.subst(equal.left, 0);
    if (!d.conclusion.equals(expected)) {
      throw reject(Rule.SUBST, "%s is not %s", d.conclusion, expected);
    }
    checkSamePremises(Rule.SUBST, equality, d);
    return accept(
        new Derivation.Subst(template, equality, d,
            template.subst(equal.right, 0)));
  }
}

// End Kernel.java
