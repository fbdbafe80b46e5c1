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
package net.hydromatic.fol.derive;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.fol.ast.FolBuilder.fol;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Formulas;
import net.hydromatic.fol.ast.Symbol;
import net.hydromatic.fol.ast.Term;
import net.hydromatic.fol.kernel.Derivation;
import net.hydromatic.fol.kernel.Kernel;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Derived rules of inference.
 *
 * <p>Every method here builds its result from the primitive rules of a
 * {@link Kernel}, and so cannot produce anything the kernel would not.
 * Arguments of the wrong shape cause {@link IllegalArgumentException} if
 * the shape can be checked up front, or
 * {@link net.hydromatic.fol.kernel.KernelException} from the rule that
 * fails.
 *
 * <p>Connectives other than {@code ⊥}, {@code ⟹} and {@code ∀} are
 * abbreviations (see {@link net.hydromatic.fol.ast.FolBuilder}), so the
 * introduction and elimination rules for them are theorems about
 * implication.
 */
public class Rules {
  private final Kernel k;

  private Rules(Kernel kernel) {
    this.k = requireNonNull(kernel);
  }

  /** Creates a set of derived rules that calls the given kernel. */
  public static Rules of(Kernel kernel) {
    return new Rules(kernel);
  }

  /** Returns the kernel. */
  public Kernel kernel() {
    return k;
  }

  //~ Structural rules -------------------------------------------------------

  /** Given {@code Γ ⊢ A} and {@code Δ ⊇ Γ}, derives {@code Δ ⊢ A}. */
  public Derivation weaken(Set<Formula> delta, Derivation d) {
    return Derivations.weaken(k, delta, d);
  }

  /** Given {@code Γ ⊢ A}, derives {@code lift(Γ, n, m) ⊢ lift(A, n, m)}. */
  public Derivation lift(Derivation d, int n, int m) {
    return Derivations.lift(k, d, n, m);
  }

  /** Given {@code Γ ⊢ A}, derives {@code Γ[s // n] ⊢ A[s // n]}. */
  public Derivation subst(Derivation d, Term s, int n) {
    return Derivations.subst(k, d, s, n);
  }

  /** Inverse of implication introduction: given {@code Γ ⊢ A ⟹ B},
   * derives {@code Γ ∪ {A} ⊢ B}. */
  public Derivation deduction(Derivation d) {
    final Formula.Imp imp = asImp(d.conclusion);
    final ImmutableSet<Formula> gamma =
        Formulas.plus(d.premises, imp.antecedent);
    return k.impE(weaken(gamma, d), k.axm(gamma, imp.antecedent));
  }

  //~ Implication and negation -----------------------------------------------

  /** Derives {@code Γ ⊢ A ⟹ A}. */
  public Derivation impSelf(Set<Formula> gamma, Formula a) {
    return k.impI(gamma, a, k.axm(Formulas.plus(gamma, a), a));
  }

  /** Given {@code Γ ⊢ A ⟹ B} and {@code Γ ⊢ B ⟹ C}, derives
   * {@code Γ ⊢ A ⟹ C}. */
  public Derivation impTrans(Derivation d1, Derivation d2) {
    final Formula.Imp imp = asImp(d1.conclusion);
    final ImmutableSet<Formula> g = Formulas.plus(d1.premises, imp.antecedent);
    return k.impI(d1.premises, imp.antecedent,
        k.impE(weaken(g, d2),
            k.impE(weaken(g, d1), k.axm(g, imp.antecedent))));
  }

  /** Ex falso quodlibet: given {@code Γ ⊢ ⊥}, derives {@code Γ ⊢ A}. */
  public Derivation exfalso(Formula a, Derivation d) {
    checkArgument(d.conclusion instanceof Formula.Falsum,
        "not falsum: %s", d.conclusion);
    return k.falsumE(d.premises, a,
        weaken(Formulas.plus(d.premises, fol.not(a)), d));
  }

  /** Negation introduction: given {@code Γ ∪ {A} ⊢ ⊥}, derives
   * {@code Γ ⊢ ¬A}. */
  public Derivation notI(Set<Formula> gamma, Formula a, Derivation d) {
    checkArgument(d.conclusion instanceof Formula.Falsum,
        "not falsum: %s", d.conclusion);
    return k.impI(gamma, a, d);
  }

  /** Negation elimination: given {@code Γ ⊢ ¬A} and {@code Γ ⊢ A}, derives
   * {@code Γ ⊢ ⊥}. */
  public Derivation notE(Derivation dNotA, Derivation dA) {
    checkArgument(dNotA.conclusion.equals(fol.not(dA.conclusion)),
        "%s is not the negation of %s", dNotA.conclusion, dA.conclusion);
    return k.impE(dNotA, dA);
  }

  /** Given {@code Γ ⊢ A} and {@code Γ ⊢ ¬A}, derives {@code Γ ⊢ ⊥}. */
  public Derivation contradiction(Derivation dA, Derivation dNotA) {
    return notE(dNotA, dA);
  }

  /** Given {@code Γ ⊢ A}, derives {@code Γ ⊢ ¬¬A}. */
  public Derivation notNotI(Derivation d) {
    final Formula notA = fol.not(d.conclusion);
    final ImmutableSet<Formula> g = Formulas.plus(d.premises, notA);
    return k.impI(d.premises, notA, k.impE(k.axm(g, notA), weaken(g, d)));
  }

  /** Double negation elimination: given {@code Γ ⊢ ¬¬A}, derives
   * {@code Γ ⊢ A}. */
  public Derivation notNotE(Derivation d) {
    final Formula notA = negand(d.conclusion);
    final Formula a = negand(notA);
    final ImmutableSet<Formula> g = Formulas.plus(d.premises, notA);
    return k.falsumE(d.premises, a, k.impE(weaken(g, d), k.axm(g, notA)));
  }

  /** Given {@code Γ ⊢ A ∧ ¬A}, derives {@code Γ ⊢ ⊥}. */
  public Derivation notAndSelf(Derivation d) {
    final Derivation a = andE1(d);
    final Derivation notA = andE2(d);
    return notE(notA, a);
  }

  //~ Conjunction, disjunction, equivalence ----------------------------------

  /** Given {@code Γ ⊢ A} and {@code Γ ⊢ B}, derives {@code Γ ⊢ A ∧ B}. */
  public Derivation andI(Derivation dA, Derivation dB) {
    checkArgument(dA.premises.equals(dB.premises),
        "premises differ: %s, %s", dA.premises, dB.premises);
    final Formula hyp =
        fol.imp(dA.conclusion, fol.not(dB.conclusion));
    final ImmutableSet<Formula> g = Formulas.plus(dA.premises, hyp);
    final Derivation bot =
        k.impE(k.impE(k.axm(g, hyp), weaken(g, dA)), weaken(g, dB));
    return k.impI(dA.premises, hyp, bot);
  }

  /** Given {@code Γ ⊢ A ∧ B}, derives {@code Γ ⊢ A}. */
  public Derivation andE1(Derivation d) {
    final List<Formula> ab = conjuncts(d.conclusion);
    final Formula a = ab.get(0);
    final Formula notA = fol.not(a);
    final ImmutableSet<Formula> g1 = Formulas.plus(d.premises, notA);
    final ImmutableSet<Formula> g2 = Formulas.plus(g1, a);
    final Derivation bot2 = k.impE(k.axm(g2, notA), k.axm(g2, a));
    final Derivation notB = exfalso(fol.not(ab.get(1)), bot2);
    final Derivation bot1 =
        k.impE(weaken(g1, d), k.impI(g1, a, notB));
    return k.falsumE(d.premises, a, bot1);
  }

  /** Given {@code Γ ⊢ A ∧ B}, derives {@code Γ ⊢ B}. */
  public Derivation andE2(Derivation d) {
    final List<Formula> ab = conjuncts(d.conclusion);
    final Formula b = ab.get(1);
    final Formula notB = fol.not(b);
    final ImmutableSet<Formula> g1 = Formulas.plus(d.premises, notB);
    final Derivation i =
        k.impI(g1, ab.get(0), k.axm(Formulas.plus(g1, ab.get(0)), notB));
    return k.falsumE(d.premises, b, k.impE(weaken(g1, d), i));
  }

  /** Given {@code Γ ⊢ A}, derives {@code Γ ⊢ A ∨ B}. */
  public Derivation orI1(Derivation dA, Formula b) {
    final Formula notA = fol.not(dA.conclusion);
    final ImmutableSet<Formula> g = Formulas.plus(dA.premises, notA);
    final Derivation bot = k.impE(k.axm(g, notA), weaken(g, dA));
    return k.impI(dA.premises, notA, exfalso(b, bot));
  }

  /** Given {@code Γ ⊢ B}, derives {@code Γ ⊢ A ∨ B}. */
  public Derivation orI2(Formula a, Derivation dB) {
    final Formula notA = fol.not(a);
    return k.impI(dB.premises, notA,
        weaken(Formulas.plus(dB.premises, notA), dB));
  }

  /**
   * Disjunction elimination: given {@code Γ ⊢ A ∨ B},
   * {@code Γ ∪ {A} ⊢ C} and {@code Γ ∪ {B} ⊢ C}, derives {@code Γ ⊢ C}.
   *
   * <p>The case derivations may use fewer premises than
   * {@code Γ ∪ {A}} and {@code Γ ∪ {B}}.
   */
  public Derivation orE(Derivation d, Derivation d1, Derivation d2) {
    final Formula.Imp imp = asImp(d.conclusion);
    final Formula a = negand(imp.antecedent);
    final Formula b = imp.consequent;
    final Formula c = d1.conclusion;
    checkArgument(c.equals(d2.conclusion),
        "cases have different conclusions: %s, %s", c, d2.conclusion);
    final Formula notC = fol.not(c);
    final ImmutableSet<Formula> g = Formulas.plus(d.premises, notC);
    final ImmutableSet<Formula> ga = Formulas.plus(g, a);
    final Derivation notA =
        k.impI(g, a, k.impE(k.axm(ga, notC), weaken(ga, d1)));
    final Derivation dB = k.impE(weaken(g, d), notA);
    final Derivation dC =
        k.impE(k.impI(g, b, weaken(Formulas.plus(g, b), d2)), dB);
    return k.falsumE(d.premises, c, k.impE(k.axm(g, notC), dC));
  }

  /** Excluded middle: derives {@code Γ ⊢ A ∨ ¬A}. */
  public Derivation lem(Set<Formula> gamma, Formula a) {
    // A ∨ ¬A abbreviates ¬A ⟹ ¬A
    return impSelf(gamma, fol.not(a));
  }

  /** Given {@code Γ ∪ {A} ⊢ C} and {@code Γ ∪ {¬A} ⊢ C}, derives
   * {@code Γ ⊢ C}. */
  public Derivation byCases(Set<Formula> gamma, Formula a, Derivation d1,
      Derivation d2) {
    return orE(lem(gamma, a), d1, d2);
  }

  /** Given {@code Γ ⊢ A ⟹ B} and {@code Γ ⊢ B ⟹ A}, derives
   * {@code Γ ⊢ A ⇔ B}. */
  public Derivation iffI(Derivation dAB, Derivation dBA) {
    final Formula.Imp ab = asImp(dAB.conclusion);
    checkArgument(dBA.conclusion.equals(fol.imp(ab.consequent, ab.antecedent)),
        "%s is not the converse of %s", dBA.conclusion, ab);
    return andI(dAB, dBA);
  }

  /** Given {@code Γ ⊢ A ⇔ B} and {@code Γ ⊢ A}, derives {@code Γ ⊢ B}. */
  public Derivation iffE1(Derivation d, Derivation dA) {
    return k.impE(andE1(d), dA);
  }

  /** Given {@code Γ ⊢ A ⇔ B} and {@code Γ ⊢ B}, derives {@code Γ ⊢ A}. */
  public Derivation iffE2(Derivation d, Derivation dB) {
    return k.impE(andE2(d), dB);
  }

  /** Derives {@code Γ ⊢ A ⇔ A}. */
  public Derivation iffRefl(Set<Formula> gamma, Formula a) {
    final Derivation d = impSelf(gamma, a);
    return andI(d, d);
  }

  /** Given {@code Γ ⊢ A ⇔ B}, derives {@code Γ ⊢ B ⇔ A}. */
  public Derivation iffSymm(Derivation d) {
    return andI(andE2(d), andE1(d));
  }

  //~ Quantifiers ------------------------------------------------------------

  /** Instantiates the outermost quantifiers of {@code Γ ⊢ ∀...∀A} with
   * each term in turn. */
  public Derivation allE(Derivation d, Term... terms) {
    Derivation d2 = d;
    for (Term term : terms) {
      d2 = k.allE(term, d2);
    }
    return d2;
  }

  /** Existential introduction: given {@code Γ ⊢ A[t // 0]}, derives
   * {@code Γ ⊢ ∃A}. */
  public Derivation exI(Formula body, Term t, Derivation d) {
    checkArgument(d.conclusion.equals(body.subst(t, 0)),
        "%s is not an instance of %s", d.conclusion, body);
    final Formula allNot = fol.all(fol.not(body));
    final ImmutableSet<Formula> g = Formulas.plus(d.premises, allNot);
    final Derivation bot =
        k.impE(k.allE(t, k.axm(g, allNot)), weaken(g, d));
    return k.impI(d.premises, allNot, bot);
  }

  /**
   * Existential elimination: given {@code Γ ⊢ ∃A} and
   * {@code lift1(Γ) ∪ {A} ⊢ lift1(B)}, derives {@code Γ ⊢ B}.
   *
   * <p>Inside the second derivation, variable 0 stands for the witness;
   * because {@code B} is lifted, the witness does not escape.
   */
  public Derivation exE(Derivation d, Formula b, Derivation dB) {
    final Formula body = exBody(d.conclusion);
    final Formula liftedB = b.lift(1);
    checkArgument(dB.conclusion.equals(liftedB),
        "%s is not %s", dB.conclusion, liftedB);
    final Formula notB = fol.not(b);
    final ImmutableSet<Formula> g = Formulas.plus(d.premises, notB);
    final ImmutableSet<Formula> lg = Formulas.lift1(g);
    final ImmutableSet<Formula> lga = Formulas.plus(lg, body);
    final Derivation bot =
        k.impE(k.axm(lga, fol.not(liftedB)), weaken(lga, dB));
    final Derivation allNot = k.allI(g, k.impI(lg, body, bot));
    return k.falsumE(d.premises, b, k.impE(weaken(g, d), allNot));
  }

  //~ Equality ---------------------------------------------------------------

  /** Symmetry: given {@code Γ ⊢ s ≃ t}, derives {@code Γ ⊢ t ≃ s}. */
  public Derivation symm(Derivation d) {
    final Formula.Equal equal = asEqual(d.conclusion);
    final Formula template = fol.equal(fol.var(0), equal.left.lift(1));
    return k.subst(template, d, k.ref(d.premises, equal.left));
  }

  /** Transitivity: given {@code Γ ⊢ s ≃ t} and {@code Γ ⊢ t ≃ u}, derives
   * {@code Γ ⊢ s ≃ u}. */
  public Derivation trans(Derivation d1, Derivation d2) {
    final Formula.Equal equal = asEqual(d1.conclusion);
    final Formula template = fol.equal(equal.left.lift(1), fol.var(0));
    return k.subst(template, d2, d1);
  }

  /** Congruence: given {@code Γ ⊢ s ≃ t} and a term {@code u}, derives
   * {@code Γ ⊢ u[s // 0] ≃ u[t // 0]}. */
  public Derivation congr(Term u, Derivation d) {
    final Formula.Equal equal = asEqual(d.conclusion);
    final Term us = u.subst(equal.left, 0);
    return k.subst(fol.equal(us.lift(1), u), d, k.ref(d.premises, us));
  }

  /** Given {@code Γ ⊢ sᵢ ≃ tᵢ} for each argument of {@code f}, derives
   * {@code Γ ⊢ f(s₀, ...) ≃ f(t₀, ...)}. */
  public Derivation appCongr(Set<Formula> gamma, Symbol.Fn f,
      List<Derivation> equalities) {
    final List<Formula.Equal> equals = equalities(gamma, f, equalities);
    Derivation d =
        k.ref(gamma, fol.apps(f, sides(equals, 0, false)));
    for (int i = 0; i < equals.size(); i++) {
      final Term template = fol.apps(f, templateArgs(equals, i));
      d = trans(d, congr(template, equalities.get(i)));
    }
    return d;
  }

  /** Given {@code Γ ⊢ sᵢ ≃ tᵢ} for each argument of {@code R}, and
   * {@code Γ ⊢ R(s₀, ...)}, derives {@code Γ ⊢ R(t₀, ...)}. */
  public Derivation relCongr(Symbol.Rel r, List<Derivation> equalities,
      Derivation d) {
    final List<Formula.Equal> equals = equalities(d.premises, r, equalities);
    Derivation d2 = d;
    for (int i = 0; i < equals.size(); i++) {
      final Formula template = fol.appsRel(r, templateArgs(equals, i));
      d2 = k.subst(template, equalities.get(i), d2);
    }
    return d2;
  }

  /** Given {@code Γ ⊢ sᵢ ≃ tᵢ} for each argument of {@code R}, derives
   * {@code Γ ⊢ R(s₀, ...) ⇔ R(t₀, ...)}. */
  public Derivation relIff(Set<Formula> gamma, Symbol.Rel r,
      List<Derivation> equalities) {
    final List<Formula.Equal> equals = equalities(gamma, r, equalities);
    final Formula rs =
        fol.appsRel(r, sides(equals, 0, false));
    final Formula rt =
        fol.appsRel(r, sides(equals, equals.size(), false));
    final ImmutableSet<Formula> gs = Formulas.plus(gamma, rs);
    final ImmutableSet<Formula> gt = Formulas.plus(gamma, rt);
    final List<Derivation> forward = new ArrayList<>();
    final List<Derivation> backward = new ArrayList<>();
    for (Derivation equality : equalities) {
      forward.add(weaken(gs, equality));
      backward.add(symm(weaken(gt, equality)));
    }
    return andI(
        k.impI(gamma, rs, relCongr(r, forward, k.axm(gs, rs))),
        k.impI(gamma, rt, relCongr(r, backward, k.axm(gt, rt))));
  }

  //~ Helpers ----------------------------------------------------------------

  private static Formula.Imp asImp(Formula f) {
    checkArgument(f instanceof Formula.Imp, "not an implication: %s", f);
    return (Formula.Imp) f;
  }

  private static Formula.Equal asEqual(Formula f) {
    checkArgument(f instanceof Formula.Equal, "not an equality: %s", f);
    return (Formula.Equal) f;
  }

  private static Formula negand(Formula f) {
    final @Nullable Formula negand = f.negand();
    checkArgument(negand != null, "not a negation: %s", f);
    return negand;
  }

  /** Splits {@code A ∧ B}, that is {@code ¬(A ⟹ ¬B)}, into {@code [A, B]}. */
  private static List<Formula> conjuncts(Formula f) {
    final Formula.Imp imp = asImp(negand(f));
    return ImmutableList.of(imp.antecedent, negand(imp.consequent));
  }

  /** Returns {@code A} given {@code ∃A}, that is {@code ¬∀¬A}. */
  private static Formula exBody(Formula f) {
    final Formula all = negand(f);
    checkArgument(all instanceof Formula.All, "not existential: %s", f);
    return negand(((Formula.All) all).body);
  }

  private static List<Formula.Equal> equalities(Set<Formula> gamma,
      Symbol symbol, List<Derivation> equalities) {
    checkArgument(equalities.size() == symbol.arity,
        "%s has arity %s but %s equalities were given", symbol,
        symbol.arity, equalities.size());
    final ImmutableList.Builder<Formula.Equal> b = ImmutableList.builder();
    for (Derivation d : equalities) {
      checkArgument(d.premises.equals(gamma),
          "premises differ: %s, %s", d.premises, gamma);
      b.add(asEqual(d.conclusion));
    }
    return b.build();
  }

  /** Returns right-hand sides before {@code i} and left-hand sides from
   * {@code i}, lifted if {@code lift}. */
  private static List<Term> sides(List<Formula.Equal> equals, int i,
      boolean lift) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    for (int j = 0; j < equals.size(); j++) {
      final Term t = j < i ? equals.get(j).right : equals.get(j).left;
      b.add(lift ? t.lift(1) : t);
    }
    return b.build();
  }

  /** Arguments of the template that rewrites argument {@code i}:
   * right-hand sides before it, variable 0 at it, left-hand sides after
   * it, all lifted by one. */
  private static List<Term> templateArgs(List<Formula.Equal> equals, int i) {
    final List<Term> args = new ArrayList<>(sides(equals, i, true));
    args.set(i, fol.var(0));
    return args;
  }
}

// End Rules.java
