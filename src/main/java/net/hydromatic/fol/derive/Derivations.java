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

import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Formulas;
import net.hydromatic.fol.ast.Term;
import net.hydromatic.fol.kernel.Derivation;
import net.hydromatic.fol.kernel.DerivationVisitor;
import net.hydromatic.fol.kernel.Kernel;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Structural transformations of derivations: weakening, lifting and
 * substitution.
 *
 * <p>Each transformation rebuilds a derivation rule by rule, calling the
 * {@link Kernel} at every step; the result is therefore checked exactly as
 * if it had been built by hand.
 */
public abstract class Derivations {
  private Derivations() {}

  /**
   * Weakening: given {@code Γ ⊢ A} and {@code Δ ⊇ Γ}, returns
   * {@code Δ ⊢ A}.
   *
   * <p>The inclusion is threaded through every rule. Under {@code allI},
   * the premises become {@code lift1(Δ)}, which includes {@code lift1(Γ)}
   * because images preserve inclusion.
   */
  public static Derivation weaken(Kernel kernel, Set<Formula> delta,
      Derivation d) {
    checkArgument(delta.containsAll(d.premises),
        "%s does not include premises %s", delta, d.premises);
    return new Weakener(kernel, ImmutableSet.copyOf(delta)).apply(d);
  }

  /** Given {@code Γ ⊢ A}, returns
   * {@code lift(Γ, n, m) ⊢ lift(A, n, m)}. */
  public static Derivation lift(Kernel kernel, Derivation d, int n, int m) {
    checkArgument(n >= 0 && m >= 0, "invalid lift %s, %s", n, m);
    return new Lifter(kernel, n, m).go(d);
  }

  /** Given {@code Γ ⊢ A}, returns {@code Γ[s // n] ⊢ A[s // n]}. */
  public static Derivation subst(Kernel kernel, Derivation d, Term s, int n) {
    checkArgument(s.arity == 0, "not fully applied: %s", s);
    checkArgument(n >= 0, "negative index %s", n);
    return new Substituter(kernel, s, n).go(d);
  }

  /** Visitor that rebuilds a derivation, using a kernel.
   *
   * <p>Each input is rebuilt at most once per shuttle, however many times
   * it is shared. */
  abstract static class DerivationShuttle
      extends DerivationVisitor<Derivation> {
    final Kernel kernel;
    private final Map<Derivation, Derivation> done = new IdentityHashMap<>();

    DerivationShuttle(Kernel kernel) {
      this.kernel = requireNonNull(kernel);
    }

    /** Rebuilds a derivation, or returns the result of rebuilding it
     * earlier. */
    Derivation go(Derivation d) {
      Derivation d2 = done.get(d);
      if (d2 == null) {
        d2 = d.accept(this);
        done.put(d, d2);
      }
      return d2;
    }

    @Override
    public Derivation visit(Derivation.ImpE impE) {
      return kernel.impE(go(impE.major), go(impE.minor));
    }
  }

  /** Shuttle that rebuilds a derivation with a larger set of premises. */
  private static class Weakener extends DerivationShuttle {
    final ImmutableSet<Formula> delta;
    final Map<ImmutableSet<Formula>, Weakener> children;

    Weakener(Kernel kernel, ImmutableSet<Formula> delta) {
      this(kernel, delta, new HashMap<>());
    }

    private Weakener(Kernel kernel, ImmutableSet<Formula> delta,
        Map<ImmutableSet<Formula>, Weakener> children) {
      super(kernel);
      this.delta = delta;
      this.children = children;
    }

    Derivation apply(Derivation d) {
      return d.premises.equals(delta) ? d : go(d);
    }

    /** Weakens an input to a different set of premises. */
    private Derivation weaken(ImmutableSet<Formula> delta2, Derivation d) {
      if (delta2.equals(delta)) {
        return apply(d);
      }
      return children.computeIfAbsent(delta2,
          delta3 -> new Weakener(kernel, delta3, children)).apply(d);
    }

    @Override
    public Derivation visit(Derivation.Axm axm) {
      return kernel.axm(delta, axm.conclusion);
    }

    @Override
    public Derivation visit(Derivation.ImpI impI) {
      return kernel.impI(delta, impI.antecedent,
          weaken(Formulas.plus(delta, impI.antecedent), impI.input));
    }

    @Override
    public Derivation visit(Derivation.ImpE impE) {
      return kernel.impE(apply(impE.major), apply(impE.minor));
    }

    @Override
    public Derivation visit(Derivation.FalsumE falsumE) {
      return kernel.falsumE(delta, falsumE.conclusion,
          weaken(Formulas.plus(delta, fol.not(falsumE.conclusion)),
              falsumE.input));
    }

    @Override
    public Derivation visit(Derivation.AllI allI) {
      return kernel.allI(delta, weaken(Formulas.lift1(delta), allI.input));
    }

    @Override
    public Derivation visit(Derivation.AllE allE) {
      return kernel.allE(allE.term, apply(allE.input));
    }

    @Override
    public Derivation visit(Derivation.Ref ref) {
      return kernel.ref(delta, ref.term);
    }

    @Override
    public Derivation visit(Derivation.Subst subst) {
      return kernel.subst(subst.template, apply(subst.equality),
          apply(subst.input));
    }
  }

  /** Shuttle that lifts every formula and term in a derivation. */
  private static class Lifter extends DerivationShuttle {
    final int n;
    final int m;
    private @Nullable Lifter under;

    Lifter(Kernel kernel, int n, int m) {
      super(kernel);
      this.n = n;
      this.m = m;
    }

    /** Returns the shuttle that lifts beneath one more quantifier. */
    private Lifter under() {
      if (under == null) {
        under = new Lifter(kernel, n, m + 1);
      }
      return under;
    }

    private ImmutableSet<Formula> lift(Set<Formula> premises) {
      return Formulas.lift(premises, n, m);
    }

    @Override
    public Derivation visit(Derivation.Axm axm) {
      return kernel.axm(lift(axm.premises), axm.conclusion.lift(n, m));
    }

    @Override
    public Derivation visit(Derivation.ImpI impI) {
      return kernel.impI(lift(impI.premises), impI.antecedent.lift(n, m),
          go(impI.input));
    }

    @Override
    public Derivation visit(Derivation.FalsumE falsumE) {
      return kernel.falsumE(lift(falsumE.premises),
          falsumE.conclusion.lift(n, m), go(falsumE.input));
    }

    /** {@inheritDoc}
     *
     * <p>The input's premises are {@code lift1(Γ)}; lifting them at
     * {@code m + 1} gives {@code lift1(lift(Γ, n, m))}, because two lifts
     * commute when the second cut is below the first. */
    @Override
    public Derivation visit(Derivation.AllI allI) {
      return kernel.allI(lift(allI.premises), under().go(allI.input));
    }

    @Override
    public Derivation visit(Derivation.AllE allE) {
      return kernel.allE(allE.term.lift(n, m), go(allE.input));
    }

    @Override
    public Derivation visit(Derivation.Ref ref) {
      return kernel.ref(lift(ref.premises), ref.term.lift(n, m));
    }

    @Override
    public Derivation visit(Derivation.Subst subst) {
      return kernel.subst(subst.template.lift(n, m + 1),
          go(subst.equality), go(subst.input));
    }
  }

  /** Shuttle that substitutes a term for a variable throughout a
   * derivation. */
  private static class Substituter extends DerivationShuttle {
    final Term s;
    final int n;
    private @Nullable Substituter under;

    Substituter(Kernel kernel, Term s, int n) {
      super(kernel);
      this.s = s;
      this.n = n;
    }

    /** Returns the shuttle that substitutes beneath one more quantifier. */
    private Substituter under() {
      if (under == null) {
        under = new Substituter(kernel, s, n + 1);
      }
      return under;
    }

    private ImmutableSet<Formula> subst(Set<Formula> premises) {
      return Formulas.subst(premises, s, n);
    }

    @Override
    public Derivation visit(Derivation.Axm axm) {
      return kernel.axm(subst(axm.premises), axm.conclusion.subst(s, n));
    }

    @Override
    public Derivation visit(Derivation.ImpI impI) {
      return kernel.impI(subst(impI.premises), impI.antecedent.subst(s, n),
          go(impI.input));
    }

    @Override
    public Derivation visit(Derivation.FalsumE falsumE) {
      return kernel.falsumE(subst(falsumE.premises),
          falsumE.conclusion.subst(s, n), go(falsumE.input));
    }

    @Override
    public Derivation visit(Derivation.AllI allI) {
      return kernel.allI(subst(allI.premises), under().go(allI.input));
    }

    /** {@inheritDoc}
     *
     * <p>Relies on the composition law
     * {@code A[t // 0][s // n] = A[s // n + 1][t[s // n] // 0]}. */
    @Override
    public Derivation visit(Derivation.AllE allE) {
      return kernel.allE(allE.term.subst(s, n), go(allE.input));
    }

    @Override
    public Derivation visit(Derivation.Ref ref) {
      return kernel.ref(subst(ref.premises), ref.term.subst(s, n));
    }

    @Override
    public Derivation visit(Derivation.Subst subst) {
      return kernel.subst(subst.template.subst(s, n + 1),
          go(subst.equality), go(subst.input));
    }
  }
}

// End Derivations.java
