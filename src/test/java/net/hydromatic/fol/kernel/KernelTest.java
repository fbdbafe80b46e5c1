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

import static net.hydromatic.fol.Fixtures.A;
import static net.hydromatic.fol.Fixtures.B;
import static net.hydromatic.fol.Fixtures.F;
import static net.hydromatic.fol.Fixtures.P;
import static net.hydromatic.fol.Fixtures.Q;
import static net.hydromatic.fol.Fixtures.R;
import static net.hydromatic.fol.Fixtures.set;
import static net.hydromatic.fol.ast.FolBuilder.fol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Term;
import org.junit.jupiter.api.Test;

/** Tests for {@link Kernel}, one or more per primitive rule. */
public class KernelTest {
  private final Kernel kernel = Kernel.create();
  private final Formula q = fol.appsRel(Q);
  private final Formula pa = fol.appsRel(P, fol.constant(A));
  private final Formula pb = fol.appsRel(P, fol.constant(B));
  private final Formula p0 = fol.appsRel(P, fol.var(0));

  @Test void testAxm() {
    final Derivation d = kernel.axm(set(q, pa), pa);
    assertThat(d, hasToString("{Q, P(a)} ⊢ P(a)"));
    assertThat(d.rule, is(Rule.AXM));
    assertThat(d.size(), is(1));
    assertThat(d.depth(), is(0));
    final KernelException e =
        assertThrows(KernelException.class, () -> kernel.axm(set(q), pa));
    assertThat(e.rule, is(Rule.AXM));
    assertThat(e.getMessage(), startsWith("axm: "));
  }

  /** {A} ⊢ A ⟹ A, by discharging an assumption that is still a premise. */
  @Test void testImpI() {
    final Derivation d0 = kernel.axm(set(q), q);
    final Derivation d1 = kernel.impI(set(q), q, d0);
    assertThat(d1, hasToString("{Q} ⊢ (Q ⟹ Q)"));
    final Derivation d2 = kernel.impI(q, d0);
    assertThat(d2, hasToString("{} ⊢ (Q ⟹ Q)"));
    assertThat(d2.inputs(), hasSize(1));
    assertThrows(KernelException.class,
        () -> kernel.impI(set(pa), q, d0));
    assertThrows(KernelException.class,
        () -> kernel.impI(set(), fol.rel(P), d0));
  }

  @Test void testImpE() {
    final ImmutableSet<Formula> gamma = set(fol.imp(q, pa), q);
    final Derivation major = kernel.axm(gamma, fol.imp(q, pa));
    final Derivation minor = kernel.axm(gamma, q);
    final Derivation d = kernel.impE(major, minor);
    assertThat(d.conclusion, is(pa));
    assertThat(d.premises, is(gamma));
    assertThat(d.size(), is(3));
    assertThat(d.depth(), is(1));

    // minor premise is not the antecedent
    assertThrows(KernelException.class, () -> kernel.impE(major, major));
    // major premise is not an implication
    assertThrows(KernelException.class, () -> kernel.impE(minor, minor));
    // premises differ
    final Derivation minor2 = kernel.axm(set(q), q);
    assertThrows(KernelException.class, () -> kernel.impE(major, minor2));
  }

  @Test void testFalsumE() {
    final Formula notQ = fol.not(q);
    final ImmutableSet<Formula> gamma = set(notQ, q);
    final Derivation bottom =
        kernel.impE(kernel.axm(gamma, notQ), kernel.axm(gamma, q));
    assertThat(bottom.conclusion, is(fol.falsum()));
    final Derivation d = kernel.falsumE(set(q), q, bottom);
    assertThat(d, hasToString("{Q} ⊢ Q"));
    assertThat(kernel.falsumE(q, bottom).premises, is(set(q)));

    // conclusion of the input is not falsum
    assertThrows(KernelException.class,
        () -> kernel.falsumE(set(), q, kernel.axm(set(notQ), notQ)));
    // input does not have ¬A as premise
    assertThrows(KernelException.class,
        () -> kernel.falsumE(set(q), pa, bottom));
  }

  @Test void testAllI() {
    final Formula p1 = fol.appsRel(P, fol.var(1));
    final Derivation d0 = kernel.axm(set(p1), p1);
    final Derivation d = kernel.allI(set(p0), d0);
    assertThat(d, hasToString("{P(#0)} ⊢ ∀P(#1)"));

    // The quantified variable is free in a premise
    final Derivation d1 = kernel.axm(set(p0), p0);
    assertThrows(KernelException.class, () -> kernel.allI(set(p0), d1));

    final Derivation d2 = kernel.impI(p0, d1);
    final Derivation d3 = kernel.allI(set(), d2);
    assertThat(d3, hasToString("{} ⊢ ∀(P(#0) ⟹ P(#0))"));
  }

  @Test void testAllE() {
    final Formula all = fol.all(fol.appsRel(R, fol.var(0), fol.var(1)));
    final Derivation d0 = kernel.axm(set(all), all);
    final Term t = fol.apps(F, fol.var(0));
    final Derivation d = kernel.allE(t, d0);
    assertThat(d.conclusion, hasToString("R(f(#0), #0)"));
    assertThat(((Derivation.AllE) d).term, is(t));
    assertThrows(KernelException.class,
        () -> kernel.allE(t, kernel.axm(set(q), q)));
    assertThrows(KernelException.class,
        () -> kernel.allE(fol.func(F), d0));
  }

  /** Instantiating {@code ∀(P(#0) ⟹ P(#0))} with a term {@code t} gives
   * {@code P(t) ⟹ P(t)}, with the same number of quantifiers. */
  @Test void testAllEImplication() {
    final Formula f = fol.all(fol.imp(p0, p0));
    final Derivation d0 =
        kernel.allI(set(), kernel.impI(p0, kernel.axm(set(p0), p0)));
    assertThat(d0.conclusion, is(f));
    final Term t = fol.apps(F, fol.constant(B));
    final Derivation d = kernel.allE(t, d0);
    final Formula pt = fol.appsRel(P, t);
    assertThat(d.conclusion, is(fol.imp(pt, pt)));
    assertThat(d.conclusion, hasToString("(P(f(b)) ⟹ P(f(b)))"));
    assertThat(f.subst(t, 0).quantifierCount(), is(f.quantifierCount()));
  }

  @Test void testRef() {
    final Term t = fol.apps(F, fol.constant(A));
    final Derivation d = kernel.ref(set(q), t);
    assertThat(d, hasToString("{Q} ⊢ f(a) ≃ f(a)"));
    assertThrows(KernelException.class,
        () -> kernel.ref(set(), fol.func(F)));
    assertThrows(KernelException.class,
        () -> kernel.ref(set(fol.rel(P)), t));
  }

  @Test void testSubst() {
    final Formula ab = fol.equal(fol.constant(A), fol.constant(B));
    final ImmutableSet<Formula> gamma = set(ab, pa);
    final Derivation eq = kernel.axm(gamma, ab);
    final Derivation d0 = kernel.axm(gamma, pa);
    final Derivation d = kernel.subst(p0, eq, d0);
    assertThat(d.conclusion, is(pb));

    // Template with another free variable; #1 in the template becomes #0
    final Formula template = fol.appsRel(R, fol.var(0), fol.var(1));
    final Formula ra0 = fol.appsRel(R, fol.constant(A), fol.var(0));
    final ImmutableSet<Formula> gamma2 = set(ab, ra0);
    final Derivation d2 =
        kernel.subst(template, kernel.axm(gamma2, ab),
            kernel.axm(gamma2, ra0));
    assertThat(d2.conclusion, hasToString("R(b, #0)"));

    // The input does not match the template
    assertThrows(KernelException.class, () -> kernel.subst(p0, eq, eq));
    // The equality is not an equality
    assertThrows(KernelException.class, () -> kernel.subst(p0, d0, d0));
  }

  /** Inputs may be shared. Size counts each use of an input; depth is the
   * longest path. Both are computed once per node. */
  @Test void testSharedInputs() {
    final Term a = fol.constant(A);
    final Formula template = fol.equal(fol.var(0), a);
    Derivation d = kernel.ref(set(q), a);
    assertThat(d.depth(), is(0));
    for (int i = 0; i < 25; i++) {
      d = kernel.subst(template, d, d);
    }
    assertThat(d, hasToString("{Q} ⊢ a ≃ a"));
    assertThat(d.depth(), is(25));
    assertThat(d.size(), is((1 << 26) - 1));
  }

  /** Every accepted rule application is reported to the tracer, as is every
   * rejected one. */
  @Test void testTracer() {
    final List<Derivation> accepted = new ArrayList<>();
    final List<KernelException> rejected = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnRejected(
            Tracers.withOnRule(Tracers.empty(), accepted::add),
            rejected::add);
    final Kernel k = Kernel.create(tracer);
    final Derivation d0 = k.axm(set(q), q);
    final Derivation d1 = k.impI(q, d0);
    assertThrows(KernelException.class, () -> k.impE(d1, d1));
    assertThat(accepted, hasSize(2));
    assertThat(accepted.get(1), is(d1));
    assertThat(rejected, hasSize(1));
    assertThat(rejected.get(0).rule, is(Rule.IMP_E));
  }
}

// End KernelTest.java
