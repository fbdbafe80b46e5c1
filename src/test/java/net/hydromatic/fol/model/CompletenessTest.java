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

import static net.hydromatic.fol.Fixtures.P;
import static net.hydromatic.fol.Fixtures.R;
import static net.hydromatic.fol.Fixtures.set;
import static net.hydromatic.fol.ast.FolBuilder.fol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import net.hydromatic.fol.Fixtures;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Symbol;
import net.hydromatic.fol.ast.Term;
import net.hydromatic.fol.eval.Realizer;
import net.hydromatic.fol.eval.Soundness;
import net.hydromatic.fol.eval.Structure;
import net.hydromatic.fol.kernel.Derivation;
import net.hydromatic.fol.kernel.Kernel;
import net.hydromatic.fol.kernel.Rule;
import net.hydromatic.fol.kernel.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Completeness}. */
public class CompletenessTest {
  private final Structure<Integer> named =
      Fixtures.modular(2).withConstants(ImmutableMap.of("c0", 0, "c1", 1));
  private final HenkinTheory theory = Theories.ofStructure(named);
  private final Kernel kernel = Kernel.create();
  private final Completeness completeness = Completeness.of(kernel, theory);

  /** A true universal is derived from an instance at the witness of its
   * negation and the Henkin axiom for that witness. */
  @Test void testDeriveUniversal() {
    final Formula r00 = fol.appsRel(R, fol.var(0), fol.var(0));
    final Formula reflexive = fol.all(r00);
    final Derivation d = completeness.derive(reflexive);
    assertThat(d.conclusion, is(reflexive));
    assertThat(d.rule, is(Rule.FALSUM_E));
    assertThat(theory.admits(d), is(true));

    // No element refutes R(x, x), so the witness is the first constant
    final Term a = fol.constant(Fixtures.A);
    final Formula raa = fol.appsRel(R, a, a);
    final Formula henkin =
        fol.imp(fol.ex(fol.not(r00)), fol.not(raa));
    assertThat(d.premises, is(set(raa, henkin)));
    assertThat(completeness.entails(reflexive), is(true));
  }

  /** A false universal is refuted by the counterexample that the theory
   * names. */
  @Test void testDeriveNegatedUniversal() {
    final Formula allP = fol.all(fol.appsRel(P, fol.var(0)));
    final Derivation d = completeness.derive(allP);
    assertThat(d.conclusion, is(fol.not(allP)));
    assertThat(d.rule, is(Rule.IMP_I));
    // P(x) holds only for 0; b is 1
    assertThat(d.premises,
        is(set(fol.not(fol.appsRel(P, fol.constant(Fixtures.B))))));
    assertThat(completeness.entails(allP), is(false));
    assertThat(completeness.entails(fol.not(allP)), is(true));
  }

  @Test void testDeriveImplication() {
    final Formula pa = fol.appsRel(P, fol.constant(Fixtures.A));
    final Formula pb = fol.appsRel(P, fol.constant(Fixtures.B));

    // consequent true
    final Derivation d1 = completeness.derive(fol.imp(pb, pa));
    assertThat(d1.conclusion, is(fol.imp(pb, pa)));
    assertThat(d1.premises, is(set(pa)));

    // antecedent false
    final Derivation d2 = completeness.derive(fol.imp(pb, fol.falsum()));
    assertThat(d2.conclusion, is(fol.not(pb)));
    assertThat(d2.premises, is(set(fol.not(pb))));

    // antecedent true, consequent false
    final Derivation d3 = completeness.derive(fol.imp(pa, pb));
    assertThat(d3.conclusion, is(fol.not(fol.imp(pa, pb))));
    assertThat(d3.premises, is(set(pa, fol.not(pb))));

    // ¬⊥ needs no premises
    final Derivation d4 = completeness.derive(fol.falsum());
    assertThat(d4.conclusion, is(fol.not(fol.falsum())));
    assertThat(d4.premises, is(set()));
  }

  @Test void testNotOverSignature() {
    final Formula s =
        fol.appsRel(Symbol.Rel.of("S", 0), ImmutableList.of());
    assertThrows(IllegalArgumentException.class,
        () -> completeness.derive(s));
    assertThrows(IllegalArgumentException.class,
        () -> completeness.derive(fol.appsRel(P, fol.var(0))));
  }

  /** A theory that lacks a Henkin axiom cannot support the derivation of a
   * true universal. */
  @Test void testMissingHenkinAxiom() {
    final HenkinTheory noAxioms =
        new HenkinTheory(theory.signature) {
          @Override public boolean contains(Formula sentence) {
            return theory.contains(sentence)
                && !(sentence instanceof Formula.Imp
                    && ((Formula.Imp) sentence).antecedent.negand() != null);
          }

          @Override public Symbol.Fn witness(Formula body) {
            return theory.witness(body);
          }
        };
    final Completeness c = Completeness.of(kernel, noAxioms);
    final Formula reflexive =
        fol.all(fol.appsRel(R, fol.var(0), fol.var(0)));
    assertThrows(IllegalStateException.class, () -> c.derive(reflexive));
  }

  /** Every sentence or its negation is derivable from the theory; the
   * derivations come from the kernel and are sound in the structure that
   * the theory describes. */
  @Test void testDecidesEverySentence() {
    final Set<Derivation> traced =
        Collections.newSetFromMap(new IdentityHashMap<>());
    final Completeness tracedCompleteness =
        Completeness.of(
            Kernel.create(Tracers.withOnRule(Tracers.empty(), traced::add)),
            TermModel.of(theory));
    final Soundness<Integer> soundness = Soundness.of(Realizer.of(named));
    final Fixtures.Generator g = new Fixtures.Generator(31L);
    final List<Formula> sentences = g.formulas(200, 0, 4);
    for (Formula sentence : sentences) {
      final Derivation d = tracedCompleteness.derive(sentence);
      assertThat(traced.contains(d), is(true));
      assertThat(theory.admits(d), is(true));
      assertThat(d.conclusion.equals(sentence)
              || d.conclusion.equals(fol.not(sentence)),
          is(true));
      assertThat(soundness.verify(d), is(true));
      assertThat(tracedCompleteness.entails(sentence),
          is(theory.contains(sentence)));
    }
  }
}

// End CompletenessTest.java
