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
import static net.hydromatic.fol.ast.FolBuilder.fol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.fol.Fixtures;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Signature;
import net.hydromatic.fol.ast.Symbol;
import org.junit.jupiter.api.Test;

/** Tests for {@link TruthLemma}. */
public class TruthLemmaTest {
  private final HenkinTheory theory =
      Theories.ofStructure(Fixtures.modular(3), e -> "c" + e);
  private final TruthLemma truthLemma =
      TruthLemma.of(TermModel.of(theory));

  @Test void testEvaluate() {
    final Formula leastElement =
        fol.ex(fol.all(fol.appsRel(R, fol.var(1), fol.var(0))));
    assertThat(truthLemma.evaluate(leastElement), is(true));
    assertThat(truthLemma.verify(leastElement), is(true));
    final Formula allP = fol.all(fol.appsRel(P, fol.var(0)));
    assertThat(truthLemma.evaluate(allP), is(false));
    assertThat(truthLemma.verify(allP), is(false));
    assertThat(truthLemma.verify(fol.not(allP)), is(true));
    assertThrows(IllegalArgumentException.class,
        () -> truthLemma.evaluate(fol.appsRel(P, fol.var(0))));
  }

  /** Membership, evaluation by substitution and realization agree on every
   * sentence. */
  @Test void testRandomSentences() {
    final Fixtures.Generator g = new Fixtures.Generator(21L);
    for (Formula sentence : g.formulas(300, 0, 4)) {
      assertThat(sentence.isSentence(), is(true));
      assertThat(truthLemma.check(sentence), is(true));
      assertThat(truthLemma.verify(sentence),
          is(theory.contains(sentence)));
    }
  }

  /** The universal case goes through the witness. If the witness does not
   * refute a false universal, evaluation and membership disagree. */
  @Test void testWitness() {
    final Formula allP = fol.all(fol.appsRel(P, fol.var(0)));
    final Formula allNotR =
        fol.all(fol.not(fol.appsRel(R, fol.var(0), fol.var(0))));
    assertThat(truthLemma.check(allP), is(true));
    assertThat(truthLemma.verify(allNotR), is(false));

    // witness is always "a", which satisfies P and R(a, a)
    final HenkinTheory lazy =
        new HenkinTheory(theory.signature) {
          @Override public boolean contains(Formula sentence) {
            return theory.contains(sentence);
          }

          @Override public Symbol.Fn witness(Formula body) {
            return theory.signature.function("a");
          }
        };
    final TruthLemma lemma = TruthLemma.of(TermModel.of(lazy));
    assertThat(lemma.evaluate(allP), is(true));
    assertThat(lemma.check(allP), is(false));
    assertThrows(IllegalStateException.class, () -> lemma.verify(allP));
    assertThat(lemma.evaluate(allNotR), is(false));
  }

  /** A theory that is not complete breaks the truth lemma. */
  @Test void testIncomplete() {
    final Signature signature = Signature.builder().constant("c").build();
    final HenkinTheory reflexive =
        new HenkinTheory(signature) {
          @Override public boolean contains(Formula sentence) {
            return sentence instanceof Formula.Equal;
          }

          @Override public Symbol.Fn witness(Formula body) {
            return signature.function("c");
          }
        };
    final TruthLemma lemma = TruthLemma.of(TermModel.of(reflexive));
    final Formula c = fol.equal(fol.constant(signature.function("c")),
        fol.constant(signature.function("c")));
    assertThat(lemma.check(c), is(true));
    final Formula tautology = fol.imp(fol.falsum(), fol.falsum());
    assertThat(lemma.check(tautology), is(false));
    assertThrows(IllegalStateException.class,
        () -> lemma.verify(tautology));
  }
}

// End TruthLemmaTest.java
