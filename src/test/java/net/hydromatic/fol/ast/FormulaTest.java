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
package net.hydromatic.fol.ast;

import static net.hydromatic.fol.Fixtures.A;
import static net.hydromatic.fol.Fixtures.F;
import static net.hydromatic.fol.Fixtures.P;
import static net.hydromatic.fol.Fixtures.Q;
import static net.hydromatic.fol.Fixtures.R;
import static net.hydromatic.fol.ast.FolBuilder.fol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import net.hydromatic.fol.Fixtures;
import org.junit.jupiter.api.Test;

/** Tests for {@link Formula}. */
public class FormulaTest {
  private final Formula p0 = fol.appsRel(P, fol.var(0));
  private final Formula r01 = fol.appsRel(R, fol.var(0), fol.var(1));

  @Test void testToString() {
    assertThat(fol.falsum(), hasToString("⊥"));
    assertThat(p0, hasToString("P(#0)"));
    assertThat(fol.equal(fol.var(0), fol.constant(A)), hasToString("#0 ≃ a"));
    assertThat(fol.imp(p0, fol.appsRel(Q)), hasToString("(P(#0) ⟹ Q)"));
    assertThat(fol.not(p0), hasToString("¬P(#0)"));
    assertThat(fol.all(fol.equal(fol.var(0), fol.var(1))),
        hasToString("∀(#0 ≃ #1)"));
    assertThat(fol.all(fol.imp(p0, r01)),
        hasToString("∀(P(#0) ⟹ R(#0, #1))"));
    assertThat(fol.appRel(fol.rel(R), fol.var(2)), hasToString("R(#2)"));
  }

  /** The derived connectives are abbreviations. */
  @Test void testDerivedConnectives() {
    final Formula q = fol.appsRel(Q);
    assertThat(fol.not(q), is(fol.imp(q, fol.falsum())));
    assertThat(fol.and(p0, q),
        is(fol.imp(fol.imp(p0, fol.imp(q, fol.falsum())), fol.falsum())));
    assertThat(fol.or(p0, q), is(fol.imp(fol.not(p0), q)));
    assertThat(fol.iff(p0, q),
        is(fol.and(fol.imp(p0, q), fol.imp(q, p0))));
    assertThat(fol.ex(p0), is(fol.not(fol.all(fol.not(p0)))));
    assertThat(fol.not(p0).negand(), is(p0));
    assertThat(fol.imp(p0, q).negand(), nullValue());
    assertThat(p0.negand(), nullValue());
  }

  @Test void testArity() {
    final Formula r = fol.rel(R);
    assertThat(r.arity, is(2));
    assertThat(fol.appRel(r, fol.var(0)).arity, is(1));
    assertThat(r01.arity, is(0));
    assertThat(r01.head(), is(r));
    assertThat(r01.args(), hasToString("[#0, #1]"));
    assertThrows(IllegalArgumentException.class,
        () -> fol.appRel(r01, fol.var(0)));
    assertThrows(IllegalArgumentException.class,
        () -> fol.imp(fol.rel(P), p0));
    assertThrows(IllegalArgumentException.class, () -> fol.all(fol.rel(P)));
    assertThrows(IllegalArgumentException.class,
        () -> fol.appsRel(R, fol.var(0)));
    assertThrows(IllegalArgumentException.class,
        () -> fol.appRel(fol.rel(P), fol.func(F)));
  }

  @Test void testFreeBound() {
    assertThat(p0.freeBound(), is(1));
    assertThat(fol.all(p0).freeBound(), is(0));
    assertThat(fol.all(r01).freeBound(), is(1));
    assertThat(fol.all(fol.all(r01)).isSentence(), is(true));
    assertThat(fol.falsum().isSentence(), is(true));
    assertThat(fol.rel(P).isSentence(), is(false));
  }

  @Test void testLiftAndSubst() {
    final Formula f = fol.imp(r01, fol.all(r01));
    assertThat(f.lift(1, 0), hasToString("(R(#1, #2) ⟹ ∀R(#0, #2))"));
    assertThat(f.lift(1, 1), hasToString("(R(#0, #2) ⟹ ∀R(#0, #1))"));
    final Term s = fol.apps(F, fol.var(0));
    assertThat(f.subst(s, 0), hasToString("(R(f(#0), #0) ⟹ ∀R(#0, f(#1)))"));
    assertThat(f.subst(s, 1), hasToString("(R(#0, f(#1)) ⟹ ∀R(#0, #1))"));
  }

  @Test void testFold() {
    final Formula f = fol.all(fol.imp(p0, fol.appsRel(Q)));
    final String s =
        f.fold(
            new Formula.Folder<String>() {
              @Override public String falsum() {
                return "F";
              }

              @Override public String equal(Term left, Term right) {
                return left + "=" + right;
              }

              @Override public String rel(Symbol.Rel symbol,
                  List<Term> args) {
                return symbol.name + args;
              }

              @Override public String imp(String antecedent,
                  String consequent) {
                return "(" + antecedent + " -> " + consequent + ")";
              }

              @Override public String all(String body) {
                return "A" + body;
              }
            });
    assertThat(s, is("A(P[#0] -> Q[])"));
  }

  /** Lifting and substitution preserve the number of quantifiers and
   * satisfy the same laws as on terms. */
  @Test void testLaws() {
    final Fixtures.Generator g = new Fixtures.Generator(5L);
    final List<Formula> formulas = g.formulas(200, 3, 4);
    final List<Term> terms = g.terms(4, 2, 2);
    for (Formula f : formulas) {
      final int count = f.quantifierCount();
      assertThat(f.lift(0, 2), is(f));
      for (int n = 0; n < 3; n++) {
        assertThat(f.lift(2, n).quantifierCount(), is(count));
        assertThat(f.lift(1, n + 1).subst(fol.var(0), n), is(f));
        for (Term s : terms) {
          assertThat(f.subst(s, n).quantifierCount(), is(count));
          assertThat(f.lift(1, n).subst(s, n), is(f));
          for (Term s2 : terms) {
            assertThat(f.subst(s, 0).subst(s2, n),
                is(f.subst(s2, n + 1).subst(s.subst(s2, n), 0)));
          }
        }
      }
    }
  }

  @Test void testSize() {
    final Formula f = fol.all(fol.imp(p0, fol.appsRel(Q)));
    // All, Imp, AppRel(Rel P, #0), Rel Q
    assertThat(f.size(), is(6));
    assertThat(f.quantifierCount(), is(1));
    assertThat(f.isQuantifierFree(), is(false));
    assertThat(p0.isQuantifierFree(), is(true));
  }
}

// End FormulaTest.java
