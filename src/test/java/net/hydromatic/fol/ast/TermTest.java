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
import static net.hydromatic.fol.Fixtures.B;
import static net.hydromatic.fol.Fixtures.F;
import static net.hydromatic.fol.Fixtures.G;
import static net.hydromatic.fol.ast.FolBuilder.fol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.fol.Fixtures;
import org.junit.jupiter.api.Test;

/** Tests for {@link Term}: construction, arity, lifting and
 * substitution. */
public class TermTest {
  @Test void testToString() {
    final Term t = fol.apps(G, fol.var(0), fol.apps(F, fol.constant(A)));
    assertThat(t, hasToString("g(#0, f(a))"));
    assertThat(t.arity, is(0));
    assertThat(t.size(), is(4));
    assertThat(t.freeBound(), is(1));
    assertThat(t.isClosed(), is(false));

    final Term partial = fol.app(fol.func(G), fol.constant(B));
    assertThat(partial.arity, is(1));
    assertThat(partial, hasToString("g(b)"));
    assertThat(partial.head(), is(fol.func(G)));
    assertThat(partial.args(), hasToString("[b]"));
  }

  /** Applying a fully-applied term, or applying to a partial term, is
   * rejected. */
  @Test void testBadApplication() {
    assertThrows(IllegalArgumentException.class,
        () -> fol.app(fol.constant(A), fol.constant(B)));
    assertThrows(IllegalArgumentException.class,
        () -> fol.app(fol.func(F), fol.func(G)));
    assertThrows(IllegalArgumentException.class,
        () -> fol.apps(G, fol.constant(A)));
    assertThrows(IllegalArgumentException.class,
        () -> fol.constant(F));
    assertThrows(IllegalArgumentException.class, () -> fol.var(-1));
  }

  @Test void testFold() {
    final Term t =
        fol.apps(G, fol.var(2), fol.apps(F, fol.apps(F, fol.var(0))));
    final String s =
        t.fold(
            new Term.Folder<String>() {
              @Override public String var(int index) {
                return "v" + index;
              }

              @Override public String apply(Symbol.Fn symbol,
                  List<String> args) {
                return symbol.name + args.stream()
                    .collect(Collectors.joining(" ", "[", "]"));
              }
            });
    assertThat(s, is("g[v2 f[f[v0]]]"));
    assertThrows(IllegalArgumentException.class,
        () -> fol.func(G).fold(null));
  }

  @Test void testLift() {
    final Term t = fol.apps(G, fol.var(0), fol.var(3));
    assertThat(t.lift(2, 0), hasToString("g(#2, #5)"));
    assertThat(t.lift(2, 1), hasToString("g(#0, #5)"));
    assertThat(t.lift(2, 4), is(t));
    assertThat(t.lift(0, 0), sameInstance(t));
  }

  @Test void testSubst() {
    final Term t = fol.apps(G, fol.var(0), fol.apps(G, fol.var(1),
        fol.var(2)));
    final Term s = fol.apps(F, fol.var(0));
    // #1 becomes s lifted by 1; #2 drops to #1; #0 is unchanged
    assertThat(t.subst(s, 1), hasToString("g(#0, g(f(#1), #1))"));
    assertThat(t.subst(s, 0), hasToString("g(f(#0), g(#0, #1))"));
    assertThat(fol.constant(A).subst(s, 0), is(fol.constant(A)));
    assertThrows(IllegalArgumentException.class,
        () -> t.subst(fol.func(F), 0));
  }

  /** Lifting by 0 and substituting a lifted variable are identities;
   * substitution cancels a lift by one. */
  @Test void testIdentityLaws() {
    final Fixtures.Generator g = new Fixtures.Generator(1L);
    for (Term t : g.terms(200, 4, 3)) {
      assertThat(t.lift(0, 3), is(t));
      for (int n = 0; n < 4; n++) {
        assertThat(t.lift(1, n + 1).subst(fol.var(0), n), is(t));
        for (Term s : g.terms(3, 3, 2)) {
          assertThat(t.lift(1, n).subst(s, n), is(t));
        }
      }
    }
  }

  /** Two lifts commute when the later cut is below the earlier one:
   * {@code lift(lift(t, n, m), n', m') = lift(lift(t, n', m'), n, m + n')}
   * for {@code m' ≤ m}. */
  @Test void testLiftCommutes() {
    final Fixtures.Generator g = new Fixtures.Generator(2L);
    for (Term t : g.terms(200, 5, 3)) {
      for (int m = 0; m < 4; m++) {
        for (int m2 = 0; m2 <= m; m2++) {
          assertThat(t.lift(2, m).lift(3, m2),
              is(t.lift(3, m2).lift(2, m + 3)));
        }
      }
    }
  }

  /** Substitution composes: {@code t[s1 // n1][s2 // n1 + n2]} equals
   * {@code t[s2 // n1 + n2 + 1][s1[s2 // n2] // n1]}. */
  @Test void testSubstComposes() {
    final Fixtures.Generator g = new Fixtures.Generator(3L);
    for (Term t : g.terms(100, 5, 3)) {
      for (Term s1 : g.terms(3, 3, 2)) {
        for (Term s2 : g.terms(3, 3, 2)) {
          for (int n1 = 0; n1 < 3; n1++) {
            for (int n2 = 0; n2 < 3; n2++) {
              assertThat(t.subst(s1, n1).subst(s2, n1 + n2),
                  is(t.subst(s2, n1 + n2 + 1).subst(s1.subst(s2, n2), n1)));
            }
          }
        }
      }
    }
  }

  /** Lifting then substituting below the lifted range: for
   * {@code n ≤ m}, {@code lift(t[s // n], k, m) = lift(t, k, m + 1)[lift(s, k,
   * m - n) // n]}. */
  @Test void testLiftSubst() {
    final Fixtures.Generator g = new Fixtures.Generator(4L);
    for (Term t : g.terms(100, 5, 3)) {
      for (Term s : g.terms(3, 3, 2)) {
        for (int m = 0; m < 3; m++) {
          for (int n = 0; n <= m; n++) {
            assertThat(t.subst(s, n).lift(2, m),
                is(t.lift(2, m + 1).subst(s.lift(2, m - n), n)));
          }
        }
      }
    }
  }

  @Test void testEqualsAndHash() {
    final Term t1 = fol.apps(F, fol.var(1));
    final Term t2 = fol.app(fol.func(Symbol.Fn.of("f", 1)), fol.var(1));
    assertThat(t1.equals(t2), is(true));
    assertThat(t1.hashCode(), is(t2.hashCode()));
    assertThat(t1.equals(fol.apps(F, fol.var(0))), is(false));
  }
}

// End TermTest.java
