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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Arrays;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/** Utilities for {@link Formula} and sets of formulas. */
public abstract class Formulas {
  private Formulas() {}

  /** Returns the image of a set of formulas under
   * {@link Formula#lift(int, int)}. */
  public static ImmutableSet<Formula> lift(Set<Formula> formulas, int n,
      int m) {
    final ImmutableSet.Builder<Formula> b = ImmutableSet.builder();
    formulas.forEach(f -> b.add(f.lift(n, m)));
    return b.build();
  }

  /** Returns the image of a set of formulas under lifting by 1, the premises
   * of a derivation under a new universal quantifier. */
  public static ImmutableSet<Formula> lift1(Set<Formula> formulas) {
    return lift(formulas, 1, 0);
  }

  /** Returns the image of a set of formulas under
   * {@link Formula#subst(Term, int)}. */
  public static ImmutableSet<Formula> subst(Set<Formula> formulas, Term s,
      int n) {
    final ImmutableSet.Builder<Formula> b = ImmutableSet.builder();
    formulas.forEach(f -> b.add(f.subst(s, n)));
    return b.build();
  }

  /** Returns a set containing the given formulas and some more. */
  public static ImmutableSet<Formula> plus(Set<Formula> formulas,
      Formula... more) {
    return ImmutableSet.<Formula>builder()
        .addAll(formulas)
        .addAll(Arrays.asList(more))
        .build();
  }

  /** Returns the union of two sets of formulas. */
  public static ImmutableSet<Formula> union(Set<Formula> formulas0,
      Set<Formula> formulas1) {
    return ImmutableSet.<Formula>builder()
        .addAll(formulas0)
        .addAll(formulas1)
        .build();
  }

  /** Returns the least bound that every formula in a set is below. */
  public static int freeBound(Iterable<Formula> formulas) {
    int bound = 0;
    for (Formula f : formulas) {
      bound = Math.max(bound, f.freeBound());
    }
    return bound;
  }

  /** Returns the function and relation symbols that occur in a formula. */
  public static SortedSet<Symbol> symbols(Formula formula) {
    final SortedSet<Symbol> symbols = new TreeSet<>();
    final TermVisitor<Void> termVisitor =
        new TermVisitor<Void>() {
          @Override
          public Void visit(Term.Func func) {
            symbols.add(func.symbol);
            return null;
          }
        };
    formula.accept(
        new FormulaVisitor<Void>() {
          @Override
          public Void visit(Formula.Equal equal) {
            equal.left.accept(termVisitor);
            equal.right.accept(termVisitor);
            return null;
          }

          @Override
          public Void visit(Formula.Rel rel) {
            symbols.add(rel.symbol);
            return null;
          }

          @Override
          public Void visit(Formula.AppRel appRel) {
            appRel.arg.accept(termVisitor);
            return super.visit(appRel);
          }
        });
    return ImmutableSortedSet.copyOfSorted(symbols);
  }

  /** Returns whether every symbol in a formula belongs to a signature. */
  public static boolean isOver(Formula formula, Signature signature) {
    return symbols(formula).stream().allMatch(signature::contains);
  }
}

// End Formulas.java
