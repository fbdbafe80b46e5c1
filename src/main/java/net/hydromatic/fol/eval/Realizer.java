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
package net.hydromatic.fol.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.math.IntMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Formulas;
import net.hydromatic.fol.ast.Symbol;
import net.hydromatic.fol.ast.Term;

/**
 * Realizes terms and formulas in a {@link Structure}.
 *
 * <p>A term is realized homomorphically: variable {@code k} is the element
 * that the valuation assigns to {@code k}, and a function application is
 * the structure's interpretation applied to the realized arguments.
 *
 * <p>{@code ∀A} is realized under {@code v} if {@code A} is realized under
 * {@code v.cons(x)} for every element {@code x} of the carrier. This requires
 * a finite carrier; otherwise {@link UnsupportedOperationException}.
 *
 * @param <E> element type
 */
public class Realizer<E> {
  public final Structure<E> structure;
  private final int enumerationLimit;

  private Realizer(Structure<E> structure, Map<Prop, Object> props) {
    this.structure = requireNonNull(structure);
    this.enumerationLimit = Prop.ENUMERATION_LIMIT.intValue(props);
  }

  /** Creates a realizer with default properties. */
  public static <E> Realizer<E> of(Structure<E> structure) {
    return new Realizer<>(structure, ImmutableMap.of());
  }

  /** Creates a realizer with the given properties. */
  public static <E> Realizer<E> of(Structure<E> structure,
      Map<Prop, Object> props) {
    return new Realizer<>(structure, props);
  }

  /** Realizes a fully-applied term. */
  public E realize(Term term, Valuation<E> valuation) {
    return term.fold(
        new Term.Folder<E>() {
          @Override
          public E var(int index) {
            return valuation.get(index);
          }

          @Override
          public E apply(Symbol.Fn symbol, List<E> args) {
            return structure.apply(symbol, args);
          }
        });
  }

  /** Realizes a fully-applied formula. */
  public boolean realize(Formula formula, Valuation<E> valuation) {
    return formula.fold(new PredicateFolder()).test(valuation);
  }

  /** Returns whether every formula in a set is realized. */
  public boolean realizesAll(Iterable<Formula> formulas,
      Valuation<E> valuation) {
    for (Formula formula : formulas) {
      if (!realize(formula, valuation)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether {@code formula} is realized under every valuation that
   * realizes every formula in {@code gamma}. */
  public boolean satisfies(Set<Formula> gamma, Formula formula) {
    final int n =
        Math.max(Formulas.freeBound(gamma), formula.freeBound());
    for (Valuation<E> valuation : valuations(n)) {
      if (realizesAll(gamma, valuation) && !realize(formula, valuation)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether every sentence is true in the structure. */
  public boolean isModel(Iterable<Formula> sentences) {
    final Valuation<E> valuation =
        Valuation.constant(structure.carrierList().get(0));
    return realizesAll(sentences, valuation);
  }

  /** Returns every valuation that varies in variables less than {@code n};
   * throws if there are more than {@link Prop#ENUMERATION_LIMIT}. */
  public Iterable<Valuation<E>> valuations(int n) {
    final List<E> carrier = structure.carrierList();
    final int count = IntMath.saturatedPow(carrier.size(), n);
    if (count > enumerationLimit) {
      throw new IllegalStateException("too many valuations: " + carrier.size()
          + "^" + n + " exceeds " + enumerationLimit);
    }
    return Valuation.all(carrier, n);
  }

  /** Folds a formula into a predicate on valuations. */
  private class PredicateFolder
      implements Formula.Folder<Predicate<Valuation<E>>> {
    @Override
    public Predicate<Valuation<E>> falsum() {
      return v -> false;
    }

    @Override
    public Predicate<Valuation<E>> equal(Term left, Term right) {
      return v -> realize(left, v).equals(realize(right, v));
    }

    @Override
    public Predicate<Valuation<E>> rel(Symbol.Rel symbol, List<Term> args) {
      return v -> {
        final List<E> values = new ArrayList<>();
        for (Term arg : args) {
          values.add(realize(arg, v));
        }
        return structure.test(symbol, values);
      };
    }

    @Override
    public Predicate<Valuation<E>> imp(Predicate<Valuation<E>> antecedent,
        Predicate<Valuation<E>> consequent) {
      return v -> !antecedent.test(v) || consequent.test(v);
    }

    @Override
    public Predicate<Valuation<E>> all(Predicate<Valuation<E>> body) {
      return v -> {
        if (!structure.isFinite()) {
          throw new UnsupportedOperationException(
              "cannot realize a quantifier over a carrier that is not finite");
        }
        for (E e : structure.carrier()) {
          if (!body.test(v.cons(e))) {
            return false;
          }
        }
        return true;
      };
    }
  }
}

// End Realizer.java
