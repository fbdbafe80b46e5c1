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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.fol.ast.FolBuilder.fol;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Formulas;
import net.hydromatic.fol.ast.Symbol;
import net.hydromatic.fol.eval.Realizer;
import net.hydromatic.fol.eval.Structure;
import net.hydromatic.fol.eval.Valuation;

/** Utilities for {@link Theory} and {@link HenkinTheory}. */
public abstract class Theories {
  private Theories() {}

  /**
   * Returns the complete theory of a finite structure in which every element
   * is the interpretation of some constant.
   *
   * <p>A sentence is a member if it is over the structure's signature and
   * is true in the structure. The theory is complete because every sentence
   * is true or false; consistent because it has a model; deductively closed
   * because derivations are sound; and has enough constants because every
   * element is named.
   */
  public static <E> HenkinTheory ofStructure(Structure<E> structure) {
    final Realizer<E> realizer = Realizer.of(structure);
    final Set<E> named = new LinkedHashSet<>();
    for (Symbol.Fn constant : structure.signature.constants()) {
      named.add(structure.apply(constant, ImmutableList.of()));
    }
    checkArgument(named.containsAll(structure.carrier()),
        "elements %s are not all named by constants", structure.carrier());
    return new StructureTheory<>(realizer);
  }

  /** Returns the complete theory of a finite structure, first naming each
   * element by a new constant. */
  public static <E> HenkinTheory ofStructure(Structure<E> structure,
      Function<E, String> naming) {
    final Map<String, E> names = new LinkedHashMap<>();
    for (E e : structure.carrier()) {
      final E previous = names.put(naming.apply(e), e);
      checkArgument(previous == null, "%s and %s have the same name", e,
          previous);
    }
    return ofStructure(structure.withConstants(names));
  }

  /** Complete theory of a structure whose elements are named.
   *
   * @param <E> element type */
  private static class StructureTheory<E> extends HenkinTheory {
    final Realizer<E> realizer;
    final Valuation<E> valuation;

    StructureTheory(Realizer<E> realizer) {
      super(realizer.structure.signature);
      this.realizer = realizer;
      this.valuation =
          Valuation.constant(realizer.structure.carrierList().get(0));
    }

    @Override
    public String toString() {
      return "Th(" + realizer.structure + ")";
    }

    @Override
    public boolean contains(Formula sentence) {
      return sentence.isSentence()
          && Formulas.isOver(sentence, signature)
          && realizer.realize(sentence, valuation);
    }

    @Override
    public Symbol.Fn witness(Formula body) {
      checkArgument(body.arity == 0 && body.freeBound() <= 1,
          "not a formula in one variable: %s", body);
      for (Symbol.Fn constant : signature.constants()) {
        if (contains(body.subst(fol.constant(constant), 0))) {
          return constant;
        }
      }
      // ∃body is false, so any constant will do
      return signature.constants().get(0);
    }
  }
}

// End Theories.java
