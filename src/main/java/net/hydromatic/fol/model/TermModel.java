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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.fol.ast.FolBuilder.fol;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.math.IntMath;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Symbol;
import net.hydromatic.fol.ast.Term;
import net.hydromatic.fol.eval.Prop;
import net.hydromatic.fol.eval.Realizer;
import net.hydromatic.fol.eval.Structure;
import net.hydromatic.fol.eval.Valuation;

/**
 * Canonical term model of a {@link HenkinTheory}.
 *
 * <p>Its carrier is the set of closed terms modulo equality in the theory.
 * Because the theory has enough constants, every class contains a constant;
 * each class is represented by the least constant in it (in signature
 * order), so the carrier is a set of constants.
 *
 * <p>A function symbol maps representatives {@code c₀, ...} to the class of
 * {@code f(c₀, ...)}; a relation symbol holds of representatives
 * {@code c₀, ...} if the theory contains {@code R(c₀, ...)}. If
 * {@link Prop#CHECK_CONGRUENCE} is set, construction checks that these
 * definitions do not depend on the choice of representative.
 */
public class TermModel {
  public final HenkinTheory theory;
  /** Maps each constant to the representative of its class. */
  private final ImmutableMap<Symbol.Fn, Symbol.Fn> representatives;
  public final Structure<Symbol.Fn> structure;
  private final Realizer<Symbol.Fn> realizer;
  private final Valuation<Symbol.Fn> valuation;

  private TermModel(HenkinTheory theory, Map<Prop, Object> props) {
    this.theory = requireNonNull(theory);
    final List<Symbol.Fn> constants = theory.signature.constants();
    if (constants.isEmpty()) {
      throw new IllegalStateException("theory " + theory
          + " has no constants");
    }
    this.representatives = partition(theory, constants);
    this.structure = buildStructure();
    this.realizer = Realizer.of(structure, props);
    this.valuation = Valuation.constant(representatives.get(constants.get(0)));
    if (Prop.CHECK_CONGRUENCE.booleanValue(props)) {
      checkCongruence(Prop.ENUMERATION_LIMIT.intValue(props));
    }
  }

  /** Creates the term model of a theory, with default properties. */
  public static TermModel of(HenkinTheory theory) {
    return new TermModel(theory, ImmutableMap.of());
  }

  /** Creates the term model of a theory. */
  public static TermModel of(HenkinTheory theory, Map<Prop, Object> props) {
    return new TermModel(theory, props);
  }

  /** Groups constants into classes by equality in the theory. */
  private static ImmutableMap<Symbol.Fn, Symbol.Fn> partition(
      HenkinTheory theory, List<Symbol.Fn> constants) {
    final Map<Symbol.Fn, Symbol.Fn> map = new LinkedHashMap<>();
    final List<Symbol.Fn> roots = new ArrayList<>();
    for (Symbol.Fn c : constants) {
      Symbol.Fn root = c;
      for (Symbol.Fn r : roots) {
        if (theory.contains(fol.equal(fol.constant(c), fol.constant(r)))) {
          root = r;
          break;
        }
      }
      if (root == c) {
        roots.add(c);
      }
      map.put(c, root);
    }
    return ImmutableMap.copyOf(map);
  }

  private Structure<Symbol.Fn> buildStructure() {
    final Structure.Builder<Symbol.Fn> b =
        Structure.<Symbol.Fn>builder(theory.signature)
            .carrier(representatives.values());
    for (Symbol.Fn f : theory.signature.functions()) {
      b.function(f.name, args -> classOf(fol.apps(f, constants(args))));
    }
    for (Symbol.Rel r : theory.signature.relations()) {
      b.relation(r.name,
          args -> theory.contains(fol.appsRel(r, constants(args))));
    }
    return b.build();
  }

  private static List<Term> constants(List<Symbol.Fn> symbols) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    symbols.forEach(s -> b.add(fol.constant(s)));
    return b.build();
  }

  private List<Symbol.Fn> representatives(List<Symbol.Fn> symbols) {
    final ImmutableList.Builder<Symbol.Fn> b = ImmutableList.builder();
    symbols.forEach(s -> b.add(requireNonNull(representatives.get(s))));
    return b.build();
  }

  /** Returns the carrier: one representative constant per class. */
  public List<Symbol.Fn> carrier() {
    return structure.carrierList();
  }

  /**
   * Returns the class of a closed term, as its representative.
   *
   * <p>Throws {@link IllegalStateException} if the theory does not equate
   * the term with any constant.
   */
  public Symbol.Fn classOf(Term term) {
    checkArgument(term.arity == 0 && term.isClosed(),
        "not a closed term: %s", term);
    if (term instanceof Term.Func) {
      final Symbol.Fn rep = representatives.get(((Term.Func) term).symbol);
      if (rep != null) {
        return rep;
      }
    }
    for (Map.Entry<Symbol.Fn, Symbol.Fn> e : representatives.entrySet()) {
      if (theory.contains(fol.equal(term, fol.constant(e.getKey())))) {
        return e.getValue();
      }
    }
    throw new IllegalStateException("theory " + theory
        + " does not equate " + term + " with any constant");
  }

  /** Realizes a closed term in this model. */
  public Symbol.Fn realize(Term term) {
    return realizer.realize(term, valuation);
  }

  /** Returns whether a sentence is true in this model. */
  public boolean holds(Formula sentence) {
    checkArgument(sentence.isSentence(), "not a sentence: %s", sentence);
    return realizer.realize(sentence, valuation);
  }

  /** Checks that equality is an equivalence on constants, and that function
   * and relation symbols respect it. */
  private void checkCongruence(int limit) {
    final List<Symbol.Fn> constants = representatives.keySet().asList();
    for (Symbol.Fn c : constants) {
      for (Symbol.Fn d : constants) {
        final boolean equal =
            theory.contains(fol.equal(fol.constant(c), fol.constant(d)));
        if (equal != representatives.get(c).equals(representatives.get(d))) {
          throw new IllegalStateException("equality of " + c + " and " + d
              + " in " + theory + " is not an equivalence");
        }
      }
    }
    for (Symbol.Fn f : theory.signature.functions()) {
      for (List<Symbol.Fn> args : tuples(constants, f.arity, limit)) {
        final Symbol.Fn x = classOf(fol.apps(f, constants(args)));
        final Symbol.Fn y =
            classOf(fol.apps(f, constants(representatives(args))));
        if (!x.equals(y)) {
          throw new IllegalStateException("function " + f
              + " does not respect equality at " + args);
        }
      }
    }
    for (Symbol.Rel r : theory.signature.relations()) {
      for (List<Symbol.Fn> args : tuples(constants, r.arity, limit)) {
        final boolean x = theory.contains(fol.appsRel(r, constants(args)));
        final boolean y =
            theory.contains(fol.appsRel(r, constants(representatives(args))));
        if (x != y) {
          throw new IllegalStateException("relation " + r
              + " does not respect equality at " + args);
        }
      }
    }
  }

  private static List<List<Symbol.Fn>> tuples(List<Symbol.Fn> constants,
      int arity, int limit) {
    if (IntMath.saturatedPow(constants.size(), arity) > limit) {
      throw new IllegalStateException("too many tuples to check congruence: "
          + constants.size() + "^" + arity + " exceeds " + limit);
    }
    return Lists.cartesianProduct(Collections.nCopies(arity, constants));
  }
}

// End TermModel.java
