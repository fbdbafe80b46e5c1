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

import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Term;

/**
 * Truth lemma for a {@link TermModel}: a sentence is true in the term model
 * of a Henkin theory if and only if the theory contains it.
 *
 * <p>{@link #evaluate} decides truth by induction on the number of
 * quantifiers rather than on the structure of the formula. {@code ∀A} is
 * true if and only if {@code A[c // 0]} is true, where {@code c} is the
 * theory's witness for {@code ¬A}; {@code A[c // 0]} has one quantifier
 * fewer than {@code ∀A}, though it may be larger. Because every step
 * substitutes a constant, every formula evaluated is a sentence.
 */
public class TruthLemma {
  public final TermModel model;

  private TruthLemma(TermModel model) {
    this.model = requireNonNull(model);
  }

  public static TruthLemma of(TermModel model) {
    return new TruthLemma(model);
  }

  /** Evaluates a sentence in the term model by substituting constants for
   * quantified variables. */
  public boolean evaluate(Formula sentence) {
    checkArgument(sentence.isSentence(), "not a sentence: %s", sentence);
    switch (sentence.op) {
    case FALSUM:
      return false;
    case EQUAL:
      final Formula.Equal equal = (Formula.Equal) sentence;
      return model.classOf(equal.left).equals(model.classOf(equal.right));
    case REL:
    case APP_REL:
      return model.theory.contains(sentence);
    case IMP:
      final Formula.Imp imp = (Formula.Imp) sentence;
      return !evaluate(imp.antecedent) || evaluate(imp.consequent);
    case ALL:
      return evaluate(counterexample((Formula.All) sentence));
    default:
      throw new AssertionError(sentence.op);
    }
  }

  /** Given {@code ∀A}, returns {@code A[c // 0]} where {@code c} is the
   * witness of {@code ¬A}. If any instance of {@code A} is false, this one
   * is. */
  private Formula counterexample(Formula.All all) {
    final Term c = fol.constant(model.theory.witness(fol.not(all.body)));
    return all.body.subst(c, 0);
  }

  /** Returns whether the theory contains the negated counterexample of
   * every universal sentence it does not contain. */
  private boolean witnessed(Formula sentence) {
    if (!(sentence instanceof Formula.All)
        || model.theory.contains(sentence)) {
      return true;
    }
    final Formula instance = counterexample((Formula.All) sentence);
    return model.theory.contains(fol.not(instance)) && !evaluate(instance);
  }

  /**
   * Returns whether membership in the theory, substitution-based evaluation
   * and realization in the term model all agree on a sentence, and, if the
   * sentence is a universal that the theory does not contain, whether the
   * theory contains the negation of its counterexample.
   */
  public boolean check(Formula sentence) {
    final boolean member = model.theory.contains(sentence);
    return evaluate(sentence) == member && model.holds(sentence) == member
        && witnessed(sentence);
  }

  /** As {@link #check}, but throws if they disagree, and returns whether
   * the sentence is true. */
  public boolean verify(Formula sentence) {
    final boolean member = model.theory.contains(sentence);
    final boolean evaluated = evaluate(sentence);
    final boolean realized = model.holds(sentence);
    if (evaluated != member || realized != member) {
      throw new IllegalStateException("truth lemma fails for " + sentence
          + ": member " + member + ", evaluated " + evaluated
          + ", realized " + realized);
    }
    if (!witnessed(sentence)) {
      throw new IllegalStateException("truth lemma fails for " + sentence
          + ": theory does not contain the negation of "
          + counterexample((Formula.All) sentence));
    }
    return member;
  }
}

// End TruthLemma.java
