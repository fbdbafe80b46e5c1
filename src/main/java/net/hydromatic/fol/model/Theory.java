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

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Formulas;
import net.hydromatic.fol.ast.Signature;
import net.hydromatic.fol.derive.Rules;
import net.hydromatic.fol.kernel.Derivation;

/**
 * Theory: a set of sentences over a signature, given by its membership
 * predicate.
 *
 * <p>A derivation {@code Γ ⊢ A} is a derivation <em>from</em> a theory
 * {@code T} if {@code Γ ⊆ T}; premise sets are finite, so this is how
 * {@code T ⊢ A} is witnessed for a theory that may be infinite.
 */
public abstract class Theory {
  public final Signature signature;

  protected Theory(Signature signature) {
    this.signature = requireNonNull(signature);
  }

  /** Creates a finite theory. */
  public static Theory of(Signature signature, Iterable<Formula> sentences) {
    return new FiniteTheory(signature, ImmutableSet.copyOf(sentences));
  }

  /** Returns whether a sentence is a member of this theory. */
  public abstract boolean contains(Formula sentence);

  /** Returns whether every premise of a derivation is in this theory; that
   * is, whether the derivation shows that its conclusion follows from this
   * theory. */
  public boolean admits(Derivation derivation) {
    for (Formula premise : derivation.premises) {
      if (!contains(premise)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether this theory contains either a sentence or its
   * negation. */
  public boolean decides(Formula sentence) {
    return contains(sentence) || contains(fol.not(sentence));
  }

  /**
   * Given derivations from this theory of {@code A} and of {@code ¬A},
   * derives {@code ⊥} from this theory.
   */
  public Derivation refute(Rules rules, Derivation proof,
      Derivation disproof) {
    checkArgument(admits(proof), "not a derivation from %s: %s", this, proof);
    checkArgument(admits(disproof), "not a derivation from %s: %s", this,
        disproof);
    final ImmutableSet<Formula> gamma =
        Formulas.union(proof.premises, disproof.premises);
    return rules.contradiction(rules.weaken(gamma, proof),
        rules.weaken(gamma, disproof));
  }

  /**
   * Returns whether some derivations fail to show that this theory is
   * inconsistent.
   *
   * <p>Returns false if, among the derivations from this theory, one derives
   * {@code ⊥} or two derive {@code A} and {@code ¬A}; true otherwise.
   * Consistency is not decidable in general, so "true" means only that this
   * evidence does not refute the theory.
   */
  public boolean isConsistent(Iterable<Derivation> evidence) {
    final Set<Formula> conclusions = new HashSet<>();
    for (Derivation d : evidence) {
      if (!admits(d)) {
        continue;
      }
      if (d.conclusion instanceof Formula.Falsum) {
        return false;
      }
      conclusions.add(d.conclusion);
    }
    for (Formula conclusion : conclusions) {
      if (conclusions.contains(fol.not(conclusion))) {
        return false;
      }
    }
    return true;
  }

  /** Theory with a finite set of members. */
  private static class FiniteTheory extends Theory {
    final ImmutableSet<Formula> sentences;

    FiniteTheory(Signature signature, ImmutableSet<Formula> sentences) {
      super(signature);
      for (Formula sentence : sentences) {
        checkArgument(sentence.isSentence(), "not a sentence: %s", sentence);
        checkArgument(Formulas.isOver(sentence, signature),
            "%s is not over %s", sentence, signature);
      }
      this.sentences = sentences;
    }

    @Override
    public String toString() {
      return sentences.toString();
    }

    @Override
    public boolean contains(Formula sentence) {
      return sentences.contains(sentence);
    }
  }
}

// End Theory.java
