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

import java.util.List;
import net.hydromatic.fol.ast.Formulas;
import net.hydromatic.fol.kernel.Derivation;
import net.hydromatic.fol.kernel.DerivationVisitor;
import net.hydromatic.fol.kernel.Tracer;
import net.hydromatic.fol.kernel.Tracers;

/**
 * Checks derivations against a structure.
 *
 * <p>Every derivation {@code Γ ⊢ A} that the kernel produces is sound: under
 * any valuation that realizes every formula in {@code Γ}, {@code A} is
 * realized. This class checks that claim at every node of a derivation,
 * walking the tree rule by rule. Below {@code allI}, the input is checked
 * under {@code v.cons(x)} for every element {@code x}; the other rules check
 * their inputs under the same valuation.
 *
 * <p>A failure is reported to {@link Tracer#onUnsound}; if the tracer does
 * not handle it, the checker throws {@link SoundnessException}.
 *
 * @param <E> element type
 */
public class Soundness<E> {
  private final Realizer<E> realizer;
  private final Tracer tracer;

  private Soundness(Realizer<E> realizer, Tracer tracer) {
    this.realizer = requireNonNull(realizer);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a checker. */
  public static <E> Soundness<E> of(Realizer<E> realizer, Tracer tracer) {
    return new Soundness<>(realizer, tracer);
  }

  /** Creates a checker that throws on the first failure. */
  public static <E> Soundness<E> of(Realizer<E> realizer) {
    return of(realizer, Tracers.empty());
  }

  /** Checks a derivation under one valuation. Returns whether every node was
   * sound. */
  public boolean check(Derivation derivation, Valuation<E> valuation) {
    return derivation.accept(new Checker(valuation));
  }

  /** Checks a derivation under every valuation of the variables free in its
   * premises and conclusion. Returns whether every node was sound. */
  public boolean verify(Derivation derivation) {
    final int n = Math.max(Formulas.freeBound(derivation.premises),
        derivation.conclusion.freeBound());
    boolean sound = true;
    for (Valuation<E> valuation : realizer.valuations(n)) {
      sound &= check(derivation, valuation);
    }
    return sound;
  }

  /** Checks one node, after its inputs have been checked. */
  private boolean checkNode(Derivation d, Valuation<E> valuation,
      boolean inputsSound) {
    if (realizer.realizesAll(d.premises, valuation)
        && !realizer.realize(d.conclusion, valuation)) {
      final String description = "conclusion " + d.conclusion
          + " is not realized under " + valuation;
      if (!tracer.onUnsound(d, description)) {
        throw new SoundnessException(d, description);
      }
      return false;
    }
    return inputsSound;
  }

  /** Visitor that checks each node under a valuation. */
  private class Checker extends DerivationVisitor<Boolean> {
    final Valuation<E> valuation;

    Checker(Valuation<E> valuation) {
      this.valuation = valuation;
    }

    @Override
    protected Boolean visitInputs(Derivation derivation) {
      final List<Derivation> inputs = derivation.inputs();
      boolean sound = true;
      for (Derivation input : inputs) {
        sound &= input.accept(this);
      }
      return checkNode(derivation, valuation, sound);
    }

    @Override
    public Boolean visit(Derivation.AllI allI) {
      boolean sound = true;
      for (E e : realizer.structure.carrier()) {
        sound &= allI.input.accept(new Checker(valuation.cons(e)));
      }
      return checkNode(allI, valuation, sound);
    }
  }
}

// End Soundness.java
