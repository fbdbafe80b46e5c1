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
package net.hydromatic.fol;

import static net.hydromatic.fol.ast.FolBuilder.fol;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Signature;
import net.hydromatic.fol.ast.Symbol;
import net.hydromatic.fol.ast.Term;
import net.hydromatic.fol.eval.Structure;

/** Signatures, structures and random terms and formulas for tests. */
public class Fixtures {
  private Fixtures() {}

  /** Signature with constants "a" and "b", unary function "f", binary
   * function "g", nullary relation "Q", unary relation "P" and binary
   * relation "R". */
  public static final Signature SIGNATURE =
      Signature.builder()
          .constant("a")
          .constant("b")
          .function("f", 1)
          .function("g", 2)
          .relation("Q", 0)
          .relation("P", 1)
          .relation("R", 2)
          .build();

  public static final Symbol.Fn A = SIGNATURE.function("a");
  public static final Symbol.Fn B = SIGNATURE.function("b");
  public static final Symbol.Fn F = SIGNATURE.function("f");
  public static final Symbol.Fn G = SIGNATURE.function("g");
  public static final Symbol.Rel Q = SIGNATURE.relation("Q");
  public static final Symbol.Rel P = SIGNATURE.relation("P");
  public static final Symbol.Rel R = SIGNATURE.relation("R");

  /** Returns a structure over {@link #SIGNATURE} whose carrier is the
   * integers modulo {@code n}. "f" is successor, "g" is addition, "P" holds
   * of 0, "R" is less-than-or-equal, and "Q" is true. */
  public static Structure<Integer> modular(int n) {
    final List<Integer> carrier = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      carrier.add(i);
    }
    return Structure.<Integer>builder(SIGNATURE)
        .carrier(carrier)
        .constant("a", 0)
        .constant("b", n - 1)
        .function("f", args -> (args.get(0) + 1) % n)
        .function("g", args -> (args.get(0) + args.get(1)) % n)
        .relation("Q", args -> true)
        .relation("P", args -> args.get(0) == 0)
        .relation("R", args -> args.get(0) <= args.get(1))
        .build();
  }

  /** Returns a structure over {@link #SIGNATURE} whose carrier is every
   * integer, which therefore cannot realize quantifiers. */
  public static Structure<Integer> integers() {
    return Structure.<Integer>builder(SIGNATURE)
        .constant("a", 0)
        .constant("b", 1)
        .function("f", args -> args.get(0) + 1)
        .function("g", args -> args.get(0) + args.get(1))
        .relation("Q", args -> false)
        .relation("P", args -> args.get(0) > 0)
        .relation("R", args -> args.get(0) < args.get(1))
        .build();
  }

  /** Generates random terms and formulas over {@link #SIGNATURE}. */
  public static class Generator {
    private final Random random;

    public Generator(long seed) {
      this.random = new Random(seed);
    }

    /** Generates a fully-applied term whose variables are below
     * {@code bound}. */
    public Term term(int bound, int depth) {
      final int choice = random.nextInt(depth <= 0 ? 3 : 5);
      switch (choice) {
      case 0:
        if (bound > 0) {
          return fol.var(random.nextInt(bound));
        }
        // fall through
      case 1:
        return fol.constant(A);
      case 2:
        return fol.constant(B);
      case 3:
        return fol.apps(F, term(bound, depth - 1));
      default:
        return fol.apps(G, term(bound, depth - 1), term(bound, depth - 1));
      }
    }

    /** Generates a fully-applied formula whose free variables are below
     * {@code bound}. */
    public Formula formula(int bound, int depth) {
      final int choice = random.nextInt(depth <= 0 ? 4 : 7);
      switch (choice) {
      case 0:
        return fol.falsum();
      case 1:
        return fol.equal(term(bound, 1), term(bound, 1));
      case 2:
        return fol.appsRel(P, term(bound, 1));
      case 3:
        return random.nextBoolean()
            ? fol.appsRel(R, term(bound, 1), term(bound, 1))
            : fol.appsRel(Q);
      case 4:
        return fol.not(formula(bound, depth - 1));
      case 5:
        return fol.imp(formula(bound, depth - 1), formula(bound, depth - 1));
      default:
        return fol.all(formula(bound + 1, depth - 1));
      }
    }

    /** Generates a list of formulas. */
    public List<Formula> formulas(int count, int bound, int depth) {
      final ImmutableList.Builder<Formula> b = ImmutableList.builder();
      for (int i = 0; i < count; i++) {
        b.add(formula(bound, depth));
      }
      return b.build();
    }

    /** Generates a list of terms. */
    public List<Term> terms(int count, int bound, int depth) {
      final ImmutableList.Builder<Term> b = ImmutableList.builder();
      for (int i = 0; i < count; i++) {
        b.add(term(bound, depth));
      }
      return b.build();
    }
  }

  /** Shorthand for an immutable set of formulas. */
  public static ImmutableSet<Formula> set(Formula... formulas) {
    return ImmutableSet.copyOf(formulas);
  }
}

// End Fixtures.java
