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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;
import java.util.List;

/** Builds terms and formulas, and their bounded counterparts. */
public enum FolBuilder {
  /** The singleton instance of the builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  fol;

  /** Creates a variable with a given de Bruijn index. */
  public Term var(int index) {
    return new Term.Var(index);
  }

  /** Creates a reference to a function symbol. */
  public Term func(Symbol.Fn symbol) {
    return new Term.Func(symbol);
  }

  /** Creates a term that is a constant. */
  public Term constant(Symbol.Fn symbol) {
    checkArgument(symbol.isConstant(), "not a constant: %s", symbol);
    return func(symbol);
  }

  /** Applies a term that expects arguments to one more argument. */
  public Term app(Term fn, Term arg) {
    return new Term.App(fn, arg);
  }

  /** Applies a term to several arguments, from left to right. The result
   * expects {@code fn.arity - args.size()} more arguments. */
  public Term apps(Term fn, List<? extends Term> args) {
    Term t = fn;
    for (Term arg : args) {
      t = app(t, arg);
    }
    return t;
  }

  /** Applies a function symbol to exactly as many arguments as its arity,
   * yielding a fully-applied term. */
  public Term apps(Symbol.Fn symbol, List<? extends Term> args) {
    checkArgument(args.size() == symbol.arity,
        "function %s expects %s arguments, got %s", symbol, symbol.arity,
        args.size());
    return apps(func(symbol), args);
  }

  /** Applies a function symbol to arguments. */
  public Term apps(Symbol.Fn symbol, Term... args) {
    return apps(symbol, Arrays.asList(args));
  }

  /** Returns falsum. */
  public Formula falsum() {
    return Formula.Falsum.INSTANCE;
  }

  /** Creates an equality. */
  public Formula equal(Term left, Term right) {
    return new Formula.Equal(left, right);
  }

  /** Creates a reference to a relation symbol. */
  public Formula rel(Symbol.Rel symbol) {
    return new Formula.Rel(symbol);
  }

  /** Applies a relation that expects arguments to one more argument. */
  public Formula appRel(Formula rel, Term arg) {
    return new Formula.AppRel(rel, arg);
  }

  /** Applies a relation to several arguments, from left to right. */
  public Formula appsRel(Formula rel, List<? extends Term> args) {
    Formula f = rel;
    for (Term arg : args) {
      f = appRel(f, arg);
    }
    return f;
  }

  /** Applies a relation symbol to exactly as many arguments as its arity,
   * yielding an atomic formula. */
  public Formula appsRel(Symbol.Rel symbol, List<? extends Term> args) {
    checkArgument(args.size() == symbol.arity,
        "relation %s expects %s arguments, got %s", symbol, symbol.arity,
        args.size());
    return appsRel(rel(symbol), args);
  }

  /** Applies a relation symbol to arguments. */
  public Formula appsRel(Symbol.Rel symbol, Term... args) {
    return appsRel(symbol, Arrays.asList(args));
  }

  /** Creates an implication. */
  public Formula imp(Formula antecedent, Formula consequent) {
    return new Formula.Imp(antecedent, consequent);
  }

  /** Creates a universal quantification. */
  public Formula all(Formula body) {
    return new Formula.All(body);
  }

  /** Quantifies a formula universally {@code n} times. */
  public Formula alls(int n, Formula body) {
    Formula f = body;
    for (int i = 0; i < n; i++) {
      f = all(f);
    }
    return f;
  }

  /** Creates "{@code ¬a}", defined as "{@code a ⟹ ⊥}". */
  public Formula not(Formula a) {
    return imp(a, falsum());
  }

  /** Creates "{@code a ∧ b}", defined as "{@code ¬(a ⟹ ¬b)}". */
  public Formula and(Formula a, Formula b) {
    return not(imp(a, not(b)));
  }

  /** Creates "{@code a ∨ b}", defined as "{@code ¬a ⟹ b}". */
  public Formula or(Formula a, Formula b) {
    return imp(not(a), b);
  }

  /** Creates "{@code a ⇔ b}", defined as
   * "{@code (a ⟹ b) ∧ (b ⟹ a)}". */
  public Formula iff(Formula a, Formula b) {
    return and(imp(a, b), imp(b, a));
  }

  /** Creates "{@code ∃a}", defined as "{@code ¬∀¬a}". */
  public Formula ex(Formula body) {
    return not(all(not(body)));
  }

  // bounded terms and formulas

  /** Creates a bounded variable. */
  public BoundedTerm boundedVar(int bound, int index) {
    return new BoundedTerm.Var(bound, index);
  }

  /** Creates a bounded reference to a function symbol. */
  public BoundedTerm boundedFunc(int bound, Symbol.Fn symbol) {
    return new BoundedTerm.Func(bound, symbol);
  }

  /** Creates a bounded application. */
  public BoundedTerm boundedApp(BoundedTerm fn, BoundedTerm arg) {
    return new BoundedTerm.App(fn, arg);
  }

  /** Applies a function symbol to bounded arguments. All arguments must have
   * the same bound. */
  public BoundedTerm boundedApps(int bound, Symbol.Fn symbol,
      List<? extends BoundedTerm> args) {
    checkArgument(args.size() == symbol.arity,
        "function %s expects %s arguments, got %s", symbol, symbol.arity,
        args.size());
    BoundedTerm t = boundedFunc(bound, symbol);
    for (BoundedTerm arg : args) {
      t = boundedApp(t, arg);
    }
    return t;
  }

  /** Creates a bounded falsum. */
  public BoundedFormula boundedFalsum(int bound) {
    return new BoundedFormula.Falsum(bound);
  }

  /** Creates a bounded equality. */
  public BoundedFormula boundedEqual(BoundedTerm left, BoundedTerm right) {
    return new BoundedFormula.Equal(left, right);
  }

  /** Creates a bounded reference to a relation symbol. */
  public BoundedFormula boundedRel(int bound, Symbol.Rel symbol) {
    return new BoundedFormula.Rel(bound, symbol);
  }

  /** Creates a bounded relation application. */
  public BoundedFormula boundedAppRel(BoundedFormula rel, BoundedTerm arg) {
    return new BoundedFormula.AppRel(rel, arg);
  }

  /** Applies a relation symbol to bounded arguments. */
  public BoundedFormula boundedAppsRel(int bound, Symbol.Rel symbol,
      List<? extends BoundedTerm> args) {
    checkArgument(args.size() == symbol.arity,
        "relation %s expects %s arguments, got %s", symbol, symbol.arity,
        args.size());
    BoundedFormula f = boundedRel(bound, symbol);
    for (BoundedTerm arg : args) {
      f = boundedAppRel(f, arg);
    }
    return f;
  }

  /** Creates a bounded implication. */
  public BoundedFormula boundedImp(BoundedFormula antecedent,
      BoundedFormula consequent) {
    return new BoundedFormula.Imp(antecedent, consequent);
  }

  /** Creates a bounded universal quantification. */
  public BoundedFormula boundedAll(BoundedFormula body) {
    return new BoundedFormula.All(body);
  }

  /** Creates a bounded negation. */
  public BoundedFormula boundedNot(BoundedFormula a) {
    return boundedImp(a, boundedFalsum(a.bound));
  }
}

// End FolBuilder.java
