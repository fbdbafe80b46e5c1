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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.fol.ast.FolBuilder.fol;

/**
 * Formula whose free variables are all below a static bound.
 *
 * <p>The body of {@link All} has bound one greater than the quantifier
 * itself. A bounded formula with bound 0 is a sentence.
 *
 * @see BoundedTerm
 */
public abstract class BoundedFormula {
  public final Op op;

  /** Every free variable has an index less than this. */
  public final int bound;

  /** Number of arguments that this formula still expects. */
  public final int arity;

  BoundedFormula(Op op, int bound, int arity) {
    this.op = requireNonNull(op);
    this.bound = bound;
    this.arity = arity;
    checkArgument(bound >= 0, "negative bound %s", bound);
  }

  @Override
  public int hashCode() {
    return erase().hashCode() * 31 + bound;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof BoundedFormula
            && bound == ((BoundedFormula) obj).bound
            && erase().equals(((BoundedFormula) obj).erase());
  }

  @Override
  public String toString() {
    return erase().toString();
  }

  /** Returns whether this is a sentence (has bound 0 and is fully
   * applied). */
  public boolean isSentence() {
    return bound == 0 && arity == 0;
  }

  /** Converts a formula to a bounded formula. Throws if the formula has a free
   * variable whose index is not less than {@code bound}. */
  public static BoundedFormula of(Formula formula, int bound) {
    checkArgument(formula.freeBound() <= bound,
        "formula %s has a free variable not below %s", formula, bound);
    return of_(formula, bound);
  }

  private static BoundedFormula of_(Formula formula, int bound) {
    switch (formula.op) {
    case FALSUM:
      return new Falsum(bound);
    case EQUAL:
      final Formula.Equal equal = (Formula.Equal) formula;
      return new Equal(BoundedTerm.of(equal.left, bound),
          BoundedTerm.of(equal.right, bound));
    case REL:
      return new Rel(bound, ((Formula.Rel) formula).symbol);
    case APP_REL:
      final Formula.AppRel appRel = (Formula.AppRel) formula;
      return new AppRel(of_(appRel.rel, bound),
          BoundedTerm.of(appRel.arg, bound));
    case IMP:
      final Formula.Imp imp = (Formula.Imp) formula;
      return new Imp(of_(imp.antecedent, bound), of_(imp.consequent, bound));
    case ALL:
      return new All(of_(((Formula.All) formula).body, bound + 1));
    default:
      throw new AssertionError(formula.op);
    }
  }

  /** Returns the corresponding unconstrained formula. */
  public abstract Formula erase();

  /** Returns this formula with bound increased to {@code newBound}. */
  public final BoundedFormula widen(int newBound) {
    checkArgument(newBound >= bound, "cannot narrow bound %s to %s", bound,
        newBound);
    return newBound == bound ? this : of(erase(), newBound);
  }

  /** Lifts free variables at or above {@code m} by {@code n}. The result has
   * bound {@code bound + n}. */
  public abstract BoundedFormula lift(int n, int m);

  /**
   * Substitutes {@code s} for free variable {@code n}.
   *
   * <p>Requires that this formula has bound {@code n + s.bound + 1}; the
   * result has bound {@code n + s.bound}.
   */
  public final BoundedFormula subst(int n, BoundedTerm s) {
    checkArgument(s.arity == 0, "substituted term must be fully applied: %s",
        s);
    checkArgument(n >= 0 && bound == n + s.bound + 1,
        "cannot substitute at %s a term with bound %s into a formula with "
            + "bound %s", n, s.bound, bound);
    return subst_(n, s);
  }

  abstract BoundedFormula subst_(int n, BoundedTerm s);

  /** Instantiates the quantified variable of a formula with bound 1 by a
   * closed term, yielding a sentence. */
  public final BoundedFormula instantiate(BoundedTerm closedTerm) {
    return subst(0, closedTerm);
  }

  /** Bounded falsum. */
  public static final class Falsum extends BoundedFormula {
    Falsum(int bound) {
      super(Op.FALSUM, bound, 0);
    }

    @Override
    public Formula erase() {
      return fol.falsum();
    }

    @Override
    public BoundedFormula lift(int n, int m) {
      return new Falsum(bound + n);
    }

    @Override
    BoundedFormula subst_(int n, BoundedTerm s) {
      return new Falsum(bound - 1);
    }
  }

  /** Bounded equality. */
  public static final class Equal extends BoundedFormula {
    public final BoundedTerm left;
    public final BoundedTerm right;

    Equal(BoundedTerm left, BoundedTerm right) {
      super(Op.EQUAL, left.bound, 0);
      checkArgument(left.bound == right.bound, "bounds differ: %s, %s",
          left.bound, right.bound);
      checkArgument(left.arity == 0 && right.arity == 0,
          "not fully applied: %s, %s", left, right);
      this.left = left;
      this.right = right;
    }

    @Override
    public Formula erase() {
      return fol.equal(left.erase(), right.erase());
    }

    @Override
    public BoundedFormula lift(int n, int m) {
      return new Equal(left.lift(n, m), right.lift(n, m));
    }

    @Override
    BoundedFormula subst_(int n, BoundedTerm s) {
      return new Equal(left.subst_(n, s), right.subst_(n, s));
    }
  }

  /** Bounded reference to a relation symbol. */
  public static final class Rel extends BoundedFormula {
    public final Symbol.Rel symbol;

    Rel(int bound, Symbol.Rel symbol) {
      super(Op.REL, bound, symbol.arity);
      this.symbol = symbol;
    }

    @Override
    public Formula erase() {
      return fol.rel(symbol);
    }

    @Override
    public BoundedFormula lift(int n, int m) {
      return new Rel(bound + n, symbol);
    }

    @Override
    BoundedFormula subst_(int n, BoundedTerm s) {
      return new Rel(bound - 1, symbol);
    }
  }

  /** Bounded application of a relation to an argument. */
  public static final class AppRel extends BoundedFormula {
    public final BoundedFormula rel;
    public final BoundedTerm arg;

    AppRel(BoundedFormula rel, BoundedTerm arg) {
      super(Op.APP_REL, rel.bound, rel.arity - 1);
      checkArgument(rel.bound == arg.bound, "bounds differ: %s, %s",
          rel.bound, arg.bound);
      checkArgument(rel.arity > 0, "formula %s expects no more arguments",
          rel);
      checkArgument(arg.arity == 0, "argument %s is not fully applied", arg);
      this.rel = rel;
      this.arg = arg;
    }

    @Override
    public Formula erase() {
      return fol.appRel(rel.erase(), arg.erase());
    }

    @Override
    public BoundedFormula lift(int n, int m) {
      return new AppRel(rel.lift(n, m), arg.lift(n, m));
    }

    @Override
    BoundedFormula subst_(int n, BoundedTerm s) {
      return new AppRel(rel.subst_(n, s), arg.subst_(n, s));
    }
  }

  /** Bounded implication. */
  public static final class Imp extends BoundedFormula {
    public final BoundedFormula antecedent;
    public final BoundedFormula consequent;

    Imp(BoundedFormula antecedent, BoundedFormula consequent) {
      super(Op.IMP, antecedent.bound, 0);
      checkArgument(antecedent.bound == consequent.bound,
          "bounds differ: %s, %s", antecedent.bound, consequent.bound);
      checkArgument(antecedent.arity == 0 && consequent.arity == 0,
          "not fully applied: %s, %s", antecedent, consequent);
      this.antecedent = antecedent;
      this.consequent = consequent;
    }

    @Override
    public Formula erase() {
      return fol.imp(antecedent.erase(), consequent.erase());
    }

    @Override
    public BoundedFormula lift(int n, int m) {
      return new Imp(antecedent.lift(n, m), consequent.lift(n, m));
    }

    @Override
    BoundedFormula subst_(int n, BoundedTerm s) {
      return new Imp(antecedent.subst_(n, s), consequent.subst_(n, s));
    }
  }

  /** Bounded universal quantification. The body's bound is one greater than
   * this formula's. */
  public static final class All extends BoundedFormula {
    public final BoundedFormula body;

    All(BoundedFormula body) {
      super(Op.ALL, body.bound - 1, 0);
      checkArgument(body.arity == 0, "not fully applied: %s", body);
      this.body = body;
    }

    @Override
    public Formula erase() {
      return fol.all(body.erase());
    }

    @Override
    public BoundedFormula lift(int n, int m) {
      return new All(body.lift(n, m + 1));
    }

    @Override
    BoundedFormula subst_(int n, BoundedTerm s) {
      return new All(body.subst_(n + 1, s));
    }
  }
}

// End BoundedFormula.java
