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

/**
 * Term whose variables are all below a static bound.
 *
 * <p>A bounded term is structurally identical to a {@link Term}, but every
 * variable index is less than {@link #bound}. A bounded term with bound 0 is
 * closed. {@link #erase()} converts to the unconstrained representation; it is
 * injective for each fixed bound, and commutes with {@link #lift} and
 * {@link #subst}. {@link #of(Term, int)} is its inverse.
 */
public abstract class BoundedTerm {
  public final Op op;

  /** Every variable has an index less than this. */
  public final int bound;

  /** Number of arguments that this term still expects. */
  public final int arity;

  BoundedTerm(Op op, int bound, int arity) {
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
        || obj instanceof BoundedTerm
            && bound == ((BoundedTerm) obj).bound
            && erase().equals(((BoundedTerm) obj).erase());
  }

  @Override
  public String toString() {
    return erase().toString();
  }

  /** Converts a term to a bounded term. Throws if the term has a variable
   * whose index is not less than {@code bound}. */
  public static BoundedTerm of(Term term, int bound) {
    checkArgument(term.freeBound() <= bound,
        "term %s has a variable not below %s", term, bound);
    return term.accept(
        new TermVisitor<BoundedTerm>() {
          @Override
          public BoundedTerm visit(Term.Var var) {
            return new Var(bound, var.index);
          }

          @Override
          public BoundedTerm visit(Term.Func func) {
            return new Func(bound, func.symbol);
          }

          @Override
          public BoundedTerm visit(Term.App app) {
            return new App(app.fn.accept(this), app.arg.accept(this));
          }
        });
  }

  /** Returns the corresponding unconstrained term. */
  public abstract Term erase();

  /** Returns this term with bound increased to {@code newBound}; indices do
   * not change. */
  public final BoundedTerm widen(int newBound) {
    checkArgument(newBound >= bound, "cannot narrow bound %s to %s", bound,
        newBound);
    return newBound == bound ? this : of(erase(), newBound);
  }

  /** Increases by {@code n} every variable index that is at least {@code m}.
   * The result has bound {@code bound + n}. */
  public abstract BoundedTerm lift(int n, int m);

  /**
   * Substitutes {@code s} for variable {@code n}.
   *
   * <p>Requires that this term has bound {@code n + s.bound + 1}; the result
   * has bound {@code n + s.bound}.
   */
  public final BoundedTerm subst(int n, BoundedTerm s) {
    checkArgument(s.arity == 0, "substituted term must be fully applied: %s",
        s);
    checkArgument(n >= 0 && bound == n + s.bound + 1,
        "cannot substitute at %s a term with bound %s into a term with bound "
            + "%s", n, s.bound, bound);
    return subst_(n, s);
  }

  abstract BoundedTerm subst_(int n, BoundedTerm s);

  /** Bounded variable. */
  public static final class Var extends BoundedTerm {
    public final int index;

    Var(int bound, int index) {
      super(Op.VAR, bound, 0);
      checkArgument(index >= 0 && index < bound,
          "index %s out of scope %s", index, bound);
      this.index = index;
    }

    @Override
    public Term erase() {
      return FolBuilder.fol.var(index);
    }

    @Override
    public BoundedTerm lift(int n, int m) {
      return new Var(bound + n, index < m ? index : index + n);
    }

    @Override
    BoundedTerm subst_(int n, BoundedTerm s) {
      if (index < n) {
        return new Var(bound - 1, index);
      } else if (index > n) {
        return new Var(bound - 1, index - 1);
      } else {
        return s.lift(n, 0);
      }
    }
  }

  /** Bounded reference to a function symbol. */
  public static final class Func extends BoundedTerm {
    public final Symbol.Fn symbol;

    Func(int bound, Symbol.Fn symbol) {
      super(Op.FUNC, bound, symbol.arity);
      this.symbol = symbol;
    }

    @Override
    public Term erase() {
      return FolBuilder.fol.func(symbol);
    }

    @Override
    public BoundedTerm lift(int n, int m) {
      return new Func(bound + n, symbol);
    }

    @Override
    BoundedTerm subst_(int n, BoundedTerm s) {
      return new Func(bound - 1, symbol);
    }
  }

  /** Bounded application. Both components have the same bound. */
  public static final class App extends BoundedTerm {
    public final BoundedTerm fn;
    public final BoundedTerm arg;

    App(BoundedTerm fn, BoundedTerm arg) {
      super(Op.APP, fn.bound, fn.arity - 1);
      checkArgument(fn.bound == arg.bound, "bounds differ: %s, %s", fn.bound,
          arg.bound);
      checkArgument(fn.arity > 0, "term %s expects no more arguments", fn);
      checkArgument(arg.arity == 0, "argument %s is not fully applied", arg);
      this.fn = fn;
      this.arg = arg;
    }

    @Override
    public Term erase() {
      return FolBuilder.fol.app(fn.erase(), arg.erase());
    }

    @Override
    public BoundedTerm lift(int n, int m) {
      return new App(fn.lift(n, m), arg.lift(n, m));
    }

    @Override
    BoundedTerm subst_(int n, BoundedTerm s) {
      return new App(fn.subst_(n, s), arg.subst_(n, s));
    }
  }
}

// End BoundedTerm.java
