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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;

/**
 * Term, possibly partially applied.
 *
 * <p>A term is a variable ({@link Var}, a de Bruijn index), a function symbol
 * ({@link Func}), or the application ({@link App}) of a term that still
 * expects arguments to a fully-applied term. The {@link #arity} of a term is
 * the number of arguments it still expects; only terms of arity 0 are terms
 * proper. A function symbol applied to {@code n} arguments is {@code n}
 * nested {@code App} nodes around a {@code Func} node.
 *
 * <p>Terms are immutable, and compare structurally.
 */
public abstract class Term {
  public final Op op;

  /** Number of arguments that this term still expects. */
  public final int arity;

  private final int hash;

  Term(Op op, int arity, int hash) {
    this.op = requireNonNull(op);
    this.arity = arity;
    this.hash = hash;
  }

  @Override
  public final int hashCode() {
    return hash;
  }

  @Override
  public final String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf);

  /** Accepts a visitor, calling the {@code visit} method appropriate to the
   * type of this node. */
  public abstract <R> R accept(TermVisitor<R> visitor);

  /**
   * Folds a fully-applied term bottom-up.
   *
   * <p>Unlike {@link #accept(TermVisitor)}, the folder never sees the
   * "apply one more argument" layer; it sees a variable, or a function symbol
   * together with the results of folding each of its arguments.
   */
  public <R> R fold(Folder<R> folder) {
    checkArgument(arity == 0, "not fully applied: %s", this);
    if (this instanceof Var) {
      return folder.var(((Var) this).index);
    }
    final List<R> results = new ArrayList<>();
    for (Term arg : args()) {
      results.add(arg.fold(folder));
    }
    return folder.apply(((Func) head()).symbol, results);
  }

  /** Returns the node at the bottom of the chain of {@link App} nodes; a
   * {@link Func} or a {@link Var}. */
  public Term head() {
    Term t = this;
    while (t instanceof App) {
      t = ((App) t).fn;
    }
    return t;
  }

  /** Returns the arguments that have been applied to {@link #head()}, in
   * order. */
  public List<Term> args() {
    final List<Term> list = new ArrayList<>();
    for (Term t = this; t instanceof App; t = ((App) t).fn) {
      list.add(((App) t).arg);
    }
    return ImmutableList.copyOf(Lists.reverse(list));
  }

  /**
   * Increases by {@code n} every variable index that is greater than or equal
   * to {@code m}.
   *
   * <p>Indices below {@code m} refer to binders between the cut point and
   * this term, and do not move.
   */
  public abstract Term lift(int n, int m);

  /** Increases every variable index by {@code n}. */
  public final Term lift(int n) {
    return lift(n, 0);
  }

  /**
   * Replaces variable {@code n} with {@code s}, lifted by {@code n}; decreases
   * indices greater than {@code n} by 1; leaves indices less than {@code n}
   * unchanged.
   */
  public final Term subst(Term s, int n) {
    checkArgument(s.arity == 0, "substituted term must be fully applied: %s",
        s);
    checkArgument(n >= 0, "negative index %s", n);
    return subst_(s, n);
  }

  abstract Term subst_(Term s, int n);

  /** Returns the least {@code n} such that every variable in this term has
   * index less than {@code n}. */
  public abstract int freeBound();

  /** Returns whether this term has no variables. */
  public final boolean isClosed() {
    return freeBound() == 0;
  }

  /** Returns the number of nodes in this term. */
  public abstract int size();

  /**
   * Callback for {@link #fold(Folder)}.
   *
   * @param <R> result type
   */
  public interface Folder<R> {
    R var(int index);

    R apply(Symbol.Fn symbol, List<R> args);
  }

  /** Variable, represented by a de Bruijn index. */
  public static final class Var extends Term {
    public final int index;

    Var(int index) {
      super(Op.VAR, 0, index * 37 + 1);
      checkArgument(index >= 0, "negative index %s", index);
      this.index = index;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Var && index == ((Var) obj).index;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append('#').append(index);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Term lift(int n, int m) {
      return n == 0 || index < m ? this : new Var(index + n);
    }

    @Override
    Term subst_(Term s, int n) {
      if (index < n) {
        return this;
      } else if (index > n) {
        return new Var(index - 1);
      } else {
        return s.lift(n, 0);
      }
    }

    @Override
    public int freeBound() {
      return index + 1;
    }

    @Override
    public int size() {
      return 1;
    }
  }

  /** Reference to a function symbol, before any arguments are applied. */
  public static final class Func extends Term {
    public final Symbol.Fn symbol;

    Func(Symbol.Fn symbol) {
      super(Op.FUNC, symbol.arity, symbol.hashCode() * 37 + 2);
      this.symbol = symbol;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Func && symbol.equals(((Func) obj).symbol);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(symbol.name);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Term lift(int n, int m) {
      return this;
    }

    @Override
    Term subst_(Term s, int n) {
      return this;
    }

    @Override
    public int freeBound() {
      return 0;
    }

    @Override
    public int size() {
      return 1;
    }
  }

  /** Application of a term that expects at least one more argument to a
   * fully-applied term. */
  public static final class App extends Term {
    public final Term fn;
    public final Term arg;

    App(Term fn, Term arg) {
      super(Op.APP, fn.arity - 1, (fn.hashCode() * 37 + arg.hashCode()) * 37);
      checkArgument(fn.arity > 0, "term %s expects no more arguments", fn);
      checkArgument(arg.arity == 0, "argument %s is not fully applied", arg);
      this.fn = fn;
      this.arg = arg;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof App
              && hashCode() == obj.hashCode()
              && fn.equals(((App) obj).fn)
              && arg.equals(((App) obj).arg);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      head().unparse(buf).append('(');
      final List<Term> args = args();
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        args.get(i).unparse(buf);
      }
      return buf.append(')');
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    /** Creates an application with the given components, or returns this if
     * they are the same as this. */
    App copy(Term fn, Term arg) {
      return fn == this.fn && arg == this.arg ? this : new App(fn, arg);
    }

    @Override
    public Term lift(int n, int m) {
      return copy(fn.lift(n, m), arg.lift(n, m));
    }

    @Override
    Term subst_(Term s, int n) {
      return copy(fn.subst_(s, n), arg.subst_(s, n));
    }

    @Override
    public int freeBound() {
      return Math.max(fn.freeBound(), arg.freeBound());
    }

    @Override
    public int size() {
      return fn.size() + arg.size();
    }
  }
}

// End Term.java
