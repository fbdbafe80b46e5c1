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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Formula, possibly a partially applied relation.
 *
 * <p>The primitive connectives are falsum ({@link Falsum}), equality
 * ({@link Equal}), relation application ({@link Rel}, {@link AppRel}),
 * implication ({@link Imp}) and universal quantification ({@link All}).
 * Negation, conjunction, disjunction, biconditional and existential
 * quantification are derived; see {@link FolBuilder}.
 *
 * <p>As with {@link Term}, {@link #arity} is the number of arguments that a
 * relation still expects; only formulas of arity 0 are formulas proper.
 *
 * <p>Formulas are immutable, and compare structurally.
 */
public abstract class Formula {
  public final Op op;

  /** Number of arguments that this formula still expects. */
  public final int arity;

  private final int hash;

  Formula(Op op, int arity, int hash) {
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
    return unparse(new StringBuilder(), false).toString();
  }

  /** Writes this formula to a buffer. If {@code nested}, the formula is the
   * operand of a prefix operator and binary formulas need parentheses. */
  abstract StringBuilder unparse(StringBuilder buf, boolean nested);

  /** Accepts a visitor, calling the {@code visit} method appropriate to the
   * type of this node. */
  public abstract <R> R accept(FormulaVisitor<R> visitor);

  /**
   * Folds a formula bottom-up.
   *
   * <p>The folder sees falsum, equality, a relation symbol with all of its
   * arguments, implication and quantification; it never sees the
   * "apply one more argument" layer.
   */
  public <R> R fold(Folder<R> folder) {
    checkArgument(arity == 0, "not fully applied: %s", this);
    switch (op) {
    case FALSUM:
      return folder.falsum();
    case EQUAL:
      final Equal equal = (Equal) this;
      return folder.equal(equal.left, equal.right);
    case REL:
    case APP_REL:
      return folder.rel(((Rel) head()).symbol, args());
    case IMP:
      final Imp imp = (Imp) this;
      return folder.imp(imp.antecedent.fold(folder),
          imp.consequent.fold(folder));
    case ALL:
      return folder.all(((All) this).body.fold(folder));
    default:
      throw new AssertionError(op);
    }
  }

  /** Returns the node at the bottom of a chain of {@link AppRel} nodes. */
  public Formula head() {
    Formula f = this;
    while (f instanceof AppRel) {
      f = ((AppRel) f).rel;
    }
    return f;
  }

  /** Returns the arguments applied to {@link #head()}, in order. Empty if
   * this is not a relation application. */
  public List<Term> args() {
    final List<Term> list = new ArrayList<>();
    for (Formula f = this; f instanceof AppRel; f = ((AppRel) f).rel) {
      list.add(((AppRel) f).arg);
    }
    return ImmutableList.copyOf(Lists.reverse(list));
  }

  /** If this formula is a negation "{@code a ⟹ ⊥}", returns {@code a};
   * otherwise null. */
  public @Nullable Formula negand() {
    return null;
  }

  /** Increases by {@code n} every free variable index that is at least
   * {@code m}. Crossing a quantifier increments the cut point. */
  public abstract Formula lift(int n, int m);

  /** Increases every free variable index by {@code n}. */
  public final Formula lift(int n) {
    return lift(n, 0);
  }

  /**
   * Substitutes {@code s} for free variable {@code n}, closing the gap left
   * by that variable. Crossing a quantifier increments {@code n}.
   *
   * @see Term#subst(Term, int)
   */
  public final Formula subst(Term s, int n) {
    checkArgument(s.arity == 0, "substituted term must be fully applied: %s",
        s);
    checkArgument(n >= 0, "negative index %s", n);
    return subst_(s, n);
  }

  abstract Formula subst_(Term s, int n);

  /** Returns the least {@code n} such that every free variable in this
   * formula has index less than {@code n}. */
  public abstract int freeBound();

  /** Returns whether this formula has no free variables. */
  public final boolean isSentence() {
    return arity == 0 && freeBound() == 0;
  }

  /** Returns the number of universal quantifiers in this formula. Lifting
   * and substitution preserve it. */
  public final int quantifierCount() {
    int count = 0;
    final Deque<Formula> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      final Formula f = stack.pop();
      if (f instanceof All) {
        ++count;
        stack.push(((All) f).body);
      } else if (f instanceof Imp) {
        stack.push(((Imp) f).antecedent);
        stack.push(((Imp) f).consequent);
      }
    }
    return count;
  }

  /** Returns whether this formula contains no quantifiers. */
  public final boolean isQuantifierFree() {
    return quantifierCount() == 0;
  }

  /** Returns the number of nodes in this formula, including the nodes of its
   * terms. */
  public final int size() {
    int size = 0;
    final Deque<Formula> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      final Formula f = stack.pop();
      ++size;
      switch (f.op) {
      case EQUAL:
        size += ((Equal) f).left.size() + ((Equal) f).right.size();
        break;
      case APP_REL:
        size += ((AppRel) f).arg.size();
        stack.push(((AppRel) f).rel);
        break;
      case IMP:
        stack.push(((Imp) f).antecedent);
        stack.push(((Imp) f).consequent);
        break;
      case ALL:
        stack.push(((All) f).body);
        break;
      default:
        break;
      }
    }
    return size;
  }

  /**
   * Callback for {@link #fold(Folder)}.
   *
   * @param <R> result type
   */
  public interface Folder<R> {
    R falsum();

    R equal(Term left, Term right);

    R rel(Symbol.Rel symbol, List<Term> args);

    R imp(R antecedent, R consequent);

    R all(R body);
  }

  /** Falsum, the formula that is never true. */
  public static final class Falsum extends Formula {
    static final Falsum INSTANCE = new Falsum();

    private Falsum() {
      super(Op.FALSUM, 0, 3);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Falsum;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, boolean nested) {
      return buf.append(op.str);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Formula lift(int n, int m) {
      return this;
    }

    @Override
    Formula subst_(Term s, int n) {
      return this;
    }

    @Override
    public int freeBound() {
      return 0;
    }
  }

  /** Equality of two terms. */
  public static final class Equal extends Formula {
    public final Term left;
    public final Term right;

    Equal(Term left, Term right) {
      super(Op.EQUAL, 0, (left.hashCode() * 41 + right.hashCode()) * 41 + 4);
      checkArgument(left.arity == 0, "not fully applied: %s", left);
      checkArgument(right.arity == 0, "not fully applied: %s", right);
      this.left = left;
      this.right = right;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Equal
              && left.equals(((Equal) obj).left)
              && right.equals(((Equal) obj).right);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, boolean nested) {
      if (nested) {
        return unparse(buf.append('('), false).append(')');
      }
      return right.unparse(left.unparse(buf).append(op.str));
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }

    Equal copy(Term left, Term right) {
      return left == this.left && right == this.right
          ? this
          : new Equal(left, right);
    }

    @Override
    public Formula lift(int n, int m) {
      return copy(left.lift(n, m), right.lift(n, m));
    }

    @Override
    Formula subst_(Term s, int n) {
      return copy(left.subst_(s, n), right.subst_(s, n));
    }

    @Override
    public int freeBound() {
      return Math.max(left.freeBound(), right.freeBound());
    }
  }

  /** Reference to a relation symbol, before any arguments are applied. */
  public static final class Rel extends Formula {
    public final Symbol.Rel symbol;

    Rel(Symbol.Rel symbol) {
      super(Op.REL, symbol.arity, symbol.hashCode() * 41 + 5);
      this.symbol = symbol;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Rel && symbol.equals(((Rel) obj).symbol);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, boolean nested) {
      return buf.append(symbol.name);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Formula lift(int n, int m) {
      return this;
    }

    @Override
    Formula subst_(Term s, int n) {
      return this;
    }

    @Override
    public int freeBound() {
      return 0;
    }
  }

  /** Application of a relation that expects at least one more argument to a
   * fully-applied term. */
  public static final class AppRel extends Formula {
    public final Formula rel;
    public final Term arg;

    AppRel(Formula rel, Term arg) {
      super(Op.APP_REL, rel.arity - 1,
          (rel.hashCode() * 41 + arg.hashCode()) * 41 + 6);
      checkArgument(rel.arity > 0, "formula %s expects no more arguments", rel);
      checkArgument(arg.arity == 0, "argument %s is not fully applied", arg);
      this.rel = rel;
      this.arg = arg;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof AppRel
              && hashCode() == obj.hashCode()
              && rel.equals(((AppRel) obj).rel)
              && arg.equals(((AppRel) obj).arg);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, boolean nested) {
      head().unparse(buf, nested).append('(');
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
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }

    AppRel copy(Formula rel, Term arg) {
      return rel == this.rel && arg == this.arg ? this : new AppRel(rel, arg);
    }

    @Override
    public Formula lift(int n, int m) {
      return copy(rel.lift(n, m), arg.lift(n, m));
    }

    @Override
    Formula subst_(Term s, int n) {
      return copy(rel.subst_(s, n), arg.subst_(s, n));
    }

    @Override
    public int freeBound() {
      return Math.max(rel.freeBound(), arg.freeBound());
    }
  }

  /** Implication. */
  public static final class Imp extends Formula {
    public final Formula antecedent;
    public final Formula consequent;

    Imp(Formula antecedent, Formula consequent) {
      super(Op.IMP, 0,
          (antecedent.hashCode() * 41 + consequent.hashCode()) * 41 + 7);
      checkArgument(antecedent.arity == 0, "not fully applied: %s",
          antecedent);
      checkArgument(consequent.arity == 0, "not fully applied: %s",
          consequent);
      this.antecedent = antecedent;
      this.consequent = consequent;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Imp
              && hashCode() == obj.hashCode()
              && antecedent.equals(((Imp) obj).antecedent)
              && consequent.equals(((Imp) obj).consequent);
    }

    @Override
    public @Nullable Formula negand() {
      return consequent instanceof Falsum ? antecedent : null;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, boolean nested) {
      if (consequent instanceof Falsum) {
        return antecedent.unparse(buf.append('¬'), true);
      }
      buf.append('(');
      antecedent.unparse(buf, false).append(op.str);
      return consequent.unparse(buf, false).append(')');
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }

    Imp copy(Formula antecedent, Formula consequent) {
      return antecedent == this.antecedent && consequent == this.consequent
          ? this
          : new Imp(antecedent, consequent);
    }

    @Override
    public Formula lift(int n, int m) {
      return copy(antecedent.lift(n, m), consequent.lift(n, m));
    }

    @Override
    Formula subst_(Term s, int n) {
      return copy(antecedent.subst_(s, n), consequent.subst_(s, n));
    }

    @Override
    public int freeBound() {
      return Math.max(antecedent.freeBound(), consequent.freeBound());
    }
  }

  /** Universal quantification. The quantified variable is index 0 in
   * {@link #body}. */
  public static final class All extends Formula {
    public final Formula body;

    All(Formula body) {
      super(Op.ALL, 0, body.hashCode() * 41 + 8);
      checkArgument(body.arity == 0, "not fully applied: %s", body);
      this.body = body;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof All
              && hashCode() == obj.hashCode()
              && body.equals(((All) obj).body);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, boolean nested) {
      return body.unparse(buf.append(op.str), true);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }

    All copy(Formula body) {
      return body == this.body ? this : new All(body);
    }

    @Override
    public Formula lift(int n, int m) {
      return copy(body.lift(n, m + 1));
    }

    @Override
    Formula subst_(Term s, int n) {
      return copy(body.subst_(s, n + 1));
    }

    @Override
    public int freeBound() {
      return Math.max(body.freeBound() - 1, 0);
    }
  }
}

// End Formula.java
