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
package net.hydromatic.fol.kernel;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.fol.ast.FolBuilder.fol;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.fol.ast.Formula;
import net.hydromatic.fol.ast.Term;

/**
 * Derivation of a conclusion from a set of premises, {@code Γ ⊢ A}.
 *
 * <p>There is one sub-class per {@link Rule}. Constructors are not public:
 * the only way to obtain a derivation is via {@link Kernel}, which checks
 * the shape of each rule application. A derivation is therefore a certificate
 * that its {@link #conclusion} follows from its {@link #premises}.
 *
 * <p>Derivations are immutable, and may share sub-derivations.
 */
public abstract class Derivation {
  public final Rule rule;
  public final ImmutableSet<Formula> premises;
  public final Formula conclusion;

  /** Cached {@link #size()} and {@link #depth()}; -1 until computed. */
  private int size = -1;
  private int depth = -1;

  Derivation(Rule rule, ImmutableSet<Formula> premises, Formula conclusion) {
    this.rule = requireNonNull(rule);
    this.premises = requireNonNull(premises);
    this.conclusion = requireNonNull(conclusion);
  }

  /** Returns a description such as "{@code {A} ⊢ (A ⟹ A)}". */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("{");
    int i = 0;
    for (Formula premise : premises) {
      if (i++ > 0) {
        buf.append(", ");
      }
      buf.append(premise);
    }
    return buf.append("} ⊢ ").append(conclusion).toString();
  }

  /** Returns the derivations that this derivation was built from. */
  public abstract List<Derivation> inputs();

  /** Accepts a visitor, calling the {@code visit} method appropriate to the
   * rule of this derivation. */
  public abstract <R> R accept(DerivationVisitor<R> visitor);

  /** Returns the number of rule applications in this derivation, counting
   * a shared input once for each use. */
  public int size() {
    if (size < 0) {
      int n = 1;
      for (Derivation input : inputs()) {
        n += input.size();
      }
      size = n;
    }
    return size;
  }

  /** Returns the length of the longest path from this derivation to a
   * derivation with no inputs. An axiom has depth 0. */
  public int depth() {
    if (depth < 0) {
      int n = 0;
      for (Derivation input : inputs()) {
        n = Math.max(n, input.depth() + 1);
      }
      depth = n;
    }
    return depth;
  }

  /** Derivation by {@link Rule#AXM}. */
  public static final class Axm extends Derivation {
    Axm(ImmutableSet<Formula> premises, Formula conclusion) {
      super(Rule.AXM, premises, conclusion);
    }

    @Override
    public List<Derivation> inputs() {
      return ImmutableList.of();
    }

    @Override
    public <R> R accept(DerivationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Derivation by {@link Rule#IMP_I}. */
  public static final class ImpI extends Derivation {
    /** The discharged assumption. */
    public final Formula antecedent;
    public final Derivation input;

    ImpI(ImmutableSet<Formula> premises, Formula antecedent,
        Derivation input) {
      super(Rule.IMP_I, premises,
          fol.imp(antecedent, input.conclusion));
      this.antecedent = antecedent;
      this.input = input;
    }

    @Override
    public List<Derivation> inputs() {
      return ImmutableList.of(input);
    }

    @Override
    public <R> R accept(DerivationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Derivation by {@link Rule#IMP_E}. */
  public static final class ImpE extends Derivation {
    /** Derivation of {@code A ⟹ B}. */
    public final Derivation major;
    /** Derivation of {@code A}. */
    public final Derivation minor;

    ImpE(Derivation major, Derivation minor) {
      super(Rule.IMP_E, major.premises,
          ((Formula.Imp) major.conclusion).consequent);
      this.major = major;
      this.minor = minor;
    }

    @Override
    public List<Derivation> inputs() {
      return ImmutableList.of(major, minor);
    }

    @Override
    public <R> R accept(DerivationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Derivation by {@link Rule#FALSUM_E}. */
  public static final class FalsumE extends Derivation {
    /** Derivation of {@code ⊥} from premises plus {@code ¬conclusion}. */
    public final Derivation input;

    FalsumE(ImmutableSet<Formula> premises, Formula conclusion,
        Derivation input) {
      super(Rule.FALSUM_E, premises, conclusion);
      this.input = input;
    }

    @Override
    public List<Derivation> inputs() {
      return ImmutableList.of(input);
    }

    @Override
    public <R> R accept(DerivationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Derivation by {@link Rule#ALL_I}. */
  public static final class AllI extends Derivation {
    /** Derivation of the body from the lifted premises. */
    public final Derivation input;

    AllI(ImmutableSet<Formula> premises, Derivation input) {
      super(Rule.ALL_I, premises, fol.all(input.conclusion));
      this.input = input;
    }

    @Override
    public List<Derivation> inputs() {
      return ImmutableList.of(input);
    }

    @Override
    public <R> R accept(DerivationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Derivation by {@link Rule#ALL_E}. */
  public static final class AllE extends Derivation {
    /** The term that instantiates the quantifier. */
    public final Term term;
    /** Derivation of {@code ∀A}. */
    public final Derivation input;

    AllE(Term term, Derivation input, Formula conclusion) {
      super(Rule.ALL_E, input.premises, conclusion);
      this.term = term;
      this.input = input;
    }

    @Override
    public List<Derivation> inputs() {
      return ImmutableList.of(input);
    }

    @Override
    public <R> R accept(DerivationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Derivation by {@link Rule#REF}. */
  public static final class Ref extends Derivation {
    public final Term term;

    Ref(ImmutableSet<Formula> premises, Term term) {
      super(Rule.REF, premises, fol.equal(term, term));
      this.term = term;
    }

    @Override
    public List<Derivation> inputs() {
      return ImmutableList.of();
    }

    @Override
    public <R> R accept(DerivationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Derivation by {@link Rule#SUBST}. */
  public static final class Subst extends Derivation {
    /** Formula {@code F} whose variable 0 marks the positions that are
     * rewritten. */
    public final Formula template;
    /** Derivation of {@code s ≃ t}. */
    public final Derivation equality;
    /** Derivation of {@code F[s // 0]}. */
    public final Derivation input;

    Subst(Formula template, Derivation equality, Derivation input,
        Formula conclusion) {
      super(Rule.SUBST, input.premises, conclusion);
      this.template = template;
      this.equality = equality;
      this.input = input;
    }

    @Override
    public List<Derivation> inputs() {
      return ImmutableList.of(equality, input);
    }

    @Override
    public <R> R accept(DerivationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}

// End Derivation.java
