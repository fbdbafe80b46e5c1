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

import com.google.common.collect.Ordering;
import java.util.Comparator;

/**
 * Function or relation symbol.
 *
 * <p>Symbols carry no behavior; only their name and arity matter. Two symbols
 * are equal if they are of the same kind and have the same name and arity.
 */
public abstract class Symbol implements Comparable<Symbol> {
  private static final Comparator<Symbol> COMPARATOR =
      Comparator.comparingInt((Symbol s) -> s.arity)
          .thenComparing(s -> s.name)
          .thenComparing(s -> s.getClass().getName());

  /** Ordering that compares symbols by arity, then by name. */
  public static final Ordering<Symbol> ORDERING = Ordering.from(COMPARATOR);

  public final String name;
  public final int arity;

  Symbol(String name, int arity) {
    this.name = requireNonNull(name, "name");
    this.arity = arity;
    checkArgument(!name.isEmpty(), "empty name");
    checkArgument(arity >= 0, "negative arity %s", arity);
  }

  @Override
  public int hashCode() {
    return (name.hashCode() * 31 + arity) * 31 + getClass().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj != null
            && obj.getClass() == getClass()
            && name.equals(((Symbol) obj).name)
            && arity == ((Symbol) obj).arity;
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public int compareTo(Symbol o) {
    return COMPARATOR.compare(this, o);
  }

  /** Function symbol. A function symbol of arity 0 is a constant. */
  public static final class Fn extends Symbol {
    Fn(String name, int arity) {
      super(name, arity);
    }

    /** Creates a function symbol. */
    public static Fn of(String name, int arity) {
      return new Fn(name, arity);
    }

    /** Returns whether this is a constant (a function symbol of arity 0). */
    public boolean isConstant() {
      return arity == 0;
    }
  }

  /** Relation symbol. */
  public static final class Rel extends Symbol {
    Rel(String name, int arity) {
      super(name, arity);
    }

    /** Creates a relation symbol. */
    public static Rel of(String name, int arity) {
      return new Rel(name, arity);
    }
  }
}

// End Symbol.java
