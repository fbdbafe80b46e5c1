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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signature: function symbols and relation symbols, each family indexed by
 * arity.
 *
 * <p>A signature is immutable. Use {@link #builder()} to create one, and
 * {@link #withConstants} to extend one with fresh constants.
 */
public class Signature {
  /** Signature with no symbols. Terms over it are just variables. */
  public static final Signature EMPTY = builder().build();

  private final ImmutableSortedMap<String, Symbol.Fn> functions;
  private final ImmutableSortedMap<String, Symbol.Rel> relations;

  private Signature(
      ImmutableSortedMap<String, Symbol.Fn> functions,
      ImmutableSortedMap<String, Symbol.Rel> relations) {
    this.functions = functions;
    this.relations = relations;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "{functions: " + functions.values()
        + ", relations: " + relations.values() + "}";
  }

  /** Returns all function symbols, sorted by arity then name. */
  public List<Symbol.Fn> functions() {
    return Symbol.ORDERING.sortedCopy(functions.values());
  }

  /** Returns the function symbols of a given arity, sorted by name. */
  public List<Symbol.Fn> functions(int arity) {
    final ImmutableList.Builder<Symbol.Fn> b = ImmutableList.builder();
    functions.values().forEach(f -> {
      if (f.arity == arity) {
        b.add(f);
      }
    });
    return b.build();
  }

  /** Returns the constants (function symbols of arity 0), sorted by name. */
  public List<Symbol.Fn> constants() {
    return functions(0);
  }

  /** Returns all relation symbols, sorted by arity then name. */
  public List<Symbol.Rel> relations() {
    return Symbol.ORDERING.sortedCopy(relations.values());
  }

  /** Returns the relation symbols of a given arity, sorted by name. */
  public List<Symbol.Rel> relations(int arity) {
    final ImmutableList.Builder<Symbol.Rel> b = ImmutableList.builder();
    relations.values().forEach(r -> {
      if (r.arity == arity) {
        b.add(r);
      }
    });
    return b.build();
  }

  /** Looks up a function symbol by name; throws if not found. */
  public Symbol.Fn function(String name) {
    final Symbol.Fn f = functions.get(name);
    if (f == null) {
      throw new IllegalArgumentException("function " + name + " not found");
    }
    return f;
  }

  /** Looks up a relation symbol by name; throws if not found. */
  public Symbol.Rel relation(String name) {
    final Symbol.Rel r = relations.get(name);
    if (r == null) {
      throw new IllegalArgumentException("relation " + name + " not found");
    }
    return r;
  }

  /** Returns whether this signature contains a given symbol. */
  public boolean contains(Symbol symbol) {
    final @Nullable Symbol s =
        symbol instanceof Symbol.Fn
            ? functions.get(symbol.name)
            : relations.get(symbol.name);
    return symbol.equals(s);
  }

  /** Returns whether every function symbol has arity 0. If so, every closed
   * term is a constant, and there are finitely many closed terms. */
  public boolean isAlgebraFree() {
    return functions.values().stream().allMatch(Symbol.Fn::isConstant);
  }

  /** Returns a signature that has the same symbols as this one plus some new
   * constants. Throws if a name is already used by a function symbol. */
  public Signature withConstants(Iterable<String> names) {
    final Builder b = toBuilder();
    names.forEach(b::constant);
    return b.build();
  }

  /** Returns a builder initialized with this signature's symbols. */
  public Builder toBuilder() {
    final Builder b = new Builder();
    b.functions.putAll(functions);
    b.relations.putAll(relations);
    return b;
  }

  /** Builder for a {@link Signature}. */
  public static class Builder {
    private final Map<String, Symbol.Fn> functions = new LinkedHashMap<>();
    private final Map<String, Symbol.Rel> relations = new LinkedHashMap<>();

    private Builder() {}

    /** Adds a function symbol. */
    public Builder function(String name, int arity) {
      checkArgument(!functions.containsKey(name),
          "duplicate function symbol %s", name);
      functions.put(name, Symbol.Fn.of(name, arity));
      return this;
    }

    /** Adds a constant, that is, a function symbol of arity 0. */
    public Builder constant(String name) {
      return function(name, 0);
    }

    /** Adds a relation symbol. */
    public Builder relation(String name, int arity) {
      checkArgument(!relations.containsKey(name),
          "duplicate relation symbol %s", name);
      relations.put(name, Symbol.Rel.of(name, arity));
      return this;
    }

    public Signature build() {
      return new Signature(ImmutableSortedMap.copyOf(functions),
          ImmutableSortedMap.copyOf(relations));
    }
  }
}

// End Signature.java
