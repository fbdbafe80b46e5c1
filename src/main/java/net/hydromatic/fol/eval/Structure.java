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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.fol.ast.Signature;
import net.hydromatic.fol.ast.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Structure: a carrier together with an interpretation of each function and
 * relation symbol of a signature.
 *
 * <p>The carrier is either a finite set or, if it is not given, an
 * unenumerated type. Over an unenumerated carrier, terms and quantifier-free
 * formulas can be realized, but universal quantifiers cannot.
 *
 * <p>Structures are immutable.
 *
 * @param <E> element type
 */
public class Structure<E> {
  public final Signature signature;
  private final @Nullable ImmutableSet<E> carrier;
  private final ImmutableMap<Symbol.Fn, Function<List<E>, E>> functions;
  private final ImmutableMap<Symbol.Rel, Predicate<List<E>>> relations;

  private Structure(Signature signature, @Nullable ImmutableSet<E> carrier,
      ImmutableMap<Symbol.Fn, Function<List<E>, E>> functions,
      ImmutableMap<Symbol.Rel, Predicate<List<E>>> relations) {
    this.signature = requireNonNull(signature);
    this.carrier = carrier;
    this.functions = requireNonNull(functions);
    this.relations = requireNonNull(relations);
  }

  /** Creates a builder for a structure over a signature. */
  public static <E> Builder<E> builder(Signature signature) {
    return new Builder<>(signature);
  }

  @Override
  public String toString() {
    return "Structure{carrier=" + (carrier == null ? "?" : carrier)
        + ", signature=" + signature + "}";
  }

  /** Returns whether the carrier is a finite, enumerable set. */
  public boolean isFinite() {
    return carrier != null;
  }

  /** Returns the carrier; throws if it is not finite. */
  public ImmutableSet<E> carrier() {
    if (carrier == null) {
      throw new UnsupportedOperationException("carrier is not finite");
    }
    return carrier;
  }

  /** Returns the carrier as a list, in the order its elements were given. */
  public List<E> carrierList() {
    return carrier().asList();
  }

  /** Returns a structure whose signature has extra constants, each
   * interpreted as the given element. */
  public Structure<E> withConstants(Map<String, E> names) {
    final Signature signature2 = signature.withConstants(names.keySet());
    final ImmutableMap.Builder<Symbol.Fn, Function<List<E>, E>> b =
        ImmutableMap.builder();
    b.putAll(functions);
    names.forEach((name, e) -> {
      checkArgument(carrier == null || carrier.contains(e),
          "%s is not in the carrier", e);
      b.put(signature2.function(name), args -> e);
    });
    return new Structure<>(signature2, carrier, b.build(), relations);
  }

  /** Applies the interpretation of a function symbol. */
  public E apply(Symbol.Fn symbol, List<E> args) {
    checkArgument(args.size() == symbol.arity,
        "function %s expects %s arguments, got %s", symbol, symbol.arity,
        args.size());
    final Function<List<E>, E> function = functions.get(symbol);
    checkArgument(function != null, "function %s not in signature", symbol);
    final E e = requireNonNull(function.apply(ImmutableList.copyOf(args)));
    if (carrier != null && !carrier.contains(e)) {
      throw new IllegalStateException("function " + symbol + " applied to "
          + args + " gave " + e + ", which is not in the carrier");
    }
    return e;
  }

  /** Tests the interpretation of a relation symbol. */
  public boolean test(Symbol.Rel symbol, List<E> args) {
    checkArgument(args.size() == symbol.arity,
        "relation %s expects %s arguments, got %s", symbol, symbol.arity,
        args.size());
    final Predicate<List<E>> relation = relations.get(symbol);
    checkArgument(relation != null, "relation %s not in signature", symbol);
    return relation.test(ImmutableList.copyOf(args));
  }

  /** Builder for {@link Structure}.
   *
   * @param <E> element type */
  public static class Builder<E> {
    private final Signature signature;
    private @Nullable ImmutableSet<E> carrier;
    private final Map<Symbol.Fn, Function<List<E>, E>> functions =
        new HashMap<>();
    private final Map<Symbol.Rel, Predicate<List<E>>> relations =
        new HashMap<>();

    Builder(Signature signature) {
      this.signature = requireNonNull(signature);
    }

    /** Sets a finite carrier. It must not be empty. */
    public Builder<E> carrier(Iterable<? extends E> elements) {
      final ImmutableSet<E> set = ImmutableSet.copyOf(elements);
      checkArgument(!set.isEmpty(), "carrier must not be empty");
      this.carrier = set;
      return this;
    }

    /** Interprets a function symbol. */
    public Builder<E> function(String name, Function<List<E>, E> function) {
      functions.put(signature.function(name), requireNonNull(function));
      return this;
    }

    /** Interprets a constant symbol. */
    public Builder<E> constant(String name, E value) {
      final Symbol.Fn symbol = signature.function(name);
      checkArgument(symbol.isConstant(), "not a constant: %s", symbol);
      requireNonNull(value);
      functions.put(symbol, args -> value);
      return this;
    }

    /** Interprets a relation symbol as a predicate. */
    public Builder<E> relation(String name, Predicate<List<E>> relation) {
      relations.put(signature.relation(name), requireNonNull(relation));
      return this;
    }

    /** Interprets a relation symbol as the set of tuples for which it
     * holds. */
    public Builder<E> relation(String name, Set<? extends List<E>> tuples) {
      final ImmutableSet<List<E>> set = ImmutableSet.copyOf(tuples);
      return relation(name, set::contains);
    }

    /** Creates the structure; every symbol must have been interpreted. */
    public Structure<E> build() {
      for (Symbol.Fn fn : signature.functions()) {
        checkState(functions.containsKey(fn), "no interpretation for %s", fn);
      }
      for (Symbol.Rel rel : signature.relations()) {
        checkState(relations.containsKey(rel), "no interpretation for %s",
            rel);
      }
      return new Structure<>(signature, carrier,
          ImmutableMap.copyOf(functions), ImmutableMap.copyOf(relations));
    }
  }
}

// End Structure.java
