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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import java.util.Collections;
import java.util.List;

/**
 * Valuation: a total function from variable index to element.
 *
 * <p>Valuations are persistent; {@link #cons}, {@link #insert},
 * {@link #drop} and {@link #skip} return a new valuation and leave this one
 * unchanged.
 *
 * @param <E> element type
 */
public abstract class Valuation<E> {
  private Valuation() {}

  /** Returns the element assigned to a variable. */
  public abstract E get(int index);

  @Override
  public String toString() {
    return prefix(4) + "...";
  }

  /** Returns a valuation that assigns the same element to every variable. */
  public static <E> Valuation<E> constant(E e) {
    return new Prefix<>(ImmutableList.of(), e);
  }

  /** Returns a valuation that assigns {@code prefix.get(k)} to variable
   * {@code k} while {@code k < prefix.size()}, and {@code rest} to every
   * other variable. */
  public static <E> Valuation<E> of(List<E> prefix, E rest) {
    return new Prefix<>(ImmutableList.copyOf(prefix), rest);
  }

  /** Returns every valuation over {@code carrier} that differs only in
   * variables less than {@code n}. The others get the first element. */
  public static <E> Iterable<Valuation<E>> all(List<E> carrier, int n) {
    checkArgument(!carrier.isEmpty(), "empty carrier");
    final E first = carrier.get(0);
    return Iterables.transform(
        Lists.cartesianProduct(Collections.nCopies(n, carrier)),
        prefix -> of(prefix, first));
  }

  /** Returns a valuation that assigns {@code e} to variable 0, and what this
   * valuation assigns to {@code k} to variable {@code k + 1}. This is the
   * valuation under a quantifier. */
  public Valuation<E> cons(E e) {
    return insert(0, e);
  }

  /** Returns a valuation that assigns {@code e} to variable {@code n},
   * agrees with this below {@code n}, and shifts the rest up by one.
   *
   * <p>Realizing {@code t[s // n]} under {@code v} is the same as realizing
   * {@code t} under {@code v.insert(n, s')}, where {@code s'} is the
   * realization of {@code s} under {@code v.drop(n)}. */
  public Valuation<E> insert(int n, E e) {
    checkArgument(n >= 0, "negative index %s", n);
    return new Insert<>(this, n, requireNonNull(e));
  }

  /** Returns a valuation that assigns to {@code k} what this assigns to
   * {@code k + n}. */
  public Valuation<E> drop(int n) {
    checkArgument(n >= 0, "negative index %s", n);
    return n == 0 ? this : new Skip<>(this, n, 0);
  }

  /** Returns a valuation that agrees with this below {@code m}, and assigns
   * to {@code k ≥ m} what this assigns to {@code k + n}.
   *
   * <p>Realizing {@code lift(t, n, m)} under {@code v} is the same as
   * realizing {@code t} under {@code v.skip(n, m)}. */
  public Valuation<E> skip(int n, int m) {
    checkArgument(n >= 0 && m >= 0, "invalid skip %s, %s", n, m);
    return n == 0 ? this : new Skip<>(this, n, m);
  }

  /** Returns the elements assigned to variables {@code 0 .. n - 1}. */
  public List<E> prefix(int n) {
    final ImmutableList.Builder<E> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(get(i));
    }
    return b.build();
  }

  /** Returns whether this valuation agrees with another on variables
   * {@code 0 .. n - 1}. */
  public boolean agreesBelow(Valuation<E> other, int n) {
    return prefix(n).equals(other.prefix(n));
  }

  /** Valuation given by a list, then a default. */
  private static class Prefix<E> extends Valuation<E> {
    final ImmutableList<E> list;
    final E rest;

    Prefix(ImmutableList<E> list, E rest) {
      this.list = list;
      this.rest = requireNonNull(rest);
    }

    @Override
    public E get(int index) {
      checkArgument(index >= 0, "negative index %s", index);
      return index < list.size() ? list.get(index) : rest;
    }
  }

  /** Valuation with an element inserted. */
  private static class Insert<E> extends Valuation<E> {
    final Valuation<E> base;
    final int n;
    final E e;

    Insert(Valuation<E> base, int n, E e) {
      this.base = base;
      this.n = n;
      this.e = e;
    }

    @Override
    public E get(int index) {
      return index < n ? base.get(index)
          : index == n ? e
          : base.get(index - 1);
    }
  }

  /** Valuation with a gap. */
  private static class Skip<E> extends Valuation<E> {
    final Valuation<E> base;
    final int n;
    final int m;

    Skip(Valuation<E> base, int n, int m) {
      this.base = base;
      this.n = n;
      this.m = m;
    }

    @Override
    public E get(int index) {
      return base.get(index < m ? index : index + n);
    }
  }
}

// End Valuation.java
