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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Valuation}. */
public class ValuationTest {
  private final Valuation<String> v =
      Valuation.of(ImmutableList.of("a", "b", "c"), "z");

  @Test void testOf() {
    assertThat(v.get(0), is("a"));
    assertThat(v.get(2), is("c"));
    assertThat(v.get(100), is("z"));
    assertThat(v, hasToString("[a, b, c, z]..."));
    assertThat(Valuation.constant("x"), hasToString("[x, x, x, x]..."));
    assertThrows(IllegalArgumentException.class, () -> v.get(-1));
  }

  @Test void testCons() {
    final Valuation<String> v2 = v.cons("y");
    assertThat(v2.prefix(5), hasToString("[y, a, b, c, z]"));
    // v is unchanged
    assertThat(v.prefix(2), hasToString("[a, b]"));
  }

  @Test void testInsertDropSkip() {
    assertThat(v.insert(1, "y").prefix(5), hasToString("[a, y, b, c, z]"));
    assertThat(v.insert(3, "y").prefix(5), hasToString("[a, b, c, y, z]"));
    assertThat(v.drop(2).prefix(3), hasToString("[c, z, z]"));
    assertThat(v.drop(0), is(v));
    assertThat(v.skip(1, 1).prefix(3), hasToString("[a, c, z]"));
    assertThat(v.skip(2, 0).prefix(2), hasToString("[c, z]"));
    assertThrows(IllegalArgumentException.class, () -> v.insert(-1, "y"));
    assertThrows(IllegalArgumentException.class, () -> v.skip(1, -1));
  }

  /** Dropping undoes an insertion at 0; skipping undoes an insertion at the
   * same position. */
  @Test void testInverses() {
    for (int n = 0; n < 4; n++) {
      assertThat(v.insert(n, "y").skip(1, n).agreesBelow(v, 6), is(true));
    }
    assertThat(v.cons("y").drop(1).agreesBelow(v, 6), is(true));
    assertThat(v.cons("y").agreesBelow(v, 1), is(false));
    assertThat(v.cons("a").agreesBelow(v, 1), is(true));
  }

  @Test void testAll() {
    final List<Valuation<Integer>> list =
        Lists.newArrayList(Valuation.all(ImmutableList.of(0, 1, 2), 2));
    assertThat(list, hasSize(9));
    assertThat(list.get(0).prefix(3), hasToString("[0, 0, 0]"));
    assertThat(list.get(5).prefix(3), hasToString("[1, 2, 0]"));
    assertThat(Lists.newArrayList(Valuation.all(ImmutableList.of(7), 0)),
        hasSize(1));
    assertThrows(IllegalArgumentException.class,
        () -> Valuation.all(ImmutableList.<Integer>of(), 1));
  }
}

// End ValuationTest.java
