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

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each derivation
   * produced by a primitive rule, then calls the underlying tracer. */
  public static Tracer withOnRule(Tracer tracer,
      Consumer<Derivation> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRule(Derivation derivation) {
        consumer.accept(derivation);
        super.onRule(derivation);
      }
    };
  }

  /** Returns a tracer that performs the given action on each rejected rule
   * application, then calls the underlying tracer. */
  public static Tracer withOnRejected(Tracer tracer,
      Consumer<KernelException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRejected(KernelException e) {
        consumer.accept(e);
        super.onRejected(e);
      }
    };
  }

  /** Returns a tracer that handles unsound derivations by performing the given
   * action, instead of letting the checker throw. */
  public static Tracer withOnUnsound(Tracer tracer,
      BiConsumer<Derivation, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onUnsound(Derivation derivation, String description) {
        consumer.accept(derivation, description);
        super.onUnsound(derivation, description);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onRule(Derivation derivation) {}

    @Override
    public void onRejected(KernelException e) {}

    @Override
    public boolean onUnsound(Derivation derivation, String description) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onRule(Derivation derivation) {
      tracer.onRule(derivation);
    }

    @Override
    public void onRejected(KernelException e) {
      tracer.onRejected(e);
    }

    @Override
    public boolean onUnsound(Derivation derivation, String description) {
      return tracer.onUnsound(derivation, description);
    }
  }
}

// End Tracers.java
