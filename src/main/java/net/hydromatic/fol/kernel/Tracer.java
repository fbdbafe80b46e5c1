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

/** Called on various events in the kernel and the checkers built on it. */
public interface Tracer {
  /** Called when a primitive rule has produced a derivation. */
  void onRule(Derivation derivation);

  /** Called when a primitive rule rejects its arguments, just before the
   * exception is thrown. */
  void onRejected(KernelException e);

  /**
   * Called when a semantic check finds a derivation whose premises are
   * realized but whose conclusion is not. Returns whether a handler was
   * found; if not, the checker throws.
   */
  boolean onUnsound(Derivation derivation, String description);
}

// End Tracer.java
