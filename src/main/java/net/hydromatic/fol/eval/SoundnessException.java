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

import static java.util.Objects.requireNonNull;

import net.hydromatic.fol.kernel.Derivation;

/** A derivation was found whose premises are realized but whose conclusion
 * is not. */
public class SoundnessException extends RuntimeException {
  public final Derivation derivation;

  public SoundnessException(Derivation derivation, String message) {
    super(message);
    this.derivation = requireNonNull(derivation);
  }

  @Override
  public String getMessage() {
    return super.getMessage() + " in " + derivation;
  }
}

// End SoundnessException.java
