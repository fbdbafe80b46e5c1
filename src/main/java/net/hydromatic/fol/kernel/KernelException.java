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

/** A rule of the kernel was applied to derivations or formulas of the wrong
 * shape. No derivation is produced. */
public class KernelException extends RuntimeException {
  public final Rule rule;

  public KernelException(Rule rule, String message) {
    super(message);
    this.rule = requireNonNull(rule);
  }

  @Override
  public String getMessage() {
    return rule.camelName + ": " + super.getMessage();
  }
}

// End KernelException.java
