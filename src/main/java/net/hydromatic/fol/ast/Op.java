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

/** Sub-types of {@link Term}, {@link Formula} and their bounded variants. */
public enum Op {
  // terms
  VAR(""),
  FUNC(""),
  APP(""),

  // formulas
  FALSUM("⊥"),
  EQUAL(" ≃ "),
  REL(""),
  APP_REL(""),
  IMP(" ⟹ "),
  ALL("∀");

  /** Symbol used when printing, for operators that have one. */
  public final String str;

  Op(String str) {
    this.str = str;
  }
}

// End Op.java
