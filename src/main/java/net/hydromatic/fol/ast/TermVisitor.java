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

/**
 * Visitor over {@link Term} objects.
 *
 * <p>Unlike {@link Term#fold(Term.Folder)}, a visitor sees every node,
 * including each {@link Term.App} layer.
 *
 * @param <R> return type from {@code visit} methods
 * @see Term#accept(TermVisitor)
 */
public class TermVisitor<R> {
  /** Visits a {@link Term.Var}. */
  public R visit(Term.Var var) {
    return null;
  }

  /** Visits a {@link Term.Func}. */
  public R visit(Term.Func func) {
    return null;
  }

  /** Visits a {@link Term.App}. */
  public R visit(Term.App app) {
    app.fn.accept(this);
    return app.arg.accept(this);
  }
}

// End TermVisitor.java
