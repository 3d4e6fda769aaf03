/*
 * Copyright 2025 The Leolang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.leolang.asg;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A function declaration, either top-level or belonging to a circuit. The signature is resolved
 * before any bodies, so calls may refer to functions declared later; {@link #setBody} is called
 * once the body has been resolved.
 */
public final class Function {

  /** How (and whether) a circuit function receives the instance it was called on. */
  public enum Receiver {
    /** A top-level function, or a static circuit function. */
    NONE,
    SELF,
    MUT_SELF,
    CONST_SELF
  }

  public final String name;
  public final Span span;
  public final @Nullable Circuit owner;
  public final Receiver receiver;

  /** Non-null iff {@link #receiver} is not {@link Receiver#NONE}. */
  public final @Nullable Variable self;

  public final ImmutableList<Variable> params;
  public final Type returnType;

  private Statement.Block body;

  public Function(
      String name,
      Span span,
      @Nullable Circuit owner,
      Receiver receiver,
      @Nullable Variable self,
      ImmutableList<Variable> params,
      Type returnType) {
    Preconditions.checkArgument((receiver == Receiver.NONE) == (self == null));
    this.name = name;
    this.span = span;
    this.owner = owner;
    this.receiver = receiver;
    this.self = self;
    this.params = params;
    this.returnType = returnType;
  }

  public void setBody(Statement.Block body) {
    Preconditions.checkState(this.body == null);
    this.body = body;
  }

  public Statement.Block body() {
    Preconditions.checkState(body != null, "Body of %s not yet resolved", this);
    return body;
  }

  /** True for circuit functions that can only be called as {@code Circuit::name(...)}. */
  public boolean isStatic() {
    return owner != null && receiver == Receiver.NONE;
  }

  @Override
  public String toString() {
    return (owner == null) ? name : owner.name + "::" + name;
  }
}
