// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.autodep.syntax;

import com.google.common.base.Preconditions;

/** Syntax node for an identifier. */
public final class Identifier extends Expression {

  private final String name;

  Identifier(Token token, String name) {
    super(token, Kind.IDENTIFIER);
    this.name = name;
  }

  /** Returns an identifier with the given name. */
  public static Identifier of(String name) {
    return new Identifier(Token.synthetic(TokenKind.IDENTIFIER, name), name);
  }

  /** Returns an identifier naming the rule of a synthesized call, such as {@code filegroup}. */
  public static Identifier ruleName(String name) {
    Preconditions.checkArgument(!name.isEmpty(), "empty rule name");
    return new Identifier(Token.synthetic(TokenKind.RULE_NAME, name), name);
  }

  /**
   * Returns the name of the Identifier. If there were parse errors, misparsed regions may be
   * represented as an Identifier whose name is not a valid identifier.
   */
  public String getName() {
    return name;
  }

  @Override
  public Identifier deepCopy() {
    return copyDecorationsTo(new Identifier(getToken(), name));
  }
}
