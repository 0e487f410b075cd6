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

/** Syntax node for {@code True} or {@code False}. */
public final class BooleanLiteral extends Expression {

  private final boolean value;

  BooleanLiteral(Token token, boolean value) {
    super(token, Kind.BOOLEAN_LITERAL);
    this.value = value;
  }

  public static BooleanLiteral of(boolean value) {
    return new BooleanLiteral(
        value
            ? Token.synthetic(TokenKind.TRUE, "True", null)
            : Token.synthetic(TokenKind.FALSE, "False", null),
        value);
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public BooleanLiteral deepCopy() {
    return copyDecorationsTo(new BooleanLiteral(getToken(), value));
  }
}
