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

/** Syntax node for an integer literal. */
public final class IntegerLiteral extends Expression {

  private final long value;

  IntegerLiteral(Token token, long value) {
    super(token, Kind.INTEGER_LITERAL);
    this.value = value;
  }

  public static IntegerLiteral of(long value) {
    return new IntegerLiteral(Token.synthetic(TokenKind.INT, Long.toString(value), value), value);
  }

  public long getValue() {
    return value;
  }

  @Override
  public IntegerLiteral deepCopy() {
    return copyDecorationsTo(new IntegerLiteral(getToken(), value));
  }
}
