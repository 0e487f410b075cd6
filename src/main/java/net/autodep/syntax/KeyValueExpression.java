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

/** Syntax node for an entry {@code key: value} of a map literal. */
public final class KeyValueExpression extends Expression {

  private final Expression key;
  private final Expression value;

  KeyValueExpression(Token colon, Expression key, Expression value) {
    super(colon, Kind.KEY_VALUE);
    this.key = key;
    this.value = value;
  }

  public static KeyValueExpression of(Expression key, Expression value) {
    return new KeyValueExpression(Token.synthetic(TokenKind.COLON, ":", null), key, value);
  }

  public Expression getKey() {
    return key;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public KeyValueExpression deepCopy() {
    return copyDecorationsTo(new KeyValueExpression(getToken(), key.deepCopy(), value.deepCopy()));
  }
}
