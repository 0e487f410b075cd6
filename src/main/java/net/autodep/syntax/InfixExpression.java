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

/**
 * Syntax node for a binary operator expression {@code x op y}. This includes keyword arguments and
 * assignments ({@code name = "x"}) and attribute selection ({@code native.glob}).
 */
public final class InfixExpression extends Expression {

  private final Expression left;
  private final TokenKind operator;
  private final Expression right;
  private final boolean spaced;

  InfixExpression(Token op, Expression left, Expression right, boolean spaced) {
    super(op, Kind.INFIX);
    this.left = left;
    this.operator = op.getKind();
    this.right = right;
    this.spaced = spaced;
  }

  /** Returns a keyword argument {@code name = value}. */
  public static InfixExpression keywordArgument(String name, Expression value) {
    return new InfixExpression(
        Token.synthetic(TokenKind.EQUALS, "=", null), Identifier.of(name), value, true);
  }

  public Expression getLeft() {
    return left;
  }

  public TokenKind getOperator() {
    return operator;
  }

  public Expression getRight() {
    return right;
  }

  /** Reports whether the operator is surrounded by spaces in the source. */
  public boolean isSpaced() {
    return spaced;
  }

  /** Reports whether this is {@code identifier = value}. */
  public boolean isKeywordArgument() {
    return operator == TokenKind.EQUALS && left instanceof Identifier;
  }

  /** Returns the name of a keyword argument. */
  public String getKeywordName() {
    Preconditions.checkState(isKeywordArgument(), "not a keyword argument: %s", this);
    return ((Identifier) left).getName();
  }

  @Override
  public InfixExpression deepCopy() {
    return copyDecorationsTo(
        new InfixExpression(getToken(), left.deepCopy(), right.deepCopy(), spaced));
  }
}
