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

/** Syntax node for a unary operator expression: {@code -x}, {@code +x} or {@code not x}. */
public final class PrefixExpression extends Expression {

  private final TokenKind operator;
  private final Expression operand;

  PrefixExpression(Token op, Expression operand) {
    super(op, Kind.PREFIX);
    this.operator = op.getKind();
    this.operand = operand;
  }

  public TokenKind getOperator() {
    return operator;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public PrefixExpression deepCopy() {
    return copyDecorationsTo(new PrefixExpression(getToken(), operand.deepCopy()));
  }
}
