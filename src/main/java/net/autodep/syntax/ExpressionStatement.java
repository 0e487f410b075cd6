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

/** Syntax node for a statement consisting of an expression evaluated for effect: a rule. */
public final class ExpressionStatement extends Statement {

  private final Expression expression;

  ExpressionStatement(Token token, Expression expression) {
    super(token);
    this.expression = expression;
  }

  /** Returns a statement holding {@code expression}, which must not belong to another tree. */
  public static ExpressionStatement of(Expression expression) {
    return new ExpressionStatement(expression.getToken(), expression);
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  public Kind kind() {
    return Kind.EXPRESSION;
  }

  @Override
  public ExpressionStatement deepCopy() {
    return copyDecorationsTo(new ExpressionStatement(getToken(), expression.deepCopy()));
  }
}
