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

/**
 * Syntax node for a parenthesized sequence {@code (a, b)}. A single element without a trailing
 * comma, {@code (a)}, is a parenthesized expression rather than a tuple; it is kept as a node so
 * that the parentheses survive printing.
 */
public final class TupleLiteral extends Expression {

  private final ExpressionList elements;

  TupleLiteral(Token lparen, ExpressionList elements) {
    super(lparen, Kind.TUPLE_LITERAL);
    this.elements = elements;
  }

  public ExpressionList getElements() {
    return elements;
  }

  /** Reports whether this is a parenthesized expression rather than a tuple. */
  public boolean isParenthesizedExpression() {
    return elements.size() == 1 && !elements.hasTrailingComma();
  }

  @Override
  public TupleLiteral deepCopy() {
    return copyDecorationsTo(new TupleLiteral(getToken(), elements.deepCopy()));
  }
}
