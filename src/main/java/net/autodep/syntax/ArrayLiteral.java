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
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Syntax node for an array literal {@code [a, b, c]}. */
public final class ArrayLiteral extends Expression {

  private ExpressionList elements;

  ArrayLiteral(Token lbracket, ExpressionList elements) {
    super(lbracket, Kind.ARRAY_LITERAL);
    this.elements = elements;
  }

  /** Returns an array of the given elements, laid out as a new list. */
  public static ArrayLiteral of(List<? extends Expression> elements) {
    return new ArrayLiteral(
        Token.synthetic(TokenKind.LBRACKET, "[", null), ExpressionList.of(elements));
  }

  /** Returns an array of string literals. */
  public static ArrayLiteral ofStrings(List<String> values) {
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    for (String value : values) {
      elements.add(StringLiteral.of(value));
    }
    return of(elements.build());
  }

  public ExpressionList getElements() {
    return elements;
  }

  public void setElements(ExpressionList elements) {
    this.elements = Preconditions.checkNotNull(elements);
  }

  @Override
  public ArrayLiteral deepCopy() {
    return copyDecorationsTo(new ArrayLiteral(getToken(), elements.deepCopy()));
  }
}
