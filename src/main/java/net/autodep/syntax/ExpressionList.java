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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Syntax node for the arguments of a call, or the elements of an array or tuple literal. */
public final class ExpressionList extends ElementList<Expression> {

  ExpressionList(Token token, List<Expression> elements, boolean multiline, boolean trailingComma) {
    super(token, Kind.EXPRESSION_LIST, elements, multiline, trailingComma);
  }

  /** Returns a list of the given elements, laid out as a new list. */
  public static ExpressionList of(List<? extends Expression> elements) {
    ExpressionList list =
        new ExpressionList(
            Token.synthetic(TokenKind.COMMA, ",", null),
            ImmutableList.<Expression>copyOf(elements),
            /* multiline= */ false,
            /* trailingComma= */ false);
    list.applyDefaultLayout();
    return list;
  }

  /** Returns a list of the given elements, one per line. */
  public static ExpressionList multiline(List<? extends Expression> elements) {
    return new ExpressionList(
        Token.synthetic(TokenKind.COMMA, ",", null),
        ImmutableList.<Expression>copyOf(elements),
        /* multiline= */ !elements.isEmpty(),
        /* trailingComma= */ !elements.isEmpty());
  }

  @Override
  public ExpressionList deepCopy() {
    return copyDecorationsTo(
        new ExpressionList(getToken(), copyElements(), isMultiline(), hasTrailingComma()));
  }
}
