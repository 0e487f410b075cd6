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

/** Syntax node for the entries of a map literal. */
public final class KeyValueExpressionList extends ElementList<KeyValueExpression> {

  KeyValueExpressionList(
      Token token, List<KeyValueExpression> entries, boolean multiline, boolean trailingComma) {
    super(token, Kind.KEY_VALUE_LIST, entries, multiline, trailingComma);
  }

  /** Returns a list of the given entries, laid out as a new list. */
  public static KeyValueExpressionList of(List<KeyValueExpression> entries) {
    KeyValueExpressionList list =
        new KeyValueExpressionList(
            Token.synthetic(TokenKind.COMMA, ",", null),
            ImmutableList.copyOf(entries),
            /* multiline= */ false,
            /* trailingComma= */ false);
    list.applyDefaultLayout();
    return list;
  }

  @Override
  public KeyValueExpressionList deepCopy() {
    return copyDecorationsTo(
        new KeyValueExpressionList(getToken(), copyElements(), isMultiline(), hasTrailingComma()));
  }
}
