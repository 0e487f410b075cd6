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

import java.util.List;

/** Syntax node for a map literal {@code {k: v, ...}}. */
public final class MapLiteral extends Expression {

  private final KeyValueExpressionList entries;

  MapLiteral(Token lbrace, KeyValueExpressionList entries) {
    super(lbrace, Kind.MAP_LITERAL);
    this.entries = entries;
  }

  public static MapLiteral of(List<KeyValueExpression> entries) {
    return new MapLiteral(
        Token.synthetic(TokenKind.LBRACE, "{", null), KeyValueExpressionList.of(entries));
  }

  public KeyValueExpressionList getEntries() {
    return entries;
  }

  @Override
  public MapLiteral deepCopy() {
    return copyDecorationsTo(new MapLiteral(getToken(), entries.deepCopy()));
  }
}
