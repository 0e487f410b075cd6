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

import javax.annotation.Nullable;

/**
 * Syntax node for a string literal. The literal's prefix letter, if any, is recorded by the kind
 * of its token ({@link TokenKind#RAW_STRING} and so on).
 */
public final class StringLiteral extends Expression {

  private final String value;

  StringLiteral(Token token, String value) {
    super(token, Kind.STRING_LITERAL);
    this.value = value;
  }

  /** Returns a double-quoted literal denoting the given string. */
  public static StringLiteral of(String value) {
    return new StringLiteral(Token.synthetic(TokenKind.STRING, quote(value), value), value);
  }

  /** Returns the value denoted by the string literal. */
  public String getValue() {
    return value;
  }

  /** Returns the literal's source text, including its quotes and prefix. */
  public String getSource() {
    return getTokenLiteral();
  }

  /** Returns the value of {@code e} if it is a string literal, or null. */
  @Nullable
  public static String valueOf(Expression e) {
    return e instanceof StringLiteral ? ((StringLiteral) e).getValue() : null;
  }

  /** Returns the double-quoted form of a string, escaping as a declaration file requires. */
  static String quote(String s) {
    StringBuilder buf = new StringBuilder(s.length() + 2);
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          buf.append("\\\"");
          break;
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\r':
          buf.append("\\r");
          break;
        case '\t':
          buf.append("\\t");
          break;
        default:
          buf.append(c);
      }
    }
    return buf.append('"').toString();
  }

  @Override
  public StringLiteral deepCopy() {
    return copyDecorationsTo(new StringLiteral(getToken(), value));
  }
}
