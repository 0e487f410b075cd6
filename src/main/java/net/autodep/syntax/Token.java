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
import javax.annotation.Nullable;

/**
 * An immutable lexical token: its kind, the exact source text it was scanned from, its decoded
 * value (for strings, integers, identifiers and comments), and the bracket nesting depth at which
 * it occurred.
 *
 * <p>Tokens made by the engine rather than the {@link Lexer} have no position in any file; their
 * offsets are -1.
 */
public final class Token {

  private final TokenKind kind;
  private final String literal;
  @Nullable private final Object value;
  private final int start;
  private final int end;
  private final int depth;

  Token(TokenKind kind, String literal, @Nullable Object value, int start, int end, int depth) {
    this.kind = Preconditions.checkNotNull(kind);
    this.literal = Preconditions.checkNotNull(literal);
    this.value = value;
    this.start = start;
    this.end = end;
    this.depth = depth;
  }

  /** Returns a token that did not come from source text. */
  public static Token synthetic(TokenKind kind, String literal, @Nullable Object value) {
    return new Token(kind, literal, value, -1, -1, 0);
  }

  /** Returns a synthetic token whose value is its literal. */
  public static Token synthetic(TokenKind kind, String literal) {
    return synthetic(kind, literal, literal);
  }

  public TokenKind getKind() {
    return kind;
  }

  /** Returns the source text of the token, exactly as written. */
  public String getLiteral() {
    return literal;
  }

  /**
   * Returns the decoded value: the unquoted content of a string, the Long value of an integer, the
   * name of an identifier, or the text of a comment. Null for punctuation.
   */
  @Nullable
  public Object getValue() {
    return value;
  }

  public int getStartOffset() {
    return start;
  }

  public int getEndOffset() {
    return end;
  }

  /** Returns the number of unclosed brackets enclosing this token. */
  public int getDepth() {
    return depth;
  }

  public boolean isSynthetic() {
    return start < 0;
  }

  @Override
  public String toString() {
    return value == null ? kind.name() : kind.name() + "(" + value + ")";
  }
}
