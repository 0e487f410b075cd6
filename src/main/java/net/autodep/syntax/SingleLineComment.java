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

/** Syntax node for a comment occupying the rest of one line. */
public final class SingleLineComment extends Comment {

  SingleLineComment(Token token) {
    super(token);
    Preconditions.checkArgument(token.getKind() == TokenKind.COMMENT);
  }

  /** Returns a comment with the given text, which must start with '#'. */
  public static SingleLineComment of(String text) {
    Preconditions.checkArgument(text.startsWith("#"), "not a comment: %s", text);
    Preconditions.checkArgument(text.indexOf('\n') < 0, "multi-line comment: %s", text);
    return new SingleLineComment(Token.synthetic(TokenKind.COMMENT, text));
  }

  /** Returns the text of the comment, including the leading '#' but not the trailing newline. */
  public String getText() {
    return getTokenLiteral();
  }

  @Override
  public ImmutableList<String> getLines() {
    return ImmutableList.of(getText());
  }

  @Override
  public Kind kind() {
    return Kind.SINGLE_LINE;
  }

  @Override
  public SingleLineComment deepCopy() {
    // Tokens are immutable.
    return new SingleLineComment(getToken());
  }
}
