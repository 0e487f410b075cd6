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

/** Base class for all statements nodes in the AST. */
public abstract class Statement extends Node {

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    COMMENT,
    EXPRESSION,
  }

  private CommentMap comments = new CommentMap();
  private int blankLinesBefore;

  Statement(Token token) {
    super(token);
  }

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public abstract Kind kind();

  public final CommentMap getComments() {
    return comments;
  }

  /** Returns the number of blank lines between this statement and the previous line of text. */
  public final int getBlankLinesBefore() {
    return blankLinesBefore;
  }

  public final void setBlankLinesBefore(int blankLinesBefore) {
    Preconditions.checkArgument(blankLinesBefore >= 0);
    this.blankLinesBefore = blankLinesBefore;
  }

  @Override
  public abstract Statement deepCopy();

  final <S extends Statement> S copyDecorationsTo(S copy) {
    ((Statement) copy).comments = comments.deepCopy();
    ((Statement) copy).blankLinesBefore = blankLinesBefore;
    return copy;
  }
}
