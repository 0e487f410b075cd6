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
 * Syntax node for a block of comments that stands on its own, separated from the next statement by
 * a blank line or the end of the file, such as a file heading.
 */
public final class CommentStatement extends Statement {

  private final Comment comment;

  CommentStatement(Comment comment) {
    super(comment.getToken());
    this.comment = comment;
  }

  public static CommentStatement of(Comment comment) {
    return new CommentStatement(comment);
  }

  public Comment getComment() {
    return comment;
  }

  @Override
  public Kind kind() {
    return Kind.COMMENT;
  }

  @Override
  public CommentStatement deepCopy() {
    return copyDecorationsTo(new CommentStatement(comment.deepCopy()));
  }
}
