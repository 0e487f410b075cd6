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

/**
 * Syntax node for a run of comment lines with nothing but line breaks between them. The group is
 * attached, moved and replaced as a unit; its token is the token of its first line.
 */
public final class CommentGroup extends Comment {

  private final ImmutableList<SingleLineComment> comments;

  CommentGroup(List<SingleLineComment> comments) {
    super(comments.get(0).getToken());
    this.comments = ImmutableList.copyOf(comments);
  }

  /** Returns a group of the given comments, which must not be empty. */
  public static CommentGroup of(List<SingleLineComment> comments) {
    Preconditions.checkArgument(!comments.isEmpty(), "empty comment group");
    return new CommentGroup(comments);
  }

  /** Returns a group with one comment per given line of text. */
  public static CommentGroup ofLines(List<String> lines) {
    ImmutableList.Builder<SingleLineComment> comments = ImmutableList.builder();
    for (String line : lines) {
      comments.add(SingleLineComment.of(line));
    }
    return of(comments.build());
  }

  public ImmutableList<SingleLineComment> getComments() {
    return comments;
  }

  @Override
  public ImmutableList<String> getLines() {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (SingleLineComment comment : comments) {
      lines.add(comment.getText());
    }
    return lines.build();
  }

  @Override
  public Kind kind() {
    return Kind.GROUP;
  }

  @Override
  public CommentGroup deepCopy() {
    ImmutableList.Builder<SingleLineComment> copies = ImmutableList.builder();
    for (SingleLineComment comment : comments) {
      copies.add(comment.deepCopy());
    }
    return new CommentGroup(copies.build());
  }
}
