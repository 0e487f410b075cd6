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
 * The comments attached to a statement or expression: an optional leading comment, printed on the
 * lines before the node, and an optional trailing comment, printed after the node's last line.
 * Both belong to the decorated node alone.
 */
public final class CommentMap {

  @Nullable private Comment leading;
  @Nullable private Comment trailing;

  @Nullable
  public Comment getLeading() {
    return leading;
  }

  public void setLeading(@Nullable Comment leading) {
    this.leading = leading;
  }

  @Nullable
  public Comment getTrailing() {
    return trailing;
  }

  public void setTrailing(@Nullable Comment trailing) {
    this.trailing = trailing;
  }

  public boolean isEmpty() {
    return leading == null && trailing == null;
  }

  CommentMap deepCopy() {
    CommentMap copy = new CommentMap();
    copy.leading = leading == null ? null : leading.deepCopy();
    copy.trailing = trailing == null ? null : trailing.deepCopy();
    return copy;
  }
}
