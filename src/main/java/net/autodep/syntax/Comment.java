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

/** Base class for comment nodes. */
public abstract class Comment extends Node {

  /**
   * Kind of the comment. This is similar to using instanceof, except that it's more efficient and
   * can be used in a switch/case.
   */
  public enum Kind {
    SINGLE_LINE,
    GROUP,
  }

  Comment(Token token) {
    super(token);
  }

  /** Kind of the comment. */
  public abstract Kind kind();

  /** Returns the text of each line of the comment, including the leading '#'. */
  public abstract ImmutableList<String> getLines();

  @Override
  public abstract Comment deepCopy();
}
