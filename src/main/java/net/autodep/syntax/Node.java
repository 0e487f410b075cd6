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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A Node is a node in the syntax tree of a declaration file. Every node is one of four categories
 * ({@link BuildFile}, {@link Statement}, {@link Expression}, {@link Comment}), each of which has a
 * closed set of kinds.
 *
 * <p>Nodes are mutable so that rewrites can edit a tree in place, but a tree is a tree: a node is
 * owned by exactly one parent. Code that moves a subtree into another tree must {@link #deepCopy}
 * it first.
 */
public abstract class Node {

  private final Token token;

  Node(Token token) {
    this.token = Preconditions.checkNotNull(token);
  }

  /** Returns the token this node was made from. */
  public final Token getToken() {
    return token;
  }

  /** Returns the source text of this node's token. */
  public final String getTokenLiteral() {
    return token.getLiteral();
  }

  /** Returns a copy of this subtree that shares no mutable state with it. */
  public abstract Node deepCopy();

  /**
   * Renders this node as lines of text. The first line holds no indentation, since it continues
   * whatever line the node starts on; every later line carries the indentation for its depth,
   * counted from {@code depth}, the depth of the line on which the node starts.
   */
  public final ImmutableList<String> toLines(int depth) {
    return NodePrinter.render(this, depth);
  }

  /** Returns the source form of this node. */
  @Override
  public String toString() {
    return Joiner.on('\n').join(toLines(0));
  }
}
