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

/** Syntax node for an index expression {@code object[key]}. */
public final class IndexExpression extends Expression {

  private final Expression object;
  private final Expression key;

  IndexExpression(Token lbracket, Expression object, Expression key) {
    super(lbracket, Kind.INDEX);
    this.object = object;
    this.key = key;
  }

  public Expression getObject() {
    return object;
  }

  public Expression getKey() {
    return key;
  }

  @Override
  public IndexExpression deepCopy() {
    return copyDecorationsTo(new IndexExpression(getToken(), object.deepCopy(), key.deepCopy()));
  }
}
