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
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for all expression nodes in the AST.
 *
 * <p>Keyword arguments and top-level assignments are both {@link InfixExpression}s with operator
 * {@code =}; the grammar does not distinguish them.
 */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    ARRAY_LITERAL,
    BOOLEAN_LITERAL,
    CALL,
    EXPRESSION_LIST,
    IDENTIFIER,
    INDEX,
    INFIX,
    INTEGER_LITERAL,
    KEY_VALUE,
    KEY_VALUE_LIST,
    MAP_LITERAL,
    PREFIX,
    STRING_LITERAL,
    TUPLE_LITERAL,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;

  private CommentMap comments = new CommentMap();
  private int blankLinesBefore;

  Expression(Token token, Kind kind) {
    super(token);
    this.kind = kind;
  }

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public final Kind kind() {
    return kind;
  }

  public final CommentMap getComments() {
    return comments;
  }

  /**
   * Returns the number of blank lines that precede this expression. Only meaningful for an element
   * of a multi-line collection.
   */
  public final int getBlankLinesBefore() {
    return blankLinesBefore;
  }

  public final void setBlankLinesBefore(int blankLinesBefore) {
    Preconditions.checkArgument(blankLinesBefore >= 0);
    this.blankLinesBefore = blankLinesBefore;
  }

  @Override
  public abstract Expression deepCopy();

  /** Copies the comments and layout of this expression onto {@code copy}, and returns it. */
  final <E extends Expression> E copyDecorationsTo(E copy) {
    ((Expression) copy).comments = comments.deepCopy();
    ((Expression) copy).blankLinesBefore = blankLinesBefore;
    return copy;
  }

  static <E extends Expression> List<E> deepCopyAll(List<E> expressions) {
    List<E> copies = new ArrayList<>(expressions.size());
    for (E e : expressions) {
      @SuppressWarnings("unchecked") // deepCopy of an E is an E
      E copy = (E) e.deepCopy();
      copies.add(copy);
    }
    return copies;
  }

  /** Parses a single expression, such as the value of a field. */
  public static Expression parse(ParserInput input) throws SyntaxError.Exception {
    return Parser.parseExpression(input);
  }
}
